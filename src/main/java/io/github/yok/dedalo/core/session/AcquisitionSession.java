package io.github.yok.dedalo.core.session;

import com.google.common.base.Preconditions;
import io.github.yok.dedalo.core.exception.InstrumentFaultException;
import io.github.yok.dedalo.core.exception.InvalidFlowRateException;
import io.github.yok.dedalo.core.frame.ChannelFrame;
import io.github.yok.dedalo.core.frame.CumulativeCountConverter;
import io.github.yok.dedalo.core.frame.FrameRecorder;
import io.github.yok.dedalo.core.lut.DiameterGrid;
import io.github.yok.dedalo.core.lut.LookupTableCache;
import io.github.yok.dedalo.core.mie.RefractiveIndex;
import io.github.yok.dedalo.core.psd.ChannelCorrection;
import io.github.yok.dedalo.core.psd.FrameAggregator;
import io.github.yok.dedalo.core.psd.PsdSample;
import io.github.yok.dedalo.core.psd.SessionStatistics;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 1 回の計測で、フレームを集計して {@link SessionState} に記録するクラスです。
 *
 * <p>
 * {@link #process(ChannelFrame)} は計測スレッドから呼び出します。 {@link #selectRefractiveIndex(RefractiveIndex)}
 * は任意のスレッドから呼び出せ、新しい LUT の構築中も以前の補正テーブルで集計を続けます。
 * </p>
 */
@Slf4j
public final class AcquisitionSession {

    @Getter
    private final SessionState state;

    private final FrameAggregator aggregator;

    private final LookupTableCache cache;

    /**
     * LUT の計算格子です。
     */
    private final DiameterGrid lutGrid;

    private final FrameRecorder recorder;

    /**
     * 累積計数の変換器です（累積計数でない場合は null）。
     */
    private final CumulativeCountConverter converter;

    /**
     * 1 周期の計測時間 [s] です。
     */
    private final double cycleSeconds;

    private double elapsedSeconds;

    /**
     * 屈折率の変更要求の世代です。最新の要求の LUT だけを差し替えます。
     */
    private long selection;

    private final Object selectionLock = new Object();

    /**
     * セッションを生成します。通常は {@link AcquisitionSessionFactory} から生成します。
     *
     * @param state 計測状態です
     * @param aggregator フレーム集計ロジックです
     * @param cache LUT キャッシュです
     * @param lutGrid LUT の計算格子です
     * @param recorder 生フレームの記録先です
     * @param converter 累積計数の変換器です（null 可）
     * @param cycleSeconds 1 周期の計測時間 [s] です
     */
    public AcquisitionSession(SessionState state, FrameAggregator aggregator,
            LookupTableCache cache, DiameterGrid lutGrid, FrameRecorder recorder,
            CumulativeCountConverter converter, double cycleSeconds) {
        Preconditions.checkArgument(cycleSeconds > 0.0, "周期は正である必要があります。cycle=%s",
                cycleSeconds);
        this.state = Preconditions.checkNotNull(state);
        this.aggregator = Preconditions.checkNotNull(aggregator);
        this.cache = Preconditions.checkNotNull(cache);
        this.lutGrid = Preconditions.checkNotNull(lutGrid);
        this.recorder = Preconditions.checkNotNull(recorder);
        this.converter = converter;
        this.cycleSeconds = cycleSeconds;
    }

    /**
     * フレームを集計して記録します。
     *
     * <p>
     * 電圧異常のフレームも集計・記録したうえで {@link InstrumentFaultException} を送出します。
     * </p>
     *
     * @param frame フレームです
     * @return 集計したサンプルです
     * @throws InvalidFlowRateException 流量が正でない場合に発生します（状態は変更しません）
     * @throws InstrumentFaultException 電圧異常を検出した場合に発生します
     * @throws IllegalStateException セッションが終了している場合に発生します
     * @throws IllegalArgumentException 計数合計が統計の上限以上の場合に発生します（統計とサンプルは変更しません）
     */
    public PsdSample process(ChannelFrame frame) {
        Preconditions.checkNotNull(frame, "frame が null です。");
        if (!(frame.getFlowRate() > 0.0)) {
            throw new InvalidFlowRateException(frame.getFlowRate());
        }
        if (state.isFinished()) {
            throw new IllegalStateException("終了したセッションでフレームは処理できません");
        }

        recorder.record(frame);
        ChannelFrame counts = converter != null ? converter.convert(frame) : frame;

        CompensationTables tables = state.activeTables();
        double elapsed = elapsedSeconds + cycleSeconds;
        PsdSample sample =
                aggregator.aggregate(counts, tables.getCorrection(), cycleSeconds, elapsed);
        state.record(sample);
        elapsedSeconds = elapsed;

        if (sample.isFaulty()) {
            Set<InstrumentAlarm> faults = EnumSet.noneOf(InstrumentAlarm.class);
            sample.getAlarms().stream().filter(InstrumentAlarm::isFault).forEach(faults::add);
            throw new InstrumentFaultException("装置異常を検出しました: frame=" + frame.getIndex()
                    + ", faults=" + faults + ", laser=" + frame.getLaserVoltageMv()
                    + " mV, buffer=" + frame.getBufferVoltageMv() + " mV", faults, sample);
        }
        return sample;
    }

    /**
     * 測定対象の屈折率を変更します。
     *
     * <p>
     * LUT は非同期に構築し、完成した時点で補正テーブルを丸ごと差し替えます。 構築中に別の屈折率が選ばれた場合、
     * 古い要求の LUT は完成しても差し替えず、Future はその時点の補正テーブルで完了します。
     * </p>
     *
     * @param index 新しい屈折率です
     * @return 差し替え後に有効な補正テーブルの Future です
     */
    public CompletableFuture<CompensationTables> selectRefractiveIndex(RefractiveIndex index) {
        Preconditions.checkNotNull(index, "index が null です。");
        long ticket;
        synchronized (selectionLock) {
            ticket = ++selection;
        }
        log.info("屈折率を変更します。n={}、k={}", index.getReal(), index.getImaginary());
        return cache.getAsync(lutGrid, index).thenApply(target -> {
            CompensationTables current = state.activeTables();
            ChannelCorrection correction = aggregator.getCompensator().compensate(
                    aggregator.getChannels(), state.getCalibration(), current.getReferenceLut(),
                    target);
            CompensationTables next = new CompensationTables(index, current.getReferenceLut(),
                    target, correction);
            synchronized (selectionLock) {
                if (ticket != selection) {
                    log.info("より新しい屈折率が選ばれているため差し替えません。n={}、k={}", index.getReal(),
                            index.getImaginary());
                    return state.activeTables();
                }
                state.swapTables(next);
            }
            log.info("補正テーブルを差し替えました。n={}、k={}", index.getReal(), index.getImaginary());
            return next;
        });
    }

    /**
     * 記録済みのサンプルを返します。
     *
     * @return サンプルです
     */
    public List<PsdSample> samples() {
        return state.samples();
    }

    /**
     * 現在の統計を返します。
     *
     * @return 統計です
     */
    public SessionStatistics statistics() {
        return state.statistics();
    }

    /**
     * 統計を確定し、生フレームの記録先を閉じます。2 回目以降の呼び出しは確定済みの統計を返すだけです。
     *
     * @return 確定した統計です
     */
    public synchronized SessionStatistics finish() {
        boolean first = !state.isFinished();
        SessionStatistics statistics = state.finish();
        if (first) {
            recorder.close();
            log.info("計測を終了しました。サンプル数={}、計数合計={}", statistics.getSampleCount(),
                    statistics.getTotalCount());
        }
        return statistics;
    }
}
