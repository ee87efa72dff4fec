package io.github.yok.dedalo.core.psd;

import com.google.common.base.Preconditions;
import io.github.yok.dedalo.core.calibration.CalibrationCurve;
import io.github.yok.dedalo.core.frame.ChannelFrame;
import io.github.yok.dedalo.core.lut.DiameterGrid;
import io.github.yok.dedalo.core.lut.MieLookupTable;
import io.github.yok.dedalo.core.session.CoincidenceMonitor;
import io.github.yok.dedalo.core.session.InstrumentAlarm;
import io.github.yok.dedalo.core.session.VoltageMonitor;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 1 フレームのチャネル別計数から {@link PsdSample} を作るクラスです。
 *
 * <p>
 * 計数はチャネル間で再配分せず、そのまま引き継ぎます（補正されるのは径ラベルだけです）。 電圧・計数の警告・異常はサンプルに記録しますが、例外は送出しません。
 * </p>
 */
@Slf4j
@Getter
@RequiredArgsConstructor
public final class FrameAggregator {

    /**
     * チャネル中心径（公称径）です。
     */
    private final DiameterGrid channels;

    /**
     * チャネル補正の計算ロジックです。
     */
    private final RefractiveIndexCompensator compensator;

    /**
     * 濃度換算ロジックです。
     */
    private final ConcentrationNormalizer normalizer;

    /**
     * 要約統計の計算ロジックです。
     */
    private final DistributionStatisticsCalculator statisticsCalculator;

    /**
     * 電圧の監視ロジックです。
     */
    private final VoltageMonitor voltageMonitor;

    /**
     * 同時通過（高濃度）の監視ロジックです。
     */
    private final CoincidenceMonitor coincidenceMonitor;

    /**
     * 1 周期の計測時間 [s] です。
     */
    private final double cycleSeconds;

    /**
     * 直前に計算したチャネル補正です。
     */
    @Getter(AccessLevel.NONE)
    private final AtomicReference<CachedCorrection> lastCorrection = new AtomicReference<>();

    /**
     * LUT と校正曲線からチャネル補正を計算して、フレームを集計します。
     *
     * <p>
     * 直前と同じ LUT・校正曲線の組み合わせでは、前回計算したチャネル補正を再利用します。
     * </p>
     *
     * @param frame フレームです
     * @param referenceLut 基準屈折率の LUT です
     * @param targetLut 測定対象の屈折率の LUT です
     * @param calibration 校正曲線です
     * @return サンプルです
     */
    public PsdSample aggregate(ChannelFrame frame, MieLookupTable referenceLut,
            MieLookupTable targetLut, CalibrationCurve calibration) {
        ChannelCorrection correction = correctionFor(referenceLut, targetLut, calibration);
        return aggregate(frame, correction, cycleSeconds, (frame.getIndex() + 1) * cycleSeconds);
    }

    private ChannelCorrection correctionFor(MieLookupTable referenceLut, MieLookupTable targetLut,
            CalibrationCurve calibration) {
        CachedCorrection cached = lastCorrection.get();
        if (cached != null && cached.referenceLut == referenceLut && cached.targetLut == targetLut
                && cached.calibration == calibration) {
            return cached.correction;
        }
        ChannelCorrection correction =
                compensator.compensate(channels, calibration, referenceLut, targetLut);
        lastCorrection.set(new CachedCorrection(referenceLut, targetLut, calibration, correction));
        return correction;
    }

    /**
     * 計算済みのチャネル補正でフレームを集計します。
     *
     * @param frame フレームです
     * @param correction チャネル補正です
     * @param acquisitionSeconds 濃度換算に使う計測時間 [s] です
     * @param elapsedSeconds 計測開始からの経過時間 [s] です
     * @return サンプルです
     * @throws io.github.yok.dedalo.core.exception.InvalidFlowRateException フレームの流量が正でない場合に発生します
     * @throws IllegalArgumentException チャネル数が一致しない場合に発生します
     */
    public PsdSample aggregate(ChannelFrame frame, ChannelCorrection correction,
            double acquisitionSeconds, double elapsedSeconds) {
        Preconditions.checkNotNull(frame, "frame が null です。");
        Preconditions.checkNotNull(correction, "correction が null です。");
        Preconditions.checkArgument(frame.channelCount() == correction.size(),
                "フレームのチャネル数が補正と一致しません。frame=%s, correction=%s", frame.channelCount(),
                correction.size());

        int[] raw = frame.getCounts();
        long[] counts = new long[raw.length];
        for (int i = 0; i < raw.length; i++) {
            counts[i] = raw[i];
        }
        double[] concentrations =
                normalizer.concentration(counts, frame.getFlowRate(), acquisitionSeconds);

        Set<InstrumentAlarm> alarms = voltageMonitor.evaluate(frame);
        if (coincidenceMonitor.exceeds(frame.totalCount(), frame.getFlowRate(),
                acquisitionSeconds)) {
            alarms.add(InstrumentAlarm.COINCIDENCE);
        }
        if (!alarms.isEmpty()) {
            log.warn("フレーム {} で警告・異常を検出しました。alarms={}、レーザー={} mV、バッファ={} mV、計数={}",
                    frame.getIndex(), alarms, frame.getLaserVoltageMv(),
                    frame.getBufferVoltageMv(), frame.totalCount());
        }

        DistributionStatistics statistics =
                statisticsCalculator.calculate(correction.getCorrected(), counts);
        return new PsdSample(frame.getIndex(), frame.getTimestamp(), elapsedSeconds,
                acquisitionSeconds, 1, correction, counts, concentrations,
                frame.getLaserVoltageMv(), frame.getBufferVoltageMv(), frame.getFlowRate(),
                statistics, alarms);
    }

    @RequiredArgsConstructor
    private static final class CachedCorrection {

        private final MieLookupTable referenceLut;

        private final MieLookupTable targetLut;

        private final CalibrationCurve calibration;

        private final ChannelCorrection correction;
    }
}
