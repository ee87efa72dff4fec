package io.github.yok.dedalo.core.session;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.dedalo.core.calibration.CalibrationCurve;
import io.github.yok.dedalo.core.psd.IncrementalStatistics;
import io.github.yok.dedalo.core.psd.PsdSample;
import io.github.yok.dedalo.core.psd.SessionStatistics;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import lombok.Getter;

/**
 * 1 回の計測（Run）に固有の状態です。
 *
 * <p>
 * 補正テーブルは {@link AtomicReference} で丸ごと差し替えます。 サンプル・統計・警告は計測スレッドと参照スレッドの両方から
 * 使用されるため、このインスタンスのロックで保護します。 計測ごとに新しいインスタンスを作り、計測間で共有しません。
 * </p>
 */
public final class SessionState {

    /**
     * 校正曲線です。
     */
    @Getter
    private final CalibrationCurve calibration;

    private final AtomicReference<CompensationTables> tables;

    private final IncrementalStatistics statistics;

    private final List<PsdSample> samples = new ArrayList<>();

    private final Set<InstrumentAlarm> alarms = EnumSet.noneOf(InstrumentAlarm.class);

    private SessionStatistics finalStatistics;

    /**
     * 状態を生成します。
     *
     * @param calibration 校正曲線です
     * @param tables 初期の補正テーブルです
     * @param statistics 逐次統計です
     */
    public SessionState(CalibrationCurve calibration, CompensationTables tables,
            IncrementalStatistics statistics) {
        this.calibration = Preconditions.checkNotNull(calibration, "calibration が null です。");
        this.tables = new AtomicReference<>(
                Preconditions.checkNotNull(tables, "tables が null です。"));
        this.statistics = Preconditions.checkNotNull(statistics, "statistics が null です。");
    }

    /**
     * 現在の補正テーブルを返します。
     *
     * @return 補正テーブルです
     */
    public CompensationTables activeTables() {
        return tables.get();
    }

    /**
     * 補正テーブルを差し替えます。
     *
     * @param next 新しい補正テーブルです
     * @return 差し替え前の補正テーブルです
     */
    public CompensationTables swapTables(CompensationTables next) {
        return tables.getAndSet(Preconditions.checkNotNull(next, "next が null です。"));
    }

    /**
     * サンプルを記録し、統計と警告を更新します。統計が受け付けないサンプルの場合は何も記録しません。
     *
     * @param sample サンプルです
     * @throws IllegalStateException 計測が終了している場合に発生します
     * @throws IllegalArgumentException 計数合計が統計の上限以上の場合に発生します
     */
    public synchronized void record(PsdSample sample) {
        if (finalStatistics != null) {
            throw new IllegalStateException("終了した計測にサンプルは追加できません");
        }
        statistics.add(sample);
        samples.add(sample);
        alarms.addAll(sample.getAlarms());
    }

    /**
     * 警告・異常を追加します（シリアル異常など、サンプルを伴わないもの）。
     *
     * @param alarm 警告・異常です
     */
    public synchronized void raise(InstrumentAlarm alarm) {
        alarms.add(alarm);
    }

    public synchronized List<PsdSample> samples() {
        return ImmutableList.copyOf(samples);
    }

    public synchronized int sampleCount() {
        return samples.size();
    }

    public synchronized Set<InstrumentAlarm> alarms() {
        return alarms.isEmpty() ? Collections.emptySet() : EnumSet.copyOf(alarms);
    }

    /**
     * 現在の統計を返します。終了後は確定した統計を返します。
     *
     * @return 統計です
     */
    public synchronized SessionStatistics statistics() {
        return finalStatistics != null ? finalStatistics : statistics.snapshot();
    }

    public synchronized boolean isFinished() {
        return finalStatistics != null;
    }

    /**
     * 統計を確定します。2 回目以降は確定済みの統計を返します。
     *
     * @return 確定した統計です
     */
    public synchronized SessionStatistics finish() {
        if (finalStatistics == null) {
            finalStatistics = statistics.snapshot();
        }
        return finalStatistics;
    }
}
