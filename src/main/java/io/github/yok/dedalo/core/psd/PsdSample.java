package io.github.yok.dedalo.core.psd;

import com.google.common.base.Preconditions;
import io.github.yok.dedalo.core.session.InstrumentAlarm;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * 1 つ以上のフレームから得た粒子径分布（PSD）です。
 *
 * <p>
 * 不変クラスです。配列の取得時はコピーを返します。
 * </p>
 */
@Getter
public final class PsdSample {

    /**
     * サンプル番号（最初に集計したフレームの番号）です。
     */
    private final int index;

    /**
     * 最後に集計したフレームの読み出し時刻です。
     */
    private final Instant timestamp;

    /**
     * 計測開始からこのサンプルの終わりまでの経過時間 [s] です。
     */
    private final double elapsedSeconds;

    /**
     * 濃度換算に使用した計測時間 [s] です。
     */
    private final double acquisitionSeconds;

    /**
     * 集計したフレーム数です。
     */
    private final int frameCount;

    /**
     * チャネル補正です。
     */
    private final ChannelCorrection correction;

    /**
     * 計数合計です。
     */
    private final long totalCount;

    /**
     * 個数濃度の合計 [個/mL] です。
     */
    private final double totalConcentration;

    /**
     * レーザーダイオード電圧の平均 [mV] です。
     */
    private final double laserVoltageMv;

    /**
     * RAM バッファ電圧の平均 [mV] です。
     */
    private final double bufferVoltageMv;

    /**
     * 流量（計測時間による加重平均）[mL/min] です。
     */
    private final double flowRate;

    /**
     * 要約統計です。
     */
    private final DistributionStatistics statistics;

    /**
     * 発生した警告・異常です。
     */
    private final Set<InstrumentAlarm> alarms;

    @Getter(AccessLevel.NONE)
    private final long[] counts;

    @Getter(AccessLevel.NONE)
    private final double[] concentrations;

    /**
     * サンプルを生成します。
     *
     * @param index サンプル番号です
     * @param timestamp 読み出し時刻です
     * @param elapsedSeconds 経過時間 [s] です
     * @param acquisitionSeconds 計測時間 [s] です
     * @param frameCount フレーム数です
     * @param correction チャネル補正です
     * @param counts チャネル別計数です
     * @param concentrations チャネル別個数濃度 [個/mL] です
     * @param laserVoltageMv レーザーダイオード電圧 [mV] です
     * @param bufferVoltageMv RAM バッファ電圧 [mV] です
     * @param flowRate 流量 [mL/min] です
     * @param statistics 要約統計です
     * @param alarms 警告・異常です
     * @throws IllegalArgumentException 配列長がチャネル数と一致しない場合に発生します
     */
    public PsdSample(int index, Instant timestamp, double elapsedSeconds,
            double acquisitionSeconds, int frameCount, ChannelCorrection correction,
            long[] counts, double[] concentrations, double laserVoltageMv,
            double bufferVoltageMv, double flowRate, DistributionStatistics statistics,
            Set<InstrumentAlarm> alarms) {
        Preconditions.checkNotNull(correction, "correction が null です。");
        Preconditions.checkArgument(
                counts.length == correction.size() && concentrations.length == correction.size(),
                "計数・濃度の長さがチャネル数と一致しません。channels=%s", correction.size());
        this.index = index;
        this.timestamp = timestamp;
        this.elapsedSeconds = elapsedSeconds;
        this.acquisitionSeconds = acquisitionSeconds;
        this.frameCount = frameCount;
        this.correction = correction;
        this.counts = counts.clone();
        this.concentrations = concentrations.clone();
        long total = 0;
        double totalConc = 0.0;
        for (int i = 0; i < counts.length; i++) {
            total += counts[i];
            totalConc += concentrations[i];
        }
        this.totalCount = total;
        this.totalConcentration = totalConc;
        this.laserVoltageMv = laserVoltageMv;
        this.bufferVoltageMv = bufferVoltageMv;
        this.flowRate = flowRate;
        this.statistics = statistics;
        this.alarms = alarms.isEmpty() ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(alarms));
    }

    public long[] getCounts() {
        return counts.clone();
    }

    public double[] getConcentrations() {
        return concentrations.clone();
    }

    public long getCount(int channel) {
        return counts[channel];
    }

    public double getConcentration(int channel) {
        return concentrations[channel];
    }

    public int channelCount() {
        return counts.length;
    }

    /**
     * 異常（計測を中断すべきもの）を含むかどうかを返します。
     *
     * @return 異常を含む場合は true です
     */
    public boolean isFaulty() {
        return alarms.stream().anyMatch(InstrumentAlarm::isFault);
    }

    public boolean hasAlarm(InstrumentAlarm alarm) {
        return alarms.contains(alarm);
    }
}
