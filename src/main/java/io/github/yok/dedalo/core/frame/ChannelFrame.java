package io.github.yok.dedalo.core.frame;

import com.google.common.base.Preconditions;
import java.time.Instant;
import java.util.Arrays;
import lombok.Value;

/**
 * 装置から 1 周期ごとに読み出すチャネル別計数と装置状態です。
 *
 * <p>
 * 不変クラスです。計数配列は生成時と取得時にコピーします。
 * </p>
 */
@Value
public class ChannelFrame {

    /**
     * フレーム番号（0 始まり）です。
     */
    int index;

    /**
     * 読み出し時刻です。
     */
    Instant timestamp;

    /**
     * 読み出しに要した時間 [s] です（I/O 診断用）。
     */
    double durationSeconds;

    /**
     * レーザーダイオード電圧 [mV] です。
     */
    double laserVoltageMv;

    /**
     * RAM バッファ電圧 [mV] です。
     */
    double bufferVoltageMv;

    /**
     * 試料の流量 [mL/min] です。
     */
    double flowRate;

    /**
     * チャネル別計数です。
     */
    int[] counts;

    /**
     * フレームを生成します。
     *
     * @param index フレーム番号です
     * @param timestamp 読み出し時刻です
     * @param durationSeconds 読み出し時間 [s] です
     * @param laserVoltageMv レーザーダイオード電圧 [mV] です
     * @param bufferVoltageMv RAM バッファ電圧 [mV] です
     * @param flowRate 流量 [mL/min] です
     * @param counts チャネル別計数です（コピーして保持します）
     * @throws NullPointerException timestamp または counts が null の場合に発生します
     * @throws IllegalArgumentException 計数が空、または負の計数を含む場合に発生します
     */
    public ChannelFrame(int index, Instant timestamp, double durationSeconds,
            double laserVoltageMv, double bufferVoltageMv, double flowRate, int[] counts) {
        Preconditions.checkNotNull(timestamp, "timestamp が null です。");
        Preconditions.checkNotNull(counts, "counts が null です。");
        Preconditions.checkArgument(counts.length > 0, "チャネル数は 1 以上である必要があります。");
        for (int i = 0; i < counts.length; i++) {
            Preconditions.checkArgument(counts[i] >= 0, "計数は 0 以上である必要があります。channel=%s, count=%s",
                    i, counts[i]);
        }
        this.index = index;
        this.timestamp = timestamp;
        this.durationSeconds = durationSeconds;
        this.laserVoltageMv = laserVoltageMv;
        this.bufferVoltageMv = bufferVoltageMv;
        this.flowRate = flowRate;
        this.counts = counts.clone();
    }

    /**
     * チャネル別計数のコピーを返します。
     *
     * @return チャネル別計数です
     */
    public int[] getCounts() {
        return counts.clone();
    }

    public int getCount(int channel) {
        return counts[channel];
    }

    public int channelCount() {
        return counts.length;
    }

    /**
     * 全チャネルの計数合計を返します。
     *
     * @return 計数合計です
     */
    public long totalCount() {
        long total = 0;
        for (int c : counts) {
            total += c;
        }
        return total;
    }

    /**
     * 計数だけを置き換えたフレームを返します。
     *
     * @param newCounts 新しい計数です
     * @return 新しいフレームです
     */
    public ChannelFrame withCounts(int[] newCounts) {
        return new ChannelFrame(index, timestamp, durationSeconds, laserVoltageMv,
                bufferVoltageMv, flowRate, newCounts);
    }

    /**
     * 流量だけを置き換えたフレームを返します。
     *
     * @param newFlowRate 新しい流量 [mL/min] です
     * @return 新しいフレームです
     */
    public ChannelFrame withFlowRate(double newFlowRate) {
        return new ChannelFrame(index, timestamp, durationSeconds, laserVoltageMv,
                bufferVoltageMv, newFlowRate, counts);
    }

    @Override
    public String toString() {
        return "ChannelFrame(index=" + index + ", timestamp=" + timestamp + ", laser="
                + laserVoltageMv + "mV, buffer=" + bufferVoltageMv + "mV, flowRate=" + flowRate
                + ", counts=" + Arrays.toString(counts) + ")";
    }
}
