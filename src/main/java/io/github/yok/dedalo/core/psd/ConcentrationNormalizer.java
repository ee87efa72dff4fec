package io.github.yok.dedalo.core.psd;

import com.google.common.base.Preconditions;
import io.github.yok.dedalo.core.exception.InvalidFlowRateException;

/**
 * 計数を個数濃度 [個/mL] に換算し、比較用に正規化するクラスです。
 *
 * <p>
 * 濃度は計数を通過試料体積（流量 [mL/min] / 60 × 計測時間 [s]）で割った値です。
 * </p>
 */
public final class ConcentrationNormalizer {

    /**
     * 通過試料体積 [mL] を返します。
     *
     * @param flowRate 流量 [mL/min] です
     * @param acquisitionSeconds 計測時間 [s] です
     * @return 通過試料体積 [mL] です
     * @throws InvalidFlowRateException 流量が正でない場合に発生します
     * @throws IllegalArgumentException 計測時間が正でない場合に発生します
     */
    public double sampledVolume(double flowRate, double acquisitionSeconds) {
        if (!(flowRate > 0.0) || Double.isInfinite(flowRate)) {
            throw new InvalidFlowRateException(flowRate);
        }
        Preconditions.checkArgument(acquisitionSeconds > 0.0 && Double.isFinite(acquisitionSeconds),
                "計測時間は正である必要があります。t=%s", acquisitionSeconds);
        return flowRate / 60.0 * acquisitionSeconds;
    }

    /**
     * チャネル別計数を個数濃度に換算します。
     *
     * @param counts チャネル別計数です
     * @param flowRate 流量 [mL/min] です
     * @param acquisitionSeconds 計測時間 [s] です
     * @return チャネル別個数濃度 [個/mL] です
     * @throws InvalidFlowRateException 流量が正でない場合に発生します
     * @throws IllegalArgumentException 計測時間が正でない場合に発生します
     */
    public double[] concentration(long[] counts, double flowRate, double acquisitionSeconds) {
        return perVolume(counts, sampledVolume(flowRate, acquisitionSeconds));
    }

    /**
     * 計数合計を個数濃度に換算します。
     *
     * @param totalCount 計数合計です
     * @param flowRate 流量 [mL/min] です
     * @param acquisitionSeconds 計測時間 [s] です
     * @return 個数濃度 [個/mL] です
     */
    public double totalConcentration(long totalCount, double flowRate,
            double acquisitionSeconds) {
        return totalCount / sampledVolume(flowRate, acquisitionSeconds);
    }

    /**
     * 計数を通過試料体積で割ります。
     *
     * @param counts チャネル別計数です
     * @param volumeMl 通過試料体積 [mL] です
     * @return チャネル別個数濃度 [個/mL] です
     */
    public double[] perVolume(long[] counts, double volumeMl) {
        Preconditions.checkArgument(volumeMl > 0.0, "通過試料体積は正である必要があります。volume=%s", volumeMl);
        double[] out = new double[counts.length];
        for (int i = 0; i < counts.length; i++) {
            out[i] = counts[i] / volumeMl;
        }
        return out;
    }

    /**
     * 比較用に、合計が 1 になるよう正規化したヒストグラムを返します。
     *
     * @param histogram ヒストグラムです
     * @return 正規化したヒストグラムです
     * @throws IllegalArgumentException 合計が 0 の場合、または負の値を含む場合に発生します
     */
    public double[] normalizeForComparison(double[] histogram) {
        double total = 0.0;
        for (double v : histogram) {
            Preconditions.checkArgument(v >= 0.0 && Double.isFinite(v),
                    "ヒストグラムに負または有限でない値が含まれています。value=%s", v);
            total += v;
        }
        Preconditions.checkArgument(total > 0.0, "合計が 0 のヒストグラムは正規化できません。");
        double[] out = new double[histogram.length];
        for (int i = 0; i < histogram.length; i++) {
            out[i] = histogram[i] / total;
        }
        return out;
    }

    /**
     * 計数ヒストグラムを比較用に正規化します。
     *
     * @param counts チャネル別計数です
     * @return 正規化したヒストグラムです
     */
    public double[] normalizeForComparison(long[] counts) {
        double[] h = new double[counts.length];
        for (int i = 0; i < counts.length; i++) {
            h[i] = counts[i];
        }
        return normalizeForComparison(h);
    }
}
