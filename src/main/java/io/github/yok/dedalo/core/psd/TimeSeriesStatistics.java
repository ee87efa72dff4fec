package io.github.yok.dedalo.core.psd;

import java.util.Arrays;
import lombok.Value;

/**
 * フレームごとの計数合計の時系列に対する統計です。
 *
 * <p>
 * 標準偏差は母標準偏差、分位点は線形補間（h = (n-1)p）による値です。 サンプルがない場合は NaN です。
 * </p>
 */
@Value
public class TimeSeriesStatistics {

    /**
     * サンプル数です。
     */
    long sampleCount;

    /**
     * 計数合計の平均です。
     */
    double mean;

    /**
     * 計数合計の母標準偏差です。
     */
    double standardDeviation;

    double median;

    double q1;

    double q3;

    /**
     * 平均計数率 [個/s] です。
     */
    double countRate;

    /**
     * サンプルがない場合の統計です。
     *
     * @return 空の統計です
     */
    public static TimeSeriesStatistics empty() {
        return new TimeSeriesStatistics(0, Double.NaN, Double.NaN, Double.NaN, Double.NaN,
                Double.NaN, Double.NaN);
    }

    /**
     * 計数合計の列から統計を計算します。
     *
     * @param totals フレームごとの計数合計です
     * @param acquisitionSeconds 計測時間の合計 [s] です
     * @return 統計です
     */
    public static TimeSeriesStatistics compute(long[] totals, double acquisitionSeconds) {
        int n = totals.length;
        if (n == 0) {
            return empty();
        }
        long sum = 0;
        for (long t : totals) {
            sum += t;
        }
        double mean = (double) sum / n;
        double squares = 0.0;
        for (long t : totals) {
            double dev = t - mean;
            squares += dev * dev;
        }
        long[] sorted = totals.clone();
        Arrays.sort(sorted);
        double rate = acquisitionSeconds > 0.0 ? sum / acquisitionSeconds : Double.NaN;
        return new TimeSeriesStatistics(n, mean, Math.sqrt(squares / n), quantile(sorted, 0.5),
                quantile(sorted, 0.25), quantile(sorted, 0.75), rate);
    }

    /**
     * 昇順に並んだ値の線形補間分位点を返します。
     *
     * @param sorted 昇順の値です（空不可）
     * @param p 確率（0〜1）です
     * @return 分位点です
     */
    static double quantile(long[] sorted, double p) {
        double h = (sorted.length - 1) * p;
        int lo = (int) Math.floor(h);
        double frac = h - lo;
        if (frac == 0.0) {
            return sorted[lo];
        }
        return sorted[lo] + frac * (sorted[lo + 1] - sorted[lo]);
    }
}
