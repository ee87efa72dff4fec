package io.github.yok.dedalo.core.psd;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * チャネル別計数から {@link DistributionStatistics} を計算するクラスです。
 *
 * <p>
 * 算術平均・標準偏差は対象範囲のチャネル径そのものに対して、重み付き平均・四分位は計数を重みとして計算します。 四分位は各粒子をチャネル径に置いた標本に対する
 * 線形補間の分位点です。
 * </p>
 */
public final class DistributionStatisticsCalculator {

    /**
     * チャネル幅 [µm] です（誤差の計算に使用します）。
     */
    private final double binWidth;

    /**
     * 既定の粒子径範囲です（null の場合は全チャネル）。
     */
    private final DiameterRange defaultRange;

    /**
     * 計算器を生成します。
     *
     * @param binWidth チャネル幅 [µm] です
     * @param defaultRange 既定の粒子径範囲です（null 可）
     * @throws IllegalArgumentException チャネル幅が正でない場合に発生します
     */
    public DistributionStatisticsCalculator(double binWidth, DiameterRange defaultRange) {
        Preconditions.checkArgument(binWidth > 0.0, "チャネル幅は正である必要があります。binWidth=%s", binWidth);
        this.binWidth = binWidth;
        this.defaultRange = defaultRange;
    }

    public double getBinWidth() {
        return binWidth;
    }

    /**
     * 既定の粒子径範囲で統計を計算します。
     *
     * @param diameters チャネル径です
     * @param counts チャネル別計数です
     * @return 要約統計です
     */
    public DistributionStatistics calculate(double[] diameters, long[] counts) {
        return calculate(diameters, counts, defaultRange);
    }

    /**
     * 指定の粒子径範囲で統計を計算します。
     *
     * @param diameters チャネル径です
     * @param counts チャネル別計数です
     * @param range 粒子径範囲です（null の場合は全チャネル）
     * @return 要約統計です
     * @throws IllegalArgumentException 配列長が一致しない場合に発生します
     */
    public DistributionStatistics calculate(double[] diameters, long[] counts,
            DiameterRange range) {
        Preconditions.checkArgument(diameters.length == counts.length,
                "チャネル径と計数の長さが一致しません。diameters=%s, counts=%s", diameters.length,
                counts.length);

        int[] selected = IntStream.range(0, diameters.length)
                .filter(i -> range == null || range.contains(diameters[i])).toArray();
        int n = selected.length;

        long total = 0;
        double sumD = 0.0;
        double sumDc = 0.0;
        double sumC2 = 0.0;
        long maxCount = -1;
        double mode = Double.NaN;
        for (int i : selected) {
            long c = counts[i];
            total += c;
            sumD += diameters[i];
            sumDc += diameters[i] * c;
            sumC2 += (double) c * c;
            if (c > maxCount) {
                maxCount = c;
                mode = diameters[i];
            }
        }

        double arithmeticMean = n > 0 ? sumD / n : Double.NaN;
        double arithmeticMeanError = n > 0 ? binWidth / Math.sqrt(n) : Double.NaN;
        double variance = 0.0;
        for (int i : selected) {
            double dev = diameters[i] - arithmeticMean;
            variance += dev * dev;
        }
        double standardDeviation = n > 0 ? Math.sqrt(variance / n) : Double.NaN;

        if (total == 0) {
            return new DistributionStatistics(0, Double.NaN, arithmeticMean, arithmeticMeanError,
                    Double.NaN, Double.NaN, standardDeviation, Double.NaN, Double.NaN,
                    Double.NaN);
        }

        double weightedMean = sumDc / total;
        double weightedMeanError = binWidth * Math.sqrt(sumC2) / total;

        // 補正後の径は単調とは限らないため、径の昇順に並べてから分位点を求めます。
        Integer[] order = Arrays.stream(selected).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> diameters[i]));

        return new DistributionStatistics(total, mode, arithmeticMean, arithmeticMeanError,
                weightedMean, weightedMeanError, standardDeviation,
                weightedQuantile(order, diameters, counts, total, 0.25),
                weightedQuantile(order, diameters, counts, total, 0.5),
                weightedQuantile(order, diameters, counts, total, 0.75));
    }

    /**
     * 計数で展開した標本の線形補間分位点を返します。
     */
    private static double weightedQuantile(Integer[] order, double[] diameters, long[] counts,
            long total, double p) {
        double h = (total - 1) * p;
        long lo = (long) Math.floor(h);
        double frac = h - lo;
        double lower = valueAt(order, diameters, counts, lo);
        if (frac == 0.0) {
            return lower;
        }
        double upper = valueAt(order, diameters, counts, lo + 1);
        return lower + frac * (upper - lower);
    }

    /**
     * 展開標本の k 番目（0 始まり）の値を返します。
     */
    private static double valueAt(Integer[] order, double[] diameters, long[] counts, long k) {
        long cumulative = 0;
        for (int i : order) {
            cumulative += counts[i];
            if (cumulative > k) {
                return diameters[i];
            }
        }
        return diameters[order[order.length - 1]];
    }
}
