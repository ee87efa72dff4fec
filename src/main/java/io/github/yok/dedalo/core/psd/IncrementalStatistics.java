package io.github.yok.dedalo.core.psd;

import com.google.common.base.Preconditions;

/**
 * サンプルの追加ごとに統計を更新するクラスです。
 *
 * <p>
 * 計数合計の平均・分散は Welford 法で、中央値・四分位は {@link CountOrderStatistics} で更新します。 1 回の追加は O(チャネル数 +
 * log V) で、サンプル数に依存しません。 結果は {@link StatisticsEngine#summarize} による一括計算と一致します。 スレッドセーフではありません。
 * </p>
 */
public final class IncrementalStatistics {

    private final DistributionAccumulator accumulator;

    private final CountOrderStatistics order = new CountOrderStatistics();

    private int sampleCount;

    private long totalCount;

    private double mean;

    private double m2;

    private double acquisitionSeconds;

    /**
     * 更新器を生成します。
     *
     * @param calculator 要約統計の計算ロジックです
     * @param normalizer 濃度換算ロジックです
     */
    public IncrementalStatistics(DistributionStatisticsCalculator calculator,
            ConcentrationNormalizer normalizer) {
        this.accumulator = new DistributionAccumulator(calculator, normalizer);
    }

    /**
     * サンプルを追加します。
     *
     * <p>
     * 受け付けられないサンプルの場合は、どの統計も更新せずに例外を送出します。
     * </p>
     *
     * @param sample サンプルです
     * @throws IllegalArgumentException 計数合計が順序統計量の上限以上の場合に発生します
     */
    public void add(PsdSample sample) {
        Preconditions.checkNotNull(sample, "sample が null です。");
        long x = sample.getTotalCount();
        Preconditions.checkArgument(CountOrderStatistics.accepts(x),
                "計数合計が上限を超えています。total=%s, limit=%s", x, CountOrderStatistics.MAX_CAPACITY);
        accumulator.add(sample);
        sampleCount++;
        totalCount += x;
        double delta = x - mean;
        mean += delta / sampleCount;
        m2 += delta * (x - mean);
        order.add(x);
        acquisitionSeconds += sample.getAcquisitionSeconds();
    }

    public int getSampleCount() {
        return sampleCount;
    }

    /**
     * 現在の統計のスナップショットを返します。
     *
     * @return スナップショットです
     */
    public SessionStatistics snapshot() {
        if (sampleCount == 0) {
            return SessionStatistics.empty();
        }
        double rate = acquisitionSeconds > 0.0 ? totalCount / acquisitionSeconds : Double.NaN;
        TimeSeriesStatistics timeSeries = new TimeSeriesStatistics(sampleCount, mean,
                Math.sqrt(Math.max(0.0, m2 / sampleCount)), order.quantile(0.5),
                order.quantile(0.25), order.quantile(0.75), rate);
        return new SessionStatistics(sampleCount, accumulator.finish(), timeSeries);
    }
}
