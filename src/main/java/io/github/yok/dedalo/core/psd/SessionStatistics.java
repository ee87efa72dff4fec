package io.github.yok.dedalo.core.psd;

import java.util.Optional;
import lombok.Value;

/**
 * 計測全体（または時間窓）の統計のスナップショットです。
 */
@Value
public class SessionStatistics {

    /**
     * 集計したサンプル数です。
     */
    int sampleCount;

    /**
     * 全サンプルを積算した分布です（サンプルがない場合は null）。
     */
    PsdSample accumulated;

    /**
     * 計数合計の時系列統計です。
     */
    TimeSeriesStatistics timeSeries;

    /**
     * サンプルがない場合のスナップショットです。
     *
     * @return 空のスナップショットです
     */
    public static SessionStatistics empty() {
        return new SessionStatistics(0, null, TimeSeriesStatistics.empty());
    }

    public Optional<PsdSample> accumulatedSample() {
        return Optional.ofNullable(accumulated);
    }

    public long getTotalCount() {
        return accumulated == null ? 0 : accumulated.getTotalCount();
    }

    public double getTotalConcentration() {
        return accumulated == null ? Double.NaN : accumulated.getTotalConcentration();
    }

    public double getAverageLaserVoltageMv() {
        return accumulated == null ? Double.NaN : accumulated.getLaserVoltageMv();
    }

    public double getAverageBufferVoltageMv() {
        return accumulated == null ? Double.NaN : accumulated.getBufferVoltageMv();
    }

    public double getFlowRate() {
        return accumulated == null ? Double.NaN : accumulated.getFlowRate();
    }

    public DistributionStatistics getDistribution() {
        return accumulated == null ? null : accumulated.getStatistics();
    }
}
