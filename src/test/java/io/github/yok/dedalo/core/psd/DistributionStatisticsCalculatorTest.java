package io.github.yok.dedalo.core.psd;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DistributionStatisticsCalculatorTest {

    private final DistributionStatisticsCalculator calculator =
            new DistributionStatisticsCalculator(0.2, null);

    @Test
    @DisplayName("最頻径・平均・標準偏差・計数で重み付けした分位点を求める")
    void basicStatistics() {
        DistributionStatistics s =
                calculator.calculate(new double[] {1.0, 2.0, 3.0}, new long[] {1, 2, 1});

        assertEquals(4, s.getTotalCount());
        assertEquals(2.0, s.getModeDiameter());
        assertEquals(2.0, s.getArithmeticMean(), 1e-12);
        assertEquals(0.2 / Math.sqrt(3.0), s.getArithmeticMeanError(), 1e-12);
        assertEquals(Math.sqrt(2.0 / 3.0), s.getStandardDeviation(), 1e-12);
        assertEquals(2.0, s.getWeightedMean(), 1e-12);
        assertEquals(0.2 * Math.sqrt(6.0) / 4.0, s.getWeightedMeanError(), 1e-12);
        assertEquals(1.75, s.getQ1(), 1e-12);
        assertEquals(2.0, s.getMedian(), 1e-12);
        assertEquals(2.25, s.getQ3(), 1e-12);
    }

    @Test
    @DisplayName("最頻径は最初の最大計数のチャネルになる")
    void modeIsFirstMaximum() {
        DistributionStatistics s = calculator.calculate(new double[] {1.0, 1.2, 1.4, 1.6},
                new long[] {0, 50, 30, 50});

        assertEquals(1.2, s.getModeDiameter());
    }

    @Test
    @DisplayName("補正後の径が昇順でなくても分位点は径の順で求める")
    void quantilesSortByDiameter() {
        DistributionStatistics s =
                calculator.calculate(new double[] {3.0, 1.0, 2.0}, new long[] {1, 1, 1});

        assertEquals(2.0, s.getMedian(), 1e-12);
        assertEquals(1.5, s.getQ1(), 1e-12);
    }

    @Test
    @DisplayName("径の範囲を指定すると範囲内のチャネルだけを使う")
    void restrictsToRange() {
        DistributionStatistics s = calculator.calculate(new double[] {1.0, 2.0, 3.0},
                new long[] {100, 2, 2}, new DiameterRange(1.5, 3.5));

        assertEquals(4, s.getTotalCount());
        assertEquals(2.5, s.getWeightedMean(), 1e-12);
        assertEquals(2.5, s.getArithmeticMean(), 1e-12);
    }

    @Test
    @DisplayName("計数合計が 0 の場合、計数に依存する統計は NaN になる")
    void emptyDistribution() {
        DistributionStatistics s =
                calculator.calculate(new double[] {1.0, 2.0}, new long[] {0, 0});

        assertEquals(0, s.getTotalCount());
        assertTrue(Double.isNaN(s.getModeDiameter()));
        assertTrue(Double.isNaN(s.getWeightedMean()));
        assertTrue(Double.isNaN(s.getMedian()));
    }
}
