package io.github.yok.dedalo.core.psd;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.dedalo.core.exception.InvalidFlowRateException;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ConcentrationNormalizerTest {

    private final ConcentrationNormalizer normalizer = new ConcentrationNormalizer();

    @Test
    @DisplayName("流量 10 mL/min、1 秒で 50+30 個なら 480 個/mL")
    void concentrationScenario() {
        long[] counts = new long[32];
        counts[10] = 50;
        counts[11] = 30;

        double[] c = normalizer.concentration(counts, 10.0, 1.0);

        assertEquals(300.0, c[10], 1e-9);
        assertEquals(180.0, c[11], 1e-9);
        assertEquals(480.0, Arrays.stream(c).sum(), 1e-9);
        assertEquals(480.0, normalizer.totalConcentration(80, 10.0, 1.0), 1e-9);
    }

    @Test
    @DisplayName("同じ計数で流量を半分にすると濃度は 2 倍になる")
    void concentrationIsInverselyProportionalToFlowRate() {
        long[] counts = {12, 0, 7, 100};

        double[] full = normalizer.concentration(counts, 10.0, 2.0);
        double[] half = normalizer.concentration(counts, 5.0, 2.0);

        for (int i = 0; i < counts.length; i++) {
            assertEquals(2.0 * full[i], half[i], 1e-9);
        }
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -1.0, Double.NaN, Double.POSITIVE_INFINITY})
    @DisplayName("流量が正の有限値でない場合は InvalidFlowRateException")
    void rejectsInvalidFlowRate(double flowRate) {
        InvalidFlowRateException e = assertThrows(InvalidFlowRateException.class,
                () -> normalizer.concentration(new long[] {1}, flowRate, 1.0));
        assertEquals(Double.valueOf(flowRate), Double.valueOf(e.getFlowRate()));
    }

    @Test
    @DisplayName("計測時間が正でない場合は IllegalArgumentException")
    void rejectsNonPositiveAcquisitionTime() {
        assertThrows(IllegalArgumentException.class,
                () -> normalizer.concentration(new long[] {1}, 10.0, 0.0));
    }

    @Test
    @DisplayName("比較用の正規化ヒストグラムは入力の大きさによらず合計 1 になる")
    void normalizedHistogramSumsToOne() {
        for (double scale : new double[] {1e-6, 1.0, 1e9}) {
            double[] histogram = {3.0 * scale, 0.0, 1.5 * scale, 7.25 * scale};

            double[] normalized = normalizer.normalizeForComparison(histogram);

            assertEquals(1.0, Arrays.stream(normalized).sum(), 1e-12);
        }
        assertArrayEquals(new double[] {0.25, 0.75},
                normalizer.normalizeForComparison(new long[] {1, 3}), 1e-12);
    }

    @Test
    @DisplayName("合計 0 のヒストグラムは正規化できない")
    void rejectsEmptyHistogram() {
        assertThrows(IllegalArgumentException.class,
                () -> normalizer.normalizeForComparison(new long[] {0, 0}));
    }
}
