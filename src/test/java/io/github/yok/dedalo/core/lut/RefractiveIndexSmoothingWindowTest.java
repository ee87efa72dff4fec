package io.github.yok.dedalo.core.lut;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.dedalo.core.mie.BhmieExtinctionCalculator;
import io.github.yok.dedalo.core.mie.RefractiveIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RefractiveIndexSmoothingWindowTest {

    private static final DiameterGrid LUT_GRID = DiameterGrid.uniform(0.2, 20.0, 0.01);

    private final RefractiveIndexSmoothingWindow policy = new RefractiveIndexSmoothingWindow();

    @Test
    @DisplayName("屈折率が高いほど窓幅が小さくなり、対応表の両端の値に近い")
    void windowShrinksWithIndex() {
        int low = policy.windowFor(new RefractiveIndex(1.42, 0.0), LUT_GRID);
        int mid = policy.windowFor(new RefractiveIndex(1.50, 0.0), LUT_GRID);
        int high = policy.windowFor(new RefractiveIndex(1.64, 0.0), LUT_GRID);

        assertTrue(low > mid && mid > high, low + " > " + mid + " > " + high);
        assertEquals(201, low);
        assertEquals(154, mid);
        assertEquals(115, high);
    }

    @Test
    @DisplayName("対応表の範囲外の屈折率は端の値で評価する")
    void clampsOutsideTable() {
        assertEquals(policy.referenceWindow(1.42), policy.referenceWindow(1.33), 1e-9);
        assertEquals(policy.referenceWindow(1.64), policy.referenceWindow(1.80), 1e-9);
    }

    @Test
    @DisplayName("粗い格子では同じ径幅になるよう格子点数を換算する")
    void scalesWithGridStep() {
        DiameterGrid coarse = DiameterGrid.uniform(0.2, 20.0, 0.05);

        assertEquals(30, policy.windowFor(new RefractiveIndex(1.50, 0.0), coarse));
    }

    @Test
    @DisplayName("屈折率ごとにキャッシュキーの窓幅が変わる")
    void keyCarriesIndexDependentWindow() {
        LookupTableBuilder builder =
                new LookupTableBuilder(new BhmieExtinctionCalculator(), 0.670, 1.331, policy);

        LookupTableKey low = builder.keyOf(LUT_GRID, new RefractiveIndex(1.42, 0.0));
        LookupTableKey high = builder.keyOf(LUT_GRID, RefractiveIndex.POLYSTYRENE);

        assertNotEquals(low.getSmoothingWindow(), high.getSmoothingWindow());
        assertEquals(123, high.getSmoothingWindow());
    }

    @Test
    @DisplayName("平滑化した逆引き曲線は生の断面積より非単調区間が大幅に少ない")
    void smoothingRemovesResonanceRipple() {
        BhmieExtinctionCalculator calculator = new BhmieExtinctionCalculator();
        RefractiveIndex index = new RefractiveIndex(1.50, 0.0);

        MieLookupTable raw =
                new LookupTableBuilder(calculator, 0.670, 1.331, 0).build(LUT_GRID, index);
        MieLookupTable smoothed =
                new LookupTableBuilder(calculator, 0.670, 1.331, policy).build(LUT_GRID, index);

        assertTrue(raw.getNonMonotonicIntervalCount() > 100,
                "raw=" + raw.getNonMonotonicIntervalCount());
        assertTrue(smoothed.getNonMonotonicIntervalCount() < 20,
                "smoothed=" + smoothed.getNonMonotonicIntervalCount());
        assertEquals(raw.crossSectionAt(5.0), smoothed.crossSectionAt(5.0), 1e-12);
    }

    @Test
    @DisplayName("長さの異なる対応表は受け付けない")
    void rejectsMismatchedTable() {
        assertThrows(IllegalArgumentException.class,
                () -> new RefractiveIndexSmoothingWindow(new double[] {1.4, 1.5, 1.6, 1.7},
                        new double[] {100, 90, 80}));
    }
}
