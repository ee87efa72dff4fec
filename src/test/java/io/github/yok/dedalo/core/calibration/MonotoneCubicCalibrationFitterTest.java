package io.github.yok.dedalo.core.calibration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.dedalo.core.exception.CalibrationFitException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MonotoneCubicCalibrationFitterTest {

    /**
     * 標準粒子（ポリスチレン）の参照点です。
     */
    static final List<CalibrationPoint> BEADS = List.of(new CalibrationPoint(1.05, 1.0),
            new CalibrationPoint(2.5, 1.8), new CalibrationPoint(3.7, 2.9),
            new CalibrationPoint(4.1, 3.7), new CalibrationPoint(5.8, 5.0),
            new CalibrationPoint(10.0, 10.0));

    private final MonotoneCubicCalibrationFitter fitter = new MonotoneCubicCalibrationFitter();

    @Test
    @DisplayName("曲線は参照点を通り、逆変換で測定径に戻る")
    void passesThroughPointsAndRoundTrips() {
        CalibrationCurve curve = fitter.fit(BEADS);

        for (CalibrationPoint p : BEADS) {
            assertEquals(p.getTrueDiameter(), curve.apply(p.getMeasured()), 1e-12);
            assertEquals(p.getMeasured(), curve.invert(curve.apply(p.getMeasured())), 1e-9);
        }
        assertEquals("pchip(n=6)", curve.describe());
    }

    @Test
    @DisplayName("曲線は狭義単調増加である")
    void strictlyIncreasing() {
        CalibrationCurve curve = fitter.fit(BEADS);

        double previous = curve.apply(0.5);
        for (double m = 0.51; m <= 12.0; m += 0.01) {
            double v = curve.apply(m);
            assertTrue(v > previous, "m=" + m);
            previous = v;
        }
    }

    @Test
    @DisplayName("参照点の範囲外は端の区間の傾きで線形に外挿する")
    void extrapolatesLinearly() {
        CalibrationCurve curve = fitter.fit(BEADS);

        double slope = (10.0 - 5.0) / (10.0 - 5.8);
        assertEquals(10.0 + slope, curve.apply(11.0), 1e-12);
        double lowSlope = (1.8 - 1.0) / (2.5 - 1.05);
        assertEquals(1.0 - 0.05 * lowSlope, curve.apply(1.0), 1e-12);
        assertEquals(11.0, curve.invert(10.0 + slope), 1e-9);
    }

    @Test
    @DisplayName("参照点が不足、または単調でない場合は CalibrationFitException")
    void rejectsInvalidPoints() {
        assertThrows(CalibrationFitException.class,
                () -> fitter.fit(List.of(new CalibrationPoint(1.0, 1.0))));
        assertThrows(CalibrationFitException.class,
                () -> fitter.fit(List.of(new CalibrationPoint(1.0, 1.0),
                        new CalibrationPoint(1.0, 2.0))));
        assertThrows(CalibrationFitException.class,
                () -> fitter.fit(List.of(new CalibrationPoint(1.0, 2.0),
                        new CalibrationPoint(2.0, 1.5))));
        assertThrows(CalibrationFitException.class,
                () -> fitter.fit(List.of(new CalibrationPoint(-1.0, 2.0),
                        new CalibrationPoint(2.0, 3.0))));
    }

    @Test
    @DisplayName("恒等写像の校正曲線は値を変えない")
    void identityCurve() {
        CalibrationCurve curve = IdentityCalibrationCurve.INSTANCE;

        assertEquals(3.2, curve.apply(3.2));
        assertEquals(3.2, curve.invert(3.2));
    }
}
