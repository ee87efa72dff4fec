package io.github.yok.dedalo.core.calibration;

import java.util.List;

/**
 * 参照点から校正曲線を求めるインタフェースです。
 */
public interface CalibrationCurveFitter {

    /**
     * 校正曲線を求めます。
     *
     * @param points 参照点です
     * @return 校正曲線です
     * @throws io.github.yok.dedalo.core.exception.CalibrationFitException 参照点が不足・不正、または
     *         狭義単調増加な曲線が得られない場合に発生します
     */
    CalibrationCurve fit(List<CalibrationPoint> points);
}
