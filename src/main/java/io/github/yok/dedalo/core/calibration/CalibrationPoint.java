package io.github.yok.dedalo.core.calibration;

import lombok.Value;

/**
 * 標準粒子による校正の参照点（測定径と真の粒子径の組）です。
 */
@Value
public class CalibrationPoint {

    /**
     * 装置が報告した粒子径 [µm] です。
     */
    double measured;

    /**
     * 標準粒子の真の粒子径 [µm] です。
     */
    double trueDiameter;
}
