package io.github.yok.dedalo.core.calibration;

/**
 * 校正を行わない（測定径をそのまま返す）校正曲線です。
 */
public enum IdentityCalibrationCurve implements CalibrationCurve {

    INSTANCE;

    @Override
    public double apply(double measured) {
        return measured;
    }

    @Override
    public double invert(double trueDiameter) {
        return trueDiameter;
    }

    @Override
    public String describe() {
        return "identity";
    }
}
