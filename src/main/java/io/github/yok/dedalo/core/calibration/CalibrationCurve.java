package io.github.yok.dedalo.core.calibration;

import io.github.yok.dedalo.core.lut.DiameterGrid;

/**
 * 測定径から真の粒子径への狭義単調増加な写像です。
 *
 * <p>
 * 実数全体で定義され、参照点の範囲外では線形に外挿します。
 * </p>
 */
public interface CalibrationCurve {

    /**
     * 測定径を真の粒子径に変換します。
     *
     * @param measured 測定径 [µm] です
     * @return 真の粒子径 [µm] です
     */
    double apply(double measured);

    /**
     * 真の粒子径から測定径を逆算します。
     *
     * @param trueDiameter 真の粒子径 [µm] です
     * @return 測定径 [µm] です
     */
    double invert(double trueDiameter);

    /**
     * 格子上の各点で校正曲線を評価します（可視化用）。
     *
     * @param grid 測定径の格子です
     * @return 各格子点での真の粒子径です
     */
    default double[] sample(DiameterGrid grid) {
        double[] out = new double[grid.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = apply(grid.get(i));
        }
        return out;
    }

    /**
     * 曲線の名称（ログ・出力用）を返します。
     *
     * @return 名称です
     */
    String describe();
}
