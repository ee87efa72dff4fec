package io.github.yok.dedalo.core.calibration;

import io.github.yok.dedalo.core.exception.CalibrationFitException;
import java.util.List;

/**
 * 参照点の検証ユーティリティです。
 */
final class CalibrationPoints {

    private CalibrationPoints() {}

    /**
     * 参照点を検証します。
     *
     * <p>
     * 測定径・真の粒子径がともに正の有限値で、測定径の昇順に並び、両方とも狭義単調増加であることを確認します。
     * </p>
     *
     * @param points 参照点です
     * @param minimum 必要な最小点数です
     * @throws CalibrationFitException 検証に失敗した場合に発生します
     */
    static void validate(List<CalibrationPoint> points, int minimum) {
        if (points == null || points.size() < minimum) {
            throw new CalibrationFitException("校正の参照点が不足しています: 必要=" + minimum + ", 実際="
                    + (points == null ? 0 : points.size()));
        }
        for (int i = 0; i < points.size(); i++) {
            CalibrationPoint p = points.get(i);
            if (p == null) {
                throw new CalibrationFitException("校正の参照点に null が含まれています: index=" + i);
            }
            if (!Double.isFinite(p.getMeasured()) || !Double.isFinite(p.getTrueDiameter())
                    || p.getMeasured() <= 0.0 || p.getTrueDiameter() <= 0.0) {
                throw new CalibrationFitException("校正の参照点は正の有限値である必要があります: index=" + i
                        + ", point=" + p);
            }
            if (i > 0) {
                CalibrationPoint prev = points.get(i - 1);
                if (p.getMeasured() <= prev.getMeasured()) {
                    throw new CalibrationFitException(
                            "測定径が昇順でないか重複しています: index=" + i + ", measured=" + p.getMeasured());
                }
                if (p.getTrueDiameter() <= prev.getTrueDiameter()) {
                    throw new CalibrationFitException("真の粒子径が狭義単調増加ではありません: index=" + i
                            + ", trueDiameter=" + p.getTrueDiameter());
                }
            }
        }
    }
}
