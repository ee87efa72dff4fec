package io.github.yok.dedalo.out;

import io.github.yok.dedalo.core.calibration.CalibrationCurve;
import io.github.yok.dedalo.core.calibration.CalibrationPoint;
import io.github.yok.dedalo.core.lut.DiameterGrid;
import io.github.yok.dedalo.core.psd.ComparisonEntry;
import io.github.yok.dedalo.core.psd.PsdSample;
import io.github.yok.dedalo.core.psd.SessionStatistics;
import java.util.List;

/**
 * 計測結果を出力する処理のインタフェースです。
 *
 * <p>
 * 計測ごとの結果は必須で、校正曲線と複数計測の比較は出力形式によっては出力しません。
 * </p>
 */
public interface ResultWriter {

    /**
     * 1 回の計測の結果を出力します。
     *
     * @param name 計測名（ファイル名の一部に使います）です
     * @param samples 時刻順のサンプルです
     * @param statistics 計測全体の統計です
     */
    void writeRecording(String name, List<PsdSample> samples, SessionStatistics statistics);

    /**
     * 校正曲線を出力します。
     *
     * @param curve 校正曲線です
     * @param points 参照点です
     * @param grid 評価する測定径の格子です
     */
    default void writeCalibration(CalibrationCurve curve, List<CalibrationPoint> points,
            DiameterGrid grid) {}

    /**
     * 複数計測の比較結果を出力します。
     *
     * @param entries 比較結果です
     * @param acquisitionTimeFilterSeconds 計測時間フィルタ [s] です
     */
    default void writeComparison(List<ComparisonEntry> entries,
            double acquisitionTimeFilterSeconds) {}
}
