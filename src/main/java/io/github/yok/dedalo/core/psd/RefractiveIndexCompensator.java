package io.github.yok.dedalo.core.psd;

import com.google.common.base.Preconditions;
import io.github.yok.dedalo.core.calibration.CalibrationCurve;
import io.github.yok.dedalo.core.exception.OutOfRangeException;
import io.github.yok.dedalo.core.lut.DiameterGrid;
import io.github.yok.dedalo.core.lut.DiameterInversion;
import io.github.yok.dedalo.core.lut.MieLookupTable;
import lombok.extern.slf4j.Slf4j;

/**
 * チャネル中心径を、校正曲線と 2 つの LUT（基準屈折率・測定対象の屈折率）で補正するクラスです。
 *
 * <p>
 * 公称径 → 校正後の径 → 基準 LUT で消光断面積 → 対象 LUT で逆引き、の順に変換します。 LUT の範囲外になったチャネルは校正後の径のまま
 * 未補正として扱い、処理は継続します。
 * </p>
 */
@Slf4j
public final class RefractiveIndexCompensator {

    /**
     * チャネル補正を計算します。
     *
     * @param channels チャネル中心径（公称径）です
     * @param calibration 校正曲線です
     * @param reference 基準屈折率（装置の校正材料）の LUT です
     * @param target 測定対象の屈折率の LUT です
     * @return チャネル補正です
     */
    public ChannelCorrection compensate(DiameterGrid channels, CalibrationCurve calibration,
            MieLookupTable reference, MieLookupTable target) {
        Preconditions.checkNotNull(channels, "channels が null です。");
        Preconditions.checkNotNull(calibration, "calibration が null です。");
        Preconditions.checkNotNull(reference, "reference が null です。");
        Preconditions.checkNotNull(target, "target が null です。");

        int n = channels.size();
        double[] nominal = channels.toArray();
        double[] calibrated = new double[n];
        double[] corrected = new double[n];
        boolean[] correctedFlags = new boolean[n];
        boolean[] ambiguousFlags = new boolean[n];

        for (int i = 0; i < n; i++) {
            calibrated[i] = calibration.apply(nominal[i]);
            try {
                double sigma = reference.crossSectionAt(calibrated[i]);
                DiameterInversion inversion = target.invert(sigma, calibrated[i]);
                corrected[i] = inversion.getDiameter();
                correctedFlags[i] = true;
                ambiguousFlags[i] = inversion.isAmbiguous();
                if (inversion.isAmbiguous()) {
                    log.debug("逆引きの解が複数あります。チャネル={}、校正後={}、候補={}、採用={}", i + 1,
                            calibrated[i], inversion.getCandidates(), corrected[i]);
                }
            } catch (OutOfRangeException e) {
                log.warn("チャネル {} は LUT の範囲外のため屈折率補正を行いません。{}", i + 1, e.getMessage());
                corrected[i] = calibrated[i];
                correctedFlags[i] = false;
            }
        }

        ChannelCorrection correction = new ChannelCorrection(nominal, calibrated, corrected,
                correctedFlags, ambiguousFlags);
        log.debug("チャネル補正を計算しました。チャネル数={}、未補正={}、曖昧={}", n, correction.uncorrectedCount(),
                correction.ambiguousCount());
        return correction;
    }
}
