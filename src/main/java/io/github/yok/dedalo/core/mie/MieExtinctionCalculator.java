package io.github.yok.dedalo.core.mie;

/**
 * 球形粒子の Mie 消光効率・消光断面積を計算するインタフェースです。
 *
 * <p>
 * 実装は純粋関数であり、同じ入力には常に同じ値を返す必要があります。
 * </p>
 */
public interface MieExtinctionCalculator {

    /**
     * 消光効率 Q_ext を計算します。
     *
     * @param diameter 粒子径 [µm] です
     * @param wavelength 真空中の波長 [µm] です
     * @param mediumIndex 媒質の屈折率です
     * @param index 粒子の屈折率です
     * @return 消光効率（無次元）です
     * @throws io.github.yok.dedalo.core.exception.DomainException 入力が物理的に不正な場合に発生します
     */
    double efficiency(double diameter, double wavelength, double mediumIndex,
            RefractiveIndex index);

    /**
     * 消光断面積 σ_ext = Q_ext · π d² / 4 を計算します。
     *
     * @param diameter 粒子径 [µm] です
     * @param wavelength 真空中の波長 [µm] です
     * @param mediumIndex 媒質の屈折率です
     * @param index 粒子の屈折率です
     * @return 消光断面積 [µm²] です
     * @throws io.github.yok.dedalo.core.exception.DomainException 入力が物理的に不正な場合に発生します
     */
    default double crossSection(double diameter, double wavelength, double mediumIndex,
            RefractiveIndex index) {
        double q = efficiency(diameter, wavelength, mediumIndex, index);
        return q * Math.PI * diameter * diameter / 4.0;
    }
}
