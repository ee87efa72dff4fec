package io.github.yok.dedalo.core.lut;

import io.github.yok.dedalo.core.mie.RefractiveIndex;

/**
 * 逆引き曲線に適用する移動平均の窓幅を決めるインタフェースです。
 *
 * <p>
 * 窓幅は LUT のキャッシュキーに含まれるため、同じ屈折率と格子には常に同じ値を返す必要があります。
 * </p>
 */
public interface SmoothingWindowPolicy {

    /**
     * 窓幅を返します。
     *
     * @param index 粒子の屈折率です
     * @param grid 計算格子です
     * @return 窓幅（格子点数、0 または 1 で平滑化なし）です
     */
    int windowFor(RefractiveIndex index, DiameterGrid grid);
}
