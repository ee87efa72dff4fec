package io.github.yok.dedalo.core.lut;

import io.github.yok.dedalo.core.mie.RefractiveIndex;
import lombok.Value;

/**
 * LUT キャッシュのキーです。
 *
 * <p>
 * 同じキーの LUT は内容が同一であるため、プロセス内で共有できます。
 * </p>
 */
@Value
public class LookupTableKey {

    RefractiveIndex index;

    double wavelength;

    double mediumIndex;

    /**
     * 計算格子の内容ハッシュです。
     */
    String gridSignature;

    /**
     * 逆引き曲線の移動平均窓幅（0 または 1 で平滑化なし）です。
     */
    int smoothingWindow;
}
