package io.github.yok.dedalo.core.psd;

import com.google.common.base.Preconditions;
import lombok.Value;

/**
 * 統計計算の対象とする粒子径の範囲（両端を含む）です。
 */
@Value
public class DiameterRange {

    double min;

    double max;

    /**
     * 範囲を生成します。
     *
     * @param min 下限 [µm] です
     * @param max 上限 [µm] です
     * @throws IllegalArgumentException 下限が上限より大きい場合に発生します
     */
    public DiameterRange(double min, double max) {
        Preconditions.checkArgument(min <= max, "粒子径範囲が不正です。min=%s, max=%s", min, max);
        this.min = min;
        this.max = max;
    }

    public boolean contains(double diameter) {
        return diameter >= min && diameter <= max;
    }
}
