package io.github.yok.dedalo.core.lut;

import com.google.common.base.Preconditions;
import io.github.yok.dedalo.core.mie.RefractiveIndex;
import lombok.Value;

/**
 * 屈折率によらず一定の窓幅を使う平滑化設定です。
 */
@Value
public class FixedSmoothingWindow implements SmoothingWindowPolicy {

    int window;

    /**
     * 設定を生成します。
     *
     * @param window 窓幅（格子点数）です
     * @throws IllegalArgumentException 窓幅が負の場合に発生します
     */
    public FixedSmoothingWindow(int window) {
        Preconditions.checkArgument(window >= 0, "窓幅は 0 以上である必要があります。window=%s", window);
        this.window = window;
    }

    @Override
    public int windowFor(RefractiveIndex index, DiameterGrid grid) {
        return window;
    }
}
