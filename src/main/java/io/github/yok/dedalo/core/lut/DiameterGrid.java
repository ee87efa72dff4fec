package io.github.yok.dedalo.core.lut;

import com.google.common.base.Preconditions;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.util.Arrays;

/**
 * 狭義単調増加の粒子径格子 [µm] を表す不変クラスです。
 *
 * <p>
 * 装置のチャネル中心径と、LUT の計算格子の両方に使用します。 {@link #signature()} は格子内容のハッシュで、LUT キャッシュのキーに含まれます。
 * </p>
 */
public final class DiameterGrid {

    /**
     * 格子点です。
     */
    private final double[] diameters;

    /**
     * 内容ハッシュです。
     */
    private final String signature;

    /**
     * 格子点の配列から格子を生成します。
     *
     * @param diameters 格子点です（コピーして保持します）
     * @throws IllegalArgumentException 2 点未満、有限でない、または狭義単調増加でない場合に発生します
     */
    public DiameterGrid(double[] diameters) {
        Preconditions.checkNotNull(diameters, "格子点が null です。");
        Preconditions.checkArgument(diameters.length >= 2, "格子点は 2 点以上必要です。size=%s",
                diameters.length);
        for (int i = 0; i < diameters.length; i++) {
            Preconditions.checkArgument(Double.isFinite(diameters[i]) && diameters[i] > 0.0,
                    "格子点は正の有限値である必要があります。index=%s, d=%s", i, (Object) diameters[i]);
            if (i > 0) {
                Preconditions.checkArgument(diameters[i] > diameters[i - 1],
                        "格子点は狭義単調増加である必要があります。index=%s", i);
            }
        }
        this.diameters = diameters.clone();
        Hasher hasher = Hashing.murmur3_128().newHasher();
        for (double d : this.diameters) {
            hasher.putDouble(d);
        }
        this.signature = hasher.hash().toString();
    }

    /**
     * 等間隔格子 min, min+step, ..., max を生成します。
     *
     * <p>
     * 点数は (max-min)/step を丸めて決め、各点は min + i·step で計算します。
     * </p>
     *
     * @param min 最小径です
     * @param max 最大径です
     * @param step 刻み幅です
     * @return 等間隔格子です
     * @throws IllegalArgumentException 範囲や刻み幅が不正な場合に発生します
     */
    public static DiameterGrid uniform(double min, double max, double step) {
        Preconditions.checkArgument(step > 0.0, "刻み幅は正である必要があります。step=%s", step);
        Preconditions.checkArgument(max > min, "最大径は最小径より大きい必要があります。min=%s, max=%s", min, max);
        int intervals = (int) Math.round((max - min) / step);
        Preconditions.checkArgument(Math.abs(min + intervals * step - max) < step * 1e-6,
                "範囲が刻み幅で割り切れません。min=%s, max=%s, step=%s", min, max, step);
        double[] values = new double[intervals + 1];
        for (int i = 0; i <= intervals; i++) {
            // 1e-9 µm 単位に丸めて 1.6000000000000001 のような表記を避けます。
            values[i] = Math.round((min + i * step) * 1e9) / 1e9;
        }
        values[intervals] = max;
        return new DiameterGrid(values);
    }

    /**
     * 格子点数を返します。
     *
     * @return 格子点数です
     */
    public int size() {
        return diameters.length;
    }

    /**
     * i 番目の格子点を返します。
     *
     * @param i インデックスです
     * @return 粒子径 [µm] です
     */
    public double get(int i) {
        return diameters[i];
    }

    public double min() {
        return diameters[0];
    }

    public double max() {
        return diameters[diameters.length - 1];
    }

    /**
     * 格子点の配列（コピー）を返します。
     *
     * @return 格子点です
     */
    public double[] toArray() {
        return diameters.clone();
    }

    /**
     * 隣接格子点の間隔の平均を返します（等間隔格子では刻み幅そのものです）。
     *
     * @return 平均刻み幅です
     */
    public double meanStep() {
        return (max() - min()) / (diameters.length - 1);
    }

    /**
     * 格子内容のハッシュ（16 進）を返します。
     *
     * @return 署名です
     */
    public String signature() {
        return signature;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DiameterGrid)) {
            return false;
        }
        return Arrays.equals(diameters, ((DiameterGrid) o).diameters);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(diameters);
    }

    @Override
    public String toString() {
        return "DiameterGrid[" + min() + ".." + max() + ", n=" + size() + "]";
    }
}
