package io.github.yok.dedalo.core.lut;

import com.google.common.base.Preconditions;

/**
 * 1 次元の移動平均フィルタです。
 *
 * <p>
 * 境界は鏡映（d c b a | a b c d | d c b a）で拡張します。 偶数幅の窓は中心より左側に 1 点多く含みます。
 * </p>
 */
public final class MovingAverageSmoother {

    private MovingAverageSmoother() {}

    /**
     * 移動平均を適用した新しい配列を返します。
     *
     * @param values 入力値です
     * @param window 窓幅です（0 または 1 の場合はコピーを返します）
     * @return 平滑化後の値です
     * @throws IllegalArgumentException 窓幅が負の場合に発生します
     */
    public static double[] smooth(double[] values, int window) {
        Preconditions.checkNotNull(values, "values が null です。");
        Preconditions.checkArgument(window >= 0, "窓幅は 0 以上である必要があります。window=%s", window);
        if (window <= 1 || values.length == 0) {
            return values.clone();
        }
        int n = values.length;
        int left = window / 2;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0.0;
            for (int j = i - left; j < i - left + window; j++) {
                sum += values[reflect(j, n)];
            }
            out[i] = sum / window;
        }
        return out;
    }

    /**
     * 範囲外インデックスを鏡映で [0, n) に戻します。
     */
    private static int reflect(int j, int n) {
        int period = 2 * n;
        int k = Math.floorMod(j, period);
        return k < n ? k : period - 1 - k;
    }
}
