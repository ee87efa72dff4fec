package io.github.yok.dedalo.core.psd;

import com.google.common.base.Preconditions;
import io.github.yok.dedalo.core.lut.DiameterGrid;
import java.util.Arrays;

/**
 * チャネルごとの粒子径ラベルの補正結果です。
 *
 * <p>
 * 公称径、校正後の径、屈折率補正後の径と、補正できたかどうか・逆引きが曖昧だったかどうかのフラグを保持します。 補正は径ラベルだけを変更し、計数は変更しません。
 * </p>
 */
public final class ChannelCorrection {

    private final double[] nominal;

    private final double[] calibrated;

    private final double[] corrected;

    private final boolean[] correctedFlags;

    private final boolean[] ambiguousFlags;

    /**
     * 補正結果を生成します。
     *
     * @param nominal 公称径です
     * @param calibrated 校正後の径です
     * @param corrected 屈折率補正後の径です
     * @param correctedFlags 屈折率補正できたかどうかです
     * @param ambiguousFlags 逆引きが曖昧だったかどうかです
     * @throws IllegalArgumentException 配列長が一致しない場合に発生します
     */
    public ChannelCorrection(double[] nominal, double[] calibrated, double[] corrected,
            boolean[] correctedFlags, boolean[] ambiguousFlags) {
        int n = nominal.length;
        Preconditions.checkArgument(
                calibrated.length == n && corrected.length == n && correctedFlags.length == n
                        && ambiguousFlags.length == n,
                "チャネル補正の配列長が一致しません。n=%s", n);
        this.nominal = nominal.clone();
        this.calibrated = calibrated.clone();
        this.corrected = corrected.clone();
        this.correctedFlags = correctedFlags.clone();
        this.ambiguousFlags = ambiguousFlags.clone();
    }

    /**
     * 補正を行わない（すべて公称径の）結果を返します。
     *
     * @param channels チャネル中心径です
     * @return 補正結果です
     */
    public static ChannelCorrection identity(DiameterGrid channels) {
        double[] d = channels.toArray();
        boolean[] flags = new boolean[d.length];
        Arrays.fill(flags, true);
        return new ChannelCorrection(d, d, d, flags, new boolean[d.length]);
    }

    public int size() {
        return nominal.length;
    }

    public double[] getNominal() {
        return nominal.clone();
    }

    public double[] getCalibrated() {
        return calibrated.clone();
    }

    public double[] getCorrected() {
        return corrected.clone();
    }

    public double nominalAt(int i) {
        return nominal[i];
    }

    public double calibratedAt(int i) {
        return calibrated[i];
    }

    public double correctedAt(int i) {
        return corrected[i];
    }

    public boolean isCorrected(int i) {
        return correctedFlags[i];
    }

    public boolean isAmbiguous(int i) {
        return ambiguousFlags[i];
    }

    /**
     * 屈折率補正できなかったチャネル数を返します。
     *
     * @return チャネル数です
     */
    public int uncorrectedCount() {
        int count = 0;
        for (boolean f : correctedFlags) {
            if (!f) {
                count++;
            }
        }
        return count;
    }

    /**
     * 逆引きが曖昧だったチャネル数を返します。
     *
     * @return チャネル数です
     */
    public int ambiguousCount() {
        int count = 0;
        for (boolean f : ambiguousFlags) {
            if (f) {
                count++;
            }
        }
        return count;
    }
}
