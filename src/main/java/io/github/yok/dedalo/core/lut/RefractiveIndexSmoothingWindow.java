package io.github.yok.dedalo.core.lut;

import com.google.common.base.Preconditions;
import io.github.yok.dedalo.core.mie.RefractiveIndex;
import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;

/**
 * 屈折率の実部から窓幅を決める平滑化設定です。
 *
 * <p>
 * 屈折率と窓幅の対応表を 3 次多項式で最小二乗近似し、指定した屈折率で評価します。 屈折率が高いほど Mie 共鳴の周期が短くなるため、窓幅は
 * 小さくなります。 対応表の窓幅は {@link #REFERENCE_STEP} 刻みの格子を前提とし、他の刻みの格子では同じ径幅になるよう換算します。
 * 対応表の範囲外の屈折率は範囲の端で評価します。
 * </p>
 */
@Slf4j
public final class RefractiveIndexSmoothingWindow implements SmoothingWindowPolicy {

    /**
     * 対応表の窓幅が前提とする格子の刻み [µm] です。
     */
    public static final double REFERENCE_STEP = 0.01;

    /**
     * 既定の対応表の屈折率（実部）です。
     */
    private static final double[] DEFAULT_INDICES = {1.42, 1.46, 1.50, 1.53, 1.58, 1.64};

    /**
     * 既定の対応表の窓幅（格子点数）です。
     */
    private static final double[] DEFAULT_WINDOWS = {200, 180, 147, 145, 125, 115};

    private static final int DEGREE = 3;

    /**
     * 多項式係数（低次から）です。
     */
    private final double[] coefficients;

    private final double minIndex;

    private final double maxIndex;

    /**
     * 既定の対応表で設定を生成します。
     */
    public RefractiveIndexSmoothingWindow() {
        this(DEFAULT_INDICES, DEFAULT_WINDOWS);
    }

    /**
     * 対応表から設定を生成します。
     *
     * @param indices 屈折率（実部、昇順）です
     * @param windows 各屈折率での窓幅（{@link #REFERENCE_STEP} 刻みの格子点数）です
     * @throws IllegalArgumentException 対応表が不正な場合に発生します
     */
    public RefractiveIndexSmoothingWindow(double[] indices, double[] windows) {
        Preconditions.checkArgument(indices.length == windows.length,
                "対応表の長さが一致しません。indices=%s, windows=%s", indices.length, windows.length);
        Preconditions.checkArgument(indices.length > DEGREE,
                "対応表は %s 点以上必要です。size=%s", DEGREE + 1, indices.length);
        for (int i = 1; i < indices.length; i++) {
            Preconditions.checkArgument(indices[i] > indices[i - 1], "屈折率は昇順である必要があります。%s",
                    Arrays.toString(indices));
        }
        this.minIndex = indices[0];
        this.maxIndex = indices[indices.length - 1];
        this.coefficients = fit(indices, windows);
    }

    private static double[] fit(double[] indices, double[] windows) {
        int n = indices.length;
        DMatrixRMaj a = new DMatrixRMaj(n, DEGREE + 1);
        DMatrixRMaj b = new DMatrixRMaj(n, 1);
        for (int i = 0; i < n; i++) {
            double p = 1.0;
            for (int j = 0; j <= DEGREE; j++) {
                a.set(i, j, p);
                p *= indices[i];
            }
            b.set(i, 0, windows[i]);
        }
        LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.leastSquares(n, DEGREE + 1);
        if (!solver.setA(a)) {
            throw new IllegalArgumentException("窓幅の対応表から多項式を求められません: "
                    + Arrays.toString(indices));
        }
        DMatrixRMaj x = new DMatrixRMaj(DEGREE + 1, 1);
        solver.solve(b, x);
        double[] c = new double[DEGREE + 1];
        for (int j = 0; j <= DEGREE; j++) {
            c[j] = x.get(j, 0);
        }
        return c;
    }

    /**
     * 屈折率（実部）での窓幅を {@link #REFERENCE_STEP} 刻みの格子点数で返します。
     *
     * @param realIndex 屈折率の実部です
     * @return 窓幅です（小数を含みます）
     */
    public double referenceWindow(double realIndex) {
        double n = Math.max(minIndex, Math.min(maxIndex, realIndex));
        double value = 0.0;
        for (int j = DEGREE; j >= 0; j--) {
            value = value * n + coefficients[j];
        }
        return Math.max(0.0, value);
    }

    @Override
    public int windowFor(RefractiveIndex index, DiameterGrid grid) {
        double scaled = referenceWindow(index.getReal()) * REFERENCE_STEP / grid.meanStep();
        int window = (int) scaled;
        log.debug("平滑化の窓幅を決めました。n={}、窓幅={}（刻み {} µm）", index.getReal(), window,
                grid.meanStep());
        return window;
    }
}
