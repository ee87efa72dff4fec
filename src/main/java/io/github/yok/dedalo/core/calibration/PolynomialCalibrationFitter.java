package io.github.yok.dedalo.core.calibration;

import com.google.common.base.Preconditions;
import io.github.yok.dedalo.core.exception.CalibrationFitException;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;

/**
 * 最小二乗多項式で校正曲線を求めるクラスです。
 *
 * <p>
 * 数値安定性のため、測定径は参照点の中心と半幅で正規化してから当てはめます。 多項式は評価域（チャネル範囲と参照点範囲の和）で単調性を確認し、
 * 評価域外では端点の傾きで線形に外挿します。
 * </p>
 */
@Slf4j
public final class PolynomialCalibrationFitter implements CalibrationCurveFitter {

    /**
     * 単調性を確認する評価点数です。
     */
    private static final int MONOTONICITY_SAMPLES = 1000;

    /**
     * 多項式の次数です。
     */
    private final int degree;

    /**
     * 評価域の下端 [µm] です。
     */
    private final double domainMin;

    /**
     * 評価域の上端 [µm] です。
     */
    private final double domainMax;

    /**
     * フィッタを生成します。
     *
     * @param degree 多項式の次数です（1 以上）
     * @param domainMin 評価域の下端です
     * @param domainMax 評価域の上端です
     * @throws IllegalArgumentException 次数や評価域が不正な場合に発生します
     */
    public PolynomialCalibrationFitter(int degree, double domainMin, double domainMax) {
        Preconditions.checkArgument(degree >= 1, "次数は 1 以上である必要があります。degree=%s", degree);
        Preconditions.checkArgument(domainMax > domainMin, "評価域が不正です。min=%s, max=%s", domainMin,
                domainMax);
        this.degree = degree;
        this.domainMin = domainMin;
        this.domainMax = domainMax;
    }

    @Override
    public CalibrationCurve fit(List<CalibrationPoint> points) {
        CalibrationPoints.validate(points, degree + 1);
        int n = points.size();

        double first = points.get(0).getMeasured();
        double last = points.get(n - 1).getMeasured();
        double center = 0.5 * (first + last);
        double scale = 0.5 * (last - first);

        // ヴァンデルモンド行列 A と右辺 b を作ります。
        DMatrixRMaj a = new DMatrixRMaj(n, degree + 1);
        DMatrixRMaj b = new DMatrixRMaj(n, 1);
        for (int i = 0; i < n; i++) {
            double s = (points.get(i).getMeasured() - center) / scale;
            double p = 1.0;
            for (int j = 0; j <= degree; j++) {
                a.set(i, j, p);
                p *= s;
            }
            b.set(i, 0, points.get(i).getTrueDiameter());
        }

        LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.leastSquares(n, degree + 1);
        if (!solver.setA(a)) {
            throw new CalibrationFitException("最小二乗問題が特異です（EJML）: degree=" + degree);
        }
        DMatrixRMaj coefficients = new DMatrixRMaj(degree + 1, 1);
        solver.solve(b, coefficients);

        double[] c = new double[degree + 1];
        for (int j = 0; j <= degree; j++) {
            c[j] = coefficients.get(j, 0);
            if (!Double.isFinite(c[j])) {
                throw new CalibrationFitException("多項式係数が有限値ではありません: " + Arrays.toString(c));
            }
        }

        double lo = Math.min(domainMin, first);
        double hi = Math.max(domainMax, last);
        Curve curve = new Curve(c, center, scale, lo, hi);
        curve.checkStrictlyIncreasing();
        log.info("多項式校正曲線を作成しました。次数={}、参照点数={}、評価域=[{}, {}]", degree, n, lo, hi);
        return curve;
    }

    /**
     * 多項式校正曲線です。
     */
    static final class Curve extends AbstractCalibrationCurve {

        private final double[] c;

        private final double center;

        private final double scale;

        private final double lo;

        private final double hi;

        Curve(double[] c, double center, double scale, double lo, double hi) {
            this.c = c;
            this.center = center;
            this.scale = scale;
            this.lo = lo;
            this.hi = hi;
        }

        /**
         * 評価域内の多項式値を返します。
         */
        private double polynomial(double measured) {
            double s = (measured - center) / scale;
            double v = 0.0;
            for (int j = c.length - 1; j >= 0; j--) {
                v = v * s + c[j];
            }
            return v;
        }

        /**
         * 評価域内の多項式の微分値を返します。
         */
        private double derivative(double measured) {
            double s = (measured - center) / scale;
            double v = 0.0;
            for (int j = c.length - 1; j >= 1; j--) {
                v = v * s + j * c[j];
            }
            return v / scale;
        }

        void checkStrictlyIncreasing() {
            for (int i = 0; i <= MONOTONICITY_SAMPLES; i++) {
                double m = lo + (hi - lo) * i / MONOTONICITY_SAMPLES;
                if (!(derivative(m) > 0.0)) {
                    throw new CalibrationFitException(
                            "多項式校正曲線が評価域で狭義単調増加ではありません: measured=" + m);
                }
            }
        }

        @Override
        public double apply(double measured) {
            if (measured < lo) {
                return polynomial(lo) + derivative(lo) * (measured - lo);
            }
            if (measured > hi) {
                return polynomial(hi) + derivative(hi) * (measured - hi);
            }
            return polynomial(measured);
        }

        @Override
        protected double lowerKnot() {
            return lo;
        }

        @Override
        protected double upperKnot() {
            return hi;
        }

        @Override
        public String describe() {
            return "polynomial(degree=" + (c.length - 1) + ")";
        }
    }
}
