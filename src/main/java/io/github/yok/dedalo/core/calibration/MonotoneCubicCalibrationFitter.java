package io.github.yok.dedalo.core.calibration;

import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Fritsch–Carlson の区分 3 次エルミート補間（PCHIP）で校正曲線を求めるクラスです。
 *
 * <p>
 * 曲線は参照点を通り、参照点が狭義単調増加であれば曲線も狭義単調増加になります。 参照点の範囲外では、端の区間の傾き（割線）で線形に外挿します。
 * </p>
 */
@Slf4j
public final class MonotoneCubicCalibrationFitter implements CalibrationCurveFitter {

    @Override
    public CalibrationCurve fit(List<CalibrationPoint> points) {
        CalibrationPoints.validate(points, 2);
        int n = points.size();
        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = points.get(i).getMeasured();
            y[i] = points.get(i).getTrueDiameter();
        }
        double[] slopes = slopes(x, y);
        log.info("PCHIP 校正曲線を作成しました。参照点数={}、範囲=[{}, {}]", n, x[0], x[n - 1]);
        return new Curve(x, y, slopes);
    }

    /**
     * 各節点での微分値を求めます。
     */
    static double[] slopes(double[] x, double[] y) {
        int n = x.length;
        double[] h = new double[n - 1];
        double[] delta = new double[n - 1];
        for (int k = 0; k < n - 1; k++) {
            h[k] = x[k + 1] - x[k];
            delta[k] = (y[k + 1] - y[k]) / h[k];
        }
        double[] d = new double[n];
        if (n == 2) {
            d[0] = delta[0];
            d[1] = delta[0];
            return d;
        }
        for (int k = 1; k < n - 1; k++) {
            if (delta[k - 1] * delta[k] <= 0.0) {
                d[k] = 0.0;
            } else {
                // 重み付き調和平均
                double w1 = 2.0 * h[k] + h[k - 1];
                double w2 = h[k] + 2.0 * h[k - 1];
                d[k] = (w1 + w2) / (w1 / delta[k - 1] + w2 / delta[k]);
            }
        }
        d[0] = edgeSlope(h[0], h[1], delta[0], delta[1]);
        d[n - 1] = edgeSlope(h[n - 2], h[n - 3], delta[n - 2], delta[n - 3]);
        return d;
    }

    /**
     * 端点の微分値を 3 点公式で求め、単調性を保つよう制限します。
     */
    private static double edgeSlope(double h0, double h1, double m0, double m1) {
        double d = ((2.0 * h0 + h1) * m0 - h0 * m1) / (h0 + h1);
        if (Math.signum(d) != Math.signum(m0)) {
            return 0.0;
        }
        if (Math.signum(m0) != Math.signum(m1) && Math.abs(d) > Math.abs(3.0 * m0)) {
            return 3.0 * m0;
        }
        return d;
    }

    /**
     * PCHIP 校正曲線です。
     */
    static final class Curve extends AbstractCalibrationCurve {

        private final double[] x;

        private final double[] y;

        private final double[] d;

        Curve(double[] x, double[] y, double[] d) {
            this.x = x;
            this.y = y;
            this.d = d;
        }

        @Override
        public double apply(double measured) {
            int n = x.length;
            if (measured <= x[0]) {
                double slope = (y[1] - y[0]) / (x[1] - x[0]);
                return y[0] + slope * (measured - x[0]);
            }
            if (measured >= x[n - 1]) {
                double slope = (y[n - 1] - y[n - 2]) / (x[n - 1] - x[n - 2]);
                return y[n - 1] + slope * (measured - x[n - 1]);
            }
            int k = 0;
            while (measured > x[k + 1]) {
                k++;
            }
            double h = x[k + 1] - x[k];
            double t = (measured - x[k]) / h;
            double t2 = t * t;
            double t3 = t2 * t;
            double h00 = 2.0 * t3 - 3.0 * t2 + 1.0;
            double h10 = t3 - 2.0 * t2 + t;
            double h01 = -2.0 * t3 + 3.0 * t2;
            double h11 = t3 - t2;
            return h00 * y[k] + h10 * h * d[k] + h01 * y[k + 1] + h11 * h * d[k + 1];
        }

        @Override
        protected double lowerKnot() {
            return x[0];
        }

        @Override
        protected double upperKnot() {
            return x[x.length - 1];
        }

        @Override
        public String describe() {
            return "pchip(n=" + x.length + ")";
        }
    }
}
