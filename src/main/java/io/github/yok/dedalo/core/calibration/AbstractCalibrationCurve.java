package io.github.yok.dedalo.core.calibration;

/**
 * 二分法による逆変換を提供する校正曲線の基底クラスです。
 */
public abstract class AbstractCalibrationCurve implements CalibrationCurve {

    /**
     * 逆変換の許容誤差 [µm] です。
     */
    private static final double TOLERANCE = 1e-12;

    private static final int MAX_ITERATIONS = 200;

    /**
     * 逆変換の初期探索区間の下端です。
     *
     * @return 下端 [µm] です
     */
    protected abstract double lowerKnot();

    /**
     * 逆変換の初期探索区間の上端です。
     *
     * @return 上端 [µm] です
     */
    protected abstract double upperKnot();

    /**
     * 真の粒子径から測定径を二分法で逆算します。
     *
     * @param trueDiameter 真の粒子径 [µm] です
     * @return 測定径 [µm] です
     * @throws IllegalArgumentException trueDiameter が有限でない場合に発生します
     */
    @Override
    public double invert(double trueDiameter) {
        if (!Double.isFinite(trueDiameter)) {
            throw new IllegalArgumentException("粒子径は有限値である必要があります: " + trueDiameter);
        }
        double lo = lowerKnot();
        double hi = upperKnot();
        double width = hi - lo;

        // 狭義単調増加かつ外挿は線形のため、区間を広げれば必ず挟み込めます。
        while (apply(lo) > trueDiameter) {
            lo -= width;
            width *= 2.0;
        }
        width = hi - lo;
        while (apply(hi) < trueDiameter) {
            hi += width;
            width *= 2.0;
        }

        for (int i = 0; i < MAX_ITERATIONS && hi - lo > TOLERANCE; i++) {
            double mid = 0.5 * (lo + hi);
            if (apply(mid) < trueDiameter) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return 0.5 * (lo + hi);
    }
}
