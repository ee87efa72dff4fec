package io.github.yok.dedalo.core.lut;

import com.google.common.base.Preconditions;
import io.github.yok.dedalo.core.exception.OutOfRangeException;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * 粒子径格子上で事前計算した Mie 消光断面積の表（LUT）です。
 *
 * <p>
 * 順引き {@link #crossSectionAt(double)} は生の断面積を線形補間し、逆引き {@link #invert(double, double)}
 * は（設定されていれば平滑化した）逆引き曲線を使用します。 インスタンスは不変で、スレッド間で共有できます。
 * </p>
 */
public final class MieLookupTable {

    /**
     * 同一とみなす逆引き解の距離 [µm] です。
     */
    private static final double ROOT_TOLERANCE = 1e-9;

    /**
     * キャッシュキーです。
     */
    @Getter
    private final LookupTableKey key;

    private final double[] diameters;

    private final double[] efficiencies;

    private final double[] crossSections;

    /**
     * 逆引きに使用する断面積曲線です。
     */
    private final double[] inversionCurve;

    /**
     * 逆引き曲線で単調増加でない区間の数です。
     */
    @Getter
    private final int nonMonotonicIntervalCount;

    /**
     * LUT を生成します。
     *
     * @param key キャッシュキーです
     * @param diameters 粒子径格子です
     * @param efficiencies 消光効率です
     * @param crossSections 消光断面積です
     * @param inversionCurve 逆引き曲線です
     * @throws IllegalArgumentException 配列長が一致しない場合に発生します
     */
    public MieLookupTable(LookupTableKey key, DiameterGrid diameters, double[] efficiencies,
            double[] crossSections, double[] inversionCurve) {
        Preconditions.checkNotNull(key, "key が null です。");
        Preconditions.checkNotNull(diameters, "diameters が null です。");
        int n = diameters.size();
        Preconditions.checkArgument(
                efficiencies.length == n && crossSections.length == n
                        && inversionCurve.length == n,
                "LUT の配列長が格子点数と一致しません。n=%s", n);
        this.key = key;
        this.diameters = diameters.toArray();
        this.efficiencies = efficiencies.clone();
        this.crossSections = crossSections.clone();
        this.inversionCurve = inversionCurve.clone();
        int count = 0;
        for (int i = 0; i + 1 < n; i++) {
            if (this.inversionCurve[i + 1] <= this.inversionCurve[i]) {
                count++;
            }
        }
        this.nonMonotonicIntervalCount = count;
    }

    /**
     * 格子点数を返します。
     *
     * @return 格子点数です
     */
    public int size() {
        return diameters.length;
    }

    public double minDiameter() {
        return diameters[0];
    }

    public double maxDiameter() {
        return diameters[diameters.length - 1];
    }

    public double diameterAt(int i) {
        return diameters[i];
    }

    public double efficiencyAt(int i) {
        return efficiencies[i];
    }

    public double crossSectionAtIndex(int i) {
        return crossSections[i];
    }

    public double inversionCurveAt(int i) {
        return inversionCurve[i];
    }

    /**
     * 逆引き曲線が狭義単調増加かどうかを返します。
     *
     * @return 狭義単調増加の場合は true です
     */
    public boolean isMonotonic() {
        return nonMonotonicIntervalCount == 0;
    }

    /**
     * 粒子径に対する消光断面積を線形補間で返します。
     *
     * @param diameter 粒子径 [µm] です
     * @return 消光断面積 [µm²] です
     * @throws OutOfRangeException 粒子径が格子範囲外の場合に発生します
     */
    public double crossSectionAt(double diameter) {
        if (!(diameter >= minDiameter() && diameter <= maxDiameter())) {
            throw new OutOfRangeException("粒子径", diameter, minDiameter(), maxDiameter());
        }
        int i = lowerIndex(diameter);
        if (i == diameters.length - 1) {
            return crossSections[i];
        }
        double t = (diameter - diameters[i]) / (diameters[i + 1] - diameters[i]);
        return crossSections[i] + t * (crossSections[i + 1] - crossSections[i]);
    }

    /**
     * 消光断面積から粒子径を逆引きします。
     *
     * <p>
     * 断面積を挟むすべての格子区間で線形補間により解を求め、複数ある場合は参照径に最も近い解を採用します。
     * </p>
     *
     * @param crossSection 消光断面積 [µm²] です
     * @param hintDiameter 参照径（校正後の測定径）[µm] です
     * @return 逆引き結果です
     * @throws OutOfRangeException 断面積が逆引き曲線の値域外の場合に発生します
     */
    public DiameterInversion invert(double crossSection, double hintDiameter) {
        List<Double> roots = new ArrayList<>();
        if (Double.isFinite(crossSection)) {
            for (int i = 0; i + 1 < diameters.length; i++) {
                double c0 = inversionCurve[i];
                double c1 = inversionCurve[i + 1];
                if (crossSection < Math.min(c0, c1) || crossSection > Math.max(c0, c1)) {
                    continue;
                }
                double root;
                if (c1 == c0) {
                    root = 0.5 * (diameters[i] + diameters[i + 1]);
                } else {
                    double t = (crossSection - c0) / (c1 - c0);
                    root = diameters[i] + t * (diameters[i + 1] - diameters[i]);
                }
                addDistinct(roots, root);
            }
        }
        if (roots.isEmpty()) {
            throw new OutOfRangeException("消光断面積", crossSection, minInversionValue(),
                    maxInversionValue());
        }
        double best = roots.get(0);
        for (double r : roots) {
            if (Math.abs(r - hintDiameter) < Math.abs(best - hintDiameter)) {
                best = r;
            }
        }
        return new DiameterInversion(best, roots.size() > 1, roots);
    }

    private static void addDistinct(List<Double> roots, double root) {
        if (roots.isEmpty() || Math.abs(roots.get(roots.size() - 1) - root) > ROOT_TOLERANCE) {
            roots.add(root);
        }
    }

    private double minInversionValue() {
        double min = Double.POSITIVE_INFINITY;
        for (double v : inversionCurve) {
            min = Math.min(min, v);
        }
        return min;
    }

    private double maxInversionValue() {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : inversionCurve) {
            max = Math.max(max, v);
        }
        return max;
    }

    /**
     * diameters[i] <= d を満たす最大の i を二分探索で返します。
     */
    private int lowerIndex(double d) {
        int lo = 0;
        int hi = diameters.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (diameters[mid] <= d) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }
}
