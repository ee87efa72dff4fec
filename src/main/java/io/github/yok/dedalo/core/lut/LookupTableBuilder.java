package io.github.yok.dedalo.core.lut;

import com.google.common.base.Preconditions;
import io.github.yok.dedalo.core.mie.MieExtinctionCalculator;
import io.github.yok.dedalo.core.mie.RefractiveIndex;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 粒子径格子上で Mie 消光断面積を評価し、{@link MieLookupTable} を構築するクラスです。
 */
@Slf4j
@Getter
public final class LookupTableBuilder {

    /**
     * 消光断面積の計算ロジックです。
     */
    private final MieExtinctionCalculator calculator;

    /**
     * 真空中の波長 [µm] です。
     */
    private final double wavelength;

    /**
     * 媒質の屈折率です。
     */
    private final double mediumIndex;

    /**
     * 逆引き曲線の移動平均窓幅を決める設定です。
     */
    private final SmoothingWindowPolicy smoothing;

    /**
     * 構築設定を生成します。
     *
     * @param calculator 消光断面積の計算ロジックです
     * @param wavelength 真空中の波長 [µm] です
     * @param mediumIndex 媒質の屈折率です
     * @param smoothing 移動平均窓幅の設定です
     */
    public LookupTableBuilder(MieExtinctionCalculator calculator, double wavelength,
            double mediumIndex, SmoothingWindowPolicy smoothing) {
        this.calculator = Preconditions.checkNotNull(calculator, "calculator が null です。");
        this.wavelength = wavelength;
        this.mediumIndex = mediumIndex;
        this.smoothing = Preconditions.checkNotNull(smoothing, "smoothing が null です。");
    }

    /**
     * 屈折率によらず一定の窓幅で平滑化する構築設定を生成します。
     *
     * @param calculator 消光断面積の計算ロジックです
     * @param wavelength 真空中の波長 [µm] です
     * @param mediumIndex 媒質の屈折率です
     * @param smoothingWindow 移動平均窓幅です（0 または 1 で平滑化なし）
     */
    public LookupTableBuilder(MieExtinctionCalculator calculator, double wavelength,
            double mediumIndex, int smoothingWindow) {
        this(calculator, wavelength, mediumIndex, new FixedSmoothingWindow(smoothingWindow));
    }

    /**
     * この構築設定でのキャッシュキーを返します。
     *
     * @param grid 計算格子です
     * @param index 粒子の屈折率です
     * @return キャッシュキーです
     */
    public LookupTableKey keyOf(DiameterGrid grid, RefractiveIndex index) {
        return new LookupTableKey(index, wavelength, mediumIndex, grid.signature(),
                smoothing.windowFor(index, grid));
    }

    /**
     * LUT を構築します。
     *
     * @param grid 計算格子です
     * @param index 粒子の屈折率です
     * @return 構築した LUT です
     * @throws io.github.yok.dedalo.core.exception.DomainException 波長・屈折率が不正な場合に発生します
     */
    public MieLookupTable build(DiameterGrid grid, RefractiveIndex index) {
        Preconditions.checkNotNull(grid, "格子が null です。");
        Preconditions.checkNotNull(index, "屈折率が null です。");

        long start = System.nanoTime();
        int n = grid.size();
        double[] efficiencies = new double[n];
        double[] crossSections = new double[n];
        for (int i = 0; i < n; i++) {
            double d = grid.get(i);
            efficiencies[i] = calculator.efficiency(d, wavelength, mediumIndex, index);
            crossSections[i] = efficiencies[i] * Math.PI * d * d / 4.0;
        }
        LookupTableKey key = keyOf(grid, index);
        double[] inversionCurve =
                MovingAverageSmoother.smooth(crossSections, key.getSmoothingWindow());

        MieLookupTable table = new MieLookupTable(key, grid, efficiencies,
                crossSections, inversionCurve);
        double elapsedMs = (System.nanoTime() - start) / 1e6;
        log.info("LUT を構築しました。n={}、k={}、格子={}、窓幅={}、所要時間={} ms、非単調区間数={}",
                index.getReal(), index.getImaginary(), grid, key.getSmoothingWindow(),
                String.format(Locale.ROOT, "%.1f", elapsedMs), table.getNonMonotonicIntervalCount());
        return table;
    }
}
