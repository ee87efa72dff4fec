package io.github.yok.dedalo.core.session;

import com.google.common.base.Preconditions;
import lombok.Getter;

/**
 * 1 周期の計数が単一粒子計測の上限を超えていないかを判定するクラスです。
 *
 * <p>
 * 上限は、1 周期に計測セルを通過する試料の長さをレーザー光の厚みで割った値です。 流量 Q [mL/min] は 10^11/6 倍すると µm³/s になります。
 * </p>
 */
@Getter
public final class CoincidenceMonitor {

    /**
     * 1 mL/min を µm³/s に換算する係数です。
     */
    private static final double ML_PER_MIN_TO_UM3_PER_S = 1e11 / 6.0;

    /**
     * 計測セルの幅 [µm] です。
     */
    private final double cellWidthUm;

    /**
     * 計測セルの奥行き [µm] です。
     */
    private final double cellDepthUm;

    /**
     * レーザー光の厚み [µm] です。
     */
    private final double laserWaistUm;

    /**
     * 監視器を生成します。
     *
     * @param cellWidthUm セル幅 [µm] です
     * @param cellDepthUm セル奥行き [µm] です
     * @param laserWaistUm レーザー光の厚み [µm] です
     * @throws IllegalArgumentException 寸法が正でない場合に発生します
     */
    public CoincidenceMonitor(double cellWidthUm, double cellDepthUm, double laserWaistUm) {
        Preconditions.checkArgument(cellWidthUm > 0.0 && cellDepthUm > 0.0 && laserWaistUm > 0.0,
                "セル寸法は正である必要があります。width=%s, depth=%s, waist=%s", cellWidthUm, cellDepthUm,
                laserWaistUm);
        this.cellWidthUm = cellWidthUm;
        this.cellDepthUm = cellDepthUm;
        this.laserWaistUm = laserWaistUm;
    }

    /**
     * 1 周期あたりの計数上限を返します。
     *
     * @param flowRate 流量 [mL/min] です
     * @param cycleSeconds 周期 [s] です
     * @return 計数上限です
     */
    public double threshold(double flowRate, double cycleSeconds) {
        double volumetric = flowRate * ML_PER_MIN_TO_UM3_PER_S;
        double speed = volumetric / (cellWidthUm * cellDepthUm);
        double pumpedLength = speed * cycleSeconds;
        return pumpedLength / laserWaistUm;
    }

    /**
     * 計数が上限以上かどうかを判定します。
     *
     * @param countsPerCycle 1 周期の計数です
     * @param flowRate 流量 [mL/min] です
     * @param cycleSeconds 周期 [s] です
     * @return 上限以上の場合は true です
     */
    public boolean exceeds(long countsPerCycle, double flowRate, double cycleSeconds) {
        return countsPerCycle >= threshold(flowRate, cycleSeconds);
    }
}
