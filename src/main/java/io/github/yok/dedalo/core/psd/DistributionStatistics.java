package io.github.yok.dedalo.core.psd;

import lombok.Value;

/**
 * 粒子径分布の要約統計です。
 *
 * <p>
 * 計数がない場合、径に関する値は NaN です。
 * </p>
 */
@Value
public class DistributionStatistics {

    /**
     * 対象範囲の計数合計です。
     */
    long totalCount;

    /**
     * 最頻径（計数が最大のチャネルの径）[µm] です。
     */
    double modeDiameter;

    /**
     * チャネル径の算術平均 [µm] です。
     */
    double arithmeticMean;

    /**
     * 算術平均の誤差（チャネル幅/√チャネル数）[µm] です。
     */
    double arithmeticMeanError;

    /**
     * 計数重み付き平均径 [µm] です。
     */
    double weightedMean;

    /**
     * 重み付き平均の誤差（チャネル幅·√Σc²/Σc）[µm] です。
     */
    double weightedMeanError;

    /**
     * チャネル径の母標準偏差 [µm] です。
     */
    double standardDeviation;

    /**
     * 計数重み付きの第 1 四分位径 [µm] です。
     */
    double q1;

    /**
     * 計数重み付きの中央径 [µm] です。
     */
    double median;

    /**
     * 計数重み付きの第 3 四分位径 [µm] です。
     */
    double q3;
}
