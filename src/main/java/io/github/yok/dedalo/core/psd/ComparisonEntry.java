package io.github.yok.dedalo.core.psd;

import com.google.common.primitives.Doubles;
import java.util.List;
import lombok.Value;

/**
 * 複数ファイル比較での 1 ファイル分の正規化ヒストグラムです。
 */
@Value
public class ComparisonEntry {

    /**
     * 表示名（ファイル名など）です。
     */
    String label;

    /**
     * チャネル径（補正後）[µm] です。
     */
    List<Double> diameters;

    /**
     * 合計が 1 になるよう正規化した計数です。
     */
    List<Double> normalized;

    /**
     * 比較に使用した計数合計です。
     */
    long totalCount;

    /**
     * 比較に使用したサンプル数です。
     */
    int sampleCount;

    /**
     * 比較結果を生成します。
     *
     * @param label 表示名です
     * @param diameters チャネル径です
     * @param normalized 正規化した計数です
     * @param totalCount 計数合計です
     * @param sampleCount サンプル数です
     */
    public ComparisonEntry(String label, double[] diameters, double[] normalized,
            long totalCount, int sampleCount) {
        this.label = label;
        this.diameters = List.copyOf(Doubles.asList(diameters));
        this.normalized = List.copyOf(Doubles.asList(normalized));
        this.totalCount = totalCount;
        this.sampleCount = sampleCount;
    }
}
