package io.github.yok.dedalo.core.psd;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 複数の計測を、計数合計で正規化したヒストグラムで比較するクラスです。
 *
 * <p>
 * 計測時間フィルタが正の場合、計測開始からその秒数までのサンプルだけを使用します（0 の場合は全サンプル）。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class DistributionComparator {

    private final ConcentrationNormalizer normalizer;

    /**
     * 計測ごとの正規化ヒストグラムを作ります。
     *
     * @param recordings 表示名から時刻順サンプル列への対応（順序を保持します）です
     * @param acquisitionTimeFilterSeconds 計測時間フィルタ [s] です（0 で全サンプル）
     * @return 比較結果です
     * @throws IllegalArgumentException フィルタが負の場合、またはフィルタ後の計数が 0 の計測がある場合に発生します
     */
    public List<ComparisonEntry> compare(Map<String, List<PsdSample>> recordings,
            double acquisitionTimeFilterSeconds) {
        Preconditions.checkNotNull(recordings, "recordings が null です。");
        Preconditions.checkArgument(acquisitionTimeFilterSeconds >= 0.0,
                "計測時間フィルタは 0 以上である必要があります。filter=%s", acquisitionTimeFilterSeconds);

        List<ComparisonEntry> entries = new ArrayList<>();
        for (Map.Entry<String, List<PsdSample>> e : recordings.entrySet()) {
            long[] counts = null;
            ChannelCorrection correction = null;
            int used = 0;
            for (PsdSample s : e.getValue()) {
                if (acquisitionTimeFilterSeconds > 0.0
                        && s.getElapsedSeconds() > acquisitionTimeFilterSeconds) {
                    continue;
                }
                if (counts == null) {
                    counts = new long[s.channelCount()];
                }
                for (int i = 0; i < counts.length; i++) {
                    counts[i] += s.getCount(i);
                }
                correction = s.getCorrection();
                used++;
            }
            Preconditions.checkArgument(counts != null, "比較対象のサンプルがありません。label=%s",
                    e.getKey());
            double[] normalized = normalizer.normalizeForComparison(counts);
            long total = 0;
            for (long c : counts) {
                total += c;
            }
            log.info("比較用ヒストグラムを作成しました。label={}、サンプル数={}、計数合計={}", e.getKey(), used, total);
            entries.add(new ComparisonEntry(e.getKey(), correction.getCorrected(), normalized,
                    total, used));
        }
        return entries;
    }
}
