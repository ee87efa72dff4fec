package io.github.yok.dedalo.core.psd;

import com.google.common.base.Preconditions;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * サンプル列の統計を計算するクラスです。
 *
 * <p>
 * {@link #summarize} は毎回最初から計算します。 ライブ計測では {@link #newIncremental()} の更新器を使用します。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class StatisticsEngine {

    private final DistributionStatisticsCalculator calculator;

    private final ConcentrationNormalizer normalizer;

    /**
     * サンプル列（時間窓で絞り込み可）の統計を計算します。
     *
     * @param samples 時刻順のサンプル列です
     * @param window 時間窓です（空の場合は全サンプル）
     * @return 統計です
     */
    public SessionStatistics summarize(List<PsdSample> samples, Optional<TimeWindow> window) {
        Preconditions.checkNotNull(samples, "samples が null です。");
        List<PsdSample> selected = window
                .map(w -> samples.stream().filter(s -> w.contains(s.getElapsedSeconds()))
                        .collect(Collectors.toList()))
                .orElse(samples);
        if (selected.isEmpty()) {
            log.debug("統計対象のサンプルがありません。window={}", window.orElse(null));
            return SessionStatistics.empty();
        }

        DistributionAccumulator accumulator = new DistributionAccumulator(calculator, normalizer);
        long[] totals = new long[selected.size()];
        double seconds = 0.0;
        for (int i = 0; i < totals.length; i++) {
            PsdSample s = selected.get(i);
            accumulator.add(s);
            totals[i] = s.getTotalCount();
            seconds += s.getAcquisitionSeconds();
        }
        return new SessionStatistics(selected.size(), accumulator.finish(),
                TimeSeriesStatistics.compute(totals, seconds));
    }

    /**
     * 全サンプルの統計を計算します。
     *
     * @param samples 時刻順のサンプル列です
     * @return 統計です
     */
    public SessionStatistics summarize(List<PsdSample> samples) {
        return summarize(samples, Optional.empty());
    }

    /**
     * 逐次更新用の統計器を生成します。
     *
     * @return 統計器です
     */
    public IncrementalStatistics newIncremental() {
        return new IncrementalStatistics(calculator, normalizer);
    }
}
