package io.github.yok.dedalo.core.session;

import com.google.common.base.Preconditions;
import io.github.yok.dedalo.core.calibration.CalibrationCurve;
import io.github.yok.dedalo.core.frame.CumulativeCountConverter;
import io.github.yok.dedalo.core.frame.FrameRecorder;
import io.github.yok.dedalo.core.lut.DiameterGrid;
import io.github.yok.dedalo.core.lut.LookupTableCache;
import io.github.yok.dedalo.core.lut.MieLookupTable;
import io.github.yok.dedalo.core.mie.RefractiveIndex;
import io.github.yok.dedalo.core.psd.ChannelCorrection;
import io.github.yok.dedalo.core.psd.FrameAggregator;
import io.github.yok.dedalo.core.psd.StatisticsEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 計測ごとに新しい {@link AcquisitionSession} を生成するクラスです。
 *
 * <p>
 * 基準・測定対象の LUT は生成時に同期的に用意します。 LUT を用意できない場合、計測は開始できません。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class AcquisitionSessionFactory {

    private final LookupTableCache cache;

    /**
     * LUT の計算格子です。
     */
    private final DiameterGrid lutGrid;

    private final FrameAggregator aggregator;

    private final StatisticsEngine statisticsEngine;

    /**
     * 基準屈折率（装置の校正材料）です。
     */
    private final RefractiveIndex referenceIndex;

    /**
     * 1 周期の計測時間 [s] です。
     */
    private final double cycleSeconds;

    /**
     * 装置の計数が累積値かどうかです。
     */
    private final boolean cumulativeCounts;

    /**
     * 累積計数のグリッチ閾値です。
     */
    private final long glitchThreshold;

    /**
     * 新しいセッションを生成します。
     *
     * @param targetIndex 測定対象の屈折率です
     * @param calibration 校正曲線です
     * @param recorder 生フレームの記録先です
     * @return セッションです
     * @throws IllegalStateException LUT を構築できない場合に発生します
     */
    public AcquisitionSession open(RefractiveIndex targetIndex, CalibrationCurve calibration,
            FrameRecorder recorder) {
        Preconditions.checkNotNull(targetIndex, "targetIndex が null です。");
        Preconditions.checkNotNull(calibration, "calibration が null です。");
        Preconditions.checkNotNull(recorder, "recorder が null です。");

        MieLookupTable referenceLut;
        MieLookupTable targetLut;
        try {
            referenceLut = cache.get(lutGrid, referenceIndex);
            targetLut = cache.get(lutGrid, targetIndex);
        } catch (RuntimeException e) {
            throw new IllegalStateException("LUT を構築できないため計測を開始できません: " + e.getMessage(), e);
        }

        ChannelCorrection correction = aggregator.getCompensator()
                .compensate(aggregator.getChannels(), calibration, referenceLut, targetLut);
        CompensationTables tables =
                new CompensationTables(targetIndex, referenceLut, targetLut, correction);
        SessionState state =
                new SessionState(calibration, tables, statisticsEngine.newIncremental());
        CumulativeCountConverter converter =
                cumulativeCounts ? new CumulativeCountConverter(glitchThreshold) : null;

        log.info("計測セッションを開始します。基準屈折率={}、対象屈折率={}、校正={}、累積計数={}", referenceIndex,
                targetIndex, calibration.describe(), cumulativeCounts);
        return new AcquisitionSession(state, aggregator, cache, lutGrid, recorder, converter,
                cycleSeconds);
    }
}
