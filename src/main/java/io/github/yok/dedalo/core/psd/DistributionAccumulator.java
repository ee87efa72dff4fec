package io.github.yok.dedalo.core.psd;

import com.google.common.base.Preconditions;
import io.github.yok.dedalo.core.session.InstrumentAlarm;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * 複数の {@link PsdSample} を 1 つの分布に積算するクラスです。
 *
 * <p>
 * 計数はチャネルごとに合算し、濃度は通過試料体積の合計で割り直します。 径ラベルは最後に追加したサンプルのチャネル補正を使用します。 スレッドセーフではありません。
 * </p>
 */
public final class DistributionAccumulator {

    private final DistributionStatisticsCalculator calculator;

    private final ConcentrationNormalizer normalizer;

    private long[] counts;

    private ChannelCorrection correction;

    private final Set<InstrumentAlarm> alarms = EnumSet.noneOf(InstrumentAlarm.class);

    private int firstIndex;

    private Instant lastTimestamp;

    private double elapsedSeconds;

    private double acquisitionSeconds;

    private double sampledVolumeMl;

    private int frameCount;

    private double laserSum;

    private double bufferSum;

    /**
     * 積算器を生成します。
     *
     * @param calculator 要約統計の計算ロジックです
     * @param normalizer 濃度換算ロジックです
     */
    public DistributionAccumulator(DistributionStatisticsCalculator calculator,
            ConcentrationNormalizer normalizer) {
        this.calculator = Preconditions.checkNotNull(calculator, "calculator が null です。");
        this.normalizer = Preconditions.checkNotNull(normalizer, "normalizer が null です。");
    }

    /**
     * サンプルを積算します。
     *
     * @param sample サンプルです
     * @throws IllegalArgumentException チャネル数が既存のサンプルと異なる場合に発生します
     */
    public void add(PsdSample sample) {
        Preconditions.checkNotNull(sample, "sample が null です。");
        if (counts == null) {
            counts = new long[sample.channelCount()];
            firstIndex = sample.getIndex();
        }
        Preconditions.checkArgument(counts.length == sample.channelCount(),
                "チャネル数が一致しません。expected=%s, actual=%s", counts.length, sample.channelCount());
        for (int i = 0; i < counts.length; i++) {
            counts[i] += sample.getCount(i);
        }
        correction = sample.getCorrection();
        alarms.addAll(sample.getAlarms());
        lastTimestamp = sample.getTimestamp();
        elapsedSeconds = Math.max(elapsedSeconds, sample.getElapsedSeconds());
        acquisitionSeconds += sample.getAcquisitionSeconds();
        sampledVolumeMl += normalizer.sampledVolume(sample.getFlowRate(),
                sample.getAcquisitionSeconds());
        frameCount += sample.getFrameCount();
        laserSum += sample.getLaserVoltageMv() * sample.getFrameCount();
        bufferSum += sample.getBufferVoltageMv() * sample.getFrameCount();
    }

    public boolean isEmpty() {
        return counts == null;
    }

    public int getFrameCount() {
        return frameCount;
    }

    /**
     * 積算結果を確定したサンプルとして返します。積算器は引き続き使用できます。
     *
     * @return 積算したサンプルです
     * @throws IllegalStateException サンプルが 1 つも積算されていない場合に発生します
     */
    public PsdSample finish() {
        if (isEmpty()) {
            throw new IllegalStateException("積算されたサンプルがありません");
        }
        double[] concentrations = normalizer.perVolume(counts, sampledVolumeMl);
        DistributionStatistics statistics = calculator.calculate(correction.getCorrected(), counts);
        double flowRate = sampledVolumeMl * 60.0 / acquisitionSeconds;
        return new PsdSample(firstIndex, lastTimestamp, elapsedSeconds, acquisitionSeconds,
                frameCount, correction, counts, concentrations, laserSum / frameCount,
                bufferSum / frameCount, flowRate, statistics, alarms);
    }
}
