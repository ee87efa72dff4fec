package io.github.yok.dedalo.core.psd;

import io.github.yok.dedalo.core.frame.ChannelFrame;
import io.github.yok.dedalo.core.lut.DiameterGrid;
import io.github.yok.dedalo.core.session.CoincidenceMonitor;
import io.github.yok.dedalo.core.session.VoltageMonitor;
import java.time.Instant;

/**
 * psd・session のテストで共通に使う部品です。
 */
public final class PsdTestFixtures {

    /**
     * 装置の 32 チャネル（1.0〜7.2 µm、0.2 µm 刻み）です。
     */
    public static final DiameterGrid CHANNELS = DiameterGrid.uniform(1.0, 7.2, 0.2);

    private PsdTestFixtures() {}

    public static DistributionStatisticsCalculator calculator() {
        return new DistributionStatisticsCalculator(0.2, null);
    }

    public static StatisticsEngine engine() {
        return new StatisticsEngine(calculator(), new ConcentrationNormalizer());
    }

    public static FrameAggregator aggregator() {
        return new FrameAggregator(CHANNELS, new RefractiveIndexCompensator(),
                new ConcentrationNormalizer(), calculator(), new VoltageMonitor(7000, 8000, 2400),
                new CoincidenceMonitor(250, 230, 1.5), 1.0);
    }

    /**
     * 正常な電圧のフレームを作ります。
     */
    public static ChannelFrame frame(int index, double flowRate, int... counts) {
        return frame(index, 5000, 3000, flowRate, counts);
    }

    public static ChannelFrame frame(int index, double laserMv, double bufferMv, double flowRate,
            int... counts) {
        int[] full = new int[CHANNELS.size()];
        System.arraycopy(counts, 0, full, 0, Math.min(counts.length, full.length));
        return new ChannelFrame(index, Instant.EPOCH.plusSeconds(index), 1.0, laserMv, bufferMv,
                flowRate, full);
    }

    /**
     * 指定チャネルにだけ計数があるフレームを作ります。
     */
    public static ChannelFrame frameAt(int index, double flowRate, int channel, int count) {
        int[] counts = new int[CHANNELS.size()];
        counts[channel] = count;
        return frame(index, flowRate, counts);
    }

    /**
     * 補正なしで 1 秒分のサンプルに集計します。
     */
    public static PsdSample sample(ChannelFrame frame) {
        return aggregator().aggregate(frame, ChannelCorrection.identity(CHANNELS), 1.0,
                frame.getIndex() + 1.0);
    }
}
