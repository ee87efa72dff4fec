package io.github.yok.dedalo.core.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.dedalo.core.psd.ChannelCorrection;
import io.github.yok.dedalo.core.psd.ConcentrationNormalizer;
import io.github.yok.dedalo.core.psd.FrameAggregator;
import io.github.yok.dedalo.core.psd.PsdSample;
import io.github.yok.dedalo.core.psd.PsdTestFixtures;
import io.github.yok.dedalo.core.psd.RefractiveIndexCompensator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CoincidenceMonitorTest {

    private final CoincidenceMonitor monitor = new CoincidenceMonitor(250, 230, 1.5);

    @Test
    @DisplayName("計数上限は流量と周期に比例し、セル断面積とレーザー厚みに反比例する")
    void threshold() {
        // 10 mL/min = 1e13/60 µm³/s
        double expected = 10.0 * 1e12 / 60.0 / (250 * 230) / 1.5;

        assertEquals(expected, monitor.threshold(10.0, 1.0), expected * 1e-12);
        assertEquals(2.0 * expected, monitor.threshold(10.0, 2.0), expected * 1e-12);
    }

    @Test
    @DisplayName("計数が上限以上のフレームには同時通過の警告が付くが異常にはならない")
    void flagsCoincidence() {
        double limit = monitor.threshold(1e-4, 1.0);
        assertTrue(monitor.exceeds((long) Math.ceil(limit), 1e-4, 1.0));
        assertFalse(monitor.exceeds((long) Math.floor(limit) - 1, 1e-4, 1.0));

        FrameAggregator aggregator = new FrameAggregator(PsdTestFixtures.CHANNELS,
                new RefractiveIndexCompensator(), new ConcentrationNormalizer(),
                PsdTestFixtures.calculator(), new VoltageMonitor(7000, 8000, 2400), monitor, 1.0);
        PsdSample sample = aggregator.aggregate(
                PsdTestFixtures.frameAt(0, 1e-4, 5, (int) Math.ceil(limit) + 1),
                ChannelCorrection.identity(PsdTestFixtures.CHANNELS), 1.0, 1.0);

        assertTrue(sample.hasAlarm(InstrumentAlarm.COINCIDENCE));
        assertFalse(sample.isFaulty());
    }
}
