package io.github.yok.dedalo.core.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.dedalo.core.calibration.IdentityCalibrationCurve;
import io.github.yok.dedalo.core.exception.DomainException;
import io.github.yok.dedalo.core.exception.InstrumentFaultException;
import io.github.yok.dedalo.core.exception.InvalidFlowRateException;
import io.github.yok.dedalo.core.frame.ChannelFrame;
import io.github.yok.dedalo.core.frame.FrameRecorder;
import io.github.yok.dedalo.core.lut.DiameterGrid;
import io.github.yok.dedalo.core.lut.LookupTableBuilder;
import io.github.yok.dedalo.core.lut.LookupTableCache;
import io.github.yok.dedalo.core.mie.BhmieExtinctionCalculator;
import io.github.yok.dedalo.core.mie.RefractiveIndex;
import io.github.yok.dedalo.core.psd.PsdSample;
import io.github.yok.dedalo.core.psd.PsdTestFixtures;
import io.github.yok.dedalo.core.psd.SessionStatistics;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AcquisitionSessionTest {

    static final DiameterGrid LUT_GRID = DiameterGrid.uniform(0.5, 10.0, 0.05);

    private static LookupTableCache cache;

    @BeforeAll
    static void createCache() {
        cache = new LookupTableCache(
                new LookupTableBuilder(new BhmieExtinctionCalculator(), 0.670, 1.331, 0), 2);
    }

    @AfterAll
    static void closeCache() {
        cache.close();
    }

    static AcquisitionSessionFactory factory(LookupTableCache cache, boolean cumulative) {
        return new AcquisitionSessionFactory(cache, LUT_GRID, PsdTestFixtures.aggregator(),
                PsdTestFixtures.engine(), RefractiveIndex.POLYSTYRENE, 1.0, cumulative, 2300);
    }

    static AcquisitionSession open(LookupTableCache cache, FrameRecorder recorder) {
        return factory(cache, false).open(RefractiveIndex.POLYSTYRENE,
                IdentityCalibrationCurve.INSTANCE, recorder);
    }

    /**
     * 記録したフレームと close 回数を保持する記録先です。
     */
    static final class ListRecorder implements FrameRecorder {

        final List<ChannelFrame> frames = new ArrayList<>();

        int closed;

        @Override
        public void record(ChannelFrame frame) {
            frames.add(frame);
        }

        @Override
        public void close() {
            closed++;
        }
    }

    @Test
    @DisplayName("フレームを順に集計し、経過時間は周期の累積になる")
    void processesFrames() {
        ListRecorder recorder = new ListRecorder();
        AcquisitionSession session = open(cache, recorder);

        PsdSample first = session.process(PsdTestFixtures.frameAt(0, 10.0, 10, 50));
        PsdSample second = session.process(PsdTestFixtures.frameAt(1, 10.0, 11, 30));

        assertEquals(1.0, first.getElapsedSeconds());
        assertEquals(2.0, second.getElapsedSeconds());
        assertEquals(2, session.samples().size());
        assertEquals(80, session.statistics().getTotalCount());
        assertEquals(2, recorder.frames.size());
    }

    @Test
    @DisplayName("レーザー電圧 8200 mV のフレームは集計したうえで InstrumentFaultException を送出する")
    void laserFaultRaisesAfterAggregation() {
        AcquisitionSession session = open(cache, FrameRecorder.NONE);
        ChannelFrame frame = PsdTestFixtures.frame(0, 8200, 3000, 10.0, 5, 5);

        InstrumentFaultException e =
                assertThrows(InstrumentFaultException.class, () -> session.process(frame));

        assertTrue(e.getFaults().contains(InstrumentAlarm.LASER_DIODE_FAULT));
        assertTrue(e.getSample().isPresent());
        assertTrue(e.getSample().get().isFaulty());
        assertEquals(1, session.samples().size());
        assertEquals(10, session.statistics().getTotalCount());
        assertTrue(session.getState().alarms().contains(InstrumentAlarm.LASER_DIODE_FAULT));
    }

    @Test
    @DisplayName("流量 0 のフレームは InvalidFlowRateException で、記録も集計もしない")
    void zeroFlowRateLeavesNoTrace() {
        ListRecorder recorder = new ListRecorder();
        AcquisitionSession session = open(cache, recorder);

        assertThrows(InvalidFlowRateException.class,
                () -> session.process(PsdTestFixtures.frame(0, 0.0, 1, 2, 3)));

        assertTrue(recorder.frames.isEmpty());
        assertTrue(session.samples().isEmpty());
        assertEquals(0, session.statistics().getSampleCount());
    }

    @Test
    @DisplayName("終了すると記録先を 1 回だけ閉じ、以降のフレームは受け付けない")
    void finishClosesRecorderOnce() {
        ListRecorder recorder = new ListRecorder();
        AcquisitionSession session = open(cache, recorder);
        session.process(PsdTestFixtures.frameAt(0, 10.0, 3, 7));

        SessionStatistics first = session.finish();
        SessionStatistics second = session.finish();

        assertEquals(1, recorder.closed);
        assertSame(first, second);
        assertEquals(7, first.getTotalCount());
        assertThrows(IllegalStateException.class,
                () -> session.process(PsdTestFixtures.frameAt(1, 10.0, 3, 7)));
    }

    @Test
    @DisplayName("屈折率を変更すると補正テーブルが丸ごと差し替わる")
    void selectRefractiveIndexSwapsTables() throws Exception {
        AcquisitionSession session = open(cache, FrameRecorder.NONE);
        CompensationTables before = session.getState().activeTables();
        RefractiveIndex silica = new RefractiveIndex(1.45, 0.0);

        CompensationTables after =
                session.selectRefractiveIndex(silica).get(30, TimeUnit.SECONDS);

        assertSame(after, session.getState().activeTables());
        assertEquals(silica, after.getTargetIndex());
        assertSame(before.getReferenceLut(), after.getReferenceLut());
        assertNotEquals(before.getCorrection().correctedAt(0),
                after.getCorrection().correctedAt(0));

        PsdSample sample = session.process(PsdTestFixtures.frameAt(0, 10.0, 0, 1));
        assertSame(after.getCorrection(), sample.getCorrection());
    }

    @Test
    @DisplayName("構築の遅い屈折率を先に選んでも、後から選んだ屈折率の補正テーブルが残る")
    void latestSelectionWinsOverSlowerBuild() throws Exception {
        BhmieExtinctionCalculator bhmie = new BhmieExtinctionCalculator();
        CountDownLatch release = new CountDownLatch(1);
        RefractiveIndex slow = new RefractiveIndex(1.40, 0.0);
        RefractiveIndex fast = new RefractiveIndex(1.60, 0.0);
        try (LookupTableCache gated = new LookupTableCache(new LookupTableBuilder(
                (d, wavelength, medium, index) -> {
                    if (index.equals(slow)) {
                        awaitUninterruptibly(release);
                    }
                    return bhmie.efficiency(d, wavelength, medium, index);
                }, 0.670, 1.331, 0), 2)) {
            gated.get(LUT_GRID, fast);
            AcquisitionSession session = open(gated, FrameRecorder.NONE);

            CompletableFuture<CompensationTables> first = session.selectRefractiveIndex(slow);
            CompensationTables second =
                    session.selectRefractiveIndex(fast).get(30, TimeUnit.SECONDS);
            assertEquals(fast, session.getState().activeTables().getTargetIndex());

            release.countDown();
            CompensationTables stale = first.get(30, TimeUnit.SECONDS);

            assertSame(second, session.getState().activeTables());
            assertSame(second, stale);
            assertEquals(fast, session.getState().activeTables().getTargetIndex());
        }
    }

    @Test
    @DisplayName("計数合計が統計の上限以上のフレームは拒否し、サンプルと統計は変わらない")
    void oversizedFrameLeavesStatisticsUntouched() {
        AcquisitionSession session = open(cache, FrameRecorder.NONE);
        session.process(PsdTestFixtures.frameAt(0, 10.0, 3, 100));

        assertThrows(IllegalArgumentException.class,
                () -> session.process(PsdTestFixtures.frameAt(1, 10.0, 3, 17_000_000)));

        assertEquals(1, session.samples().size());
        SessionStatistics statistics = session.statistics();
        assertEquals(1, statistics.getSampleCount());
        assertEquals(100, statistics.getTotalCount());
        PsdSample next = session.process(PsdTestFixtures.frameAt(2, 10.0, 3, 50));
        assertEquals(2.0, next.getElapsedSeconds());
        assertEquals(2, session.statistics().getSampleCount());
    }

    @Test
    @DisplayName("累積計数モードでは差分に変換してから集計する")
    void cumulativeCountsAreDecoded() {
        AcquisitionSession session = factory(cache, true).open(RefractiveIndex.POLYSTYRENE,
                IdentityCalibrationCurve.INSTANCE, FrameRecorder.NONE);

        session.process(PsdTestFixtures.frameAt(0, 10.0, 4, 10));
        PsdSample second = session.process(PsdTestFixtures.frameAt(1, 10.0, 4, 25));

        assertEquals(15, second.getCount(4));
        assertEquals(25, session.statistics().getTotalCount());
    }

    @Test
    @DisplayName("LUT を構築できない場合はセッションを開始できない")
    void cannotOpenWithoutLut() {
        try (LookupTableCache failing = new LookupTableCache(new LookupTableBuilder(
                (d, wavelength, medium, index) -> {
                    throw new DomainException("計算できません");
                }, 0.670, 1.331, 0), 1)) {
            AcquisitionSessionFactory factory = factory(failing, false);

            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> factory.open(RefractiveIndex.POLYSTYRENE,
                            IdentityCalibrationCurve.INSTANCE, FrameRecorder.NONE));
            assertTrue(e.getCause() instanceof DomainException);
        }
    }

    private static void awaitUninterruptibly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
