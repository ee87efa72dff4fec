package io.github.yok.dedalo.core.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.dedalo.core.exception.InstrumentFaultException;
import io.github.yok.dedalo.core.exception.InvalidFlowRateException;
import io.github.yok.dedalo.core.frame.ChannelFrame;
import io.github.yok.dedalo.core.frame.FrameRecorder;
import io.github.yok.dedalo.core.frame.FrameSource;
import io.github.yok.dedalo.core.lut.LookupTableBuilder;
import io.github.yok.dedalo.core.lut.LookupTableCache;
import io.github.yok.dedalo.core.mie.BhmieExtinctionCalculator;
import io.github.yok.dedalo.core.psd.PsdSample;
import io.github.yok.dedalo.core.psd.PsdTestFixtures;
import io.github.yok.dedalo.core.psd.SessionStatistics;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AcquisitionLoopTest {

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

    /**
     * 用意したフレームを順に返すフレーム供給元です。
     */
    static final class QueueSource implements FrameSource {

        private final Deque<Object> items = new ArrayDeque<>();

        volatile boolean closed;

        QueueSource(Object... items) {
            for (Object item : items) {
                this.items.add(item);
            }
        }

        @Override
        public synchronized Optional<ChannelFrame> read() {
            Object next = items.poll();
            if (next == null) {
                return Optional.empty();
            }
            if (next instanceof RuntimeException) {
                throw (RuntimeException) next;
            }
            return Optional.of((ChannelFrame) next);
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    /**
     * 無限にフレームを返すフレーム供給元です。
     */
    static final class EndlessSource implements FrameSource {

        private final AtomicInteger index = new AtomicInteger();

        volatile boolean closed;

        @Override
        public Optional<ChannelFrame> read() {
            return Optional.of(PsdTestFixtures.frameAt(index.getAndIncrement(), 10.0, 3, 1));
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    /**
     * 通知を記録するリスナです。
     */
    static final class RecordingListener implements AcquisitionListener {

        final List<PsdSample> samples = new CopyOnWriteArrayList<>();

        final List<InstrumentFaultException> faults = new CopyOnWriteArrayList<>();

        final List<RuntimeException> errors = new CopyOnWriteArrayList<>();

        volatile SessionStatistics stopped;

        @Override
        public void onSample(PsdSample sample) {
            samples.add(sample);
        }

        @Override
        public void onFault(InstrumentFaultException fault) {
            faults.add(fault);
        }

        @Override
        public void onError(RuntimeException error) {
            errors.add(error);
        }

        @Override
        public void onStopped(SessionStatistics statistics) {
            stopped = statistics;
        }
    }

    private static AcquisitionSession newSession() {
        return AcquisitionSessionTest.open(cache, FrameRecorder.NONE);
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("条件が成立しませんでした");
            }
            Thread.sleep(5);
        }
    }

    @Test
    @DisplayName("供給元の終端まで読み出すと停止し、統計を確定して供給元を閉じる")
    void runsToEndOfSource() throws Exception {
        QueueSource source = new QueueSource(PsdTestFixtures.frameAt(0, 10.0, 1, 5),
                PsdTestFixtures.frameAt(1, 10.0, 2, 6), PsdTestFixtures.frameAt(2, 10.0, 3, 7));
        RecordingListener listener = new RecordingListener();
        AcquisitionLoop loop = new AcquisitionLoop(newSession(), source, listener, 0, 3);

        loop.start();

        assertTrue(loop.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(AcquisitionState.STOPPED, loop.getState());
        assertTrue(source.closed);
        assertEquals(3, listener.samples.size());
        assertEquals(18, loop.finalStatistics().orElseThrow().getTotalCount());
        assertEquals(3, listener.stopped.getSampleCount());
        assertThrows(IllegalStateException.class, loop::start);
    }

    @Test
    @DisplayName("電圧異常のフレームは通知したうえで計測を継続する")
    void voltageFaultDoesNotStopLoop() throws Exception {
        QueueSource source = new QueueSource(PsdTestFixtures.frameAt(0, 10.0, 1, 5),
                PsdTestFixtures.frame(1, 8200, 3000, 10.0, 4),
                PsdTestFixtures.frameAt(2, 10.0, 3, 7));
        RecordingListener listener = new RecordingListener();
        AcquisitionLoop loop = new AcquisitionLoop(newSession(), source, listener, 0, 3);

        loop.start();

        assertTrue(loop.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(3, listener.samples.size());
        assertEquals(1, listener.faults.size());
        assertTrue(listener.samples.get(1).isFaulty());
        assertTrue(listener.errors.isEmpty());
    }

    @Test
    @DisplayName("読み出しの連続タイムアウトが上限に達すると計測を停止する")
    void stopsAfterConsecutiveTimeouts() throws Exception {
        InstrumentFaultException timeout =
                new InstrumentFaultException("応答がありません", InstrumentAlarm.SERIAL_TIMEOUT, null);
        QueueSource source = new QueueSource(PsdTestFixtures.frameAt(0, 10.0, 1, 5), timeout,
                PsdTestFixtures.frameAt(1, 10.0, 1, 5), timeout, timeout, timeout,
                PsdTestFixtures.frameAt(2, 10.0, 1, 5));
        RecordingListener listener = new RecordingListener();
        AcquisitionSession session = newSession();
        AcquisitionLoop loop = new AcquisitionLoop(session, source, listener, 0, 3);

        loop.start();

        assertTrue(loop.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(2, listener.samples.size());
        assertEquals(4, listener.faults.size());
        assertTrue(session.getState().alarms().contains(InstrumentAlarm.SERIAL_TIMEOUT));
        assertTrue(source.closed);
    }

    @Test
    @DisplayName("流量が不正なフレームはエラーとして通知し、計測を停止する")
    void invalidFlowRateStopsWithError() throws Exception {
        QueueSource source = new QueueSource(PsdTestFixtures.frameAt(0, 10.0, 1, 5),
                PsdTestFixtures.frameAt(1, 0.0, 1, 5), PsdTestFixtures.frameAt(2, 10.0, 1, 5));
        RecordingListener listener = new RecordingListener();
        AcquisitionLoop loop = new AcquisitionLoop(newSession(), source, listener, 0, 3);

        loop.start();

        assertTrue(loop.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(1, listener.samples.size());
        assertEquals(1, listener.errors.size());
        assertTrue(listener.errors.get(0) instanceof InvalidFlowRateException);
        assertEquals(1, loop.finalStatistics().orElseThrow().getSampleCount());
    }

    @Test
    @DisplayName("一時停止中はフレームを読み出さず、再開後はサンプルを引き継いで計測を続ける")
    void pauseAndResume() throws Exception {
        EndlessSource source = new EndlessSource();
        RecordingListener listener = new RecordingListener();
        AcquisitionSession session = newSession();
        AcquisitionLoop loop = new AcquisitionLoop(session, source, listener, 10, 3);

        loop.start();
        waitUntil(() -> listener.samples.size() >= 2);
        loop.pause();
        assertEquals(AcquisitionState.PAUSED, loop.getState());

        // 一時停止の要求時点で処理中だったフレームが記録されるのを待ちます。
        Thread.sleep(100);
        int paused = session.samples().size();
        Thread.sleep(100);
        assertEquals(paused, session.samples().size());

        loop.resume();
        assertEquals(AcquisitionState.RUNNING, loop.getState());
        waitUntil(() -> session.samples().size() > paused + 1);

        loop.stop();
        assertTrue(loop.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(AcquisitionState.STOPPED, loop.getState());
        assertTrue(source.closed);
        SessionStatistics statistics = loop.finalStatistics().orElseThrow();
        assertEquals(session.samples().size(), statistics.getSampleCount());
        assertTrue(statistics.getSampleCount() > paused);
    }

    @Test
    @DisplayName("開始前に停止すると、その場で供給元を閉じて空の統計を確定する")
    void stopBeforeStart() throws Exception {
        QueueSource source = new QueueSource();
        AcquisitionLoop loop = new AcquisitionLoop(newSession(), source, null, 0, 1);

        loop.stop();

        assertTrue(loop.awaitTermination(1, TimeUnit.SECONDS));
        assertTrue(source.closed);
        assertEquals(0, loop.finalStatistics().orElseThrow().getSampleCount());
        assertFalse(loop.getState() == AcquisitionState.RUNNING);
    }
}
