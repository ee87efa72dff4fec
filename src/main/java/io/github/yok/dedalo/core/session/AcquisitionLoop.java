package io.github.yok.dedalo.core.session;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.dedalo.core.exception.InstrumentFaultException;
import io.github.yok.dedalo.core.frame.ChannelFrame;
import io.github.yok.dedalo.core.frame.FrameSource;
import io.github.yok.dedalo.core.psd.PsdSample;
import io.github.yok.dedalo.core.psd.SessionStatistics;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * 専用スレッドでフレームを読み出し、{@link AcquisitionSession} に渡す計測ループです。
 *
 * <p>
 * 一時停止・停止はフレーム読み出しの境界でのみ反映されます。 周期ペーシングが有効な場合、1 周期の残り時間はループのモニタ上で待機するため、
 * 停止・一時停止の要求ですぐに起床します。 終了時は、どの経路でも統計を確定し、フレーム供給元と記録先を閉じます。
 * </p>
 */
@Slf4j
public final class AcquisitionLoop {

    private static final ThreadFactory THREAD_FACTORY =
            new ThreadFactoryBuilder().setNameFormat("acquisition-%d").setDaemon(true).build();

    private final AcquisitionSession session;

    private final FrameSource source;

    private final AcquisitionListener listener;

    /**
     * 1 周期の長さ [ms] です（0 の場合はペーシングしません）。
     */
    private final long cyclePeriodMillis;

    /**
     * 計測を止める連続タイムアウト回数です。
     */
    private final int maxConsecutiveTimeouts;

    private final Object monitor = new Object();

    private final CountDownLatch terminated = new CountDownLatch(1);

    private AcquisitionState state = AcquisitionState.IDLE;

    private volatile SessionStatistics finalStatistics;

    /**
     * 計測ループを生成します。
     *
     * @param session 計測セッションです
     * @param source フレーム供給元です（ループが閉じます）
     * @param listener 通知先です
     * @param cyclePeriodMillis 1 周期の長さ [ms] です（0 でペーシングなし）
     * @param maxConsecutiveTimeouts 計測を止める連続タイムアウト回数です（1 以上）
     */
    public AcquisitionLoop(AcquisitionSession session, FrameSource source,
            AcquisitionListener listener, long cyclePeriodMillis, int maxConsecutiveTimeouts) {
        Preconditions.checkArgument(cyclePeriodMillis >= 0, "周期は 0 以上である必要があります。period=%s",
                cyclePeriodMillis);
        Preconditions.checkArgument(maxConsecutiveTimeouts >= 1,
                "連続タイムアウト回数は 1 以上である必要があります。max=%s", maxConsecutiveTimeouts);
        this.session = Preconditions.checkNotNull(session);
        this.source = Preconditions.checkNotNull(source);
        this.listener = listener != null ? listener : AcquisitionListener.NONE;
        this.cyclePeriodMillis = cyclePeriodMillis;
        this.maxConsecutiveTimeouts = maxConsecutiveTimeouts;
    }

    /**
     * 計測を開始します。
     *
     * @throws IllegalStateException IDLE 以外の状態で呼び出した場合に発生します
     */
    public void start() {
        synchronized (monitor) {
            if (state != AcquisitionState.IDLE) {
                throw new IllegalStateException("計測は開始済みです: state=" + state);
            }
            state = AcquisitionState.RUNNING;
        }
        THREAD_FACTORY.newThread(this::run).start();
        log.info("計測ループを開始しました。");
    }

    /**
     * 計測を一時停止します。RUNNING 以外では何もしません。
     */
    public void pause() {
        synchronized (monitor) {
            if (state == AcquisitionState.RUNNING) {
                state = AcquisitionState.PAUSED;
                monitor.notifyAll();
                log.info("計測を一時停止しました。");
            }
        }
    }

    /**
     * 計測を再開します。PAUSED 以外では何もしません。
     */
    public void resume() {
        synchronized (monitor) {
            if (state == AcquisitionState.PAUSED) {
                state = AcquisitionState.RUNNING;
                monitor.notifyAll();
                log.info("計測を再開しました。");
            }
        }
    }

    /**
     * 計測を停止します。開始前に呼び出した場合は、その場で統計を確定して資源を解放します。
     */
    public void stop() {
        boolean neverStarted;
        synchronized (monitor) {
            if (state == AcquisitionState.STOPPED) {
                return;
            }
            neverStarted = state == AcquisitionState.IDLE;
            state = AcquisitionState.STOPPED;
            monitor.notifyAll();
        }
        if (neverStarted) {
            try {
                source.close();
            } finally {
                finalStatistics = session.finish();
                terminated.countDown();
            }
        }
        log.info("計測の停止を要求しました。");
    }

    public AcquisitionState getState() {
        synchronized (monitor) {
            return state;
        }
    }

    /**
     * 計測スレッドの終了を待ちます。
     *
     * @param timeout 待機時間です
     * @param unit 時間の単位です
     * @return 終了した場合は true です
     * @throws InterruptedException 待機中に割り込まれた場合に発生します
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    /**
     * 確定した統計を返します。
     *
     * @return 統計です（終了前は空）
     */
    public Optional<SessionStatistics> finalStatistics() {
        return Optional.ofNullable(finalStatistics);
    }

    private void run() {
        int consecutiveTimeouts = 0;
        try (FrameSource frames = source) {
            while (awaitRunnable()) {
                long started = System.nanoTime();
                Optional<ChannelFrame> frame;
                try {
                    frame = frames.read();
                    consecutiveTimeouts = 0;
                } catch (InstrumentFaultException e) {
                    consecutiveTimeouts++;
                    e.getFaults().forEach(session.getState()::raise);
                    log.warn("フレームを読み出せませんでした。連続回数={}/{}、{}", consecutiveTimeouts,
                            maxConsecutiveTimeouts, e.getMessage());
                    listener.onFault(e);
                    if (consecutiveTimeouts >= maxConsecutiveTimeouts) {
                        log.error("連続タイムアウト回数が上限に達したため計測を停止します。");
                        break;
                    }
                    continue;
                }
                if (frame.isEmpty()) {
                    log.info("フレーム供給元の終端に達しました。");
                    break;
                }
                try {
                    PsdSample sample = session.process(frame.get());
                    listener.onSample(sample);
                } catch (InstrumentFaultException e) {
                    log.error("{}", e.getMessage());
                    e.getSample().ifPresent(listener::onSample);
                    listener.onFault(e);
                }
                pace(started);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("計測スレッドが割り込まれました。");
        } catch (RuntimeException e) {
            log.error("計測中に予期しない例外が発生しました。", e);
            listener.onError(e);
        } finally {
            synchronized (monitor) {
                state = AcquisitionState.STOPPED;
                monitor.notifyAll();
            }
            finalStatistics = session.finish();
            terminated.countDown();
            listener.onStopped(finalStatistics);
        }
    }

    /**
     * 一時停止中は再開まで待ち、実行を続けるかどうかを返します。
     */
    private boolean awaitRunnable() throws InterruptedException {
        synchronized (monitor) {
            while (state == AcquisitionState.PAUSED) {
                monitor.wait();
            }
            return state == AcquisitionState.RUNNING;
        }
    }

    /**
     * 1 周期の残り時間だけ待機します。状態が変わった場合はすぐに戻ります。
     */
    private void pace(long startedNanos) throws InterruptedException {
        if (cyclePeriodMillis <= 0) {
            return;
        }
        long deadline = startedNanos + TimeUnit.MILLISECONDS.toNanos(cyclePeriodMillis);
        synchronized (monitor) {
            long remaining;
            while (state == AcquisitionState.RUNNING
                    && (remaining = deadline - System.nanoTime()) > 0) {
                TimeUnit.NANOSECONDS.timedWait(monitor, remaining);
            }
        }
    }
}
