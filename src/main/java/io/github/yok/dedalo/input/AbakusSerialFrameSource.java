package io.github.yok.dedalo.input;

import com.google.common.base.Preconditions;
import io.github.yok.dedalo.core.exception.InstrumentFaultException;
import io.github.yok.dedalo.core.frame.ChannelFrame;
import io.github.yok.dedalo.core.frame.FrameSource;
import io.github.yok.dedalo.core.session.InstrumentAlarm;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Abakus レーザーセンサからシリアル回線でフレームを読み出す供給元です。
 *
 * <p>
 * 最初の読み出しでリモート制御モードに切り替え、ノイズレベルを取得して計測を開始します。 各周期ではレーザー電圧、バッファ電圧、計数の順に要求します。
 * 応答が空の場合は待ち時間をおいて読み直し、上限回数を超えたらタイムアウトとします。
 * </p>
 */
@Slf4j
public final class AbakusSerialFrameSource implements FrameSource {

    private final SerialLink link;

    private final AbakusResponseDecoder decoder = new AbakusResponseDecoder();

    private final int channelCount;

    private final double flowRate;

    /**
     * 送信から読み出しまでの待ち時間 [ms] です。
     */
    private final long delayMillis;

    /**
     * リモート制御モード開始後の待ち時間 [ms] です。
     */
    private final long remoteModeDelayMillis;

    /**
     * 空応答を読み直す回数の上限です。
     */
    private final int maxEmptyReads;

    private final Clock clock;

    private boolean opened;

    private boolean closed;

    private int nextIndex;

    private NoiseLevel[] noiseLevels = new NoiseLevel[0];

    /**
     * 供給元を生成します。
     *
     * @param link シリアル回線です（この供給元が閉じます）
     * @param channelCount チャネル数です
     * @param flowRate 流量 [mL/min] です
     * @param delayMillis 送信から読み出しまでの待ち時間 [ms] です
     * @param remoteModeDelayMillis リモート制御モード開始後の待ち時間 [ms] です
     * @param maxEmptyReads 空応答を読み直す回数の上限です
     * @param clock 時刻の取得元です
     */
    public AbakusSerialFrameSource(SerialLink link, int channelCount, double flowRate,
            long delayMillis, long remoteModeDelayMillis, int maxEmptyReads, Clock clock) {
        Preconditions.checkArgument(channelCount > 0, "チャネル数は正である必要があります。");
        Preconditions.checkArgument(delayMillis >= 0 && remoteModeDelayMillis >= 0,
                "待ち時間は 0 以上である必要があります。");
        Preconditions.checkArgument(maxEmptyReads >= 1, "読み直し回数は 1 以上である必要があります。");
        this.link = Preconditions.checkNotNull(link, "link が null です。");
        this.channelCount = channelCount;
        this.flowRate = flowRate;
        this.delayMillis = delayMillis;
        this.remoteModeDelayMillis = remoteModeDelayMillis;
        this.maxEmptyReads = maxEmptyReads;
        this.clock = Preconditions.checkNotNull(clock, "clock が null です。");
    }

    /**
     * 取得したノイズレベルを返します（開始前は空）。
     *
     * @return ノイズレベルです
     */
    public List<NoiseLevel> getNoiseLevels() {
        return List.of(noiseLevels);
    }

    @Override
    public Optional<ChannelFrame> read() {
        if (closed) {
            return Optional.empty();
        }
        if (!opened) {
            open();
        }
        Instant started = clock.instant();
        double laser = decoder.decodeVoltage(AbakusCommand.LASER_VOLTAGE,
                request(AbakusCommand.LASER_VOLTAGE));
        double buffer = decoder.decodeVoltage(AbakusCommand.BUFFER_VOLTAGE,
                request(AbakusCommand.BUFFER_VOLTAGE));
        int[] counts = decoder.decodeCounts(request(AbakusCommand.COUNTS), channelCount);
        Instant finished = clock.instant();
        double duration = Duration.between(started, finished).toNanos() / 1e9;
        ChannelFrame frame = new ChannelFrame(nextIndex++, finished, duration, laser, buffer,
                flowRate, counts);
        log.debug("フレームを読み出しました。{}", frame);
        return Optional.of(frame);
    }

    private void open() {
        opened = true;
        request(AbakusCommand.REMOTE_MODE);
        noiseLevels = decoder.decodeNoise(request(AbakusCommand.NOISE_LEVELS), channelCount);
        log.info("ノイズレベルを取得しました。{}", Arrays.toString(noiseLevels));
        link.write(AbakusCommand.START_MEASUREMENT.getCode());
        log.info("計測開始コマンド {} を送信しました。", AbakusCommand.START_MEASUREMENT.getCode());
    }

    /**
     * コマンドを送信し、空でない応答を読み出します。
     */
    private String request(AbakusCommand command) {
        long wait = command.isSlow() ? remoteModeDelayMillis : delayMillis;
        link.write(command.getCode());
        for (int attempt = 1; attempt <= maxEmptyReads; attempt++) {
            sleep(wait, command);
            String line = link.readLine();
            if (line != null && !line.isBlank()) {
                return line;
            }
            log.debug("応答待ちです。command={}、試行={}/{}", command.getCode(), attempt, maxEmptyReads);
        }
        throw new InstrumentFaultException(
                "装置の応答がありません（" + command.getCode() + "、" + maxEmptyReads + " 回）",
                EnumSet.of(InstrumentAlarm.SERIAL_TIMEOUT), null);
    }

    private static void sleep(long millis, AbakusCommand command) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InstrumentFaultException("応答待ちが中断されました（" + command.getCode() + "）",
                    InstrumentAlarm.SERIAL_TIMEOUT, e);
        }
    }

    /**
     * 計測を停止して接続を終了し、回線を閉じます。
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (opened) {
                link.write(AbakusCommand.STOP.getCode());
                link.write(AbakusCommand.DISCONNECT.getCode());
                log.info("計測停止・切断コマンドを送信しました。");
            }
        } finally {
            link.close();
        }
    }
}
