package io.github.yok.dedalo.input;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.dedalo.core.exception.InstrumentFaultException;
import io.github.yok.dedalo.core.frame.ChannelFrame;
import io.github.yok.dedalo.core.session.InstrumentAlarm;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AbakusSerialFrameSourceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T00:00:00Z"),
            ZoneOffset.UTC);

    /**
     * 直前に送信したコマンドに対して用意した応答を返す回線です。
     */
    private static final class ScriptedLink implements SerialLink {

        private final Map<AbakusCommand, Deque<String>> replies =
                new EnumMap<>(AbakusCommand.class);

        private final List<String> written = new ArrayList<>();

        private AbakusCommand last;

        private boolean closed;

        ScriptedLink reply(AbakusCommand command, String... lines) {
            replies.computeIfAbsent(command, k -> new ArrayDeque<>()).addAll(List.of(lines));
            return this;
        }

        @Override
        public void write(String command) {
            written.add(command);
            for (AbakusCommand c : AbakusCommand.values()) {
                if (c.getCode().equals(command)) {
                    last = c;
                }
            }
        }

        @Override
        public String readLine() {
            Deque<String> queue = replies.get(last);
            if (queue == null || queue.isEmpty()) {
                return "";
            }
            return queue.poll();
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    private static ScriptedLink handshake() {
        return new ScriptedLink().reply(AbakusCommand.REMOTE_MODE, "C0001")
                .reply(AbakusCommand.NOISE_LEVELS, "C0013 12.5 10 13.0 12 14.5 14");
    }

    private static AbakusSerialFrameSource source(SerialLink link) {
        return new AbakusSerialFrameSource(link, 3, 10.0, 0, 0, 3, CLOCK);
    }

    @Test
    @DisplayName("最初の読み出しで開始手順を送り、以降は電圧と計数を順に要求する")
    void readsFramesAfterHandshake() {
        ScriptedLink link = handshake()
                .reply(AbakusCommand.LASER_VOLTAGE, "U0004 6123", "U0004 6130")
                .reply(AbakusCommand.BUFFER_VOLTAGE, "\u0002U0003 3050", "U0003 3040")
                .reply(AbakusCommand.COUNTS, "C0012 10 5 12 7 14 0", "C0012 10 1 12 2 14 3");
        AbakusSerialFrameSource source = source(link);

        ChannelFrame first = source.read().orElseThrow();
        ChannelFrame second = source.read().orElseThrow();

        assertEquals(List.of("C0001", "C0013", "C0005", "U0004", "U0003", "C0012", "U0004",
                "U0003", "C0012"), link.written);
        assertEquals(0, first.getIndex());
        assertEquals(1, second.getIndex());
        assertEquals(6123.0, first.getLaserVoltageMv(), 1e-12);
        assertEquals(3050.0, first.getBufferVoltageMv(), 1e-12);
        assertEquals(10.0, first.getFlowRate(), 1e-12);
        assertArrayEquals(new int[] {5, 7, 0}, first.getCounts());
        assertArrayEquals(new int[] {1, 2, 3}, second.getCounts());
    }

    @Test
    @DisplayName("ノイズレベルの径は 10 で割って µm に直す")
    void noiseDiametersAreScaled() {
        ScriptedLink link = handshake().reply(AbakusCommand.LASER_VOLTAGE, "U0004 6123")
                .reply(AbakusCommand.BUFFER_VOLTAGE, "U0003 3050")
                .reply(AbakusCommand.COUNTS, "C0012 10 5 12 7 14 0");
        AbakusSerialFrameSource source = source(link);
        assertTrue(source.getNoiseLevels().isEmpty());

        source.read();

        List<NoiseLevel> noise = source.getNoiseLevels();
        assertEquals(3, noise.size());
        assertEquals(new NoiseLevel(2, 1.2, 13.0), noise.get(1));
    }

    @Test
    @DisplayName("空応答が上限回数続くと SERIAL_TIMEOUT の障害になる")
    void emptyRepliesTimeOut() {
        ScriptedLink link = handshake();
        AbakusSerialFrameSource source = source(link);

        InstrumentFaultException e =
                assertThrows(InstrumentFaultException.class, source::read);

        assertEquals(Set.of(InstrumentAlarm.SERIAL_TIMEOUT), e.getFaults());
    }

    @Test
    @DisplayName("エコーが一致しない応答は SERIAL_PROTOCOL の障害になる")
    void mismatchedEchoIsProtocolFault() {
        ScriptedLink link = handshake().reply(AbakusCommand.LASER_VOLTAGE, "U0003 3050");
        AbakusSerialFrameSource source = source(link);

        InstrumentFaultException e =
                assertThrows(InstrumentFaultException.class, source::read);

        assertEquals(Set.of(InstrumentAlarm.SERIAL_PROTOCOL), e.getFaults());
    }

    @Test
    @DisplayName("計数の値が不足する応答は SERIAL_PROTOCOL の障害になる")
    void shortCountReplyIsProtocolFault() {
        ScriptedLink link = handshake().reply(AbakusCommand.LASER_VOLTAGE, "U0004 6123")
                .reply(AbakusCommand.BUFFER_VOLTAGE, "U0003 3050")
                .reply(AbakusCommand.COUNTS, "C0012 10 5 12");

        InstrumentFaultException e =
                assertThrows(InstrumentFaultException.class, source(link)::read);

        assertEquals(Set.of(InstrumentAlarm.SERIAL_PROTOCOL), e.getFaults());
    }

    @Test
    @DisplayName("開始後の close は停止と切断を送ってから回線を閉じる")
    void closeStopsAndDisconnects() {
        ScriptedLink link = handshake().reply(AbakusCommand.LASER_VOLTAGE, "U0004 6123")
                .reply(AbakusCommand.BUFFER_VOLTAGE, "U0003 3050")
                .reply(AbakusCommand.COUNTS, "C0012 10 5 12 7 14 0");
        AbakusSerialFrameSource source = source(link);
        source.read();

        source.close();
        source.close();

        assertEquals(List.of("C0006", "C0000"),
                link.written.subList(link.written.size() - 2, link.written.size()));
        assertTrue(link.closed);
        assertFalse(source.read().isPresent());
    }

    @Test
    @DisplayName("開始前の close はコマンドを送らずに回線だけ閉じる")
    void closeBeforeOpenOnlyClosesLink() {
        ScriptedLink link = handshake();
        AbakusSerialFrameSource source = source(link);

        source.close();

        assertTrue(link.written.isEmpty());
        assertTrue(link.closed);
    }
}
