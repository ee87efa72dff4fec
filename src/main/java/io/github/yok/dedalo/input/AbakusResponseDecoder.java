package io.github.yok.dedalo.input;

import io.github.yok.dedalo.core.exception.InstrumentFaultException;
import io.github.yok.dedalo.core.session.InstrumentAlarm;
import java.util.EnumSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abakus の応答行（先頭にコマンドのエコー、続いて空白区切りの値）を解釈するクラスです。
 *
 * <p>
 * 径を含む応答では、径が µm 値の 10 倍で返るため 10 で割ります。
 * </p>
 */
public final class AbakusResponseDecoder {

    private static final Pattern NUMBER = Pattern.compile("^[-+]?[0-9]*\\.?[0-9]+");

    /**
     * 電圧の応答（{@code U0004 6123} など）を解釈します。
     *
     * @param command 送信したコマンドです
     * @param line 応答行です
     * @return 電圧 [mV] です
     * @throws InstrumentFaultException エコーが一致しない、または値を解釈できない場合に発生します
     */
    public double decodeVoltage(AbakusCommand command, String line) {
        String[] tokens = tokens(command, line);
        if (tokens.length < 2) {
            throw protocolError(command, "電圧の値がありません", line);
        }
        return parse(command, tokens[1], line);
    }

    /**
     * 計数の応答（{@code C0012 d1 c1 d2 c2 ...}）を解釈します。
     *
     * @param line 応答行です
     * @param channelCount チャネル数です
     * @return チャネル別計数です
     * @throws InstrumentFaultException エコーが一致しない、値が不足している、または値を解釈できない場合に発生します
     */
    public int[] decodeCounts(String line, int channelCount) {
        String[] tokens = tokens(AbakusCommand.COUNTS, line);
        if (tokens.length < 1 + 2 * channelCount) {
            throw protocolError(AbakusCommand.COUNTS,
                    "値が不足しています（必要=" + 2 * channelCount + "、実際=" + (tokens.length - 1) + "）",
                    line);
        }
        int[] counts = new int[channelCount];
        for (int c = 0; c < channelCount; c++) {
            double value = parse(AbakusCommand.COUNTS, tokens[2 + 2 * c], line);
            if (value < 0) {
                throw protocolError(AbakusCommand.COUNTS, "計数が負です: channel=" + (c + 1), line);
            }
            counts[c] = (int) Math.round(value);
        }
        return counts;
    }

    /**
     * ノイズレベルの応答（{@code C0013 mv1 d1 mv2 d2 ...}）を解釈します。
     *
     * @param line 応答行です
     * @param channelCount チャネル数です
     * @return チャネルごとのノイズレベルです
     * @throws InstrumentFaultException エコーが一致しない、または値を解釈できない場合に発生します
     */
    public NoiseLevel[] decodeNoise(String line, int channelCount) {
        String[] tokens = tokens(AbakusCommand.NOISE_LEVELS, line);
        if (tokens.length < 1 + 2 * channelCount) {
            throw protocolError(AbakusCommand.NOISE_LEVELS, "値が不足しています", line);
        }
        NoiseLevel[] levels = new NoiseLevel[channelCount];
        for (int c = 0; c < channelCount; c++) {
            double mv = parse(AbakusCommand.NOISE_LEVELS, tokens[1 + 2 * c], line);
            double diameter = parse(AbakusCommand.NOISE_LEVELS, tokens[2 + 2 * c], line) / 10.0;
            levels[c] = new NoiseLevel(c + 1, diameter, mv);
        }
        return levels;
    }

    /**
     * 応答を空白で分割し、エコーを確認します。
     */
    private static String[] tokens(AbakusCommand command, String line) {
        String[] tokens = line.trim().split("\\s+");
        // 電圧応答のエコーには制御文字が前置されることがあるため末尾一致で確認します。
        if (tokens.length == 0 || !tokens[0].endsWith(command.getCode())) {
            throw protocolError(command, "応答のコマンドが一致しません", line);
        }
        return tokens;
    }

    private static double parse(AbakusCommand command, String token, String line) {
        Matcher m = NUMBER.matcher(token);
        if (!m.find()) {
            throw protocolError(command, "数値を解釈できません: " + token, line);
        }
        return Double.parseDouble(m.group());
    }

    private static InstrumentFaultException protocolError(AbakusCommand command, String reason,
            String line) {
        return new InstrumentFaultException(
                "シリアル応答が不正です（" + command.getCode() + "）: " + reason + ": " + line,
                EnumSet.of(InstrumentAlarm.SERIAL_PROTOCOL), null);
    }
}
