package io.github.yok.dedalo.input;

import com.google.common.base.Preconditions;
import io.github.yok.dedalo.core.exception.FileFormatException;
import io.github.yok.dedalo.core.frame.ChannelFrame;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import lombok.extern.slf4j.Slf4j;

/**
 * 装置の記録ファイル（ヘッダ + タブ区切りのデータ行）を読み込むクラスです。
 *
 * <p>
 * ヘッダ項目は行番号ではなく見出し文字列で探します。 データ行は番号、読み出し時間 [s]、レーザー電圧 [mV]、バッファ電圧 [mV]、 チャネル別計数の順です。
 * </p>
 */
@Slf4j
public final class RecordedFileReader {

    /**
     * ヘッダ行数です。
     */
    private final int headerLines;

    /**
     * チャネル数です。
     */
    private final int channelCount;

    /**
     * 読み込みロジックを生成します。
     *
     * @param headerLines ヘッダ行数です
     * @param channelCount チャネル数です
     * @throws IllegalArgumentException 行数・チャネル数が正でない場合に発生します
     */
    public RecordedFileReader(int headerLines, int channelCount) {
        Preconditions.checkArgument(headerLines > 0, "ヘッダ行数は正である必要があります。headerLines=%s",
                headerLines);
        Preconditions.checkArgument(channelCount > 0, "チャネル数は正である必要があります。channels=%s",
                channelCount);
        this.headerLines = headerLines;
        this.channelCount = channelCount;
    }

    /**
     * ファイルを読み込みます。
     *
     * @param file ファイルです
     * @return 記録ファイルです
     * @throws FileFormatException 書式が不正な場合に発生します
     * @throws UncheckedIOException 読み込みに失敗した場合に発生します
     */
    public RecordedFile read(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(file.getFileName().toString(), reader);
        } catch (IOException e) {
            throw new UncheckedIOException("記録ファイルを読み込めません: " + file, e);
        }
    }

    /**
     * 文字ストリームから読み込みます。
     *
     * @param source 読み込み元の名前（エラーメッセージ用）です
     * @param reader 文字ストリームです
     * @return 記録ファイルです
     * @throws FileFormatException 書式が不正な場合に発生します
     * @throws IOException 読み込みに失敗した場合に発生します
     */
    public RecordedFile read(String source, Reader reader) throws IOException {
        BufferedReader in =
                reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        List<String> header = new ArrayList<>(headerLines);
        for (int i = 0; i < headerLines; i++) {
            String line = in.readLine();
            if (line == null) {
                throw new FileFormatException(source, i + 1,
                        "ヘッダ行が不足しています（必要な行数=" + headerLines + "）");
            }
            header.add(line);
        }
        RecordedFileHeader parsed = parseHeader(source, header);

        Instant start = parsed.getStartTime() != null
                ? parsed.getStartTime().toInstant(ZoneOffset.UTC)
                : Instant.EPOCH;
        List<ChannelFrame> frames = new ArrayList<>();
        double elapsed = 0.0;
        int lineNumber = headerLines;
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            ChannelFrame frame = parseRow(source, lineNumber, line, start, elapsed,
                    parsed.getFlowRate());
            elapsed += frame.getDurationSeconds();
            frames.add(frame);
        }
        log.info("記録ファイルを読み込みました。file={}、フレーム数={}、流量={} mL/min", source, frames.size(),
                parsed.getFlowRate());
        return new RecordedFile(source, parsed, List.copyOf(frames));
    }

    private RecordedFileHeader parseHeader(String source, List<String> lines) {
        RecordedFileHeader.RecordedFileHeaderBuilder builder = RecordedFileHeader.builder();
        Double flowRate = null;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            int lineNumber = i + 1;
            if (line.startsWith(RecordedFileFormat.SERIAL_PORT)) {
                builder.serialPort(valueOf(line, RecordedFileFormat.SERIAL_PORT));
            } else if (line.startsWith(RecordedFileFormat.SOFTWARE)) {
                builder.softwareVersion(valueOf(line, RecordedFileFormat.SOFTWARE));
            } else if (line.startsWith(RecordedFileFormat.MODEL)) {
                builder.model(valueOf(line, RecordedFileFormat.MODEL));
            } else if (line.startsWith(RecordedFileFormat.INSTRUMENT_ID)) {
                builder.instrumentId(valueOf(line, RecordedFileFormat.INSTRUMENT_ID));
            } else if (line.startsWith(RecordedFileFormat.WAVELENGTH)) {
                builder.wavelength(number(source, lineNumber,
                        valueOf(line, RecordedFileFormat.WAVELENGTH), "波長"));
            } else if (line.startsWith(RecordedFileFormat.SIZE_RANGE)) {
                builder.sizeRange(valueOf(line, RecordedFileFormat.SIZE_RANGE));
            } else if (line.startsWith(RecordedFileFormat.DELAY)) {
                builder.delayMillis((int) Math.round(number(source, lineNumber,
                        valueOf(line, RecordedFileFormat.DELAY), "待ち時間")));
            } else if (line.startsWith(RecordedFileFormat.FLOW_RATE)) {
                flowRate = number(source, lineNumber, valueOf(line, RecordedFileFormat.FLOW_RATE),
                        "流量");
            } else if (line.startsWith(RecordedFileFormat.START_TIME)) {
                String text = valueOf(line, RecordedFileFormat.START_TIME);
                try {
                    builder.startTime(LocalDateTime.parse(text, RecordedFileFormat.DATE_FORMAT));
                } catch (DateTimeParseException e) {
                    log.warn("計測開始日時を解釈できません。file={}、line={}、value={}", source, lineNumber, text);
                }
            } else {
                Matcher m = RecordedFileFormat.NOISE_ENTRY.matcher(line);
                while (m.find()) {
                    builder.noiseLevel(new NoiseLevel(Integer.parseInt(m.group(1)),
                            Double.parseDouble(m.group(2)), Double.parseDouble(m.group(3))));
                }
            }
        }
        if (flowRate == null) {
            throw new FileFormatException(source, 0, "ヘッダに流量（" + RecordedFileFormat.FLOW_RATE
                    + "）がありません");
        }
        return builder.flowRate(flowRate).build();
    }

    private ChannelFrame parseRow(String source, int lineNumber, String line, Instant start,
            double elapsedSeconds, double flowRate) {
        String[] columns = line.trim().split("\\s+");
        int expected = RecordedFileFormat.LEADING_COLUMNS + channelCount;
        if (columns.length != expected) {
            throw new FileFormatException(source, lineNumber,
                    "列数が不正です（期待値=" + expected + "、実際=" + columns.length + "）");
        }
        try {
            int index = Integer.parseInt(columns[0]);
            double duration = Double.parseDouble(columns[1]);
            double laser = Double.parseDouble(columns[2]);
            double buffer = Double.parseDouble(columns[3]);
            int[] counts = new int[channelCount];
            for (int i = 0; i < channelCount; i++) {
                double value = Double.parseDouble(columns[RecordedFileFormat.LEADING_COLUMNS + i]);
                if (value < 0 || value != Math.rint(value)) {
                    throw new FileFormatException(source, lineNumber,
                            "計数は 0 以上の整数である必要があります: channel=" + (i + 1) + ", value=" + value);
                }
                counts[i] = (int) value;
            }
            Instant timestamp = start.plusNanos(Math.round(elapsedSeconds * 1e9));
            return new ChannelFrame(index, timestamp, duration, laser, buffer, flowRate, counts);
        } catch (NumberFormatException e) {
            throw new FileFormatException(source, lineNumber, "数値を解釈できません: " + e.getMessage(),
                    e);
        }
    }

    private static String valueOf(String line, String label) {
        return line.substring(label.length()).trim();
    }

    private static double number(String source, int lineNumber, String text, String name) {
        Matcher m = RecordedFileFormat.NUMBER.matcher(text);
        if (!m.find()) {
            throw new FileFormatException(source, lineNumber, name + "を解釈できません: " + text);
        }
        return Double.parseDouble(m.group());
    }
}
