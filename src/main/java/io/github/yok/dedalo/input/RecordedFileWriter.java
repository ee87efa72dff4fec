package io.github.yok.dedalo.input;

import com.google.common.base.Preconditions;
import io.github.yok.dedalo.core.frame.ChannelFrame;
import io.github.yok.dedalo.core.frame.FrameRecorder;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 取得した生フレームを、{@link RecordedFileReader} で読み込める記録ファイルに書き込むクラスです。
 *
 * <p>
 * ヘッダは生成時に書き込み、データ行はフレームごとに追記します。 列見出しとデータ行はタブ区切りの表として出力します。
 * </p>
 */
@Slf4j
public final class RecordedFileWriter implements FrameRecorder {

    /**
     * 表部分の書式です。
     */
    private static final CSVFormat TABLE_FORMAT =
            CSVFormat.Builder.create(CSVFormat.TDF).setRecordSeparator('\n').build();

    private final CSVPrinter table;

    private final int channelCount;

    private boolean closed;

    /**
     * ファイルを作成してヘッダを書き込みます。
     *
     * @param file 出力ファイルです
     * @param header ヘッダ情報です
     * @param channelDiameters チャネル中心径 [µm] です
     * @param headerLines ヘッダ行数です
     * @return 書き込みロジックです
     * @throws UncheckedIOException ファイルを作成できない場合に発生します
     */
    public static RecordedFileWriter create(Path file, RecordedFileHeader header,
            double[] channelDiameters, int headerLines) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
            log.info("生データの記録を開始します。file={}", file.toAbsolutePath());
            return new RecordedFileWriter(out, header, channelDiameters, headerLines);
        } catch (IOException e) {
            throw new UncheckedIOException("記録ファイルを作成できません: " + file, e);
        }
    }

    /**
     * 任意の出力先にヘッダを書き込みます。
     *
     * @param writer 出力先です（このクラスが閉じます）
     * @param header ヘッダ情報です
     * @param channelDiameters チャネル中心径 [µm] です
     * @param headerLines ヘッダ行数です
     * @throws IllegalArgumentException ヘッダ行数がチャネル数に対して少なすぎる場合に発生します
     * @throws UncheckedIOException 書き込みに失敗した場合に発生します
     */
    public RecordedFileWriter(Writer writer, RecordedFileHeader header, double[] channelDiameters,
            int headerLines) {
        Preconditions.checkNotNull(writer, "writer が null です。");
        Preconditions.checkNotNull(header, "header が null です。");
        this.channelCount = channelDiameters.length;
        List<String> lines = headerLines(header, channelDiameters, headerLines);
        try {
            for (String line : lines) {
                writer.write(line);
                writer.write('\n');
            }
            writer.flush();
            this.table = new CSVPrinter(writer, TABLE_FORMAT);
        } catch (IOException e) {
            throw new UncheckedIOException("記録ファイルのヘッダを書き込めません", e);
        }
    }

    /**
     * ヘッダ行を組み立てます。
     *
     * @param header ヘッダ情報です
     * @param diameters チャネル中心径です
     * @param headerLines ヘッダ行数です
     * @return ちょうど headerLines 行のヘッダです
     */
    static List<String> headerLines(RecordedFileHeader header, double[] diameters,
            int headerLines) {
        int minimum = RecordedFileFormat.minimumHeaderLines(diameters.length);
        Preconditions.checkArgument(headerLines >= minimum,
                "ヘッダ行数が少なすぎます。headerLines=%s, minimum=%s", headerLines, minimum);

        List<String> lines = new ArrayList<>(headerLines);
        lines.add(RecordedFileHeader.TITLE);
        lines.add("");
        lines.add(RecordedFileFormat.SERIAL_PORT + "\t" + header.getSerialPort());
        lines.add(RecordedFileFormat.SOFTWARE + "\t" + header.getSoftwareVersion());
        lines.add(RecordedFileFormat.MODEL + "\t" + header.getModel());
        lines.add(RecordedFileFormat.INSTRUMENT_ID + "\t" + header.getInstrumentId());
        lines.add(RecordedFileFormat.WAVELENGTH + "\t" + (header.getWavelength() == null ? ""
                : String.format(Locale.ROOT, "%.3f μm", header.getWavelength())));
        lines.add(RecordedFileFormat.SIZE_RANGE + "\t" + header.getSizeRange());
        lines.add(RecordedFileFormat.NOISE);

        // ノイズレベルは 1 行に 2 チャネルずつ書きます。
        List<NoiseLevel> noise = header.getNoiseLevels();
        for (int pair = 0; pair < (diameters.length + 1) / 2; pair++) {
            StringBuilder sb = new StringBuilder();
            for (int c = 2 * pair; c < Math.min(2 * pair + 2, diameters.length); c++) {
                double mv = c < noise.size() ? noise.get(c).getMillivolts() : 0.0;
                sb.append('\t').append(String.format(Locale.ROOT, "%d) %s μm\t--->\t%.1f", c + 1,
                        diameters[c], mv));
            }
            lines.add(sb.toString());
        }

        lines.add(RecordedFileFormat.DELAY + "\t"
                + (header.getDelayMillis() == null ? "" : header.getDelayMillis() + " ms"));
        lines.add(RecordedFileFormat.FLOW_RATE + "\t" + header.getFlowRate() + " mL/min");
        lines.add(RecordedFileFormat.START_TIME + "\t" + (header.getStartTime() == null ? ""
                : header.getStartTime().format(RecordedFileFormat.DATE_FORMAT)));
        while (lines.size() < headerLines - RecordedFileFormat.TABLE_HEADER_LINES) {
            lines.add("");
        }

        List<Object> columns = new ArrayList<>(List.of("Index", "Duration [s]",
                "Laser diode voltage [mV]", "RAM-buffer voltage [mV]"));
        for (double d : diameters) {
            columns.add(d);
        }
        lines.add(RecordedFileFormat.SEPARATOR);
        lines.add(TABLE_FORMAT.format(columns.toArray()));
        lines.add(RecordedFileFormat.SEPARATOR);
        return lines;
    }

    @Override
    public synchronized void record(ChannelFrame frame) {
        if (closed) {
            throw new IllegalStateException("記録ファイルは閉じられています");
        }
        Preconditions.checkArgument(frame.channelCount() == channelCount,
                "チャネル数が一致しません。expected=%s, actual=%s", channelCount, frame.channelCount());
        List<Object> row = new ArrayList<>(4 + channelCount);
        row.add(frame.getIndex());
        row.add(String.format(Locale.ROOT, "%.6f", frame.getDurationSeconds()));
        row.add(frame.getLaserVoltageMv());
        row.add(frame.getBufferVoltageMv());
        for (int c : frame.getCounts()) {
            row.add(c);
        }
        try {
            table.printRecord(row);
            table.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("記録ファイルに書き込めません: frame=" + frame.getIndex(), e);
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            table.close();
        } catch (IOException e) {
            throw new UncheckedIOException("記録ファイルを閉じられません", e);
        }
    }
}
