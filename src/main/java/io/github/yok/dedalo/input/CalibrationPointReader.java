package io.github.yok.dedalo.input;

import io.github.yok.dedalo.core.calibration.CalibrationPoint;
import io.github.yok.dedalo.core.exception.FileFormatException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * 校正の参照点（測定径, 真の粒子径）を CSV またはタブ区切りファイルから読み込むクラスです。
 *
 * <p>
 * {@code #} で始まる行はコメントです。 先頭行の 1 列目が数値でない場合は見出し行として読み飛ばします。 読み込んだ点は測定径の昇順に並べ替えます。
 * </p>
 */
public final class CalibrationPointReader {

    /**
     * ファイルを読み込みます。
     *
     * @param file ファイルです
     * @return 参照点です
     * @throws FileFormatException 書式が不正な場合に発生します
     * @throws UncheckedIOException 読み込みに失敗した場合に発生します
     */
    public List<CalibrationPoint> read(Path file) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(file.getFileName().toString(), reader);
        } catch (IOException e) {
            throw new UncheckedIOException("校正ファイルを読み込めません: " + file, e);
        }
    }

    /**
     * 文字ストリームから読み込みます。
     *
     * @param source 読み込み元の名前です
     * @param reader 文字ストリームです
     * @return 参照点です
     * @throws IOException 読み込みに失敗した場合に発生します
     */
    public List<CalibrationPoint> read(String source, BufferedReader reader) throws IOException {
        reader.mark(8192);
        String first = reader.readLine();
        reader.reset();
        char delimiter = first != null && first.indexOf('\t') >= 0 ? '\t' : ',';

        CSVFormat format = CSVFormat.Builder.create(CSVFormat.DEFAULT).setDelimiter(delimiter)
                .setCommentMarker('#').setIgnoreEmptyLines(true).setTrim(true).build();
        List<CalibrationPoint> points = new ArrayList<>();
        try (CSVParser parser = format.parse(reader)) {
            boolean firstRecord = true;
            for (CSVRecord record : parser) {
                long line = parser.getCurrentLineNumber();
                if (record.size() < 2) {
                    throw new FileFormatException(source, (int) line, "2 列（測定径, 真の粒子径）が必要です");
                }
                if (firstRecord && !isNumber(record.get(0))) {
                    firstRecord = false;
                    continue;
                }
                firstRecord = false;
                try {
                    points.add(new CalibrationPoint(Double.parseDouble(record.get(0)),
                            Double.parseDouble(record.get(1))));
                } catch (NumberFormatException e) {
                    throw new FileFormatException(source, (int) line,
                            "数値を解釈できません: " + record.get(0) + ", " + record.get(1), e);
                }
            }
        }
        points.sort(Comparator.comparingDouble(CalibrationPoint::getMeasured));
        return points;
    }

    /**
     * 文字ストリームから読み込みます。
     *
     * @param source 読み込み元の名前です
     * @param reader 文字ストリームです
     * @return 参照点です
     * @throws IOException 読み込みに失敗した場合に発生します
     */
    public List<CalibrationPoint> read(String source, Reader reader) throws IOException {
        return read(source, new BufferedReader(reader));
    }

    private static boolean isNumber(String text) {
        try {
            Double.parseDouble(text);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
