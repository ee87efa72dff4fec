package io.github.yok.dedalo.input;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.dedalo.core.calibration.CalibrationPoint;
import io.github.yok.dedalo.core.exception.FileFormatException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CalibrationPointReaderTest {

    private final CalibrationPointReader reader = new CalibrationPointReader();

    private List<CalibrationPoint> read(String text) throws IOException {
        return reader.read("beads.csv", new StringReader(text));
    }

    @Test
    @DisplayName("カンマ区切りの見出し付きファイルを読み、測定径の昇順に並べる")
    void readsCommaSeparatedWithHeader() throws IOException {
        List<CalibrationPoint> points = read("measured,true\n3.2,3.0\n1.1,1.0\n5.4,5.0\n");

        assertEquals(3, points.size());
        assertEquals(new CalibrationPoint(1.1, 1.0), points.get(0));
        assertEquals(new CalibrationPoint(5.4, 5.0), points.get(2));
    }

    @Test
    @DisplayName("タブ区切りでコメント行と空行を読み飛ばす")
    void readsTabSeparatedWithComments() throws IOException {
        List<CalibrationPoint> points = read("1.1\t1.0\n# ポリスチレン標準粒子\n\n3.2\t3.0\n");

        assertEquals(List.of(new CalibrationPoint(1.1, 1.0), new CalibrationPoint(3.2, 3.0)),
                points);
    }

    @Test
    @DisplayName("列が足りない行や数値でない値は FileFormatException")
    void malformedRowsAreRejected() {
        assertThrows(FileFormatException.class, () -> read("1.1,1.0\n3.2\n"));
        assertThrows(FileFormatException.class, () -> read("1.1,1.0\n3.2,abc\n"));
    }

    @Test
    @DisplayName("ファイルパスから読み込める")
    void readsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("beads.csv");
        Files.writeString(file, "2.0,2.1\n1.0,0.9\n", StandardCharsets.UTF_8);

        List<CalibrationPoint> points = reader.read(file);

        assertEquals(new CalibrationPoint(1.0, 0.9), points.get(0));
    }
}
