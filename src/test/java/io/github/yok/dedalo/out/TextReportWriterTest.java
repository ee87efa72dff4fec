package io.github.yok.dedalo.out;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.dedalo.core.psd.PsdSample;
import io.github.yok.dedalo.core.psd.PsdTestFixtures;
import io.github.yok.dedalo.core.psd.SessionStatistics;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TextReportWriterTest {

    private static SessionStatistics statistics() {
        List<PsdSample> samples =
                List.of(PsdTestFixtures.sample(PsdTestFixtures.frameAt(0, 10.0, 5, 30)),
                        PsdTestFixtures.sample(PsdTestFixtures.frameAt(1, 10.0, 5, 10)));
        return PsdTestFixtures.engine().summarize(samples);
    }

    @Test
    @DisplayName("要約には電圧・流量・粒子数・分布統計が並ぶ")
    void formatsSummary() {
        String text = TextReportWriter.format("run01", statistics());

        assertTrue(text.startsWith("=== run01 ==="));
        assertTrue(text.contains("Average laser diode voltage:"));
        assertTrue(text.contains(" 5000.00 mV"));
        assertTrue(text.contains(" 10.00 mL/min"));
        assertTrue(text.contains(" 40 pt"));
        assertTrue(text.contains("Peak diameter:"));
        assertTrue(text.contains("Count rate:"));
    }

    @Test
    @DisplayName("サンプルがない場合は数値を - と表示し、分布統計を省く")
    void formatsEmptySummary() {
        String text = TextReportWriter.format("empty", SessionStatistics.empty());

        assertTrue(text.contains(" - mL/min"));
        assertTrue(text.contains(" 0 pt"));
        assertFalse(text.contains("Peak diameter"));
    }

    @Test
    @DisplayName("レポートを dedalo_report_<name>.txt に書き出す")
    void writesReportFile(@TempDir Path dir) throws IOException {
        new TextReportWriter(dir.toString()).writeRecording("Run01.txt", List.of(), statistics());

        Path file = dir.resolve("dedalo_report_run01.txt");
        assertTrue(Files.readString(file, StandardCharsets.UTF_8).contains("=== Run01.txt ==="));
    }
}
