package io.github.yok.dedalo.out;

import io.github.yok.dedalo.core.psd.DistributionStatistics;
import io.github.yok.dedalo.core.psd.PsdSample;
import io.github.yok.dedalo.core.psd.SessionStatistics;
import io.github.yok.dedalo.core.psd.TimeSeriesStatistics;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * 計測結果の要約をテキストブロックとして出力するクラスです。
 */
@Slf4j
public final class TextReportWriter implements ResultWriter {

    private final Path outputDir;

    /**
     * テキスト出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 出力先が指定されていない場合に発生します
     */
    public TextReportWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 要約を {@code dedalo_report_<name>.txt} に出力します。
     *
     * @param name 計測名です
     * @param samples 時刻順のサンプルです
     * @param statistics 計測全体の統計です
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void writeRecording(String name, List<PsdSample> samples,
            SessionStatistics statistics) {
        String fileName = CsvResultWriter.buildFileName("report", name).replaceAll("\\.csv$", ".txt");
        Path file = outputDir.resolve(fileName);
        try {
            Files.createDirectories(outputDir);
            Files.writeString(file, format(name, statistics), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("レポート出力に失敗しました: " + file, e);
        }
        log.info("レポートを出力しました。file={}", file.toAbsolutePath());
    }

    /**
     * 要約のテキストブロックを作ります。
     *
     * @param name 計測名です
     * @param statistics 計測全体の統計です
     * @return テキストです
     */
    public static String format(String name, SessionStatistics statistics) {
        String nl = System.lineSeparator();
        StringBuilder sb = new StringBuilder(512);
        sb.append("=== ").append(name).append(" ===").append(nl);
        line(sb, nl, "Average laser diode voltage", fmt2(statistics.getAverageLaserVoltageMv()),
                "mV");
        line(sb, nl, "Average RAM-buffer voltage", fmt2(statistics.getAverageBufferVoltageMv()),
                "mV");
        line(sb, nl, "Flow rate", fmt2(statistics.getFlowRate()), "mL/min");
        line(sb, nl, "Total particles", String.valueOf(statistics.getTotalCount()), "pt");
        line(sb, nl, "Total concentration", fmt2(statistics.getTotalConcentration()), "pt/mL");

        DistributionStatistics d = statistics.getDistribution();
        if (d != null) {
            line(sb, nl, "Peak diameter", fmt2(d.getModeDiameter()), "µm");
            line(sb, nl, "Mean diameter",
                    fmt2(d.getArithmeticMean()) + " ± " + fmt2(d.getArithmeticMeanError()), "µm");
            line(sb, nl, "Weighted mean diameter",
                    fmt2(d.getWeightedMean()) + " ± " + fmt2(d.getWeightedMeanError()), "µm");
            line(sb, nl, "Diameter S.D.", fmt2(d.getStandardDeviation()), "µm");
            line(sb, nl, "Diameter Q1 / median / Q3",
                    fmt2(d.getQ1()) + " / " + fmt2(d.getMedian()) + " / " + fmt2(d.getQ3()), "µm");
        }

        TimeSeriesStatistics ts = statistics.getTimeSeries();
        line(sb, nl, "Counts per sample mean", fmt2(ts.getMean()), "pt");
        line(sb, nl, "Counts per sample S.D.", fmt2(ts.getStandardDeviation()), "pt");
        line(sb, nl, "Counts per sample median", fmt2(ts.getMedian()), "pt");
        line(sb, nl, "Counts per sample Q1 / Q3", fmt2(ts.getQ1()) + " / " + fmt2(ts.getQ3()),
                "pt");
        line(sb, nl, "Count rate", fmt2(ts.getCountRate()), "pt/s");
        return sb.toString();
    }

    private static void line(StringBuilder sb, String nl, String label, String value,
            String unit) {
        sb.append(String.format(Locale.ROOT, "%-28s %s %s", label + ":", value, unit)).append(nl);
    }

    /**
     * 数値を小数点以下2桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt2(double v) {
        return Double.isNaN(v) ? "-" : String.format(Locale.ROOT, "%.2f", v);
    }
}
