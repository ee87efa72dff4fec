package io.github.yok.dedalo.out;

import io.github.yok.dedalo.core.calibration.CalibrationCurve;
import io.github.yok.dedalo.core.calibration.CalibrationPoint;
import io.github.yok.dedalo.core.lut.DiameterGrid;
import io.github.yok.dedalo.core.psd.ChannelCorrection;
import io.github.yok.dedalo.core.psd.ComparisonEntry;
import io.github.yok.dedalo.core.psd.ConcentrationNormalizer;
import io.github.yok.dedalo.core.psd.DistributionStatistics;
import io.github.yok.dedalo.core.psd.PsdSample;
import io.github.yok.dedalo.core.psd.SessionStatistics;
import io.github.yok.dedalo.core.psd.TimeSeriesStatistics;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 計測結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（name は計測名）。
 * </p>
 *
 * <ul>
 * <li>{@code dedalo_samples_<name>.csv}（1 行 1 サンプル）</li>
 * <li>{@code dedalo_distribution_<name>.csv}（1 行 1 チャネル、積算した分布）</li>
 * <li>{@code dedalo_summary_<name>.csv}（key/value の要約）</li>
 * <li>{@code dedalo_comparison.csv}（複数計測の正規化ヒストグラム）</li>
 * <li>{@code dedalo_calibration.csv}（校正曲線と参照点）</li>
 * </ul>
 */
@Slf4j
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "dedalo";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    private final ConcentrationNormalizer normalizer;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @param normalizer 比較用の正規化ロジックです
     * @throws IllegalArgumentException 出力先が指定されていない場合に発生します
     */
    public CsvResultWriter(String outputDir, ConcentrationNormalizer normalizer) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
        this.normalizer = normalizer;
    }

    /**
     * 1 回の計測の結果を出力します。
     *
     * @param name 計測名です
     * @param samples 時刻順のサンプルです
     * @param statistics 計測全体の統計です
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void writeRecording(String name, List<PsdSample> samples,
            SessionStatistics statistics) {
        try {
            Files.createDirectories(outputDir);

            // 1) サンプルごとの計数
            writeSamplesCsv(name, samples);

            // 2) 積算した分布
            if (statistics.accumulatedSample().isPresent()) {
                writeDistributionCsv(name, statistics.getAccumulated());
            }

            // 3) 要約
            writeSummaryCsv(name, statistics);
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
        log.info("CSV を出力しました。name={}、dir={}", name, outputDir.toAbsolutePath());
    }

    private void writeSamplesCsv(String name, List<PsdSample> samples) throws IOException {
        Path file = outputDir.resolve(buildFileName("samples", name));
        int channels = samples.isEmpty() ? 0 : samples.get(0).channelCount();

        List<String> header = new ArrayList<>(List.of("index", "elapsedSeconds",
                "acquisitionSeconds", "laserVoltageMv", "bufferVoltageMv", "flowRate",
                "totalCount", "totalConcentration", "alarms"));
        for (int c = 1; c <= channels; c++) {
            header.add("ch" + c);
        }

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader(header.toArray(new String[0])).build().print(w)) {
            for (PsdSample s : samples) {
                List<Object> row = new ArrayList<>(header.size());
                row.add(s.getIndex());
                row.add(s.getElapsedSeconds());
                row.add(s.getAcquisitionSeconds());
                row.add(s.getLaserVoltageMv());
                row.add(s.getBufferVoltageMv());
                row.add(s.getFlowRate());
                row.add(s.getTotalCount());
                row.add(s.getTotalConcentration());
                row.add(s.getAlarms().stream().map(Enum::name)
                        .collect(Collectors.joining(" ")));
                for (long count : s.getCounts()) {
                    row.add(count);
                }
                pr.printRecord(row);
            }
        }
    }

    private void writeDistributionCsv(String name, PsdSample accumulated) throws IOException {
        Path file = outputDir.resolve(buildFileName("distribution", name));
        ChannelCorrection correction = accumulated.getCorrection();
        double[] normalized = accumulated.getTotalCount() > 0
                ? normalizer.normalizeForComparison(accumulated.getCounts())
                : new double[accumulated.channelCount()];

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("channel", "nominalDiameter", "calibratedDiameter",
                                "correctedDiameter", "corrected", "ambiguous", "count",
                                "concentration", "normalized")
                        .build().print(w)) {
            for (int i = 0; i < accumulated.channelCount(); i++) {
                pr.printRecord(i + 1, correction.nominalAt(i), correction.calibratedAt(i),
                        correction.correctedAt(i), correction.isCorrected(i),
                        correction.isAmbiguous(i), accumulated.getCount(i),
                        accumulated.getConcentration(i), normalized[i]);
            }
        }
    }

    private void writeSummaryCsv(String name, SessionStatistics statistics) throws IOException {
        Path file = outputDir.resolve(buildFileName("summary", name));
        TimeSeriesStatistics ts = statistics.getTimeSeries();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("samples", statistics.getSampleCount());
            pr.printRecord("totalCount", statistics.getTotalCount());
            pr.printRecord("totalConcentration", statistics.getTotalConcentration());
            pr.printRecord("averageLaserVoltageMv", statistics.getAverageLaserVoltageMv());
            pr.printRecord("averageBufferVoltageMv", statistics.getAverageBufferVoltageMv());
            pr.printRecord("flowRate", statistics.getFlowRate());

            DistributionStatistics d = statistics.getDistribution();
            if (d != null) {
                pr.printRecord("distribution.mode", d.getModeDiameter());
                pr.printRecord("distribution.arithmeticMean", d.getArithmeticMean());
                pr.printRecord("distribution.arithmeticMeanError", d.getArithmeticMeanError());
                pr.printRecord("distribution.weightedMean", d.getWeightedMean());
                pr.printRecord("distribution.weightedMeanError", d.getWeightedMeanError());
                pr.printRecord("distribution.standardDeviation", d.getStandardDeviation());
                pr.printRecord("distribution.q1", d.getQ1());
                pr.printRecord("distribution.median", d.getMedian());
                pr.printRecord("distribution.q3", d.getQ3());
            }

            pr.printRecord("timeSeries.mean", ts.getMean());
            pr.printRecord("timeSeries.standardDeviation", ts.getStandardDeviation());
            pr.printRecord("timeSeries.median", ts.getMedian());
            pr.printRecord("timeSeries.q1", ts.getQ1());
            pr.printRecord("timeSeries.q3", ts.getQ3());
            pr.printRecord("timeSeries.countRate", ts.getCountRate());

            statistics.accumulatedSample().ifPresent(s -> printAlarms(pr, s));
        }
    }

    private static void printAlarms(CSVPrinter pr, PsdSample s) {
        try {
            pr.printRecord("alarms",
                    s.getAlarms().stream().map(Enum::name).collect(Collectors.joining(" ")));
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました", e);
        }
    }

    /**
     * 校正曲線を出力します。
     *
     * @param curve 校正曲線です
     * @param points 参照点です
     * @param grid 評価する測定径の格子です
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void writeCalibration(CalibrationCurve curve, List<CalibrationPoint> points,
            DiameterGrid grid) {
        Path file = outputDir.resolve(FILE_HEAD + "_calibration.csv");
        double[] sampled = curve.sample(grid);
        try {
            Files.createDirectories(outputDir);
            try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                    CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                            .setHeader("kind", "measured", "true").build().print(w)) {
                for (int i = 0; i < grid.size(); i++) {
                    pr.printRecord("curve", grid.get(i), sampled[i]);
                }
                for (CalibrationPoint p : points) {
                    pr.printRecord("reference", p.getMeasured(), p.getTrueDiameter());
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + file, e);
        }
        log.info("校正曲線を出力しました。curve={}、file={}", curve.describe(), file.toAbsolutePath());
    }

    /**
     * 複数計測の比較結果を出力します。
     *
     * @param entries 比較結果です
     * @param acquisitionTimeFilterSeconds 計測時間フィルタ [s] です
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void writeComparison(List<ComparisonEntry> entries,
            double acquisitionTimeFilterSeconds) {
        Path file = outputDir.resolve(FILE_HEAD + "_comparison.csv");
        try {
            Files.createDirectories(outputDir);
            try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                    CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                            .setHeader("label", "channel", "diameter", "normalized",
                                    "filterSeconds")
                            .build().print(w)) {
                for (ComparisonEntry e : entries) {
                    for (int i = 0; i < e.getDiameters().size(); i++) {
                        pr.printRecord(e.getLabel(), i + 1, e.getDiameters().get(i),
                                e.getNormalized().get(i), acquisitionTimeFilterSeconds);
                    }
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + file, e);
        }
        log.info("比較結果を出力しました。計測数={}、file={}", entries.size(), file.toAbsolutePath());
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code dedalo_summary_run01.csv}
     * </p>
     *
     * @param kind 出力の識別子（samples/distribution/summary）です
     * @param name 計測名です
     * @return ファイル名です
     */
    static String buildFileName(String kind, String name) {
        return FILE_HEAD + "_" + kind + "_" + sanitize(name) + ".csv";
    }

    /**
     * ファイル名に使えない文字を置き換えます。
     */
    private static String sanitize(String name) {
        String base = name.replaceAll("\\.[^.]*$", "");
        return base.replaceAll("[^A-Za-z0-9._-]", "_").toLowerCase(Locale.ROOT);
    }
}
