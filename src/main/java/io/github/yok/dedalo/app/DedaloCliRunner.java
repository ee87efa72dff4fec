package io.github.yok.dedalo.app;

import io.github.yok.dedalo.core.calibration.CalibrationCurve;
import io.github.yok.dedalo.core.calibration.CalibrationCurveFitter;
import io.github.yok.dedalo.core.calibration.CalibrationPoint;
import io.github.yok.dedalo.core.calibration.IdentityCalibrationCurve;
import io.github.yok.dedalo.core.exception.InstrumentFaultException;
import io.github.yok.dedalo.core.frame.FrameRecorder;
import io.github.yok.dedalo.core.lut.DiameterGrid;
import io.github.yok.dedalo.core.mie.RefractiveIndex;
import io.github.yok.dedalo.core.psd.ComparisonEntry;
import io.github.yok.dedalo.core.psd.DistributionComparator;
import io.github.yok.dedalo.core.psd.FrameAggregator;
import io.github.yok.dedalo.core.psd.PsdSample;
import io.github.yok.dedalo.core.psd.SessionStatistics;
import io.github.yok.dedalo.core.session.AcquisitionListener;
import io.github.yok.dedalo.core.session.AcquisitionLoop;
import io.github.yok.dedalo.core.session.AcquisitionSession;
import io.github.yok.dedalo.core.session.AcquisitionSessionFactory;
import io.github.yok.dedalo.input.CalibrationPointReader;
import io.github.yok.dedalo.input.RecordedFile;
import io.github.yok.dedalo.input.RecordedFileFrameSource;
import io.github.yok.dedalo.input.RecordedFileReader;
import io.github.yok.dedalo.out.ResultWriter;
import io.github.yok.dedalo.out.TextReportWriter;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で記録ファイルを再処理するクラスです。
 *
 * <p>
 * 記録ファイルごとに計測セッションを開き、全フレームを計測ループで再生して結果を出力します。 ファイルが 2 つ以上の場合は、正規化ヒストグラムの比較も出力します。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DedaloCliRunner implements CommandLineRunner {

    /**
     * DEDALO の設定値（dedalo.*）です。
     */
    private final DedaloProperties properties;

    private final AcquisitionSessionFactory sessionFactory;

    /**
     * 公称径の格子を参照するための集計ロジックです。
     */
    private final FrameAggregator aggregator;

    private final CalibrationCurveFitter calibrationCurveFitter;

    private final CalibrationPointReader calibrationPointReader;

    private final RecordedFileReader recordedFileReader;

    private final DistributionComparator comparator;

    /**
     * 結果出力ロジックです。
     */
    private final List<ResultWriter> resultWriters;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     * @throws InterruptedException 再処理の完了待ちで割り込まれた場合に発生します
     * @throws IllegalStateException 再処理が予期しない例外で中断した場合に発生します
     */
    @Override
    public void run(String... args) throws InterruptedException {
        System.out.println("=== dedalo start: reprocess recorded files ===");
        System.out.print(properties.toMultilineString());

        List<String> files = properties.getInput().getFiles();
        if (files == null || files.isEmpty()) {
            log.warn("dedalo.input.files が指定されていないため、再処理は行いません。");
            return;
        }

        DiameterGrid channels = aggregator.getChannels();
        CalibrationCurve calibration = resolveCalibration(channels);
        RefractiveIndex target = DedaloConfiguration.toIndex(properties.getRefractiveIndex()
                .getTarget());

        Map<String, List<PsdSample>> recordings = new LinkedHashMap<>();
        for (int i = 0; i < files.size(); i++) {
            String file = files.get(i);
            System.out.println("=== 記録ファイルの再処理 (" + (i + 1) + "/" + files.size() + ") ===");
            RecordedFile recorded = recordedFileReader.read(Paths.get(file));
            List<PsdSample> samples = replay(recorded, target, calibration);
            recordings.put(recorded.getSource(), samples);
        }

        if (recordings.size() >= 2) {
            double filter = properties.getInput().getAcquisitionTimeFilterSeconds();
            List<ComparisonEntry> entries = comparator.compare(recordings, filter);
            resultWriters.forEach(w -> w.writeComparison(entries, filter));
            System.out.println("比較: " + entries.stream()
                    .map(e -> e.getLabel() + "(samples=" + e.getSampleCount() + ")")
                    .collect(Collectors.joining(", ")));
        }
    }

    /**
     * 1 つの記録ファイルを計測ループで再生し、結果を出力します。
     */
    private List<PsdSample> replay(RecordedFile recorded, RefractiveIndex target,
            CalibrationCurve calibration) throws InterruptedException {
        AcquisitionSession session = sessionFactory.open(target, calibration, FrameRecorder.NONE);
        ReplayListener listener = new ReplayListener();
        AcquisitionLoop loop = new AcquisitionLoop(session, new RecordedFileFrameSource(recorded),
                listener, 0, properties.getAcquisition().getMaxConsecutiveTimeouts());
        loop.start();
        while (!loop.awaitTermination(10, TimeUnit.SECONDS)) {
            log.info("再処理中です。file={}、サンプル数={}", recorded.getSource(),
                    session.samples().size());
        }

        RuntimeException error = listener.error.get();
        if (error != null) {
            throw new IllegalStateException("記録ファイルの再処理に失敗しました: " + recorded.getSource(),
                    error);
        }
        if (listener.faults.get() > 0) {
            log.warn("装置異常のサンプルがあります。file={}、件数={}", recorded.getSource(),
                    listener.faults.get());
        }

        SessionStatistics statistics = loop.finalStatistics().orElseGet(session::finish);
        List<PsdSample> samples = session.samples();
        for (ResultWriter writer : resultWriters) {
            writer.writeRecording(recorded.getSource(), samples, statistics);
        }
        System.out.print(TextReportWriter.format(recorded.getSource(), statistics));
        return samples;
    }

    /**
     * 設定から校正曲線を作り、有効な場合は出力します。
     */
    private CalibrationCurve resolveCalibration(DiameterGrid channels) {
        DedaloProperties.Calibration c = properties.getCalibration();
        if (!c.isEnabled()) {
            log.info("校正は無効です。チャネルの公称径をそのまま使います。");
            return IdentityCalibrationCurve.INSTANCE;
        }
        List<CalibrationPoint> points;
        if (c.getFile() != null && !c.getFile().isEmpty()) {
            points = calibrationPointReader.read(Paths.get(c.getFile()));
        } else {
            points = c.getReferencePoints().stream()
                    .map(pt -> new CalibrationPoint(pt.getMeasured(), pt.getTrueDiameter()))
                    .collect(Collectors.toList());
        }
        CalibrationCurve curve = calibrationCurveFitter.fit(points);
        log.info("校正曲線を作成しました。{}、参照点数={}", curve.describe(), points.size());
        resultWriters.forEach(w -> w.writeCalibration(curve, points, channels));
        return curve;
    }

    /**
     * 再生中の装置異常と予期しない例外を記録するリスナです。
     */
    private static final class ReplayListener implements AcquisitionListener {

        private final AtomicInteger faults = new AtomicInteger();

        private final AtomicReference<RuntimeException> error = new AtomicReference<>();

        @Override
        public void onFault(InstrumentFaultException fault) {
            faults.incrementAndGet();
        }

        @Override
        public void onError(RuntimeException e) {
            error.set(e);
        }
    }
}
