package io.github.yok.dedalo.app;

import io.github.yok.dedalo.core.calibration.CalibrationCurveFitter;
import io.github.yok.dedalo.core.calibration.MonotoneCubicCalibrationFitter;
import io.github.yok.dedalo.core.calibration.PolynomialCalibrationFitter;
import io.github.yok.dedalo.core.lut.DiameterGrid;
import io.github.yok.dedalo.core.lut.FixedSmoothingWindow;
import io.github.yok.dedalo.core.lut.LookupTableBuilder;
import io.github.yok.dedalo.core.lut.LookupTableCache;
import io.github.yok.dedalo.core.lut.RefractiveIndexSmoothingWindow;
import io.github.yok.dedalo.core.lut.SmoothingWindowPolicy;
import io.github.yok.dedalo.core.mie.BhmieExtinctionCalculator;
import io.github.yok.dedalo.core.mie.MieExtinctionCalculator;
import io.github.yok.dedalo.core.mie.RefractiveIndex;
import io.github.yok.dedalo.core.psd.ConcentrationNormalizer;
import io.github.yok.dedalo.core.psd.DistributionComparator;
import io.github.yok.dedalo.core.psd.DistributionStatisticsCalculator;
import io.github.yok.dedalo.core.psd.FrameAggregator;
import io.github.yok.dedalo.core.psd.RefractiveIndexCompensator;
import io.github.yok.dedalo.core.psd.StatisticsEngine;
import io.github.yok.dedalo.core.session.AcquisitionSessionFactory;
import io.github.yok.dedalo.core.session.CoincidenceMonitor;
import io.github.yok.dedalo.core.session.VoltageMonitor;
import io.github.yok.dedalo.input.CalibrationPointReader;
import io.github.yok.dedalo.input.RecordedFileReader;
import io.github.yok.dedalo.out.CsvResultWriter;
import io.github.yok.dedalo.out.ResultWriter;
import io.github.yok.dedalo.out.TextReportWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Mie 補正・濃度換算・統計処理の Bean 定義を行う設定クラスです。
 *
 * <p>
 * BHMIE による LUT、校正曲線、チャネル補正、計測セッションの生成ロジック一式を組み立てます。
 * </p>
 */
@Configuration
@RequiredArgsConstructor
public class DedaloConfiguration {

    /**
     * DEDALO の設定値（dedalo.*）です。
     */
    private final DedaloProperties p;

    /**
     * 消光効率の計算ロジックを生成します。
     *
     * @return 消光効率の計算ロジックです
     */
    @Bean
    public MieExtinctionCalculator mieExtinctionCalculator() {
        return new BhmieExtinctionCalculator();
    }

    /**
     * LUT のキャッシュを生成します。アプリケーション終了時に構築スレッドを停止します。
     *
     * @param calculator 消光効率の計算ロジックです
     * @return LUT のキャッシュです
     */
    @Bean(destroyMethod = "close")
    public LookupTableCache lookupTableCache(MieExtinctionCalculator calculator) {
        DedaloProperties.Optics o = p.getOptics();
        DedaloProperties.Lut l = p.getLut();
        SmoothingWindowPolicy smoothing = l.getSmoothing() == DedaloProperties.Lut.Smoothing.FIXED
                ? new FixedSmoothingWindow(l.getSmoothingWindow())
                : new RefractiveIndexSmoothingWindow();
        LookupTableBuilder builder =
                new LookupTableBuilder(calculator, o.getWavelength(), o.getMediumIndex(), smoothing);
        return new LookupTableCache(builder, l.getBuilderThreads());
    }

    /**
     * 濃度換算ロジックを生成します。
     *
     * @return 濃度換算ロジックです
     */
    @Bean
    public ConcentrationNormalizer concentrationNormalizer() {
        return new ConcentrationNormalizer();
    }

    /**
     * 分布の要約統計の計算ロジックを生成します。
     *
     * @return 要約統計の計算ロジックです
     */
    @Bean
    public DistributionStatisticsCalculator distributionStatisticsCalculator() {
        return new DistributionStatisticsCalculator(p.getChannels().getStep(), null);
    }

    /**
     * 統計処理を生成します。
     *
     * @param calculator 要約統計の計算ロジックです
     * @param normalizer 濃度換算ロジックです
     * @return 統計処理です
     */
    @Bean
    public StatisticsEngine statisticsEngine(DistributionStatisticsCalculator calculator,
            ConcentrationNormalizer normalizer) {
        return new StatisticsEngine(calculator, normalizer);
    }

    /**
     * フレームの集計ロジックを生成します。
     *
     * @param calculator 要約統計の計算ロジックです
     * @param normalizer 濃度換算ロジックです
     * @return 集計ロジックです
     */
    @Bean
    public FrameAggregator frameAggregator(DistributionStatisticsCalculator calculator,
            ConcentrationNormalizer normalizer) {
        DedaloProperties.Channels ch = p.getChannels();
        DedaloProperties.Alarm a = p.getAlarm();
        DedaloProperties.Cell c = p.getCell();
        return new FrameAggregator(DiameterGrid.uniform(ch.getMin(), ch.getMax(), ch.getStep()),
                new RefractiveIndexCompensator(), normalizer, calculator,
                new VoltageMonitor(a.getLaserWarningMv(), a.getLaserFaultMv(),
                        a.getBufferFaultMv()),
                new CoincidenceMonitor(c.getWidthUm(), c.getDepthUm(), c.getLaserWaistUm()),
                p.getAcquisition().getCycleSeconds());
    }

    /**
     * 計測セッションの生成ロジックを生成します。
     *
     * @param cache LUT のキャッシュです
     * @param aggregator 集計ロジックです
     * @param statisticsEngine 統計処理です
     * @return セッションの生成ロジックです
     */
    @Bean
    public AcquisitionSessionFactory acquisitionSessionFactory(LookupTableCache cache,
            FrameAggregator aggregator, StatisticsEngine statisticsEngine) {
        DedaloProperties.Lut l = p.getLut();
        DedaloProperties.Acquisition a = p.getAcquisition();
        return new AcquisitionSessionFactory(cache,
                DiameterGrid.uniform(l.getMin(), l.getMax(), l.getStep()), aggregator,
                statisticsEngine, toIndex(p.getRefractiveIndex().getReference()),
                a.getCycleSeconds(), a.isCumulativeCounts(), a.getGlitchThreshold());
    }

    /**
     * 校正曲線の当てはめロジックを生成します。
     *
     * @return 当てはめロジックです
     */
    @Bean
    public CalibrationCurveFitter calibrationCurveFitter() {
        DedaloProperties.Calibration c = p.getCalibration();
        if (c.getMethod() == DedaloProperties.Calibration.Method.POLYNOMIAL) {
            return new PolynomialCalibrationFitter(c.getDegree(), p.getChannels().getMin(),
                    p.getChannels().getMax());
        }
        return new MonotoneCubicCalibrationFitter();
    }

    /**
     * 校正参照点の読み込みロジックを生成します。
     *
     * @return 読み込みロジックです
     */
    @Bean
    public CalibrationPointReader calibrationPointReader() {
        return new CalibrationPointReader();
    }

    /**
     * 記録ファイルの読み込みロジックを生成します。
     *
     * @return 読み込みロジックです
     */
    @Bean
    public RecordedFileReader recordedFileReader() {
        DedaloProperties.Channels ch = p.getChannels();
        int channels = DiameterGrid.uniform(ch.getMin(), ch.getMax(), ch.getStep()).size();
        return new RecordedFileReader(p.getInput().getHeaderLines(), channels);
    }

    /**
     * 複数計測の比較ロジックを生成します。
     *
     * @param normalizer 濃度換算ロジックです
     * @return 比較ロジックです
     */
    @Bean
    public DistributionComparator distributionComparator(ConcentrationNormalizer normalizer) {
        return new DistributionComparator(normalizer);
    }

    /**
     * CSV の結果出力ロジックを生成します。
     *
     * @param normalizer 濃度換算ロジックです
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter csvResultWriter(ConcentrationNormalizer normalizer) {
        return new CsvResultWriter(p.getOutput().getDir(), normalizer);
    }

    /**
     * テキストレポートの出力ロジックを生成します（dedalo.output.text=false で無効）。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    @ConditionalOnProperty(prefix = "dedalo.output", name = "text", havingValue = "true",
            matchIfMissing = true)
    public ResultWriter textReportWriter() {
        return new TextReportWriter(p.getOutput().getDir());
    }

    static RefractiveIndex toIndex(DedaloProperties.ComplexIndex index) {
        return new RefractiveIndex(index.getReal(), index.getImaginary());
    }
}
