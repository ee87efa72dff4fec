package io.github.yok.dedalo.app;

import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import javax.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * DEDALO の設定値（dedalo.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "dedalo")
public class DedaloProperties {

    /**
     * 光学系の設定です。
     */
    @Valid
    private Optics optics = new Optics();

    /**
     * 装置チャネル（公称径）の設定です。
     */
    @Valid
    private Channels channels = new Channels();

    /**
     * LUT の設定です。
     */
    @Valid
    private Lut lut = new Lut();

    /**
     * 基準・測定対象の屈折率です。
     */
    @Valid
    private RefractiveIndices refractiveIndex = new RefractiveIndices();

    /**
     * 校正の設定です。
     */
    @Valid
    private Calibration calibration = new Calibration();

    /**
     * 計測の設定です。
     */
    @Valid
    private Acquisition acquisition = new Acquisition();

    /**
     * 電圧アラームの閾値です。
     */
    @Valid
    private Alarm alarm = new Alarm();

    /**
     * 計測セルの寸法です。
     */
    @Valid
    private Cell cell = new Cell();

    /**
     * 入力（記録ファイル）の設定です。
     */
    @Valid
    private Input input = new Input();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "dedalo")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Optics op = getOptics();
        Channels ch = getChannels();
        Lut l = getLut();
        RefractiveIndices ri = getRefractiveIndex();
        Calibration c = getCalibration();
        Acquisition a = getAcquisition();
        Alarm al = getAlarm();
        Cell ce = getCell();
        Input in = getInput();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(512).append(nl);

        appendSection(sb, nl, "optics",
                // wavelength: レーザー波長 [µm]
                "wavelength", op.getWavelength(),
                // mediumIndex: 媒質の屈折率
                "mediumIndex", op.getMediumIndex());

        appendSection(sb, nl, "channels",
                // 公称径 [µm] の範囲と刻み
                "min", ch.getMin(), "max", ch.getMax(), "step", ch.getStep());

        appendSection(sb, nl, "lut",
                "min", l.getMin(), "max", l.getMax(), "step", l.getStep(),
                // smoothing: 逆引き曲線の平滑化方式（FIXED / REFRACTIVE_INDEX）
                "smoothing", l.getSmoothing(),
                // smoothingWindow: FIXED の移動平均窓（0 で平滑化なし）
                "smoothingWindow", l.getSmoothingWindow(),
                "builderThreads", l.getBuilderThreads());

        appendSection(sb, nl, "refractiveIndex",
                "reference", ri.getReference().getReal() + "+" + ri.getReference().getImaginary()
                        + "i",
                "target", ri.getTarget().getReal() + "+" + ri.getTarget().getImaginary() + "i");

        appendSection(sb, nl, "calibration",
                "enabled", c.isEnabled(),
                "method", c.getMethod(),
                // degree: POLYNOMIAL の次数
                "degree", c.getDegree(),
                "file", c.getFile(),
                "referencePoints", c.getReferencePoints().size());

        appendSection(sb, nl, "acquisition",
                // flowRate: シリアル計測時の流量 [mL/min]
                "flowRate", a.getFlowRate(),
                "delayMillis", a.getDelayMillis(),
                "cycleSeconds", a.getCycleSeconds(),
                "cumulativeCounts", a.isCumulativeCounts(),
                "glitchThreshold", a.getGlitchThreshold(),
                "maxConsecutiveTimeouts", a.getMaxConsecutiveTimeouts());

        appendSection(sb, nl, "alarm",
                "laserWarningMv", al.getLaserWarningMv(),
                "laserFaultMv", al.getLaserFaultMv(),
                "bufferFaultMv", al.getBufferFaultMv());

        appendSection(sb, nl, "cell",
                "widthUm", ce.getWidthUm(),
                "depthUm", ce.getDepthUm(),
                "laserWaistUm", ce.getLaserWaistUm());

        appendSection(sb, nl, "input",
                "files", in.getFiles(),
                "headerLines", in.getHeaderLines(),
                // acquisitionTimeFilterSeconds: 比較に使う計測時間（0 で全サンプル）
                "acquisitionTimeFilterSeconds", in.getAcquisitionTimeFilterSeconds());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir(),
                "text", o.isText());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Optics {

        /**
         * レーザー波長 [µm] です。
         */
        @Positive
        private double wavelength = 0.670;

        /**
         * 媒質（水）の屈折率です。
         */
        @Positive
        private double mediumIndex = 1.3310;
    }

    @Data
    public static class Channels {

        @Positive
        private double min = 1.0;

        @Positive
        private double max = 7.2;

        @Positive
        private double step = 0.2;
    }

    @Data
    public static class Lut {

        @Positive
        private double min = 0.2;

        @Positive
        private double max = 20.0;

        @Positive
        private double step = 0.01;

        /**
         * 逆引き曲線の平滑化方式です。
         */
        @NotNull
        private Smoothing smoothing = Smoothing.REFRACTIVE_INDEX;

        /**
         * FIXED の場合に逆引き曲線へ適用する移動平均の窓幅です（0 または 1 で平滑化なし）。
         */
        @PositiveOrZero
        private int smoothingWindow = 0;

        /**
         * LUT をバックグラウンドで構築するスレッド数です。
         */
        @Min(1)
        private int builderThreads = 2;

        public enum Smoothing {
            /**
             * smoothingWindow の窓幅を常に使います。
             */
            FIXED,
            /**
             * 粒子の屈折率（実部）から窓幅を決めます。
             */
            REFRACTIVE_INDEX
        }
    }

    @Data
    public static class RefractiveIndices {

        /**
         * 装置の校正材料（ポリスチレン）の屈折率です。
         */
        @Valid
        private ComplexIndex reference = new ComplexIndex();

        /**
         * 測定対象の屈折率です。
         */
        @Valid
        private ComplexIndex target = new ComplexIndex();
    }

    @Data
    public static class ComplexIndex {

        @Positive
        private double real = 1.5848;

        @PositiveOrZero
        private double imaginary = 0.0;
    }

    @Data
    public static class Calibration {

        /**
         * 校正曲線を適用するかどうかです（false の場合は恒等写像）。
         */
        private boolean enabled = true;

        @NotNull
        private Method method = Method.PCHIP;

        /**
         * 多項式の次数です。
         */
        @Min(1)
        private int degree = 3;

        /**
         * 参照点の CSV ファイルです（指定時は referencePoints より優先します）。
         */
        private String file;

        /**
         * 参照点（測定径と真の径）です。
         */
        @Valid
        private List<Point> referencePoints = new ArrayList<>(List.of(new Point(1.05, 1.0),
                new Point(2.5, 1.8), new Point(3.7, 2.9), new Point(4.1, 3.7),
                new Point(5.8, 5.0), new Point(10.0, 10.0)));

        public enum Method {
            PCHIP, POLYNOMIAL
        }
    }

    @Data
    public static class Point {

        /**
         * 装置が報告する径 [µm] です。
         */
        @Positive
        private double measured;

        /**
         * 標準粒子の真の径 [µm] です。
         */
        @Positive
        private double trueDiameter;

        public Point() {}

        public Point(double measured, double trueDiameter) {
            this.measured = measured;
            this.trueDiameter = trueDiameter;
        }
    }

    @Data
    public static class Acquisition {

        /**
         * シリアル計測時の流量 [mL/min] です（記録ファイルの再処理ではファイルの流量を使います）。
         */
        @Positive
        private double flowRate = 10.0;

        /**
         * シリアル書き込みから読み出しまでの待ち時間 [ms] です。
         */
        @PositiveOrZero
        private int delayMillis = 80;

        /**
         * 1 周期の計測時間 [s] です。
         */
        @Positive
        private double cycleSeconds = 1.0;

        /**
         * 装置の計数が累積値かどうかです。
         */
        private boolean cumulativeCounts = false;

        @Positive
        private long glitchThreshold = 2300;

        @Min(1)
        private int maxConsecutiveTimeouts = 5;
    }

    @Data
    public static class Alarm {

        @Positive
        private double laserWarningMv = 7000;

        @Positive
        private double laserFaultMv = 8000;

        @Positive
        private double bufferFaultMv = 2400;
    }

    @Data
    public static class Cell {

        @Positive
        private double widthUm = 250;

        @Positive
        private double depthUm = 230;

        @Positive
        private double laserWaistUm = 1.5;
    }

    @Data
    public static class Input {

        /**
         * 再処理する記録ファイルの一覧です。
         */
        private List<String> files = new ArrayList<>();

        @Min(1)
        private int headerLines = 38;

        /**
         * 比較に使う計測時間 [s] です（0 で全サンプル）。
         */
        @PositiveOrZero
        private double acquisitionTimeFilterSeconds = 0.0;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";

        /**
         * テキストレポートも出力するかどうかです。
         */
        private boolean text = true;
    }
}
