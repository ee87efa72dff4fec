package io.github.yok.dedalo.input;

import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 記録ファイルのヘッダ情報です。
 *
 * <p>
 * 流量以外の項目は任意で、記録されていない場合は空文字列または null です。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class RecordedFileHeader {

    /**
     * 記録ファイルの表題です。
     */
    public static final String TITLE = "ABAKUS LASER SENSOR ----- PARTICLE SIZE DISTRIBUTION DATA";

    @Builder.Default
    String serialPort = "";

    @Builder.Default
    String softwareVersion = "";

    @Builder.Default
    String model = "";

    @Builder.Default
    String instrumentId = "";

    /**
     * レーザー波長 [µm] です（null 可）。
     */
    Double wavelength;

    @Builder.Default
    String sizeRange = "";

    /**
     * チャネルごとのノイズレベルです。
     */
    @Singular
    List<NoiseLevel> noiseLevels;

    /**
     * シリアル書き込みから読み出しまでの待ち時間 [ms] です（null 可）。
     */
    Integer delayMillis;

    /**
     * 流量 [mL/min] です。
     */
    double flowRate;

    /**
     * 計測開始日時です（null 可）。
     */
    LocalDateTime startTime;
}
