package io.github.yok.dedalo.input;

import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/**
 * 記録ファイルの書式に関する定数です。
 */
final class RecordedFileFormat {

    static final String SERIAL_PORT = "Serial port connected:";

    static final String SOFTWARE = "Abakus software version:";

    static final String MODEL = "Abakus model:";

    static final String INSTRUMENT_ID = "Abakus ID number:";

    static final String WAVELENGTH = "Abakus laser wavelength:";

    static final String SIZE_RANGE = "Detectable size range:";

    static final String NOISE = "Noise levels and calibration:";

    static final String DELAY = "Delay time between serial writing and reading:";

    static final String FLOW_RATE = "Flow rate:";

    static final String START_TIME = "Date and starting time:";

    static final String SEPARATOR = "_".repeat(120);

    /**
     * 表題・空行・6 項目・ノイズ見出しの行数です。
     */
    static final int LINES_BEFORE_NOISE = 9;

    /**
     * 待ち時間・流量・開始日時の行数です。
     */
    static final int LINES_AFTER_NOISE = 3;

    /**
     * 区切り線・列見出し・区切り線の行数です。
     */
    static final int TABLE_HEADER_LINES = 3;

    /**
     * データ行の先頭列数（番号、読み出し時間、レーザー電圧、バッファ電圧）です。
     */
    static final int LEADING_COLUMNS = 4;

    static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("dd-MM-yyyy_HH-mm-ss.SS");

    /**
     * ノイズレベルの項目（例: {@code 3) 1.4 μm ---> 120.0}）です。
     */
    static final Pattern NOISE_ENTRY =
            Pattern.compile("(\\d+)\\)\\s*([0-9.]+)\\s*μm\\s*--->\\s*([0-9.]+)");

    static final Pattern NUMBER = Pattern.compile("[-+]?[0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?");

    private RecordedFileFormat() {}

    /**
     * 指定のチャネル数に必要なヘッダ行数の最小値を返します。
     *
     * @param channelCount チャネル数です
     * @return 最小ヘッダ行数です
     */
    static int minimumHeaderLines(int channelCount) {
        return LINES_BEFORE_NOISE + (channelCount + 1) / 2 + LINES_AFTER_NOISE
                + TABLE_HEADER_LINES;
    }
}
