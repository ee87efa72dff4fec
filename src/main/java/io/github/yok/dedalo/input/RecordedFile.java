package io.github.yok.dedalo.input;

import io.github.yok.dedalo.core.frame.ChannelFrame;
import java.util.List;
import lombok.Value;

/**
 * 読み込んだ記録ファイルです。
 */
@Value
public class RecordedFile {

    /**
     * 読み込み元（ファイル名）です。
     */
    String source;

    RecordedFileHeader header;

    /**
     * データ行のフレームです（ファイル順）。
     */
    List<ChannelFrame> frames;
}
