package io.github.yok.dedalo.core.frame;

import java.util.Optional;

/**
 * {@link ChannelFrame} の供給元（シリアル装置、記録ファイルの再生など）です。
 */
public interface FrameSource extends AutoCloseable {

    /**
     * 次のフレームを読み出します。読み出しはブロックする場合があります。
     *
     * @return 次のフレームです（終端に達した場合は空）
     * @throws io.github.yok.dedalo.core.exception.InstrumentFaultException 装置応答がタイムアウトした、
     *         または応答が不正な場合に発生します
     */
    Optional<ChannelFrame> read();

    /**
     * 供給元を閉じます。
     */
    @Override
    void close();
}
