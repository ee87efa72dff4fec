package io.github.yok.dedalo.core.frame;

/**
 * 取得した生フレームを保存する記録先です。
 */
public interface FrameRecorder extends AutoCloseable {

    /**
     * 何も保存しない記録先です。
     */
    FrameRecorder NONE = new FrameRecorder() {
        @Override
        public void record(ChannelFrame frame) {
            // 保存しません
        }

        @Override
        public void close() {
            // 解放するリソースはありません
        }
    };

    /**
     * フレームを保存します。
     *
     * @param frame 生フレームです
     * @throws java.io.UncheckedIOException 書き込みに失敗した場合に発生します
     */
    void record(ChannelFrame frame);

    /**
     * 記録先を閉じます。
     */
    @Override
    void close();
}
