package io.github.yok.dedalo.input;

/**
 * 装置とのシリアル回線を行単位で扱うインタフェースです。
 *
 * <p>
 * ポートの設定（ボーレート 38400、8N1 など）と物理的な入出力は実装側の責務です。
 * </p>
 */
public interface SerialLink extends AutoCloseable {

    /**
     * コマンドを 1 行送信します（改行は実装が付加します）。
     *
     * @param command コマンド文字列です
     * @throws java.io.UncheckedIOException 送信に失敗した場合に発生します
     */
    void write(String command);

    /**
     * 受信済みの 1 行を読み出します。
     *
     * @return 受信した行です（まだ何も受信していない場合は空文字列）
     * @throws java.io.UncheckedIOException 受信に失敗した場合に発生します
     */
    String readLine();

    @Override
    void close();
}
