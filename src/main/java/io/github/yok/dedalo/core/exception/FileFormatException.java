package io.github.yok.dedalo.core.exception;

import lombok.Getter;

/**
 * 記録ファイルのヘッダや行の形式が不正な場合の例外です。
 */
@Getter
public class FileFormatException extends DedaloException {

    private static final long serialVersionUID = 1L;

    /**
     * 対象ファイル名です。
     */
    private final String source;

    /**
     * 問題のあった行番号（1 始まり、不明な場合は 0）です。
     */
    private final int lineNumber;

    /**
     * 例外を生成します。
     *
     * @param source 対象ファイル名です
     * @param lineNumber 行番号（1 始まり、不明な場合は 0）です
     * @param message メッセージです
     */
    public FileFormatException(String source, int lineNumber, String message) {
        super(source + (lineNumber > 0 ? ":" + lineNumber : "") + ": " + message);
        this.source = source;
        this.lineNumber = lineNumber;
    }

    /**
     * 原因付きの例外を生成します。
     *
     * @param source 対象ファイル名です
     * @param lineNumber 行番号（1 始まり、不明な場合は 0）です
     * @param message メッセージです
     * @param cause 原因です
     */
    public FileFormatException(String source, int lineNumber, String message, Throwable cause) {
        super(source + (lineNumber > 0 ? ":" + lineNumber : "") + ": " + message, cause);
        this.source = source;
        this.lineNumber = lineNumber;
    }
}
