package io.github.yok.dedalo.core.exception;

/**
 * 校正曲線が作れない場合の例外です。
 *
 * <p>
 * 参照点が不足している場合や、フィット結果が狭義単調増加にならない（逆変換が一意に定まらない）場合に発生します。
 * </p>
 */
public class CalibrationFitException extends DedaloException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public CalibrationFitException(String message) {
        super(message);
    }

    /**
     * 原因付きの例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public CalibrationFitException(String message, Throwable cause) {
        super(message, cause);
    }
}
