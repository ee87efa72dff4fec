package io.github.yok.dedalo.core.exception;

/**
 * DEDALO の処理で発生する例外の基底クラスです。
 *
 * <p>
 * 物理量の不正、LUT の範囲外、校正曲線のフィット失敗、装置異常、ファイル形式エラーを 呼び出し側でまとめて扱えるよう、非検査例外として定義します。
 * </p>
 */
public class DedaloException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public DedaloException(String message) {
        super(message);
    }

    /**
     * 原因付きの例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public DedaloException(String message, Throwable cause) {
        super(message, cause);
    }
}
