package io.github.yok.dedalo.core.exception;

/**
 * Mie 計算などに物理的に不正な入力（粒径 0 以下、非物理的な屈折率など）が渡された場合の例外です。
 */
public class DomainException extends DedaloException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public DomainException(String message) {
        super(message);
    }
}
