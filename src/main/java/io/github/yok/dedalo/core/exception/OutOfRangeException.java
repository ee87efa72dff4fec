package io.github.yok.dedalo.core.exception;

import lombok.Getter;

/**
 * LUT の格子範囲外を問い合わせた場合の例外です。
 *
 * <p>
 * 範囲外の値を端点に丸めることはしません。丸めるか棄却するかは呼び出し側が決めます。
 * </p>
 */
@Getter
public class OutOfRangeException extends DedaloException {

    private static final long serialVersionUID = 1L;

    /**
     * 問い合わせた値です。
     */
    private final double value;

    /**
     * 有効範囲の下限です。
     */
    private final double lowerBound;

    /**
     * 有効範囲の上限です。
     */
    private final double upperBound;

    /**
     * 例外を生成します。
     *
     * @param quantity 量の名前です（メッセージ用）
     * @param value 問い合わせた値です
     * @param lowerBound 有効範囲の下限です
     * @param upperBound 有効範囲の上限です
     */
    public OutOfRangeException(String quantity, double value, double lowerBound,
            double upperBound) {
        super(quantity + " が LUT の範囲外です: " + value + "（範囲 [" + lowerBound + ", " + upperBound
                + "]）");
        this.value = value;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }
}
