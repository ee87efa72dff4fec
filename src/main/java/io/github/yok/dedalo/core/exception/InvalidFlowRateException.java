package io.github.yok.dedalo.core.exception;

import lombok.Getter;

/**
 * 流量が 0 以下のため濃度が定義できない場合の例外です。
 */
@Getter
public class InvalidFlowRateException extends DedaloException {

    private static final long serialVersionUID = 1L;

    /**
     * 指定された流量（mL/min）です。
     */
    private final double flowRate;

    /**
     * 例外を生成します。
     *
     * @param flowRate 指定された流量（mL/min）です
     */
    public InvalidFlowRateException(double flowRate) {
        super("流量は 0 より大きい必要があります: " + flowRate + " mL/min");
        this.flowRate = flowRate;
    }
}
