package io.github.yok.dedalo.input;

import lombok.Value;

/**
 * チャネルごとのノイズレベルです。
 */
@Value
public class NoiseLevel {

    /**
     * チャネル番号（1 始まり）です。
     */
    int channel;

    /**
     * チャネル径 [µm] です。
     */
    double diameter;

    /**
     * ノイズレベル [mV] です。
     */
    double millivolts;
}
