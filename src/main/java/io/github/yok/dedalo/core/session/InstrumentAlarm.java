package io.github.yok.dedalo.core.session;

/**
 * 装置の警告・異常の種類です。
 */
public enum InstrumentAlarm {

    /**
     * レーザーダイオード電圧が警告閾値（既定 7000 mV）以上です。
     */
    LASER_VOLTAGE_HIGH(false),

    /**
     * レーザーダイオード電圧が異常閾値（既定 8000 mV）以上です。
     */
    LASER_DIODE_FAULT(true),

    /**
     * RAM バッファ電圧が異常閾値（既定 2400 mV）未満です。
     */
    BUFFER_VOLTAGE_LOW(true),

    /**
     * 1 周期の計数が単一粒子計測の上限を超えています（濃度が高すぎます）。
     */
    COINCIDENCE(false),

    /**
     * シリアル応答がタイムアウトしました。
     */
    SERIAL_TIMEOUT(true),

    /**
     * シリアル応答のコマンドヘッダが要求と一致しません。
     */
    SERIAL_PROTOCOL(true);

    /**
     * 異常（true）か警告（false）かです。
     */
    private final boolean fault;

    InstrumentAlarm(boolean fault) {
        this.fault = fault;
    }

    /**
     * 計測を中断すべき異常かどうかを返します。
     *
     * @return 異常の場合は true、警告の場合は false です
     */
    public boolean isFault() {
        return fault;
    }
}
