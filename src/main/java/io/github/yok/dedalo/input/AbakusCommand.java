package io.github.yok.dedalo.input;

/**
 * Abakus レーザーセンサのシリアルコマンドです。
 */
public enum AbakusCommand {

    /**
     * リモート制御モードを開始します。応答まで長めに待ちます。
     */
    REMOTE_MODE("C0001", true),

    /**
     * 計測を開始します。
     */
    START_MEASUREMENT("C0005", false),

    /**
     * チャネルごとのノイズレベルを取得します。
     */
    NOISE_LEVELS("C0013", false),

    /**
     * チャネルごとの径と計数の組を取得します。
     */
    COUNTS("C0012", false),

    /**
     * レーザーダイオード電圧を取得します。
     */
    LASER_VOLTAGE("U0004", false),

    /**
     * RAM バッファ電圧を取得します。
     */
    BUFFER_VOLTAGE("U0003", false),

    /**
     * 計測を停止します。
     */
    STOP("C0006", false),

    /**
     * 装置との接続を終了します。
     */
    DISCONNECT("C0000", false);

    private final String code;

    private final boolean slow;

    AbakusCommand(String code, boolean slow) {
        this.code = code;
        this.slow = slow;
    }

    public String getCode() {
        return code;
    }

    /**
     * 応答待ちに通常より長い時間が必要かどうかを返します。
     *
     * @return 長い待ち時間が必要な場合は true です
     */
    public boolean isSlow() {
        return slow;
    }
}
