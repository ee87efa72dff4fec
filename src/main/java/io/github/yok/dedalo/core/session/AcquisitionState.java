package io.github.yok.dedalo.core.session;

/**
 * 計測ループの状態です。
 *
 * <p>
 * IDLE → RUNNING ⇄ PAUSED → STOPPED の順に遷移し、STOPPED からは戻りません。
 * </p>
 */
public enum AcquisitionState {

    IDLE,

    RUNNING,

    PAUSED,

    STOPPED
}
