package io.github.yok.dedalo.core.session;

import io.github.yok.dedalo.core.exception.InstrumentFaultException;
import io.github.yok.dedalo.core.psd.PsdSample;
import io.github.yok.dedalo.core.psd.SessionStatistics;

/**
 * 計測ループの通知を受け取るインタフェースです。
 *
 * <p>
 * 通知は計測スレッドから呼び出されます。
 * </p>
 */
public interface AcquisitionListener {

    /**
     * 何もしないリスナです。
     */
    AcquisitionListener NONE = new AcquisitionListener() {};

    /**
     * サンプルを集計したときに呼び出されます（異常フラグ付きのサンプルを含みます）。
     *
     * @param sample サンプルです
     */
    default void onSample(PsdSample sample) {}

    /**
     * 装置異常を検出したときに呼び出されます。
     *
     * @param fault 装置異常です
     */
    default void onFault(InstrumentFaultException fault) {}

    /**
     * 予期しない例外で計測が中断したときに呼び出されます。
     *
     * @param error 例外です
     */
    default void onError(RuntimeException error) {}

    /**
     * 計測が終了したときに呼び出されます。
     *
     * @param statistics 確定した統計です
     */
    default void onStopped(SessionStatistics statistics) {}
}
