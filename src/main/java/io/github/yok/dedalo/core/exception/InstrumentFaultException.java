package io.github.yok.dedalo.core.exception;

import io.github.yok.dedalo.core.psd.PsdSample;
import io.github.yok.dedalo.core.session.InstrumentAlarm;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * 装置異常（レーザーダイオード電圧・RAM バッファ電圧の閾値超過、シリアル応答なし）を表す例外です。
 *
 * <p>
 * 電圧異常の場合、そのフレームは計数として集計済みであり、異常フラグ付きの {@link PsdSample} を保持します。
 * </p>
 */
public class InstrumentFaultException extends DedaloException {

    private static final long serialVersionUID = 1L;

    /**
     * 発生した異常の種類です。
     */
    private final Set<InstrumentAlarm> faults;

    /**
     * 異常フラグ付きで集計されたサンプルです（シリアル異常の場合は null）。
     */
    private final transient PsdSample sample;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     * @param faults 発生した異常の種類です（空不可）
     * @param sample 異常フラグ付きで集計されたサンプルです（null 可）
     */
    public InstrumentFaultException(String message, Set<InstrumentAlarm> faults,
            PsdSample sample) {
        super(message);
        this.faults = Collections.unmodifiableSet(EnumSet.copyOf(faults));
        this.sample = sample;
    }

    /**
     * 原因付きの例外を生成します（シリアル通信異常用）。
     *
     * @param message メッセージです
     * @param fault 発生した異常の種類です
     * @param cause 原因です
     */
    public InstrumentFaultException(String message, InstrumentAlarm fault, Throwable cause) {
        super(message, cause);
        this.faults = Collections.unmodifiableSet(EnumSet.of(fault));
        this.sample = null;
    }

    /**
     * 発生した異常の種類を返します。
     *
     * @return 異常の種類です
     */
    public Set<InstrumentAlarm> getFaults() {
        return faults;
    }

    /**
     * 異常フラグ付きで集計されたサンプルを返します。
     *
     * @return サンプルです（シリアル異常の場合は空）
     */
    public Optional<PsdSample> getSample() {
        return Optional.ofNullable(sample);
    }
}
