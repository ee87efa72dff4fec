package io.github.yok.dedalo.core.session;

import com.google.common.base.Preconditions;
import io.github.yok.dedalo.core.frame.ChannelFrame;
import java.util.EnumSet;
import java.util.Set;
import lombok.Getter;

/**
 * レーザーダイオード電圧と RAM バッファ電圧を閾値と比較し、警告・異常を判定するクラスです。
 */
@Getter
public final class VoltageMonitor {

    /**
     * レーザーダイオード電圧の警告閾値 [mV] です（この値以上で警告）。
     */
    private final double laserWarningMv;

    /**
     * レーザーダイオード電圧の異常閾値 [mV] です（この値以上で異常）。
     */
    private final double laserFaultMv;

    /**
     * RAM バッファ電圧の異常閾値 [mV] です（この値未満で異常）。
     */
    private final double bufferFaultMv;

    /**
     * 監視器を生成します。
     *
     * @param laserWarningMv レーザー警告閾値 [mV] です
     * @param laserFaultMv レーザー異常閾値 [mV] です
     * @param bufferFaultMv バッファ異常閾値 [mV] です
     * @throws IllegalArgumentException 警告閾値が異常閾値より大きい場合に発生します
     */
    public VoltageMonitor(double laserWarningMv, double laserFaultMv, double bufferFaultMv) {
        Preconditions.checkArgument(laserWarningMv <= laserFaultMv,
                "レーザー警告閾値は異常閾値以下である必要があります。warning=%s, fault=%s", laserWarningMv,
                laserFaultMv);
        this.laserWarningMv = laserWarningMv;
        this.laserFaultMv = laserFaultMv;
        this.bufferFaultMv = bufferFaultMv;
    }

    /**
     * フレームの電圧を判定します。
     *
     * @param frame フレームです
     * @return 発生した警告・異常です（なければ空）
     */
    public Set<InstrumentAlarm> evaluate(ChannelFrame frame) {
        Set<InstrumentAlarm> alarms = EnumSet.noneOf(InstrumentAlarm.class);
        if (frame.getLaserVoltageMv() >= laserFaultMv) {
            alarms.add(InstrumentAlarm.LASER_DIODE_FAULT);
        } else if (frame.getLaserVoltageMv() >= laserWarningMv) {
            alarms.add(InstrumentAlarm.LASER_VOLTAGE_HIGH);
        }
        if (frame.getBufferVoltageMv() < bufferFaultMv) {
            alarms.add(InstrumentAlarm.BUFFER_VOLTAGE_LOW);
        }
        return alarms;
    }
}
