package io.github.yok.dedalo.core.psd;

import com.google.common.base.Preconditions;
import lombok.Value;

/**
 * 計測開始からの経過時間 [s] の範囲（両端を含む）です。
 */
@Value
public class TimeWindow {

    double fromSeconds;

    double toSeconds;

    /**
     * 時間窓を生成します。
     *
     * @param fromSeconds 開始 [s] です
     * @param toSeconds 終了 [s] です
     * @throws IllegalArgumentException 開始が終了より後の場合に発生します
     */
    public TimeWindow(double fromSeconds, double toSeconds) {
        Preconditions.checkArgument(fromSeconds <= toSeconds, "時間窓が不正です。from=%s, to=%s",
                fromSeconds, toSeconds);
        this.fromSeconds = fromSeconds;
        this.toSeconds = toSeconds;
    }

    /**
     * 計測開始から指定秒数までの時間窓を返します。
     *
     * @param seconds 秒数です
     * @return 時間窓です
     */
    public static TimeWindow firstSeconds(double seconds) {
        return new TimeWindow(0.0, seconds);
    }

    public boolean contains(double elapsedSeconds) {
        return elapsedSeconds >= fromSeconds && elapsedSeconds <= toSeconds;
    }
}
