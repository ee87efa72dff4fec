package io.github.yok.dedalo.core.frame;

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;

/**
 * 装置が報告する累積計数を、周期ごとの増分に変換するクラスです。
 *
 * <p>
 * 1 周期の増分合計の絶対値がグリッチ閾値以上の場合は読み出し異常とみなし、直前の増分を再利用します。 いずれかのチャネルで増分が負になった場合はカウンタのリセットとみなし、
 * 現在の読み値をそのまま増分とします。 インスタンスは 1 セッション専用でスレッドセーフではありません。
 * </p>
 */
@Slf4j
public final class CumulativeCountConverter {

    /**
     * グリッチ閾値（1 周期の増分合計の絶対値）です。
     */
    private final long glitchThreshold;

    /**
     * 直前の累積読み値です。
     */
    private int[] previousReading;

    /**
     * 直前の増分です。
     */
    private int[] previousIncrement;

    /**
     * 変換器を生成します。
     *
     * @param glitchThreshold グリッチ閾値です（正）
     * @throws IllegalArgumentException 閾値が正でない場合に発生します
     */
    public CumulativeCountConverter(long glitchThreshold) {
        Preconditions.checkArgument(glitchThreshold > 0, "グリッチ閾値は正である必要があります。threshold=%s",
                glitchThreshold);
        this.glitchThreshold = glitchThreshold;
    }

    /**
     * 累積計数のフレームを増分のフレームに変換します。
     *
     * @param frame 累積計数のフレームです
     * @return 増分のフレームです
     * @throws IllegalArgumentException チャネル数が前回と異なる場合に発生します
     */
    public ChannelFrame convert(ChannelFrame frame) {
        int[] reading = frame.getCounts();
        int n = reading.length;
        if (previousReading == null) {
            previousReading = new int[n];
            previousIncrement = new int[n];
        }
        Preconditions.checkArgument(previousReading.length == n,
                "チャネル数が前回と異なります。前回=%s、今回=%s", previousReading.length, n);

        int[] increment = new int[n];
        boolean reset = false;
        long sum = 0;
        for (int i = 0; i < n; i++) {
            increment[i] = reading[i] - previousReading[i];
            if (increment[i] < 0) {
                reset = true;
            }
            sum += increment[i];
        }

        if (reset) {
            log.info("累積計数のリセットを検出しました。フレーム={}", frame.getIndex());
            increment = reading.clone();
            sum = frame.totalCount();
        }
        if (Math.abs(sum) >= glitchThreshold) {
            log.warn("増分合計が閾値以上のため直前の増分を再利用します。フレーム={}、増分合計={}、閾値={}", frame.getIndex(),
                    sum, glitchThreshold);
            increment = previousIncrement.clone();
        }

        previousReading = reading;
        previousIncrement = increment;
        return frame.withCounts(increment);
    }
}
