package io.github.yok.dedalo.core.session;

import io.github.yok.dedalo.core.lut.MieLookupTable;
import io.github.yok.dedalo.core.mie.RefractiveIndex;
import io.github.yok.dedalo.core.psd.ChannelCorrection;
import lombok.Value;

/**
 * 屈折率補正に使用する LUT とチャネル補正の組です。
 *
 * <p>
 * セッション内では 1 つの参照として丸ごと差し替えるため、構築途中の組が見えることはありません。
 * </p>
 */
@Value
public class CompensationTables {

    /**
     * 測定対象の屈折率です。
     */
    RefractiveIndex targetIndex;

    /**
     * 基準屈折率の LUT です。
     */
    MieLookupTable referenceLut;

    /**
     * 測定対象の屈折率の LUT です。
     */
    MieLookupTable targetLut;

    /**
     * チャネル補正です。
     */
    ChannelCorrection correction;
}
