package io.github.yok.dedalo.core.lut;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/**
 * 消光断面積から粒子径への逆引き結果です。
 *
 * <p>
 * Mie 共鳴により断面積が粒子径に対して単調でない区間では複数の解が存在します。 その場合は参照径に最も近い解を採用し、
 * {@code ambiguous} を true にします。
 * </p>
 */
@Value
public class DiameterInversion {

    /**
     * 採用した粒子径 [µm] です。
     */
    double diameter;

    /**
     * 複数の解が存在したかどうかです。
     */
    boolean ambiguous;

    /**
     * すべての解（昇順）です。
     */
    List<Double> candidates;

    /**
     * 逆引き結果を生成します。
     *
     * @param diameter 採用した粒子径です
     * @param ambiguous 複数の解が存在したかどうかです
     * @param candidates すべての解です
     */
    public DiameterInversion(double diameter, boolean ambiguous, List<Double> candidates) {
        this.diameter = diameter;
        this.ambiguous = ambiguous;
        this.candidates = ImmutableList.copyOf(candidates);
    }
}
