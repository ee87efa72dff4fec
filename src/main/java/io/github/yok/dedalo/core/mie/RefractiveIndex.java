package io.github.yok.dedalo.core.mie;

import io.github.yok.dedalo.core.exception.DomainException;
import lombok.Value;
import org.ejml.data.Complex_F64;

/**
 * 粒子材料の複素屈折率 n + ik を表す不変クラスです。
 *
 * <p>
 * 実部 n は正、虚部（吸収係数）k は 0 以上である必要があります。
 * </p>
 */
@Value
public class RefractiveIndex {

    /**
     * ポリスチレン標準粒子の屈折率（波長 670 nm）です。
     */
    public static final RefractiveIndex POLYSTYRENE = new RefractiveIndex(1.5848, 0.0);

    /**
     * 屈折率の実部です。
     */
    double real;

    /**
     * 屈折率の虚部（吸収）です。
     */
    double imaginary;

    /**
     * 屈折率を生成します。
     *
     * @param real 実部です
     * @param imaginary 虚部です
     * @throws DomainException 実部が正でない、虚部が負、または有限でない場合に発生します
     */
    public RefractiveIndex(double real, double imaginary) {
        if (!Double.isFinite(real) || !Double.isFinite(imaginary)) {
            throw new DomainException("屈折率は有限値である必要があります: n=" + real + ", k=" + imaginary);
        }
        if (real <= 0.0) {
            throw new DomainException("屈折率の実部は正である必要があります: n=" + real);
        }
        if (imaginary < 0.0) {
            throw new DomainException("屈折率の虚部は 0 以上である必要があります: k=" + imaginary);
        }
        this.real = real;
        this.imaginary = imaginary;
    }

    /**
     * 媒質に対する相対複素屈折率 m = (n + ik) / n_med を返します。
     *
     * @param mediumIndex 媒質の屈折率です
     * @return 相対複素屈折率です
     * @throws DomainException 媒質の屈折率が正の有限値でない場合に発生します
     */
    public Complex_F64 relativeTo(double mediumIndex) {
        if (!Double.isFinite(mediumIndex) || mediumIndex <= 0.0) {
            throw new DomainException("媒質の屈折率は正の有限値である必要があります: n_med=" + mediumIndex);
        }
        return new Complex_F64(real / mediumIndex, imaginary / mediumIndex);
    }
}
