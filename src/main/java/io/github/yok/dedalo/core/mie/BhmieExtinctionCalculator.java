package io.github.yok.dedalo.core.mie;

import io.github.yok.dedalo.core.exception.DomainException;
import org.ejml.data.Complex_F64;
import org.ejml.ops.ComplexMath_F64;

/**
 * Bohren–Huffman の級数展開（BHMIE）で消光効率を計算するクラスです。
 *
 * <p>
 * 対数微分 D_n(mx) は下向き漸化式で、Riccati–Bessel 関数 ψ_n, χ_n は上向き漸化式で求めます。 級数の打ち切り次数は
 * nstop = x + 4x^(1/3) + 2 です。
 * </p>
 */
public final class BhmieExtinctionCalculator implements MieExtinctionCalculator {

    /**
     * 消光効率 Q_ext を計算します。
     *
     * @param diameter 粒子径 [µm] です
     * @param wavelength 真空中の波長 [µm] です
     * @param mediumIndex 媒質の屈折率です
     * @param index 粒子の屈折率です
     * @return 消光効率です
     * @throws DomainException 粒子径・波長が正の有限値でない、または屈折率が不正な場合に発生します
     */
    @Override
    public double efficiency(double diameter, double wavelength, double mediumIndex,
            RefractiveIndex index) {
        if (index == null) {
            throw new DomainException("屈折率は null 不可です");
        }
        if (!Double.isFinite(diameter) || diameter <= 0.0) {
            throw new DomainException("粒子径は正の有限値である必要があります: d=" + diameter);
        }
        if (!Double.isFinite(wavelength) || wavelength <= 0.0) {
            throw new DomainException("波長は正の有限値である必要があります: λ=" + wavelength);
        }
        Complex_F64 m = index.relativeTo(mediumIndex);
        double x = Math.PI * diameter * mediumIndex / wavelength;
        return extinctionEfficiency(x, m);
    }

    /**
     * サイズパラメータと相対屈折率から Q_ext を計算します。
     *
     * @param x サイズパラメータです
     * @param m 相対複素屈折率です
     * @return 消光効率です
     */
    static double extinctionEfficiency(double x, Complex_F64 m) {
        Complex_F64 y = new Complex_F64(m.real * x, m.imaginary * x);
        double ymod = y.getMagnitude();

        int nstop = (int) Math.round(x + 4.0 * Math.cbrt(x) + 2.0);
        int nmx = (int) Math.round(Math.max(nstop, ymod)) + 15;

        // D_n(y) を下向き漸化式で求めます。D[n-1] = n/y - 1/(D[n] + n/y)
        Complex_F64[] d = new Complex_F64[nmx + 1];
        d[nmx] = new Complex_F64(0.0, 0.0);
        Complex_F64 nOverY = new Complex_F64();
        Complex_F64 tmp = new Complex_F64();
        Complex_F64 inv = new Complex_F64();
        Complex_F64 one = new Complex_F64(1.0, 0.0);
        for (int n = nmx; n >= 1; n--) {
            ComplexMath_F64.divide(new Complex_F64(n, 0.0), y, nOverY);
            ComplexMath_F64.plus(d[n], nOverY, tmp);
            ComplexMath_F64.divide(one, tmp, inv);
            Complex_F64 prev = new Complex_F64();
            ComplexMath_F64.minus(nOverY, inv, prev);
            d[n - 1] = prev;
        }

        double psi0 = Math.cos(x);
        double psi1 = Math.sin(x);
        double chi0 = -Math.sin(x);
        double chi1 = Math.cos(x);
        Complex_F64 xi1 = new Complex_F64(psi1, -chi1);

        Complex_F64 dOverM = new Complex_F64();
        Complex_F64 mTimesD = new Complex_F64();
        Complex_F64 coef = new Complex_F64();
        Complex_F64 num = new Complex_F64();
        Complex_F64 den = new Complex_F64();
        Complex_F64 an = new Complex_F64();
        Complex_F64 bn = new Complex_F64();

        double sum = 0.0;
        for (int n = 1; n <= nstop; n++) {
            double fn = n;
            double psi = (2.0 * fn - 1.0) * psi1 / x - psi0;
            double chi = (2.0 * fn - 1.0) * chi1 / x - chi0;
            Complex_F64 xi = new Complex_F64(psi, -chi);

            // a_n = ((D/m + n/x) ψ - ψ_{n-1}) / ((D/m + n/x) ξ - ξ_{n-1})
            ComplexMath_F64.divide(d[n], m, dOverM);
            coef.setTo(dOverM.real + fn / x, dOverM.imaginary);
            num.setTo(coef.real * psi - psi1, coef.imaginary * psi);
            ComplexMath_F64.multiply(coef, xi, den);
            ComplexMath_F64.minus(den, xi1, den);
            ComplexMath_F64.divide(num, den, an);

            // b_n = ((m D + n/x) ψ - ψ_{n-1}) / ((m D + n/x) ξ - ξ_{n-1})
            ComplexMath_F64.multiply(m, d[n], mTimesD);
            coef.setTo(mTimesD.real + fn / x, mTimesD.imaginary);
            num.setTo(coef.real * psi - psi1, coef.imaginary * psi);
            ComplexMath_F64.multiply(coef, xi, den);
            ComplexMath_F64.minus(den, xi1, den);
            ComplexMath_F64.divide(num, den, bn);

            sum += (2.0 * fn + 1.0) * (an.real + bn.real);

            psi0 = psi1;
            psi1 = psi;
            chi0 = chi1;
            chi1 = chi;
            xi1 = new Complex_F64(psi1, -chi1);
        }
        return 2.0 / (x * x) * sum;
    }
}
