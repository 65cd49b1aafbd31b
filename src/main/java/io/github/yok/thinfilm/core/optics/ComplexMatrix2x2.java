package io.github.yok.thinfilm.core.optics;

import org.apache.commons.math3.complex.Complex;

/**
 * 特性行列計算用の 2×2 複素行列です（不変）。
 */
final class ComplexMatrix2x2 {

    static final ComplexMatrix2x2 IDENTITY =
            new ComplexMatrix2x2(Complex.ONE, Complex.ZERO, Complex.ZERO, Complex.ONE);

    final Complex m11;
    final Complex m12;
    final Complex m21;
    final Complex m22;

    ComplexMatrix2x2(Complex m11, Complex m12, Complex m21, Complex m22) {
        this.m11 = m11;
        this.m12 = m12;
        this.m21 = m21;
        this.m22 = m22;
    }

    /**
     * 右から行列を掛けた積 {@code this · other} を返します。
     *
     * @param other 右側の行列です
     * @return 積です
     */
    ComplexMatrix2x2 multiply(ComplexMatrix2x2 other) {
        return new ComplexMatrix2x2(
                m11.multiply(other.m11).add(m12.multiply(other.m21)),
                m11.multiply(other.m12).add(m12.multiply(other.m22)),
                m21.multiply(other.m11).add(m22.multiply(other.m21)),
                m21.multiply(other.m12).add(m22.multiply(other.m22)));
    }
}
