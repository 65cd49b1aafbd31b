package io.github.yok.thinfilm.core.dispersion;

import lombok.Value;

/**
 * 波長に依存しない (n, k) を返す分散式です。
 */
@Value
public class ConstantDispersion implements DispersionFormula {

    /**
     * 屈折率です。
     */
    double n;

    /**
     * 消衰係数です。
     */
    double k;

    @Override
    public ComplexIndex indexAt(double wavelengthUm) {
        return new ComplexIndex(n, k);
    }
}
