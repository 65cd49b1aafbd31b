package io.github.yok.thinfilm.core.dispersion;

import lombok.Value;

/**
 * Cauchy 分散式 n(λ) = A + B/λ² + C/λ⁴ です（λ は µm）。
 *
 * <p>
 * 消衰係数 k は波長に依存しない定数として扱います。
 * </p>
 */
@Value
public class CauchyDispersion implements DispersionFormula {

    double a;

    double b;

    double c;

    /**
     * 消衰係数です。
     */
    double k;

    /**
     * 指定波長での屈折率 n を計算します。
     *
     * @param wavelengthUm 波長（µm）です
     * @return 屈折率です
     */
    public double refractiveIndex(double wavelengthUm) {
        double lambda2 = wavelengthUm * wavelengthUm;
        double lambda4 = lambda2 * lambda2;
        return a + b / lambda2 + c / lambda4;
    }

    @Override
    public ComplexIndex indexAt(double wavelengthUm) {
        return new ComplexIndex(refractiveIndex(wavelengthUm), k);
    }
}
