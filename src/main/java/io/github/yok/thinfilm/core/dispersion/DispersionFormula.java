package io.github.yok.thinfilm.core.dispersion;

/**
 * 波長から複素屈折率を求める分散式を表すインタフェースです。
 *
 * <p>
 * 分散式は定数・Cauchy・Sellmeier・テーブル補間の 4 種類に閉じており、各実装は不変です。
 * 波長の単位はすべて µm です。
 * </p>
 */
public sealed interface DispersionFormula permits ConstantDispersion, CauchyDispersion,
        SellmeierDispersion, TabulatedDispersion {

    /**
     * 指定波長での複素屈折率を返します。
     *
     * @param wavelengthUm 波長（µm）です
     * @return 複素屈折率です
     */
    ComplexIndex indexAt(double wavelengthUm);
}
