package io.github.yok.thinfilm.core.dispersion;

import lombok.Value;

/**
 * 名前付きの光学材料（コーティング材料または基板）です。
 */
@Value
public class Material {

    /**
     * 材料名です（カタログのキー）。
     */
    String name;

    /**
     * 分散式です。
     */
    DispersionFormula dispersion;

    /**
     * 指定波長での複素屈折率を返します。
     *
     * @param wavelengthUm 波長（µm）です
     * @return 複素屈折率です
     */
    public ComplexIndex indexAt(double wavelengthUm) {
        return dispersion.indexAt(wavelengthUm);
    }
}
