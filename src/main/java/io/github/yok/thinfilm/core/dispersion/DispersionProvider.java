package io.github.yok.thinfilm.core.dispersion;

/**
 * 材料名と波長から屈折率を提供するインタフェースです。
 *
 * <p>
 * 光学計算エンジンが外部に求める唯一の機能です。 同じ (名前, 波長) に対しては、最適化の実行中に常に同じ値を返す必要があります。
 * </p>
 */
public interface DispersionProvider {

    /**
     * コーティング材料の複素屈折率を返します。
     *
     * @param materialId 材料名です
     * @param wavelengthUm 波長（µm）です
     * @return 複素屈折率です
     * @throws IllegalArgumentException 材料が未登録の場合に発生します
     */
    ComplexIndex materialIndex(String materialId, double wavelengthUm);

    /**
     * 基板（ガラス）の屈折率を返します。
     *
     * @param substrateId 基板名です
     * @param wavelengthUm 波長（µm）です
     * @return 屈折率（実数）です
     * @throws IllegalArgumentException 基板が未登録の場合に発生します
     */
    double substrateIndex(String substrateId, double wavelengthUm);
}
