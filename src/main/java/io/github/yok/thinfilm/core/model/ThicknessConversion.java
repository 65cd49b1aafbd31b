package io.github.yok.thinfilm.core.model;

/**
 * 光学膜厚と物理膜厚の換算を行うユーティリティです。
 */
public final class ThicknessConversion {

    private ThicknessConversion() {}

    /**
     * 光学膜厚（波数）を物理膜厚（µm）に換算します。
     *
     * @param opticalThickness 光学膜厚（波数）です
     * @param refractiveIndex 基準波長での屈折率です
     * @param referenceWavelengthUm 基準波長（µm）です
     * @return 物理膜厚（µm）です
     */
    public static double opticalToPhysical(double opticalThickness, double refractiveIndex,
            double referenceWavelengthUm) {
        return opticalThickness * referenceWavelengthUm / refractiveIndex;
    }

    /**
     * 物理膜厚（µm）を光学膜厚（波数）に換算します。
     *
     * @param physicalThicknessUm 物理膜厚（µm）です
     * @param refractiveIndex 基準波長での屈折率です
     * @param referenceWavelengthUm 基準波長（µm）です
     * @return 光学膜厚（波数）です
     */
    public static double physicalToOptical(double physicalThicknessUm, double refractiveIndex,
            double referenceWavelengthUm) {
        return refractiveIndex * physicalThicknessUm / referenceWavelengthUm;
    }
}
