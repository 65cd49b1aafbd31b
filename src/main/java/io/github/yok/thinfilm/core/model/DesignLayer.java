package io.github.yok.thinfilm.core.model;

import lombok.Value;
import lombok.With;

/**
 * 設計中の 1 層（材料・膜厚・最適化条件）を表すクラスです。
 *
 * <p>
 * 不変クラスです。最適化で膜厚を変えるときは {@link #withThickness(double)} で新しい層を作ります。 膜厚は
 * {@link #thicknessKind} に従って物理膜厚（µm）または光学膜厚（波数）として解釈します。
 * </p>
 */
@Value
public class DesignLayer {

    /**
     * 材料名です。
     */
    String materialId;

    /**
     * 膜厚です。
     */
    @With
    double thickness;

    /**
     * 膜厚の表し方です。
     */
    ThicknessKind thicknessKind;

    /**
     * 最適化の変数にするかどうかです。
     */
    boolean variable;

    /**
     * 最適化時の膜厚下限です。
     */
    double minThickness;

    /**
     * 最適化時の膜厚上限です。
     */
    double maxThickness;

    /**
     * 層を生成します。
     *
     * @param materialId 材料名です（null/空不可）
     * @param thickness 膜厚です
     * @param thicknessKind 膜厚の表し方です（null 不可）
     * @param variable 最適化の変数にするかどうかです
     * @param minThickness 膜厚下限です
     * @param maxThickness 膜厚上限です（下限以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public DesignLayer(String materialId, double thickness, ThicknessKind thicknessKind,
            boolean variable, double minThickness, double maxThickness) {
        if (materialId == null || materialId.trim().isEmpty()) {
            throw new IllegalArgumentException("materialId は必須です");
        }
        if (thicknessKind == null) {
            throw new IllegalArgumentException("thicknessKind は null 不可です");
        }
        if (!(minThickness <= maxThickness)) {
            throw new IllegalArgumentException(
                    "minThickness は maxThickness 以下が必要です: " + minThickness + " > " + maxThickness);
        }
        this.materialId = materialId;
        this.thickness = thickness;
        this.thicknessKind = thicknessKind;
        this.variable = variable;
        this.minThickness = minThickness;
        this.maxThickness = maxThickness;
    }

    /**
     * 固定層（最適化の変数にしない層）を生成します。
     *
     * @param materialId 材料名です
     * @param thickness 膜厚です
     * @param thicknessKind 膜厚の表し方です
     * @return 層です
     */
    public static DesignLayer fixed(String materialId, double thickness,
            ThicknessKind thicknessKind) {
        return new DesignLayer(materialId, thickness, thicknessKind, false, thickness, thickness);
    }
}
