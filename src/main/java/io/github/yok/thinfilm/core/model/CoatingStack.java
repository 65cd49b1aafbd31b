package io.github.yok.thinfilm.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * 入射媒質・多層膜・基板からなるコーティング設計を表すクラスです。
 *
 * <p>
 * 層は入射側（index 0）から基板側（最後）の順に並びます。 最適化は可変層の膜厚だけを書き換え、層の追加・削除・並べ替えは行いません。
 * </p>
 */
@Getter
public final class CoatingStack {

    /**
     * 入射媒質の屈折率の既定値（空気）です。
     */
    public static final double DEFAULT_INCIDENT_INDEX = 1.0;

    /**
     * 設計名です。
     */
    private final String name;

    /**
     * 基板名です。
     */
    private final String substrateId;

    /**
     * 入射媒質の屈折率です。
     */
    private final double incidentIndex;

    /**
     * 光学膜厚を物理膜厚に換算するときの基準波長（µm）です。
     */
    private final double referenceWavelength;

    /**
     * 層の並びです（入射側から基板側）。
     */
    @Getter(lombok.AccessLevel.NONE)
    private final List<DesignLayer> layers;

    /**
     * コーティング設計を生成します。
     *
     * @param name 設計名です
     * @param substrateId 基板名です（null/空不可）
     * @param incidentIndex 入射媒質の屈折率です（正の値）
     * @param referenceWavelength 基準波長（µm、正の値）です
     * @param layers 層の並びです（null の場合は空）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CoatingStack(String name, String substrateId, double incidentIndex,
            double referenceWavelength, List<DesignLayer> layers) {
        if (substrateId == null || substrateId.trim().isEmpty()) {
            throw new IllegalArgumentException("substrateId は必須です");
        }
        if (!(incidentIndex > 0.0)) {
            throw new IllegalArgumentException("incidentIndex は正の値が必要です: " + incidentIndex);
        }
        if (!(referenceWavelength > 0.0)) {
            throw new IllegalArgumentException(
                    "referenceWavelength は正の値が必要です: " + referenceWavelength);
        }
        this.name = (name == null || name.trim().isEmpty()) ? "design" : name;
        this.substrateId = substrateId;
        this.incidentIndex = incidentIndex;
        this.referenceWavelength = referenceWavelength;
        this.layers = new ArrayList<>();
        if (layers != null) {
            for (DesignLayer layer : layers) {
                if (layer == null) {
                    throw new IllegalArgumentException("layers に null が含まれています");
                }
                this.layers.add(layer);
            }
        }
    }

    /**
     * 層の並び（読み取り専用）を返します。
     *
     * @return 層の並びです
     */
    public List<DesignLayer> getLayers() {
        return Collections.unmodifiableList(layers);
    }

    /**
     * 層数を返します。
     *
     * @return 層数です
     */
    public int layerCount() {
        return layers.size();
    }

    /**
     * 指定位置の層を返します。
     *
     * @param index 層の位置です
     * @return 層です
     */
    public DesignLayer layer(int index) {
        return layers.get(index);
    }

    /**
     * 層を末尾（基板側）に追加します。
     *
     * <p>
     * 可変層として追加し、探索範囲は膜厚の 0.1 倍から 10 倍とします。
     * </p>
     *
     * @param materialId 材料名です
     * @param thickness 膜厚です
     * @param thicknessKind 膜厚の表し方です
     * @return 追加した層です
     */
    public DesignLayer addLayer(String materialId, double thickness, ThicknessKind thicknessKind) {
        DesignLayer layer = new DesignLayer(materialId, thickness, thicknessKind, true,
                thickness * 0.1, thickness * 10.0);
        layers.add(layer);
        return layer;
    }

    /**
     * 指定位置の層を削除します。範囲外の位置は無視します。
     *
     * @param index 層の位置です
     */
    public void removeLayerAt(int index) {
        if (index >= 0 && index < layers.size()) {
            layers.remove(index);
        }
    }

    /**
     * 可変層の位置を層の並び順で返します。
     *
     * @return 可変層の位置です
     */
    public int[] variableLayerIndices() {
        int count = 0;
        for (DesignLayer layer : layers) {
            if (layer.isVariable()) {
                count++;
            }
        }
        int[] indices = new int[count];
        int j = 0;
        for (int i = 0; i < layers.size(); i++) {
            if (layers.get(i).isVariable()) {
                indices[j++] = i;
            }
        }
        return indices;
    }

    /**
     * 可変層の膜厚を返します。
     *
     * @return 可変層の膜厚です
     */
    public double[] variableThicknesses() {
        int[] indices = variableLayerIndices();
        double[] x = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            x[i] = layers.get(indices[i]).getThickness();
        }
        return x;
    }

    /**
     * 可変層の膜厚下限を返します。
     *
     * @return 膜厚下限です
     */
    public double[] lowerBounds() {
        int[] indices = variableLayerIndices();
        double[] lower = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            lower[i] = layers.get(indices[i]).getMinThickness();
        }
        return lower;
    }

    /**
     * 可変層の膜厚上限を返します。
     *
     * @return 膜厚上限です
     */
    public double[] upperBounds() {
        int[] indices = variableLayerIndices();
        double[] upper = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            upper[i] = layers.get(indices[i]).getMaxThickness();
        }
        return upper;
    }

    /**
     * 可変層の膜厚をこの設計に書き込みます。
     *
     * @param thicknesses 可変層の膜厚（可変層と同数）です
     * @throws IllegalArgumentException 要素数が可変層の数と一致しない場合に発生します
     */
    public void setVariableThicknesses(double[] thicknesses) {
        int[] indices = variableLayerIndices();
        checkLength(thicknesses, indices.length);
        for (int i = 0; i < indices.length; i++) {
            layers.set(indices[i], layers.get(indices[i]).withThickness(thicknesses[i]));
        }
    }

    /**
     * 可変層の膜厚だけを差し替えた新しい設計を返します。この設計は変更しません。
     *
     * @param thicknesses 可変層の膜厚（可変層と同数）です
     * @return 新しい設計です
     * @throws IllegalArgumentException 要素数が可変層の数と一致しない場合に発生します
     */
    public CoatingStack withVariableThicknesses(double[] thicknesses) {
        CoatingStack view = copy();
        view.setVariableThicknesses(thicknesses);
        return view;
    }

    /**
     * この設計の複製を返します。層は不変なので共有します。
     *
     * @return 複製です
     */
    public CoatingStack copy() {
        return new CoatingStack(name, substrateId, incidentIndex, referenceWavelength, layers);
    }

    private static void checkLength(double[] thicknesses, int expected) {
        if (thicknesses == null) {
            throw new IllegalArgumentException("thicknesses は null 不可です");
        }
        if (thicknesses.length != expected) {
            throw new IllegalArgumentException(
                    "可変層は " + expected + " 層ですが、膜厚が " + thicknesses.length + " 個指定されました");
        }
    }
}
