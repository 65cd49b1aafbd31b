package io.github.yok.thinfilm.app;

import io.github.yok.thinfilm.core.dispersion.CauchyDispersion;
import io.github.yok.thinfilm.core.dispersion.ConstantDispersion;
import io.github.yok.thinfilm.core.dispersion.DispersionFormula;
import io.github.yok.thinfilm.core.dispersion.MaterialCatalog;
import io.github.yok.thinfilm.core.dispersion.SellmeierDispersion;
import io.github.yok.thinfilm.core.dispersion.TabulatedDispersion;
import io.github.yok.thinfilm.core.model.CoatingStack;
import io.github.yok.thinfilm.core.model.DesignLayer;
import io.github.yok.thinfilm.core.model.MeritTarget;
import io.github.yok.thinfilm.core.model.MeritTargetGenerator;
import io.github.yok.thinfilm.core.model.TargetGrid;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 設定値（thinfilm.*）からコーティング設計・評価ターゲット・追加材料を組み立てるクラスです。
 */
@Slf4j
@RequiredArgsConstructor
public final class DesignAssembler {

    /**
     * thinfilm-optimizer の設定値です。
     */
    private final ThinFilmProperties properties;

    /**
     * 設定の追加材料と追加基板をカタログに登録します。
     *
     * @param catalog 登録先のカタログです
     * @return 引数のカタログです
     */
    public MaterialCatalog registerCustomMaterials(MaterialCatalog catalog) {
        for (ThinFilmProperties.CustomMaterial m : properties.getMaterials()) {
            catalog.registerMaterial(m.getName(), toFormula(m));
            log.info("コーティング材料を登録しました。name={}、model={}", m.getName(), m.getModel());
        }
        for (ThinFilmProperties.CustomMaterial s : properties.getSubstrates()) {
            catalog.registerSubstrate(s.getName(), toFormula(s));
            log.info("基板を登録しました。name={}、model={}", s.getName(), s.getModel());
        }
        return catalog;
    }

    /**
     * 設定からコーティング設計を生成します。
     *
     * <p>
     * プリセットを指定した場合はプリセットの設計を、そうでなければ layers から設計を生成します。 膜厚の上下限を省略した層は、膜厚の 0.1 倍から 10 倍を範囲とします。
     * </p>
     *
     * @return 新しい設計です
     * @throws IllegalStateException 層がない場合に発生します
     */
    public CoatingStack createStack() {
        ThinFilmProperties.Design d = properties.getDesign();
        if (d.getPreset() != null) {
            return d.getPreset().createStack();
        }
        if (d.getLayers().isEmpty()) {
            throw new IllegalStateException("design.layers は必須です（preset を使わない場合は層を指定してください）");
        }

        List<DesignLayer> layers = new ArrayList<>();
        for (ThinFilmProperties.Layer l : d.getLayers()) {
            double min = l.getMinThickness() != null ? l.getMinThickness() : l.getThickness() * 0.1;
            double max = l.getMaxThickness() != null ? l.getMaxThickness() : l.getThickness() * 10.0;
            layers.add(new DesignLayer(l.getMaterial(), l.getThickness(), l.getThicknessKind(),
                    l.isVariable(), min, max));
        }
        return new CoatingStack(d.getName(), d.getSubstrate(), d.getIncidentIndex(),
                d.getReferenceWavelength(), layers);
    }

    /**
     * 設定から評価ターゲットを生成します。
     *
     * <p>
     * プリセットを指定した場合はプリセットのターゲットを使い、 そうでなければ explicit と generator（有効な場合）のターゲットをこの順に連結します。
     * </p>
     *
     * @return 評価ターゲットの一覧です
     */
    public List<MeritTarget> createTargets() {
        ThinFilmProperties.Design d = properties.getDesign();
        if (d.getPreset() != null) {
            return d.getPreset().createTargets();
        }

        ThinFilmProperties.Targets t = properties.getTargets();
        List<MeritTarget> targets = new ArrayList<>();
        for (ThinFilmProperties.Targets.Target e : t.getExplicit()) {
            targets.add(MeritTarget.builder().enabled(e.isEnabled()).metric(e.getMetric())
                    .wavelength(e.getWavelength()).angleOfIncidenceDeg(e.getAoi())
                    .compare(e.getCompare()).targetValue(e.getTargetValue()).weight(e.getWeight())
                    .build());
        }

        ThinFilmProperties.Targets.Generator g = t.getGenerator();
        if (g.isEnabled()) {
            targets.addAll(MeritTargetGenerator.generate(TargetGrid.builder().metric(g.getMetric())
                    .compare(g.getCompare()).targetValue(g.getTargetValue()).weight(g.getWeight())
                    .wavelengthMin(g.getWavelengthMin()).wavelengthMax(g.getWavelengthMax())
                    .wavelengthStep(g.getWavelengthStep()).aoiMin(g.getAoiMin())
                    .aoiMax(g.getAoiMax()).aoiStep(g.getAoiStep()).build()));
        }
        return targets;
    }

    /**
     * 設定の材料定義を分散式に変換します。
     *
     * @param m 材料定義です
     * @return 分散式です
     * @throws IllegalArgumentException 係数やテーブルが不正な場合に発生します
     */
    static DispersionFormula toFormula(ThinFilmProperties.CustomMaterial m) {
        double[] coefficients = toArray(m.getCoefficients());
        switch (m.getModel()) {
            case CONSTANT:
                return new ConstantDispersion(m.getN(), m.getK());
            case CAUCHY:
                if (coefficients.length < 2 || coefficients.length > 3) {
                    throw new IllegalArgumentException(
                            "Cauchy の係数は A, B, (C) の 2〜3 個が必要です: " + m.getName());
                }
                return new CauchyDispersion(coefficients[0], coefficients[1],
                        coefficients.length == 3 ? coefficients[2] : 0.0, m.getK());
            case SELLMEIER:
                if (coefficients.length % 2 == 1) {
                    return withK(SellmeierDispersion.modified(coefficients[0], m.getN(),
                            Arrays.copyOfRange(coefficients, 1, coefficients.length)), m.getK());
                }
                return withK(SellmeierDispersion.standard(m.getN(), coefficients), m.getK());
            case TABULATED:
                double[][] rows = new double[m.getTable().size()][];
                for (int i = 0; i < rows.length; i++) {
                    rows[i] = toArray(m.getTable().get(i));
                }
                return new TabulatedDispersion(rows);
            default:
                throw new IllegalStateException("未対応の分散式です: " + m.getModel());
        }
    }

    private static SellmeierDispersion withK(SellmeierDispersion s, double k) {
        if (k == 0.0) {
            return s;
        }
        return new SellmeierDispersion(s.getA(), s.getB(), s.getC(), s.getFallbackN(), k);
    }

    private static double[] toArray(List<Double> values) {
        if (values == null) {
            return new double[0];
        }
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }
}
