package io.github.yok.thinfilm.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.thinfilm.core.dispersion.CauchyDispersion;
import io.github.yok.thinfilm.core.dispersion.MaterialCatalog;
import io.github.yok.thinfilm.core.dispersion.SellmeierDispersion;
import io.github.yok.thinfilm.core.dispersion.TabulatedDispersion;
import io.github.yok.thinfilm.core.model.CoatingStack;
import io.github.yok.thinfilm.core.model.CompareType;
import io.github.yok.thinfilm.core.model.DesignPreset;
import io.github.yok.thinfilm.core.model.MeritTarget;
import io.github.yok.thinfilm.core.model.TargetMetric;
import io.github.yok.thinfilm.core.model.ThicknessKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class DesignAssemblerTest {

    private static ThinFilmProperties.Layer layer(String material, double thickness) {
        ThinFilmProperties.Layer l = new ThinFilmProperties.Layer();
        l.setMaterial(material);
        l.setThickness(thickness);
        return l;
    }

    @Test
    void buildsStackFromLayersWithDefaultBounds() {
        ThinFilmProperties p = new ThinFilmProperties();
        p.getDesign().setName("custom");
        ThinFilmProperties.Layer bounded = layer("TiO2", 0.05);
        bounded.setThicknessKind(ThicknessKind.PHYSICAL);
        bounded.setMinThickness(0.01);
        bounded.setMaxThickness(0.2);
        ThinFilmProperties.Layer fixed = layer("SiO2", 0.25);
        fixed.setVariable(false);
        p.getDesign().setLayers(List.of(layer("MgF2", 0.1), bounded, fixed));

        CoatingStack stack = new DesignAssembler(p).createStack();

        assertThat(stack.getName()).isEqualTo("custom");
        assertThat(stack.getSubstrateId()).isEqualTo("N-BK7");
        assertThat(stack.layerCount()).isEqualTo(3);
        assertThat(stack.layer(0).getThicknessKind()).isEqualTo(ThicknessKind.OPTICAL);
        assertThat(stack.layer(0).getMinThickness()).isCloseTo(0.01, within(1e-12));
        assertThat(stack.layer(0).getMaxThickness()).isCloseTo(1.0, within(1e-12));
        assertThat(stack.layer(1).getMinThickness()).isEqualTo(0.01);
        assertThat(stack.layer(1).getMaxThickness()).isEqualTo(0.2);
        assertThat(stack.variableLayerIndices()).containsExactly(0, 1);
    }

    @Test
    void presetOverridesLayersAndTargets() {
        ThinFilmProperties p = new ThinFilmProperties();
        p.getDesign().setPreset(DesignPreset.V_COAT);
        p.getTargets().getGenerator().setEnabled(true);

        DesignAssembler assembler = new DesignAssembler(p);

        assertThat(assembler.createStack().layerCount()).isEqualTo(2);
        assertThat(assembler.createTargets()).hasSize(21);
    }

    @Test
    void missingLayersIsConfigurationError() {
        assertThatThrownBy(() -> new DesignAssembler(new ThinFilmProperties()).createStack())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void combinesExplicitAndGeneratedTargets() {
        ThinFilmProperties p = new ThinFilmProperties();
        ThinFilmProperties.Targets.Target explicit = new ThinFilmProperties.Targets.Target();
        explicit.setMetric(TargetMetric.TAVE);
        explicit.setCompare(CompareType.GREATER_OR_EQUAL);
        explicit.setTargetValue(99.0);
        explicit.setAoi(30.0);
        p.getTargets().setExplicit(List.of(explicit));
        ThinFilmProperties.Targets.Generator g = p.getTargets().getGenerator();
        g.setEnabled(true);
        g.setWavelengthMin(0.5);
        g.setWavelengthMax(0.6);
        g.setWavelengthStep(0.05);

        List<MeritTarget> targets = new DesignAssembler(p).createTargets();

        assertThat(targets).hasSize(4);
        assertThat(targets.get(0).getMetric()).isEqualTo(TargetMetric.TAVE);
        assertThat(targets.get(0).getAngleOfIncidenceDeg()).isEqualTo(30.0);
        assertThat(targets.get(0).getCompare()).isEqualTo(CompareType.GREATER_OR_EQUAL);
        assertThat(targets.subList(1, 4)).extracting(MeritTarget::getWavelength)
                .containsExactly(0.5, 0.55, 0.6);
    }

    @Test
    void convertsCustomMaterialDefinitions() {
        ThinFilmProperties.CustomMaterial cauchy = new ThinFilmProperties.CustomMaterial();
        cauchy.setName("SiN");
        cauchy.setModel(ThinFilmProperties.DispersionModel.CAUCHY);
        cauchy.setCoefficients(List.of(1.98, 0.012));
        assertThat(DesignAssembler.toFormula(cauchy)).isInstanceOf(CauchyDispersion.class);
        assertThat(DesignAssembler.toFormula(cauchy).indexAt(1.0).getN())
                .isCloseTo(1.992, within(1e-12));

        ThinFilmProperties.CustomMaterial sellmeier = new ThinFilmProperties.CustomMaterial();
        sellmeier.setName("TiO2-mod");
        sellmeier.setModel(ThinFilmProperties.DispersionModel.SELLMEIER);
        sellmeier.setCoefficients(List.of(5.913, 0.2441, 0.0803));
        sellmeier.setK(-0.001);
        SellmeierDispersion s = (SellmeierDispersion) DesignAssembler.toFormula(sellmeier);
        assertThat(s.getA()).isEqualTo(5.913);
        assertThat(s.getK()).isEqualTo(-0.001);

        ThinFilmProperties.CustomMaterial table = new ThinFilmProperties.CustomMaterial();
        table.setName("Ag");
        table.setModel(ThinFilmProperties.DispersionModel.TABULATED);
        table.setTable(List.of(List.of(0.4, 0.17, -1.95), List.of(0.6, 0.12, -3.7)));
        assertThat(DesignAssembler.toFormula(table)).isInstanceOf(TabulatedDispersion.class);

        cauchy.setCoefficients(List.of(1.98));
        assertThatThrownBy(() -> DesignAssembler.toFormula(cauchy))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void registersCustomMaterialsAndSubstrates() {
        ThinFilmProperties p = new ThinFilmProperties();
        ThinFilmProperties.CustomMaterial glass = new ThinFilmProperties.CustomMaterial();
        glass.setName("GLASS17");
        glass.setN(1.7);
        p.setSubstrates(List.of(glass));
        ThinFilmProperties.CustomMaterial ito = new ThinFilmProperties.CustomMaterial();
        ito.setName("ITO");
        ito.setN(1.9);
        ito.setK(-0.01);
        p.setMaterials(List.of(ito));

        MaterialCatalog catalog =
                new DesignAssembler(p).registerCustomMaterials(MaterialCatalog.withStandardMaterials());

        assertThat(catalog.substrateIndex("GLASS17", 0.55)).isEqualTo(1.7);
        assertThat(catalog.materialIndex("ITO", 0.55).getK()).isEqualTo(-0.01);
    }

    @Test
    void multilineSummaryListsEverySection() {
        String text = new ThinFilmProperties().toMultilineString();

        assertThat(text).contains("  design:", "  targets:", "  materials:", "  optimization:",
                "  output:", "    substrate: N-BK7", "    mode: LOCAL");
        assertThat(new ThinFilmProperties().toString()).contains("thinfilm=");
    }
}
