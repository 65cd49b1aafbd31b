package io.github.yok.thinfilm.core.optics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.thinfilm.core.dispersion.ConstantDispersion;
import io.github.yok.thinfilm.core.dispersion.MaterialCatalog;
import io.github.yok.thinfilm.core.model.CoatingStack;
import io.github.yok.thinfilm.core.model.DesignLayer;
import io.github.yok.thinfilm.core.model.ThicknessKind;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TransferMatrixEngineTest {

    private MaterialCatalog catalog;
    private TransferMatrixEngine engine;

    @BeforeEach
    void setUp() {
        catalog = MaterialCatalog.withStandardMaterials();
        catalog.registerMaterial("L", new ConstantDispersion(1.38, 0.0));
        catalog.registerMaterial("H", new ConstantDispersion(2.30, 0.0));
        catalog.registerMaterial("METAL", new ConstantDispersion(2.0, -0.5));
        catalog.registerSubstrate("N15", new ConstantDispersion(1.5, 0.0));
        catalog.registerSubstrate("N17", new ConstantDispersion(1.7, 0.0));
        engine = new TransferMatrixEngine(catalog);
    }

    private static CoatingStack stack(String substrate, double incidentIndex,
            DesignLayer... layers) {
        return new CoatingStack("test", substrate, incidentIndex, 0.55, List.of(layers));
    }

    private static DesignLayer physical(String material, double thicknessUm) {
        return DesignLayer.fixed(material, thicknessUm, ThicknessKind.PHYSICAL);
    }

    @Test
    void bareSubstrateGivesFresnelReflectance() {
        CoatingStack bare = stack("N-BK7", 1.0);
        double n = catalog.substrateIndex("N-BK7", 0.55);
        double expected = Math.pow((n - 1.0) / (n + 1.0), 2) * 100.0;

        OpticalResult r = engine.evaluate(bare, 0.55, 0.0);

        assertThat(r.getRs()).isCloseTo(expected, within(1e-9));
        assertThat(r.getRave()).isCloseTo(4.2388, within(0.01));
        assertThat(r.getTave()).isCloseTo(100.0 - expected, within(1e-9));
        assertThat(r.isTotalInternalReflection()).isFalse();
    }

    @Test
    void quarterWaveMgF2ReducesReflectance() {
        CoatingStack bare = stack("N-BK7", 1.0);
        CoatingStack coated = new CoatingStack("slar", "N-BK7", 1.0, 0.55, new ArrayList<>());
        coated.addLayer("MgF2", 0.25, ThicknessKind.OPTICAL);

        double nLayer = catalog.materialIndex("MgF2", 0.55).getN();
        double nSub = catalog.substrateIndex("N-BK7", 0.55);
        double expected = Math.pow((nSub - nLayer * nLayer) / (nSub + nLayer * nLayer), 2) * 100.0;

        OpticalResult r = engine.evaluate(coated, 0.55, 0.0);

        assertThat(r.getRave()).isCloseTo(expected, within(1e-6));
        assertThat(r.getRave()).isCloseTo(1.247, within(0.02));
        assertThat(r.getRave()).isLessThan(engine.evaluate(bare, 0.55, 0.0).getRave());
    }

    @Test
    void losslessStacksConserveEnergy() {
        CoatingStack stack = stack("N-BK7", 1.0, physical("H", 0.06), physical("L", 0.1),
                physical("H", 0.12), physical("L", 0.09));

        for (double wavelength : new double[] {0.42, 0.55, 0.7}) {
            for (double aoi : new double[] {0.0, 20.0, 45.0, 70.0}) {
                OpticalResult r = engine.evaluate(stack, wavelength, aoi);
                assertThat(r.getRs() + r.getTs()).isCloseTo(100.0, within(1e-6));
                assertThat(r.getRp() + r.getTp()).isCloseTo(100.0, within(1e-6));
            }
        }
    }

    @Test
    void absorbingLayerRemovesEnergy() {
        CoatingStack stack = stack("N-BK7", 1.0, physical("METAL", 0.02));

        OpticalResult r = engine.evaluate(stack, 0.55, 0.0);

        assertThat(r.getRave()).isBetween(0.0, 100.0);
        assertThat(r.getTave()).isBetween(0.0, 100.0);
        assertThat(r.getRave() + r.getTave()).isLessThan(99.0);
    }

    @Test
    void normalIncidenceMakesPolarizationsIdentical() {
        CoatingStack stack = stack("N-BK7", 1.0, physical("H", 0.06), physical("METAL", 0.01),
                physical("L", 0.1));

        OpticalResult r = engine.evaluate(stack, 0.5, 0.0);

        assertThat(r.getRs()).isEqualTo(r.getRp());
        assertThat(r.getTs()).isEqualTo(r.getTp());
    }

    @Test
    void obliqueIncidenceSplitsPolarizations() {
        CoatingStack bare = stack("N15", 1.0);

        OpticalResult at45 = engine.evaluate(bare, 0.55, 45.0);
        assertThat(at45.getRs()).isGreaterThan(at45.getRp());

        // Brewster 角では p 偏光の反射が消える
        OpticalResult brewster = engine.evaluate(bare, 0.55, Math.toDegrees(Math.atan(1.5)));
        assertThat(brewster.getRp()).isCloseTo(0.0, within(1e-10));
    }

    @Test
    void beyondCriticalAngleIsTotalInternalReflection() {
        CoatingStack glassToAir = stack("AIR", 1.5);
        double aoi = Math.toDegrees(Math.asin(1.0 / 1.5)) + 1.0;

        OpticalResult r = engine.evaluate(glassToAir, 0.55, aoi);

        assertThat(r.isTotalInternalReflection()).isTrue();
        assertThat(r.getRs()).isEqualTo(100.0);
        assertThat(r.getRp()).isEqualTo(100.0);
        assertThat(r.getTs()).isZero();
        assertThat(r.getTp()).isZero();
    }

    @Test
    void denserIncidentMediumTraversesLayersFromSubstrateSide() {
        // 1.7 側から入射する設計は層を逆順にたどるため、1.5 側から見た鏡像設計と一致する
        CoatingStack fromDense = stack("N15", 1.7, physical("L", 0.11), physical("H", 0.04));
        CoatingStack mirrored = stack("N17", 1.5, physical("L", 0.11), physical("H", 0.04));

        OpticalResult a = engine.evaluate(fromDense, 0.6, 0.0);
        OpticalResult b = engine.evaluate(mirrored, 0.6, 0.0);

        assertThat(a.getRave()).isCloseTo(b.getRave(), within(1e-9));
        assertThat(a.getTave()).isCloseTo(b.getTave(), within(1e-9));
    }

    @Test
    void spectrumAndAngularSweepsCoverRequestedRange() {
        CoatingStack stack = stack("N-BK7", 1.0, physical("L", 0.1));

        SpectralResponse spectrum = engine.spectrum(stack, 0.4, 0.7, 31, 0.0);
        assertThat(spectrum.getAxis()).isEqualTo(SpectralResponse.Axis.WAVELENGTH);
        assertThat(spectrum.size()).isEqualTo(31);
        assertThat(spectrum.getResults()).hasSize(31);
        assertThat(spectrum.getAbscissa()[0]).isEqualTo(0.4);
        assertThat(spectrum.getAbscissa()[30]).isCloseTo(0.7, within(1e-12));
        assertThat(spectrum.getAbscissa()[10]).isCloseTo(0.5, within(1e-12));

        SpectralResponse angular = engine.angularResponse(stack, 0.55, 0.0, 60.0, 7);
        assertThat(angular.getAxis()).isEqualTo(SpectralResponse.Axis.ANGLE);
        assertThat(angular.getAbscissa()).containsExactly(
                new double[] {0.0, 10.0, 20.0, 30.0, 40.0, 50.0, 60.0}, within(1e-12));

        assertThatThrownBy(() -> engine.spectrum(stack, 0.4, 0.7, 1, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.spectrum(stack, 0.7, 0.4, 10, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sweepResultCannotBeChangedByCaller() {
        CoatingStack stack = stack("N-BK7", 1.0, physical("L", 0.1));
        SpectralResponse spectrum = engine.spectrum(stack, 0.4, 0.7, 4, 0.0);

        spectrum.getAbscissa()[0] = 9.9;

        assertThat(spectrum.getAbscissa()[0]).isEqualTo(0.4);
        assertThatThrownBy(() -> spectrum.getResults().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(spectrum.size()).isEqualTo(4);
    }

    @Test
    void opticalThicknessUsesReferenceWavelengthIndex() {
        CoatingStack stack = new CoatingStack("x", "N-BK7", 1.0, 0.55, new ArrayList<>());
        DesignLayer layer = stack.addLayer("MgF2", 0.25, ThicknessKind.OPTICAL);

        double n = catalog.materialIndex("MgF2", 0.55).getN();

        assertThat(engine.physicalThickness(stack, layer)).isCloseTo(0.25 * 0.55 / n,
                within(1e-12));
        assertThat(engine.physicalThickness(stack, physical("MgF2", 0.1))).isEqualTo(0.1);
    }

    @Test
    void rejectsInvalidArguments() {
        CoatingStack bare = stack("N-BK7", 1.0);

        assertThatThrownBy(() -> engine.evaluate(bare, 0.0, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.evaluate(bare, 0.55, 90.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.evaluate(stack("N-BK7", 1.0, physical("Nope", 0.1)), 0.55,
                0.0)).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Nope");
    }
}
