package io.github.yok.thinfilm.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class CoatingStackTest {

    private static CoatingStack threeLayers() {
        return new CoatingStack("test", "N-BK7", 1.0, 0.55,
                List.of(new DesignLayer("MgF2", 0.25, ThicknessKind.OPTICAL, true, 0.05, 0.5),
                        DesignLayer.fixed("SiO2", 0.1, ThicknessKind.PHYSICAL),
                        new DesignLayer("TiO2", 0.5, ThicknessKind.OPTICAL, true, 0.1, 1.0)));
    }

    @Test
    void exposesOnlyVariableLayersAsParameters() {
        CoatingStack stack = threeLayers();

        assertThat(stack.variableLayerIndices()).containsExactly(0, 2);
        assertThat(stack.variableThicknesses()).containsExactly(0.25, 0.5);
        assertThat(stack.lowerBounds()).containsExactly(0.05, 0.1);
        assertThat(stack.upperBounds()).containsExactly(0.5, 1.0);
    }

    @Test
    void setVariableThicknessesLeavesFixedLayersAlone() {
        CoatingStack stack = threeLayers();

        stack.setVariableThicknesses(new double[] {0.3, 0.7});

        assertThat(stack.layer(0).getThickness()).isEqualTo(0.3);
        assertThat(stack.layer(1).getThickness()).isEqualTo(0.1);
        assertThat(stack.layer(2).getThickness()).isEqualTo(0.7);
        assertThatThrownBy(() -> stack.setVariableThicknesses(new double[] {0.3}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withVariableThicknessesReturnsIndependentCopy() {
        CoatingStack stack = threeLayers();

        CoatingStack view = stack.withVariableThicknesses(new double[] {0.4, 0.9});

        assertThat(view.variableThicknesses()).containsExactly(0.4, 0.9);
        assertThat(stack.variableThicknesses()).containsExactly(0.25, 0.5);
        assertThat(view.getSubstrateId()).isEqualTo("N-BK7");
        assertThat(view.getName()).isEqualTo("test");
    }

    @Test
    void addLayerUsesDecadeBoundsAndRemoveIgnoresOutOfRange() {
        CoatingStack stack = new CoatingStack(null, "N-BK7", 1.0, 0.55, null);
        assertThat(stack.getName()).isEqualTo("design");

        DesignLayer added = stack.addLayer("MgF2", 0.25, ThicknessKind.OPTICAL);
        assertThat(added.isVariable()).isTrue();
        assertThat(added.getMinThickness()).isEqualTo(0.025);
        assertThat(added.getMaxThickness()).isEqualTo(2.5);

        stack.removeLayerAt(5);
        stack.removeLayerAt(-1);
        assertThat(stack.layerCount()).isEqualTo(1);
        stack.removeLayerAt(0);
        assertThat(stack.layerCount()).isZero();
    }

    @Test
    void layersViewIsReadOnly() {
        CoatingStack stack = threeLayers();

        assertThatThrownBy(() -> stack.getLayers().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void rejectsInvalidConstruction() {
        assertThatThrownBy(() -> new CoatingStack("x", "", 1.0, 0.55, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CoatingStack("x", "N-BK7", 0.0, 0.55, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CoatingStack("x", "N-BK7", 1.0, -0.55, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(
                () -> new DesignLayer("MgF2", 0.25, ThicknessKind.OPTICAL, true, 0.5, 0.1))
                        .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void blankNamesAreTreatedAsMissing() {
        assertThatThrownBy(() -> new CoatingStack("x", "  ", 1.0, 0.55, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DesignLayer.fixed(" ", 0.1, ThicknessKind.PHYSICAL))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new CoatingStack(" ", "N-BK7", 1.0, 0.55, null).getName()).isEqualTo("design");
    }
}
