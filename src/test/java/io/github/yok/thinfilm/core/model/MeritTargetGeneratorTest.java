package io.github.yok.thinfilm.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class MeritTargetGeneratorTest {

    @Test
    void includesBothWavelengthEndpoints() {
        List<MeritTarget> targets = MeritTargetGenerator.generate(TargetGrid.builder()
                .wavelengthMin(0.45).wavelengthMax(0.65).wavelengthStep(0.005).build());

        assertThat(targets).hasSize(41);
        assertThat(targets.get(0).getWavelength()).isEqualTo(0.45);
        assertThat(targets.get(40).getWavelength()).isEqualTo(0.65);
        assertThat(targets.get(7).getWavelength()).isEqualTo(0.485);
        assertThat(targets).allSatisfy(t -> {
            assertThat(t.isEnabled()).isTrue();
            assertThat(t.getMetric()).isEqualTo(TargetMetric.RAVE);
            assertThat(t.getAngleOfIncidenceDeg()).isZero();
        });
    }

    @Test
    void sweepsAnglesOuterAndWavelengthsInner() {
        List<MeritTarget> targets = MeritTargetGenerator.generate(TargetGrid.builder()
                .metric(TargetMetric.TS).compare(CompareType.GREATER_OR_EQUAL).targetValue(99.0)
                .weight(2.0).wavelengthMin(0.5).wavelengthMax(0.6).wavelengthStep(0.05)
                .aoiMin(0.0).aoiMax(30.0).aoiStep(15.0).build());

        assertThat(targets).hasSize(9);
        assertThat(targets).extracting(MeritTarget::getAngleOfIncidenceDeg).containsExactly(0.0,
                0.0, 0.0, 15.0, 15.0, 15.0, 30.0, 30.0, 30.0);
        assertThat(targets.get(4).getWavelength()).isEqualTo(0.55);
        assertThat(targets.get(4).getCompare()).isEqualTo(CompareType.GREATER_OR_EQUAL);
        assertThat(targets.get(4).getTargetValue()).isEqualTo(99.0);
        assertThat(targets.get(4).getWeight()).isEqualTo(2.0);
    }

    @Test
    void angleStepBelowOneDegreeIsRaised() {
        List<MeritTarget> targets = MeritTargetGenerator.generate(TargetGrid.builder()
                .wavelengthMin(0.55).wavelengthMax(0.55).aoiMin(0.0).aoiMax(2.0).aoiStep(0.1)
                .build());

        assertThat(targets).extracting(MeritTarget::getAngleOfIncidenceDeg).containsExactly(0.0,
                1.0, 2.0);
    }

    @Test
    void rejectsInvalidGrid() {
        assertThatThrownBy(() -> MeritTargetGenerator
                .generate(TargetGrid.builder().wavelengthStep(0.0).build()))
                        .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MeritTargetGenerator
                .generate(TargetGrid.builder().wavelengthMin(0.7).wavelengthMax(0.5).build()))
                        .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void builderDefaultsDescribeZeroReflectanceTarget() {
        MeritTarget target = MeritTarget.builder().build();

        assertThat(target.isEnabled()).isTrue();
        assertThat(target.getMetric()).isEqualTo(TargetMetric.RAVE);
        assertThat(target.getWavelength()).isEqualTo(0.55);
        assertThat(target.getCompare()).isEqualTo(CompareType.EQUAL);
        assertThat(target.getWeight()).isEqualTo(1.0);
        assertThatThrownBy(() -> MeritTarget.builder().weight(-1.0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
