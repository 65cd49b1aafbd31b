package io.github.yok.thinfilm.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class ThicknessConversionTest {

    @Test
    void quarterWaveOfMgF2() {
        // λ/4 at 0.55 µm, n = 1.38
        assertThat(ThicknessConversion.opticalToPhysical(0.25, 1.38, 0.55))
                .isCloseTo(0.0996377, within(1e-6));
    }

    @Test
    void conversionsAreInverse() {
        double[] thicknesses = {0.01, 0.25, 0.5, 1.7};
        for (double optical : thicknesses) {
            double physical = ThicknessConversion.opticalToPhysical(optical, 2.2, 0.633);
            assertThat(ThicknessConversion.physicalToOptical(physical, 2.2, 0.633))
                    .isCloseTo(optical, within(1e-12));
        }
    }
}
