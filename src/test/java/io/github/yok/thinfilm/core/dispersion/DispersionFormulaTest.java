package io.github.yok.thinfilm.core.dispersion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class DispersionFormulaTest {

    @Test
    void constantIgnoresWavelength() {
        ConstantDispersion d = new ConstantDispersion(1.45, -0.01);

        assertThat(d.indexAt(0.4)).isEqualTo(new ComplexIndex(1.45, -0.01));
        assertThat(d.indexAt(1.2)).isEqualTo(new ComplexIndex(1.45, -0.01));
    }

    @Test
    void cauchyFollowsInverseSquareLaw() {
        CauchyDispersion d = new CauchyDispersion(1.5, 0.01, 0.001, 0.0);

        // 1.5 + 0.01/0.25 + 0.001/0.0625
        assertThat(d.indexAt(0.5).getN()).isCloseTo(1.556, within(1e-12));
        assertThat(d.indexAt(0.5).getK()).isZero();
        assertThat(d.refractiveIndex(0.4)).isGreaterThan(d.refractiveIndex(0.7));
    }

    @Test
    void sellmeierReproducesSchottBk7() {
        SellmeierDispersion bk7 = SellmeierDispersion.standard(1.5168, 1.03961212, 0.00600069867,
                0.231792344, 0.0200179144, 1.01046945, 103.560653);

        // d 線（587.56 nm）
        assertThat(bk7.indexAt(0.5875618).getN()).isCloseTo(1.5168, within(1e-4));
    }

    @Test
    void sellmeierFallsBackWhenSquareIsNotPositive() {
        // λ² が C をわずかに下回ると n² は大きな負になる
        SellmeierDispersion d = SellmeierDispersion.standard(1.23, 1.0, 0.25);

        assertThat(d.refractiveIndexSquared(0.49)).isNegative();
        assertThat(d.indexAt(0.49).getN()).isEqualTo(1.23);
    }

    @Test
    void sellmeierRejectsUnpairedTerms() {
        assertThatThrownBy(() -> SellmeierDispersion.standard(1.5, 1.0, 0.01, 0.2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SellmeierDispersion.standard(1.5, 1, 1, 1, 1, 1, 1, 1, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tabulatedInterpolatesAndClamps() {
        TabulatedDispersion d = new TabulatedDispersion(
                new double[][] {{0.6, 1.7, -0.1}, {0.4, 1.5, 0.0}});

        ComplexIndex mid = d.indexAt(0.5);
        assertThat(mid.getN()).isCloseTo(1.6, within(1e-12));
        assertThat(mid.getK()).isCloseTo(-0.05, within(1e-12));

        assertThat(d.indexAt(0.3).getN()).isEqualTo(1.5);
        assertThat(d.indexAt(0.9).getN()).isEqualTo(1.7);
        assertThat(d.indexAt(0.6).getK()).isEqualTo(-0.1);
        assertThat(d.getWavelengths()).containsExactly(0.4, 0.6);
    }

    @Test
    void tabulatedTableCannotBeChangedThroughGetters() {
        TabulatedDispersion d = new TabulatedDispersion(
                new double[][] {{0.4, 1.5, 0.0}, {0.6, 1.7, -0.1}});

        d.getWavelengths()[1] = 0.3;
        d.getN()[0] = 9.0;
        d.getK()[1] = -5.0;

        assertThat(d.indexAt(0.5).getN()).isCloseTo(1.6, within(1e-12));
        assertThat(d.indexAt(0.6).getK()).isEqualTo(-0.1);
        assertThat(d.getWavelengths()).containsExactly(0.4, 0.6);
    }

    @Test
    void sellmeierCoefficientsCannotBeChangedThroughGetters() {
        SellmeierDispersion d = SellmeierDispersion.standard(1.38, 0.48755108, 0.001882178);
        double before = d.indexAt(0.55).getN();

        d.getB()[0] = 5.0;
        d.getC()[0] = 0.2;

        assertThat(d.indexAt(0.55).getN()).isEqualTo(before);
        assertThat(d.getB()).containsExactly(0.48755108);
    }

    @Test
    void tabulatedRejectsMalformedRows() {
        assertThatThrownBy(() -> new TabulatedDispersion(new double[0][]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TabulatedDispersion(new double[][] {{0.5, 1.5}}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
