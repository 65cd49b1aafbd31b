package io.github.yok.thinfilm.core.linearalgebra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class EjmlCholeskyLinearSystemBackendTest {

    private final LinearSystemBackend backend = new EjmlCholeskyLinearSystemBackend();

    @Test
    void solvesSymmetricPositiveDefiniteSystem() {
        DMatrixRMaj a = new DMatrixRMaj(new double[][] {{4.0, 1.0}, {1.0, 3.0}});

        double[] x = backend.solve(a, new double[] {1.0, 2.0});

        assertThat(x[0]).isCloseTo(1.0 / 11.0, within(1e-12));
        assertThat(x[1]).isCloseTo(7.0 / 11.0, within(1e-12));
    }

    @Test
    void leavesInputMatrixUntouched() {
        DMatrixRMaj a = new DMatrixRMaj(new double[][] {{2.0, 0.5}, {0.5, 1.0}});
        DMatrixRMaj before = a.copy();

        backend.solve(a, new double[] {1.0, 1.0});

        assertThat(a.getData()).containsExactly(before.getData());
    }

    @Test
    void indefiniteMatrixIsReportedAsIllegalState() {
        DMatrixRMaj a = new DMatrixRMaj(new double[][] {{1.0, 2.0}, {2.0, 1.0}});

        assertThatThrownBy(() -> backend.solve(a, new double[] {1.0, 1.0}))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsMismatchedDimensions() {
        DMatrixRMaj a = new DMatrixRMaj(2, 2);

        assertThatThrownBy(() -> backend.solve(a, new double[] {1.0}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
