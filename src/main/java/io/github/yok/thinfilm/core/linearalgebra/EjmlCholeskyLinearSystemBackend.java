package io.github.yok.thinfilm.core.linearalgebra;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;

/**
 * EJML の Cholesky 分解で対称正定値の連立一次方程式を解くクラスです。
 *
 * <p>
 * Levenberg-Marquardt 法の正規方程式 (JᵀJ + μ·diag) step = −Jᵀr を想定しています。 分解に失敗した場合や解に NaN/∞
 * が含まれる場合は {@link IllegalStateException} を送出します。
 * </p>
 */
public final class EjmlCholeskyLinearSystemBackend implements LinearSystemBackend {

    /**
     * A x = b を解きます。
     *
     * @param a 対称正定値の係数行列です
     * @param b 右辺ベクトルです
     * @return 解 x です
     * @throws IllegalArgumentException 引数が null、または次元が合わない場合に発生します
     * @throws IllegalStateException 分解に失敗した、または解が有限でない場合に発生します
     */
    @Override
    public double[] solve(DMatrixRMaj a, double[] b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("a/b は null 不可です");
        }
        int n = a.numRows;
        if (a.numCols != n || b.length != n) {
            throw new IllegalArgumentException("次元が一致しません: A=" + a.numRows + "x" + a.numCols
                    + ", b=" + b.length);
        }

        LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.symmPosDef(n);

        // 分解器が入力を書き換える場合に備えて複製を渡す
        if (!solver.setA(a.copy())) {
            throw new IllegalStateException("Cholesky 分解に失敗しました（EJML）");
        }

        DMatrixRMaj rhs = new DMatrixRMaj(n, 1, true, b);
        DMatrixRMaj x = new DMatrixRMaj(n, 1);
        solver.solve(rhs, x);

        if (MatrixFeatures_DDRM.hasUncountable(x)) {
            throw new IllegalStateException("連立一次方程式の解が有限ではありません（EJML）");
        }
        return x.getData().clone();
    }
}
