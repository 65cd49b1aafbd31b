package io.github.yok.thinfilm.core.linearalgebra;

import org.ejml.data.DMatrixRMaj;

/**
 * 連立一次方程式 A x = b を解くバックエンドを表すインタフェースです。
 *
 * <p>
 * 使用するライブラリや分解方法を差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface LinearSystemBackend {

    /**
     * A x = b を解きます。A と b は変更しません。
     *
     * @param a 係数行列（正方）です
     * @param b 右辺ベクトルです
     * @return 解 x です
     * @throws IllegalStateException 行列が特異・悪条件で解けない場合に発生します
     */
    double[] solve(DMatrixRMaj a, double[] b);
}
