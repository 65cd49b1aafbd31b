package io.github.yok.thinfilm.core.solver;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Value;

/**
 * 膜厚最適化の結果を表すクラスです。
 */
@Value
public class OptimizationOutcome {

    /**
     * 最適化が成功したかどうかです（打ち切りも成功として扱います）。
     */
    boolean success;

    /**
     * 結果の説明です。
     */
    String message;

    /**
     * 最適化前の評価関数の値です。
     */
    double initialMerit;

    /**
     * 最適化後の評価関数の値です。
     */
    double finalMerit;

    /**
     * Levenberg-Marquardt 法の外側反復の回数です（大域探索では全試行の合計）。
     */
    int iterations;

    /**
     * 最適化後の可変層の膜厚です（層の並び順）。
     */
    @Getter(AccessLevel.NONE)
    double[] optimizedThicknesses;

    /**
     * 最後まで実行した試行の数です（局所最適化では 1）。
     */
    int trials;

    /**
     * 途中で打ち切られたかどうかです。
     */
    boolean cancelled;

    /**
     * 最適化後の可変層の膜厚の複製を返します。
     *
     * @return 可変層の膜厚です（層の並び順）
     */
    public double[] getOptimizedThicknesses() {
        return optimizedThicknesses.clone();
    }

    /**
     * 失敗の結果を生成します。
     *
     * @param message 失敗の理由です
     * @return 失敗の結果です
     */
    public static OptimizationOutcome failure(String message) {
        return new OptimizationOutcome(false, message, Double.NaN, Double.NaN, 0, new double[0], 0,
                false);
    }
}
