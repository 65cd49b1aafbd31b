package io.github.yok.thinfilm.core.solver;

import lombok.Builder;
import lombok.Value;

/**
 * Levenberg-Marquardt 法の反復条件です。
 */
@Value
@Builder(toBuilder = true)
public class LevenbergMarquardtSettings {

    /**
     * 外側反復の最大回数です。
     */
    @Builder.Default
    int maxIterations = 200;

    /**
     * 減衰係数 μ の初期値です。
     */
    @Builder.Default
    double initialDamping = 1e-3;

    /**
     * 勾配ノルム ‖Jᵀr‖ の収束判定閾値です。
     */
    @Builder.Default
    double gradientTolerance = 1e-10;

    /**
     * ステップ長の収束判定閾値（‖step‖ &lt; tol·(‖x‖ + tol)）です。
     */
    @Builder.Default
    double stepTolerance = 1e-10;

    /**
     * 評価関数の相対改善量の収束判定閾値です。
     */
    @Builder.Default
    double functionTolerance = 1e-10;

    /**
     * 既定値の反復条件を返します。
     *
     * @return 既定値の反復条件です
     */
    public static LevenbergMarquardtSettings defaults() {
        return builder().build();
    }
}
