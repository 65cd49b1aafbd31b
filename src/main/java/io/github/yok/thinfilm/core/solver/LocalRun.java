package io.github.yok.thinfilm.core.solver;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Value;

/**
 * Levenberg-Marquardt 法 1 回分の実行結果です。
 */
@Value
class LocalRun {

    /**
     * 反復を止めた理由です。
     */
    enum StopReason {
        MAX_ITERATIONS("最大反復回数"), GRADIENT("勾配収束"), STEP("ステップ収束"), FUNCTION("評価関数収束"),
        DAMPING_EXHAUSTED("減衰係数の調整上限");

        private final String label;

        StopReason(String label) {
            this.label = label;
        }

        String label() {
            return label;
        }
    }

    /**
     * 最終的な膜厚ベクトルです。
     */
    @Getter(AccessLevel.NONE)
    double[] x;

    /**
     * 外側反復の回数です。
     */
    int iterations;

    /**
     * 最終的なコスト r·r です。
     */
    double cost;

    /**
     * 反復を止めた理由です。
     */
    StopReason stopReason;

    double[] getX() {
        return x.clone();
    }
}
