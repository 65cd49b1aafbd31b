package io.github.yok.thinfilm.core.solver;

import io.github.yok.thinfilm.core.merit.MeritEvaluator;
import io.github.yok.thinfilm.core.model.CoatingStack;
import io.github.yok.thinfilm.core.model.MeritTarget;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 可変層の膜厚ベクトル x を変数とする最小二乗問題です。
 *
 * <p>
 * 生成時に設計を複製して保持し、残差を評価するたびに x を反映した設計を新しく作ります。 呼び出し側の設計を書き換えないため、同じ問題を複数スレッドから評価できます。
 * </p>
 */
final class ThicknessProblem {

    private final CoatingStack base;
    private final List<MeritTarget> activeTargets;
    private final MeritEvaluator evaluator;
    private final double[] lower;
    private final double[] upper;

    /**
     * 問題を生成します。
     *
     * @param stack 元の設計です（複製して保持します）
     * @param activeTargets 有効なターゲットのみの一覧です
     * @param evaluator 評価器です
     */
    ThicknessProblem(CoatingStack stack, List<MeritTarget> activeTargets,
            MeritEvaluator evaluator) {
        this.base = stack.copy();
        this.activeTargets = Collections.unmodifiableList(new ArrayList<>(activeTargets));
        this.evaluator = evaluator;
        this.lower = base.lowerBounds();
        this.upper = base.upperBounds();
    }

    int parameterCount() {
        return lower.length;
    }

    int residualCount() {
        return activeTargets.size();
    }

    double[] lowerBounds() {
        return lower.clone();
    }

    double[] upperBounds() {
        return upper.clone();
    }

    /**
     * 膜厚ベクトルを反映した設計を返します。
     *
     * @param x 可変層の膜厚です
     * @return 新しい設計です
     */
    CoatingStack view(double[] x) {
        return base.withVariableThicknesses(x);
    }

    /**
     * 重み付き残差ベクトルを計算します。
     *
     * @param x 可変層の膜厚です
     * @return 残差ベクトルです
     */
    double[] residuals(double[] x) {
        return evaluator.residualVector(view(x), activeTargets);
    }

    /**
     * 評価関数の値を計算します。
     *
     * @param x 可変層の膜厚です
     * @return 評価関数の値です
     */
    double merit(double[] x) {
        return evaluator.merit(view(x), activeTargets);
    }

    /**
     * 各成分を上下限の範囲に収めます。
     *
     * @param x 膜厚ベクトルです
     * @return 範囲に収めた新しいベクトルです
     */
    double[] clip(double[] x) {
        double[] clipped = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            clipped[i] = Math.max(lower[i], Math.min(upper[i], x[i]));
        }
        return clipped;
    }
}
