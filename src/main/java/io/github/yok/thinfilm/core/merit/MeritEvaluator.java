package io.github.yok.thinfilm.core.merit;

import io.github.yok.thinfilm.core.model.CoatingStack;
import io.github.yok.thinfilm.core.model.MeritTarget;
import io.github.yok.thinfilm.core.optics.OpticalResult;
import io.github.yok.thinfilm.core.optics.TransferMatrixEngine;
import java.util.ArrayList;
import java.util.List;

/**
 * 評価ターゲットから残差と評価関数（重み付き二乗和）を計算するクラスです。
 *
 * <p>
 * 無効なターゲットは残差ベクトルに含めず、評価関数にも寄与しません。
 * </p>
 */
public final class MeritEvaluator {

    /**
     * 光学計算エンジンです。
     */
    private final TransferMatrixEngine engine;

    /**
     * 評価器を生成します。
     *
     * @param engine 光学計算エンジンです（null 不可）
     * @throws IllegalArgumentException engine が null の場合に発生します
     */
    public MeritEvaluator(TransferMatrixEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("engine は null 不可です");
        }
        this.engine = engine;
    }

    /**
     * ターゲットが参照する光学量を計算します。
     *
     * @param stack コーティング設計です
     * @param target 評価ターゲットです
     * @return 光学量（%）です
     */
    public double targetValue(CoatingStack stack, MeritTarget target) {
        OpticalResult result =
                engine.evaluate(stack, target.getWavelength(), target.getAngleOfIncidenceDeg());
        switch (target.getMetric()) {
            case RS:
                return result.getRs();
            case RP:
                return result.getRp();
            case RAVE:
                return result.getRave();
            case TS:
                return result.getTs();
            case TP:
                return result.getTp();
            case TAVE:
                return result.getTave();
            default:
                throw new IllegalStateException("未対応の光学量です: " + target.getMetric());
        }
    }

    /**
     * 重みを掛ける前の残差を計算します。
     *
     * <p>
     * EQUAL は {@code value - target}、LESS_OR_EQUAL は超過分、GREATER_OR_EQUAL は不足分です。
     * </p>
     *
     * @param stack コーティング設計です
     * @param target 評価ターゲットです
     * @return 残差です
     */
    public double residual(CoatingStack stack, MeritTarget target) {
        return error(targetValue(stack, target), target);
    }

    /**
     * ターゲット 1 つ分の評価関数への寄与（weight · residual²）を計算します。
     *
     * @param stack コーティング設計です
     * @param target 評価ターゲットです
     * @return 寄与です（無効なターゲットは 0）
     */
    public double contribution(CoatingStack stack, MeritTarget target) {
        if (!target.isEnabled()) {
            return 0.0;
        }
        double e = residual(stack, target);
        return target.getWeight() * e * e;
    }

    /**
     * 評価関数（有効なターゲットの寄与の総和）を計算します。
     *
     * @param stack コーティング設計です
     * @param targets 評価ターゲットです
     * @return 評価関数の値です
     */
    public double merit(CoatingStack stack, List<MeritTarget> targets) {
        double total = 0.0;
        for (MeritTarget target : targets) {
            if (target.isEnabled()) {
                total += contribution(stack, target);
            }
        }
        return total;
    }

    /**
     * 有効なターゲットの重み付き残差ベクトル（sqrt(weight) · residual）を計算します。
     *
     * <p>
     * 残差ベクトルの二乗和は {@link #merit(CoatingStack, List)} と一致します。
     * </p>
     *
     * @param stack コーティング設計です
     * @param activeTargets 有効なターゲットのみの一覧です
     * @return 残差ベクトルです
     */
    public double[] residualVector(CoatingStack stack, List<MeritTarget> activeTargets) {
        double[] residuals = new double[activeTargets.size()];
        for (int i = 0; i < residuals.length; i++) {
            MeritTarget target = activeTargets.get(i);
            residuals[i] = residual(stack, target) * Math.sqrt(target.getWeight());
        }
        return residuals;
    }

    /**
     * 有効なターゲットだけを順序を保って取り出します。
     *
     * @param targets 評価ターゲットです
     * @return 有効なターゲットの一覧です
     */
    public static List<MeritTarget> activeTargets(List<MeritTarget> targets) {
        List<MeritTarget> active = new ArrayList<>();
        if (targets != null) {
            for (MeritTarget target : targets) {
                if (target != null && target.isEnabled()) {
                    active.add(target);
                }
            }
        }
        return active;
    }

    private static double error(double value, MeritTarget target) {
        switch (target.getCompare()) {
            case EQUAL:
                return value - target.getTargetValue();
            case LESS_OR_EQUAL:
                return Math.max(0.0, value - target.getTargetValue());
            case GREATER_OR_EQUAL:
                return Math.max(0.0, target.getTargetValue() - value);
            default:
                throw new IllegalStateException("未対応の比較方法です: " + target.getCompare());
        }
    }
}
