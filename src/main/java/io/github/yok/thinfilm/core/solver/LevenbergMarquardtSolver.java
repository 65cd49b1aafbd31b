package io.github.yok.thinfilm.core.solver;

import com.google.common.base.Preconditions;
import io.github.yok.thinfilm.core.linearalgebra.LinearSystemBackend;
import io.github.yok.thinfilm.core.merit.MeritEvaluator;
import io.github.yok.thinfilm.core.model.CoatingStack;
import io.github.yok.thinfilm.core.model.MeritTarget;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.NormOps_DDRM;

/**
 * 可変層の膜厚を上下限付きの Levenberg-Marquardt 法で最適化するクラスです。
 *
 * <p>
 * 残差は有効な評価ターゲットごとの sqrt(weight)·error で、コスト r·r は評価関数と一致します。 ヤコビ行列は前進差分で求め、正規方程式
 * (JᵀJ + μ·diag(JᵀJ)) step = −Jᵀr を解きます。 改善したステップは採用して μ を 1/3 に、改善しない場合は μ を 3 倍にして解き直します。
 * </p>
 *
 * <p>
 * 呼び出し側の設計は実行中に変更せず、最後に最適化後の膜厚を 1 回だけ書き込みます。 同じ設計に対して同時に最適化を実行しないでください。
 * </p>
 */
@Slf4j
public final class LevenbergMarquardtSolver {

    /**
     * 前進差分の相対刻みです。
     */
    private static final double FINITE_DIFFERENCE_STEP = 1e-7;

    /**
     * Marquardt スケーリングに使う対角成分の下限です。
     */
    private static final double DIAGONAL_FLOOR = 1e-6;

    /**
     * 1 回の外側反復で減衰係数を調整する試行の上限です。
     */
    private static final int MAX_DAMPING_ATTEMPTS = 10;

    private static final double MIN_DAMPING = 1e-15;

    private static final double MAX_DAMPING = 1e15;

    static final String NO_VARIABLE_LAYERS = "最適化する可変層がありません";

    static final String NO_ACTIVE_TARGETS = "有効な評価ターゲットがありません";

    /**
     * 評価器です。
     */
    private final MeritEvaluator evaluator;

    /**
     * 正規方程式を解くバックエンドです。
     */
    private final LinearSystemBackend linearSystem;

    /**
     * ソルバを生成します。
     *
     * @param evaluator 評価器です（null 不可）
     * @param linearSystem 正規方程式を解くバックエンドです（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public LevenbergMarquardtSolver(MeritEvaluator evaluator, LinearSystemBackend linearSystem) {
        if (evaluator == null) {
            throw new IllegalArgumentException("evaluator は null 不可です");
        }
        if (linearSystem == null) {
            throw new IllegalArgumentException("linearSystem は null 不可です");
        }
        this.evaluator = evaluator;
        this.linearSystem = linearSystem;
    }

    /**
     * 設計の可変層の膜厚を最適化し、結果を設計に書き込みます。
     *
     * <p>
     * 可変層や有効なターゲットがない場合は、設計を変更せずに失敗の結果を返します。 評価中の例外も失敗の結果として返し、呼び出し側には送出しません。
     * </p>
     *
     * @param stack コーティング設計です
     * @param targets 評価ターゲットです
     * @param settings 反復条件です
     * @return 最適化結果です
     */
    public OptimizationOutcome optimize(CoatingStack stack, List<MeritTarget> targets,
            LevenbergMarquardtSettings settings) {
        try {
            String precondition = checkPreconditions(stack, targets);
            if (precondition != null) {
                log.warn("局所最適化を実行できません。理由={}", precondition);
                return OptimizationOutcome.failure(precondition);
            }
            checkSettings(settings);

            List<MeritTarget> activeTargets = MeritEvaluator.activeTargets(targets);
            double initialMerit = evaluator.merit(stack, activeTargets);

            log.info("局所最適化を開始します。設計={}、可変層={}、ターゲット={}、初期評価関数={}、最大反復回数={}",
                    stack.getName(), stack.variableLayerIndices().length, activeTargets.size(),
                    fmt(initialMerit), settings.getMaxIterations());

            ThicknessProblem problem = new ThicknessProblem(stack, activeTargets, evaluator);
            LocalRun run =
                    run(problem, stack.variableThicknesses(), settings, CancellationSignal.NONE);

            stack.setVariableThicknesses(run.getX());
            double finalMerit = evaluator.merit(stack, activeTargets);

            String message = String.format(Locale.ROOT, "最適化が完了しました（反復 %d 回、%s）。評価関数: %.6f -> %.6f",
                    run.getIterations(), run.getStopReason().label(), initialMerit, finalMerit);
            log.info(message);

            return new OptimizationOutcome(true, message, initialMerit, finalMerit,
                    run.getIterations(), run.getX(), 1, false);

        } catch (RuntimeException e) {
            log.warn("局所最適化に失敗しました。", e);
            return OptimizationOutcome.failure("最適化に失敗しました: " + e.getMessage());
        }
    }

    /**
     * 最適化の前提条件を確認します。
     *
     * @param stack コーティング設計です
     * @param targets 評価ターゲットです
     * @return 満たさない場合はその理由、満たす場合は null です
     */
    static String checkPreconditions(CoatingStack stack, List<MeritTarget> targets) {
        Preconditions.checkNotNull(stack, "設計が null です。");
        if (stack.variableLayerIndices().length == 0) {
            return NO_VARIABLE_LAYERS;
        }
        if (MeritEvaluator.activeTargets(targets).isEmpty()) {
            return NO_ACTIVE_TARGETS;
        }
        return null;
    }

    /**
     * 反復条件を確認します。
     *
     * @param settings 反復条件です
     * @throws IllegalArgumentException 反復条件が不正な場合に発生します
     */
    static void checkSettings(LevenbergMarquardtSettings settings) {
        Preconditions.checkNotNull(settings, "反復条件が null です。");
        Preconditions.checkArgument(settings.getMaxIterations() > 0, "最大反復回数は 1 以上が必要です。maxIterations=%s",
                settings.getMaxIterations());
        Preconditions.checkArgument(settings.getInitialDamping() > 0.0,
                "減衰係数の初期値は正の値が必要です。initialDamping=%s", settings.getInitialDamping());
    }

    /**
     * 指定した初期値から Levenberg-Marquardt 法を実行します。
     *
     * <p>
     * 打ち切りの合図は外側反復の先頭でだけ確認します。
     * </p>
     *
     * @param problem 最小二乗問題です
     * @param start 初期値です（上下限への丸めは行いません）
     * @param settings 反復条件です
     * @param cancellation 打ち切りの合図です
     * @return 実行結果です
     * @throws OptimizationCancelledException 打ち切りが要求された場合に発生します
     */
    LocalRun run(ThicknessProblem problem, double[] start, LevenbergMarquardtSettings settings,
            CancellationSignal cancellation) {
        final int nParams = problem.parameterCount();

        double[] x = start.clone();
        double mu = settings.getInitialDamping();

        double[] residuals = problem.residuals(x);
        double cost = dot(residuals, residuals);

        int iterations = 0;
        LocalRun.StopReason stopReason = LocalRun.StopReason.MAX_ITERATIONS;

        for (int iter = 0; iter < settings.getMaxIterations(); iter++) {
            if (cancellation.isCancelled()) {
                throw new OptimizationCancelledException("反復 " + iter + " 回目で打ち切りが要求されました");
            }
            iterations++;

            DMatrixRMaj jacobian = jacobian(problem, x, residuals);

            // JᵀJ と Jᵀr
            DMatrixRMaj jtj = new DMatrixRMaj(nParams, nParams);
            CommonOps_DDRM.multTransA(jacobian, jacobian, jtj);
            DMatrixRMaj jtr = new DMatrixRMaj(nParams, 1);
            CommonOps_DDRM.multTransA(jacobian, new DMatrixRMaj(residuals.length, 1, true, residuals),
                    jtr);

            double gradientNorm = NormOps_DDRM.normF(jtr);
            if (gradientNorm < settings.getGradientTolerance()) {
                stopReason = LocalRun.StopReason.GRADIENT;
                break;
            }

            double[] negativeGradient = new double[nParams];
            for (int i = 0; i < nParams; i++) {
                negativeGradient[i] = -jtr.get(i, 0);
            }

            boolean accepted = false;
            boolean converged = false;

            for (int attempt = 0; attempt < MAX_DAMPING_ATTEMPTS; attempt++) {
                DMatrixRMaj a = jtj.copy();
                for (int i = 0; i < nParams; i++) {
                    a.add(i, i, mu * Math.max(jtj.get(i, i), DIAGONAL_FLOOR));
                }

                double[] step;
                try {
                    step = linearSystem.solve(a, negativeGradient);
                } catch (IllegalStateException e) {
                    mu *= 10.0;
                    log.debug("正規方程式を解けないため減衰係数を増やします。反復={}、μ={}、理由={}", iter + 1, fmt(mu),
                            e.getMessage());
                    continue;
                }

                if (norm(step) < settings.getStepTolerance()
                        * (norm(x) + settings.getStepTolerance())) {
                    stopReason = LocalRun.StopReason.STEP;
                    converged = true;
                    break;
                }

                double[] xNew = new double[nParams];
                for (int i = 0; i < nParams; i++) {
                    xNew[i] = x[i] + step[i];
                }
                xNew = problem.clip(xNew);

                double[] newResiduals = problem.residuals(xNew);
                double newCost = dot(newResiduals, newResiduals);

                if (newCost < cost) {
                    boolean smallImprovement =
                            Math.abs(cost - newCost) < settings.getFunctionTolerance() * cost
                                    && iter > 0;
                    x = xNew;
                    residuals = newResiduals;
                    cost = newCost;
                    accepted = true;
                    if (smallImprovement) {
                        stopReason = LocalRun.StopReason.FUNCTION;
                        converged = true;
                    } else {
                        mu = Math.max(mu / 3.0, MIN_DAMPING);
                    }
                    break;
                }

                mu = Math.min(mu * 3.0, MAX_DAMPING);
            }

            log.debug("LM 反復={}、コスト={}、勾配ノルム={}、μ={}、採用={}", iter + 1, fmt(cost),
                    fmt(gradientNorm), fmt(mu), accepted);

            if (converged) {
                break;
            }
            if (!accepted) {
                stopReason = LocalRun.StopReason.DAMPING_EXHAUSTED;
                log.debug("減衰係数を調整しても改善しないため反復を終了します。反復={}、コスト={}", iter + 1, fmt(cost));
                break;
            }
        }

        return new LocalRun(x, iterations, cost, stopReason);
    }

    /**
     * 前進差分でヤコビ行列を計算します。
     *
     * <p>
     * パラメータを 1 つずつ h = max(δ, |x_i|·δ) だけずらした複製で残差を評価します。
     * </p>
     */
    private static DMatrixRMaj jacobian(ThicknessProblem problem, double[] x,
            double[] residuals) {
        int nParams = x.length;
        DMatrixRMaj jacobian = new DMatrixRMaj(residuals.length, nParams);
        for (int p = 0; p < nParams; p++) {
            double h = Math.max(FINITE_DIFFERENCE_STEP, Math.abs(x[p]) * FINITE_DIFFERENCE_STEP);
            double[] probe = x.clone();
            probe[p] = x[p] + h;

            double[] perturbed = problem.residuals(probe);
            for (int i = 0; i < residuals.length; i++) {
                jacobian.set(i, p, (perturbed[i] - residuals[i]) / h);
            }
        }
        return jacobian;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    private static double norm(double[] v) {
        return Math.sqrt(dot(v, v));
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.6g", v);
    }
}
