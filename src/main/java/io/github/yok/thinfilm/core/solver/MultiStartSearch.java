package io.github.yok.thinfilm.core.solver;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.thinfilm.core.merit.MeritEvaluator;
import io.github.yok.thinfilm.core.model.CoatingStack;
import io.github.yok.thinfilm.core.model.MeritTarget;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * 初期値を上下限内でランダムに変えて局所最適化を繰り返す大域探索（マルチスタート）クラスです。
 *
 * <p>
 * 各試行は設計の複製上で Levenberg-Marquardt 法を実行し、評価関数が最小の膜厚を保持します。 打ち切りが要求された場合はそれまでの最良値を設計に適用し、成功として返します。
 * </p>
 *
 * <p>
 * parallelism が 2 以上の場合は、すべての初期値を試行順に先に生成してからスレッドプールで並列に実行します。
 * </p>
 */
@Slf4j
public final class MultiStartSearch {

    /**
     * 局所最適化ソルバです。
     */
    private final LevenbergMarquardtSolver solver;

    /**
     * 評価器です。
     */
    private final MeritEvaluator evaluator;

    /**
     * 試行ごとの反復条件の基準です（最大反復回数は呼び出しごとに上書きします）。
     */
    private final LevenbergMarquardtSettings baseSettings;

    /**
     * 初期値の乱数源です。
     */
    private final Random random;

    /**
     * 同時に実行する試行数です。
     */
    private final int parallelism;

    /**
     * 逐次実行の探索を生成します。
     *
     * @param solver 局所最適化ソルバです
     * @param evaluator 評価器です
     * @param baseSettings 試行ごとの反復条件の基準です
     * @param random 初期値の乱数源です
     */
    public MultiStartSearch(LevenbergMarquardtSolver solver, MeritEvaluator evaluator,
            LevenbergMarquardtSettings baseSettings, Random random) {
        this(solver, evaluator, baseSettings, random, 1);
    }

    /**
     * 探索を生成します。
     *
     * @param solver 局所最適化ソルバです（null 不可）
     * @param evaluator 評価器です（null 不可）
     * @param baseSettings 試行ごとの反復条件の基準です（null 不可）
     * @param random 初期値の乱数源です（null 不可）
     * @param parallelism 同時に実行する試行数（1 以上）です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public MultiStartSearch(LevenbergMarquardtSolver solver, MeritEvaluator evaluator,
            LevenbergMarquardtSettings baseSettings, Random random, int parallelism) {
        if (solver == null) {
            throw new IllegalArgumentException("solver は null 不可です");
        }
        if (evaluator == null) {
            throw new IllegalArgumentException("evaluator は null 不可です");
        }
        if (baseSettings == null) {
            throw new IllegalArgumentException("baseSettings は null 不可です");
        }
        if (random == null) {
            throw new IllegalArgumentException("random は null 不可です");
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism は 1 以上が必要です: " + parallelism);
        }
        this.solver = solver;
        this.evaluator = evaluator;
        this.baseSettings = baseSettings;
        this.random = random;
        this.parallelism = parallelism;
    }

    /**
     * 大域探索を実行し、最良の膜厚を設計に適用します。
     *
     * @param stack コーティング設計です
     * @param targets 評価ターゲットです
     * @param maxTrials 試行回数（1 以上）です
     * @param maxIterationsPerTrial 試行ごとの最大反復回数（1 以上）です
     * @param progress 試行完了ごとの通知先です（null の場合は通知しません）
     * @param cancellation 打ち切りの合図です（null の場合は打ち切りません）
     * @return 最適化結果です
     */
    public OptimizationOutcome globalOptimize(CoatingStack stack, List<MeritTarget> targets,
            int maxTrials, int maxIterationsPerTrial, ProgressListener progress,
            CancellationSignal cancellation) {
        try {
            String precondition = LevenbergMarquardtSolver.checkPreconditions(stack, targets);
            if (precondition != null) {
                log.warn("大域最適化を実行できません。理由={}", precondition);
                return OptimizationOutcome.failure(precondition);
            }
            Preconditions.checkArgument(maxTrials > 0, "試行回数は 1 以上が必要です。maxTrials=%s",
                    maxTrials);
            Preconditions.checkArgument(maxIterationsPerTrial > 0,
                    "試行ごとの最大反復回数は 1 以上が必要です。maxIterationsPerTrial=%s", maxIterationsPerTrial);

            final ProgressListener listener = progress != null ? progress : ProgressListener.NONE;
            final CancellationSignal signal =
                    cancellation != null ? cancellation : CancellationSignal.NONE;
            final LevenbergMarquardtSettings trialSettings =
                    baseSettings.toBuilder().maxIterations(maxIterationsPerTrial).build();
            LevenbergMarquardtSolver.checkSettings(trialSettings);

            List<MeritTarget> activeTargets = MeritEvaluator.activeTargets(targets);
            double initialMerit = evaluator.merit(stack, activeTargets);
            ThicknessProblem problem = new ThicknessProblem(stack, activeTargets, evaluator);
            BestTrialAccumulator best = new BestTrialAccumulator(stack.variableThicknesses());

            log.info("大域最適化を開始します。設計={}、可変層={}、試行回数={}、試行ごとの最大反復回数={}、並列数={}、初期評価関数={}",
                    stack.getName(), problem.parameterCount(), maxTrials, maxIterationsPerTrial,
                    parallelism, fmt(initialMerit));

            boolean cancelled;
            if (parallelism > 1 && maxTrials > 1) {
                cancelled = runParallel(problem, maxTrials, trialSettings, listener, signal, best);
            } else {
                cancelled = runSequential(problem, maxTrials, trialSettings, listener, signal, best);
            }

            stack.setVariableThicknesses(best.bestThicknesses());
            double finalMerit = evaluator.merit(stack, activeTargets);

            String message;
            if (cancelled) {
                message = String.format(Locale.ROOT,
                        "大域最適化を打ち切りました（試行 %d/%d 回、反復 %d 回）。評価関数: %.6f -> %.6f",
                        best.completedTrials(), maxTrials, best.totalIterations(), initialMerit,
                        finalMerit);
            } else {
                message = String.format(Locale.ROOT,
                        "大域最適化が完了しました（試行 %d 回、反復 %d 回）。評価関数: %.6f -> %.6f",
                        best.completedTrials(), best.totalIterations(), initialMerit, finalMerit);
            }
            log.info(message);

            return new OptimizationOutcome(true, message, initialMerit, finalMerit,
                    best.totalIterations(), stack.variableThicknesses(), best.completedTrials(),
                    cancelled);

        } catch (RuntimeException e) {
            log.warn("大域最適化に失敗しました。", e);
            return OptimizationOutcome.failure("大域最適化に失敗しました: " + e.getMessage());
        }
    }

    /**
     * 試行を 1 つずつ順に実行します。
     *
     * @return 打ち切られた場合は true です
     */
    private boolean runSequential(ThicknessProblem problem, int maxTrials,
            LevenbergMarquardtSettings trialSettings, ProgressListener listener,
            CancellationSignal signal, BestTrialAccumulator best) {
        for (int trial = 1; trial <= maxTrials; trial++) {
            if (signal.isCancelled()) {
                log.info("試行 {} の前に打ち切りが要求されました。", trial);
                return true;
            }
            double[] start = drawStart(problem);
            if (!runTrial(problem, trial, maxTrials, start, trialSettings, listener, signal,
                    best)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 試行をスレッドプールで並列に実行します。
     *
     * <p>
     * 初期値は実行前に試行順で生成するため、同じ乱数列からは逐次実行と同じ初期値の組になります。
     * </p>
     *
     * @return 打ち切られた場合は true です
     */
    private boolean runParallel(ThicknessProblem problem, int maxTrials,
            LevenbergMarquardtSettings trialSettings, ProgressListener listener,
            CancellationSignal signal, BestTrialAccumulator best) {
        double[][] starts = new double[maxTrials][];
        for (int i = 0; i < maxTrials; i++) {
            starts[i] = drawStart(problem);
        }

        final AtomicBoolean cancelled = new AtomicBoolean(false);
        final CancellationSignal sharedSignal = () -> cancelled.get() || signal.isCancelled();

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, maxTrials),
                new ThreadFactoryBuilder().setNameFormat("multistart-%d").setDaemon(true)
                        .build());
        try {
            List<Future<?>> futures = new ArrayList<>(maxTrials);
            for (int i = 0; i < maxTrials; i++) {
                final int trial = i + 1;
                final double[] start = starts[i];
                futures.add(pool.submit(() -> {
                    if (sharedSignal.isCancelled()) {
                        cancelled.set(true);
                        return;
                    }
                    if (!runTrial(problem, trial, maxTrials, start, trialSettings, listener,
                            sharedSignal, best)) {
                        cancelled.set(true);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("大域最適化の待機中に割り込まれたため打ち切ります。");
            cancelled.set(true);
        } catch (ExecutionException e) {
            throw new IllegalStateException("試行の実行に失敗しました: " + e.getCause().getMessage(),
                    e.getCause());
        } finally {
            pool.shutdownNow();
        }
        return cancelled.get();
    }

    /**
     * 1 回の試行を実行し、結果を記録して進捗を通知します。
     *
     * @return 打ち切られずに終わった場合は true です
     */
    private boolean runTrial(ThicknessProblem problem, int trial, int maxTrials, double[] start,
            LevenbergMarquardtSettings trialSettings, ProgressListener listener,
            CancellationSignal signal, BestTrialAccumulator best) {
        LocalRun run;
        try {
            run = solver.run(problem, start, trialSettings, signal);
        } catch (OptimizationCancelledException e) {
            log.info("試行 {} を打ち切りました。理由={}", trial, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.warn("試行 {} で例外が発生したためスキップします。理由={}", trial, e.getMessage());
            synchronized (best) {
                best.skip();
                listener.onTrialCompleted(best.completedTrials(), maxTrials, best.bestMerit());
            }
            return true;
        }

        double merit = problem.merit(run.getX());
        synchronized (best) {
            boolean improved = best.offer(trial, run.getX(), merit, run.getIterations());
            log.info("試行 {}/{} 完了: 評価関数={}、反復={}、停止理由={}、最良={}{}", trial, maxTrials, fmt(merit),
                    run.getIterations(), run.getStopReason().label(), fmt(best.bestMerit()),
                    improved ? "（更新）" : "");
            listener.onTrialCompleted(best.completedTrials(), maxTrials, best.bestMerit());
        }
        return true;
    }

    /**
     * 各パラメータを上下限内の一様乱数で生成します。
     */
    private double[] drawStart(ThicknessProblem problem) {
        double[] lower = problem.lowerBounds();
        double[] upper = problem.upperBounds();
        double[] start = new double[lower.length];
        for (int i = 0; i < start.length; i++) {
            start[i] = lower[i] + random.nextDouble() * (upper[i] - lower[i]);
        }
        return start;
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.6g", v);
    }
}
