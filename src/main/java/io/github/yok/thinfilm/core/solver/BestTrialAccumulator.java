package io.github.yok.thinfilm.core.solver;

/**
 * 大域探索の各試行結果から最良の膜厚を保持するクラスです。
 *
 * <p>
 * 評価関数が厳密に小さい試行を採用し、同値の場合は試行番号の小さいほうを残します。 並列実行時に複数スレッドから呼ばれるため、すべての操作を同期します。
 * </p>
 */
final class BestTrialAccumulator {

    private double[] bestThicknesses;
    private double bestMerit = Double.POSITIVE_INFINITY;
    private int bestTrial = -1;
    private int totalIterations;
    private int completedTrials;

    /**
     * 初期値（設計の現在の膜厚）で生成します。
     *
     * @param initialThicknesses 採用候補がない場合に返す膜厚です
     */
    BestTrialAccumulator(double[] initialThicknesses) {
        this.bestThicknesses = initialThicknesses.clone();
    }

    /**
     * 完了した試行を記録します。
     *
     * @param trialIndex 試行番号（1 始まり）です
     * @param thicknesses 試行の最終膜厚です
     * @param merit 試行の最終評価関数です
     * @param iterations 試行の反復回数です
     * @return 最良値を更新した場合は true です
     */
    synchronized boolean offer(int trialIndex, double[] thicknesses, double merit,
            int iterations) {
        completedTrials++;
        totalIterations += iterations;

        boolean improved = merit < bestMerit
                || (merit == bestMerit && bestTrial > 0 && trialIndex < bestTrial);
        if (improved) {
            bestThicknesses = thicknesses.clone();
            bestMerit = merit;
            bestTrial = trialIndex;
        }
        return improved;
    }

    /**
     * 例外で終わった試行を記録します。
     */
    synchronized void skip() {
        completedTrials++;
    }

    synchronized double[] bestThicknesses() {
        return bestThicknesses.clone();
    }

    synchronized double bestMerit() {
        return bestMerit;
    }

    synchronized int totalIterations() {
        return totalIterations;
    }

    synchronized int completedTrials() {
        return completedTrials;
    }
}
