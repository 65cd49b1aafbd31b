package io.github.yok.thinfilm.core.solver;

/**
 * 大域探索の進捗を受け取るインタフェースです。
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * 何もしないリスナです。
     */
    ProgressListener NONE = (trialIndex, totalTrials, bestMerit) -> {
    };

    /**
     * 試行が 1 つ終わるたびに呼び出されます。
     *
     * @param trialIndex 終わった試行の番号（1 始まり）です
     * @param totalTrials 試行の総数です
     * @param bestMerit これまでの最良の評価関数の値です（成功した試行がなければ +∞）
     */
    void onTrialCompleted(int trialIndex, int totalTrials, double bestMerit);
}
