package io.github.yok.thinfilm.core.solver;

import java.time.Duration;

/**
 * 長時間の探索を協調的に打ち切るための合図です。
 *
 * <p>
 * 探索は試行の区切りと Levenberg-Marquardt 法の外側反復の先頭でだけ問い合わせます。
 * </p>
 */
@FunctionalInterface
public interface CancellationSignal {

    /**
     * 打ち切らない合図です。
     */
    CancellationSignal NONE = () -> false;

    /**
     * 打ち切りが要求されているかどうかを返します。
     *
     * @return 打ち切る場合は true です
     */
    boolean isCancelled();

    /**
     * 生成時点から指定時間が経過すると打ち切りを要求する合図を返します。
     *
     * @param limit 制限時間です
     * @return 合図です
     */
    static CancellationSignal timeLimit(Duration limit) {
        final long deadline = System.nanoTime() + limit.toNanos();
        return () -> System.nanoTime() - deadline >= 0;
    }
}
