package io.github.yok.thinfilm.core.solver;

/**
 * 探索が打ち切られたことを探索内部に伝える例外です。
 */
public class OptimizationCancelledException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public OptimizationCancelledException(String message) {
        super(message);
    }
}
