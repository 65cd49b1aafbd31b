package io.github.yok.thinfilm.out;

import io.github.yok.thinfilm.core.model.CoatingStack;
import io.github.yok.thinfilm.core.optics.SpectralResponse;
import io.github.yok.thinfilm.core.solver.OptimizationOutcome;

/**
 * 計算結果を出力する処理のインタフェースです。
 *
 * <p>
 * 最適化後の設計、最適化結果、およびその設計で計算した分光特性を受け取ります。
 * </p>
 */
public interface ResultWriter {

    /**
     * 最適化後の設計と分光特性を出力します。
     *
     * @param stack 最適化後のコーティング設計です
     * @param outcome 最適化結果です
     * @param spectrum 最適化後の設計の分光特性です
     */
    void write(CoatingStack stack, OptimizationOutcome outcome, SpectralResponse spectrum);
}
