package io.github.yok.thinfilm.app;

import io.github.yok.thinfilm.core.merit.MeritEvaluator;
import io.github.yok.thinfilm.core.model.CoatingStack;
import io.github.yok.thinfilm.core.model.DesignLayer;
import io.github.yok.thinfilm.core.model.MeritTarget;
import io.github.yok.thinfilm.core.optics.SpectralResponse;
import io.github.yok.thinfilm.core.optics.TransferMatrixEngine;
import io.github.yok.thinfilm.core.solver.CancellationSignal;
import io.github.yok.thinfilm.core.solver.LevenbergMarquardtSettings;
import io.github.yok.thinfilm.core.solver.LevenbergMarquardtSolver;
import io.github.yok.thinfilm.core.solver.MultiStartSearch;
import io.github.yok.thinfilm.core.solver.OptimizationOutcome;
import io.github.yok.thinfilm.core.solver.ProgressListener;
import io.github.yok.thinfilm.out.ResultWriter;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で thinfilm-optimizer を実行するクラスです。
 *
 * <p>
 * 設定から設計と評価ターゲットを組み立て、膜厚を最適化し、最適化後の分光特性とあわせて出力します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class ThinFilmCliRunner implements CommandLineRunner {

    /**
     * thinfilm-optimizer の設定値（thinfilm.*）です。
     */
    private final ThinFilmProperties properties;

    /**
     * 設計と評価ターゲットの組み立てロジックです。
     */
    private final DesignAssembler designAssembler;

    /**
     * 特性行列法の計算エンジンです。
     */
    private final TransferMatrixEngine engine;

    /**
     * 評価器です。
     */
    private final MeritEvaluator evaluator;

    /**
     * 局所最適化ソルバです。
     */
    private final LevenbergMarquardtSolver solver;

    /**
     * 局所最適化の反復条件です。
     */
    private final LevenbergMarquardtSettings settings;

    /**
     * 大域探索です。
     */
    private final MultiStartSearch multiStartSearch;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== thinfilm-optimizer start: optimize layer thicknesses ===");
        System.out.print(properties.toMultilineString());

        CoatingStack stack = designAssembler.createStack();
        List<MeritTarget> targets = designAssembler.createTargets();

        System.out.println("=== 初期設計 ===");
        printStack(stack);
        System.out.println("評価ターゲット: " + MeritEvaluator.activeTargets(targets).size() + " 件"
                + "（初期評価関数=" + fmt5(evaluator.merit(stack, targets)) + "）");

        ThinFilmProperties.Optimization o = properties.getOptimization();
        OptimizationOutcome outcome;
        if (o.getMode() == ThinFilmProperties.Mode.GLOBAL) {
            CancellationSignal cancellation = o.getTimeLimitSeconds() > 0
                    ? CancellationSignal.timeLimit(Duration.ofSeconds(o.getTimeLimitSeconds()))
                    : CancellationSignal.NONE;
            ProgressListener progress = (trial, total, best) -> System.out
                    .println("進捗: 試行 " + trial + "/" + total + "、最良評価関数=" + fmt5(best));
            outcome = multiStartSearch.globalOptimize(stack, targets, o.getMaxTrials(),
                    o.getMaxIterationsPerTrial(), progress, cancellation);
        } else {
            outcome = solver.optimize(stack, targets, settings);
        }

        System.out.println("=== 最適化結果 ===");
        System.out.println("結果: " + outcome.getMessage());
        if (!outcome.isSuccess()) {
            // 失敗時も初期設計のまま出力する
            System.out.println("最適化に失敗したため、初期設計のまま出力します。");
        }
        printStack(stack);

        ThinFilmProperties.Output.Spectrum s = properties.getOutput().getSpectrum();
        SpectralResponse spectrum = engine.spectrum(stack, s.getWavelengthMin(),
                s.getWavelengthMax(), s.getPoints(), s.getAoi());

        resultWriter.write(stack, outcome, spectrum);
        System.out.println("出力: " + properties.getOutput().getDir());
    }

    /**
     * 層構成を表示します。
     *
     * @param stack コーティング設計です
     */
    private void printStack(CoatingStack stack) {
        System.out.println("設計: " + stack.getName() + "（基板=" + stack.getSubstrateId() + "、入射媒質 n="
                + fmt5(stack.getIncidentIndex()) + "、基準波長=" + fmt5(stack.getReferenceWavelength())
                + " µm）");
        for (int i = 0; i < stack.layerCount(); i++) {
            DesignLayer layer = stack.layer(i);
            System.out.println("  層" + (i + 1) + ": " + layer.getMaterialId() + " "
                    + fmt5(layer.getThickness()) + " (" + layer.getThicknessKind() + ")"
                    + "、物理膜厚=" + fmt5(engine.physicalThickness(stack, layer)) + " µm"
                    + (layer.isVariable() ? "、可変" : ""));
        }
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(java.util.Locale.ROOT, "%.5f", v);
    }
}
