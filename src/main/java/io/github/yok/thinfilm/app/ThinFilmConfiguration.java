package io.github.yok.thinfilm.app;

import io.github.yok.thinfilm.core.dispersion.MaterialCatalog;
import io.github.yok.thinfilm.core.linearalgebra.EjmlCholeskyLinearSystemBackend;
import io.github.yok.thinfilm.core.linearalgebra.LinearSystemBackend;
import io.github.yok.thinfilm.core.merit.MeritEvaluator;
import io.github.yok.thinfilm.core.optics.TransferMatrixEngine;
import io.github.yok.thinfilm.core.solver.LevenbergMarquardtSettings;
import io.github.yok.thinfilm.core.solver.LevenbergMarquardtSolver;
import io.github.yok.thinfilm.core.solver.MultiStartSearch;
import io.github.yok.thinfilm.out.CsvResultWriter;
import io.github.yok.thinfilm.out.ResultWriter;
import java.util.Random;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 特性行列法の計算エンジンと Levenberg-Marquardt 最適化一式の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class ThinFilmConfiguration {

    /**
     * thinfilm-optimizer の設定値（thinfilm.*）です。
     */
    private final ThinFilmProperties p;

    /**
     * 設定値から設計と評価ターゲットを組み立てるロジックを生成します。
     *
     * @return 組み立てロジックです
     */
    @Bean
    public DesignAssembler designAssembler() {
        return new DesignAssembler(p);
    }

    /**
     * 標準材料に設定の追加材料を登録したカタログを生成します。
     *
     * @param assembler 組み立てロジックです
     * @return 材料カタログです
     */
    @Bean
    public MaterialCatalog materialCatalog(DesignAssembler assembler) {
        return assembler.registerCustomMaterials(MaterialCatalog.withStandardMaterials());
    }

    /**
     * 特性行列法の計算エンジンを生成します。
     *
     * @param catalog 材料カタログです
     * @return 計算エンジンです
     */
    @Bean
    public TransferMatrixEngine transferMatrixEngine(MaterialCatalog catalog) {
        return new TransferMatrixEngine(catalog);
    }

    /**
     * 評価関数の計算ロジックを生成します。
     *
     * @param engine 計算エンジンです
     * @return 評価器です
     */
    @Bean
    public MeritEvaluator meritEvaluator(TransferMatrixEngine engine) {
        return new MeritEvaluator(engine);
    }

    /**
     * 正規方程式を解くバックエンドを生成します。
     *
     * @return 線形方程式バックエンドです
     */
    @Bean
    public LinearSystemBackend linearSystemBackend() {
        return new EjmlCholeskyLinearSystemBackend();
    }

    /**
     * Levenberg-Marquardt 法の反復条件を生成します。
     *
     * @return 反復条件です
     */
    @Bean
    public LevenbergMarquardtSettings levenbergMarquardtSettings() {
        ThinFilmProperties.Optimization o = p.getOptimization();
        return LevenbergMarquardtSettings.builder().maxIterations(o.getMaxIterations())
                .initialDamping(o.getInitialDamping()).gradientTolerance(o.getGradientTolerance())
                .stepTolerance(o.getStepTolerance()).functionTolerance(o.getFunctionTolerance())
                .build();
    }

    /**
     * 局所最適化ソルバを生成します。
     *
     * @param evaluator 評価器です
     * @param linearSystem 線形方程式バックエンドです
     * @return ソルバです
     */
    @Bean
    public LevenbergMarquardtSolver levenbergMarquardtSolver(MeritEvaluator evaluator,
            LinearSystemBackend linearSystem) {
        return new LevenbergMarquardtSolver(evaluator, linearSystem);
    }

    /**
     * 大域探索（マルチスタート）を生成します。
     *
     * <p>
     * seed を指定した場合は同じ初期値の列を再現します。
     * </p>
     *
     * @param solver 局所最適化ソルバです
     * @param evaluator 評価器です
     * @param settings 反復条件です
     * @return 大域探索です
     */
    @Bean
    public MultiStartSearch multiStartSearch(LevenbergMarquardtSolver solver,
            MeritEvaluator evaluator, LevenbergMarquardtSettings settings) {
        ThinFilmProperties.Optimization o = p.getOptimization();
        Random random = o.getSeed() != null ? new Random(o.getSeed()) : new Random();
        return new MultiStartSearch(solver, evaluator, settings, random, o.getParallelism());
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @param engine 物理膜厚の換算に使う計算エンジンです
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter(TransferMatrixEngine engine) {
        return new CsvResultWriter(p.getOutput().getDir(), engine);
    }
}
