package io.github.yok.thinfilm.app;

import io.github.yok.thinfilm.core.model.CompareType;
import io.github.yok.thinfilm.core.model.DesignPreset;
import io.github.yok.thinfilm.core.model.TargetMetric;
import io.github.yok.thinfilm.core.model.ThicknessKind;
import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * thinfilm-optimizer の設定値（thinfilm.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の設計・評価ターゲット・最適化条件の組み立てに使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "thinfilm")
public class ThinFilmProperties {

    /**
     * コーティング設計です。
     */
    @Valid
    private Design design = new Design();

    /**
     * 評価ターゲットです。
     */
    @Valid
    private Targets targets = new Targets();

    /**
     * 追加するコーティング材料です（同名の標準材料は置き換えます）。
     */
    @Valid
    private List<CustomMaterial> materials = new ArrayList<>();

    /**
     * 追加する基板です（同名の標準基板は置き換えます）。
     */
    @Valid
    private List<CustomMaterial> substrates = new ArrayList<>();

    /**
     * 最適化条件です。
     */
    @Valid
    private Optimization optimization = new Optimization();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "thinfilm")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Design d = getDesign();
        Targets t = getTargets();
        Targets.Generator g = t.getGenerator();
        Optimization o = getOptimization();
        Output out = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "design",
                // preset: 初期設計（未指定の場合は layers を使う）
                "preset", d.getPreset(),
                // name: 設計名（出力ファイル名に使う）
                "name", d.getName(),
                // substrate: 基板名
                "substrate", d.getSubstrate(),
                // incidentIndex: 入射媒質の屈折率
                "incidentIndex", d.getIncidentIndex(),
                // referenceWavelength: 光学膜厚の基準波長（µm）
                "referenceWavelength", d.getReferenceWavelength(),
                // layers: 層の数（入射側から基板側）
                "layers", d.getLayers().size());

        appendSection(sb, nl, "targets",
                // explicit: 個別に指定した評価ターゲットの数
                "explicit", t.getExplicit().size(),
                // generator.enabled: 波長 × 入射角の格子でターゲットを生成するかどうか
                "generator.enabled", g.isEnabled(),
                // generator.metric: 評価する光学量
                "generator.metric", g.getMetric(),
                // generator.compare: 比較方法
                "generator.compare", g.getCompare(),
                // generator.targetValue: 目標値（%）
                "generator.targetValue", g.getTargetValue(),
                // generator.wavelength: 波長範囲と刻み（µm）
                "generator.wavelength",
                g.getWavelengthMin() + ".." + g.getWavelengthMax() + " / " + g.getWavelengthStep(),
                // generator.aoi: 入射角範囲と刻み（度）
                "generator.aoi", g.getAoiMin() + ".." + g.getAoiMax() + " / " + g.getAoiStep());

        appendSection(sb, nl, "materials",
                // materials: 追加するコーティング材料の数
                "materials", getMaterials().size(),
                // substrates: 追加する基板の数
                "substrates", getSubstrates().size());

        appendSection(sb, nl, "optimization",
                // mode: LOCAL（Levenberg-Marquardt のみ）/ GLOBAL（マルチスタート）
                "mode", o.getMode(),
                // maxIterations: 局所最適化の最大反復回数
                "maxIterations", o.getMaxIterations(),
                // initialDamping: 減衰係数 μ の初期値
                "initialDamping", o.getInitialDamping(),
                // gradientTolerance / stepTolerance / functionTolerance: 収束判定の閾値
                "gradientTolerance", o.getGradientTolerance(),
                "stepTolerance", o.getStepTolerance(),
                "functionTolerance", o.getFunctionTolerance(),
                // maxTrials: 大域探索の試行回数
                "maxTrials", o.getMaxTrials(),
                // maxIterationsPerTrial: 大域探索の試行ごとの最大反復回数
                "maxIterationsPerTrial", o.getMaxIterationsPerTrial(),
                // seed: 乱数の種（未指定の場合は毎回異なる）
                "seed", o.getSeed(),
                // parallelism: 同時に実行する試行数
                "parallelism", o.getParallelism(),
                // timeLimitSeconds: 大域探索の制限時間（0 は無制限）
                "timeLimitSeconds", o.getTimeLimitSeconds());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", out.getDir(),
                // spectrum: 出力する分光特性の波長範囲（µm）と点数
                "spectrum", out.getSpectrum().getWavelengthMin() + ".."
                        + out.getSpectrum().getWavelengthMax() + " / "
                        + out.getSpectrum().getPoints(),
                // spectrum.aoi: 分光特性の入射角（度）
                "spectrum.aoi", out.getSpectrum().getAoi());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * <pre>
     *   section:
     *     key: value
     * </pre>
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Design {

        /**
         * 初期設計のプリセットです。指定した場合は layers と targets より優先します。
         */
        private DesignPreset preset;

        /**
         * 設計名です。
         */
        private String name = "design";

        /**
         * 基板名です。
         */
        @NotBlank
        private String substrate = "N-BK7";

        /**
         * 入射媒質の屈折率です。
         */
        @Positive
        private double incidentIndex = 1.0;

        /**
         * 光学膜厚の基準波長（µm）です。
         */
        @Positive
        private double referenceWavelength = 0.55;

        /**
         * 層の並び（入射側から基板側）です。
         */
        @Valid
        private List<Layer> layers = new ArrayList<>();
    }

    @Data
    public static class Layer {

        /**
         * 材料名です。
         */
        @NotBlank
        private String material;

        /**
         * 膜厚です（thicknessKind に応じて µm または波長単位）。
         */
        private double thickness;

        /**
         * 膜厚の表し方です。
         */
        @NotNull
        private ThicknessKind thicknessKind = ThicknessKind.OPTICAL;

        /**
         * 最適化の変数にするかどうかです。
         */
        private boolean variable = true;

        /**
         * 膜厚下限です（未指定の場合は thickness の 0.1 倍）。
         */
        private Double minThickness;

        /**
         * 膜厚上限です（未指定の場合は thickness の 10 倍）。
         */
        private Double maxThickness;
    }

    @Data
    public static class Targets {

        /**
         * 個別に指定する評価ターゲットです。
         */
        @Valid
        private List<Target> explicit = new ArrayList<>();

        /**
         * 格子状にターゲットを生成する条件です。
         */
        @Valid
        private Generator generator = new Generator();

        @Data
        public static class Target {

            private boolean enabled = true;

            @NotNull
            private TargetMetric metric = TargetMetric.RAVE;

            /**
             * 波長（µm）です。
             */
            @Positive
            private double wavelength = 0.55;

            /**
             * 入射角（度）です。
             */
            private double aoi = 0.0;

            @NotNull
            private CompareType compare = CompareType.EQUAL;

            /**
             * 目標値（%）です。
             */
            private double targetValue = 0.0;

            private double weight = 1.0;
        }

        @Data
        public static class Generator {

            /**
             * 生成するかどうかです。
             */
            private boolean enabled = false;

            @NotNull
            private TargetMetric metric = TargetMetric.RAVE;

            @NotNull
            private CompareType compare = CompareType.EQUAL;

            private double targetValue = 0.0;

            private double weight = 1.0;

            @Positive
            private double wavelengthMin = 0.45;

            @Positive
            private double wavelengthMax = 0.66;

            @Positive
            private double wavelengthStep = 0.005;

            private double aoiMin = 0.0;

            private double aoiMax = 0.0;

            private double aoiStep = 15.0;
        }
    }

    /**
     * 設定から追加する材料（または基板）です。
     *
     * <p>
     * coefficients の意味は model ごとに異なります。
     * </p>
     * <ul>
     * <li>CONSTANT: 使いません（n と k を使います）</li>
     * <li>CAUCHY: A, B, C（C は省略可）</li>
     * <li>SELLMEIER: B1, C1, B2, C2, ...（奇数個の場合は先頭を定数項 A とします）</li>
     * <li>TABULATED: 使いません（table の各行 [波長, n, k] を使います）</li>
     * </ul>
     */
    @Data
    public static class CustomMaterial {

        @NotBlank
        private String name;

        @NotNull
        private DispersionModel model = DispersionModel.CONSTANT;

        /**
         * 屈折率です（Sellmeier では n² が正にならない場合の名目値）。
         */
        private double n = 1.5;

        /**
         * 消衰係数です（吸収のある材料は負の値）。
         */
        private double k = 0.0;

        private List<Double> coefficients = new ArrayList<>();

        private List<List<Double>> table = new ArrayList<>();
    }

    /**
     * 設定から指定できる分散式の種類です。
     */
    public enum DispersionModel {
        CONSTANT, CAUCHY, SELLMEIER, TABULATED
    }

    /**
     * 最適化の実行方法です。
     */
    public enum Mode {
        /**
         * 現在の膜厚から Levenberg-Marquardt 法を 1 回実行します。
         */
        LOCAL,

        /**
         * 初期値を変えて Levenberg-Marquardt 法を繰り返します。
         */
        GLOBAL
    }

    @Data
    public static class Optimization {

        @NotNull
        private Mode mode = Mode.LOCAL;

        @Min(1)
        private int maxIterations = 200;

        @Positive
        private double initialDamping = 1e-3;

        private double gradientTolerance = 1e-10;

        private double stepTolerance = 1e-10;

        private double functionTolerance = 1e-10;

        @Min(1)
        private int maxTrials = 20;

        @Min(1)
        private int maxIterationsPerTrial = 50;

        /**
         * 乱数の種です（未指定の場合は実行ごとに異なる初期値になります）。
         */
        private Long seed;

        @Min(1)
        private int parallelism = 1;

        /**
         * 大域探索の制限時間（秒）です。0 の場合は制限しません。
         */
        @Min(0)
        private long timeLimitSeconds = 0;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        @NotBlank
        private String dir = "./out";

        @Valid
        private Spectrum spectrum = new Spectrum();

        @Data
        public static class Spectrum {

            @Positive
            private double wavelengthMin = 0.40;

            @Positive
            private double wavelengthMax = 0.70;

            @Min(2)
            private int points = 301;

            /**
             * 入射角（度）です。
             */
            private double aoi = 0.0;
        }
    }
}
