package io.github.yok.thinfilm.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * よく使う反射防止膜の初期設計です。
 */
public enum DesignPreset {

    /**
     * N-BK7 上の MgF2 単層反射防止膜（λ/4）です。
     */
    SINGLE_LAYER_AR {
        @Override
        public CoatingStack createStack() {
            CoatingStack stack = new CoatingStack("SLAR", "N-BK7",
                    CoatingStack.DEFAULT_INCIDENT_INDEX, 0.55, new ArrayList<>());
            stack.addLayer("MgF2", 0.25, ThicknessKind.OPTICAL);
            return stack;
        }

        @Override
        public List<MeritTarget> createTargets() {
            return MeritTargetGenerator.generate(TargetGrid.builder().wavelengthMin(0.45)
                    .wavelengthMax(0.65).wavelengthStep(0.005).build());
        }
    },

    /**
     * N-BK7 上の MgF2 / TiO2 の 2 層 V コートです（空気 / L / H / 基板）。
     */
    V_COAT {
        @Override
        public CoatingStack createStack() {
            CoatingStack stack = new CoatingStack("VCoat", "N-BK7",
                    CoatingStack.DEFAULT_INCIDENT_INDEX, 0.55, new ArrayList<>());
            stack.addLayer("MgF2", 0.3239, ThicknessKind.OPTICAL);
            stack.addLayer("TiO2", 0.0502, ThicknessKind.OPTICAL);
            return stack;
        }

        @Override
        public List<MeritTarget> createTargets() {
            // 設計波長付近の狭い帯域にすると V 字の谷へ滑らかに収束する
            return MeritTargetGenerator.generate(TargetGrid.builder().wavelengthMin(0.50)
                    .wavelengthMax(0.60).wavelengthStep(0.005).build());
        }
    };

    /**
     * 初期設計を生成します。
     *
     * @return 新しい設計です
     */
    public abstract CoatingStack createStack();

    /**
     * 初期設計に合わせた評価ターゲットを生成します。
     *
     * @return 評価ターゲットの一覧です
     */
    public abstract List<MeritTarget> createTargets();
}
