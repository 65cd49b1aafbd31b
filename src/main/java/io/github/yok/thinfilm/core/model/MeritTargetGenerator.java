package io.github.yok.thinfilm.core.model;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;

/**
 * 波長と入射角の格子から評価ターゲットの一覧を生成するクラスです。
 */
public final class MeritTargetGenerator {

    private MeritTargetGenerator() {}

    /**
     * 格子条件から評価ターゲットを生成します。
     *
     * <p>
     * 入射角ごとに波長を {@code wavelengthMin} から {@code wavelengthMax} まで走査します。 波長は小数 4 桁、入射角は小数 1
     * 桁に丸めます。 入射角の最小と最大がほぼ等しい場合は 1 角度だけ生成します。
     * </p>
     *
     * @param grid 格子条件です
     * @return 評価ターゲットの一覧（入射角、波長の順）です
     * @throws IllegalArgumentException 格子条件が不正な場合に発生します
     */
    public static List<MeritTarget> generate(TargetGrid grid) {
        Preconditions.checkNotNull(grid, "格子条件が null です。");
        Preconditions.checkArgument(grid.getWavelengthStep() > 0.0, "波長の刻みは正の値が必要です。step=%s",
                grid.getWavelengthStep());
        Preconditions.checkArgument(grid.getWavelengthMin() > 0.0
                && grid.getWavelengthMin() <= grid.getWavelengthMax(),
                "波長範囲が不正です。min=%s, max=%s", grid.getWavelengthMin(), grid.getWavelengthMax());
        Preconditions.checkArgument(grid.getAoiMin() <= grid.getAoiMax(), "入射角範囲が不正です。min=%s, max=%s",
                grid.getAoiMin(), grid.getAoiMax());

        double aoiStep = Math.max(grid.getAoiStep(), 1.0);
        boolean singleAngle = Math.abs(grid.getAoiMax() - grid.getAoiMin()) < 0.01;

        List<MeritTarget> targets = new ArrayList<>();
        // 浮動小数点の累積誤差で端点を落とさないよう、刻み回数で走査する
        int angleCount = singleAngle ? 1
                : (int) Math.floor((grid.getAoiMax() - grid.getAoiMin() + 0.001) / aoiStep) + 1;
        int wavelengthCount = (int) Math.floor(
                (grid.getWavelengthMax() - grid.getWavelengthMin() + 1e-4) / grid.getWavelengthStep())
                + 1;

        for (int a = 0; a < angleCount; a++) {
            double aoi = round(grid.getAoiMin() + a * aoiStep, 1);
            for (int w = 0; w < wavelengthCount; w++) {
                double wavelength = round(grid.getWavelengthMin() + w * grid.getWavelengthStep(), 4);
                targets.add(MeritTarget.builder().enabled(true).metric(grid.getMetric())
                        .wavelength(wavelength).angleOfIncidenceDeg(aoi).compare(grid.getCompare())
                        .targetValue(grid.getTargetValue()).weight(grid.getWeight()).build());
            }
        }
        return targets;
    }

    private static double round(double value, int digits) {
        double scale = Math.pow(10.0, digits);
        return Math.round(value * scale) / scale;
    }
}
