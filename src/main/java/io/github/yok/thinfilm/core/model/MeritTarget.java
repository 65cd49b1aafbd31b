package io.github.yok.thinfilm.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * 評価関数の 1 項（波長・入射角・光学量・比較方法・重み）を表すクラスです。
 */
@Value
public class MeritTarget {

    /**
     * 評価に使うかどうかです。
     */
    boolean enabled;

    /**
     * 参照する光学量です。
     */
    TargetMetric metric;

    /**
     * 波長（µm）です。
     */
    double wavelength;

    /**
     * 入射角（度）です。
     */
    double angleOfIncidenceDeg;

    /**
     * 比較方法です。
     */
    CompareType compare;

    /**
     * 目標値（%）です。
     */
    double targetValue;

    /**
     * 重みです（0 以上）。
     */
    double weight;

    /**
     * 評価ターゲットを生成します。
     *
     * @param enabled 評価に使うかどうかです
     * @param metric 参照する光学量です（null 不可）
     * @param wavelength 波長（µm、正の値）です
     * @param angleOfIncidenceDeg 入射角（度）です
     * @param compare 比較方法です（null 不可）
     * @param targetValue 目標値（%）です
     * @param weight 重み（0 以上）です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    @Builder(toBuilder = true)
    public MeritTarget(boolean enabled, TargetMetric metric, double wavelength,
            double angleOfIncidenceDeg, CompareType compare, double targetValue, double weight) {
        if (metric == null) {
            throw new IllegalArgumentException("metric は null 不可です");
        }
        if (compare == null) {
            throw new IllegalArgumentException("compare は null 不可です");
        }
        if (!(wavelength > 0.0)) {
            throw new IllegalArgumentException("wavelength は正の値が必要です: " + wavelength);
        }
        if (!(weight >= 0.0)) {
            throw new IllegalArgumentException("weight は 0 以上が必要です: " + weight);
        }
        this.enabled = enabled;
        this.metric = metric;
        this.wavelength = wavelength;
        this.angleOfIncidenceDeg = angleOfIncidenceDeg;
        this.compare = compare;
        this.targetValue = targetValue;
        this.weight = weight;
    }

    /**
     * 既定値（有効、Rave、0.55 µm、0 度、EQUAL、目標 0、重み 1）を持つビルダです。
     */
    public static class MeritTargetBuilder {
        private boolean enabled = true;
        private TargetMetric metric = TargetMetric.RAVE;
        private double wavelength = 0.55;
        private CompareType compare = CompareType.EQUAL;
        private double weight = 1.0;
    }
}
