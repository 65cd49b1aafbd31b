package io.github.yok.thinfilm.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * 波長 × 入射角の格子で評価ターゲットを一括生成するための条件です。
 */
@Value
@Builder
public class TargetGrid {

    @Builder.Default
    TargetMetric metric = TargetMetric.RAVE;

    @Builder.Default
    CompareType compare = CompareType.EQUAL;

    @Builder.Default
    double targetValue = 0.0;

    @Builder.Default
    double weight = 1.0;

    @Builder.Default
    double wavelengthMin = 0.45;

    @Builder.Default
    double wavelengthMax = 0.66;

    @Builder.Default
    double wavelengthStep = 0.005;

    @Builder.Default
    double aoiMin = 0.0;

    @Builder.Default
    double aoiMax = 0.0;

    /**
     * 入射角の刻み（度）です。1 度未満は 1 度として扱います。
     */
    @Builder.Default
    double aoiStep = 15.0;
}
