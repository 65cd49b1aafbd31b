package io.github.yok.thinfilm.core.model;

/**
 * 評価ターゲットが参照する光学量です（いずれも %）。
 */
public enum TargetMetric {
    RS, RP, RAVE, TS, TP, TAVE
}
