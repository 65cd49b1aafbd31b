package io.github.yok.thinfilm.core.optics;

import lombok.Value;

/**
 * 1 波長・1 入射角での反射率と透過率（%）を保持するクラスです。
 */
@Value
public class OpticalResult {

    /**
     * s 偏光反射率です。
     */
    double rs;

    /**
     * p 偏光反射率です。
     */
    double rp;

    /**
     * 平均反射率 (Rs + Rp) / 2 です。
     */
    double rave;

    /**
     * s 偏光透過率です。
     */
    double ts;

    /**
     * p 偏光透過率です。
     */
    double tp;

    /**
     * 平均透過率 (Ts + Tp) / 2 です。
     */
    double tave;

    /**
     * 全反射が起きたかどうかです。
     */
    boolean totalInternalReflection;

    /**
     * 偏光ごとの値から平均値を計算して結果を生成します。
     *
     * @param rs s 偏光反射率です
     * @param rp p 偏光反射率です
     * @param ts s 偏光透過率です
     * @param tp p 偏光透過率です
     * @return 計算結果です
     */
    public static OpticalResult of(double rs, double rp, double ts, double tp) {
        return new OpticalResult(rs, rp, (rs + rp) / 2.0, ts, tp, (ts + tp) / 2.0, false);
    }

    /**
     * 全反射の結果（R = 100%, T = 0%）を返します。
     *
     * @return 全反射の結果です
     */
    public static OpticalResult totalInternalReflection() {
        return new OpticalResult(100.0, 100.0, 100.0, 0.0, 0.0, 0.0, true);
    }
}
