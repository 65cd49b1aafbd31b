package io.github.yok.thinfilm.core.dispersion;

import lombok.Value;

/**
 * 複素屈折率 ñ = n + ik を表すクラスです。
 *
 * <p>
 * 符号規約は ZEMAX に合わせ、吸収のある材料では k &lt; 0 とします（誘電体は k = 0）。
 * </p>
 */
@Value
public class ComplexIndex {

    /**
     * 屈折率（実部）n です。
     */
    double n;

    /**
     * 消衰係数（虚部）k です。
     */
    double k;

    /**
     * 吸収のない屈折率を生成します。
     *
     * @param n 屈折率です
     * @return k = 0 の複素屈折率です
     */
    public static ComplexIndex lossless(double n) {
        return new ComplexIndex(n, 0.0);
    }
}
