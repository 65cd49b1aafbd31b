package io.github.yok.thinfilm.core.dispersion;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Value;

/**
 * Sellmeier 分散式 n² = A + Σ Bᵢλ²/(λ² − Cᵢ) です（λ は µm、Cᵢ は µm²）。
 *
 * <p>
 * 標準形は A = 1 です。TiO2 などの修正形では A ≠ 1 を指定します。 n² が 0 以下になる波長では、名目屈折率 {@code fallbackN}
 * を返します。
 * </p>
 */
@Value
public class SellmeierDispersion implements DispersionFormula {

    /**
     * 定数項 A です。
     */
    double a;

    /**
     * 係数 Bᵢ です（最大 3 項）。
     */
    @Getter(AccessLevel.NONE)
    double[] b;

    /**
     * 共鳴波長の二乗 Cᵢ です（最大 3 項）。
     */
    @Getter(AccessLevel.NONE)
    double[] c;

    /**
     * n² が正にならない場合に返す名目屈折率です。
     */
    double fallbackN;

    /**
     * 消衰係数です。
     */
    double k;

    /**
     * Sellmeier 分散式を生成します。
     *
     * @param a 定数項 A です
     * @param b 係数 Bᵢ です
     * @param c 係数 Cᵢ です
     * @param fallbackN 名目屈折率です
     * @param k 消衰係数です
     * @throws IllegalArgumentException 係数の個数が 1..3 で揃っていない場合に発生します
     */
    public SellmeierDispersion(double a, double[] b, double[] c, double fallbackN, double k) {
        Preconditions.checkNotNull(b, "B 係数が null です。");
        Preconditions.checkNotNull(c, "C 係数が null です。");
        Preconditions.checkArgument(b.length == c.length && b.length >= 1 && b.length <= 3,
                "Sellmeier 係数は B/C が同数で 1..3 項必要です。B=%s, C=%s", b.length, c.length);
        this.a = a;
        this.b = Arrays.copyOf(b, b.length);
        this.c = Arrays.copyOf(c, c.length);
        this.fallbackN = fallbackN;
        this.k = k;
    }

    /**
     * 標準形（A = 1）の Sellmeier 分散式を生成します。
     *
     * @param fallbackN 名目屈折率です
     * @param terms B1, C1, B2, C2, ... の順の係数です
     * @return 分散式です
     */
    public static SellmeierDispersion standard(double fallbackN, double... terms) {
        return modified(1.0, fallbackN, terms);
    }

    /**
     * 定数項 A を指定した修正形の Sellmeier 分散式を生成します。
     *
     * @param a 定数項 A です
     * @param fallbackN 名目屈折率です
     * @param terms B1, C1, B2, C2, ... の順の係数です
     * @return 分散式です
     * @throws IllegalArgumentException 係数が (B, C) の組になっていない場合に発生します
     */
    public static SellmeierDispersion modified(double a, double fallbackN, double... terms) {
        Preconditions.checkArgument(terms.length % 2 == 0, "Sellmeier 係数は (B, C) の組で指定してください。個数=%s",
                terms.length);
        int count = terms.length / 2;
        double[] b = new double[count];
        double[] c = new double[count];
        for (int i = 0; i < count; i++) {
            b[i] = terms[2 * i];
            c[i] = terms[2 * i + 1];
        }
        return new SellmeierDispersion(a, b, c, fallbackN, 0.0);
    }

    /**
     * 係数 Bᵢ の複製を返します。
     *
     * @return 係数 Bᵢ です
     */
    public double[] getB() {
        return b.clone();
    }

    /**
     * 係数 Cᵢ の複製を返します。
     *
     * @return 係数 Cᵢ です
     */
    public double[] getC() {
        return c.clone();
    }

    /**
     * 指定波長での n² を計算します。
     *
     * @param wavelengthUm 波長（µm）です
     * @return n² です
     */
    public double refractiveIndexSquared(double wavelengthUm) {
        double lambda2 = wavelengthUm * wavelengthUm;
        double n2 = a;
        for (int i = 0; i < b.length; i++) {
            // 両方 0 の項は未使用
            if (b[i] != 0.0 || c[i] != 0.0) {
                n2 += b[i] * lambda2 / (lambda2 - c[i]);
            }
        }
        return n2;
    }

    @Override
    public ComplexIndex indexAt(double wavelengthUm) {
        double n2 = refractiveIndexSquared(wavelengthUm);
        double n = (n2 > 0.0) ? Math.sqrt(n2) : fallbackN;
        return new ComplexIndex(n, k);
    }
}
