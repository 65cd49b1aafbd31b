package io.github.yok.thinfilm.core.dispersion;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Value;

/**
 * 波長ごとの (n, k) 表を線形補間する分散式です。
 *
 * <p>
 * 表の範囲外では端の値をそのまま返します。
 * </p>
 */
@Value
public class TabulatedDispersion implements DispersionFormula {

    /**
     * 昇順に並べた波長（µm）です。
     */
    @Getter(AccessLevel.NONE)
    double[] wavelengths;

    /**
     * 各波長の屈折率です。
     */
    @Getter(AccessLevel.NONE)
    double[] n;

    /**
     * 各波長の消衰係数です。
     */
    @Getter(AccessLevel.NONE)
    double[] k;

    /**
     * (λ, n, k) の行からテーブルを生成します。行は波長順でなくても構いません。
     *
     * @param rows {λ, n, k} の配列です（1 行以上）
     * @throws IllegalArgumentException 行が空、または 3 列でない場合に発生します
     */
    public TabulatedDispersion(double[][] rows) {
        Preconditions.checkNotNull(rows, "テーブルが null です。");
        Preconditions.checkArgument(rows.length > 0, "テーブルは 1 行以上必要です。");
        double[][] sorted = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            Preconditions.checkArgument(rows[i] != null && rows[i].length == 3,
                    "テーブルの各行は {波長, n, k} の 3 列で指定してください。行=%s", i);
            sorted[i] = rows[i];
        }
        Arrays.sort(sorted, (r1, r2) -> Double.compare(r1[0], r2[0]));

        this.wavelengths = new double[sorted.length];
        this.n = new double[sorted.length];
        this.k = new double[sorted.length];
        for (int i = 0; i < sorted.length; i++) {
            this.wavelengths[i] = sorted[i][0];
            this.n[i] = sorted[i][1];
            this.k[i] = sorted[i][2];
        }
    }

    /**
     * 波長（µm、昇順）の複製を返します。
     *
     * @return 波長です
     */
    public double[] getWavelengths() {
        return wavelengths.clone();
    }

    /**
     * 各波長の屈折率の複製を返します。
     *
     * @return 屈折率です
     */
    public double[] getN() {
        return n.clone();
    }

    /**
     * 各波長の消衰係数の複製を返します。
     *
     * @return 消衰係数です
     */
    public double[] getK() {
        return k.clone();
    }

    @Override
    public ComplexIndex indexAt(double wavelengthUm) {
        int last = wavelengths.length - 1;
        if (last == 0 || wavelengthUm <= wavelengths[0]) {
            return new ComplexIndex(n[0], k[0]);
        }
        if (wavelengthUm >= wavelengths[last]) {
            return new ComplexIndex(n[last], k[last]);
        }

        int hi = Arrays.binarySearch(wavelengths, wavelengthUm);
        if (hi >= 0) {
            return new ComplexIndex(n[hi], k[hi]);
        }
        hi = -hi - 1;
        int lo = hi - 1;

        double t = (wavelengthUm - wavelengths[lo]) / (wavelengths[hi] - wavelengths[lo]);
        return new ComplexIndex(n[lo] + t * (n[hi] - n[lo]), k[lo] + t * (k[hi] - k[lo]));
    }
}
