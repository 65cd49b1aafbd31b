package io.github.yok.thinfilm.core.optics;

import com.google.common.base.Preconditions;
import io.github.yok.thinfilm.core.dispersion.ComplexIndex;
import io.github.yok.thinfilm.core.dispersion.DispersionProvider;
import io.github.yok.thinfilm.core.model.CoatingStack;
import io.github.yok.thinfilm.core.model.DesignLayer;
import io.github.yok.thinfilm.core.model.ThicknessConversion;
import io.github.yok.thinfilm.core.model.ThicknessKind;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.complex.Complex;

/**
 * 特性行列法（transfer-matrix method）で多層膜の反射率・透過率を計算するクラスです。
 *
 * <p>
 * 各層を 2×2 複素特性行列で表し、s 偏光・p 偏光それぞれについて行列積から振幅反射係数 r と振幅透過係数 t を求めます。
 * 状態を持たないため、複数スレッドから同時に呼び出せます。
 * </p>
 *
 * <p>
 * 複素屈折率は ñ = n + ik（吸収材料は k &lt; 0）をそのまま用い、各層の cosθ は実部が非負になる分岐を選びます。
 * </p>
 */
public final class TransferMatrixEngine {

    /**
     * 屈折率の提供元です。
     */
    private final DispersionProvider dispersion;

    /**
     * 計算エンジンを生成します。
     *
     * @param dispersion 屈折率の提供元です（null 不可）
     * @throws IllegalArgumentException dispersion が null の場合に発生します
     */
    public TransferMatrixEngine(DispersionProvider dispersion) {
        if (dispersion == null) {
            throw new IllegalArgumentException("dispersion は null 不可です");
        }
        this.dispersion = dispersion;
    }

    /**
     * 指定波長・入射角での反射率と透過率を計算します。
     *
     * @param stack コーティング設計です（null 不可）
     * @param wavelengthUm 波長（µm、正の値）です
     * @param aoiDeg 入射媒質中での入射角（度）です
     * @return 計算結果（%）です
     * @throws IllegalArgumentException 引数が不正、または材料・基板が未登録の場合に発生します
     */
    public OpticalResult evaluate(CoatingStack stack, double wavelengthUm, double aoiDeg) {
        Preconditions.checkNotNull(stack, "設計が null です。");
        Preconditions.checkArgument(wavelengthUm > 0.0 && Double.isFinite(wavelengthUm),
                "波長は正の有限値が必要です。wavelength=%s", wavelengthUm);
        Preconditions.checkArgument(Math.abs(aoiDeg) < 90.0, "入射角は -90 度より大きく 90 度未満が必要です。aoi=%s",
                aoiDeg);

        final double n0 = stack.getIncidentIndex();
        final double nSub = dispersion.substrateIndex(stack.getSubstrateId(), wavelengthUm);

        final double aoi = Math.toRadians(aoiDeg);
        final double sin0 = Math.sin(aoi);
        final double cos0 = Math.cos(aoi);

        // 基板側で全反射する場合は行列計算をしない
        final double sinSub = n0 * sin0 / nSub;
        if (sinSub > 1.0) {
            return OpticalResult.totalInternalReflection();
        }
        final double cosSub = Math.sqrt(1.0 - sinSub * sinSub);

        ComplexMatrix2x2 ms = ComplexMatrix2x2.IDENTITY;
        ComplexMatrix2x2 mp = ComplexMatrix2x2.IDENTITY;

        // 高屈折率側から入射する（ガラス→空気）場合は層を逆順にたどる
        final boolean reverse = n0 > nSub;
        final int layerCount = stack.layerCount();
        final Complex snellInvariant = new Complex(n0 * sin0);

        for (int i = 0; i < layerCount; i++) {
            DesignLayer layer = stack.layer(reverse ? (layerCount - 1 - i) : i);

            ComplexIndex index = dispersion.materialIndex(layer.getMaterialId(), wavelengthUm);
            Complex nLayer = new Complex(index.getN(), index.getK());

            // 複素数の Snell の法則
            Complex sinLayer = snellInvariant.divide(nLayer);
            Complex cosLayer = Complex.ONE.subtract(sinLayer.multiply(sinLayer)).sqrt();
            if (cosLayer.getReal() < 0.0
                    || (cosLayer.getReal() == 0.0 && cosLayer.getImaginary() < 0.0)) {
                cosLayer = cosLayer.negate();
            }

            double thicknessUm = physicalThickness(stack, layer);

            // 位相膜厚 δ = 2π ñ d cosθ / λ
            Complex delta = nLayer.multiply(cosLayer).multiply(2.0 * Math.PI * thicknessUm / wavelengthUm);
            Complex cosDelta = delta.cos();
            Complex sinDelta = delta.sin();

            Complex etaS = nLayer.multiply(cosLayer);
            Complex etaP = nLayer.divide(cosLayer);

            ms = ms.multiply(characteristicMatrix(cosDelta, sinDelta, etaS));
            mp = mp.multiply(characteristicMatrix(cosDelta, sinDelta, etaP));
        }

        Complex[] coefficientsS = reflectionAndTransmission(ms, n0 * cos0, nSub * cosSub);
        Complex[] coefficientsP = reflectionAndTransmission(mp, n0 / cos0, nSub / cosSub);

        double rs = squaredModulus(coefficientsS[0]) * 100.0;
        double rp = squaredModulus(coefficientsP[0]) * 100.0;

        // 透過率はアドミッタンス比（s と p で異なる）を掛ける
        double geometryS = (nSub * cosSub) / (n0 * cos0);
        double geometryP = (nSub * cos0) / (n0 * cosSub);
        double ts = squaredModulus(coefficientsS[1]) * geometryS * 100.0;
        double tp = squaredModulus(coefficientsP[1]) * geometryP * 100.0;

        return OpticalResult.of(rs, rp, ts, tp);
    }

    /**
     * 波長を等間隔に掃引して計算します。
     *
     * @param stack コーティング設計です
     * @param wavelengthMinUm 最短波長（µm）です
     * @param wavelengthMaxUm 最長波長（µm）です
     * @param points 点数（2 以上）です
     * @param aoiDeg 入射角（度）です
     * @return 掃引結果です
     * @throws IllegalArgumentException 掃引条件が不正な場合に発生します
     */
    public SpectralResponse spectrum(CoatingStack stack, double wavelengthMinUm,
            double wavelengthMaxUm, int points, double aoiDeg) {
        double[] wavelengths = linspace(wavelengthMinUm, wavelengthMaxUm, points);
        List<OpticalResult> results = new ArrayList<>(points);
        for (double wavelength : wavelengths) {
            results.add(evaluate(stack, wavelength, aoiDeg));
        }
        return new SpectralResponse(SpectralResponse.Axis.WAVELENGTH, wavelengths, results);
    }

    /**
     * 入射角を等間隔に掃引して計算します。
     *
     * @param stack コーティング設計です
     * @param wavelengthUm 波長（µm）です
     * @param angleMinDeg 最小入射角（度）です
     * @param angleMaxDeg 最大入射角（度）です
     * @param points 点数（2 以上）です
     * @return 掃引結果です
     * @throws IllegalArgumentException 掃引条件が不正な場合に発生します
     */
    public SpectralResponse angularResponse(CoatingStack stack, double wavelengthUm,
            double angleMinDeg, double angleMaxDeg, int points) {
        double[] angles = linspace(angleMinDeg, angleMaxDeg, points);
        List<OpticalResult> results = new ArrayList<>(points);
        for (double angle : angles) {
            results.add(evaluate(stack, wavelengthUm, angle));
        }
        return new SpectralResponse(SpectralResponse.Axis.ANGLE, angles, results);
    }

    /**
     * 層の物理膜厚（µm）を返します。
     *
     * <p>
     * 光学膜厚の層は、計算波長ではなく設計の基準波長での屈折率で換算します。
     * </p>
     *
     * @param stack 層が属する設計です
     * @param layer 層です
     * @return 物理膜厚（µm）です
     */
    public double physicalThickness(CoatingStack stack, DesignLayer layer) {
        if (layer.getThicknessKind() == ThicknessKind.PHYSICAL) {
            return layer.getThickness();
        }
        double referenceWavelength = stack.getReferenceWavelength();
        double n = dispersion.materialIndex(layer.getMaterialId(), referenceWavelength).getN();
        if (n > 0.0) {
            return ThicknessConversion.opticalToPhysical(layer.getThickness(), n,
                    referenceWavelength);
        }
        return layer.getThickness();
    }

    /**
     * 特性行列 [[cosδ, i sinδ/η], [i η sinδ, cosδ]] を作ります。
     */
    private static ComplexMatrix2x2 characteristicMatrix(Complex cosDelta, Complex sinDelta,
            Complex eta) {
        return new ComplexMatrix2x2(cosDelta, Complex.I.multiply(sinDelta).divide(eta),
                Complex.I.multiply(eta).multiply(sinDelta), cosDelta);
    }

    /**
     * 行列と入射側・基板側のアドミッタンスから {r, t} を求めます。
     *
     * <p>
     * 層がない場合（単位行列）は、単一界面の Fresnel 係数になります。
     * </p>
     */
    private static Complex[] reflectionAndTransmission(ComplexMatrix2x2 m, double eta0,
            double etaSub) {
        Complex b = m.m11.add(m.m12.multiply(etaSub));
        Complex c = m.m21.add(m.m22.multiply(etaSub));
        Complex eta0B = b.multiply(eta0);
        Complex denominator = eta0B.add(c);
        Complex r = eta0B.subtract(c).divide(denominator);
        Complex t = new Complex(2.0 * eta0).divide(denominator);
        return new Complex[] {r, t};
    }

    private static double squaredModulus(Complex z) {
        return z.getReal() * z.getReal() + z.getImaginary() * z.getImaginary();
    }

    private static double[] linspace(double min, double max, int points) {
        Preconditions.checkArgument(points >= 2, "掃引点数は 2 以上が必要です。points=%s", points);
        Preconditions.checkArgument(min < max, "掃引範囲が不正です。min=%s, max=%s", min, max);
        double[] values = new double[points];
        for (int i = 0; i < points; i++) {
            double t = (double) i / (points - 1);
            values[i] = min + t * (max - min);
        }
        return values;
    }
}
