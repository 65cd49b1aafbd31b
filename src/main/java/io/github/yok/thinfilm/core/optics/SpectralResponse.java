package io.github.yok.thinfilm.core.optics;

import java.util.Collections;
import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Value;

/**
 * 波長または入射角を掃引した計算結果です。
 *
 * <p>
 * {@code abscissa[i]} が {@code results.get(i)} の掃引値（波長 µm または入射角 度）です。
 * </p>
 */
@Value
public class SpectralResponse {

    /**
     * 掃引の種類です。
     */
    public enum Axis {
        WAVELENGTH, ANGLE
    }

    /**
     * 掃引の種類です。
     */
    Axis axis;

    /**
     * 掃引値です。
     */
    @Getter(AccessLevel.NONE)
    double[] abscissa;

    /**
     * 各掃引値での計算結果です。
     */
    @Getter(AccessLevel.NONE)
    List<OpticalResult> results;

    /**
     * 掃引値の複製を返します。
     *
     * @return 掃引値（波長 µm または入射角 度）です
     */
    public double[] getAbscissa() {
        return abscissa.clone();
    }

    /**
     * 各掃引値での計算結果を返します。
     *
     * @return 変更できない計算結果の一覧です
     */
    public List<OpticalResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    /**
     * 掃引点数を返します。
     *
     * @return 掃引点数です
     */
    public int size() {
        return abscissa.length;
    }
}
