package io.github.yok.thinfilm.core.model;

/**
 * 層厚の表し方です。
 */
public enum ThicknessKind {

    /**
     * 物理膜厚（µm）です。
     */
    PHYSICAL,

    /**
     * 光学膜厚（基準波長に対する波数、0.25 = λ/4）です。
     */
    OPTICAL
}
