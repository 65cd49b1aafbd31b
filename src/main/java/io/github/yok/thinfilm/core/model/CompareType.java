package io.github.yok.thinfilm.core.model;

/**
 * 評価ターゲットの比較方法です。
 */
public enum CompareType {

    /**
     * 目標値に一致させます（両側）。
     */
    EQUAL,

    /**
     * 目標値以下にします（超えた分だけを誤差にします）。
     */
    LESS_OR_EQUAL,

    /**
     * 目標値以上にします（下回った分だけを誤差にします）。
     */
    GREATER_OR_EQUAL
}
