package org.stl.config;

/**
 * And/Or 的鲁棒性语义。
 */
public enum ConjunctionSemantics {
    /**
     * 经典语义：逐点取最小值。
     */
    CLASSIC,
    /**
     * 平滑语义：以 nu 为参数的加权合取，nu 趋于无穷时退化为经典最小值。
     */
    SMOOTHED
}
