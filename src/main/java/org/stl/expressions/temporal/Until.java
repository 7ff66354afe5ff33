package org.stl.expressions.temporal;

import lombok.Getter;
import org.stl.expressions.Formula;
import org.stl.expressions.FormulaVisitor;
import org.stl.utils.ValueRange;

import java.util.List;
import java.util.Objects;

/**
 * 有界直到算子 l U[lb, ub] r 及其弱变体 l W[lb, ub] r。
 * 强变体要求 r 在窗口内成立，释放时取 l 的前缀最小值与 r 的较小者；
 * 弱变体不要求 r 成立，总是返回 l 在 r 释放之前的最小值。
 * 值域为 [min(l.min, r.min), max(l.max, r.max)]。
 * 此类是不可变的。
 */
@Getter
public final class Until extends Formula {

    private final TimeBounds bounds;
    private final Formula left;
    private final Formula right;
    private final boolean weak;

    private Until(TimeBounds bounds, Formula left, Formula right, boolean weak) {
        super(unionVariables(List.of(left, right)),
                bounds.getUpper() + maxHorizon(List.of(left, right)),
                inferRange(left, right));
        this.bounds = bounds;
        this.left = left;
        this.right = right;
        this.weak = weak;
    }

    private static ValueRange inferRange(Formula left, Formula right) {
        if (left.getRange().isEmpty() || right.getRange().isEmpty()) {
            return null;
        }
        ValueRange l = left.getRange().get();
        ValueRange r = right.getRange().get();
        return ValueRange.of(Math.min(l.getMin(), r.getMin()), Math.max(l.getMax(), r.getMax()));
    }

    // --- 工厂方法 ---
    public static Until of(TimeBounds bounds, Formula left, Formula right, boolean weak) {
        Objects.requireNonNull(bounds, "Until-构造函数: bounds 不能为 null");
        Objects.requireNonNull(left, "Until-构造函数: left 不能为 null");
        Objects.requireNonNull(right, "Until-构造函数: right 不能为 null");
        return new Until(bounds, left, right, weak);
    }

    public static Until strong(double lowerBound, double upperBound, Formula left, Formula right) {
        return of(TimeBounds.of(lowerBound, upperBound), left, right, false);
    }

    public static Until weak(double lowerBound, double upperBound, Formula left, Formula right) {
        return of(TimeBounds.of(lowerBound, upperBound), left, right, true);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitUntil(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Until that = (Until) o;
        return weak == that.weak && bounds.equals(that.bounds) && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(weak ? "W" : "U", bounds, left, right);
    }
}
