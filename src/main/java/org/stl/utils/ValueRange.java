package org.stl.utils;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 代表一个闭区间 [min, max]，用于公式值域的静态推断。
 * 边界允许为正负无穷，但不允许 NaN。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class ValueRange {

    private static final Logger logger = LoggerFactory.getLogger(ValueRange.class);

    public static final ValueRange UNBOUNDED = new ValueRange(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);

    private final double min;
    private final double max;

    private ValueRange(double min, double max) {
        this.min = min;
        this.max = max;
    }

    // --- 工厂方法 ---

    /**
     * 工厂方法：创建区间 [min, max]。
     * @throws IllegalArgumentException 如果任一边界为 NaN 或 min > max。
     */
    public static ValueRange of(double min, double max) {
        if (Double.isNaN(min) || Double.isNaN(max)) {
            logger.error("ValueRange-构造函数: 边界不能为 NaN: [{}, {}]", min, max);
            throw new IllegalArgumentException("ValueRange 的边界不能为 NaN");
        }
        if (min > max) {
            logger.error("ValueRange-构造函数: 下界 {} 大于上界 {}", min, max);
            throw new IllegalArgumentException("ValueRange 的下界 " + min + " 大于上界 " + max);
        }
        return new ValueRange(min, max);
    }

    /**
     * 工厂方法：由两个无序端点构造区间，保留 (min(a,b), max(a,b))。
     */
    public static ValueRange ordered(double a, double b) {
        return of(Math.min(a, b), Math.max(a, b));
    }

    /**
     * 工厂方法：单点区间 [v, v]。
     */
    public static ValueRange point(double value) {
        return of(value, value);
    }

    // --- 区间运算 ---

    public ValueRange negate() {
        return new ValueRange(-max, -min);
    }

    /**
     * 区间绝对值。跨越零点时下界为 0。
     */
    public ValueRange abs() {
        if (containsZero()) {
            return new ValueRange(0.0, Math.max(Math.abs(min), Math.abs(max)));
        }
        return ordered(Math.abs(min), Math.abs(max));
    }

    public ValueRange add(ValueRange other) {
        return new ValueRange(min + other.min, max + other.max);
    }

    public ValueRange subtract(ValueRange other) {
        return new ValueRange(min - other.max, max - other.min);
    }

    /**
     * 区间乘法。只有两个区间的符号都确定时才有结果。
     */
    public Optional<ValueRange> multiply(ValueRange other) {
        if (!isSignDeterminate() || !other.isSignDeterminate()) {
            return Optional.empty();
        }
        return Optional.of(fromCorners(min * other.min, min * other.max, max * other.min, max * other.max));
    }

    /**
     * 区间除法。被除数符号确定且除数严格不含零时才有结果。
     */
    public Optional<ValueRange> divide(ValueRange other) {
        if (!isSignDeterminate() || other.containsZero()) {
            return Optional.empty();
        }
        return Optional.of(fromCorners(min / other.min, min / other.max, max / other.min, max / other.max));
    }

    /**
     * 逐端点取最小值：[min(a.min, b.min), min(a.max, b.max)]。
     */
    public ValueRange lowerEnvelope(ValueRange other) {
        return new ValueRange(Math.min(min, other.min), Math.min(max, other.max));
    }

    // --- 查询 ---

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    public boolean containsZero() {
        return contains(0.0);
    }

    /**
     * 区间内所有值同号（允许端点为零）。
     */
    public boolean isSignDeterminate() {
        return min >= 0.0 || max <= 0.0;
    }

    private static ValueRange fromCorners(double... corners) {
        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (double c : corners) {
            if (Double.isNaN(c)) {
                // 0 * inf 之类的情况，无法给出可靠界限
                return UNBOUNDED;
            }
            lo = Math.min(lo, c);
            hi = Math.max(hi, c);
        }
        return new ValueRange(lo, hi);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ValueRange that = (ValueRange) o;
        return Double.compare(min, that.min) == 0 && Double.compare(max, that.max) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(min) + Double.hashCode(max);
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
