package org.stl.expressions.temporal;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stl.exceptions.ConfigurationException;

/**
 * 时序算子的相对时间窗口 [lower, upper]，0 <= lower <= upper。
 * 此类是不可变的。
 */
@Getter
public final class TimeBounds {

    private static final Logger logger = LoggerFactory.getLogger(TimeBounds.class);

    private final double lower;
    private final double upper;

    private TimeBounds(double lower, double upper) {
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * @throws ConfigurationException 如果边界为 NaN、为负或下界大于上界。
     */
    public static TimeBounds of(double lower, double upper) {
        if (Double.isNaN(lower) || lower < 0) {
            logger.error("TimeBounds-构造函数: 下界 {} 必须是非负数", lower);
            throw new ConfigurationException("lowerBound", lower, "时间下界必须是非负数");
        }
        if (Double.isNaN(upper) || lower > upper) {
            logger.error("TimeBounds-构造函数: 下界 {} 大于上界 {}", lower, upper);
            throw new ConfigurationException("upperBound", upper, "时间上界不能小于下界 " + lower);
        }
        return new TimeBounds(lower, upper);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TimeBounds that = (TimeBounds) o;
        return Double.compare(lower, that.lower) == 0 && Double.compare(upper, that.upper) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(lower) + Double.hashCode(upper);
    }

    @Override
    public String toString() {
        return "[" + lower + ", " + upper + "]";
    }
}
