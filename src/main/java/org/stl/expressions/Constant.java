package org.stl.expressions;

import lombok.Getter;
import org.stl.utils.ValueRange;

import java.util.Collections;

/**
 * 常数信号，在每个时间点取同一个值。
 */
@Getter
public final class Constant extends Formula {

    private final double value;

    private Constant(double value) {
        super(Collections.emptySet(), 0.0, ValueRange.point(value));
        this.value = value;
    }

    public static Constant of(double value) {
        return new Constant(value);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Double.compare(value, ((Constant) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }
}
