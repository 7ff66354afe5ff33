package org.stl.expressions;

import lombok.Getter;
import org.stl.utils.ValueRange;

import java.util.Objects;

/**
 * 逐点绝对值 |f|。
 */
@Getter
public final class Abs extends Formula {

    private final Formula formula;

    private Abs(Formula formula) {
        super(formula.getVariables(), formula.getHorizon(), formula.getRange().map(ValueRange::abs).orElse(null));
        this.formula = formula;
    }

    public static Abs of(Formula formula) {
        return new Abs(Objects.requireNonNull(formula, "Abs-构造函数: formula 不能为 null"));
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitAbs(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return formula.equals(((Abs) o).formula);
    }

    @Override
    public int hashCode() {
        return Objects.hash("abs", formula);
    }
}
