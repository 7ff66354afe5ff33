package org.stl.expressions.logic;

import lombok.Getter;
import org.stl.expressions.Formula;
import org.stl.expressions.FormulaVisitor;
import org.stl.utils.ValueRange;

import java.util.Objects;

/**
 * 逻辑否定：逐点取相反数。
 */
@Getter
public final class Not extends Formula {

    private final Formula formula;

    private Not(Formula formula) {
        super(formula.getVariables(), formula.getHorizon(), formula.getRange().map(ValueRange::negate).orElse(null));
        this.formula = formula;
    }

    public static Not of(Formula formula) {
        return new Not(Objects.requireNonNull(formula, "Not-构造函数: formula 不能为 null"));
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return formula.equals(((Not) o).formula);
    }

    @Override
    public int hashCode() {
        return Objects.hash("not", formula);
    }
}
