package org.stl.expressions.temporal;

import lombok.Getter;
import org.stl.expressions.Formula;
import org.stl.expressions.FormulaVisitor;

import java.util.Objects;

/**
 * 下一步算子 X f：时刻 t[i] 的值取 f 在 t[i+1] 的值。
 * horizon 比子公式多一步。
 */
@Getter
public final class Next extends Formula {

    private final Formula formula;

    private Next(Formula formula) {
        super(formula.getVariables(), 1.0 + formula.getHorizon(), formula.getRange().orElse(null));
        this.formula = formula;
    }

    public static Next of(Formula formula) {
        return new Next(Objects.requireNonNull(formula, "Next-构造函数: formula 不能为 null"));
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitNext(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return formula.equals(((Next) o).formula);
    }

    @Override
    public int hashCode() {
        return Objects.hash("X", formula);
    }
}
