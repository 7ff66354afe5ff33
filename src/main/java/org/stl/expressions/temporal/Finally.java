package org.stl.expressions.temporal;

import lombok.Getter;
import org.stl.expressions.Formula;
import org.stl.expressions.FormulaVisitor;
import org.stl.expressions.logic.Not;

import java.util.Objects;

/**
 * 有界最终算子 F[lb, ub] f，定义为 Not(Global(lb, ub, Not(f)))。
 */
@Getter
public final class Finally extends Formula {

    private final TimeBounds bounds;
    private final Formula formula;
    private final Not desugared;

    private Finally(TimeBounds bounds, Formula formula, Not desugared) {
        super(desugared.getVariables(), desugared.getHorizon(), desugared.getRange().orElse(null));
        this.bounds = bounds;
        this.formula = formula;
        this.desugared = desugared;
    }

    public static Finally of(double lowerBound, double upperBound, Formula formula) {
        return of(TimeBounds.of(lowerBound, upperBound), formula);
    }

    public static Finally of(TimeBounds bounds, Formula formula) {
        Objects.requireNonNull(bounds, "Finally-构造函数: bounds 不能为 null");
        Objects.requireNonNull(formula, "Finally-构造函数: formula 不能为 null");
        return new Finally(bounds, formula, Not.of(Global.of(bounds, Not.of(formula))));
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitFinally(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Finally that = (Finally) o;
        return bounds.equals(that.bounds) && formula.equals(that.formula);
    }

    @Override
    public int hashCode() {
        return Objects.hash("F", bounds, formula);
    }
}
