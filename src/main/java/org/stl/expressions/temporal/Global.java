package org.stl.expressions.temporal;

import lombok.Getter;
import org.stl.expressions.Formula;
import org.stl.expressions.FormulaVisitor;

import java.util.Objects;

/**
 * 有界全局算子 G[lb, ub] f：f 在窗口 [t+lb, t+ub] 内的每个采样点上都要成立。
 * 鲁棒性为窗口内 f 的最小值。值域与子公式相同。
 * @author Ayalyt
 */
@Getter
public final class Global extends Formula {

    private final TimeBounds bounds;
    private final Formula formula;

    private Global(TimeBounds bounds, Formula formula) {
        super(formula.getVariables(), bounds.getUpper() + formula.getHorizon(), formula.getRange().orElse(null));
        this.bounds = bounds;
        this.formula = formula;
    }

    /**
     * @throws org.stl.exceptions.ConfigurationException 如果 lb > ub 或边界为负。
     */
    public static Global of(double lowerBound, double upperBound, Formula formula) {
        return of(TimeBounds.of(lowerBound, upperBound), formula);
    }

    public static Global of(TimeBounds bounds, Formula formula) {
        Objects.requireNonNull(bounds, "Global-构造函数: bounds 不能为 null");
        Objects.requireNonNull(formula, "Global-构造函数: formula 不能为 null");
        return new Global(bounds, formula);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitGlobal(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Global that = (Global) o;
        return bounds.equals(that.bounds) && formula.equals(that.formula);
    }

    @Override
    public int hashCode() {
        return Objects.hash("G", bounds, formula);
    }
}
