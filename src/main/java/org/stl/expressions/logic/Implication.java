package org.stl.expressions.logic;

import lombok.Getter;
import org.stl.config.ParserConfig;
import org.stl.expressions.Formula;
import org.stl.expressions.FormulaVisitor;
import org.stl.utils.ValueRange;

import java.util.List;
import java.util.Objects;

/**
 * 蕴含 l -> r，按 Or(Not(l), r) 求值。
 * 值域为 [max(-l.max, r.min), max(-l.min, r.max)]。
 */
@Getter
public final class Implication extends Formula {

    private final Formula left;
    private final Formula right;
    private final Or desugared;

    private Implication(Formula left, Formula right, double nu) {
        super(unionVariables(List.of(left, right)), maxHorizon(List.of(left, right)), inferRange(left, right));
        this.left = left;
        this.right = right;
        this.desugared = Or.of(List.of(Not.of(left), right), nu);
    }

    private static ValueRange inferRange(Formula left, Formula right) {
        if (left.getRange().isEmpty() || right.getRange().isEmpty()) {
            return null;
        }
        ValueRange l = left.getRange().get();
        ValueRange r = right.getRange().get();
        return ValueRange.of(Math.max(-l.getMax(), r.getMin()), Math.max(-l.getMin(), r.getMax()));
    }

    public static Implication of(Formula left, Formula right, double nu) {
        Objects.requireNonNull(left, "Implication-构造函数: left 不能为 null");
        Objects.requireNonNull(right, "Implication-构造函数: right 不能为 null");
        return new Implication(left, right, nu);
    }

    public static Implication of(Formula left, Formula right) {
        return of(left, right, ParserConfig.DEFAULT_NU);
    }

    public double getNu() {
        return desugared.getNu();
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitImplication(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Implication that = (Implication) o;
        return left.equals(that.left) && right.equals(that.right) && Double.compare(getNu(), that.getNu()) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash("implies", left, right, getNu());
    }
}
