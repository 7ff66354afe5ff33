package org.stl.expressions.logic;

import lombok.Getter;
import org.stl.config.ParserConfig;
import org.stl.expressions.Formula;
import org.stl.expressions.FormulaVisitor;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * n 元析取，按 De Morgan 定义为 Not(And(Not(f1), ..., Not(fn)))。
 * 展开后的公式在构造时生成一次，求值时直接使用。
 */
@Getter
public final class Or extends Formula {

    private final List<Formula> formulas;
    private final double nu;
    private final Not desugared;

    private Or(List<Formula> formulas, double nu, Not desugared) {
        super(desugared.getVariables(), desugared.getHorizon(), desugared.getRange().orElse(null));
        this.formulas = formulas;
        this.nu = nu;
        this.desugared = desugared;
    }

    /**
     * @throws org.stl.exceptions.ConfigurationException 如果 nu <= 0。
     */
    public static Or of(List<Formula> formulas, double nu) {
        Objects.requireNonNull(formulas, "Or-构造函数: formulas 不能为 null");
        List<Formula> negated = formulas.stream()
                .map(f -> (Formula) Not.of(f))
                .collect(Collectors.toList());
        Not desugared = Not.of(And.of(negated, nu));
        return new Or(List.copyOf(formulas), nu, desugared);
    }

    public static Or of(List<Formula> formulas) {
        return of(formulas, ParserConfig.DEFAULT_NU);
    }

    public static Or of(Formula... formulas) {
        return of(Arrays.asList(formulas), ParserConfig.DEFAULT_NU);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitOr(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Or that = (Or) o;
        return Double.compare(nu, that.nu) == 0 && formulas.equals(that.formulas);
    }

    @Override
    public int hashCode() {
        return Objects.hash("or", formulas, nu);
    }
}
