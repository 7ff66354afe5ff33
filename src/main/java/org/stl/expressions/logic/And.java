package org.stl.expressions.logic;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stl.config.ParserConfig;
import org.stl.expressions.Formula;
import org.stl.expressions.FormulaVisitor;
import org.stl.utils.ValueRange;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * n 元合取 And(f1, ..., fn)。
 * 由于平滑语义下 And 不满足结合律，And(A, B, C) 与 And(A, And(B, C)) 是不同的公式。
 * nu 为平滑参数，必须严格为正，在构造时校验。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class And extends Formula {

    private static final Logger logger = LoggerFactory.getLogger(And.class);

    private final List<Formula> formulas;
    private final double nu;

    private And(List<Formula> formulas, double nu) {
        super(unionVariables(formulas), maxHorizon(formulas), inferRange(formulas));
        this.formulas = formulas;
        this.nu = nu;
        logger.debug("创建了一个 {} 元 And, nu = {}", formulas.size(), nu);
    }

    /**
     * 所有子公式值域已知时，取逐端点最小值。
     */
    private static ValueRange inferRange(List<Formula> formulas) {
        ValueRange result = null;
        for (Formula f : formulas) {
            if (f.getRange().isEmpty()) {
                return null;
            }
            ValueRange r = f.getRange().get();
            result = result == null ? r : result.lowerEnvelope(r);
        }
        return result;
    }

    // --- 工厂方法 ---

    /**
     * @throws org.stl.exceptions.ConfigurationException 如果 nu <= 0。
     * @throws IllegalArgumentException 如果没有子公式。
     */
    public static And of(List<Formula> formulas, double nu) {
        Objects.requireNonNull(formulas, "And-构造函数: formulas 不能为 null");
        if (formulas.isEmpty()) {
            logger.error("And-构造函数: 至少需要一个子公式");
            throw new IllegalArgumentException("And 至少需要一个子公式");
        }
        formulas.forEach(f -> Objects.requireNonNull(f, "And-构造函数: 子公式不能为 null"));
        ParserConfig.validateNu(nu);
        return new And(List.copyOf(formulas), nu);
    }

    public static And of(List<Formula> formulas) {
        return of(formulas, ParserConfig.DEFAULT_NU);
    }

    public static And of(Formula... formulas) {
        return of(Arrays.asList(formulas), ParserConfig.DEFAULT_NU);
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        And that = (And) o;
        return Double.compare(nu, that.nu) == 0 && formulas.equals(that.formulas);
    }

    @Override
    public int hashCode() {
        return Objects.hash("and", formulas, nu);
    }
}
