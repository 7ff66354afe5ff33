package org.stl.expressions;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stl.utils.ValueRange;

import java.util.List;
import java.util.Objects;

/**
 * 两个信号表达式之间的逐点算术运算 l op r，op 为 + - * /。
 * 此类是不可变的。
 */
@Getter
public final class Arithmetic extends Formula {

    private static final Logger logger = LoggerFactory.getLogger(Arithmetic.class);

    private final Formula left;
    private final Formula right;
    private final ArithmeticOperator operator;

    private Arithmetic(Formula left, Formula right, ArithmeticOperator operator) {
        super(unionVariables(List.of(left, right)), maxHorizon(List.of(left, right)), inferRange(left, right, operator));
        this.left = left;
        this.right = right;
        this.operator = operator;
        logger.debug("创建了一个 Arithmetic: {} {} {}，值域 {}", left, operator.getSymbol(), right, getRange());
    }

    private static ValueRange inferRange(Formula left, Formula right, ArithmeticOperator operator) {
        if (left.getRange().isEmpty() || right.getRange().isEmpty()) {
            return null;
        }
        return operator.combine(left.getRange().get(), right.getRange().get()).orElse(null);
    }

    // --- 工厂方法 ---
    public static Arithmetic of(Formula left, Formula right, ArithmeticOperator operator) {
        Objects.requireNonNull(left, "Arithmetic-构造函数: left 不能为 null");
        Objects.requireNonNull(right, "Arithmetic-构造函数: right 不能为 null");
        Objects.requireNonNull(operator, "Arithmetic-构造函数: operator 不能为 null");
        return new Arithmetic(left, right, operator);
    }

    public static Arithmetic sum(Formula left, Formula right) { return of(left, right, ArithmeticOperator.ADD); }
    public static Arithmetic subtract(Formula left, Formula right) { return of(left, right, ArithmeticOperator.SUBTRACT); }
    public static Arithmetic multiply(Formula left, Formula right) { return of(left, right, ArithmeticOperator.MULTIPLY); }
    public static Arithmetic divide(Formula left, Formula right) { return of(left, right, ArithmeticOperator.DIVIDE); }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitArithmetic(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Arithmetic that = (Arithmetic) o;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right, operator);
    }
}
