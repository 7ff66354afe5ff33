package org.stl.expressions;

import org.stl.utils.ValueRange;

import java.util.Optional;

public enum ArithmeticOperator {

    /**
     * 运算符枚举
     */
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/");

    private final String symbol;

    ArithmeticOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 对两个采样值逐点应用此运算。
     */
    public double apply(double left, double right) {
        return switch (this) {
            case ADD -> left + right;
            case SUBTRACT -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> left / right;
        };
    }

    /**
     * 按区间算术组合两个值域。乘除只在符号确定时给出结果。
     */
    public Optional<ValueRange> combine(ValueRange left, ValueRange right) {
        return switch (this) {
            case ADD -> Optional.of(left.add(right));
            case SUBTRACT -> Optional.of(left.subtract(right));
            case MULTIPLY -> left.multiply(right);
            case DIVIDE -> left.divide(right);
        };
    }
}
