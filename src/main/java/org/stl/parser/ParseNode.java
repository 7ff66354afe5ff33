package org.stl.parser;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;

/**
 * STL 公式的语法分析树。只在解析过程中存在，由 {@link FormulaBuilder} 折叠为公式语法树后丢弃。
 * 显式的 {@link Grouped} 节点记录括号，用于决定 and/or 链是否可以展平。
 */
@Getter
public abstract class ParseNode {

    /** 节点在输入文本中的起始位置 */
    private final int position;

    protected ParseNode(int position) {
        this.position = position;
    }

    public abstract <R> R accept(ParseTreeVisitor<R> visitor);

    /**
     * 数字字面量。
     */
    @Getter
    public static final class NumberLiteral extends ParseNode {
        private final double value;

        public NumberLiteral(int position, double value) {
            super(position);
            this.value = value;
        }

        @Override
        public <R> R accept(ParseTreeVisitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    /**
     * 信号名。
     */
    @Getter
    public static final class SignalName extends ParseNode {
        private final String name;

        public SignalName(int position, String name) {
            super(position);
            this.name = name;
        }

        @Override
        public <R> R accept(ParseTreeVisitor<R> visitor) {
            return visitor.visitSignal(this);
        }
    }

    /**
     * 一元运算：not, 取负, X, |.|。
     */
    @Getter
    public static final class Unary extends ParseNode {
        private final Token operator;
        private final ParseNode operand;

        public Unary(Token operator, ParseNode operand) {
            super(operator.getPosition());
            this.operator = operator;
            this.operand = operand;
        }

        @Override
        public <R> R accept(ParseTreeVisitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    /**
     * 二元运算：算术、比较、and/or、implies/iff。
     */
    @Getter
    public static final class Binary extends ParseNode {
        private final Token operator;
        private final ParseNode left;
        private final ParseNode right;

        public Binary(Token operator, ParseNode left, ParseNode right) {
            super(left.getPosition());
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(ParseTreeVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    /**
     * 时序运算：G, F（left 为 null）以及 U, W。
     * interval 为 null 表示文本中没有给出区间。
     */
    @Getter
    public static final class Temporal extends ParseNode {
        private final Token operator;
        private final Pair<Double, Double> interval;
        private final ParseNode left;
        private final ParseNode right;

        public Temporal(Token operator, Pair<Double, Double> interval, ParseNode left, ParseNode right) {
            super(left != null ? left.getPosition() : operator.getPosition());
            this.operator = operator;
            this.interval = interval;
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(ParseTreeVisitor<R> visitor) {
            return visitor.visitTemporal(this);
        }
    }

    /**
     * 括号包裹的子表达式。
     */
    @Getter
    public static final class Grouped extends ParseNode {
        private final ParseNode inner;

        public Grouped(int position, ParseNode inner) {
            super(position);
            this.inner = inner;
        }

        @Override
        public <R> R accept(ParseTreeVisitor<R> visitor) {
            return visitor.visitGrouped(this);
        }
    }
}
