package org.stl.parser;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stl.config.ParserConfig;
import org.stl.exceptions.FormulaParseException;
import org.stl.expressions.*;
import org.stl.expressions.logic.And;
import org.stl.expressions.logic.Implication;
import org.stl.expressions.logic.Not;
import org.stl.expressions.logic.Or;
import org.stl.expressions.temporal.Finally;
import org.stl.expressions.temporal.Global;
import org.stl.expressions.temporal.Next;
import org.stl.expressions.temporal.TimeBounds;
import org.stl.expressions.temporal.Until;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 将语法分析树折叠为 {@link Formula} 语法树。
 * <p>
 * 未加括号的同种 and/or 链被展平为一个多元节点，例如 {@code A and B and C} 得到三元合取；
 * 括号会阻止展平，{@code A and (B and C)} 得到嵌套的二元合取。
 * 合取、析取和蕴含使用配置中的 nu，信号值域也从配置中读取。
 */
public final class FormulaBuilder implements ParseTreeVisitor<Formula> {

    private static final Logger logger = LoggerFactory.getLogger(FormulaBuilder.class);

    private final ParserConfig config;

    public FormulaBuilder(ParserConfig config) {
        this.config = Objects.requireNonNull(config, "FormulaBuilder-构造函数: config 不能为 null");
    }

    public Formula build(ParseNode root) {
        return root.accept(this);
    }

    @Override
    public Formula visitNumber(ParseNode.NumberLiteral node) {
        return Constant.of(node.getValue());
    }

    @Override
    public Formula visitSignal(ParseNode.SignalName node) {
        return config.rangeOf(node.getName())
                .map(range -> SignalRef.of(node.getName(), range))
                .orElseGet(() -> SignalRef.of(node.getName()));
    }

    @Override
    public Formula visitUnary(ParseNode.Unary node) {
        Token operator = node.getOperator();
        switch (operator.getType()) {
            case NOT:
                return Not.of(node.getOperand().accept(this));
            case NEXT:
                return Next.of(node.getOperand().accept(this));
            case PIPE:
                return Abs.of(node.getOperand().accept(this));
            case MINUS:
                if (node.getOperand() instanceof ParseNode.NumberLiteral) {
                    return Constant.of(-((ParseNode.NumberLiteral) node.getOperand()).getValue());
                }
                // 对表达式取负与对其鲁棒性取反一致
                return Not.of(node.getOperand().accept(this));
            default:
                throw unsupported(operator);
        }
    }

    @Override
    public Formula visitBinary(ParseNode.Binary node) {
        Token operator = node.getOperator();
        switch (operator.getType()) {
            case AND:
                return And.of(flatten(node, TokenType.AND), config.getNu());
            case OR:
                return Or.of(flatten(node, TokenType.OR), config.getNu());
            case IMPLIES:
                return Implication.of(node.getLeft().accept(this), node.getRight().accept(this), config.getNu());
            case IFF:
                logger.error("位置 {} 处使用了不支持的双向蕴含", operator.getPosition());
                throw new FormulaParseException("不支持双向蕴含运算符", operator.getPosition(), operator.getText());
            case PLUS:
                return Arithmetic.sum(node.getLeft().accept(this), node.getRight().accept(this));
            case MINUS:
                return Arithmetic.subtract(node.getLeft().accept(this), node.getRight().accept(this));
            case STAR:
                return Arithmetic.multiply(node.getLeft().accept(this), node.getRight().accept(this));
            case SLASH:
                return Arithmetic.divide(node.getLeft().accept(this), node.getRight().accept(this));
            case LT:
            case LE:
            case GT:
            case GE:
            case EQ:
            case NEQ:
                return Predicate.of(node.getLeft().accept(this), node.getRight().accept(this),
                        RelationType.fromSymbol(operator.getText()));
            default:
                throw unsupported(operator);
        }
    }

    /**
     * 收集同一运算符下未加括号的所有操作数，保持从左到右的顺序。
     */
    private List<Formula> flatten(ParseNode.Binary node, TokenType operator) {
        List<Formula> operands = new ArrayList<>();
        collect(node, operator, operands);
        return operands;
    }

    private void collect(ParseNode node, TokenType operator, List<Formula> operands) {
        if (node instanceof ParseNode.Binary && ((ParseNode.Binary) node).getOperator().getType() == operator) {
            ParseNode.Binary binary = (ParseNode.Binary) node;
            collect(binary.getLeft(), operator, operands);
            collect(binary.getRight(), operator, operands);
        } else {
            operands.add(node.accept(this));
        }
    }

    @Override
    public Formula visitTemporal(ParseNode.Temporal node) {
        Token operator = node.getOperator();
        Pair<Double, Double> interval = node.getInterval();
        if (interval == null) {
            logger.error("位置 {} 处的时序运算符 {} 缺少时间区间", operator.getPosition(), operator.getText());
            throw new FormulaParseException("时序运算符需要时间区间 [a, b]", operator.getPosition(), operator.getText());
        }
        TimeBounds bounds = TimeBounds.of(interval.getLeft(), interval.getRight());
        Formula right = node.getRight().accept(this);
        switch (operator.getType()) {
            case ALWAYS:
                return Global.of(bounds, right);
            case EVENTUALLY:
                return Finally.of(bounds, right);
            case UNTIL:
                return Until.of(bounds, node.getLeft().accept(this), right, false);
            case WEAK_UNTIL:
                return Until.of(bounds, node.getLeft().accept(this), right, true);
            default:
                throw unsupported(operator);
        }
    }

    @Override
    public Formula visitGrouped(ParseNode.Grouped node) {
        return node.getInner().accept(this);
    }

    private static FormulaParseException unsupported(Token operator) {
        logger.error("无法处理的运算符 {}", operator);
        return new FormulaParseException("无法处理的运算符", operator.getPosition(), operator.getText());
    }
}
