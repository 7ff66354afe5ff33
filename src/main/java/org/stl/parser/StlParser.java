package org.stl.parser;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stl.exceptions.FormulaParseException;

import java.util.List;
import java.util.Objects;

/**
 * 递归下降解析器，将 token 序列构造成 {@link ParseNode} 语法分析树。
 * <p>
 * 优先级从低到高：
 * <pre>
 * implication    := disjunction ((implies | iff) implication)?
 * disjunction    := conjunction (or conjunction)*
 * conjunction    := until (and until)*
 * until          := unaryFormula ((U | W) interval? unaryFormula)*
 * unaryFormula   := not unaryFormula | (G | F) interval? unaryFormula | X unaryFormula | comparison
 * comparison     := additive (relop additive)?
 * additive       := multiplicative ((+ | -) multiplicative)*
 * multiplicative := signedAtom ((* | /) signedAtom)*
 * signedAtom     := - signedAtom | atom
 * atom           := NUMBER | IDENTIFIER | ( implication ) | '|' additive '|'
 * interval       := [ number , number ]
 * </pre>
 * 蕴含是右结合的，其余二元运算左结合。
 */
public final class StlParser {

    private static final Logger logger = LoggerFactory.getLogger(StlParser.class);

    private final List<Token> tokens;
    private int pos = 0;

    public StlParser(List<Token> tokens) {
        this.tokens = Objects.requireNonNull(tokens, "StlParser-构造函数: tokens 不能为 null");
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != TokenType.EOF) {
            throw new IllegalArgumentException("token 序列必须以 EOF 结尾");
        }
    }

    /**
     * 解析整个输入。
     * @throws FormulaParseException 如果输入不是合法的公式，或公式之后还有多余的 token。
     */
    public ParseNode parse() {
        ParseNode root = implication();
        if (peek().getType() != TokenType.EOF) {
            throw error("公式结束后出现多余的内容", peek());
        }
        return root;
    }

    // --- 逻辑层 ---

    private ParseNode implication() {
        ParseNode left = disjunction();
        if (check(TokenType.IMPLIES) || check(TokenType.IFF)) {
            Token operator = advance();
            ParseNode right = implication();
            return new ParseNode.Binary(operator, left, right);
        }
        return left;
    }

    private ParseNode disjunction() {
        ParseNode left = conjunction();
        while (check(TokenType.OR)) {
            Token operator = advance();
            left = new ParseNode.Binary(operator, left, conjunction());
        }
        return left;
    }

    private ParseNode conjunction() {
        ParseNode left = until();
        while (check(TokenType.AND)) {
            Token operator = advance();
            left = new ParseNode.Binary(operator, left, until());
        }
        return left;
    }

    private ParseNode until() {
        ParseNode left = unaryFormula();
        while (check(TokenType.UNTIL) || check(TokenType.WEAK_UNTIL)) {
            Token operator = advance();
            Pair<Double, Double> interval = check(TokenType.LBRACKET) ? interval() : null;
            left = new ParseNode.Temporal(operator, interval, left, unaryFormula());
        }
        return left;
    }

    private ParseNode unaryFormula() {
        if (check(TokenType.NOT) || check(TokenType.NEXT)) {
            Token operator = advance();
            return new ParseNode.Unary(operator, unaryFormula());
        }
        if (check(TokenType.ALWAYS) || check(TokenType.EVENTUALLY)) {
            Token operator = advance();
            Pair<Double, Double> interval = check(TokenType.LBRACKET) ? interval() : null;
            return new ParseNode.Temporal(operator, interval, null, unaryFormula());
        }
        return comparison();
    }

    // --- 比较与算术 ---

    private ParseNode comparison() {
        ParseNode left = additive();
        if (isRelational(peek().getType())) {
            Token operator = advance();
            return new ParseNode.Binary(operator, left, additive());
        }
        return left;
    }

    private static boolean isRelational(TokenType type) {
        return switch (type) {
            case LT, LE, GT, GE, EQ, NEQ -> true;
            default -> false;
        };
    }

    private ParseNode additive() {
        ParseNode left = multiplicative();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            Token operator = advance();
            left = new ParseNode.Binary(operator, left, multiplicative());
        }
        return left;
    }

    private ParseNode multiplicative() {
        ParseNode left = signedAtom();
        while (check(TokenType.STAR) || check(TokenType.SLASH)) {
            Token operator = advance();
            left = new ParseNode.Binary(operator, left, signedAtom());
        }
        return left;
    }

    private ParseNode signedAtom() {
        if (check(TokenType.MINUS)) {
            Token operator = advance();
            return new ParseNode.Unary(operator, signedAtom());
        }
        return atom();
    }

    private ParseNode atom() {
        Token token = peek();
        switch (token.getType()) {
            case NUMBER:
                advance();
                return new ParseNode.NumberLiteral(token.getPosition(), Double.parseDouble(token.getText()));
            case IDENTIFIER:
                advance();
                return new ParseNode.SignalName(token.getPosition(), token.getText());
            case LPAREN: {
                advance();
                ParseNode inner = implication();
                expect(TokenType.RPAREN, "')'");
                return new ParseNode.Grouped(token.getPosition(), inner);
            }
            case PIPE: {
                advance();
                ParseNode inner = additive();
                expect(TokenType.PIPE, "'|'");
                return new ParseNode.Unary(token, inner);
            }
            default:
                throw error("期望数字、信号名或 '('，实际为 '" + token.getText() + "'", token);
        }
    }

    // --- 时间区间 ---

    private Pair<Double, Double> interval() {
        expect(TokenType.LBRACKET, "'['");
        double lower = signedNumber();
        expect(TokenType.COMMA, "','");
        double upper = signedNumber();
        expect(TokenType.RBRACKET, "']'");
        return Pair.of(lower, upper);
    }

    private double signedNumber() {
        boolean negative = false;
        if (check(TokenType.MINUS)) {
            advance();
            negative = true;
        }
        Token number = expect(TokenType.NUMBER, "数字");
        double value = Double.parseDouble(number.getText());
        return negative ? -value : value;
    }

    // --- 辅助方法 ---

    private Token peek() {
        return tokens.get(pos);
    }

    private boolean check(TokenType type) {
        return peek().getType() == type;
    }

    private Token advance() {
        Token token = tokens.get(pos);
        if (token.getType() != TokenType.EOF) {
            pos++;
        }
        return token;
    }

    private Token expect(TokenType type, String description) {
        Token token = peek();
        if (token.getType() != type) {
            throw error("期望 " + description + "，实际为 '" + token.getText() + "'", token);
        }
        return advance();
    }

    private static FormulaParseException error(String message, Token token) {
        logger.error("语法错误: {} (位置 {})", message, token.getPosition());
        return new FormulaParseException(message, token.getPosition(), token.getText());
    }
}
