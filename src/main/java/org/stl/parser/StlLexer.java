package org.stl.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stl.exceptions.FormulaParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 将 STL 公式文本切分为 token 序列。
 * 关键字别名（always/G, eventually/F, next/X, until/U, !/not, -&gt;/implies, &lt;-&gt;/iff）在此处归一到同一类型。
 */
public final class StlLexer {

    private static final Logger logger = LoggerFactory.getLogger(StlLexer.class);

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),
            Map.entry("not", TokenType.NOT),
            Map.entry("implies", TokenType.IMPLIES),
            Map.entry("iff", TokenType.IFF),
            Map.entry("G", TokenType.ALWAYS),
            Map.entry("always", TokenType.ALWAYS),
            Map.entry("F", TokenType.EVENTUALLY),
            Map.entry("eventually", TokenType.EVENTUALLY),
            Map.entry("X", TokenType.NEXT),
            Map.entry("next", TokenType.NEXT),
            Map.entry("U", TokenType.UNTIL),
            Map.entry("until", TokenType.UNTIL),
            Map.entry("W", TokenType.WEAK_UNTIL)
    );

    private final String input;
    private int pos = 0;

    public StlLexer(String input) {
        this.input = input;
    }

    /**
     * @return 以 EOF 结尾的 token 列表。
     * @throws FormulaParseException 如果遇到无法识别的字符。
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                tokens.add(new Token(TokenType.EOF, "<EOF>", pos));
                break;
            }
            tokens.add(nextToken());
        }
        logger.debug("词法分析得到 {} 个 token: {}", tokens.size(), tokens);
        return tokens;
    }

    private Token nextToken() {
        int start = pos;
        char c = input.charAt(pos);

        if (Character.isLetter(c) || c == '_') {
            while (pos < input.length() && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
                pos++;
            }
            String word = input.substring(start, pos);
            return new Token(KEYWORDS.getOrDefault(word, TokenType.IDENTIFIER), word, start);
        }
        if (Character.isDigit(c) || (c == '.' && pos + 1 < input.length() && Character.isDigit(input.charAt(pos + 1)))) {
            return number(start);
        }

        // 先匹配较长的符号
        if (input.startsWith("<->", pos)) {
            return symbol(TokenType.IFF, 3);
        }
        if (input.startsWith("->", pos)) {
            return symbol(TokenType.IMPLIES, 2);
        }
        if (input.startsWith("<=", pos)) {
            return symbol(TokenType.LE, 2);
        }
        if (input.startsWith(">=", pos)) {
            return symbol(TokenType.GE, 2);
        }
        if (input.startsWith("==", pos)) {
            return symbol(TokenType.EQ, 2);
        }
        if (input.startsWith("!=", pos)) {
            return symbol(TokenType.NEQ, 2);
        }

        return switch (c) {
            case '<' -> symbol(TokenType.LT, 1);
            case '>' -> symbol(TokenType.GT, 1);
            case '!' -> symbol(TokenType.NOT, 1);
            case '+' -> symbol(TokenType.PLUS, 1);
            case '-' -> symbol(TokenType.MINUS, 1);
            case '*' -> symbol(TokenType.STAR, 1);
            case '/' -> symbol(TokenType.SLASH, 1);
            case '(' -> symbol(TokenType.LPAREN, 1);
            case ')' -> symbol(TokenType.RPAREN, 1);
            case '[' -> symbol(TokenType.LBRACKET, 1);
            case ']' -> symbol(TokenType.RBRACKET, 1);
            case ',' -> symbol(TokenType.COMMA, 1);
            case '|' -> symbol(TokenType.PIPE, 1);
            default -> {
                logger.error("位置 {} 处遇到无法识别的字符 '{}'", start, c);
                throw new FormulaParseException("无法识别的字符", start, String.valueOf(c));
            }
        };
    }

    private Token number(int start) {
        while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
            pos++;
        }
        if (pos < input.length() && input.charAt(pos) == '.') {
            pos++;
            while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                pos++;
            }
        }
        if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < input.length() && (input.charAt(pos) == '+' || input.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                    pos++;
                }
            } else {
                // 不是指数部分，回退
                pos = mark;
            }
        }
        return new Token(TokenType.NUMBER, input.substring(start, pos), start);
    }

    private Token symbol(TokenType type, int length) {
        Token token = new Token(type, input.substring(pos, pos + length), pos);
        pos += length;
        return token;
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }
}
