package org.stl.expressions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public enum RelationType {

    /**
     * 运算符枚举
     */
    LT("<"),    // Less Than
    LE("<="),   // Less Equal
    GT(">"),    // Greater Than
    GE(">="),   // Greater Equal
    EQ("=="),   // Equal
    NEQ("!=");  // Not Equal

    private final String symbol;

    RelationType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    private static Logger logger = LoggerFactory.getLogger(RelationType.class);

    /**
     * 按符号查找关系类型。
     * @param symbol 比较运算符文本，例如 "<="。
     * @throws IllegalArgumentException 如果符号未知。
     */
    public static RelationType fromSymbol(String symbol) {
        for (RelationType type : values()) {
            if (type.symbol.equals(symbol)) {
                return type;
            }
        }
        logger.error("RelationType.fromSymbol: 未知的比较运算符 {}", symbol);
        throw new IllegalArgumentException("未知的比较运算符：" + symbol);
    }
}
