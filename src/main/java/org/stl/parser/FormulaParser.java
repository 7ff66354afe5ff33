package org.stl.parser;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stl.config.ParserConfig;
import org.stl.exceptions.ConfigurationException;
import org.stl.exceptions.FormulaParseException;
import org.stl.expressions.Formula;
import org.stl.utils.ValueRange;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 公式文本到 {@link Formula} 的入口：词法分析、语法分析、再折叠为语法树。
 * 此类是不可变的，可以被多个线程共享。
 * @author Ayalyt
 */
@Getter
public final class FormulaParser {

    private static final Logger logger = LoggerFactory.getLogger(FormulaParser.class);

    private final ParserConfig config;

    public FormulaParser() {
        this(ParserConfig.defaults());
    }

    public FormulaParser(ParserConfig config) {
        this.config = Objects.requireNonNull(config, "FormulaParser-构造函数: config 不能为 null");
    }

    /**
     * 使用默认配置解析公式。
     */
    public static Formula parse(String text) {
        return new FormulaParser().parseFormula(text);
    }

    /**
     * 使用默认 nu 和给定的信号值域解析公式。
     */
    public static Formula parse(String text, Map<String, ValueRange> ranges) {
        return new FormulaParser(ParserConfig.of(ParserConfig.DEFAULT_NU, ranges)).parseFormula(text);
    }

    /**
     * @throws FormulaParseException  如果文本不是合法的公式，或使用了不支持的运算符。
     * @throws ConfigurationException 如果时间区间非法。
     */
    public Formula parseFormula(String text) {
        ParseNode tree = parseTree(text);
        Formula formula = new FormulaBuilder(config).build(tree);
        logger.info("解析公式 '{}' 得到 {}, 信号 {}, horizon {}", text, formula, formula.getVariables(), formula.getHorizon());
        return formula;
    }

    /**
     * 只做词法和语法分析，返回语法分析树。
     */
    public ParseNode parseTree(String text) {
        Objects.requireNonNull(text, "parseTree: text 不能为 null");
        List<Token> tokens = new StlLexer(text).tokenize();
        return new StlParser(tokens).parse();
    }
}
