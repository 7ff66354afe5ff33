package org.stl.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.stl.config.ParserConfig;
import org.stl.exceptions.ConfigurationException;
import org.stl.exceptions.FormulaParseException;
import org.stl.expressions.*;
import org.stl.expressions.logic.And;
import org.stl.expressions.logic.Implication;
import org.stl.expressions.logic.Not;
import org.stl.expressions.logic.Or;
import org.stl.expressions.temporal.Finally;
import org.stl.expressions.temporal.Global;
import org.stl.expressions.temporal.Next;
import org.stl.expressions.temporal.Until;
import org.stl.utils.ValueRange;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FormulaParserTest {

    private static Predicate gt(String signal, double value) {
        return Predicate.strictlyGreaterThan(SignalRef.of(signal), Constant.of(value));
    }

    @Nested
    @DisplayName("and/or 展平 (Flattening)")
    class FlatteningTests {

        @Test
        @DisplayName("未加括号的 and 链展平为一个三元合取")
        void testAndChain_IsFlattened() {
            Formula f = FormulaParser.parse("x > 0 and y > 0 and z > 0");
            assertInstanceOf(And.class, f);
            And and = (And) f;
            assertAll("flattened",
                    () -> assertEquals(3, and.getFormulas().size()),
                    () -> assertEquals(gt("x", 0), and.getFormulas().get(0)),
                    () -> assertEquals(gt("z", 0), and.getFormulas().get(2))
            );
        }

        @Test
        @DisplayName("括号阻止展平：A and (B and C) 得到嵌套的二元合取")
        void testParenthesizedAnd_IsNotFlattened() {
            And and = (And) FormulaParser.parse("x > 0 and (y > 0 and z > 0)");
            assertAll("nested",
                    () -> assertEquals(2, and.getFormulas().size()),
                    () -> assertEquals(gt("x", 0), and.getFormulas().get(0)),
                    () -> assertEquals(And.of(gt("y", 0), gt("z", 0)), and.getFormulas().get(1))
            );
        }

        @Test
        @DisplayName("括号在左侧同样阻止展平")
        void testLeftParenthesizedAnd_IsNotFlattened() {
            And and = (And) FormulaParser.parse("(x > 0 and y > 0) and z > 0");
            assertAll("nested",
                    () -> assertEquals(2, and.getFormulas().size()),
                    () -> assertEquals(And.of(gt("x", 0), gt("y", 0)), and.getFormulas().get(0))
            );
        }

        @Test
        @DisplayName("or 链同样展平")
        void testOrChain_IsFlattened() {
            Or or = (Or) FormulaParser.parse("x > 0 or y > 0 or z > 0");
            assertEquals(3, or.getFormulas().size());
        }

        @Test
        @DisplayName("混合的 and/or 不会互相展平")
        void testMixedChain() {
            Or or = (Or) FormulaParser.parse("x > 0 or y > 0 and z > 0");
            assertAll("precedence",
                    () -> assertEquals(2, or.getFormulas().size()),
                    () -> assertEquals(gt("x", 0), or.getFormulas().get(0)),
                    () -> assertEquals(And.of(gt("y", 0), gt("z", 0)), or.getFormulas().get(1))
            );
        }
    }

    @Nested
    @DisplayName("语法结构 (Grammar)")
    class GrammarTests {

        @Test
        @DisplayName("算术优先级：乘法高于加法")
        void testArithmeticPrecedence() {
            Formula f = FormulaParser.parse("x + y * 2 >= 1");
            Formula expected = Predicate.greaterThan(
                    Arithmetic.sum(SignalRef.of("x"), Arithmetic.multiply(SignalRef.of("y"), Constant.of(2))),
                    Constant.of(1));
            assertEquals(expected, f);
        }

        @Test
        @DisplayName("算术左结合：x - y - z = (x - y) - z")
        void testArithmeticLeftAssociative() {
            Formula f = FormulaParser.parse("x - y - z <= 0");
            Formula expected = Predicate.lessThan(
                    Arithmetic.subtract(Arithmetic.subtract(SignalRef.of("x"), SignalRef.of("y")), SignalRef.of("z")),
                    Constant.of(0));
            assertEquals(expected, f);
        }

        @Test
        @DisplayName("蕴含是右结合的")
        void testImplicationRightAssociative() {
            Implication f = (Implication) FormulaParser.parse("x > 0 -> y > 0 implies z > 0");
            assertAll("right associative",
                    () -> assertEquals(gt("x", 0), f.getLeft()),
                    () -> assertEquals(Implication.of(gt("y", 0), gt("z", 0)), f.getRight())
            );
        }

        @Test
        @DisplayName("时序算子与别名")
        void testTemporalOperators() {
            assertAll("temporal",
                    () -> assertEquals(Global.of(0, 2, gt("x", 0)), FormulaParser.parse("G[0, 2] x > 0")),
                    () -> assertEquals(Global.of(0, 2, gt("x", 0)), FormulaParser.parse("always[0,2](x > 0)")),
                    () -> assertEquals(Finally.of(1, 3, gt("x", 0)), FormulaParser.parse("eventually[1, 3] (x > 0)")),
                    () -> assertEquals(Next.of(gt("x", 0)), FormulaParser.parse("X (x > 0)")),
                    () -> assertEquals(Until.strong(0, 4, gt("x", 0), gt("y", 0)), FormulaParser.parse("x > 0 U[0, 4] y > 0")),
                    () -> assertEquals(Until.weak(0, 4, gt("x", 0), gt("y", 0)), FormulaParser.parse("x > 0 W[0, 4] y > 0"))
            );
        }

        @Test
        @DisplayName("否定的两种写法等价")
        void testNegationAliases() {
            assertEquals(FormulaParser.parse("not (x > 0)"), FormulaParser.parse("!(x > 0)"));
            assertEquals(Not.of(gt("x", 0)), FormulaParser.parse("not x > 0"));
        }

        @Test
        @DisplayName("所有比较运算符")
        void testComparisons() {
            assertAll("relations",
                    () -> assertEquals(RelationType.LT, ((Predicate) FormulaParser.parse("x < 1")).getRelation()),
                    () -> assertEquals(RelationType.LE, ((Predicate) FormulaParser.parse("x <= 1")).getRelation()),
                    () -> assertEquals(RelationType.GT, ((Predicate) FormulaParser.parse("x > 1")).getRelation()),
                    () -> assertEquals(RelationType.GE, ((Predicate) FormulaParser.parse("x >= 1")).getRelation()),
                    () -> assertEquals(RelationType.EQ, ((Predicate) FormulaParser.parse("x == 1")).getRelation()),
                    () -> assertEquals(RelationType.NEQ, ((Predicate) FormulaParser.parse("x != 1")).getRelation())
            );
        }

        @Test
        @DisplayName("负数字面量、取负表达式与绝对值")
        void testUnaryMinusAndAbs() {
            assertAll("unary",
                    () -> assertEquals(gt("x", -1.5), FormulaParser.parse("x > -1.5")),
                    () -> assertEquals(gt("x", 0.001), FormulaParser.parse("x > 1e-3")),
                    () -> assertEquals(Predicate.strictlyGreaterThan(Not.of(SignalRef.of("x")), Constant.of(0)),
                            FormulaParser.parse("-x > 0")),
                    () -> assertEquals(Predicate.lessThan(Abs.of(Arithmetic.subtract(SignalRef.of("x"), SignalRef.of("y"))), Constant.of(1)),
                            FormulaParser.parse("|x - y| <= 1"))
            );
        }

        @Test
        @DisplayName("信号集合与时间跨度")
        void testVariablesAndHorizon() {
            Formula f = FormulaParser.parse("G[0, 2] (x + y > z) and F[1, 3] X (w > 0)");
            assertAll("structure",
                    () -> assertEquals(Set.of("w", "x", "y", "z"), f.getVariables()),
                    () -> assertEquals(4.0, f.getHorizon())
            );
        }
    }

    @Nested
    @DisplayName("配置 (Configuration)")
    class ConfigurationTests {

        @Test
        @DisplayName("信号值域从配置中读取")
        void testRangesFromConfig() {
            Formula f = FormulaParser.parse("x > 0", Map.of("x", ValueRange.of(-5, 5)));
            assertEquals(ValueRange.of(-5, 5), f.getRange().orElseThrow());
            assertTrue(FormulaParser.parse("x > 0").getRange().isEmpty());
        }

        @Test
        @DisplayName("合取、析取和蕴含使用配置中的 nu")
        void testNuFromConfig() {
            FormulaParser parser = new FormulaParser(ParserConfig.defaults().withNu(2.5));
            assertAll("nu",
                    () -> assertEquals(2.5, ((And) parser.parseFormula("x > 0 and y > 0")).getNu()),
                    () -> assertEquals(2.5, ((Or) parser.parseFormula("x > 0 or y > 0")).getNu()),
                    () -> assertEquals(2.5, ((Implication) parser.parseFormula("x > 0 -> y > 0")).getNu())
            );
        }

        @Test
        @DisplayName("非法时间区间抛出 ConfigurationException")
        void testInvalidInterval_ShouldThrow() {
            assertAll("intervals",
                    () -> assertThrows(ConfigurationException.class, () -> FormulaParser.parse("G[2, 1] x > 0")),
                    () -> assertThrows(ConfigurationException.class, () -> FormulaParser.parse("F[-1, 1] x > 0"))
            );
        }
    }

    @Nested
    @DisplayName("错误报告 (Errors)")
    class ErrorTests {

        @Test
        @DisplayName("时序算子缺少区间")
        void testMissingInterval_ShouldThrow() {
            FormulaParseException e = assertThrows(FormulaParseException.class, () -> FormulaParser.parse("G (x > 0)"));
            assertAll("exception details",
                    () -> assertEquals(0, e.getPosition()),
                    () -> assertEquals("G", e.getOffendingToken())
            );
        }

        @Test
        @DisplayName("Until 缺少区间")
        void testUntilMissingInterval_ShouldThrow() {
            FormulaParseException e = assertThrows(FormulaParseException.class, () -> FormulaParser.parse("x > 0 U y > 0"));
            assertEquals(6, e.getPosition());
        }

        @Test
        @DisplayName("双向蕴含不受支持")
        void testIff_ShouldThrow() {
            FormulaParseException e = assertThrows(FormulaParseException.class, () -> FormulaParser.parse("x > 0 iff y > 0"));
            assertAll("exception details",
                    () -> assertEquals(6, e.getPosition()),
                    () -> assertEquals("iff", e.getOffendingToken())
            );
            assertThrows(FormulaParseException.class, () -> FormulaParser.parse("x > 0 <-> y > 0"));
        }

        @Test
        @DisplayName("缺少右括号")
        void testMissingClosingParen_ShouldThrow() {
            FormulaParseException e = assertThrows(FormulaParseException.class, () -> FormulaParser.parse("(x > 0"));
            assertAll("exception details",
                    () -> assertEquals(6, e.getPosition()),
                    () -> assertEquals("<EOF>", e.getOffendingToken())
            );
        }

        @Test
        @DisplayName("公式之后的多余内容")
        void testTrailingTokens_ShouldThrow() {
            FormulaParseException e = assertThrows(FormulaParseException.class, () -> FormulaParser.parse("x > 0 )"));
            assertAll("exception details",
                    () -> assertEquals(6, e.getPosition()),
                    () -> assertEquals(")", e.getOffendingToken())
            );
        }

        @Test
        @DisplayName("空输入与缺少操作数")
        void testMissingOperand_ShouldThrow() {
            assertAll("missing operand",
                    () -> assertThrows(FormulaParseException.class, () -> FormulaParser.parse("")),
                    () -> assertThrows(FormulaParseException.class, () -> FormulaParser.parse("x > ")),
                    () -> assertThrows(FormulaParseException.class, () -> FormulaParser.parse("x > 0 and"))
            );
        }

        @Test
        @DisplayName("区间格式错误")
        void testMalformedInterval_ShouldThrow() {
            FormulaParseException e = assertThrows(FormulaParseException.class, () -> FormulaParser.parse("G[0; 1] x > 0"));
            assertEquals(3, e.getPosition());
        }
    }

    @Test
    @DisplayName("parseTree 保留括号节点")
    void testParseTree_KeepsGrouping() {
        ParseNode tree = new FormulaParser().parseTree("(x > 0)");
        assertAll("tree",
                () -> assertInstanceOf(ParseNode.Grouped.class, tree),
                () -> assertInstanceOf(ParseNode.Binary.class, ((ParseNode.Grouped) tree).getInner())
        );
    }
}
