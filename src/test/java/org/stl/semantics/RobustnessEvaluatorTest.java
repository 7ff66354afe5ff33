package org.stl.semantics;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.stl.config.EvaluationConfig;
import org.stl.core.Trace;
import org.stl.exceptions.UnknownSignalException;
import org.stl.expressions.Formula;
import org.stl.expressions.temporal.Global;
import org.stl.parser.FormulaParser;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RobustnessEvaluatorTest {

    private static final double DELTA = 1e-9;

    // --- Test Setup ---
    private static Trace trace;
    private static RobustnessEvaluator classic;
    private static RobustnessEvaluator smoothed;

    @BeforeAll
    static void setUp() {
        trace = Trace.of(new double[]{0, 1, 2, 3}, Map.of(
                "x", new double[]{1, -1, 2, -2},
                "y", new double[]{-1, -1, 3, -1},
                "z", new double[]{3, 1, 3, 0}));
        classic = new RobustnessEvaluator(EvaluationConfig.classic());
        smoothed = new RobustnessEvaluator(EvaluationConfig.smoothed(), LoggerFactory.getLogger("robustness-test"));
    }

    private static double[] evalClassic(String formula) {
        return classic.evaluate(FormulaParser.parse(formula), trace);
    }

    private static double[] evalSmoothed(String formula) {
        return smoothed.evaluate(FormulaParser.parse(formula), trace);
    }

    @Nested
    @DisplayName("原子谓词 (Predicates)")
    class PredicateTests {

        @Test
        @DisplayName("x > 0 的鲁棒性就是 x 本身")
        void testGreaterThan() {
            assertArrayEquals(new double[]{1, -1, 2, -2}, evalClassic("x > 0"), DELTA);
        }

        @Test
        @DisplayName("x <= 1 的鲁棒性为 1 - x")
        void testLessEqual() {
            assertArrayEquals(new double[]{0, 2, -1, 3}, evalClassic("x <= 1"), DELTA);
        }

        @Test
        @DisplayName("相等谓词：恰好相等时为 +1，否则为 -|l - r|")
        void testEquality() {
            assertAll("equality",
                    () -> assertArrayEquals(new double[]{1, -2, 1, -3}, evalClassic("z == 3"), DELTA),
                    () -> assertArrayEquals(new double[]{-1, 2, -1, 3}, evalClassic("z != 3"), DELTA),
                    () -> assertEquals(1.0, evalClassic("3 == 3")[0], DELTA)
            );
        }

        @Test
        @DisplayName("算术与绝对值逐点计算")
        void testArithmeticAndAbs() {
            assertAll("arithmetic",
                    () -> assertArrayEquals(new double[]{0, -2, 5, -3}, evalClassic("x + y > 0"), DELTA),
                    () -> assertArrayEquals(new double[]{0, 0, 1, 1}, evalClassic("|x| > 1"), DELTA),
                    () -> assertArrayEquals(new double[]{-1, 1, -2, 2}, evalClassic("-x > 0"), DELTA)
            );
        }
    }

    @Nested
    @DisplayName("逻辑连接词 (Logic)")
    class LogicTests {

        @Test
        @DisplayName("双重否定是恒等变换")
        void testDoubleNegation() {
            assertArrayEquals(evalClassic("x > 0"), evalClassic("not not (x > 0)"), DELTA);
        }

        @Test
        @DisplayName("经典语义下 and 取最小值，or 取最大值")
        void testClassicAndOr() {
            assertAll("classic",
                    () -> assertArrayEquals(new double[]{-1, -1, 2, -2}, evalClassic("x > 0 and y > 0"), DELTA),
                    () -> assertArrayEquals(new double[]{1, -1, 3, -1}, evalClassic("x > 0 or y > 0"), DELTA)
            );
        }

        @Test
        @DisplayName("经典语义下 and 满足交换律和结合律")
        void testClassicAnd_CommutativeAndAssociative() {
            assertAll("laws",
                    () -> assertArrayEquals(evalClassic("x > 0 and y > 0"), evalClassic("y > 0 and x > 0"), DELTA),
                    () -> assertArrayEquals(evalClassic("(x > 0 and y > 0) and z > 1"), evalClassic("x > 0 and (y > 0 and z > 1)"), DELTA),
                    () -> assertArrayEquals(evalClassic("x > 0 and y > 0 and z > 1"), evalClassic("x > 0 and (y > 0 and z > 1)"), DELTA)
            );
        }

        @Test
        @DisplayName("德摩根律在两种语义下都成立")
        void testDeMorgan() {
            assertAll("de morgan",
                    () -> assertArrayEquals(evalClassic("not (x > 0 and y > 0)"), evalClassic("not x > 0 or not y > 0"), DELTA),
                    () -> assertArrayEquals(evalSmoothed("not (x > 0 and y > 0)"), evalSmoothed("not x > 0 or not y > 0"), DELTA)
            );
        }

        @Test
        @DisplayName("蕴含等价于 (not l) or r")
        void testImplication() {
            assertAll("implication",
                    () -> assertArrayEquals(evalClassic("not (x > 0) or y > 0"), evalClassic("x > 0 -> y > 0"), DELTA),
                    () -> assertArrayEquals(new double[]{-1, 1, 3, 2}, evalClassic("x > 0 -> y > 0"), DELTA)
            );
        }

        @Test
        @DisplayName("平滑合取保持经典最小值的符号")
        void testSmoothedAnd_PreservesSign() {
            double[] classicValues = evalClassic("x > 0 and z > 1");
            double[] smoothedValues = evalSmoothed("x > 0 and z > 1");
            for (int i = 0; i < classicValues.length; i++) {
                assertEquals(Math.signum(classicValues[i]), Math.signum(smoothedValues[i]), "index " + i);
            }
        }
    }

    @Nested
    @DisplayName("时序算子 (Temporal)")
    class TemporalTests {

        @Test
        @DisplayName("G[0,2] 在窗口内取最小值，超出轨迹部分截断")
        void testGlobal() {
            assertArrayEquals(new double[]{-1, -2, -2, -2}, evalClassic("G[0, 2] (x > 0)"), DELTA);
        }

        @Test
        @DisplayName("G[0,0] phi 等价于 phi")
        void testGlobal_ZeroWindow() {
            Formula phi = FormulaParser.parse("x + y > 0");
            assertArrayEquals(classic.evaluate(phi, trace), classic.evaluate(Global.of(0, 0, phi), trace), DELTA);
        }

        @Test
        @DisplayName("窗口下界没有对应采样点时为 +inf")
        void testGlobal_LowerBoundOffGrid() {
            double[] result = evalClassic("G[0.5, 1] (x > 0)");
            for (double r : result) {
                assertEquals(Double.POSITIVE_INFINITY, r);
            }
        }

        @Test
        @DisplayName("F[0,1] 在窗口内取最大值")
        void testFinally() {
            assertArrayEquals(new double[]{1, 2, 2, -2}, evalClassic("F[0, 1] (x > 0)"), DELTA);
        }

        @Test
        @DisplayName("X 左移一个采样点，末尾重复倒数第二个值")
        void testNext() {
            assertArrayEquals(new double[]{-1, 2, -2, -2}, evalClassic("X (x > 0)"), DELTA);
        }

        @Test
        @DisplayName("强 Until：右侧成立时取左侧前缀最小值与右侧的较小者")
        void testStrongUntil() {
            assertArrayEquals(new double[]{-1, -1, 3, -1}, evalClassic("x > 0 U[0, 2] y > 0"), DELTA);
        }

        @Test
        @DisplayName("弱 Until：总是取左侧在右侧成立之前的最小值，窗口内立即释放时为 +inf")
        void testWeakUntil() {
            assertArrayEquals(new double[]{-1, -1, Double.POSITIVE_INFINITY, -2}, evalClassic("x > 0 W[0, 2] y > 0"), DELTA);
        }

        @Test
        @DisplayName("右侧成立且小于左侧前缀最小值时，强弱两种变体结果不同")
        void testUntil_ReleaseBelowLeftMinimum() {
            Trace releasing = Trace.of(new double[]{0, 1, 2}, Map.of(
                    "x", new double[]{5, 5, 5},
                    "y", new double[]{-1, 0.5, -1}));
            double[] weak = classic.evaluate(FormulaParser.parse("x > 0 W[0, 2] y > 0"), releasing);
            double[] strong = classic.evaluate(FormulaParser.parse("x > 0 U[0, 2] y > 0"), releasing);
            assertAll("release",
                    () -> assertArrayEquals(new double[]{5, Double.POSITIVE_INFINITY, 5}, weak, DELTA),
                    () -> assertArrayEquals(new double[]{0.5, 0.5, -1}, strong, DELTA)
            );
        }
    }

    @Nested
    @DisplayName("平滑合取 (Smoothed conjunction)")
    class SmoothedMinimumTests {

        @Test
        @DisplayName("全部为正时是以 exp(-nu r~) 为权重的加权平均")
        void testPositiveCase() {
            double expected = (1 + 3 * Math.exp(-2)) / (1 + Math.exp(-2));
            assertEquals(expected, RobustnessVisitor.smoothedMinimum(new double[]{1, 3}, 1.0), DELTA);
        }

        @Test
        @DisplayName("最小值为负时使用 rmin * sum(exp((1+nu) r~)) / sum(exp(nu r~))")
        void testNegativeCase() {
            double expected = -2 * (Math.exp(-1) + 1) / (Math.exp(-0.5) + 1);
            assertEquals(expected, RobustnessVisitor.smoothedMinimum(new double[]{-1, -2}, 1.0), DELTA);
        }

        @Test
        @DisplayName("最小值为零时结果为零")
        void testZeroCase() {
            assertEquals(0.0, RobustnessVisitor.smoothedMinimum(new double[]{0, 5}, 1.0));
        }

        @Test
        @DisplayName("单个子公式时与经典语义一致")
        void testSingleOperand() {
            assertEquals(-4.0, RobustnessVisitor.smoothedMinimum(new double[]{-4}, 2.0), DELTA);
            assertEquals(4.0, RobustnessVisitor.smoothedMinimum(new double[]{4}, 2.0), DELTA);
        }

        @Test
        @DisplayName("包含无穷值时直接返回经典最小值")
        void testInfiniteMinimum() {
            assertEquals(Double.NEGATIVE_INFINITY,
                    RobustnessVisitor.smoothedMinimum(new double[]{Double.NEGATIVE_INFINITY, 1}, 1.0));
        }
    }

    @Nested
    @DisplayName("入口与错误 (Facade and errors)")
    class FacadeTests {

        @Test
        @DisplayName("引用不存在的信号时列出全部缺失的信号")
        void testUnknownSignal_ShouldThrow() {
            Formula f = FormulaParser.parse("a > 0 and b > 0 and x > 0");
            UnknownSignalException e = assertThrows(UnknownSignalException.class, () -> classic.evaluate(f, trace));
            assertEquals(Set.of("a", "b"), e.getMissingSignals());
        }

        @Test
        @DisplayName("标量鲁棒性取第一个时间点")
        void testScalarRobustness() {
            assertEquals(-1.0, classic.robustness(FormulaParser.parse("G[0, 2] (x > 0)"), trace), DELTA);
        }

        @Test
        @DisplayName("批量求值保持输入顺序")
        void testEvaluateAll() {
            Trace other = Trace.of(new double[]{0, 1}, Map.of("x", new double[]{5, 6}, "y", new double[]{0, 0}, "z", new double[]{0, 0}));
            Formula f = FormulaParser.parse("x > 0");
            List<double[]> results = classic.evaluateAll(f, List.of(trace, other));
            assertAll("batch",
                    () -> assertEquals(2, results.size()),
                    () -> assertArrayEquals(new double[]{1, -1, 2, -2}, results.get(0), DELTA),
                    () -> assertArrayEquals(new double[]{5, 6}, results.get(1), DELTA)
            );
        }

        @Test
        @DisplayName("批量求值在开始前检查所有轨迹的信号")
        void testEvaluateAll_UnknownSignal_ShouldThrow() {
            Trace missingY = Trace.of(new double[]{0, 1}, "x", new double[]{1, 2});
            Formula f = FormulaParser.parse("x > 0 and y > 0");
            assertThrows(UnknownSignalException.class, () -> classic.evaluateAll(f, List.of(trace, missingY)));
        }

        @Test
        @DisplayName("求值不修改轨迹，结果数组归调用方所有")
        void testEvaluate_DoesNotMutateTrace() {
            double[] result = evalClassic("x > 0");
            result[0] = 100;
            assertArrayEquals(new double[]{1, -1, 2, -2}, trace.getSignal("x"));
        }
    }
}
