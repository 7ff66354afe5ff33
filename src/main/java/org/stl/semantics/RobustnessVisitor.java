package org.stl.semantics;

import org.stl.config.ConjunctionSemantics;
import org.stl.core.Trace;
import org.stl.expressions.Abs;
import org.stl.expressions.Arithmetic;
import org.stl.expressions.Constant;
import org.stl.expressions.Formula;
import org.stl.expressions.FormulaVisitor;
import org.stl.expressions.Predicate;
import org.stl.expressions.SignalRef;
import org.stl.expressions.logic.And;
import org.stl.expressions.logic.Implication;
import org.stl.expressions.logic.Not;
import org.stl.expressions.logic.Or;
import org.stl.expressions.temporal.Finally;
import org.stl.expressions.temporal.Global;
import org.stl.expressions.temporal.Next;
import org.stl.expressions.temporal.Until;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 自底向上计算鲁棒性向量：每个轨迹时间点一个实数，与时间戳逐一对齐。
 * 纯函数：不修改语法树和轨迹，不做 I/O，也不记录日志。
 * 每个实例只绑定一条轨迹，不要在线程之间共享同一个实例。
 */
final class RobustnessVisitor implements FormulaVisitor<double[]> {

    private final Trace trace;
    private final ConjunctionSemantics semantics;

    RobustnessVisitor(Trace trace, ConjunctionSemantics semantics) {
        this.trace = Objects.requireNonNull(trace, "RobustnessVisitor-构造函数: trace 不能为 null");
        this.semantics = Objects.requireNonNull(semantics, "RobustnessVisitor-构造函数: semantics 不能为 null");
    }

    // --- 叶子 ---

    @Override
    public double[] visitConstant(Constant constant) {
        double[] result = new double[trace.length()];
        Arrays.fill(result, constant.getValue());
        return result;
    }

    @Override
    public double[] visitSignalRef(SignalRef signalRef) {
        return trace.getSignal(signalRef.getName());
    }

    // --- 算术与谓词 ---

    @Override
    public double[] visitArithmetic(Arithmetic arithmetic) {
        double[] left = arithmetic.getLeft().accept(this);
        double[] right = arithmetic.getRight().accept(this);
        double[] result = new double[left.length];
        for (int i = 0; i < result.length; i++) {
            result[i] = arithmetic.getOperator().apply(left[i], right[i]);
        }
        return result;
    }

    @Override
    public double[] visitPredicate(Predicate predicate) {
        double[] left = predicate.getLeft().accept(this);
        double[] right = predicate.getRight().accept(this);
        double[] result = new double[left.length];
        for (int i = 0; i < result.length; i++) {
            result[i] = switch (predicate.getRelation()) {
                case GT, GE -> left[i] - right[i];
                case LT, LE -> right[i] - left[i];
                case EQ -> equality(left[i], right[i]);
                case NEQ -> -equality(left[i], right[i]);
            };
        }
        return result;
    }

    private static double equality(double left, double right) {
        double value = -Math.abs(left - right);
        return value == 0.0 ? Predicate.EQUALITY_SATISFIED : value;
    }

    @Override
    public double[] visitAbs(Abs abs) {
        double[] result = abs.getFormula().accept(this);
        for (int i = 0; i < result.length; i++) {
            result[i] = Math.abs(result[i]);
        }
        return result;
    }

    // --- 逻辑 ---

    @Override
    public double[] visitNot(Not not) {
        double[] result = not.getFormula().accept(this);
        for (int i = 0; i < result.length; i++) {
            result[i] = -result[i];
        }
        return result;
    }

    @Override
    public double[] visitAnd(And and) {
        List<Formula> formulas = and.getFormulas();
        double[][] rho = new double[formulas.size()][];
        for (int k = 0; k < rho.length; k++) {
            rho[k] = formulas.get(k).accept(this);
        }

        double[] result = new double[trace.length()];
        double[] column = new double[rho.length];
        for (int i = 0; i < result.length; i++) {
            for (int k = 0; k < rho.length; k++) {
                column[k] = rho[k][i];
            }
            result[i] = semantics == ConjunctionSemantics.CLASSIC
                    ? minimum(column)
                    : smoothedMinimum(column, and.getNu());
        }
        return result;
    }

    @Override
    public double[] visitOr(Or or) {
        return or.getDesugared().accept(this);
    }

    @Override
    public double[] visitImplication(Implication implication) {
        return implication.getDesugared().accept(this);
    }

    // --- 时序 ---

    @Override
    public double[] visitNext(Next next) {
        double[] rho = next.getFormula().accept(this);
        int n = rho.length;
        if (n < 2) {
            return rho;
        }
        double[] result = new double[n];
        System.arraycopy(rho, 1, result, 0, n - 1);
        // 轨迹末尾之后没有采样，重复倒数第二个位置的值
        result[n - 1] = result[n - 2];
        return result;
    }

    @Override
    public double[] visitGlobal(Global global) {
        double[] rho = global.getFormula().accept(this);
        int n = trace.length();
        double lb = global.getBounds().getLower();
        double ub = global.getBounds().getUpper();

        double[] result = new double[n];
        for (int i = n - 1; i >= 0; i--) {
            double t = trace.timestampAt(i);
            int lowerPos = trace.indexOf(t + lb, i);
            if (lowerPos == Trace.NOT_FOUND) {
                // 窗口下界没有精确匹配的采样点，视为无约束
                result[i] = Double.POSITIVE_INFINITY;
                continue;
            }
            int upperPos = trace.indexOf(t + ub, lowerPos);
            int end = upperPos != Trace.NOT_FOUND ? upperPos + 1 : n;
            double min = Double.POSITIVE_INFINITY;
            for (int j = lowerPos; j < end; j++) {
                min = Math.min(min, rho[j]);
            }
            result[i] = min;
        }
        return result;
    }

    @Override
    public double[] visitFinally(Finally finallyFormula) {
        return finallyFormula.getDesugared().accept(this);
    }

    @Override
    public double[] visitUntil(Until until) {
        double[] left = until.getLeft().accept(this);
        double[] right = until.getRight().accept(this);
        int n = trace.length();
        double lb = until.getBounds().getLower();
        double ub = until.getBounds().getUpper();

        double[] result = new double[n];
        for (int i = 0; i < n; i++) {
            double t = trace.timestampAt(i);
            double minLeft = Double.POSITIVE_INFINITY;
            double maxRight = Double.NEGATIVE_INFINITY;
            boolean released = false;
            double value = 0.0;

            int j = trace.firstIndexAtOrAfter(t + lb, i);
            while (j != Trace.NOT_FOUND && j < n && trace.timestampAt(j) <= t + ub) {
                if (right[j] >= 0) {
                    // 弱变体只取左侧在释放之前的最小值
                    value = until.isWeak() ? minLeft : Math.min(minLeft, right[j]);
                    released = true;
                    break;
                }
                minLeft = Math.min(minLeft, left[j]);
                maxRight = Math.max(maxRight, right[j]);
                j++;
            }
            if (!released) {
                value = until.isWeak() ? minLeft : maxRight;
            }
            result[i] = value;
        }
        return result;
    }

    // --- 合取的两种语义 ---

    static double minimum(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
        }
        return min;
    }

    /**
     * 平滑合取。记 rmin 为经典最小值，r~_k = r_k / rmin - 1：
     * rmin < 0 时为 rmin * sum(exp((1+nu) r~)) / sum(exp(nu r~))；
     * rmin > 0 时为 sum(r_k exp(-nu r~)) / sum(exp(-nu r~))；
     * rmin == 0 时为 0。
     */
    static double smoothedMinimum(double[] values, double nu) {
        double rhoMin = minimum(values);
        if (Double.isInfinite(rhoMin) || Double.isNaN(rhoMin)) {
            return rhoMin;
        }
        if (rhoMin < 0) {
            double numerator = 0.0;
            double denominator = 0.0;
            for (double v : values) {
                double tilde = v / rhoMin - 1;
                numerator += Math.exp((1 + nu) * tilde);
                denominator += Math.exp(nu * tilde);
            }
            return rhoMin * numerator / denominator;
        }
        if (rhoMin > 0) {
            double numerator = 0.0;
            double denominator = 0.0;
            for (double v : values) {
                double weight = Math.exp(-nu * (v / rhoMin - 1));
                if (weight == 0.0) {
                    continue;
                }
                numerator += v * weight;
                denominator += weight;
            }
            return numerator / denominator;
        }
        return 0.0;
    }
}
