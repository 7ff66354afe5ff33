package org.stl.expressions;

import lombok.Getter;
import org.stl.parser.FormulaPrinter;
import org.stl.utils.ValueRange;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * STL 公式语法树节点的公共基类。
 * 每个节点在构造时静态计算：引用的信号名集合、向前看的时间跨度 (horizon)、以及可推导时的值域。
 * 所有节点都是不可变的，可以在多个求值之间共享。
 * @author Ayalyt
 */
public abstract class Formula {

    @Getter
    private final SortedSet<String> variables;
    @Getter
    private final double horizon;
    private final ValueRange range;

    protected Formula(Set<String> variables, double horizon, ValueRange range) {
        Objects.requireNonNull(variables, "Formula-构造函数: variables 不能为 null");
        this.variables = Collections.unmodifiableSortedSet(new TreeSet<>(variables));
        this.horizon = horizon;
        this.range = range;
    }

    /**
     * 静态值域。任一输入值域未知时为空。
     */
    public Optional<ValueRange> getRange() {
        return Optional.ofNullable(range);
    }

    public abstract <R> R accept(FormulaVisitor<R> visitor);

    // --- 子类共用的组合规则 ---

    protected static Set<String> unionVariables(Iterable<? extends Formula> formulas) {
        Set<String> union = new TreeSet<>();
        for (Formula f : formulas) {
            union.addAll(f.getVariables());
        }
        return union;
    }

    protected static double maxHorizon(Iterable<? extends Formula> formulas) {
        double max = 0.0;
        for (Formula f : formulas) {
            max = Math.max(max, f.getHorizon());
        }
        return max;
    }

    /**
     * 以 FormulaPrinter 的语法输出，结果可以被解析器重新读入。
     */
    @Override
    public String toString() {
        return FormulaPrinter.print(this);
    }
}
