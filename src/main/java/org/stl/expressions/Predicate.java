package org.stl.expressions;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stl.utils.ValueRange;

import java.util.List;
import java.util.Objects;

/**
 * 代表一个原子比较谓词，形如 l ~ r，~ 为 {@link RelationType} 之一。
 * 鲁棒性：
 * <ul>
 *     <li>l >= r, l > r : l - r</li>
 *     <li>l <= r, l < r : r - l</li>
 *     <li>l == r : -|l - r|，恰为 0 的点记为 +1</li>
 *     <li>l != r : not (l == r)</li>
 * </ul>
 * 结果的符号表示满足与否，绝对值表示裕度。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class Predicate extends Formula {

    private static final Logger logger = LoggerFactory.getLogger(Predicate.class);

    /** 相等谓词在零裕度处取的值 */
    public static final double EQUALITY_SATISFIED = 1.0;

    private final Formula left;
    private final Formula right;
    private final RelationType relation;

    private Predicate(Formula left, Formula right, RelationType relation) {
        super(unionVariables(List.of(left, right)), maxHorizon(List.of(left, right)), inferRange(left, right, relation));
        this.left = left;
        this.right = right;
        this.relation = relation;
        logger.debug("创建了一个 Predicate: {} {} {}", left, relation.getSymbol(), right);
    }

    /**
     * 逐端点相减后再排序：先计算 A = 两侧下界之差、B = 两侧上界之差，保留 (min(A,B), max(A,B))。
     */
    private static ValueRange inferRange(Formula left, Formula right, RelationType relation) {
        if (left.getRange().isEmpty() || right.getRange().isEmpty()) {
            return null;
        }
        ValueRange l = left.getRange().get();
        ValueRange r = right.getRange().get();
        return switch (relation) {
            case GT, GE -> endpoints(l.getMin() - r.getMin(), l.getMax() - r.getMax());
            case LT, LE -> endpoints(r.getMin() - l.getMin(), r.getMax() - l.getMax());
            case EQ -> equalityRange(l, r);
            case NEQ -> equalityRange(l, r).negate();
        };
    }

    private static ValueRange equalityRange(ValueRange l, ValueRange r) {
        return endpoints(-Math.abs(r.getMin() - l.getMin()), -Math.abs(r.getMax() - l.getMax()));
    }

    private static ValueRange endpoints(double a, double b) {
        // 同号无穷相减得到 NaN，此时没有可用的界限
        if (Double.isNaN(a) || Double.isNaN(b)) {
            return ValueRange.UNBOUNDED;
        }
        return ValueRange.ordered(a, b);
    }

    // --- 工厂方法 ---
    public static Predicate of(Formula left, Formula right, RelationType relation) {
        Objects.requireNonNull(left, "Predicate-构造函数: left 不能为 null");
        Objects.requireNonNull(right, "Predicate-构造函数: right 不能为 null");
        Objects.requireNonNull(relation, "Predicate-构造函数: relation 不能为 null");
        return new Predicate(left, right, relation);
    }

    public static Predicate lessThan(Formula left, Formula right) { return of(left, right, RelationType.LE); }
    public static Predicate strictlyLessThan(Formula left, Formula right) { return of(left, right, RelationType.LT); }
    public static Predicate greaterThan(Formula left, Formula right) { return of(left, right, RelationType.GE); }
    public static Predicate strictlyGreaterThan(Formula left, Formula right) { return of(left, right, RelationType.GT); }
    public static Predicate equalTo(Formula left, Formula right) { return of(left, right, RelationType.EQ); }
    public static Predicate notEqualTo(Formula left, Formula right) { return of(left, right, RelationType.NEQ); }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitPredicate(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Predicate that = (Predicate) o;
        return relation == that.relation && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right, relation);
    }
}
