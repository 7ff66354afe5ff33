package org.stl.config;

import lombok.Getter;

import java.util.Objects;

/**
 * 鲁棒性求值的显式配置。
 * 此类是不可变的，在构造时完成校验。
 */
@Getter
public final class EvaluationConfig {

    private static final EvaluationConfig DEFAULTS = new EvaluationConfig(ConjunctionSemantics.SMOOTHED);

    private final ConjunctionSemantics conjunctionSemantics;

    private EvaluationConfig(ConjunctionSemantics conjunctionSemantics) {
        this.conjunctionSemantics = Objects.requireNonNull(conjunctionSemantics,
                "EvaluationConfig-构造函数: conjunctionSemantics 不能为 null");
    }

    /**
     * 默认配置：平滑合取语义。
     */
    public static EvaluationConfig defaults() {
        return DEFAULTS;
    }

    public static EvaluationConfig of(ConjunctionSemantics conjunctionSemantics) {
        return new EvaluationConfig(conjunctionSemantics);
    }

    public static EvaluationConfig classic() {
        return new EvaluationConfig(ConjunctionSemantics.CLASSIC);
    }

    public static EvaluationConfig smoothed() {
        return DEFAULTS;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return conjunctionSemantics == ((EvaluationConfig) o).conjunctionSemantics;
    }

    @Override
    public int hashCode() {
        return conjunctionSemantics.hashCode();
    }

    @Override
    public String toString() {
        return "EvaluationConfig{conjunctionSemantics=" + conjunctionSemantics + "}";
    }
}
