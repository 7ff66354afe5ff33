package org.stl.semantics;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stl.config.EvaluationConfig;
import org.stl.core.Trace;
import org.stl.exceptions.UnknownSignalException;
import org.stl.expressions.Formula;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

/**
 * 调用方使用的鲁棒性求值入口。
 * 日志记录器由调用方注入，求值核心 {@link RobustnessVisitor} 本身不接触日志。
 * 公式和轨迹都是不可变的，因此同一个实例可以被多个线程同时使用。
 * @author Ayalyt
 */
@Getter
public final class RobustnessEvaluator {

    private static final ForkJoinPool PARALLEL_POOL = new ForkJoinPool();

    private final EvaluationConfig config;
    private final Logger logger;

    public RobustnessEvaluator() {
        this(EvaluationConfig.defaults());
    }

    public RobustnessEvaluator(EvaluationConfig config) {
        this(config, LoggerFactory.getLogger(RobustnessEvaluator.class));
    }

    /**
     * @param config 求值配置。
     * @param logger 用于报告求值摘要的日志记录器。
     */
    public RobustnessEvaluator(EvaluationConfig config, Logger logger) {
        this.config = Objects.requireNonNull(config, "RobustnessEvaluator-构造函数: config 不能为 null");
        this.logger = Objects.requireNonNull(logger, "RobustnessEvaluator-构造函数: logger 不能为 null");
    }

    /**
     * 计算公式在轨迹每个时间点上的鲁棒性。
     *
     * @return 新分配的数组，长度等于轨迹时间戳数量，归调用方所有。
     * @throws UnknownSignalException 如果公式引用了轨迹中不存在的信号。
     */
    public double[] evaluate(Formula formula, Trace trace) {
        Objects.requireNonNull(formula, "evaluate: formula 不能为 null");
        Objects.requireNonNull(trace, "evaluate: trace 不能为 null");
        checkSignals(formula, trace);

        double[] robustness = formula.accept(new RobustnessVisitor(trace, config.getConjunctionSemantics()));
        if (Arrays.stream(robustness).anyMatch(Double::isInfinite)) {
            // 时间窗口端点只做精确匹配，不规则采样的轨迹上可能得到无约束的窗口
            logger.warn("公式 {} 在 {} 上的鲁棒性包含无穷值，检查时间区间端点是否落在采样点上", formula, trace);
        }
        if (logger.isDebugEnabled()) {
            logger.debug("公式 {} 在 {} 上求值完成 ({}), 首个时间点鲁棒性为 {}",
                    formula, trace, config.getConjunctionSemantics(),
                    robustness.length > 0 ? robustness[0] : "N/A");
        }
        return robustness;
    }

    /**
     * 搜索循环使用的标量目标值：轨迹第一个时间点上的鲁棒性。
     * @throws IllegalArgumentException 如果轨迹为空。
     */
    public double robustness(Formula formula, Trace trace) {
        if (trace.length() == 0) {
            logger.error("无法在空轨迹上计算标量鲁棒性");
            throw new IllegalArgumentException("轨迹不包含任何时间点");
        }
        return evaluate(formula, trace)[0];
    }

    /**
     * 并发地对一批轨迹求值，结果顺序与输入一致。
     * 在提交任何计算之前先检查所有轨迹的信号。
     */
    public List<double[]> evaluateAll(Formula formula, List<Trace> traces) {
        Objects.requireNonNull(formula, "evaluateAll: formula 不能为 null");
        Objects.requireNonNull(traces, "evaluateAll: traces 不能为 null");
        traces.forEach(trace -> checkSignals(formula, trace));

        List<double[]> results = PARALLEL_POOL.submit(() ->
                traces.parallelStream()
                        .map(trace -> formula.accept(new RobustnessVisitor(trace, config.getConjunctionSemantics())))
                        .collect(Collectors.toList())
        ).join();
        logger.info("批量求值完成：{} 条轨迹，公式 {}", traces.size(), formula);
        return results;
    }

    private void checkSignals(Formula formula, Trace trace) {
        Set<String> missing = new TreeSet<>(formula.getVariables());
        missing.removeAll(trace.getSignalNames());
        if (!missing.isEmpty()) {
            logger.error("公式 {} 引用了轨迹中不存在的信号 {}", formula, missing);
            throw new UnknownSignalException(missing, trace.getSignalNames());
        }
    }
}
