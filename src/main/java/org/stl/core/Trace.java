package org.stl.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stl.exceptions.ConfigurationException;
import org.stl.exceptions.LengthMismatchException;
import org.stl.exceptions.UnknownSignalException;

import java.util.*;

/**
 * 代表一次已记录的运行：一条严格递增的公共时间轴，以及在其上采样的若干命名信号。
 * 每个信号的长度都必须等于时间戳数量。
 * 此类是不可变的，可以在多个求值线程之间共享。
 * @author Ayalyt
 */
public final class Trace {

    private static final Logger logger = LoggerFactory.getLogger(Trace.class);

    /** {@link #indexOf} 找不到精确匹配时的返回值 */
    public static final int NOT_FOUND = -1;

    /** merge 时比较时间戳使用的容差 */
    static final double MERGE_EPSILON = 1e-5;

    private final double[] timestamps;
    private final SortedMap<String, double[]> signals;

    /**
     * 私有构造函数。数组会被拷贝。
     *
     * @param timestamps 严格递增的时间戳。
     * @param signals    信号名到采样值的映射。
     * @throws LengthMismatchException  如果某个信号长度与时间戳数量不同。
     * @throws IllegalArgumentException 如果时间戳不是严格递增的。
     */
    private Trace(double[] timestamps, Map<String, double[]> signals) {
        Objects.requireNonNull(timestamps, "Trace-构造函数: timestamps 不能为 null");
        Objects.requireNonNull(signals, "Trace-构造函数: signals 不能为 null");

        for (int i = 1; i < timestamps.length; i++) {
            if (!(timestamps[i] > timestamps[i - 1])) {
                logger.error("Trace-构造函数: 时间戳在位置 {} 处不是严格递增的 ({} -> {})", i, timestamps[i - 1], timestamps[i]);
                throw new IllegalArgumentException("时间戳必须严格递增，位置 " + i + " 处为 "
                        + timestamps[i - 1] + " -> " + timestamps[i]);
            }
        }

        SortedMap<String, double[]> copy = new TreeMap<>();
        for (Map.Entry<String, double[]> entry : signals.entrySet()) {
            String name = Objects.requireNonNull(entry.getKey(), "Trace-构造函数: 信号名不能为 null");
            double[] values = Objects.requireNonNull(entry.getValue(), "Trace-构造函数: 信号 '" + name + "' 的值不能为 null");
            if (values.length != timestamps.length) {
                logger.error("Trace-构造函数: 信号 {} 长度为 {}，时间戳数量为 {}", name, values.length, timestamps.length);
                throw new LengthMismatchException(name, timestamps.length, values.length);
            }
            copy.put(name, values.clone());
        }

        this.timestamps = timestamps.clone();
        this.signals = Collections.unmodifiableSortedMap(copy);
        logger.debug("创建 Trace: {} 个时间点, 信号 {}", timestamps.length, this.signals.keySet());
    }

    /**
     * 工厂方法：从公共时间轴和信号映射创建 Trace。
     */
    public static Trace of(double[] timestamps, Map<String, double[]> signals) {
        return new Trace(timestamps, signals);
    }

    /**
     * 工厂方法：创建只包含一个信号的 Trace。
     */
    public static Trace of(double[] timestamps, String name, double[] values) {
        return new Trace(timestamps, Map.of(name, values));
    }

    /**
     * 将采样时刻和长度各不相同的信号合并为一条公共时间轴上的 Trace。
     * 新时间轴为 0, p, 2p, ... 直到最长信号的持续时间，每个新采样点取此前最近一次观测值（零阶保持）。
     * 所有信号都必须从时间 0 开始。
     *
     * @param sampledSignals 待合并的信号。
     * @param samplingPeriod 采样周期；为 null 时取所有输入中最小的正时间间隔。
     * @return 合并后的 Trace。
     * @throws ConfigurationException 如果采样周期非法或无法推断。
     */
    public static Trace merge(Collection<SampledSignal> sampledSignals, Double samplingPeriod) {
        Objects.requireNonNull(sampledSignals, "Trace.merge: sampledSignals 不能为 null");
        if (sampledSignals.isEmpty()) {
            throw new IllegalArgumentException("Trace.merge: 至少需要一个信号");
        }

        Set<String> seen = new HashSet<>();
        for (SampledSignal signal : sampledSignals) {
            if (!seen.add(signal.getName())) {
                throw new IllegalArgumentException("Trace.merge: 信号名重复: " + signal.getName());
            }
            // 所有信号必须从时间 0 开始，否则零阶保持没有初值
            if (Math.abs(signal.timestampAt(0)) > MERGE_EPSILON) {
                logger.error("Trace.merge: 信号 {} 的首个时间戳为 {}，不是 0", signal.getName(), signal.timestampAt(0));
                throw new IllegalArgumentException("信号 '" + signal.getName() + "' 必须从时间 0 开始");
            }
        }

        double period = samplingPeriod != null ? samplingPeriod : inferSamplingPeriod(sampledSignals);
        if (Double.isNaN(period) || Double.isInfinite(period) || period <= 0) {
            logger.error("Trace.merge: 采样周期 {} 非法", period);
            throw new ConfigurationException("samplingPeriod", period, "采样周期必须是有限正数");
        }

        double duration = sampledSignals.stream().mapToDouble(SampledSignal::duration).max().orElse(0.0);
        int steps = (int) Math.floor(duration / period + MERGE_EPSILON);
        double[] newTimestamps = new double[steps + 1];
        for (int i = 0; i <= steps; i++) {
            newTimestamps[i] = i * period;
        }

        Map<String, double[]> merged = new LinkedHashMap<>();
        for (SampledSignal signal : sampledSignals) {
            double[] values = new double[newTimestamps.length];
            int pos = 0;
            for (int i = 0; i < newTimestamps.length; i++) {
                double t = newTimestamps[i];
                while (pos < signal.size() && signal.timestampAt(pos) <= t + MERGE_EPSILON) {
                    pos++;
                }
                values[i] = signal.valueAt(pos - 1);
            }
            merged.put(signal.getName(), values);
        }

        logger.info("合并了 {} 个信号，采样周期 {}，共 {} 个时间点", merged.size(), period, newTimestamps.length);
        return new Trace(newTimestamps, merged);
    }

    /**
     * 以推断的采样周期合并信号。
     */
    public static Trace merge(Collection<SampledSignal> sampledSignals) {
        return merge(sampledSignals, null);
    }

    private static double inferSamplingPeriod(Collection<SampledSignal> sampledSignals) {
        double smallest = Double.POSITIVE_INFINITY;
        for (SampledSignal signal : sampledSignals) {
            for (int i = 1; i < signal.size(); i++) {
                double gap = signal.timestampAt(i) - signal.timestampAt(i - 1);
                if (gap > 0 && gap < smallest) {
                    smallest = gap;
                }
            }
        }
        if (Double.isInfinite(smallest)) {
            logger.error("Trace.merge: 所有信号都只有一个采样点，无法推断采样周期");
            throw new ConfigurationException("samplingPeriod", null, "未指定且无法从输入推断");
        }
        logger.debug("推断采样周期为 {}", smallest);
        return smallest;
    }

    /**
     * 返回新增（或替换）一个信号后的新 Trace。
     */
    public Trace withSignal(String name, double[] values) {
        Map<String, double[]> extended = new TreeMap<>(signals);
        extended.put(name, values);
        return new Trace(timestamps, extended);
    }

    /**
     * 从 start 开始查找与 t 精确相等的时间戳下标。
     * 只做精确匹配，不做最近邻匹配。
     *
     * @return 下标 i >= start 使 timestamps[i] == t，或 {@link #NOT_FOUND}。
     */
    public int indexOf(double t, int start) {
        for (int i = Math.max(start, 0); i < timestamps.length; i++) {
            if (timestamps[i] == t) {
                return i;
            }
        }
        return NOT_FOUND;
    }

    /**
     * 从 start 开始查找第一个时间 >= t 的下标。
     *
     * @return 下标，或 {@link #NOT_FOUND}。
     */
    public int firstIndexAtOrAfter(double t, int start) {
        for (int i = Math.max(start, 0); i < timestamps.length; i++) {
            if (timestamps[i] >= t) {
                return i;
            }
        }
        return NOT_FOUND;
    }

    /**
     * 获取指定信号的采样值（拷贝）。
     * @throws UnknownSignalException 如果信号不存在。
     */
    public double[] getSignal(String name) {
        double[] values = signals.get(name);
        if (values == null) {
            logger.error("Trace 中不存在信号 {}，可用信号为 {}", name, signals.keySet());
            throw new UnknownSignalException(name, signals.keySet());
        }
        return values.clone();
    }

    public boolean hasSignal(String name) {
        return signals.containsKey(name);
    }

    public SortedSet<String> getSignalNames() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(signals.keySet()));
    }

    public double[] getTimestamps() {
        return timestamps.clone();
    }

    public double timestampAt(int index) {
        return timestamps[index];
    }

    public int length() {
        return timestamps.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Trace that = (Trace) o;
        if (!Arrays.equals(timestamps, that.timestamps) || !signals.keySet().equals(that.signals.keySet())) {
            return false;
        }
        for (Map.Entry<String, double[]> entry : signals.entrySet()) {
            if (!Arrays.equals(entry.getValue(), that.signals.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(timestamps);
        for (Map.Entry<String, double[]> entry : signals.entrySet()) {
            result = 31 * result + entry.getKey().hashCode();
            result = 31 * result + Arrays.hashCode(entry.getValue());
        }
        return result;
    }

    @Override
    public String toString() {
        return "Trace{" + timestamps.length + " samples, signals=" + signals.keySet() + "}";
    }
}
