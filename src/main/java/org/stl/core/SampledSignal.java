package org.stl.core;

import lombok.Getter;
import org.stl.exceptions.LengthMismatchException;

import java.util.Arrays;
import java.util.Objects;

/**
 * 以自身时间戳采样的单个命名信号，作为 {@link Trace#merge} 的输入。
 * 不同信号可以有不同的采样时刻和长度。
 * 此类是不可变的。
 */
public final class SampledSignal {

    @Getter
    private final String name;
    private final double[] timestamps;
    private final double[] values;

    private SampledSignal(String name, double[] timestamps, double[] values) {
        this.name = Objects.requireNonNull(name, "SampledSignal-构造函数: name 不能为 null");
        Objects.requireNonNull(timestamps, "SampledSignal-构造函数: timestamps 不能为 null");
        Objects.requireNonNull(values, "SampledSignal-构造函数: values 不能为 null");
        if (timestamps.length != values.length) {
            throw new LengthMismatchException(name, timestamps.length, values.length);
        }
        if (timestamps.length == 0) {
            throw new IllegalArgumentException("信号 '" + name + "' 至少需要一个采样点");
        }
        this.timestamps = timestamps.clone();
        this.values = values.clone();
    }

    public static SampledSignal of(String name, double[] timestamps, double[] values) {
        return new SampledSignal(name, timestamps, values);
    }

    public double[] getTimestamps() {
        return timestamps.clone();
    }

    public double[] getValues() {
        return values.clone();
    }

    public int size() {
        return timestamps.length;
    }

    double timestampAt(int index) {
        return timestamps[index];
    }

    double valueAt(int index) {
        return values[index];
    }

    double duration() {
        return timestamps[timestamps.length - 1];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SampledSignal that = (SampledSignal) o;
        return name.equals(that.name)
                && Arrays.equals(timestamps, that.timestamps)
                && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, Arrays.hashCode(timestamps), Arrays.hashCode(values));
    }

    @Override
    public String toString() {
        return name + "(" + timestamps.length + " samples)";
    }
}
