package org.stl.config;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stl.exceptions.ConfigurationException;
import org.stl.utils.ValueRange;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 公式解析的显式配置：平滑参数 nu 以及各信号的已知值域。
 * 此类是不可变的，nu 在构造时校验。
 */
@Getter
public final class ParserConfig {

    private static final Logger logger = LoggerFactory.getLogger(ParserConfig.class);

    public static final double DEFAULT_NU = 1.0;

    private final double nu;
    private final SortedMap<String, ValueRange> ranges;

    private ParserConfig(double nu, Map<String, ValueRange> ranges) {
        Objects.requireNonNull(ranges, "ParserConfig-构造函数: ranges 不能为 null");
        validateNu(nu);
        this.nu = nu;
        this.ranges = Collections.unmodifiableSortedMap(new TreeMap<>(ranges));
        logger.debug("创建 ParserConfig: nu={}, ranges={}", nu, this.ranges);
    }

    public static ParserConfig defaults() {
        return new ParserConfig(DEFAULT_NU, Collections.emptyMap());
    }

    public static ParserConfig of(double nu, Map<String, ValueRange> ranges) {
        return new ParserConfig(nu, ranges);
    }

    public ParserConfig withNu(double newNu) {
        return new ParserConfig(newNu, ranges);
    }

    public ParserConfig withRanges(Map<String, ValueRange> newRanges) {
        return new ParserConfig(nu, newRanges);
    }

    /**
     * 查询某个信号的已知值域。
     */
    public Optional<ValueRange> rangeOf(String signalName) {
        return Optional.ofNullable(ranges.get(signalName));
    }

    /**
     * 校验平滑参数：必须是严格为正的有限数。
     * @throws ConfigurationException 如果 nu 非法。
     */
    public static void validateNu(double nu) {
        if (Double.isNaN(nu) || nu <= 0) {
            logger.error("平滑参数 nu 必须为正数，实际为 {}", nu);
            throw new ConfigurationException("nu", nu, "平滑参数必须严格为正");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ParserConfig that = (ParserConfig) o;
        return Double.compare(nu, that.nu) == 0 && ranges.equals(that.ranges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nu, ranges);
    }

    @Override
    public String toString() {
        return "ParserConfig{nu=" + nu + ", ranges=" + ranges + "}";
    }
}
