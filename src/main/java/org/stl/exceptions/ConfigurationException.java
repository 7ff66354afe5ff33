package org.stl.exceptions;

import lombok.Getter;

/**
 * 构造期参数非法时抛出，例如 nu <= 0 或时间区间下界大于上界。
 */
@Getter
public class ConfigurationException extends StlException {

    private final String parameter;
    private final Object value;

    public ConfigurationException(String parameter, Object value, String reason) {
        super("参数 " + parameter + " = " + value + " 非法: " + reason);
        this.parameter = parameter;
        this.value = value;
    }
}
