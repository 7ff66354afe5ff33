package org.stl.exceptions;

import lombok.Getter;

/**
 * 信号长度与时间戳数量不一致时抛出。
 */
@Getter
public class LengthMismatchException extends StlException {

    private final String signalName;
    private final int expectedLength;
    private final int actualLength;

    public LengthMismatchException(String signalName, int expectedLength, int actualLength) {
        super("信号 '" + signalName + "' 的长度为 " + actualLength + "，但时间戳数量为 " + expectedLength);
        this.signalName = signalName;
        this.expectedLength = expectedLength;
        this.actualLength = actualLength;
    }
}
