package org.stl.exceptions;

import lombok.Getter;

/**
 * 公式文本格式错误或使用了不支持的语法时抛出。
 * 携带出错位置（从 0 开始的字符偏移）和出错的 token 文本。
 */
@Getter
public class FormulaParseException extends StlException {

    private final int position;
    private final String offendingToken;

    public FormulaParseException(String message, int position, String offendingToken) {
        super(message + " (位置 " + position + ", token '" + offendingToken + "')");
        this.position = position;
        this.offendingToken = offendingToken;
    }
}
