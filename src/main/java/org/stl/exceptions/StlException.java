package org.stl.exceptions;

/**
 * STL 引擎所有错误的公共基类。
 * 所有错误都是确定性的：相同输入必然得到相同错误，因此调用方不应重试。
 */
public class StlException extends RuntimeException {

    public StlException(String message) {
        super(message);
    }

    public StlException(String message, Throwable cause) {
        super(message, cause);
    }
}
