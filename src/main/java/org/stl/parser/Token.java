package org.stl.parser;

import lombok.Getter;

/**
 * 一个词法单元：类型、原始文本和在输入中的起始位置。
 */
@Getter
public final class Token {

    private final TokenType type;
    private final String text;
    private final int position;

    public Token(TokenType type, String text, int position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + position;
    }
}
