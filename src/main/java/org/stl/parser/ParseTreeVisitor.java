package org.stl.parser;

/**
 * 对语法分析树的访问者。
 */
public interface ParseTreeVisitor<R> {

    R visitNumber(ParseNode.NumberLiteral node);

    R visitSignal(ParseNode.SignalName node);

    R visitUnary(ParseNode.Unary node);

    R visitBinary(ParseNode.Binary node);

    R visitTemporal(ParseNode.Temporal node);

    R visitGrouped(ParseNode.Grouped node);
}
