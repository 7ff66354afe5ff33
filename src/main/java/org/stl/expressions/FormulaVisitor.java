package org.stl.expressions;

import org.stl.expressions.logic.And;
import org.stl.expressions.logic.Implication;
import org.stl.expressions.logic.Not;
import org.stl.expressions.logic.Or;
import org.stl.expressions.temporal.Finally;
import org.stl.expressions.temporal.Global;
import org.stl.expressions.temporal.Next;
import org.stl.expressions.temporal.Until;

/**
 * 对公式语法树的访问者。
 * @param <R> 访问结果类型。
 */
public interface FormulaVisitor<R> {

    R visitConstant(Constant constant);

    R visitSignalRef(SignalRef signalRef);

    R visitArithmetic(Arithmetic arithmetic);

    R visitPredicate(Predicate predicate);

    R visitAbs(Abs abs);

    R visitNot(Not not);

    R visitAnd(And and);

    R visitOr(Or or);

    R visitImplication(Implication implication);

    R visitNext(Next next);

    R visitGlobal(Global global);

    R visitFinally(Finally finallyFormula);

    R visitUntil(Until until);
}
