package org.stl.parser;

import org.stl.expressions.*;
import org.stl.expressions.logic.And;
import org.stl.expressions.logic.Implication;
import org.stl.expressions.logic.Not;
import org.stl.expressions.logic.Or;
import org.stl.expressions.temporal.Finally;
import org.stl.expressions.temporal.Global;
import org.stl.expressions.temporal.Next;
import org.stl.expressions.temporal.TimeBounds;
import org.stl.expressions.temporal.Until;

import java.util.stream.Collectors;

/**
 * 将公式输出为完全加括号的文本，输出可以被 {@link FormulaParser} 重新读入得到相同的语法树。
 */
public final class FormulaPrinter implements FormulaVisitor<String> {

    private static final FormulaPrinter INSTANCE = new FormulaPrinter();

    private FormulaPrinter() {
    }

    public static String print(Formula formula) {
        return formula.accept(INSTANCE);
    }

    @Override
    public String visitConstant(Constant constant) {
        return Double.toString(constant.getValue());
    }

    @Override
    public String visitSignalRef(SignalRef signalRef) {
        return signalRef.getName();
    }

    @Override
    public String visitArithmetic(Arithmetic arithmetic) {
        return "(" + arithmetic.getLeft().accept(this) + " " + arithmetic.getOperator().getSymbol() + " "
                + arithmetic.getRight().accept(this) + ")";
    }

    @Override
    public String visitPredicate(Predicate predicate) {
        return "(" + predicate.getLeft().accept(this) + " " + predicate.getRelation().getSymbol() + " "
                + predicate.getRight().accept(this) + ")";
    }

    @Override
    public String visitAbs(Abs abs) {
        return "|" + abs.getFormula().accept(this) + "|";
    }

    @Override
    public String visitNot(Not not) {
        return "(not " + not.getFormula().accept(this) + ")";
    }

    @Override
    public String visitAnd(And and) {
        return and.getFormulas().stream()
                .map(f -> f.accept(this))
                .collect(Collectors.joining(" and ", "(", ")"));
    }

    @Override
    public String visitOr(Or or) {
        return or.getFormulas().stream()
                .map(f -> f.accept(this))
                .collect(Collectors.joining(" or ", "(", ")"));
    }

    @Override
    public String visitImplication(Implication implication) {
        return "(" + implication.getLeft().accept(this) + " implies " + implication.getRight().accept(this) + ")";
    }

    @Override
    public String visitNext(Next next) {
        return "(X " + next.getFormula().accept(this) + ")";
    }

    @Override
    public String visitGlobal(Global global) {
        return "(G" + interval(global.getBounds()) + " " + global.getFormula().accept(this) + ")";
    }

    @Override
    public String visitFinally(Finally finallyFormula) {
        return "(F" + interval(finallyFormula.getBounds()) + " " + finallyFormula.getFormula().accept(this) + ")";
    }

    @Override
    public String visitUntil(Until until) {
        String operator = until.isWeak() ? " W" : " U";
        return "(" + until.getLeft().accept(this) + operator + interval(until.getBounds()) + " "
                + until.getRight().accept(this) + ")";
    }

    private static String interval(TimeBounds bounds) {
        return "[" + bounds.getLower() + ", " + bounds.getUpper() + "]";
    }
}
