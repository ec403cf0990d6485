package org.psyforge.compiler.ir;

import org.psyforge.compiler.api.GenerationException;

import java.util.List;

/**
 * An operation with one operand.
 */
public class UnaryOperation extends DataNode {

    /**
     * Unary operators with their Fortran spelling and binding strength.
     */
    public enum Operator {
        MINUS("-", 5),
        PLUS("+", 5),
        NOT(".not.", 3);

        private final String fortran;
        private final int precedence;

        Operator(String fortran, int precedence) {
            this.fortran = fortran;
            this.precedence = precedence;
        }

        public String fortran() {
            return fortran;
        }

        public int precedence() {
            return precedence;
        }
    }

    private final Operator operator;

    UnaryOperation(Operator operator) {
        if (operator == null) {
            throw new GenerationException("A UnaryOperation requires an operator.");
        }
        this.operator = operator;
    }

    public static UnaryOperation create(Operator operator, Node operand) {
        UnaryOperation operation = new UnaryOperation(operator);
        operation.initChildren(List.of(operand));
        return operation;
    }

    public Operator getOperator() {
        return operator;
    }

    public Node getOperand() {
        return getChild(0);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
        return position == 0 && DataNode.isExpression(child);
    }

    @Override
    protected String childrenFormat() {
        return "DataNode";
    }

    @Override
    protected boolean isComplete(int count) {
        return count == 1;
    }

    @Override
    protected Node shallowCopy() {
        return new UnaryOperation(operator);
    }

    @Override
    protected boolean hasSameData(Node other) {
        return operator == ((UnaryOperation) other).operator;
    }

    @Override
    protected String describe() {
        return operator.name();
    }
}
