package org.psyforge.compiler.ir;

import org.psyforge.compiler.api.GenerationException;

import java.util.List;

/**
 * An operation with two operands.
 */
public class BinaryOperation extends DataNode {

    /**
     * Binary operators with their Fortran spelling and binding strength (higher binds tighter).
     */
    public enum Operator {
        OR(".or.", 1),
        AND(".and.", 2),
        EQ("==", 4),
        NE("/=", 4),
        LT("<", 4),
        LE("<=", 4),
        GT(">", 4),
        GE(">=", 4),
        ADD("+", 5),
        SUB("-", 5),
        MUL("*", 6),
        DIV("/", 6),
        POW("**", 8);

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

    BinaryOperation(Operator operator) {
        if (operator == null) {
            throw new GenerationException("A BinaryOperation requires an operator.");
        }
        this.operator = operator;
    }

    /**
     * @param operator The operator.
     * @param lhs The left operand, an orphan expression.
     * @param rhs The right operand, an orphan expression.
     * @return The new operation.
     */
    public static BinaryOperation create(Operator operator, Node lhs, Node rhs) {
        BinaryOperation operation = new BinaryOperation(operator);
        operation.initChildren(List.of(lhs, rhs));
        return operation;
    }

    public Operator getOperator() {
        return operator;
    }

    public Node getLhs() {
        return getChild(0);
    }

    public Node getRhs() {
        return getChild(1);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
        return position < 2 && DataNode.isExpression(child);
    }

    @Override
    protected String childrenFormat() {
        return "DataNode, DataNode";
    }

    @Override
    protected boolean isComplete(int count) {
        return count == 2;
    }

    @Override
    protected Node shallowCopy() {
        return new BinaryOperation(operator);
    }

    @Override
    protected boolean hasSameData(Node other) {
        return operator == ((BinaryOperation) other).operator;
    }

    @Override
    protected String describe() {
        return operator.name();
    }
}
