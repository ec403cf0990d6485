package org.psyforge.compiler.ir;

import org.psyforge.compiler.analysis.AccessType;
import org.psyforge.compiler.analysis.VariablesAccessInfo;
import org.psyforge.compiler.api.GenerationException;

import java.util.List;

/**
 * {@code lhs = rhs}.
 */
public class Assignment extends Statement {

    Assignment() {
    }

    /**
     * @param lhs The target, an orphan {@link Reference}.
     * @param rhs The value, an orphan expression.
     * @return The new assignment.
     * @throws GenerationException if the target is not a reference.
     */
    public static Assignment create(Node lhs, Node rhs) {
        if (!(lhs instanceof Reference)) {
            throw new GenerationException(String.format(
                    "The LHS of an Assignment must be a Reference but found '%s'.",
                    lhs == null ? "null" : lhs.getClass().getSimpleName()));
        }
        Assignment assignment = new Assignment();
        assignment.initChildren(List.of(lhs, rhs));
        return assignment;
    }

    public Reference getLhs() {
        return (Reference) getChild(0);
    }

    public Node getRhs() {
        return getChild(1);
    }

    /**
     * @return true if the target is an array with at least one range index, e.g. {@code a(:) = 0.0}.
     */
    public boolean isArrayAssignment() {
        return getLhs() instanceof ArrayReference array
                && array.getChildren().stream().anyMatch(Range.class::isInstance);
    }

    /**
     * Reads on the right-hand side happen before the write of the target.
     */
    @Override
    public void referenceAccesses(VariablesAccessInfo info) {
        getRhs().referenceAccesses(info);
        getLhs().referenceAccesses(info, AccessType.WRITE);
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
        return new Assignment();
    }
}
