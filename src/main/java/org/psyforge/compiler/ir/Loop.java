package org.psyforge.compiler.ir;

import org.psyforge.compiler.analysis.AccessType;
import org.psyforge.compiler.analysis.VariablesAccessInfo;
import org.psyforge.compiler.api.GenerationException;
import org.psyforge.compiler.symbols.DataSymbol;
import org.psyforge.compiler.symbols.DeferredType;
import org.psyforge.compiler.symbols.ScalarType;

import java.util.List;

/**
 * A counted loop {@code do variable = start, stop, step}. Children are, in this order, the start,
 * stop and step expressions and the body {@link Schedule}.
 */
public class Loop extends Statement {

    private DataSymbol variable;

    protected Loop(DataSymbol variable) {
        setVariable(variable);
    }

    /**
     * @param variable The loop variable, a scalar integer.
     * @param start The first value.
     * @param stop The last value.
     * @param step The increment.
     * @param body Orphan statements of the loop body.
     * @return The new loop.
     */
    public static Loop create(DataSymbol variable, Node start, Node stop, Node step, List<? extends Node> body) {
        Loop loop = new Loop(variable);
        loop.initChildren(List.of(start, stop, step, Schedule.create(body)));
        return loop;
    }

    /**
     * Moves the children of {@code source} into {@code target}. Used by subclasses that replace a
     * generic loop with a specialised one.
     *
     * @param target A childless loop.
     * @param source A complete loop; it is left without children.
     */
    protected static void adoptChildren(Loop target, Loop source) {
        target.initChildren(source.popAllChildren());
    }

    public DataSymbol getVariable() {
        return variable;
    }

    /**
     * @param variable A scalar integer (or not yet typed) symbol.
     * @throws GenerationException if the symbol is not suitable as a loop variable.
     */
    public final void setVariable(DataSymbol variable) {
        if (variable == null) {
            throw new GenerationException("A Loop requires a loop variable.");
        }
        boolean integer = variable.getDatatype() instanceof ScalarType scalar
                && scalar.getIntrinsic() == ScalarType.Intrinsic.INTEGER;
        if (!integer && !(variable.getDatatype() instanceof DeferredType)) {
            throw new GenerationException(String.format(
                    "The loop variable '%s' must be a scalar integer but found '%s'.",
                    variable.getName(), variable.getDatatype()));
        }
        this.variable = variable;
    }

    public Node getStart() {
        return getChild(0);
    }

    public Node getStop() {
        return getChild(1);
    }

    public Node getStep() {
        return getChild(2);
    }

    public Schedule getLoopBody() {
        return (Schedule) getChild(3);
    }

    /**
     * The bounds are evaluated once before the first iteration, then the variable is written.
     */
    @Override
    public void referenceAccesses(VariablesAccessInfo info) {
        getStart().referenceAccesses(info);
        getStop().referenceAccesses(info);
        getStep().referenceAccesses(info);
        info.addAccess(variable, AccessType.WRITE, this);
        getLoopBody().referenceAccesses(info);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
        return switch (position) {
            case 0, 1, 2 -> DataNode.isExpression(child);
            case 3 -> child instanceof Schedule;
            default -> false;
        };
    }

    @Override
    protected String childrenFormat() {
        return "DataNode, DataNode, DataNode, Schedule";
    }

    @Override
    protected boolean isComplete(int count) {
        return count == 4;
    }

    @Override
    protected Node shallowCopy() {
        return new Loop(variable);
    }

    @Override
    protected boolean hasSameData(Node other) {
        return variable == ((Loop) other).variable;
    }

    @Override
    protected String describe() {
        return "variable:'" + variable.getName() + "'";
    }
}
