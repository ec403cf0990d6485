package org.psyforge.compiler.ir;

import org.psyforge.compiler.analysis.AccessType;
import org.psyforge.compiler.analysis.VariablesAccessInfo;
import org.psyforge.compiler.api.GenerationException;
import org.psyforge.compiler.symbols.RoutineSymbol;

import java.util.List;

/**
 * {@code call routine(arguments)}.
 */
public class Call extends Statement {

    private final RoutineSymbol routine;

    Call(RoutineSymbol routine) {
        if (routine == null) {
            throw new GenerationException("A Call requires a RoutineSymbol.");
        }
        this.routine = routine;
    }

    public static Call create(RoutineSymbol routine, List<? extends Node> arguments) {
        Call call = new Call(routine);
        call.initChildren(arguments);
        return call;
    }

    public RoutineSymbol getRoutine() {
        return routine;
    }

    /**
     * Without the callee's interface every reference argument may be read and written.
     */
    @Override
    public void referenceAccesses(VariablesAccessInfo info) {
        for (Node argument : getChildren()) {
            if (argument instanceof Reference reference) {
                reference.referenceAccesses(info, AccessType.READWRITE);
            } else {
                argument.referenceAccesses(info);
            }
        }
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
        return DataNode.isExpression(child);
    }

    @Override
    protected String childrenFormat() {
        return "[DataNode]*";
    }

    @Override
    protected Node shallowCopy() {
        return new Call(routine);
    }

    @Override
    protected boolean hasSameData(Node other) {
        return routine == ((Call) other).routine;
    }

    @Override
    protected String describe() {
        return "name:'" + routine.getName() + "'";
    }
}
