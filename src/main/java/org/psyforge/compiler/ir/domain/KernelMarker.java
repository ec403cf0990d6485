package org.psyforge.compiler.ir.domain;

import org.psyforge.compiler.ir.Assignment;
import org.psyforge.compiler.ir.Call;
import org.psyforge.compiler.ir.CodeBlock;
import org.psyforge.compiler.ir.Loop;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.Schedule;
import org.psyforge.compiler.ir.Statement;
import org.psyforge.compiler.ir.directives.RegionDirective;

import java.util.List;

/**
 * Marks the innermost body of a loop nest as a kernel: straight-line computation without
 * further loops, calls or unparsed code. The single child holds the kernel statements.
 */
public class KernelMarker extends Statement {

    KernelMarker() {
    }

    /**
     * @param statements Orphan statements forming the kernel body.
     * @return The marker.
     */
    public static KernelMarker create(List<? extends Node> statements) {
        KernelMarker marker = new KernelMarker();
        marker.initChildren(List.of(Schedule.create(statements)));
        return marker;
    }

    /**
     * Decides whether a loop body is a bare kernel region.
     *
     * @param body A loop body.
     * @return true if it holds at least one assignment and no loops, directives, calls, code blocks or markers.
     */
    public static boolean matches(Schedule body) {
        if (body.walk(Assignment.class).isEmpty()) {
            return false;
        }
        for (Node node : body.walk(Node.class)) {
            if (node instanceof Loop || node instanceof RegionDirective || node instanceof Call
                    || node instanceof CodeBlock || node instanceof KernelMarker) {
                return false;
            }
        }
        return true;
    }

    public Schedule getKernelBody() {
        return (Schedule) getChild(0);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
        return position == 0 && child instanceof Schedule;
    }

    @Override
    protected String childrenFormat() {
        return "Schedule";
    }

    @Override
    protected boolean isComplete(int count) {
        return count == 1;
    }

    @Override
    protected Node shallowCopy() {
        return new KernelMarker();
    }
}
