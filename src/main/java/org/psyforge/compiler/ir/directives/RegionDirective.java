package org.psyforge.compiler.ir.directives;

import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.Schedule;
import org.psyforge.compiler.ir.Statement;

import java.util.List;

/**
 * A directive that applies to a region of statements. The single child is the region body.
 */
public abstract class RegionDirective extends Statement {

    /**
     * Creates a directive without children. Factories call {@link #initBody()}; copies receive
     * the copied body instead.
     */
    protected RegionDirective() {
    }

    /**
     * Gives a freshly constructed directive its empty body.
     */
    protected final void initBody() {
        initChildren(List.of(new Schedule()));
    }

    /**
     * @return The statements covered by the directive.
     */
    public Schedule getDirBody() {
        return (Schedule) getChild(0);
    }

    /**
     * Moves orphan statements into the region body.
     * @param statements The statements, in order.
     */
    public void addToBody(List<? extends Node> statements) {
        for (Node statement : statements) {
            getDirBody().addChild(statement);
        }
    }

    /**
     * @return The text of the opening directive line, without the sentinel.
     */
    public abstract String beginString();

    /**
     * @return The text of the closing directive line, without the sentinel.
     */
    public abstract String endString();

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
}
