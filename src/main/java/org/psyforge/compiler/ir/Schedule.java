package org.psyforge.compiler.ir;

import java.util.List;

/**
 * An ordered block of statements.
 */
public class Schedule extends Node {

    public Schedule() {
    }

    /**
     * @param statements Orphan statements.
     * @return A schedule holding them.
     */
    public static Schedule create(List<? extends Node> statements) {
        Schedule schedule = new Schedule();
        schedule.initChildren(statements);
        return schedule;
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
        return Statement.isStatement(child);
    }

    @Override
    protected String childrenFormat() {
        return "[Statement]*";
    }

    @Override
    protected Node shallowCopy() {
        return new Schedule();
    }
}
