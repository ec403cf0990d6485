package org.psyforge.compiler.ir;

import java.util.List;

/**
 * An index range {@code start:stop:step}.
 */
public class Range extends Node {

    Range() {
    }

    /**
     * @param start The first index.
     * @param stop The last index.
     * @param step The stride.
     * @return The new range.
     */
    public static Range create(Node start, Node stop, Node step) {
        Range range = new Range();
        range.initChildren(List.of(start, stop, step));
        return range;
    }

    /**
     * Creates a range with a step of 1.
     */
    public static Range create(Node start, Node stop) {
        return create(start, stop, Literal.ofInteger(1));
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

    @Override
    protected boolean isValidChild(int position, Node child) {
        return position < 3 && DataNode.isExpression(child);
    }

    @Override
    protected String childrenFormat() {
        return "DataNode, DataNode, DataNode";
    }

    @Override
    protected boolean isComplete(int count) {
        return count == 3;
    }

    @Override
    protected Node shallowCopy() {
        return new Range();
    }
}
