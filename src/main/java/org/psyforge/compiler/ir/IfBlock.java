package org.psyforge.compiler.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code if (condition) then ... [else ...] end if}. Children: the condition, the if-body and an
 * optional else-body.
 */
public class IfBlock extends Statement {

    IfBlock() {
    }

    /**
     * @param condition The condition expression.
     * @param ifBody Orphan statements executed when the condition holds.
     * @param elseBody Orphan statements executed otherwise, or null for no else branch.
     * @return The new block.
     */
    public static IfBlock create(Node condition, List<? extends Node> ifBody, List<? extends Node> elseBody) {
        IfBlock block = new IfBlock();
        List<Node> children = new ArrayList<>();
        children.add(condition);
        children.add(Schedule.create(ifBody));
        if (elseBody != null) {
            children.add(Schedule.create(elseBody));
        }
        block.initChildren(children);
        return block;
    }

    public Node getCondition() {
        return getChild(0);
    }

    public Schedule getIfBody() {
        return (Schedule) getChild(1);
    }

    public Optional<Schedule> getElseBody() {
        return getChildCount() > 2 ? Optional.of((Schedule) getChild(2)) : Optional.empty();
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
        return switch (position) {
            case 0 -> DataNode.isExpression(child);
            case 1, 2 -> child instanceof Schedule;
            default -> false;
        };
    }

    @Override
    protected String childrenFormat() {
        return "DataNode, Schedule [, Schedule]";
    }

    @Override
    protected boolean isComplete(int count) {
        return count == 2 || count == 3;
    }

    @Override
    protected Node shallowCopy() {
        return new IfBlock();
    }
}
