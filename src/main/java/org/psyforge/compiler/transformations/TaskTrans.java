package org.psyforge.compiler.transformations;

import org.psyforge.compiler.api.TransformationException;
import org.psyforge.compiler.diagnostics.CompilerLogger;
import org.psyforge.compiler.ir.Loop;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.directives.TaskClauses;
import org.psyforge.compiler.ir.directives.TaskDirective;

import java.util.List;

/**
 * Encloses a loop nest in an OpenMP task with explicit data-sharing and depend clauses.
 */
public class TaskTrans implements Transformation<Node> {

    @Override
    public void validate(Node target) {
        computeClauses(target);
    }

    @Override
    public void apply(Node target) {
        TaskClauses clauses = computeClauses(target);
        Loop loop = (Loop) target;
        Node parent = loop.getParent();
        int position = loop.position();
        loop.detach();
        TaskDirective task = TaskDirective.create();
        task.addToBody(List.of(loop));
        task.setClauses(clauses);
        parent.insertChild(position, task);
        CompilerLogger.debug("Created task around loop over '{}' with {} in and {} out dependencies",
                loop.getVariable().getName(), clauses.dependIn().size(), clauses.dependOut().size());
    }

    private TaskClauses computeClauses(Node target) {
        if (!(target instanceof Loop loop)) {
            throw new TransformationException(String.format(
                    "Error in %s: the target of a task must be a Loop but found '%s'.",
                    getName(), target == null ? "null" : target.getClass().getSimpleName()));
        }
        if (loop.getParent() == null) {
            throw new TransformationException(String.format(
                    "Error in %s: the loop over '%s' must have a parent.", getName(), loop.getVariable().getName()));
        }
        return TaskClauseBuilder.forLoop(loop);
    }
}
