package org.psyforge.compiler.ir.directives;

import org.psyforge.compiler.ir.Node;

/**
 * {@code !$omp task} around one loop nest. The clauses are computed by the task transformation
 * and rendered by the writer, which needs to format the depend expressions.
 */
public class TaskDirective extends RegionDirective {

    private TaskClauses clauses = TaskClauses.empty();

    TaskDirective() {
    }

    public static TaskDirective create() {
        TaskDirective directive = new TaskDirective();
        directive.initBody();
        return directive;
    }

    public TaskClauses getClauses() {
        return clauses;
    }

    public void setClauses(TaskClauses clauses) {
        this.clauses = clauses;
    }

    @Override
    public String beginString() {
        return "omp task";
    }

    @Override
    public String endString() {
        return "omp end task";
    }

    @Override
    protected Node shallowCopy() {
        TaskDirective copy = new TaskDirective();
        copy.clauses = clauses;
        return copy;
    }
}
