package org.psyforge.compiler.ir.directives;

import org.psyforge.compiler.ir.Node;

/**
 * {@code !$omp single [nowait]}: the body is executed by one thread of the enclosing parallel region.
 */
public class SingleDirective extends RegionDirective {

    private final boolean nowait;

    SingleDirective(boolean nowait) {
        this.nowait = nowait;
    }

    /**
     * @param nowait Whether the other threads skip the implicit barrier at the end.
     * @return A directive with an empty body.
     */
    public static SingleDirective create(boolean nowait) {
        SingleDirective directive = new SingleDirective(nowait);
        directive.initBody();
        return directive;
    }

    public boolean isNowait() {
        return nowait;
    }

    @Override
    public String beginString() {
        return nowait ? "omp single nowait" : "omp single";
    }

    @Override
    public String endString() {
        return "omp end single";
    }

    @Override
    protected Node shallowCopy() {
        return new SingleDirective(nowait);
    }

    @Override
    protected boolean hasSameData(Node other) {
        return nowait == ((SingleDirective) other).nowait;
    }
}
