package org.psyforge.compiler.transformations;

import org.psyforge.compiler.api.TransformationException;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.directives.ParallelDirective;
import org.psyforge.compiler.ir.directives.SingleDirective;

import java.util.List;

/**
 * Encloses statements of a parallel region in an OpenMP single region.
 */
public class SingleTrans extends RegionTrans<SingleDirective> {

    private final boolean nowait;

    public SingleTrans() {
        this(false);
    }

    /**
     * @param nowait Whether the other threads skip the barrier at the end of the region.
     */
    public SingleTrans(boolean nowait) {
        this.nowait = nowait;
    }

    @Override
    protected void validateRegion(List<Node> nodes) {
        if (nodes.get(0).ancestor(ParallelDirective.class).isEmpty()) {
            throw new TransformationException(String.format(
                    "Error in %s: a single region must be inside an OpenMP parallel region.", getName()));
        }
    }

    @Override
    protected SingleDirective createDirective(List<Node> nodes) {
        return SingleDirective.create(nowait);
    }
}
