package org.psyforge.compiler.ir.domain;

import org.psyforge.compiler.ir.Loop;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.symbols.DataSymbol;

/**
 * A loop over one dimension of the model domain. The loop type names the dimension
 * ({@code lon}, {@code lat}, {@code levels}, {@code tracers}) or is {@code unknown}.
 */
public class KernelLoop extends Loop {

    /** The loop type of a loop whose variable is not in the loop-type mapping. */
    public static final String UNKNOWN = "unknown";

    private final String loopType;

    KernelLoop(DataSymbol variable, String loopType) {
        super(variable);
        this.loopType = loopType;
    }

    /**
     * Builds a kernel loop from the children of a generic loop.
     *
     * @param source A generic loop; it is left without children.
     * @param loopType The domain dimension the loop iterates over.
     * @return The new loop, an orphan.
     */
    public static KernelLoop fromLoop(Loop source, String loopType) {
        KernelLoop loop = new KernelLoop(source.getVariable(), loopType);
        adoptChildren(loop, source);
        return loop;
    }

    public String getLoopType() {
        return loopType;
    }

    @Override
    protected Node shallowCopy() {
        return new KernelLoop(getVariable(), loopType);
    }

    @Override
    protected boolean hasSameData(Node other) {
        return super.hasSameData(other) && loopType.equals(((KernelLoop) other).loopType);
    }

    @Override
    protected String describe() {
        return super.describe() + ", type:'" + loopType + "'";
    }
}
