package org.psyforge.compiler.transformations;

import org.psyforge.compiler.config.ProfilingOptions;
import org.psyforge.compiler.diagnostics.CompilerLogger;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.Routine;
import org.psyforge.compiler.ir.domain.KernelLoop;
import org.psyforge.compiler.symbols.NameSpace;

import java.util.List;

/**
 * Adds the profiling regions requested by the profiling options to every routine of a tree.
 * Kernel regions are added before invoke regions, so an invoke region encloses the kernel regions
 * of its routine.
 */
public class ProfilingInstrumenter {

    private final ProfilingOptions options;
    private final NameSpace nameSpace;

    public ProfilingInstrumenter(ProfilingOptions options, NameSpace nameSpace) {
        this.options = options;
        this.nameSpace = nameSpace;
    }

    /**
     * @param root The tree to instrument.
     * @return The number of regions added.
     */
    public int instrument(Node root) {
        int regions = 0;
        ProfileTrans trans = new ProfileTrans(nameSpace);
        for (Routine routine : root.walk(Routine.class)) {
            if (options.kernels()) {
                for (KernelLoop loop : outermostKernelLoops(routine)) {
                    trans.apply(loop);
                    regions++;
                }
            }
            if (options.invokes() && routine.getChildCount() > 0) {
                trans.apply(List.copyOf(routine.getChildren()));
                regions++;
            }
        }
        CompilerLogger.info("Added {} profiling region(s) for options {}", regions, options.options());
        return regions;
    }

    private static List<KernelLoop> outermostKernelLoops(Routine routine) {
        return routine.walk(KernelLoop.class).stream()
                .filter(loop -> loop.ancestor(KernelLoop.class).isEmpty())
                .toList();
    }
}
