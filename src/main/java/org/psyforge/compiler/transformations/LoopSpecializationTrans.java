package org.psyforge.compiler.transformations;

import org.psyforge.compiler.api.TransformationException;
import org.psyforge.compiler.config.LoopTypeMapping;
import org.psyforge.compiler.diagnostics.CompilerLogger;
import org.psyforge.compiler.ir.Loop;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.Schedule;
import org.psyforge.compiler.ir.domain.KernelLoop;
import org.psyforge.compiler.ir.domain.KernelMarker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns the generic loops of a subtree into {@link KernelLoop}s and marks bare loop bodies as kernels.
 */
public class LoopSpecializationTrans implements Transformation<Node> {

    private final LoopTypeMapping loopTypes;

    /**
     * @param loopTypes Maps loop variable names to the domain dimension they iterate over.
     */
    public LoopSpecializationTrans(LoopTypeMapping loopTypes) {
        this.loopTypes = loopTypes;
    }

    @Override
    public void validate(Node target) {
        if (target == null) {
            throw new TransformationException(String.format("Error in %s: the target must not be null.", getName()));
        }
        if (target instanceof Loop && !(target instanceof KernelLoop) && target.getParent() == null) {
            throw new TransformationException(String.format(
                    "Error in %s: a loop can only be specialised inside a schedule but '%s' has no parent.",
                    getName(), target));
        }
    }

    @Override
    public void apply(Node target) {
        validate(target);
        List<Loop> loops = new ArrayList<>();
        for (Loop loop : target.walk(Loop.class)) {
            if (!(loop instanceof KernelLoop)) {
                loops.add(loop);
            }
        }
        // innermost first, so a marker is only placed in bodies that no longer hold generic loops
        Collections.reverse(loops);
        for (Loop loop : loops) {
            specialise(loop);
        }
        CompilerLogger.debug("Specialised {} loop(s)", loops.size());
    }

    private void specialise(Loop loop) {
        String loopType = loopTypes.typeOf(loop.getVariable().getName()).orElse(KernelLoop.UNKNOWN);
        KernelLoop kernelLoop = KernelLoop.fromLoop(loop, loopType);
        loop.replaceWith(kernelLoop);
        Schedule body = kernelLoop.getLoopBody();
        if (KernelMarker.matches(body)) {
            List<Node> statements = body.popAllChildren();
            body.addChild(KernelMarker.create(statements));
        }
        CompilerLogger.trace("Loop over '{}' has type '{}'", loop.getVariable().getName(), loopType);
    }
}
