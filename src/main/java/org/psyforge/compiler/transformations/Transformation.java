package org.psyforge.compiler.transformations;

import org.psyforge.compiler.api.TransformationException;

/**
 * A rewrite of the IR.
 *
 * @param <T> What the transformation is applied to: a node or a list of sibling nodes.
 */
public interface Transformation<T> {

    /**
     * @return The name used in log and error messages.
     */
    default String getName() {
        return getClass().getSimpleName();
    }

    /**
     * Checks that the transformation can be applied. Never modifies the tree.
     *
     * @param target The target.
     * @throws TransformationException if it cannot be applied.
     */
    void validate(T target);

    /**
     * Validates and then rewrites the tree.
     *
     * @param target The target.
     * @throws TransformationException if validation fails; the tree is unchanged in that case.
     */
    void apply(T target);
}
