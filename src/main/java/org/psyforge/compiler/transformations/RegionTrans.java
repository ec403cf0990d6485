package org.psyforge.compiler.transformations;

import org.psyforge.compiler.api.TransformationException;
import org.psyforge.compiler.ir.CodeBlock;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.directives.RegionDirective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Base of the transformations that enclose a run of sibling statements in a {@link RegionDirective}.
 *
 * @param <D> The directive created.
 */
public abstract class RegionTrans<D extends RegionDirective> implements Transformation<List<Node>> {

    private static final Logger LOG = LoggerFactory.getLogger(RegionTrans.class);

    /**
     * Creates the directive for the given nodes. Called after validation, before any node is moved.
     *
     * @param nodes The nodes that will form the body, still in place.
     * @return A new directive with an empty body.
     */
    protected abstract D createDirective(List<Node> nodes);

    /**
     * Additional checks of a subclass. The default accepts everything.
     * @param nodes The validated sibling run.
     */
    protected void validateRegion(List<Node> nodes) {
    }

    /**
     * @return true if the region may enclose unparsed code.
     */
    protected boolean allowsCodeBlocks() {
        return false;
    }

    /**
     * Convenience for a single statement.
     * @param node The statement to enclose.
     */
    public void apply(Node node) {
        apply(List.of(node));
    }

    @Override
    public void validate(List<Node> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            throw new TransformationException(String.format(
                    "Error in %s: cannot apply a region transformation to an empty list of nodes.", getName()));
        }
        Node parent = nodes.get(0).getParent();
        if (parent == null) {
            throw new TransformationException(String.format(
                    "Error in %s: the nodes must have a parent but '%s' is a root.", getName(), nodes.get(0)));
        }
        int previous = -1;
        for (Node node : nodes) {
            if (node.getParent() != parent) {
                throw new TransformationException(String.format(
                        "Error in %s: supplied nodes are not children of the same parent.", getName()));
            }
            int position = node.position();
            if (previous >= 0 && position != previous + 1) {
                throw new TransformationException(String.format(
                        "Error in %s: children are not consecutive children of one parent: child '%s' has position %d, "
                                + "but previous child had position %d.", getName(), node, position, previous));
            }
            previous = position;
            if (!allowsCodeBlocks() && !node.walk(CodeBlock.class).isEmpty()) {
                throw new TransformationException(String.format(
                        "Nodes of type 'CodeBlock' cannot be enclosed by a %s transformation", getName()));
            }
        }
        validateRegion(nodes);
    }

    @Override
    public void apply(List<Node> nodes) {
        validate(nodes);
        applyValidated(nodes);
    }

    /**
     * Moves the nodes into a new directive placed where the first node was.
     *
     * @param nodes A validated run of siblings.
     * @return The new directive.
     */
    protected D applyValidated(List<Node> nodes) {
        D directive = createDirective(nodes);
        Node parent = nodes.get(0).getParent();
        int position = nodes.get(0).position();
        List<Node> moved = List.copyOf(nodes);
        moved.forEach(Node::detach);
        directive.addToBody(moved);
        parent.insertChild(position, directive);
        LOG.debug("{} enclosed {} node(s) at position {} of {}", getName(), moved.size(), position, parent);
        return directive;
    }
}
