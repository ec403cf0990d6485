package org.psyforge.compiler.analysis;

import org.psyforge.compiler.ir.Node;

import java.util.List;

/**
 * One access to a symbol at one place in the tree.
 */
public class AccessInfo {

    private final AccessType accessType;
    private final Node node;
    private List<Node> indices = List.of();
    private int sequence;

    public AccessInfo(AccessType accessType, Node node) {
        this.accessType = accessType;
        this.node = node;
    }

    public AccessType getAccessType() {
        return accessType;
    }

    /**
     * @return The node where the access happens.
     */
    public Node getNode() {
        return node;
    }

    /**
     * @return The position of this access among all accesses recorded by the same collector.
     */
    public int getSequence() {
        return sequence;
    }

    void setSequence(int sequence) {
        this.sequence = sequence;
    }

    /**
     * @return The index expressions of an array access, empty for a scalar access.
     */
    public List<Node> getIndices() {
        return indices;
    }

    /**
     * Attached after the index expressions of the access have been visited.
     * @param indices The index expressions; they stay owned by the tree.
     */
    public void setIndices(List<Node> indices) {
        this.indices = List.copyOf(indices);
    }

    @Override
    public String toString() {
        return accessType + (indices.isEmpty() ? "" : indices.toString());
    }
}
