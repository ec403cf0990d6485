package org.psyforge.compiler.ir;

import org.psyforge.compiler.analysis.VariablesAccessInfo;
import org.psyforge.compiler.api.GenerationException;
import org.psyforge.compiler.api.InternalCompilerException;
import org.psyforge.compiler.symbols.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Base class of all IR nodes.
 * <p>
 * Every node owns an ordered list of children. A node can be the child of at most one parent:
 * attaching a node that already has a parent fails, so a node has to be {@link #detach() detached}
 * before it can be moved. Which children are legal at which position is decided by each subclass
 * through {@link #isValidChild(int, Node)}; every structural mutation is checked against it.
 */
public abstract class Node {

    private Node parent;
    private final List<Node> children = new ArrayList<>();

    /**
     * Decides whether {@code child} may be placed at {@code position}.
     *
     * @param position The 0-based position.
     * @param child The candidate child.
     * @return true if the child is legal at that position.
     */
    protected boolean isValidChild(int position, Node child) {
        return false;
    }

    /**
     * @return A short description of the legal children, used in error messages.
     */
    protected String childrenFormat() {
        return "<LeafNode>";
    }

    /**
     * Checks that the given child list forms a complete node. Subclasses with a fixed arity
     * override this; it is called by the {@code create} factories and by {@link #copy()}.
     *
     * @param count The number of children.
     * @return true if a node with that many children is complete.
     */
    protected boolean isComplete(int count) {
        return true;
    }

    public final Node getParent() {
        return parent;
    }

    /**
     * @return An unmodifiable view of the children.
     */
    public final List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public final Node getChild(int index) {
        return children.get(index);
    }

    public final int getChildCount() {
        return children.size();
    }

    /**
     * Appends a child.
     * @param child An orphan node that is legal at the end of the child list.
     * @throws GenerationException if the child has a parent or is not legal here.
     */
    public void addChild(Node child) {
        insertChild(children.size(), child);
    }

    /**
     * Inserts a child, shifting the following children to the right.
     *
     * @param index The position to insert at.
     * @param child An orphan node.
     * @throws GenerationException if the child has a parent or the resulting child list is invalid.
     */
    public void insertChild(int index, Node child) {
        requireOrphan(child);
        if (index < 0 || index > children.size()) {
            throw new GenerationException(String.format(
                    "Cannot insert a child at position %d of '%s' which has %d children.",
                    index, getClass().getSimpleName(), children.size()));
        }
        List<Node> candidate = new ArrayList<>(children);
        candidate.add(index, child);
        validateChildren(candidate);
        children.add(index, child);
        child.parent = this;
    }

    /**
     * Replaces the child at {@code index}. The previous child becomes an orphan.
     *
     * @param index The position of the child to replace.
     * @param child An orphan node.
     * @return The previous child.
     * @throws GenerationException if the child has a parent or is not legal at that position.
     */
    public Node setChild(int index, Node child) {
        requireOrphan(child);
        if (!isValidChild(index, child)) {
            throw invalidChild(index, child);
        }
        Node previous = children.set(index, child);
        child.parent = this;
        previous.parent = null;
        return previous;
    }

    /**
     * Removes the child at {@code index}; it becomes an independent root.
     * @param index The position.
     * @return The removed child.
     */
    public Node removeChild(int index) {
        Node removed = children.remove(index);
        removed.parent = null;
        return removed;
    }

    /**
     * Detaches and returns all children, in order.
     * @return The former children, each now a root.
     */
    public List<Node> popAllChildren() {
        List<Node> popped = new ArrayList<>(children);
        children.clear();
        popped.forEach(child -> child.parent = null);
        return popped;
    }

    /**
     * Removes this node from its parent. Does nothing for a root.
     * @return This node, now a root.
     */
    public Node detach() {
        if (parent != null) {
            parent.removeChild(position());
        }
        return this;
    }

    /**
     * Puts {@code replacement} where this node is and detaches this node.
     *
     * @param replacement An orphan node that is legal at this node's position.
     * @throws GenerationException if this node is a root, or the replacement has a parent or is not legal.
     */
    public void replaceWith(Node replacement) {
        if (parent == null) {
            throw new GenerationException(String.format(
                    "This node '%s' should have a parent if its 'replaceWith' method is called.",
                    getClass().getSimpleName()));
        }
        parent.setChild(position(), replacement);
    }

    /**
     * @return The index of this node in its parent's child list. Identity, not equality, is used.
     * @throws InternalCompilerException if this node is not among its parent's children.
     */
    public int position() {
        if (parent == null) {
            return 0;
        }
        for (int i = 0; i < parent.children.size(); i++) {
            if (parent.children.get(i) == this) {
                return i;
            }
        }
        throw new InternalCompilerException(String.format(
                "Node '%s' has a parent but is not one of its children.", this));
    }

    /**
     * @return The siblings of this node including itself, or just this node for a root.
     */
    public List<Node> siblings() {
        return parent == null ? List.of(this) : parent.getChildren();
    }

    public Node root() {
        Node node = this;
        while (node.parent != null) {
            node = node.parent;
        }
        return node;
    }

    /**
     * Collects this node and all descendants of the given type, depth first, parents before children.
     *
     * @param type The type to collect.
     * @param <T> The type to collect.
     * @return The matching nodes in pre-order.
     */
    public <T> List<T> walk(Class<T> type) {
        List<T> result = new ArrayList<>();
        collect(type, result);
        return result;
    }

    private <T> void collect(Class<T> type, List<T> result) {
        if (type.isInstance(this)) {
            result.add(type.cast(this));
        }
        for (Node child : children) {
            child.collect(type, result);
        }
    }

    /**
     * @param type The type to look for.
     * @param <T> The type to look for.
     * @return The nearest strict ancestor of that type.
     */
    public <T> Optional<T> ancestor(Class<T> type) {
        Node node = parent;
        while (node != null) {
            if (type.isInstance(node)) {
                return Optional.of(type.cast(node));
            }
            node = node.parent;
        }
        return Optional.empty();
    }

    /**
     * @param other Another node.
     * @return true if {@code other} is this node or one of its ancestors.
     */
    public boolean isDescendantOf(Node other) {
        for (Node node = this; node != null; node = node.parent) {
            if (node == other) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return The nearest node (this one included) that owns a symbol table.
     * @throws GenerationException if the node is not inside any scope.
     */
    public ScopingNode scope() {
        for (Node node = this; node != null; node = node.parent) {
            if (node instanceof ScopingNode scoping) {
                return scoping;
            }
        }
        throw new GenerationException(String.format(
                "Unable to find the scope of node '%s' as none of its ancestors has a symbol table.", this));
    }

    /**
     * @param symbol A symbol.
     * @return true if any reference in this subtree points at that very symbol.
     */
    public boolean referencesSymbol(Symbol symbol) {
        return walk(Reference.class).stream().anyMatch(ref -> ref.getSymbol() == symbol);
    }

    /**
     * Records the variable accesses of this subtree. The default visits the children in order.
     * @param info The accumulator.
     */
    public void referenceAccesses(VariablesAccessInfo info) {
        for (Node child : children) {
            child.referenceAccesses(info);
        }
    }

    /**
     * Creates a deep copy of this subtree. The copy is a root; symbols are shared with the original.
     * @return The copy.
     */
    public final Node copy() {
        Node copy = shallowCopy();
        for (Node child : children) {
            Node childCopy = child.copy();
            copy.children.add(childCopy);
            childCopy.parent = copy;
        }
        return copy;
    }

    /**
     * @return A childless node of the same class carrying the same node-specific data.
     */
    protected abstract Node shallowCopy();

    /**
     * Compares the node-specific data (operator, symbol, value, ...) without looking at children.
     * @param other A node of the same class.
     * @return true if the data is the same.
     */
    protected boolean hasSameData(Node other) {
        return true;
    }

    /**
     * Structural equality: same class, same node data and structurally equal children.
     * Symbols are compared by identity.
     *
     * @param other Another node, may be null.
     * @return true if both subtrees have the same shape and content.
     */
    public boolean isStructurallyEqual(Node other) {
        if (other == this) {
            return true;
        }
        if (other == null || other.getClass() != getClass() || !hasSameData(other)
                || other.children.size() != children.size()) {
            return false;
        }
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).isStructurallyEqual(other.children.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Attaches children while building a new node in a {@code create} factory.
     *
     * @param newChildren Orphans, validated as a whole.
     * @throws GenerationException if any child has a parent or the list is not a complete, valid child list.
     */
    protected final void initChildren(List<? extends Node> newChildren) {
        for (Node child : newChildren) {
            requireOrphan(child);
        }
        validateChildren(newChildren);
        if (!isComplete(newChildren.size())) {
            throw new GenerationException(String.format(
                    "'%s' can't be created with %d children. The valid format is: '%s'.",
                    getClass().getSimpleName(), newChildren.size(), childrenFormat()));
        }
        for (Node child : newChildren) {
            children.add(child);
            child.parent = this;
        }
    }

    private void validateChildren(List<? extends Node> candidate) {
        for (int i = 0; i < candidate.size(); i++) {
            if (candidate.get(i) == null) {
                throw new GenerationException(String.format(
                        "Item 'null' can't be child %d of '%s'. The valid format is: '%s'.",
                        i, getClass().getSimpleName(), childrenFormat()));
            }
            if (!isValidChild(i, candidate.get(i))) {
                throw invalidChild(i, candidate.get(i));
            }
        }
    }

    private GenerationException invalidChild(int index, Node child) {
        return new GenerationException(String.format(
                "Item '%s' can't be child %d of '%s'. The valid format is: '%s'.",
                child.getClass().getSimpleName(), index, getClass().getSimpleName(), childrenFormat()));
    }

    private void requireOrphan(Node child) {
        if (child == null) {
            throw new GenerationException(String.format(
                    "Item 'null' can't be added as child of '%s'.", getClass().getSimpleName()));
        }
        if (child.parent != null) {
            throw new GenerationException(String.format(
                    "Item '%s' can't be added as child of '%s' because it is not an orphan. It already has a '%s' as a parent.",
                    child.getClass().getSimpleName(), getClass().getSimpleName(), child.parent.getClass().getSimpleName()));
        }
        if (isDescendantOf(child)) {
            throw new GenerationException(String.format(
                    "Item '%s' can't be added as child of '%s' because it is one of its ancestors.",
                    child.getClass().getSimpleName(), getClass().getSimpleName()));
        }
    }

    /**
     * @return A short, single-line description of the node data, e.g. {@code name:'a'}.
     */
    protected String describe() {
        return "";
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + describe() + "]";
    }
}
