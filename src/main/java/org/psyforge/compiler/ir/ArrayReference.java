package org.psyforge.compiler.ir;

import org.psyforge.compiler.analysis.AccessInfo;
import org.psyforge.compiler.analysis.AccessType;
import org.psyforge.compiler.analysis.VariablesAccessInfo;
import org.psyforge.compiler.api.GenerationException;
import org.psyforge.compiler.api.InternalCompilerException;
import org.psyforge.compiler.symbols.DataSymbol;
import org.psyforge.compiler.symbols.DeferredType;
import org.psyforge.compiler.symbols.Symbol;
import org.psyforge.compiler.symbols.UnsupportedType;

import java.util.List;

/**
 * An access to an element or section of an array, e.g. {@code a(i, 2:n)}.
 * Children are the index expressions, one per dimension.
 */
public class ArrayReference extends Reference {

    ArrayReference(Symbol symbol) {
        super(symbol);
    }

    /**
     * Creates an array access.
     *
     * @param symbol The array symbol.
     * @param indices One orphan index expression or {@link Range} per dimension.
     * @return The new node.
     * @throws GenerationException if the symbol is not an array, or the number of indices does not match its rank.
     */
    public static ArrayReference create(Symbol symbol, List<? extends Node> indices) {
        if (!(symbol instanceof DataSymbol data)) {
            throw new GenerationException(String.format(
                    "expecting the symbol '%s' to be a DataSymbol, but found '%s'.",
                    symbol == null ? "null" : symbol.getName(), symbol == null ? "null" : symbol.getClass().getSimpleName()));
        }
        if (indices == null || indices.isEmpty()) {
            throw new GenerationException(String.format(
                    "ArrayReference to '%s' requires a list with at least one index.", symbol.getName()));
        }
        if (data.getDatatype() instanceof DeferredType || data.getDatatype() instanceof UnsupportedType) {
            // rank not modelled
        } else if (!data.isArray()) {
            throw new GenerationException(String.format(
                    "expecting the symbol '%s' to be an array, not a scalar.", symbol.getName()));
        } else if (data.getRank() != indices.size()) {
            throw new GenerationException(String.format(
                    "the symbol '%s' should have the same number of dimensions as indices (provided in the "
                            + "'indices' argument). Expecting '%d' but found '%d'.",
                    symbol.getName(), data.getRank(), indices.size()));
        }
        ArrayReference reference = new ArrayReference(symbol);
        reference.initChildren(indices);
        return reference;
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
        return DataNode.isExpression(child) || child instanceof Range;
    }

    @Override
    protected String childrenFormat() {
        return "[DataNode | Range]+";
    }

    @Override
    protected boolean isComplete(int count) {
        return count > 0;
    }

    /**
     * @return The index expressions, one per dimension.
     * @throws InternalCompilerException if the node has no children, which no valid construction produces.
     */
    public List<Node> indices() {
        if (getChildCount() == 0) {
            throw new InternalCompilerException(
                    "ArrayReference malformed or incomplete: must have one or more children representing "
                            + "array-index expressions but found none.");
        }
        for (int i = 0; i < getChildCount(); i++) {
            if (!isValidChild(i, getChild(i))) {
                throw new InternalCompilerException(String.format(
                        "ArrayReference malformed or incomplete: child %d of array '%s' must be a DataNode or "
                                + "Range representing an array-index expression but found '%s'.",
                        i, getName(), getChild(i).getClass().getSimpleName()));
            }
        }
        return getChildren();
    }

    /**
     * @param index A 0-based dimension.
     * @return true if the index is a range starting at {@code LBOUND(<this array>, index+1)}.
     */
    public boolean isLowerBound(int index) {
        Node node = validatedIndex(index);
        return node instanceof Range range && isBoundQuery(range.getStart(), IntrinsicCall.Intrinsic.LBOUND, index);
    }

    /**
     * @param index A 0-based dimension.
     * @return true if the index is a range stopping at {@code UBOUND(<this array>, index+1)}.
     */
    public boolean isUpperBound(int index) {
        Node node = validatedIndex(index);
        return node instanceof Range range && isBoundQuery(range.getStop(), IntrinsicCall.Intrinsic.UBOUND, index);
    }

    /**
     * A full range covers the whole dimension: lower bound, upper bound and a step of exactly 1.
     * @param index A 0-based dimension.
     * @return true if all three conditions hold.
     */
    public boolean isFullRange(int index) {
        if (!isLowerBound(index) || !isUpperBound(index)) {
            return false;
        }
        Range range = (Range) getChild(index);
        return range.getStep() instanceof Literal step && step.isInteger() && step.getValue().equals("1");
    }

    private Node validatedIndex(int index) {
        List<Node> indices = indices();
        if (index < 0 || index >= indices.size()) {
            throw new IllegalArgumentException(String.format(
                    "In ArrayReference '%s' the specified index '%d' must be less than the number of dimensions '%d'.",
                    getName(), index, indices.size()));
        }
        return indices.get(index);
    }

    private boolean isBoundQuery(Node expression, IntrinsicCall.Intrinsic intrinsic, int index) {
        if (!(expression instanceof IntrinsicCall call) || call.getIntrinsic() != intrinsic || call.getChildCount() != 2) {
            return false;
        }
        boolean sameArray = call.getChild(0).getClass() == Reference.class
                && ((Reference) call.getChild(0)).getSymbol() == getSymbol();
        boolean sameDimension = call.getChild(1) instanceof Literal dim
                && dim.isInteger() && dim.integerValue() == index + 1;
        return sameArray && sameDimension;
    }

    /**
     * Records the access to the array first, then the accesses inside the index expressions, and
     * finally attaches the index expressions to the last access recorded for the array symbol.
     */
    @Override
    public void referenceAccesses(VariablesAccessInfo info, AccessType accessType) {
        info.addAccess(getSymbol(), accessType, this);
        for (Node child : getChildren()) {
            child.referenceAccesses(info);
        }
        AccessInfo last = info.get(getSymbol()).lastAccess();
        last.setIndices(indices());
    }

    @Override
    protected Node shallowCopy() {
        return new ArrayReference(getSymbol());
    }
}
