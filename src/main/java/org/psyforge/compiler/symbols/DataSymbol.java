package org.psyforge.compiler.symbols;

import org.psyforge.compiler.api.GenerationException;
import org.psyforge.compiler.ir.Node;

import java.util.List;

/**
 * A symbol that holds data: a variable, an argument or a named constant.
 */
public class DataSymbol extends Symbol {

    private DataType datatype;
    private boolean constant;
    private Node initialValue;

    /**
     * Creates a local, public data symbol.
     * @param name The symbol name.
     * @param datatype The type of the data.
     */
    public DataSymbol(String name, DataType datatype) {
        this(name, datatype, Visibility.PUBLIC, new LocalInterface());
    }

    /**
     * Creates a public data symbol with the given interface.
     * @param name The symbol name.
     * @param datatype The type of the data.
     * @param symbolInterface How its storage is provided.
     */
    public DataSymbol(String name, DataType datatype, SymbolInterface symbolInterface) {
        this(name, datatype, Visibility.PUBLIC, symbolInterface);
    }

    /**
     * Creates a data symbol.
     *
     * @param name The symbol name.
     * @param datatype The type of the data.
     * @param visibility The visibility.
     * @param symbolInterface How its storage is provided.
     */
    public DataSymbol(String name, DataType datatype, Visibility visibility, SymbolInterface symbolInterface) {
        super(name, visibility, symbolInterface);
        setDatatype(datatype);
    }

    public DataType getDatatype() {
        return datatype;
    }

    public final void setDatatype(DataType datatype) {
        if (datatype == null) {
            throw new IllegalArgumentException("DataSymbol '" + getName() + "' requires a datatype.");
        }
        this.datatype = datatype;
    }

    public boolean isScalar() {
        return datatype instanceof ScalarType;
    }

    public boolean isArray() {
        return datatype instanceof ArrayType;
    }

    /**
     * @return The rank of an array symbol, 0 for anything else.
     */
    public int getRank() {
        return datatype instanceof ArrayType array ? array.getRank() : 0;
    }

    /**
     * @return The shape of an array symbol, empty for anything else.
     */
    public List<ArrayDimension> getShape() {
        return datatype instanceof ArrayType array ? array.getShape() : List.of();
    }

    public boolean isConstant() {
        return constant;
    }

    public Node getInitialValue() {
        return initialValue;
    }

    /**
     * Sets the initial value and whether the symbol is a named constant ({@code parameter}).
     *
     * @param value An orphan expression, or null to clear it.
     * @param isConstant Whether the value can never change.
     * @throws GenerationException if the value is already part of a tree, or a constant has no value.
     */
    public void setInitialValue(Node value, boolean isConstant) {
        if (value != null && value.getParent() != null) {
            throw new GenerationException(String.format(
                    "The initial value of DataSymbol '%s' must be an orphan node, but it has a '%s' parent.",
                    getName(), value.getParent().getClass().getSimpleName()));
        }
        if (isConstant && value == null) {
            throw new GenerationException(String.format(
                    "DataSymbol '%s' is a constant and therefore requires an initial value.", getName()));
        }
        this.initialValue = value;
        this.constant = isConstant;
    }

    @Override
    public String toString() {
        return getName() + ": DataSymbol<" + datatype + ", " + getInterface() + (constant ? ", constant" : "") + ">";
    }
}
