package org.psyforge.compiler.symbols;

/**
 * A named derived type. Its definition is not modelled beyond the declaration text.
 */
public class TypeSymbol extends Symbol {

    private DataType datatype;

    public TypeSymbol(String name, DataType datatype) {
        super(name);
        setDatatype(datatype);
    }

    public DataType getDatatype() {
        return datatype;
    }

    public final void setDatatype(DataType datatype) {
        if (datatype == null) {
            throw new IllegalArgumentException("TypeSymbol '" + getName() + "' requires a datatype.");
        }
        this.datatype = datatype;
    }
}
