package org.psyforge.compiler.symbols;

/**
 * The type of a symbol that is not known yet, typically because it comes from a wildcard import.
 */
public enum DeferredType implements DataType {
    INSTANCE;

    @Override
    public DataType copy() {
        return this;
    }

    @Override
    public String toString() {
        return "DeferredType";
    }
}
