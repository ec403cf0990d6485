package org.psyforge.compiler.analysis;

/**
 * How a single access uses the storage of a symbol.
 */
public enum AccessType {
    /** The value is read. */
    READ,
    /** The value is overwritten. */
    WRITE,
    /** The value may be read and written, e.g. a call argument. */
    READWRITE,
    /** Only a property such as a bound or size is queried; the data is not touched. */
    INQUIRY;

    public boolean isWrite() {
        return this == WRITE || this == READWRITE;
    }

    public boolean isRead() {
        return this == READ || this == READWRITE;
    }
}
