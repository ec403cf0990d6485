package org.psyforge.compiler.ir;

import org.psyforge.compiler.api.GenerationException;
import org.psyforge.compiler.symbols.ScalarType;

import java.util.regex.Pattern;

/**
 * A typed constant. The value is kept as text exactly as it should be written.
 */
public class Literal extends DataNode {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern REAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eEdD][+-]?\\d+)?");

    private final String value;
    private final ScalarType datatype;

    /**
     * Creates a literal.
     *
     * @param value The value as text.
     * @param datatype The type of the value.
     * @throws GenerationException if the text is not a valid value of the type.
     */
    public Literal(String value, ScalarType datatype) {
        if (value == null || datatype == null) {
            throw new GenerationException("A Literal requires both a value and a datatype.");
        }
        switch (datatype.getIntrinsic()) {
            case INTEGER -> {
                if (!INTEGER.matcher(value).matches()) {
                    throw new GenerationException("An integer Literal must be a whole number but found '" + value + "'.");
                }
            }
            case REAL -> {
                if (!REAL.matcher(value).matches()) {
                    throw new GenerationException("A real Literal must be a number but found '" + value + "'.");
                }
            }
            case BOOLEAN -> {
                if (!value.equals("true") && !value.equals("false")) {
                    throw new GenerationException("A boolean Literal must be 'true' or 'false' but found '" + value + "'.");
                }
            }
            case CHARACTER -> { }
        }
        this.value = value;
        this.datatype = datatype;
    }

    public static Literal ofInteger(long value) {
        return new Literal(Long.toString(value), ScalarType.INTEGER_TYPE);
    }

    public static Literal ofReal(String value) {
        return new Literal(value, ScalarType.REAL_TYPE);
    }

    public String getValue() {
        return value;
    }

    public ScalarType getDatatype() {
        return datatype;
    }

    /**
     * @return true for an integer literal.
     */
    public boolean isInteger() {
        return datatype.getIntrinsic() == ScalarType.Intrinsic.INTEGER;
    }

    /**
     * @return The value of an integer literal.
     * @throws GenerationException if the literal is not an integer.
     */
    public long integerValue() {
        if (!isInteger()) {
            throw new GenerationException("Literal '" + value + "' is not an integer.");
        }
        return Long.parseLong(value.startsWith("+") ? value.substring(1) : value);
    }

    @Override
    protected Node shallowCopy() {
        return new Literal(value, datatype);
    }

    @Override
    protected boolean hasSameData(Node other) {
        Literal literal = (Literal) other;
        return value.equals(literal.value) && datatype.equals(literal.datatype);
    }

    @Override
    protected String describe() {
        return "value:'" + value + "', " + datatype;
    }
}
