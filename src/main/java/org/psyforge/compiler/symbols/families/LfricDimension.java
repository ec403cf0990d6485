package org.psyforge.compiler.symbols.families;

import org.psyforge.compiler.ir.Literal;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.symbols.ScalarType;

/**
 * The extent of a vector-field dimension, which can only be 1 or 3.
 */
public class LfricDimension extends Literal {

    public LfricDimension(String value) {
        super(value, ScalarType.INTEGER_TYPE);
        if (!value.equals("1") && !value.equals("3")) {
            throw new IllegalArgumentException(
                    "An LFRic dimension object must be '1' or '3', but found '" + value + "'.");
        }
    }

    @Override
    protected Node shallowCopy() {
        return new LfricDimension(getValue());
    }
}
