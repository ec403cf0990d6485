package org.psyforge.compiler.ir;

/**
 * {@code return}.
 */
public class Return extends Statement {

    @Override
    protected Node shallowCopy() {
        return new Return();
    }
}
