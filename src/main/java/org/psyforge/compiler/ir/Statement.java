package org.psyforge.compiler.ir;

/**
 * A node that can appear in a {@link Schedule}.
 */
public abstract class Statement extends Node {

    /**
     * @param node A candidate child.
     * @return true if the node can stand where a statement is expected. Unparsed code blocks
     *         of statement structure count as statements.
     */
    public static boolean isStatement(Node node) {
        return node instanceof Statement
                || (node instanceof CodeBlock block && block.getStructure() == CodeBlock.Structure.STATEMENT);
    }
}
