package org.psyforge.compiler.ir;

/**
 * A node that evaluates to a value.
 */
public abstract class DataNode extends Node {

    /**
     * @param node A candidate child.
     * @return true if the node can stand where an expression is expected. Unparsed code blocks
     *         of expression structure count as expressions.
     */
    public static boolean isExpression(Node node) {
        return node instanceof DataNode
                || (node instanceof CodeBlock block && block.getStructure() == CodeBlock.Structure.EXPRESSION);
    }
}
