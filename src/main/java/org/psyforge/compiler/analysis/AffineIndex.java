package org.psyforge.compiler.analysis;

import org.psyforge.compiler.ir.BinaryOperation;
import org.psyforge.compiler.ir.Literal;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.Reference;
import org.psyforge.compiler.symbols.Symbol;

import java.util.List;
import java.util.Optional;

/**
 * An index expression of the form {@code v}, {@code v + c}, {@code c + v} or {@code v - c}
 * with {@code v} a scalar reference and {@code c} an integer literal.
 *
 * @param symbol The referenced variable.
 * @param offset The signed literal offset.
 * @param literalFirst true if the source wrote the literal before the variable ({@code c + v}).
 */
public record AffineIndex(Symbol symbol, long offset, boolean literalFirst) {

    /**
     * @param node An index expression.
     * @return The affine form, or empty if the expression is not affine in a single variable.
     */
    public static Optional<AffineIndex> of(Node node) {
        if (isPlainReference(node)) {
            return Optional.of(new AffineIndex(((Reference) node).getSymbol(), 0, false));
        }
        if (!(node instanceof BinaryOperation op)) {
            return Optional.empty();
        }
        Node lhs = op.getLhs();
        Node rhs = op.getRhs();
        if (op.getOperator() == BinaryOperation.Operator.ADD) {
            if (isPlainReference(lhs) && isIntegerLiteral(rhs)) {
                return Optional.of(new AffineIndex(((Reference) lhs).getSymbol(), ((Literal) rhs).integerValue(), false));
            }
            if (isIntegerLiteral(lhs) && isPlainReference(rhs)) {
                return Optional.of(new AffineIndex(((Reference) rhs).getSymbol(), ((Literal) lhs).integerValue(), true));
            }
        } else if (op.getOperator() == BinaryOperation.Operator.SUB
                && isPlainReference(lhs) && isIntegerLiteral(rhs)) {
            return Optional.of(new AffineIndex(((Reference) lhs).getSymbol(), -((Literal) rhs).integerValue(), false));
        }
        return Optional.empty();
    }

    /**
     * Decides whether two index expressions address the same offset: either they are
     * structurally identical or they have the same affine form.
     *
     * @param first An index expression.
     * @param second Another index expression.
     * @return true if both denote the same index.
     */
    public static boolean sameOffset(Node first, Node second) {
        if (first.isStructurallyEqual(second)) {
            return true;
        }
        Optional<AffineIndex> a = of(first);
        Optional<AffineIndex> b = of(second);
        return a.isPresent() && b.isPresent()
                && a.get().symbol() == b.get().symbol() && a.get().offset() == b.get().offset();
    }

    /**
     * Expresses an offset in multiples of a loop step. An exact multiple gives one value; any
     * other offset lies between two multiples and gives the upper one first, then the lower one.
     *
     * @param offset The offset.
     * @param step The loop step, not zero.
     * @return One or two multipliers of {@code step}.
     */
    public static List<Long> stepMultiples(long offset, long step) {
        if (step == 0) {
            throw new IllegalArgumentException("A loop step of 0 has no multiples.");
        }
        if (offset % step == 0) {
            return List.of(offset / step);
        }
        long floor = Math.floorDiv(offset, step);
        return List.of(floor + 1, floor);
    }

    private static boolean isPlainReference(Node node) {
        return node != null && node.getClass() == Reference.class;
    }

    private static boolean isIntegerLiteral(Node node) {
        return node instanceof Literal literal && literal.isInteger();
    }
}
