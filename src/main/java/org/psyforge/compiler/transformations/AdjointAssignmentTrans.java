package org.psyforge.compiler.transformations;

import org.psyforge.compiler.api.TangentLinearException;
import org.psyforge.compiler.api.TransformationException;
import org.psyforge.compiler.backend.FortranWriter;
import org.psyforge.compiler.diagnostics.CompilerLogger;
import org.psyforge.compiler.ir.Assignment;
import org.psyforge.compiler.ir.BinaryOperation;
import org.psyforge.compiler.ir.BinaryOperation.Operator;
import org.psyforge.compiler.ir.Literal;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.Reference;
import org.psyforge.compiler.ir.UnaryOperation;
import org.psyforge.compiler.symbols.Symbol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Replaces a tangent-linear assignment by its adjoint.
 * <p>
 * The right-hand side of the assignment must be a sum of terms, each holding exactly one active
 * variable multiplied or divided by passive expressions. For {@code a = x * b + c} the adjoint is
 * {@code b = b + a * x}, {@code c = c + a}, {@code a = 0.0}. Terms that reference the target
 * itself scale the target instead of resetting it.
 */
public class AdjointAssignmentTrans implements Transformation<Node> {

    private final List<Symbol> active;
    private final FortranWriter writer = new FortranWriter();

    /**
     * @param active The active variables.
     */
    public AdjointAssignmentTrans(Collection<? extends Symbol> active) {
        this.active = List.copyOf(active);
    }

    public List<Symbol> getActiveVariables() {
        return active;
    }

    /** One additive term of the right-hand side with the sign it is added with. */
    private record Term(Node expression, boolean negative) {
    }

    /** The active reference of a term and the passive factors it is multiplied and divided by. */
    private record Factors(Reference reference, List<Node> numerators, List<Node> divisors) {
    }

    @Override
    public void validate(Node target) {
        if (!(target instanceof Assignment assignment)) {
            throw new TransformationException(String.format(
                    "Node argument in assignment transformation should be an Assignment, but found '%s'.",
                    target == null ? "null" : target.getClass().getSimpleName()));
        }
        List<Reference> rhsActive = AdjointUtils.activeReferences(assignment.getRhs(), active);
        boolean lhsActive = AdjointUtils.isActive(assignment.getLhs(), active);
        if (!rhsActive.isEmpty() && !lhsActive) {
            throw new TangentLinearException(String.format(
                    "Assignment node '%s' has the following active variables on its RHS '%s' but its LHS '%s' is "
                            + "not an active variable.",
                    text(assignment), rhsActive.stream().map(Reference::getName).toList(), text(assignment.getLhs())));
        }
        if (!lhsActive || assignment.getRhs() instanceof Literal) {
            return;
        }
        for (Term term : splitTerms(assignment.getRhs())) {
            Node expression = term.expression();
            List<Reference> references = AdjointUtils.activeReferences(expression, active);
            if (references.isEmpty()) {
                throw new TangentLinearException(String.format(
                        "Each term on the RHS of the assigment '%s' must have an active variable but '%s' does not.",
                        text(assignment), text(expression)));
            }
            if (references.size() > 1) {
                throw new TangentLinearException(String.format(
                        "Each term on the RHS of the assigment '%s' must not have more than one active variable but "
                                + "'%s' has %d.", text(assignment), text(expression), references.size()));
            }
            for (Node node = references.get(0); node != expression; node = node.getParent()) {
                Node parent = node.getParent();
                if (parent instanceof BinaryOperation division && division.getOperator() == Operator.DIV) {
                    if (node.position() == 1) {
                        throw new TangentLinearException(String.format(
                                "A term on the RHS of the assignment '%s' with a division must not have the active "
                                        + "variable as a divisor but found '%s'.", text(assignment), text(expression)));
                    }
                } else if (!(parent instanceof BinaryOperation multiplication && multiplication.getOperator() == Operator.MUL)
                        && !(parent instanceof UnaryOperation unary && unary.getOperator() != UnaryOperation.Operator.NOT)) {
                    throw new TangentLinearException(String.format(
                            "Each term on the RHS of the assignment '%s' must be an active variable multiplied or "
                                    + "divided by an expression, but found '%s'.", text(assignment), text(expression)));
                }
            }
        }
    }

    @Override
    public void apply(Node target) {
        validate(target);
        Assignment assignment = (Assignment) target;
        Reference lhs = assignment.getLhs();
        if (!AdjointUtils.isActive(lhs, active) || assignment.getRhs() instanceof Literal) {
            return;
        }
        List<Node> statements = new ArrayList<>();
        List<Node> selfCoefficients = new ArrayList<>();
        List<Boolean> selfSigns = new ArrayList<>();
        for (Term term : splitTerms(assignment.getRhs())) {
            Factors factors = factorise(term.expression());
            Reference reference = factors.reference();
            if (reference.isStructurallyEqual(lhs)) {
                selfCoefficients.add(coefficient(factors));
                selfSigns.add(term.negative());
                continue;
            }
            Node increment = lhs.copy();
            if (!factors.numerators().isEmpty()) {
                increment = BinaryOperation.create(Operator.MUL, increment, product(factors.numerators()));
            }
            for (Node divisor : factors.divisors()) {
                increment = BinaryOperation.create(Operator.DIV, increment, divisor);
            }
            statements.add(Assignment.create(reference.copy(), BinaryOperation.create(
                    term.negative() ? Operator.SUB : Operator.ADD, reference.copy(), increment)));
        }
        if (selfCoefficients.isEmpty()) {
            statements.add(Assignment.create(lhs.copy(), Literal.ofReal("0.0")));
        } else if (selfCoefficients.size() > 1 || selfSigns.get(0) || selfCoefficients.get(0) != null) {
            Node scale = signed(selfCoefficients.get(0), selfSigns.get(0));
            for (int i = 1; i < selfCoefficients.size(); i++) {
                Node value = selfCoefficients.get(i) != null ? selfCoefficients.get(i) : Literal.ofReal("1.0");
                scale = BinaryOperation.create(selfSigns.get(i) ? Operator.SUB : Operator.ADD, scale, value);
            }
            statements.add(Assignment.create(lhs.copy(), BinaryOperation.create(Operator.MUL, lhs.copy(), scale)));
        }

        String before = text(assignment);
        Node parent = assignment.getParent();
        int position = assignment.position();
        assignment.detach();
        if (parent != null) {
            for (int i = 0; i < statements.size(); i++) {
                parent.insertChild(position + i, statements.get(i));
            }
        }
        CompilerLogger.debug("Adjoint of '{}' is {} statement(s)", before, statements.size());
    }

    private List<Term> splitTerms(Node rhs) {
        List<Term> terms = new ArrayList<>();
        split(rhs, false, terms);
        return terms;
    }

    private static void split(Node node, boolean negative, List<Term> terms) {
        if (node instanceof BinaryOperation operation
                && (operation.getOperator() == Operator.ADD || operation.getOperator() == Operator.SUB)) {
            split(operation.getLhs(), negative, terms);
            split(operation.getRhs(), operation.getOperator() == Operator.SUB ? !negative : negative, terms);
        } else {
            terms.add(new Term(node, negative));
        }
    }

    private Factors factorise(Node term) {
        Reference reference = AdjointUtils.activeReferences(term, active).get(0);
        List<Node> numerators = new ArrayList<>();
        List<Node> divisors = new ArrayList<>();
        collectFactors(term, reference, numerators, divisors);
        return new Factors(reference, numerators, divisors);
    }

    private static void collectFactors(Node node, Reference reference, List<Node> numerators, List<Node> divisors) {
        if (node == reference) {
            return;
        }
        if (node instanceof UnaryOperation unary) {
            if (unary.getOperator() == UnaryOperation.Operator.MINUS) {
                numerators.add(Literal.ofReal("-1.0"));
            }
            collectFactors(unary.getOperand(), reference, numerators, divisors);
        } else if (node instanceof BinaryOperation operation && operation.getOperator() == Operator.DIV) {
            collectFactors(operation.getLhs(), reference, numerators, divisors);
            divisors.add(operation.getRhs().copy());
        } else if (node instanceof BinaryOperation operation) {
            for (Node side : List.of(operation.getLhs(), operation.getRhs())) {
                if (reference.isDescendantOf(side)) {
                    collectFactors(side, reference, numerators, divisors);
                } else {
                    numerators.add(side.copy());
                }
            }
        }
    }

    /**
     * @return The factor of a self term, or null if it is exactly 1.
     */
    private static Node coefficient(Factors factors) {
        Node value = factors.numerators().isEmpty() ? null : product(factors.numerators());
        for (Node divisor : factors.divisors()) {
            value = BinaryOperation.create(Operator.DIV, value != null ? value : Literal.ofReal("1.0"), divisor);
        }
        return value;
    }

    private static Node signed(Node coefficient, boolean negative) {
        if (!negative) {
            return coefficient != null ? coefficient : Literal.ofReal("1.0");
        }
        return coefficient != null
                ? BinaryOperation.create(Operator.MUL, Literal.ofReal("-1.0"), coefficient)
                : Literal.ofReal("-1.0");
    }

    private static Node product(List<Node> factors) {
        Node result = factors.get(0);
        for (int i = 1; i < factors.size(); i++) {
            result = BinaryOperation.create(Operator.MUL, result, factors.get(i));
        }
        return result;
    }

    private String text(Node node) {
        return writer.write(node).strip();
    }
}
