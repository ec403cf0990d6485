package org.psyforge.compiler.transformations;

import org.psyforge.compiler.api.TangentLinearException;
import org.psyforge.compiler.api.TransformationException;
import org.psyforge.compiler.backend.FortranWriter;
import org.psyforge.compiler.ir.Assignment;
import org.psyforge.compiler.ir.BinaryOperation;
import org.psyforge.compiler.ir.BinaryOperation.Operator;
import org.psyforge.compiler.ir.Literal;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.Reference;
import org.psyforge.compiler.ir.Routine;
import org.psyforge.compiler.ir.UnaryOperation;
import org.psyforge.compiler.symbols.DataSymbol;
import org.psyforge.compiler.symbols.ScalarType;
import org.psyforge.compiler.symbols.SymbolTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the adjoint rewrite of tangent-linear assignments.
 */
@Tag("unit")
class AdjointAssignmentTransTest {

    private DataSymbol a;
    private DataSymbol b;
    private DataSymbol c;
    private DataSymbol x;
    private DataSymbol y;
    private AdjointAssignmentTrans trans;

    @BeforeEach
    void setUp() {
        a = new DataSymbol("a", ScalarType.REAL_TYPE);
        b = new DataSymbol("b", ScalarType.REAL_TYPE);
        c = new DataSymbol("c", ScalarType.REAL_TYPE);
        x = new DataSymbol("x", ScalarType.REAL_TYPE);
        y = new DataSymbol("y", ScalarType.REAL_TYPE);
        trans = new AdjointAssignmentTrans(List.of(a, b, c));
    }

    private static Reference ref(DataSymbol symbol) {
        return new Reference(symbol);
    }

    private static BinaryOperation op(Operator operator, Node lhs, Node rhs) {
        return BinaryOperation.create(operator, lhs, rhs);
    }

    private static Routine inRoutine(Assignment assignment) {
        return Routine.create("adj", new SymbolTable(), List.of(assignment));
    }

    private static String written(Routine routine) {
        FortranWriter writer = new FortranWriter();
        StringBuilder text = new StringBuilder();
        for (Node child : routine.getChildren()) {
            text.append(writer.write(child));
        }
        return text.toString();
    }

    /**
     * Verifies that each active term receives an increment and the target is reset.
     */
    @Test
    void adjointOfSumOfTerms() {
        // Arrange
        Routine routine = inRoutine(Assignment.create(ref(a), op(Operator.ADD, op(Operator.MUL, ref(x), ref(b)), ref(c))));

        // Act
        trans.apply(routine.getChild(0));

        // Assert
        assertThat(written(routine)).isEqualTo("""
                b = b + a * x
                c = c + a
                a = 0.0
                """);
    }

    /**
     * Verifies that a term holding the target scales it instead of resetting it, and that
     * subtracted and divided terms keep their sign and divisor.
     */
    @Test
    void selfTermScalesTarget() {
        // Arrange
        Routine routine = inRoutine(Assignment.create(ref(a),
                op(Operator.SUB, op(Operator.MUL, Literal.ofReal("3.0"), ref(a)), op(Operator.DIV, ref(b), ref(y)))));

        // Act
        trans.apply(routine.getChild(0));

        // Assert
        assertThat(written(routine)).isEqualTo("""
                b = b - a / y
                a = a * 3.0
                """);
    }

    /**
     * Verifies that increments follow the order of the terms and the self term scales the target last.
     */
    @Test
    void incrementsInTermOrderThenScale() {
        // Arrange
        DataSymbol d = new DataSymbol("d", ScalarType.REAL_TYPE);
        DataSymbol w = new DataSymbol("w", ScalarType.REAL_TYPE);
        DataSymbol z = new DataSymbol("z", ScalarType.REAL_TYPE);
        AdjointAssignmentTrans withD = new AdjointAssignmentTrans(List.of(a, b, c, d));
        Node rhs = op(Operator.ADD, op(Operator.ADD, op(Operator.ADD,
                op(Operator.MUL, ref(w), ref(a)), op(Operator.MUL, ref(x), ref(b))),
                op(Operator.MUL, ref(y), ref(c))), op(Operator.MUL, ref(z), ref(d)));
        Routine routine = inRoutine(Assignment.create(ref(a), rhs));

        // Act
        withD.apply(routine.getChild(0));

        // Assert
        assertThat(written(routine)).isEqualTo("""
                b = b + a * x
                c = c + a * y
                d = d + a * z
                a = a * w
                """);
    }

    /**
     * Verifies that several self terms are collapsed into one scaling factor.
     */
    @Test
    void selfTermsAreCombined() {
        // Arrange
        Routine routine = inRoutine(Assignment.create(ref(a), op(Operator.ADD, ref(a), op(Operator.MUL, ref(x), ref(a)))));

        // Act
        trans.apply(routine.getChild(0));

        // Assert
        assertThat(written(routine)).isEqualTo("""
                a = a * (1.0 + x)
                """);
    }

    /**
     * Verifies that signed, multiplied and divided self terms are combined next to another increment.
     */
    @Test
    void signedSelfTermsAreCombined() {
        // Arrange
        Node rhs = op(Operator.ADD, op(Operator.ADD, op(Operator.SUB,
                UnaryOperation.create(UnaryOperation.Operator.MINUS, ref(a)), op(Operator.MUL, ref(x), ref(a))),
                ref(b)), op(Operator.DIV, ref(a), ref(y)));
        Routine routine = inRoutine(Assignment.create(ref(a), rhs));

        // Act
        trans.apply(routine.getChild(0));

        // Assert
        assertThat(written(routine)).isEqualTo("""
                b = b + a
                a = a * (-1.0 - x + 1.0 / y)
                """);
    }

    /**
     * Verifies that an assignment of the target to itself has an empty adjoint.
     */
    @Test
    void identityAssignmentIsRemoved() {
        // Arrange
        Routine routine = inRoutine(Assignment.create(ref(a), ref(a)));

        // Act
        trans.apply(routine.getChild(0));

        // Assert
        assertThat(routine.getChildren()).isEmpty();
        assertThat(written(routine)).isEmpty();
    }

    /**
     * Verifies that a negated active variable contributes a factor of minus one.
     */
    @Test
    void negatedTerm() {
        // Arrange
        Routine routine = inRoutine(Assignment.create(ref(a),
                UnaryOperation.create(UnaryOperation.Operator.MINUS, ref(b))));

        // Act
        trans.apply(routine.getChild(0));

        // Assert
        assertThat(written(routine)).isEqualTo("""
                b = b + a * -1.0
                a = 0.0
                """);
    }

    /**
     * Verifies that unary plus and minus may combine the active variable while negation is rejected.
     */
    @Test
    void unaryOperatorsCombineActiveVariable() {
        // Arrange
        Routine minus = inRoutine(Assignment.create(ref(a),
                op(Operator.MUL, UnaryOperation.create(UnaryOperation.Operator.MINUS, ref(b)), ref(x))));
        Routine plus = inRoutine(Assignment.create(ref(a), UnaryOperation.create(UnaryOperation.Operator.PLUS, ref(b))));

        // Act
        trans.apply(minus.getChild(0));
        trans.apply(plus.getChild(0));

        // Assert
        assertThat(written(minus)).isEqualTo("""
                b = b + a * (-1.0 * x)
                a = 0.0
                """);
        assertThat(written(plus)).isEqualTo("""
                b = b + a
                a = 0.0
                """);
        assertThatThrownBy(() -> trans.validate(Assignment.create(ref(a),
                UnaryOperation.create(UnaryOperation.Operator.NOT, ref(b)))))
                .isInstanceOf(TangentLinearException.class)
                .hasMessage("Each term on the RHS of the assignment 'a = .not. b' must be an active variable "
                        + "multiplied or divided by an expression, but found '.not. b'.");
    }

    /**
     * Verifies that passive assignments and literal assignments to active variables are kept.
     */
    @Test
    void passiveAndLiteralAssignmentsAreUnchanged() {
        // Arrange
        Routine routine = Routine.create("adj", new SymbolTable(), List.of(
                Assignment.create(ref(x), op(Operator.MUL, ref(y), Literal.ofReal("2.0"))),
                Assignment.create(ref(a), Literal.ofReal("0.0"))));
        Routine before = (Routine) routine.copy();

        // Act
        trans.apply(routine.getChild(0));
        trans.apply(routine.getChild(1));

        // Assert
        assertThat(routine.isStructurallyEqual(before)).isTrue();
        assertThat(trans.getActiveVariables()).containsExactly(a, b, c);
        assertThat(AdjointUtils.isPassive(routine.getChild(0), trans.getActiveVariables())).isTrue();
    }

    /**
     * Verifies the rejected assignment shapes.
     */
    @Test
    void rejectsNonLinearForms() {
        // Act & Assert
        assertThatThrownBy(() -> trans.validate(Literal.ofReal("1.0")))
                .isInstanceOf(TransformationException.class)
                .isNotInstanceOf(TangentLinearException.class)
                .hasMessage("Node argument in assignment transformation should be an Assignment, but found 'Literal'.");
        assertThatThrownBy(() -> trans.validate(Assignment.create(ref(x), ref(b))))
                .isInstanceOf(TangentLinearException.class)
                .hasMessage("Assignment node 'x = b' has the following active variables on its RHS '[b]' but its "
                        + "LHS 'x' is not an active variable.");
        assertThatThrownBy(() -> trans.validate(Assignment.create(ref(a), op(Operator.ADD, ref(b), ref(x)))))
                .isInstanceOf(TangentLinearException.class)
                .hasMessage("Each term on the RHS of the assigment 'a = b + x' must have an active variable but 'x' does not.");
        assertThatThrownBy(() -> trans.validate(Assignment.create(ref(a), op(Operator.MUL, ref(b), ref(c)))))
                .isInstanceOf(TangentLinearException.class)
                .hasMessage("Each term on the RHS of the assigment 'a = b * c' must not have more than one active "
                        + "variable but 'b * c' has 2.");
        assertThatThrownBy(() -> trans.validate(Assignment.create(ref(a), op(Operator.DIV, ref(x), ref(b)))))
                .isInstanceOf(TangentLinearException.class)
                .hasMessage("A term on the RHS of the assignment 'a = x / b' with a division must not have the "
                        + "active variable as a divisor but found 'x / b'.");
        assertThatThrownBy(() -> trans.validate(Assignment.create(ref(a), op(Operator.POW, ref(b), Literal.ofInteger(2)))))
                .isInstanceOf(TangentLinearException.class)
                .hasMessage("Each term on the RHS of the assignment 'a = b ** 2' must be an active variable multiplied "
                        + "or divided by an expression, but found 'b ** 2'.");
    }

    /**
     * Verifies that a failed validation leaves the tree untouched.
     */
    @Test
    void failedApplyKeepsTree() {
        // Arrange
        Routine routine = inRoutine(Assignment.create(ref(a), op(Operator.MUL, ref(b), ref(c))));
        Routine before = (Routine) routine.copy();

        // Act & Assert
        assertThatThrownBy(() -> trans.apply(routine.getChild(0))).isInstanceOf(TangentLinearException.class);
        assertThat(routine.isStructurallyEqual(before)).isTrue();
    }
}
