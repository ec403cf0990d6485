package org.psyforge.compiler.transformations;

import org.psyforge.compiler.api.TransformationException;
import org.psyforge.compiler.backend.FortranWriter;
import org.psyforge.compiler.ir.ArrayReference;
import org.psyforge.compiler.ir.Assignment;
import org.psyforge.compiler.ir.BinaryOperation;
import org.psyforge.compiler.ir.Literal;
import org.psyforge.compiler.ir.Loop;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.Reference;
import org.psyforge.compiler.ir.Routine;
import org.psyforge.compiler.ir.directives.ParallelDirective;
import org.psyforge.compiler.ir.directives.SingleDirective;
import org.psyforge.compiler.ir.directives.TaskClauses;
import org.psyforge.compiler.ir.directives.TaskDirective;
import org.psyforge.compiler.symbols.ArrayType;
import org.psyforge.compiler.symbols.DataSymbol;
import org.psyforge.compiler.symbols.LiteralExtent;
import org.psyforge.compiler.symbols.ScalarType;
import org.psyforge.compiler.symbols.SymbolTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the clauses computed for OpenMP tasks around loop nests.
 */
@Tag("unit")
class TaskTransTest {

    private DataSymbol i;
    private DataSymbol ii;
    private DataSymbol j;
    private DataSymbol k;
    private DataSymbol a;
    private DataSymbol b;

    @BeforeEach
    void setUp() {
        i = new DataSymbol("i", ScalarType.INTEGER_TYPE);
        ii = new DataSymbol("ii", ScalarType.INTEGER_TYPE);
        j = new DataSymbol("j", ScalarType.INTEGER_TYPE);
        k = new DataSymbol("k", ScalarType.INTEGER_TYPE);
        ArrayType field = new ArrayType(ScalarType.REAL_TYPE, List.of(new LiteralExtent(320), new LiteralExtent(320)));
        a = new DataSymbol("a", field);
        b = new DataSymbol("b", field);
    }

    private static Loop loop(DataSymbol variable, Node start, Node stop, Node step, Node... body) {
        return Loop.create(variable, start, stop, step, List.of(body));
    }

    private static BinaryOperation add(Node lhs, Node rhs) {
        return BinaryOperation.create(BinaryOperation.Operator.ADD, lhs, rhs);
    }

    private static Literal lit(long value) {
        return Literal.ofInteger(value);
    }

    /**
     * Builds
     * <pre>
     * do i = 1, 320, 32
     *   do ii = i, i + 32, 1
     *     do j = 1, 320, 1
     *       a(ii,j) = b(ii + 1,j) + k
     * </pre>
     * inside a routine and returns the loop over {@code ii}.
     */
    private Loop tiledNest() {
        Assignment body = Assignment.create(
                ArrayReference.create(a, List.of(new Reference(ii), new Reference(j))),
                add(ArrayReference.create(b, List.of(add(new Reference(ii), lit(1)), new Reference(j))), new Reference(k)));
        Loop inner = loop(j, lit(1), lit(320), lit(1), body);
        Loop tile = loop(ii, new Reference(i), add(new Reference(i), lit(32)), lit(1), inner);
        Loop outer = loop(i, lit(1), lit(320), lit(32), tile);
        Routine.create("work", new SymbolTable(), List.of(outer));
        return tile;
    }

    /**
     * Verifies the clauses of a tiled loop nest inside a parallel single region: the tile index
     * maps to the enclosing loop variable and the offset is split into the two step multiples
     * around it.
     */
    @Test
    void computesClausesInsideParallelRegion() {
        // Arrange
        Loop tile = tiledNest();
        Loop outer = (Loop) tile.getParent().getParent();
        new ParallelRegionTrans().apply(outer);
        new SingleTrans().apply(outer);

        // Act
        new TaskTrans().apply(tile);

        // Assert
        assertThat(outer.getLoopBody().getChild(0)).isInstanceOf(TaskDirective.class);
        TaskDirective task = (TaskDirective) outer.getLoopBody().getChild(0);
        assertThat(task.getDirBody().getChildren()).containsExactly(tile);
        TaskClauses clauses = task.getClauses();
        assertThat(clauses.privateSymbols()).containsExactly(ii, j);
        assertThat(clauses.firstprivateSymbols()).containsExactly(i);
        assertThat(clauses.sharedSymbols()).containsExactly(a, b);
        assertThat(new FortranWriter().write(task).lines().findFirst()).contains(
                "!$omp task private(ii,j), firstprivate(i), shared(a,b), "
                        + "depend(in: b(i + 32,:),b(i,:),k), depend(out: a(i,:))");
    }

    /**
     * Verifies that offsets that are exact step multiples give a single entry and that the
     * literal-first order of the source is kept.
     */
    @Test
    void exactMultipleKeepsLiteralFirstOrder() {
        // Arrange
        Assignment body = Assignment.create(
                ArrayReference.create(a, List.of(add(lit(64), new Reference(i)), lit(1))),
                ArrayReference.create(b, List.of(BinaryOperation.create(BinaryOperation.Operator.SUB,
                        new Reference(i), lit(32)), lit(1))));
        Loop task = loop(j, lit(1), lit(1), lit(1), body);
        Loop outer = loop(i, lit(1), lit(320), lit(32), task);
        Routine.create("work", new SymbolTable(), List.of(outer));

        // Act
        TaskClauses clauses = TaskClauseBuilder.forLoop(task);

        // Assert
        FortranWriter writer = new FortranWriter();
        assertThat(clauses.dependIn()).extracting(writer::write).containsExactly("b(i - 32,1)");
        assertThat(clauses.dependOut()).extracting(writer::write).containsExactly("a(2 * 32 + i,1)");
        assertThat(clauses.firstprivateSymbols()).containsExactly(i);
    }

    /**
     * Verifies that a scalar read only in loop bounds becomes firstprivate instead of a dependency.
     */
    @Test
    void boundOnlyScalarIsFirstprivate() {
        // Arrange
        DataSymbol n = new DataSymbol("n", ScalarType.INTEGER_TYPE);
        Assignment body = Assignment.create(ArrayReference.create(a, List.of(new Reference(i), lit(1))), lit(0));
        Loop task = loop(i, lit(1), new Reference(n), lit(1), body);
        Routine.create("work", new SymbolTable(), List.of(task));

        // Act
        TaskClauses clauses = TaskClauseBuilder.forLoop(task);

        // Assert
        assertThat(clauses.privateSymbols()).containsExactly(i);
        assertThat(clauses.firstprivateSymbols()).containsExactly(n);
        assertThat(clauses.sharedSymbols()).containsExactly(a);
        assertThat(clauses.dependIn()).isEmpty();
        assertThat(clauses.dependOut()).extracting(new FortranWriter()::write).containsExactly("a(:,1)");
    }

    /**
     * Verifies that a loop variable missing from the private list of the parallel region is rejected.
     */
    @Test
    void rejectsSharedLoopVariable() {
        // Arrange
        Assignment body = Assignment.create(ArrayReference.create(a, List.of(new Reference(i), new Reference(j))), lit(0));
        Loop inner = loop(j, lit(1), lit(10), lit(1), body);
        Loop outer = loop(i, lit(1), lit(10), lit(1), inner);
        ParallelDirective parallel = ParallelDirective.create();
        parallel.addToBody(List.of(outer));
        parallel.setPrivateSymbols(List.of(i));
        Routine.create("work", new SymbolTable(), List.of(parallel));

        // Act & Assert
        assertThatThrownBy(() -> new TaskTrans().apply(inner))
                .isInstanceOf(TransformationException.class)
                .hasMessage("Found shared loop variable which is not allowed in OpenMP Task directive. Variable name is j");
        assertThat(outer.getLoopBody().getChildren()).containsExactly(inner);
    }

    /**
     * Verifies the rejected index forms.
     */
    @Test
    void rejectsUnsupportedIndices() {
        // Act & Assert
        assertThatThrownBy(() -> TaskClauseBuilder.forLoop(nestWithIndex(
                BinaryOperation.create(BinaryOperation.Operator.MUL, lit(2), new Reference(i)))))
                .isInstanceOf(TransformationException.class)
                .hasMessage("Binary Operator of type MUL used as in index inside an OMPTaskDirective which is not supported");
        assertThatThrownBy(() -> TaskClauseBuilder.forLoop(nestWithIndex(add(new Reference(i), new Reference(k)))))
                .isInstanceOf(TransformationException.class)
                .hasMessage("Children of BinaryOperation are of types Reference and Reference, expected one Reference "
                        + "and one Literal when used as an index inside an OMPTaskDirective.");
        assertThatThrownBy(() -> TaskClauseBuilder.forLoop(nestWithIndex(new Reference(k))))
                .isInstanceOf(TransformationException.class)
                .hasMessage("Shared variable access used as an index inside an OMPTaskDirective which is not supported. "
                        + "Variable name is k");
        assertThatThrownBy(() -> TaskClauseBuilder.forLoop(nestWithIndex(
                ArrayReference.create(b, List.of(lit(1), lit(1))))))
                .isInstanceOf(TransformationException.class)
                .hasMessage("ArrayReference object is not allowed to appear in an Array Index expression inside an OMPTaskDirective.");
    }

    private Loop nestWithIndex(Node index) {
        Assignment body = Assignment.create(new Reference(k),
                ArrayReference.create(a, List.of(index, lit(1))));
        Loop task = loop(i, lit(1), lit(10), lit(1), body);
        Routine.create("work", new SymbolTable(), List.of(task));
        return task;
    }

    /**
     * Verifies the structural preconditions of tasks.
     */
    @Test
    void validatesTarget() {
        // Arrange
        Assignment assignment = Assignment.create(new Reference(k), lit(1));
        Routine.create("work", new SymbolTable(), List.of(assignment));
        Loop orphan = loop(i, lit(1), lit(10), lit(1));
        Loop badBound = loop(i, lit(1), ArrayReference.create(a, List.of(lit(1), lit(1))), lit(1));
        Routine.create("other", new SymbolTable(), List.of(badBound));
        TaskDirective twoLoops = TaskDirective.create();
        twoLoops.addToBody(List.of(loop(i, lit(1), lit(2), lit(1)), loop(j, lit(1), lit(2), lit(1))));

        // Act & Assert
        assertThatThrownBy(() -> new TaskTrans().validate(assignment))
                .isInstanceOf(TransformationException.class)
                .hasMessage("Error in TaskTrans: the target of a task must be a Loop but found 'Assignment'.");
        assertThatThrownBy(() -> new TaskTrans().validate(orphan))
                .isInstanceOf(TransformationException.class)
                .hasMessage("Error in TaskTrans: the loop over 'i' must have a parent.");
        assertThatThrownBy(() -> new TaskTrans().validate(badBound))
                .isInstanceOf(TransformationException.class)
                .hasMessage("ArrayReference not supported in the stop variable of a Loop in a OMPTaskDirective node.");
        assertThatThrownBy(() -> TaskClauseBuilder.forDirective(twoLoops))
                .isInstanceOf(TransformationException.class)
                .hasMessage("OMPTaskDirective must have exactly one Loop child.");
    }

    /**
     * Verifies that a task directive can be recomputed from its body.
     */
    @Test
    void recomputesClausesOfExistingTask() {
        // Arrange
        Loop tile = tiledNest();
        new TaskTrans().apply(tile);
        TaskDirective task = (TaskDirective) tile.getParent().getParent();

        // Act
        TaskClauses clauses = TaskClauseBuilder.forDirective(task);

        // Assert
        assertThat(clauses.privateSymbols()).isEqualTo(task.getClauses().privateSymbols());
        assertThat(clauses.sharedSymbols()).isEqualTo(task.getClauses().sharedSymbols());
        assertThat(task.getParent().getParent()).isInstanceOf(Loop.class);
        assertThat(task.ancestor(SingleDirective.class)).isEmpty();
    }
}
