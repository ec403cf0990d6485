package org.psyforge.compiler.transformations;

import org.psyforge.compiler.api.TransformationException;
import org.psyforge.compiler.config.LoopTypeMapping;
import org.psyforge.compiler.ir.Assignment;
import org.psyforge.compiler.ir.Literal;
import org.psyforge.compiler.ir.Loop;
import org.psyforge.compiler.ir.Reference;
import org.psyforge.compiler.ir.Routine;
import org.psyforge.compiler.ir.domain.KernelLoop;
import org.psyforge.compiler.ir.domain.KernelMarker;
import org.psyforge.compiler.symbols.DataSymbol;
import org.psyforge.compiler.symbols.ScalarType;
import org.psyforge.compiler.symbols.SymbolTable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LoopSpecializationTransTest {

    private final LoopTypeMapping mapping = new LoopTypeMapping(Map.of("JI", "lon", "jj", "lat"));

    /**
     * Verifies that every loop becomes a kernel loop typed by its variable and that only the
     * innermost body is marked as a kernel.
     */
    @Test
    void specialisesNestInnermostFirst() {
        // Arrange
        DataSymbol ji = new DataSymbol("ji", ScalarType.INTEGER_TYPE);
        DataSymbol jj = new DataSymbol("jj", ScalarType.INTEGER_TYPE);
        DataSymbol jt = new DataSymbol("jt", ScalarType.INTEGER_TYPE);
        DataSymbol x = new DataSymbol("x", ScalarType.REAL_TYPE);
        Assignment kernel = Assignment.create(new Reference(x), Literal.ofReal("1.0"));
        Loop inner = Loop.create(ji, Literal.ofInteger(1), Literal.ofInteger(4), Literal.ofInteger(1), List.of(kernel));
        Loop middle = Loop.create(jj, Literal.ofInteger(1), Literal.ofInteger(4), Literal.ofInteger(1), List.of(inner));
        Loop outer = Loop.create(jt, Literal.ofInteger(1), Literal.ofInteger(2), Literal.ofInteger(1), List.of(middle));
        Routine routine = Routine.create("work", new SymbolTable(), List.of(outer));

        // Act
        new LoopSpecializationTrans(mapping).apply(routine);

        // Assert
        List<KernelLoop> loops = routine.walk(KernelLoop.class);
        assertThat(loops).extracting(KernelLoop::getLoopType).containsExactly(KernelLoop.UNKNOWN, "lat", "lon");
        assertThat(routine.walk(Loop.class)).allMatch(KernelLoop.class::isInstance);
        List<KernelMarker> markers = routine.walk(KernelMarker.class);
        assertThat(markers).hasSize(1);
        assertThat(markers.get(0).getKernelBody().getChildren()).containsExactly(kernel);
        assertThat(markers.get(0).ancestor(KernelLoop.class))
                .hasValueSatisfying(loop -> assertThat(loop.getLoopType()).isEqualTo("lon"));
    }

    /**
     * Verifies that applying the transformation twice changes nothing the second time.
     */
    @Test
    void specialisedTreeIsStable() {
        // Arrange
        DataSymbol ji = new DataSymbol("ji", ScalarType.INTEGER_TYPE);
        DataSymbol x = new DataSymbol("x", ScalarType.REAL_TYPE);
        Loop loop = Loop.create(ji, Literal.ofInteger(1), Literal.ofInteger(4), Literal.ofInteger(1),
                List.of(Assignment.create(new Reference(x), Literal.ofReal("1.0"))));
        Routine routine = Routine.create("work", new SymbolTable(), List.of(loop));
        LoopSpecializationTrans trans = new LoopSpecializationTrans(mapping);
        trans.apply(routine);
        Routine before = (Routine) routine.copy();

        // Act
        trans.apply(routine);

        // Assert
        assertThat(routine.isStructurallyEqual(before)).isTrue();
        assertThat(routine.walk(KernelMarker.class)).hasSize(1);
    }

    /**
     * Verifies the rejected targets.
     */
    @Test
    void rejectsOrphanLoop() {
        // Arrange
        Loop orphan = Loop.create(new DataSymbol("ji", ScalarType.INTEGER_TYPE), Literal.ofInteger(1),
                Literal.ofInteger(4), Literal.ofInteger(1), List.of());
        LoopSpecializationTrans trans = new LoopSpecializationTrans(mapping);

        // Act & Assert
        assertThatThrownBy(() -> trans.apply(orphan))
                .isInstanceOf(TransformationException.class)
                .hasMessageStartingWith("Error in LoopSpecializationTrans: a loop can only be specialised inside a schedule");
        assertThatThrownBy(() -> trans.apply(null))
                .isInstanceOf(TransformationException.class)
                .hasMessage("Error in LoopSpecializationTrans: the target must not be null.");
    }
}
