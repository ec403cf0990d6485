package org.psyforge.compiler.transformations;

import org.psyforge.compiler.api.GenerationException;
import org.psyforge.compiler.api.TransformationException;
import org.psyforge.compiler.backend.FortranWriter;
import org.psyforge.compiler.config.LoopTypeMapping;
import org.psyforge.compiler.config.ProfilingOptions;
import org.psyforge.compiler.ir.Assignment;
import org.psyforge.compiler.ir.Call;
import org.psyforge.compiler.ir.CodeBlock;
import org.psyforge.compiler.ir.Container;
import org.psyforge.compiler.ir.Literal;
import org.psyforge.compiler.ir.Loop;
import org.psyforge.compiler.ir.Reference;
import org.psyforge.compiler.ir.Routine;
import org.psyforge.compiler.ir.directives.ProfileNode;
import org.psyforge.compiler.ir.domain.KernelLoop;
import org.psyforge.compiler.symbols.ContainerSymbol;
import org.psyforge.compiler.symbols.DataSymbol;
import org.psyforge.compiler.symbols.NameSpace;
import org.psyforge.compiler.symbols.RoutineSymbol;
import org.psyforge.compiler.symbols.ScalarType;
import org.psyforge.compiler.symbols.SymbolTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests profiling regions and their automatic insertion.
 */
@Tag("unit")
class ProfileTransTest {

    private DataSymbol x;
    private Call call;
    private Loop loop;
    private Routine routine;

    @BeforeEach
    void setUp() {
        x = new DataSymbol("x", ScalarType.REAL_TYPE);
        call = Call.create(new RoutineSymbol("compute_cu"), List.of(new Reference(x)));
        loop = Loop.create(new DataSymbol("ji", ScalarType.INTEGER_TYPE), Literal.ofInteger(1), Literal.ofInteger(4),
                Literal.ofInteger(1), List.of(Assignment.create(new Reference(x), Literal.ofReal("0.0"))));
        routine = Routine.create("invoke_0", new SymbolTable(), List.of(call, loop));
        Container module = Container.create("field_mod", new SymbolTable(), List.of(routine));
        Container.create("file", new SymbolTable(), List.of(module));
    }

    /**
     * Verifies the region names, the module name and the symbols the region needs.
     */
    @Test
    void enclosesStatementsInNamedRegion() {
        // Arrange
        ProfileTrans trans = new ProfileTrans(new NameSpace());

        // Act
        trans.apply(call);

        // Assert
        assertThat(routine.getChild(0)).isInstanceOfSatisfying(ProfileNode.class, region -> {
            assertThat(region.getModuleName()).isEqualTo("field_mod");
            assertThat(region.getRegionName()).isEqualTo("compute_cu");
            assertThat(region.getProfileVariable().getName()).isEqualTo("profile");
            assertThat(new FortranWriter().write(region)).isEqualTo("""
                    CALL ProfileStart("field_mod", "compute_cu", profile)
                    call compute_cu(x)
                    CALL ProfileEnd(profile)
                    """);
        });
        SymbolTable table = routine.getSymbolTable();
        assertThat(table.lookup(ProfileTrans.PROFILE_MODULE)).isInstanceOf(ContainerSymbol.class);
        assertThat(table.lookup(ProfileTrans.PROFILE_TYPE).isImport()).isTrue();
        assertThat(table.lookup(ProfileTrans.PROFILE_START)).isInstanceOf(RoutineSymbol.class);
        assertThat(table.lookup(ProfileTrans.PROFILE_END).isImport()).isTrue();
        assertThat(new FortranWriter().declaration((DataSymbol) table.lookup("profile")))
                .isEqualTo("type(ProfileData), save :: profile");
    }

    /**
     * Verifies that names stay unique across regions of one run and that the library symbols are
     * declared once.
     */
    @Test
    void secondRegionGetsFreshNames() {
        // Arrange
        NameSpace nameSpace = new NameSpace();
        new ProfileTrans(nameSpace).apply(call);

        // Act
        new ProfileTrans(nameSpace).apply(List.copyOf(routine.getChildren()));

        // Assert
        ProfileNode outer = (ProfileNode) routine.getChild(0);
        assertThat(routine.getChildCount()).isEqualTo(1);
        assertThat(outer.getRegionName()).isEqualTo("compute_cu_1");
        assertThat(outer.getProfileVariable().getName()).isEqualTo("profile_1");
        assertThat(outer.getDirBody().getChild(0)).isInstanceOf(ProfileNode.class);
        assertThat(routine.getSymbolTable().getSymbols())
                .filteredOn(symbol -> symbol.getName().equals(ProfileTrans.PROFILE_START))
                .hasSize(1);
    }

    /**
     * Verifies that an explicit region name wins and that unparsed code may be profiled.
     */
    @Test
    void namedRegionMayHoldCodeBlocks() {
        // Arrange
        CodeBlock block = new CodeBlock(List.of("print *, x"), CodeBlock.Structure.STATEMENT);
        routine.addChild(block);

        // Act
        new ProfileTrans(new NameSpace(), "Output").apply(block);

        // Assert
        assertThat(routine.getChild(2)).isInstanceOfSatisfying(ProfileNode.class,
                region -> assertThat(region.getRegionName()).isEqualTo("output"));
    }

    /**
     * Verifies that a region outside any routine is rejected.
     */
    @Test
    void rejectsRegionOutsideRoutine() {
        // Arrange
        Assignment statement = Assignment.create(new Reference(x), Literal.ofReal("1.0"));
        Loop.create(new DataSymbol("jj", ScalarType.INTEGER_TYPE), Literal.ofInteger(1), Literal.ofInteger(2),
                Literal.ofInteger(1), List.of(statement));

        // Act & Assert
        assertThatThrownBy(() -> new ProfileTrans(new NameSpace()).apply(statement))
                .isInstanceOf(TransformationException.class)
                .hasMessage("Error in ProfileTrans: a profiling region must be inside a Routine.");
    }

    /**
     * Verifies that kernel regions are added first and then enclosed by the routine region.
     */
    @Test
    void instrumenterAddsKernelAndInvokeRegions() {
        // Arrange
        new LoopSpecializationTrans(new LoopTypeMapping(Map.of("ji", "lon"))).apply(routine);
        ProfilingInstrumenter instrumenter = new ProfilingInstrumenter(
                new ProfilingOptions(List.of("Kernels", "invokes")), new NameSpace());

        // Act
        int regions = instrumenter.instrument(routine.root());

        // Assert
        assertThat(regions).isEqualTo(2);
        ProfileNode invoke = (ProfileNode) routine.getChild(0);
        assertThat(invoke.getRegionName()).isEqualTo("compute_cu");
        ProfileNode kernel = (ProfileNode) invoke.getDirBody().getChild(1);
        assertThat(kernel.getRegionName()).isEqualTo("invoke_0");
        assertThat(kernel.getDirBody().getChild(0)).isInstanceOf(KernelLoop.class);
    }

    /**
     * Verifies that unknown profiling options are rejected with their position.
     */
    @Test
    void rejectsUnknownOption() {
        // Act & Assert
        assertThatThrownBy(() -> new ProfilingOptions(List.of("invokes", "loops")))
                .isInstanceOf(GenerationException.class)
                .hasMessage("Error in Profiler.set_options: options must be one of [invokes, kernels] but found 'loops' at index 1");
        assertThat(ProfilingOptions.none().invokes()).isFalse();
    }
}
