package org.psyforge.compiler.metadata;

import com.typesafe.config.ConfigFactory;
import org.psyforge.compiler.api.MetadataParseException;
import org.psyforge.compiler.config.CompilerConfig;
import org.psyforge.compiler.diagnostics.DiagnosticsEngine;
import org.psyforge.compiler.frontend.FortranReader;
import org.psyforge.compiler.ir.Container;
import org.psyforge.compiler.symbols.Symbol;
import org.psyforge.compiler.symbols.SymbolTable;
import org.psyforge.compiler.symbols.TypeSymbol;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests finding kernel metadata types in a tree read from source.
 */
@Tag("unit")
class KernelMetadataExtractorTest {

    static final String KERNEL_MODULE = """
            module compute_cu_mod
              use kind_params_mod, only: go_wp
              implicit none
              type :: cell_info
                 integer :: count
              end type cell_info
              type, extends(kernel_type) :: compute_cu
                 type(go_arg), dimension(2) :: meta_args = &
                      (/ go_arg(GO_WRITE, GO_CU, GO_POINTWISE), &
                         go_arg(GO_READ, GO_GRID_AREA_T) /)
                 integer :: ITERATES_OVER = GO_ALL_PTS
                 integer :: index_offset = GO_OFFSET_SW
              contains
                 procedure, nopass :: code => compute_cu_code
              end type compute_cu
            contains
              subroutine compute_cu_code(i, j, cu)
                integer, intent(in) :: i, j
                real(go_wp), intent(inout), dimension(:,:) :: cu
                cu(i, j) = 0.0
              end subroutine compute_cu_code
            end module compute_cu_mod
            """;

    private KernelMetadataExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new KernelMetadataExtractor(
                MetadataVocabulary.fromConfig(CompilerConfig.fromConfig(ConfigFactory.empty()), "gocean"));
    }

    private static Container read(String source) {
        return new FortranReader(new DiagnosticsEngine()).psyirFromSource(source);
    }

    /**
     * Verifies that only the type extending {@code kernel_type} is replaced, in place.
     */
    @Test
    void replacesKernelTypeInPlace() {
        // Arrange
        Container file = read(KERNEL_MODULE);
        SymbolTable table = ((Container) file.getChild(0)).getSymbolTable();

        // Act
        List<KernelMetadataSymbol> extracted = extractor.extract(file);

        // Assert
        assertThat(extracted).singleElement().satisfies(symbol -> {
            assertThat(symbol.getName()).isEqualTo("compute_cu");
            assertThat(symbol.iteratesOver()).isEqualTo("go_all_pts");
            assertThat(symbol.procedureName()).isEqualTo("compute_cu_code");
            assertThat(symbol.arguments()).containsExactly(
                    new FieldArgument("go_write", "go_cu", Stencil.named("go_pointwise")),
                    new GridPropertyArgument("go_read", "go_grid_area_t"));
        });
        assertThat(table.lookup("compute_cu")).isSameAs(extracted.get(0));
        assertThat(table.lookup("cell_info")).isExactlyInstanceOf(TypeSymbol.class);
        assertThat(table.getSymbols()).extracting(Symbol::getName)
                .containsSubsequence("cell_info", "compute_cu");
    }

    /**
     * Verifies that a second pass over the same tree finds nothing new.
     */
    @Test
    void extractingTwiceKeepsSymbols() {
        // Arrange
        Container file = read(KERNEL_MODULE);
        KernelMetadataSymbol first = extractor.extract(file).get(0);

        // Act
        List<KernelMetadataSymbol> second = extractor.extract(file);

        // Assert
        assertThat(second).isEmpty();
        assertThat(((Container) file.getChild(0)).getSymbolTable().lookup("compute_cu")).isSameAs(first);
    }

    /**
     * Verifies that invalid metadata in the source is reported as a metadata error.
     */
    @Test
    void reportsInvalidMetadata() {
        // Arrange
        Container file = read(KERNEL_MODULE.replace("GO_OFFSET_SW", "GO_OFFSET_UP"));

        // Act & Assert
        assertThatThrownBy(() -> extractor.extract(file))
                .isInstanceOf(MetadataParseException.class)
                .hasMessageContaining("index_offset")
                .hasMessageContaining("GO_OFFSET_UP");
    }

    /**
     * Verifies the recognition of the extended type.
     */
    @Test
    void recognisesKernelTypeDeclarations() {
        // Act & Assert
        assertThat(KernelMetadataExtractor.isKernelMetadata("TYPE, EXTENDS( Kernel_Type ) :: k")).isTrue();
        assertThat(KernelMetadataExtractor.isKernelMetadata("type, public, extends(kernel_type) :: k")).isTrue();
        assertThat(KernelMetadataExtractor.isKernelMetadata("type, extends(base_type) :: k")).isFalse();
        assertThat(KernelMetadataExtractor.isKernelMetadata("type :: kernel_type")).isFalse();
    }
}
