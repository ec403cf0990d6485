package org.psyforge.compiler.metadata;

import com.typesafe.config.ConfigFactory;
import org.psyforge.compiler.api.MetadataParseException;
import org.psyforge.compiler.config.CompilerConfig;
import org.psyforge.compiler.symbols.UnsupportedType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests parsing, validation and text-preserving editing of kernel metadata.
 */
@Tag("unit")
class KernelMetadataTest {

    private static final String COMPUTE_CU = """
            type, extends(kernel_type) :: compute_cu
               type(go_arg), dimension(3) :: meta_args =        &
                    (/ go_arg(GO_WRITE, GO_CU, GO_POINTWISE),    &
                       go_arg(GO_READ,  GO_CT, GO_STENCIL(000,011,000)), &
                       go_arg(GO_READ,  GO_GRID_AREA_T) /)
               integer :: ITERATES_OVER = GO_ALL_PTS
               integer :: index_offset = GO_OFFSET_SW
            contains
               procedure, nopass :: code => compute_cu_code
            end type compute_cu""";

    private MetadataVocabulary gocean;

    @BeforeEach
    void setUp() {
        gocean = MetadataVocabulary.fromConfig(CompilerConfig.fromConfig(ConfigFactory.empty()), "gocean");
    }

    /**
     * Verifies that a complete declaration is parsed into lower-case values and argument descriptors
     * whose category follows from the number of entries.
     */
    @Test
    void parsesArgumentsAndProperties() {
        // Act
        KernelMetadata metadata = KernelMetadata.parse(COMPUTE_CU, gocean);

        // Assert
        assertThat(metadata.name()).isEqualTo("compute_cu");
        assertThat(metadata.iteratesOver()).isEqualTo("go_all_pts");
        assertThat(metadata.indexOffset()).isEqualTo("go_offset_sw");
        assertThat(metadata.procedureName()).isEqualTo("compute_cu_code");
        assertThat(metadata.arguments()).hasSize(3);
        assertThat(metadata.arguments().get(0)).isEqualTo(new FieldArgument("go_write", "go_cu", Stencil.named("go_pointwise")));
        assertThat(metadata.arguments().get(1)).isInstanceOfSatisfying(FieldArgument.class,
                field -> assertThat(field.stencil().rows()).containsExactly("000", "011", "000"));
        assertThat(metadata.arguments().get(2)).isEqualTo(new GridPropertyArgument("go_read", "go_grid_area_t"));
    }

    /**
     * Verifies that rendering unchanged metadata reproduces the declaration byte for byte.
     */
    @Test
    void unchangedMetadataRendersOriginalText() {
        // Arrange
        KernelMetadata metadata = KernelMetadata.parse(COMPUTE_CU, gocean);

        // Act
        String text = metadata.toFortranString();

        // Assert
        assertThat(text).isEqualTo(COMPUTE_CU);
    }

    /**
     * Verifies that a setter only changes the edited value in the rendered text.
     */
    @Test
    void setterSplicesNewValueIntoText() {
        // Arrange
        KernelMetadata metadata = KernelMetadata.parse(COMPUTE_CU, gocean);

        // Act
        metadata.setIteratesOver("GO_INTERNAL_PTS");
        metadata.setProcedureName("new_code");

        // Assert
        assertThat(metadata.iteratesOver()).isEqualTo("go_internal_pts");
        assertThat(metadata.toFortranString())
                .isEqualTo(COMPUTE_CU.replace("GO_ALL_PTS", "go_internal_pts").replace("compute_cu_code", "new_code"));
    }

    /**
     * Verifies that replacing the arguments also updates the declared dimension.
     */
    @Test
    void setArgumentsUpdatesDimension() {
        // Arrange
        KernelMetadata metadata = KernelMetadata.parse(COMPUTE_CU, gocean);

        // Act
        metadata.setArguments(List.of(new GridPropertyArgument("go_read", "go_grid_dx_t")));

        // Assert
        assertThat(metadata.toFortranString()).contains("dimension(1)");
        KernelMetadata reparsed = KernelMetadata.parse(metadata.toFortranString(), gocean);
        assertThat(reparsed.arguments()).containsExactly(new GridPropertyArgument("go_read", "go_grid_dx_t"));
    }

    /**
     * Verifies that a value outside the vocabulary is rejected with the ordinal and the allowed set.
     */
    @Test
    void rejectsUnknownFunctionSpace() {
        // Arrange
        String declaration = COMPUTE_CU.replace("GO_CU,", "GO_XX,");

        // Act & Assert
        assertThatThrownBy(() -> KernelMetadata.parse(declaration, gocean))
                .isInstanceOf(MetadataParseException.class)
                .hasMessage("The second metadata entry for an argument should be a recognised function space (one of "
                        + "['go_cu', 'go_cv', 'go_ct', 'go_cf', 'go_every']), but found 'GO_XX'.");
    }

    /**
     * Verifies that an argument with an unsupported number of entries is rejected.
     */
    @Test
    void rejectsWrongEntryCount() {
        // Arrange
        String declaration = COMPUTE_CU.replace("go_arg(GO_READ,  GO_GRID_AREA_T)",
                "go_arg(GO_READ, GO_CT, GO_POINTWISE, GO_CT)");

        // Act & Assert
        assertThatThrownBy(() -> KernelMetadata.parse(declaration, gocean))
                .isInstanceOf(MetadataParseException.class)
                .hasMessageStartingWith("Expected kernel metadata argument to have 2, 3 or 5 entries, but found 4");
    }

    /**
     * Verifies that a missing iteration space is reported by name.
     */
    @Test
    void rejectsMissingIteratesOver() {
        // Arrange
        String declaration = COMPUTE_CU.replace("   integer :: ITERATES_OVER = GO_ALL_PTS\n", "");

        // Act & Assert
        assertThatThrownBy(() -> KernelMetadata.parse(declaration, gocean))
                .isInstanceOf(MetadataParseException.class)
                .hasMessageStartingWith("Expecting 'iterates_over' to be an entry in the metadata but it was not found in");
    }

    /**
     * Verifies that a missing argument list or index offset is reported by name.
     */
    @Test
    void rejectsMissingSections() {
        // Arrange
        String noArguments = COMPUTE_CU.substring(0, COMPUTE_CU.indexOf("   type(go_arg)"))
                + COMPUTE_CU.substring(COMPUTE_CU.indexOf("   integer :: ITERATES_OVER"));
        String noOffset = COMPUTE_CU.replace("   integer :: index_offset = GO_OFFSET_SW\n", "");

        // Act & Assert
        assertThatThrownBy(() -> KernelMetadata.parse(noArguments, gocean))
                .isInstanceOf(MetadataParseException.class)
                .hasMessageStartingWith("Expecting 'meta_args' to be an entry in the metadata but it was not found in");
        assertThatThrownBy(() -> KernelMetadata.parse(noOffset, gocean))
                .isInstanceOf(MetadataParseException.class)
                .hasMessageStartingWith("Expecting 'index_offset' to be an entry in the metadata but it was not found in");
    }

    /**
     * Verifies that each section may only be given once.
     */
    @Test
    void rejectsDuplicateSections() {
        // Arrange
        String twoArgumentLists = COMPUTE_CU.replace("   integer :: ITERATES_OVER",
                "   type(go_arg), dimension(1) :: meta_args = (/ go_arg(GO_READ, GO_GRID_DX_T) /)\n"
                        + "   integer :: ITERATES_OVER");
        String twoSpaces = COMPUTE_CU.replace("   integer :: index_offset",
                "   integer :: iterates_over = GO_INTERNAL_PTS\n   integer :: index_offset");
        String twoOffsets = COMPUTE_CU.replace("contains",
                "   integer :: index_offset = GO_OFFSET_NE\ncontains");

        // Act & Assert
        assertThatThrownBy(() -> KernelMetadata.parse(twoArgumentLists, gocean))
                .isInstanceOf(MetadataParseException.class)
                .hasMessageStartingWith("'meta_args' should only be defined once in the metadata, but found");
        assertThatThrownBy(() -> KernelMetadata.parse(twoSpaces, gocean))
                .isInstanceOf(MetadataParseException.class)
                .hasMessageStartingWith("'iterates_over' should only be defined once in the metadata, but found");
        assertThatThrownBy(() -> KernelMetadata.parse(twoOffsets, gocean))
                .isInstanceOf(MetadataParseException.class)
                .hasMessageStartingWith("'index_offset' should only be defined once in the metadata, but found");
    }

    /**
     * Verifies that an explicit stencil needs exactly three rows of three binary characters.
     */
    @Test
    void rejectsMalformedStencils() {
        // Arrange
        String badRow = COMPUTE_CU.replace("GO_STENCIL(000,011,000)", "GO_STENCIL(000,012,000)");
        String shortRow = COMPUTE_CU.replace("GO_STENCIL(000,011,000)", "GO_STENCIL(000,0110,000)");
        String twoRows = COMPUTE_CU.replace("GO_STENCIL(000,011,000)", "GO_STENCIL(000,011)");

        // Act & Assert
        assertThatThrownBy(() -> KernelMetadata.parse(badRow, gocean))
                .isInstanceOf(MetadataParseException.class)
                .hasMessage("Stencil entries must be 3 characters drawn from '0' or '1' but found '012'.");
        assertThatThrownBy(() -> KernelMetadata.parse(shortRow, gocean))
                .isInstanceOf(MetadataParseException.class)
                .hasMessage("Stencil entries must be 3 characters drawn from '0' or '1' but found '0110'.");
        assertThatThrownBy(() -> KernelMetadata.parse(twoRows, gocean))
                .isInstanceOf(MetadataParseException.class)
                .hasMessage("Expected 3 stencil entries in 'go_stencil(000,011)' but found 2.");
    }

    /**
     * Verifies that only one procedure may be bound after {@code contains}.
     */
    @Test
    void rejectsSeveralBindings() {
        // Arrange
        String declaration = COMPUTE_CU.replace("=> compute_cu_code\n",
                "=> compute_cu_code\n   procedure, nopass :: other => other_code\n");

        // Act & Assert
        assertThatThrownBy(() -> KernelMetadata.parse(declaration, gocean))
                .isInstanceOf(MetadataParseException.class)
                .hasMessage("Expecting a single entry after the 'contains' keyword but found 2.");
    }

    /**
     * Verifies that a dimension too large for an integer is a metadata error.
     */
    @Test
    void rejectsOversizedDimension() {
        // Arrange
        String declaration = COMPUTE_CU.replace("dimension(3)", "dimension(99999999999)");

        // Act & Assert
        assertThatThrownBy(() -> KernelMetadata.parse(declaration, gocean))
                .isInstanceOf(MetadataParseException.class)
                .hasMessage("The dimension of 'meta_args' must be an integer that fits in 32 bits but found '99999999999'.")
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    /**
     * Verifies that a field vector size too large for an integer is a metadata error.
     */
    @Test
    void rejectsOversizedVectorSize() {
        // Arrange
        String declaration = COMPUTE_CU.replace("GO_CU,", "GO_CU*99999999999,");

        // Act & Assert
        assertThatThrownBy(() -> KernelMetadata.parse(declaration, gocean))
                .isInstanceOf(MetadataParseException.class)
                .hasMessageStartingWith("The vector size in 'GO_CU*99999999999' must be an integer")
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    /**
     * Verifies that a dimension that disagrees with the argument count is rejected.
     */
    @Test
    void rejectsDimensionMismatch() {
        // Arrange
        String declaration = COMPUTE_CU.replace("dimension(3)", "dimension(2)");

        // Act & Assert
        assertThatThrownBy(() -> KernelMetadata.parse(declaration, gocean))
                .isInstanceOf(MetadataParseException.class)
                .hasMessage("The dimension of 'meta_args' is 2 but 3 arguments were found.");
    }

    /**
     * Verifies that metadata without a procedure binding is rejected.
     */
    @Test
    void rejectsMissingContains() {
        // Arrange
        String declaration = COMPUTE_CU.replace("contains\n   procedure, nopass :: code => compute_cu_code\n", "");

        // Act & Assert
        assertThatThrownBy(() -> KernelMetadata.parse(declaration, gocean))
                .isInstanceOf(MetadataParseException.class)
                .hasMessageStartingWith("The metadata does not have a contains keyword");
    }

    /**
     * Verifies that setters validate before mutating.
     */
    @Test
    void invalidSetterValueLeavesMetadataUnchanged() {
        // Arrange
        KernelMetadata metadata = KernelMetadata.parse(COMPUTE_CU, gocean);

        // Act & Assert
        assertThatThrownBy(() -> metadata.setIndexOffset("go_offset_up"))
                .isInstanceOf(MetadataParseException.class)
                .hasMessageContaining("index_offset");
        assertThat(metadata.indexOffset()).isEqualTo("go_offset_sw");
        assertThat(metadata.toFortranString()).isEqualTo(COMPUTE_CU);
    }

    /**
     * Verifies that the symbol of a metadata type always carries the current declaration text.
     */
    @Test
    void symbolTracksEdits() {
        // Arrange
        KernelMetadataSymbol symbol = KernelMetadataSymbol.fromDeclaration(COMPUTE_CU, gocean);

        // Act
        symbol.setIndexOffset("go_offset_ne");

        // Assert
        assertThat(symbol.getName()).isEqualTo("compute_cu");
        assertThat(symbol.getDatatype()).isInstanceOfSatisfying(UnsupportedType.class,
                type -> assertThat(type.declaration()).contains("go_offset_ne"));
    }
}
