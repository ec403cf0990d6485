package org.psyforge.compiler.symbols;

import org.psyforge.compiler.api.GenerationException;
import org.psyforge.compiler.ir.BinaryOperation;
import org.psyforge.compiler.ir.Literal;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the data types and the constraints of {@link DataSymbol}.
 */
@Tag("unit")
class DataSymbolTest {

    /**
     * Verifies that shape queries follow the datatype.
     */
    @Test
    void shapeFollowsDatatype() {
        // Arrange
        DataSymbol n = new DataSymbol("n", ScalarType.INTEGER_TYPE);
        DataSymbol field = new DataSymbol("field",
                new ArrayType(ScalarType.REAL8_TYPE, List.of(new LiteralExtent(10), new SymbolExtent(n))));

        // Act & Assert
        assertThat(n.isScalar()).isTrue();
        assertThat(n.getRank()).isZero();
        assertThat(field.isArray()).isTrue();
        assertThat(field.getRank()).isEqualTo(2);
        assertThat(field.getShape()).containsExactly(new LiteralExtent(10), new SymbolExtent(n));
    }

    /**
     * Verifies that a constant needs an initial value and that the value must be an orphan.
     */
    @Test
    void initialValueRules() {
        // Arrange
        DataSymbol pi = new DataSymbol("pi", ScalarType.REAL_TYPE);
        Literal attached = Literal.ofInteger(1);
        BinaryOperation.create(BinaryOperation.Operator.ADD, attached, Literal.ofInteger(2));

        // Act
        pi.setInitialValue(Literal.ofReal("3.14"), true);

        // Assert
        assertThat(pi.isConstant()).isTrue();
        assertThat(((Literal) pi.getInitialValue()).getValue()).isEqualTo("3.14");
        assertThatThrownBy(() -> pi.setInitialValue(null, true))
                .isInstanceOf(GenerationException.class)
                .hasMessage("DataSymbol 'pi' is a constant and therefore requires an initial value.");
        assertThatThrownBy(() -> pi.setInitialValue(attached, false))
                .isInstanceOf(GenerationException.class)
                .hasMessage("The initial value of DataSymbol 'pi' must be an orphan node, but it has a 'BinaryOperation' parent.");
    }

    /**
     * Verifies that scalar types compare by kind and precision.
     */
    @Test
    void scalarTypeEquality() {
        // Arrange
        DataSymbol rDef = new DataSymbol("r_def", ScalarType.INTEGER_TYPE);

        // Act & Assert
        assertThat(new ScalarType(ScalarType.Intrinsic.REAL, 8)).isEqualTo(ScalarType.REAL8_TYPE);
        assertThat(new ScalarType(ScalarType.Intrinsic.REAL, rDef))
                .isEqualTo(new ScalarType(ScalarType.Intrinsic.REAL, new SymbolPrecision(rDef)))
                .isNotEqualTo(ScalarType.REAL_TYPE);
        assertThat(ScalarType.BOOLEAN_TYPE.getIntrinsic().fortranName()).isEqualTo("logical");
    }

    /**
     * Verifies that invalid precisions, extents and element types are rejected.
     */
    @Test
    void rejectsInvalidTypeArguments() {
        // Arrange
        DataSymbol realKind = new DataSymbol("wp", ScalarType.REAL_TYPE);

        // Act & Assert
        assertThatThrownBy(() -> new BytePrecision(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive integer but found '0'");
        assertThatThrownBy(() -> new SymbolPrecision(realKind))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("A DataSymbol representing the precision");
        assertThatThrownBy(() -> new LiteralExtent(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ArrayType(ScalarType.REAL_TYPE, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        ArrayType inner = new ArrayType(ScalarType.REAL_TYPE, List.of(ArrayType.Extent.DEFERRED));
        assertThatThrownBy(() -> new ArrayType(inner, List.of(new LiteralExtent(2))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Verifies the mapping between Fortran intents and argument accesses.
     */
    @Test
    void intentMapping() {
        // Act & Assert
        assertThat(ArgumentInterface.Access.fromIntent("IN")).isEqualTo(ArgumentInterface.Access.READ);
        assertThat(ArgumentInterface.Access.fromIntent("in out")).isEqualTo(ArgumentInterface.Access.READWRITE);
        assertThat(ArgumentInterface.Access.WRITE.intent()).isEqualTo("out");
        assertThatThrownBy(() -> ArgumentInterface.Access.fromIntent("sideways"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown intent 'sideways'.");
    }

    /**
     * Verifies that copying a type gives an equal but distinct object.
     */
    @Test
    void typeCopyIsEqualButDistinct() {
        // Arrange
        DataSymbol wp = new DataSymbol("wp", ScalarType.INTEGER_TYPE);
        ScalarType scalar = new ScalarType(ScalarType.Intrinsic.REAL, new SymbolPrecision(wp));
        ArrayType array = new ArrayType(scalar, List.of(new LiteralExtent(4), ArrayType.Extent.DEFERRED));

        // Act
        ScalarType scalarCopy = scalar.copy();
        ArrayType arrayCopy = array.copy();

        // Assert
        assertThat(scalarCopy).isEqualTo(scalar).isNotSameAs(scalar).hasSameHashCodeAs(scalar);
        assertThat(arrayCopy).isEqualTo(array).isNotSameAs(array);
        assertThat(arrayCopy.getElementType()).isEqualTo(scalar).isNotSameAs(scalar);
    }

    /**
     * Verifies that the name space hands out each name once and respects reserved names.
     */
    @Test
    void nameSpaceCreatesUniqueNames() {
        // Arrange
        NameSpace nameSpace = new NameSpace();
        nameSpace.reserve("Profile_PSy_Data");

        // Act
        String first = nameSpace.createName("profile_psy_data");
        String second = nameSpace.createName("PROFILE_PSY_DATA");

        // Assert
        assertThat(first).isEqualTo("profile_psy_data_1");
        assertThat(second).isEqualTo("profile_psy_data_2");
        assertThat(nameSpace.reserve("profile_psy_data_1")).isFalse();
        assertThat(nameSpace.createName("region")).isEqualTo("region");
    }
}
