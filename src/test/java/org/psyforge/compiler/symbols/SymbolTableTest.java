package org.psyforge.compiler.symbols;

import org.psyforge.compiler.api.GenerationException;
import org.psyforge.compiler.api.SymbolNotFoundException;
import org.psyforge.compiler.ir.Assignment;
import org.psyforge.compiler.ir.Container;
import org.psyforge.compiler.ir.Literal;
import org.psyforge.compiler.ir.Reference;
import org.psyforge.compiler.ir.Routine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests name handling, scoping and the removal rules of {@link SymbolTable}.
 */
@Tag("unit")
class SymbolTableTest {

    /**
     * Verifies that names are case-insensitive and cannot be declared twice in one scope.
     */
    @Test
    void addRejectsDuplicateNamesIgnoringCase() {
        // Arrange
        SymbolTable table = new SymbolTable();
        table.add(new DataSymbol("Field", ScalarType.REAL_TYPE));

        // Act & Assert
        assertThat(table.lookup("FIELD").getName()).isEqualTo("Field");
        assertThatThrownBy(() -> table.add(new DataSymbol("field", ScalarType.INTEGER_TYPE)))
                .isInstanceOf(GenerationException.class)
                .hasMessage("Symbol table already contains a symbol with name 'field'.");
    }

    /**
     * Verifies that lookups continue in the table of the enclosing scope and fail with a
     * dedicated exception when no scope declares the name.
     */
    @Test
    void lookupFallsBackToEnclosingScope() {
        // Arrange
        Container module = new Container("my_mod");
        DataSymbol global = new DataSymbol("global", ScalarType.REAL_TYPE);
        module.getSymbolTable().add(global);
        Routine routine = new Routine("work");
        module.addChild(routine);
        SymbolTable inner = routine.getSymbolTable();

        // Act & Assert
        assertThat(inner.lookup("global")).isSameAs(global);
        assertThat(inner.resolve("GLOBAL")).containsSame(global);
        assertThat(inner.lookupLocal("global")).isEmpty();
        assertThat(inner.getParentSymbolTable()).containsSame(module.getSymbolTable());
        assertThatThrownBy(() -> inner.lookup("missing"))
                .isInstanceOf(SymbolNotFoundException.class)
                .hasMessage("Could not find 'missing' in the Symbol Table.");
    }

    /**
     * Verifies that a scope limit stops the search before the enclosing scope.
     */
    @Test
    void lookupHonoursScopeLimit() {
        // Arrange
        Container module = new Container("my_mod");
        module.getSymbolTable().add(new DataSymbol("global", ScalarType.REAL_TYPE));
        Routine routine = new Routine("work");
        module.addChild(routine);
        SymbolTable inner = routine.getSymbolTable();

        // Act & Assert
        assertThatThrownBy(() -> inner.lookup("global", inner)).isInstanceOf(SymbolNotFoundException.class);
    }

    /**
     * Verifies that a fresh name skips every name visible from the scope.
     */
    @Test
    void nextAvailableNameAvoidsVisibleNames() {
        // Arrange
        Container module = new Container("my_mod");
        module.getSymbolTable().add(new DataSymbol("tmp", ScalarType.REAL_TYPE));
        Routine routine = new Routine("work");
        module.addChild(routine);
        routine.getSymbolTable().add(new DataSymbol("tmp_1", ScalarType.REAL_TYPE));

        // Act
        String name = routine.getSymbolTable().nextAvailableName("tmp");

        // Assert
        assertThat(name).isEqualTo("tmp_2");
        assertThat(routine.getSymbolTable().nextAvailableName("free")).isEqualTo("free");
    }

    /**
     * Verifies that a symbol still referenced by the IR of its scope cannot be removed.
     */
    @Test
    void removeRejectsReferencedSymbol() {
        // Arrange
        DataSymbol used = new DataSymbol("used", ScalarType.REAL_TYPE);
        DataSymbol unused = new DataSymbol("unused", ScalarType.REAL_TYPE);
        SymbolTable table = new SymbolTable();
        table.add(used);
        table.add(unused);
        Routine.create("work", table, List.of(Assignment.create(new Reference(used), Literal.ofReal("1.0"))));

        // Act
        table.remove(unused);

        // Assert
        assertThat(table.contains("unused")).isFalse();
        assertThatThrownBy(() -> table.remove(used))
                .isInstanceOf(GenerationException.class)
                .hasMessage("Cannot remove Symbol 'used' because it is still referenced in the scope.");
    }

    /**
     * Verifies that arguments and modules with remaining imports are protected from removal.
     */
    @Test
    void removeRejectsArgumentsAndUsedContainers() {
        // Arrange
        SymbolTable table = new SymbolTable();
        DataSymbol argument = new DataSymbol("a", ScalarType.REAL_TYPE,
                new ArgumentInterface(ArgumentInterface.Access.READ));
        ContainerSymbol module = new ContainerSymbol("constants_mod");
        DataSymbol imported = new DataSymbol("pi", ScalarType.REAL_TYPE, new ImportInterface(module));
        table.add(argument);
        table.add(module);
        table.add(imported);
        table.setArgumentList(List.of(argument));

        // Act & Assert
        assertThatThrownBy(() -> table.remove(argument))
                .isInstanceOf(GenerationException.class)
                .hasMessage("Cannot remove Symbol 'a' because it is a routine argument.");
        assertThatThrownBy(() -> table.remove(module))
                .isInstanceOf(GenerationException.class)
                .hasMessageStartingWith("Cannot remove ContainerSymbol 'constants_mod'");
        assertThatThrownBy(() -> table.remove(new DataSymbol("ghost", ScalarType.REAL_TYPE)))
                .isInstanceOf(GenerationException.class)
                .hasMessage("Cannot remove Symbol 'ghost' from symbol table because it does not exist.");
        assertThat(table.importsFrom(module)).containsExactly(imported);
    }

    /**
     * Verifies that renaming keeps the declaration order and updates the lookup key.
     */
    @Test
    void renameKeepsOrder() {
        // Arrange
        SymbolTable table = new SymbolTable();
        DataSymbol first = new DataSymbol("first", ScalarType.REAL_TYPE);
        DataSymbol second = new DataSymbol("second", ScalarType.REAL_TYPE);
        table.add(first);
        table.add(second);

        // Act
        table.rename(first, "renamed");

        // Assert
        assertThat(table.getSymbols()).containsExactly(first, second);
        assertThat(table.lookup("renamed")).isSameAs(first);
        assertThat(table.contains("first")).isFalse();
        assertThatThrownBy(() -> table.rename(second, "RENAMED"))
                .isInstanceOf(GenerationException.class)
                .hasMessage("The name 'RENAMED' is already in use in this symbol table.");
    }

    /**
     * Verifies that only symbols with an argument interface can form the argument list.
     */
    @Test
    void argumentListRequiresArgumentInterface() {
        // Arrange
        SymbolTable table = new SymbolTable();
        DataSymbol local = new DataSymbol("local", ScalarType.REAL_TYPE);
        table.add(local);

        // Act & Assert
        assertThatThrownBy(() -> table.setArgumentList(List.of(local)))
                .isInstanceOf(GenerationException.class)
                .hasMessageStartingWith("Symbol 'local' is listed as a routine argument");
        assertThat(table.getArgumentList()).isEmpty();
        assertThat(table.getLocalDataSymbols()).containsExactly(local);
    }

    /**
     * Verifies that a table can only be owned by one node.
     */
    @Test
    void tableCannotBeAttachedTwice() {
        // Arrange
        SymbolTable table = new SymbolTable();
        new Routine("first", table, false);

        // Act & Assert
        assertThatThrownBy(() -> new Routine("second", table, false))
                .isInstanceOf(GenerationException.class)
                .hasMessage("The symbol table is already bound to a 'Routine' node.");
    }

    /**
     * Verifies that a replaced symbol keeps its place and that the replacement must have the same name.
     */
    @Test
    void replaceKeepsDeclarationOrder() {
        // Arrange
        SymbolTable table = new SymbolTable();
        TypeSymbol grid = new TypeSymbol("grid", new UnsupportedType("type :: grid\nend type grid"));
        DataSymbol n = new DataSymbol("n", ScalarType.INTEGER_TYPE);
        table.add(grid);
        table.add(n);
        TypeSymbol replacement = new TypeSymbol("GRID", new UnsupportedType("type :: GRID\nend type GRID"));

        // Act
        table.replace(grid, replacement);

        // Assert
        assertThat(table.getSymbols()).containsExactly(replacement, n);
        assertThatThrownBy(() -> table.replace(grid, replacement))
                .isInstanceOf(GenerationException.class)
                .hasMessage("The symbol 'grid' must belong to this symbol table to be replaced.");
        assertThatThrownBy(() -> table.replace(n, new DataSymbol("m", ScalarType.INTEGER_TYPE)))
                .isInstanceOf(GenerationException.class)
                .hasMessage("Cannot replace Symbol 'n' by a symbol with the different name 'm'.");
    }
}
