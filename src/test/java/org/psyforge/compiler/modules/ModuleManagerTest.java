package org.psyforge.compiler.modules;

import org.psyforge.compiler.api.GenerationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests module lookup and dependency ordering over temporary source directories.
 */
@Tag("unit")
class ModuleManagerTest {

    @TempDir
    Path sources;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(sources.resolve("a_mod.f90"), """
                module a_mod
                  use b_mod, only: x
                  use c_mod
                  implicit none
                end module a_mod
                """);
        Files.writeString(sources.resolve("B_Mod.F90"), """
                module b_mod
                  use c_mod, only: y
                  implicit none
                end module b_mod
                """);
        Files.writeString(sources.resolve("c_mod.f90"), """
                module c_mod
                  use external_mod
                  implicit none
                end module c_mod
                """);
        Files.writeString(sources.resolve("notes.txt"), "not a module");
    }

    /**
     * Verifies that lookup ignores case and that other files are not taken for modules.
     */
    @Test
    void findsModulesCaseInsensitively() throws IOException {
        // Arrange
        ModuleManager manager = new ModuleManager(List.of(sources));

        // Act
        ModuleInfo info = manager.getModuleInfo("B_MOD");

        // Assert
        assertThat(info.getName()).isEqualTo("b_mod");
        assertThat(info.getFile()).isEqualTo(sources.resolve("B_Mod.F90"));
        assertThat(manager.findModuleInfo("notes")).isEmpty();
    }

    /**
     * Verifies the message for a module without a source file.
     */
    @Test
    void reportsMissingModule(@TempDir Path other) {
        // Arrange
        ModuleManager manager = new ModuleManager(List.of(sources, other));

        // Act & Assert
        assertThatThrownBy(() -> manager.getModuleInfo("missing_mod"))
                .isInstanceOf(FileNotFoundException.class)
                .hasMessage("Could not find source file for module 'missing_mod' in any of the directories '"
                        + sources + ", " + other + "'.");
    }

    /**
     * Verifies that the first directory holding a module wins.
     */
    @Test
    void firstSearchPathWins(@TempDir Path overrides) throws IOException {
        // Arrange
        Files.writeString(overrides.resolve("c_mod.f90"), "module c_mod\nend module c_mod\n");
        ModuleManager manager = new ModuleManager(List.of(overrides, sources));

        // Act
        ModuleInfo info = manager.getModuleInfo("c_mod");

        // Assert
        assertThat(info.getFile()).isEqualTo(overrides.resolve("c_mod.f90"));
        assertThat(manager.getModuleInfo("a_mod").getFile()).isEqualTo(sources.resolve("a_mod.f90"));
    }

    /**
     * Verifies that a search path which is not a directory is skipped.
     */
    @Test
    void ignoresSearchPathThatIsNotADirectory() {
        // Arrange
        ModuleManager manager = new ModuleManager(List.of(sources.resolve("notes.txt"), sources));

        // Act & Assert
        assertThat(manager.findModuleInfo("a_mod")).isPresent();
    }

    /**
     * Verifies that indirect dependencies are collected in discovery order, including modules
     * without a source file.
     */
    @Test
    void collectsAllDependencies() throws IOException {
        // Arrange
        ModuleManager manager = new ModuleManager(List.of(sources));

        // Act & Assert
        assertThat(manager.getAllDependencies("A_MOD")).containsExactly("b_mod", "c_mod", "external_mod");
        assertThat(manager.getAllDependencies("c_mod")).containsExactly("external_mod");
    }

    /**
     * Verifies that used modules come first and that dependencies outside the list are ignored.
     */
    @Test
    void sortsDependenciesFirst() throws IOException {
        // Arrange
        ModuleManager manager = new ModuleManager(List.of(sources));

        // Act
        List<String> sorted = manager.sortModules(List.of("a_mod", "B_MOD", "c_mod"));

        // Assert
        assertThat(sorted).containsExactly("c_mod", "b_mod", "a_mod");
    }

    /**
     * Verifies that a dependency cycle is rejected.
     */
    @Test
    void rejectsCircularDependency(@TempDir Path cyclic) throws IOException {
        // Arrange
        Files.writeString(cyclic.resolve("e_mod.f90"), "module e_mod\n  use f_mod\nend module e_mod\n");
        Files.writeString(cyclic.resolve("f_mod.f90"), "module f_mod\n  use e_mod\nend module f_mod\n");
        ModuleManager manager = new ModuleManager(List.of(cyclic));

        // Act & Assert
        assertThatThrownBy(() -> manager.sortModules(List.of("e_mod", "f_mod")))
                .isInstanceOf(GenerationException.class)
                .hasMessage("Circular dependency between modules: e_mod, f_mod");
        assertThat(manager.getAllDependencies("e_mod")).containsExactly("f_mod");
    }
}
