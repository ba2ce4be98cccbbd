package com.purchasingpower.codegraph.sync;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.exception.ProjectAccessException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ProjectWalker Tests")
class ProjectWalkerTest {

    @TempDir
    Path root;

    private CodeGraphProperties properties;
    private ProjectWalker walker;

    @BeforeEach
    void setUp() {
        properties = new CodeGraphProperties();
        walker = new ProjectWalker(properties);
    }

    @Test
    @DisplayName("Should return Java sources sorted and prune excluded directories anywhere")
    void walk_ShouldPruneExcludedDirectories() throws IOException {
        // Given
        write("src/main/java/com/example/B.java");
        write("src/main/java/com/example/A.java");
        write("src/main/java/com/example/package-info.java");
        write("src/main/resources/app.yml");
        write("target/generated/Gen.java");
        write("module/node_modules/lib/Dep.java");
        write(".git/hooks/Hook.java");
        write("module/src/main/java/Other.java");

        // When
        List<FileFailure> failures = new ArrayList<>();
        List<Path> files = walker.walk(root, failures);

        // Then
        assertThat(files).extracting(f -> ProjectWalker.relativePath(root, f)).containsExactly(
                "module/src/main/java/Other.java",
                "src/main/java/com/example/A.java",
                "src/main/java/com/example/B.java");
        assertThat(failures).isEmpty();
    }

    @Test
    @DisplayName("Should skip test sources unless configured to include them")
    void walk_ShouldHonorTestSourceSetting() throws IOException {
        // Given
        write("src/main/java/Main.java");
        write("src/test/java/MainTest.java");

        // When / Then
        assertThat(walker.walk(root, new ArrayList<>())).hasSize(1);

        properties.getSync().setIncludeTestSources(true);
        assertThat(walker.walk(root, new ArrayList<>())).hasSize(2);
    }

    @Test
    @DisplayName("Should honor a custom exclusion list")
    void walk_ShouldUseConfiguredExclusions() throws IOException {
        // Given
        write("generated/Gen.java");
        write("src/Main.java");
        properties.getSync().setExcludedDirectories(List.of("generated"));

        // Then
        assertThat(walker.walk(root, new ArrayList<>()))
                .extracting(f -> ProjectWalker.relativePath(root, f))
                .containsExactly("src/Main.java");
    }

    @Test
    @DisplayName("Should fail when the project root does not exist")
    void walk_ShouldRejectMissingRoot() {
        Path missing = root.resolve("does-not-exist");

        assertThatThrownBy(() -> walker.walk(missing, new ArrayList<>()))
                .isInstanceOf(ProjectAccessException.class);
    }

    private void write(String relative) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "class X {}\n");
    }
}
