package io.tally.core.fs;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class PathResolverTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReturnAbsolutePathUnchanged() {
        Path absolute = tempDir.resolve("reports");
        var resolver = new PathResolver(Path.of("somewhere", "else"));

        assertThat(resolver.resolve(absolute.toString())).isEqualTo(absolute);
    }

    @Test
    void shouldResolveRelativePathAgainstWorkingDirectory() {
        var resolver = new PathResolver(tempDir);

        assertThat(resolver.resolve("build/reports")).isEqualTo(tempDir.resolve("build").resolve("reports"));
    }

    @Test
    void shouldNormalizeRedundantSegments() {
        var resolver = new PathResolver(tempDir);

        Path resolved = resolver.resolve("./build//tmp/../reports/.");

        assertThat(resolved).isEqualTo(tempDir.resolve("build").resolve("reports"));
        assertThat(resolved.toString()).doesNotContain("..");
    }

    @Test
    void shouldResolveAgainstExplicitCwd() {
        var resolver = new PathResolver();
        Path cwd = tempDir.resolve("project");

        assertThat(resolver.resolve("out", cwd)).isEqualTo(cwd.resolve("out"));
    }

    @Test
    void shouldDefaultToProcessWorkingDirectory() {
        var resolver = new PathResolver();

        assertThat(resolver.workingDirectory()).isEqualTo(Path.of(System.getProperty("user.dir")).toAbsolutePath().normalize());
        assertThat(resolver.resolve("reports")).isAbsolute();
    }

    @Test
    void shouldResolveParentReferencesAboveWorkingDirectory() {
        var resolver = new PathResolver(tempDir.resolve("a"));

        assertThat(resolver.resolve("../b")).isEqualTo(tempDir.resolve("b"));
    }
}
