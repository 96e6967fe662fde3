package se.kth.patchmerge;

import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.stream.Stream;

/**
 * Utility methods for the test suite.
 *
 * A scenario is a directory with a {@code Baseline.java}, {@code Modified.java}, {@code Patched.java} and
 * {@code Expected.java}.
 *
 * @author Simon Larsén
 */
public class Util {
    public static final Path RESOURCES_BASE_DIR = Paths.get("src/test/resources");
    public static final Path CLEAN_MERGE_DIRPATH = RESOURCES_BASE_DIR.resolve("clean");
    public static final Path SINGLE_SIDE_DIRPATH = CLEAN_MERGE_DIRPATH.resolve("single_side");
    public static final Path BOTH_SIDES_DIRPATH = CLEAN_MERGE_DIRPATH.resolve("both_sides");
    public static final Path CONFLICT_DIRPATH = RESOURCES_BASE_DIR.resolve("conflict");
    public static final Path PATCH_DIRPATH = RESOURCES_BASE_DIR.resolve("patch");

    private static Stream<TestSources> getSourcesStream(File testDir) {
        return Arrays.stream(testDir.listFiles())
                .filter(File::isDirectory)
                .filter(f -> !f.getName().startsWith("IGNORE"))
                .sorted()
                .map(TestSources::fromTestDirectory);
    }

    /** Provides test sources for scenarios where only the modified revision differs from the baseline. */
    public static class ModifiedOnlySourceProvider implements ArgumentsProvider {
        @Override
        public Stream<? extends Arguments> provideArguments(ExtensionContext extensionContext) {
            return getSourcesStream(SINGLE_SIDE_DIRPATH.toFile()).map(Arguments::of);
        }
    }

    /** Provides test sources for scenarios where only the patched revision differs from the baseline. */
    public static class PatchedOnlySourceProvider implements ArgumentsProvider {
        @Override
        public Stream<? extends Arguments> provideArguments(ExtensionContext extensionContext) {
            return getSourcesStream(SINGLE_SIDE_DIRPATH.toFile())
                    .map(sources -> {
                        // swap modified and patched around to make this a "patched only" test case
                        Path modified = sources.modified;
                        sources.modified = sources.patched;
                        sources.patched = modified;
                        return Arguments.of(sources);
                    });
        }
    }

    /** Provides test sources for scenarios where both revisions differ from the baseline without conflicting. */
    public static class BothSidesSourceProvider implements ArgumentsProvider {
        @Override
        public Stream<? extends Arguments> provideArguments(ExtensionContext extensionContext) {
            return getSourcesStream(BOTH_SIDES_DIRPATH.toFile()).map(Arguments::of);
        }
    }

    /** Provides test sources for scenarios where both revisions changed the same content differently. */
    public static class ConflictSourceProvider implements ArgumentsProvider {
        @Override
        public Stream<? extends Arguments> provideArguments(ExtensionContext extensionContext) {
            return getSourcesStream(CONFLICT_DIRPATH.toFile()).map(Arguments::of);
        }
    }

    public static class TestSources {
        public Path baseline;
        public Path modified;
        public Path patched;
        public Path expected;

        TestSources(Path baseline, Path modified, Path patched, Path expected) {
            this.baseline = baseline;
            this.modified = modified;
            this.patched = patched;
            this.expected = expected;
        }

        public static TestSources fromTestDirectory(File testDir) {
            Path path = testDir.toPath();
            return new TestSources(
                    path.resolve("Baseline.java"),
                    path.resolve("Modified.java"),
                    path.resolve("Patched.java"),
                    path.resolve("Expected.java"));
        }

        @Override
        public String toString() {
            return baseline.getParent().getFileName().toString();
        }
    }
}
