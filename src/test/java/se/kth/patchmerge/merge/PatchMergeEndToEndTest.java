package se.kth.patchmerge.merge;

import com.github.gumtreediff.tree.Tree;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ArgumentsSource;
import se.kth.patchmerge.TestTrees;
import se.kth.patchmerge.Util;
import se.kth.patchmerge.spoon.Parser;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Merges of real Java sources, parsed by Spoon and matched by GumTree.
 */
class PatchMergeEndToEndTest {

    @ParameterizedTest
    @ArgumentsSource(Util.ModifiedOnlySourceProvider.class)
    void mergeToTree_shouldReturnExpectedTree_whenOnlyModifiedChanged(Util.TestSources sources) throws IOException {
        runTestMerge(sources);
    }

    @ParameterizedTest
    @ArgumentsSource(Util.PatchedOnlySourceProvider.class)
    void mergeToTree_shouldReturnExpectedTree_whenOnlyPatchedChanged(Util.TestSources sources) throws IOException {
        runTestMerge(sources);
    }

    @ParameterizedTest
    @ArgumentsSource(Util.BothSidesSourceProvider.class)
    void mergeToTree_shouldReturnExpectedTree_whenBothRevisionsChanged(Util.TestSources sources)
            throws IOException {
        runTestMerge(sources);
    }

    @ParameterizedTest
    @ArgumentsSource(Util.ConflictSourceProvider.class)
    void mergeToTree_shouldKeepBaselineAndReportConflict_whenBothRevisionsEditedTheSameNode(
            Util.TestSources sources) throws IOException {
        Tree expected = Parser.parse(Parser.read(sources.expected));

        MergeResult result = merge(sources);

        assertTrue(result.getTree().isIsomorphicTo(expected), () -> result.getTree().toTreeString());
        List<ContentConflict> conflicts = result.getConflicts();
        assertFalse(conflicts.isEmpty());
        assertEquals(ContentConflict.Kind.DIVERGENT_EDIT, conflicts.get(0).getKind());
    }

    private static void runTestMerge(Util.TestSources sources) throws IOException {
        Tree expected = Parser.parse(Parser.read(sources.expected));

        MergeResult result = merge(sources);

        assertTrue(result.getTree().isIsomorphicTo(expected), () -> result.getTree().toTreeString());
        assertTrue(result.isClean(), () -> "conflicts: " + result.getConflicts()
                + ", unanchored: " + result.getUnanchored());
        assertEquals(1, TestTrees.findAll(result.getTree(), Parser.COMPILATION_UNIT).size());
    }

    private static MergeResult merge(Util.TestSources sources) throws IOException {
        Tree baseline = Parser.parse(Parser.read(sources.baseline));
        Tree modified = Parser.parse(Parser.read(sources.modified));
        Tree patched = Parser.parse(Parser.read(sources.patched));
        return new PatchMerge().mergeToTree(baseline, modified, patched);
    }
}
