package se.kth.patchmerge.merge;

import com.github.gumtreediff.tree.Tree;
import se.kth.patchmerge.exception.MergeException;
import se.kth.patchmerge.matching.GumTreeMatcher;
import se.kth.patchmerge.matching.TreeMatcher;
import se.kth.patchmerge.matching.TripleCorrespondence;
import se.kth.patchmerge.render.TreeRenderer;
import se.kth.patchmerge.render.TreeStringRenderer;
import se.kth.patchmerge.spoon.Parser;
import se.kth.patchmerge.util.LazyLogger;

import java.util.Objects;

/**
 * Structured three-way merge of a locally modified and an externally patched revision of the same baseline.
 *
 * A merge runs in three stages: node triples are built from baseline-to-modified and baseline-to-patched matchings,
 * the baseline tree is rebuilt with the winning content of each triple, and nodes added in either revision are
 * spliced in under their nearest baseline-matched ancestor.
 *
 * Instances hold no mutable state. Every merge gets its own {@link MergeSession}, so one instance can merge several
 * files concurrently.
 */
public class PatchMerge {
    private static final LazyLogger LOGGER = new LazyLogger(PatchMerge.class);

    private final TreeMatcher matcher;
    private final TreeRenderer renderer;
    private final MergeConfig config;

    /**
     * Create a merge with the default GumTree matcher, the tree text renderer and the default configuration.
     */
    public PatchMerge() {
        this(MergeConfig.defaults());
    }

    /**
     * Create a merge with the GumTree matcher selected by the configuration and the tree text renderer.
     */
    public PatchMerge(MergeConfig config) {
        this(GumTreeMatcher.fromId(config.getMatcherId()), new TreeStringRenderer(), config);
    }

    public PatchMerge(TreeMatcher matcher, TreeRenderer renderer, MergeConfig config) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Merge three source revisions and render the merged tree.
     *
     * @param baselineSource The baseline revision.
     * @param modifiedSource The modified revision.
     * @param patchedSource  The patched revision.
     * @return The renderer's output for the merged tree.
     * @throws MergeException If any revision cannot be parsed, or the merge or rendering fails.
     */
    public String performMerge(String baselineSource, String modifiedSource, String patchedSource) {
        LOGGER.info(() -> "Parsing revisions");
        Tree baseline = Parser.parse(baselineSource, config.isIncludeComments());
        Tree modified = Parser.parse(modifiedSource, config.isIncludeComments());
        Tree patched = Parser.parse(patchedSource, config.isIncludeComments());
        return performMerge(baseline, modified, patched);
    }

    /**
     * Merge three trees and render the merged tree.
     *
     * @param baseline The baseline tree.
     * @param modified The modified tree.
     * @param patched  The patched tree.
     * @return The renderer's output for the merged tree, verbatim.
     * @throws MergeException If any tree is unavailable, or the merge or rendering fails.
     */
    public String performMerge(Tree baseline, Tree modified, Tree patched) {
        return render(mergeToTree(baseline, modified, patched));
    }

    /**
     * Render the tree of a completed merge.
     *
     * @return The renderer's output, verbatim.
     * @throws MergeException If the renderer fails.
     */
    public String render(MergeResult result) {
        LOGGER.info(() -> "Rendering merged tree");
        try {
            return renderer.render(result.getTree());
        } catch (RuntimeException e) {
            throw new MergeException("Failed to render merged tree", e);
        }
    }

    /**
     * Merge three trees. None of the input trees is modified; the merged tree consists of copies only.
     *
     * @param baseline The baseline tree.
     * @param modified The modified tree.
     * @param patched  The patched tree.
     * @return The merged tree along with the conflicts and unanchored nodes of the merge.
     * @throws MergeException If any tree is unavailable, or an unanchored node is found under
     *                        {@link UnanchoredPolicy#FAIL}.
     */
    public MergeResult mergeToTree(Tree baseline, Tree modified, Tree patched) {
        requireAvailable(baseline, Revision.BASELINE);
        requireAvailable(modified, Revision.MODIFIED);
        requireAvailable(patched, Revision.PATCHED);

        long start = System.nanoTime();
        MergeSession session = new MergeSession(config);

        LOGGER.info(() -> "Building node triples");
        TripleCorrespondence.build(baseline, modified, patched, matcher, session);

        LOGGER.info(() -> "Merging baseline tree");
        Tree merged = MergedTreeBuilder.merge(baseline, session);

        LOGGER.info(() -> "Inserting new nodes");
        NewNodeInserter.insertNew(modified, patched, merged, matcher, session);

        MergeResult result = new MergeResult(merged, session.getConflicts(), session.getUnanchored());
        LOGGER.info(() -> "Merged in " + (double) (System.nanoTime() - start) / 1e9 + " seconds with "
                + result.getConflicts().size() + " conflicts and "
                + result.getUnanchored().size() + " unanchored nodes");
        return result;
    }

    private static void requireAvailable(Tree tree, Revision revision) {
        if (tree == null) {
            throw new MergeException("The " + revision.name().toLowerCase() + " tree is unavailable, refusing to merge");
        }
    }
}
