package se.kth.patchmerge.matching;

import com.github.gumtreediff.matchers.MappingStore;
import com.github.gumtreediff.tree.Tree;
import se.kth.patchmerge.merge.MergeSession;
import se.kth.patchmerge.util.LazyLogger;
import se.kth.patchmerge.util.Trees;

/**
 * Builds the node triples of a merge: for each baseline node, its counterparts in the modified and patched trees.
 */
public class TripleCorrespondence {
    private static final LazyLogger LOGGER = new LazyLogger(TripleCorrespondence.class);

    /**
     * Match the baseline tree against both derived trees and store one {@link NodeTriple} per surviving baseline
     * node in the session, along with the modified-to-baseline and patched-to-baseline reverse maps.
     *
     * A baseline node that is matched in neither derived tree is considered deleted in both and gets no triple,
     * unless it is the root. The root always gets a triple.
     *
     * @param baseline The baseline tree.
     * @param modified The modified tree.
     * @param patched  The patched tree.
     * @param matcher  The tree matching oracle.
     * @param session  The session of the current merge.
     */
    public static void build(Tree baseline, Tree modified, Tree patched, TreeMatcher matcher, MergeSession session) {
        LOGGER.info(() -> "Matching baseline to modified");
        MappingStore baseModified = matcher.match(baseline, modified);
        LOGGER.info(() -> "Matching baseline to patched");
        MappingStore basePatched = matcher.match(baseline, patched);

        int deleted = 0;
        for (Tree baseNode : baseline.preOrder()) {
            Tree modNode = baseModified.getDstForSrc(baseNode);
            Tree patNode = basePatched.getDstForSrc(baseNode);

            if (modNode != null) {
                session.putModifiedToBaseline(modNode, baseNode);
            }
            if (patNode != null) {
                session.putPatchedToBaseline(patNode, baseNode);
            }

            if (baseNode == baseline || modNode != null || patNode != null) {
                session.putTriple(new NodeTriple(baseNode, modNode, patNode));
            } else {
                deleted++;
                LOGGER.trace(() -> "Deleted in both revisions: " + Trees.describe(baseNode));
            }
        }

        int numDeleted = deleted;
        LOGGER.info(() -> "Built " + session.getTriples().size() + " node triples, "
                + numDeleted + " baseline nodes deleted in both revisions");
    }
}
