package se.kth.patchmerge.merge;

import com.github.gumtreediff.tree.Tree;
import se.kth.patchmerge.matching.NodeTriple;
import se.kth.patchmerge.util.LazyLogger;
import se.kth.patchmerge.util.Trees;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds a merged tree by walking the baseline tree and applying {@link MergeDecision} to each node triple.
 *
 * The merged tree is built bottom-up: the children of a baseline node are merged before the node's own content is
 * copied, and the copy is created with those children. A merged node therefore never holds children of the tree its
 * content was copied from.
 */
public class MergedTreeBuilder {
    private static final LazyLogger LOGGER = new LazyLogger(MergedTreeBuilder.class);

    /**
     * Merge the baseline tree according to the triples of the session. Each baseline node that ends up in the
     * merged tree is mapped to its merged node in the session.
     *
     * @param baselineRoot Root of the baseline tree.
     * @param session      A session with the triples computed by
     *                     {@link se.kth.patchmerge.matching.TripleCorrespondence}.
     * @return The root of the merged tree.
     */
    public static Tree merge(Tree baselineRoot, MergeSession session) {
        NodeTriple rootTriple = session.getTriple(baselineRoot);
        if (rootTriple == null) {
            LOGGER.warn(() -> "No triple for the baseline root, treating it as unchanged");
            rootTriple = NodeTriple.unchanged(baselineRoot);
        }
        Tree mergedRoot = merge(baselineRoot, rootTriple, session);
        LOGGER.info(() -> "Merged tree has " + Trees.size(mergedRoot) + " nodes");
        return mergedRoot;
    }

    private static Tree merge(Tree baselineNode, NodeTriple triple, MergeSession session) {
        List<Tree> mergedChildren = new ArrayList<>();
        List<Tree> baselineChildren = baselineNode.getChildren();
        for (int i = 0; i < baselineChildren.size(); i++) {
            Tree baselineChild = baselineChildren.get(i);
            NodeTriple childTriple = session.getTriple(baselineChild);
            if (childTriple == null) {
                // deleted in both revisions, along with its entire subtree
                continue;
            }
            Tree mergedChild = merge(baselineChild, childTriple, session);
            insertInBaselineOrder(mergedChildren, mergedChild, i);
        }

        Tree chosen = MergeDecision.decide(triple, session);
        chosen.setChildren(mergedChildren);
        session.putMerged(baselineNode, chosen);
        return chosen;
    }

    /**
     * Insert a merged child at the index its baseline counterpart has among the baseline children, clamped to the
     * children merged so far.
     */
    private static void insertInBaselineOrder(List<Tree> mergedChildren, Tree mergedChild, int baselineIndex) {
        if (baselineIndex >= mergedChildren.size()) {
            mergedChildren.add(mergedChild);
        } else {
            mergedChildren.add(baselineIndex, mergedChild);
        }
    }
}
