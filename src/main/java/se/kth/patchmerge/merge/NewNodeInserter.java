package se.kth.patchmerge.merge;

import com.github.gumtreediff.matchers.MappingStore;
import com.github.gumtreediff.tree.Tree;
import se.kth.patchmerge.exception.MergeException;
import se.kth.patchmerge.matching.TreeMatcher;
import se.kth.patchmerge.util.LazyLogger;
import se.kth.patchmerge.util.Trees;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Inserts nodes that were added in the modified or patched revision into the merged tree.
 *
 * The merged tree only holds baseline positions. Nodes that have no counterpart in it are new, and each top-most new
 * node is copied in under the merged counterpart of its nearest baseline-matched ancestor. New nodes have no baseline
 * position, so they are appended to the anchor's children.
 */
public class NewNodeInserter {
    private static final LazyLogger LOGGER = new LazyLogger(NewNodeInserter.class);

    /**
     * Insert the new nodes of the modified and patched trees into the merged tree. Additions made identically in
     * both revisions are inserted once. Modified's additions are inserted before patched's.
     *
     * @param modifiedRoot Root of the modified tree.
     * @param patchedRoot  Root of the patched tree.
     * @param mergedRoot   Root of the merged tree. Modified in place.
     * @param matcher      The tree matching oracle.
     * @param session      The session of the current merge, with reverse maps and the baseline-to-merged map.
     * @throws MergeException If an unanchored node is found and the policy is {@link UnanchoredPolicy#FAIL}.
     */
    public static void insertNew(
            Tree modifiedRoot, Tree patchedRoot, Tree mergedRoot, TreeMatcher matcher, MergeSession session) {
        // both matchings must be computed before the merged tree is touched
        LOGGER.info(() -> "Matching modified to merged");
        List<Tree> unmatchedModified = collectTopMostUnmatched(modifiedRoot, mergedRoot, matcher);
        LOGGER.info(() -> "Matching patched to merged");
        List<Tree> unmatchedPatched = collectTopMostUnmatched(patchedRoot, mergedRoot, matcher);

        LOGGER.info(() -> "Top-most unmatched nodes: " + unmatchedModified.size() + " in modified, "
                + unmatchedPatched.size() + " in patched");

        List<Tree> remainingPatched = removeDuplicateAdditions(unmatchedModified, unmatchedPatched);

        for (Tree node : unmatchedModified) {
            insert(node, Revision.MODIFIED, modifiedRoot, mergedRoot, session);
        }
        for (Tree node : remainingPatched) {
            insert(node, Revision.PATCHED, patchedRoot, mergedRoot, session);
        }
    }

    /**
     * Collect the nodes of the source tree that have no counterpart in the merged tree and whose parent either does
     * not exist or does have a counterpart. Descendants of such a node are brought along when it is inserted, so
     * they are not collected themselves.
     *
     * @return The top-most unmatched nodes, in pre-order.
     */
    static List<Tree> collectTopMostUnmatched(Tree sourceRoot, Tree mergedRoot, TreeMatcher matcher) {
        MappingStore mappings = matcher.match(sourceRoot, mergedRoot);

        List<Tree> topMost = new ArrayList<>();
        for (Tree node : sourceRoot.preOrder()) {
            if (mappings.getDstForSrc(node) != null) {
                continue;
            }
            Tree parent = node == sourceRoot ? null : node.getParent();
            if (parent == null || mappings.getDstForSrc(parent) != null) {
                topMost.add(node);
            }
        }
        return topMost;
    }

    /**
     * Pair each unmatched modified node with the first unclaimed, structurally identical unmatched patched node.
     * Paired patched nodes are additions already brought in by modified.
     *
     * @return The patched nodes that remain to be inserted, in their original order.
     */
    static List<Tree> removeDuplicateAdditions(List<Tree> unmatchedModified, List<Tree> unmatchedPatched) {
        Set<Tree> claimed = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Tree modNode : unmatchedModified) {
            for (Tree patNode : unmatchedPatched) {
                if (!claimed.contains(patNode) && MergeDecision.identical(modNode, patNode)) {
                    claimed.add(patNode);
                    LOGGER.debug(() -> "Added identically in both revisions: " + Trees.describe(modNode));
                    break;
                }
            }
        }

        List<Tree> remaining = new ArrayList<>();
        for (Tree patNode : unmatchedPatched) {
            if (!claimed.contains(patNode)) {
                remaining.add(patNode);
            }
        }
        return remaining;
    }

    /**
     * Find the merged node under which a new node of the origin revision is to be inserted: the merged counterpart
     * of the nearest ancestor of the node that is matched to the baseline.
     *
     * @return The anchor, or null if no ancestor of the node has a counterpart in the merged tree.
     */
    static Tree findAnchor(Tree node, Revision origin, Tree originRoot, MergeSession session) {
        Map<Tree, Tree> toBaseline = session.getToBaseline(origin);
        Tree current = node == originRoot ? null : node.getParent();
        while (current != null) {
            Tree baselineNode = toBaseline.get(current);
            if (baselineNode != null) {
                return session.getMerged(baselineNode);
            }
            current = current == originRoot ? null : current.getParent();
        }
        return null;
    }

    private static void insert(Tree node, Revision origin, Tree originRoot, Tree mergedRoot, MergeSession session) {
        Tree anchor = findAnchor(node, origin, originRoot, session);
        if (anchor != null) {
            anchor.addChild(markedCopy(node, origin));
            LOGGER.debug(() -> "Inserted " + origin + " node " + Trees.describe(node)
                    + " under " + Trees.describe(anchor));
            return;
        }

        UnanchoredPolicy policy = session.getConfig().getUnanchoredPolicy();
        switch (policy) {
            case FAIL:
                throw new MergeException("No insertion point for " + origin + " node " + Trees.describe(node));
            case ATTACH_TO_ROOT:
                mergedRoot.addChild(markedCopy(node, origin));
                session.addUnanchored(new UnanchoredNode(origin, node, true));
                LOGGER.warn(() -> "No insertion point for " + origin + " node " + Trees.describe(node)
                        + ", attached it to the merged root");
                break;
            default:
                session.addUnanchored(new UnanchoredNode(origin, node, false));
                LOGGER.warn(() -> "No insertion point for " + origin + " node " + Trees.describe(node)
                        + ", left it out of the merge");
        }
    }

    /**
     * Deep copy a new node, marking each node of the copy with the revision it was added in.
     */
    private static Tree markedCopy(Tree node, Revision origin) {
        Tree copy = Trees.deepCopy(node);
        for (Tree t : copy.preOrder()) {
            t.setMetadata(Revision.KEY, origin);
        }
        return copy;
    }
}
