package se.kth.patchmerge.merge;

import com.github.gumtreediff.tree.Tree;
import se.kth.patchmerge.matching.NodeTriple;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * All mutable state of a single merge. A session is created for one invocation, passed through each merge stage and
 * discarded afterwards; it is never shared between merges.
 *
 * Nodes are keyed by identity. Isomorphic nodes from different trees are distinct keys.
 */
public class MergeSession {
    private final MergeConfig config;

    private final Map<Tree, NodeTriple> triples = new IdentityHashMap<>();
    private final List<NodeTriple> triplesInOrder = new ArrayList<>();
    private final Map<Tree, Tree> modifiedToBaseline = new IdentityHashMap<>();
    private final Map<Tree, Tree> patchedToBaseline = new IdentityHashMap<>();
    private final Map<Tree, Tree> baselineToMerged = new IdentityHashMap<>();

    private final List<ContentConflict> conflicts = new ArrayList<>();
    private final List<UnanchoredNode> unanchored = new ArrayList<>();

    public MergeSession(MergeConfig config) {
        this.config = config;
    }

    public MergeConfig getConfig() {
        return config;
    }

    public void putTriple(NodeTriple triple) {
        if (triples.put(triple.getBaseline(), triple) != null) {
            throw new IllegalStateException("duplicate triple for baseline node " + triple.getBaseline());
        }
        triplesInOrder.add(triple);
    }

    /**
     * @return The triple of the given baseline node, or null if the node is deleted in both derived revisions.
     */
    public NodeTriple getTriple(Tree baselineNode) {
        return triples.get(baselineNode);
    }

    /**
     * @return All triples, in pre-order of their baseline nodes.
     */
    public List<NodeTriple> getTriples() {
        return Collections.unmodifiableList(triplesInOrder);
    }

    public void putModifiedToBaseline(Tree modifiedNode, Tree baselineNode) {
        modifiedToBaseline.put(modifiedNode, baselineNode);
    }

    public void putPatchedToBaseline(Tree patchedNode, Tree baselineNode) {
        patchedToBaseline.put(patchedNode, baselineNode);
    }

    /**
     * @param origin Either {@link Revision#MODIFIED} or {@link Revision#PATCHED}.
     * @return The map from nodes of the origin revision to their baseline counterparts.
     */
    public Map<Tree, Tree> getToBaseline(Revision origin) {
        switch (origin) {
            case MODIFIED:
                return Collections.unmodifiableMap(modifiedToBaseline);
            case PATCHED:
                return Collections.unmodifiableMap(patchedToBaseline);
            default:
                throw new IllegalArgumentException("no reverse map for revision " + origin);
        }
    }

    public void putMerged(Tree baselineNode, Tree mergedNode) {
        baselineToMerged.put(baselineNode, mergedNode);
    }

    /**
     * @return The merged node chosen for the given baseline node, or null if the baseline node is not part of the
     * merged tree.
     */
    public Tree getMerged(Tree baselineNode) {
        return baselineToMerged.get(baselineNode);
    }

    public void addConflict(ContentConflict conflict) {
        conflicts.add(conflict);
    }

    public List<ContentConflict> getConflicts() {
        return Collections.unmodifiableList(conflicts);
    }

    public void addUnanchored(UnanchoredNode node) {
        unanchored.add(node);
    }

    public List<UnanchoredNode> getUnanchored() {
        return Collections.unmodifiableList(unanchored);
    }
}
