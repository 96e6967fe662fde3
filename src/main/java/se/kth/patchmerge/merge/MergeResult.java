package se.kth.patchmerge.merge;

import com.github.gumtreediff.tree.Tree;

import java.util.List;

/**
 * The outcome of a completed merge: the merged tree along with what the merge could not reconcile.
 */
public class MergeResult {
    private final Tree tree;
    private final List<ContentConflict> conflicts;
    private final List<UnanchoredNode> unanchored;

    public MergeResult(Tree tree, List<ContentConflict> conflicts, List<UnanchoredNode> unanchored) {
        this.tree = tree;
        this.conflicts = List.copyOf(conflicts);
        this.unanchored = List.copyOf(unanchored);
    }

    public Tree getTree() {
        return tree;
    }

    /**
     * @return Positions where the baseline content was kept although both revisions changed it.
     */
    public List<ContentConflict> getConflicts() {
        return conflicts;
    }

    /**
     * @return New nodes for which no insertion point was found.
     */
    public List<UnanchoredNode> getUnanchored() {
        return unanchored;
    }

    /**
     * @return true iff the merge kept every change of both revisions.
     */
    public boolean isClean() {
        return conflicts.isEmpty() && unanchored.isEmpty();
    }
}
