package se.kth.patchmerge.matching;

import com.github.gumtreediff.tree.Tree;

import java.util.Objects;

/**
 * A baseline node together with its counterparts in the modified and patched trees, as established by the tree
 * matching oracle. A counterpart is null when the node has no match in that tree.
 */
public class NodeTriple {
    private final Tree baseline;
    private final Tree modified;
    private final Tree patched;

    public NodeTriple(Tree baseline, Tree modified, Tree patched) {
        this.baseline = Objects.requireNonNull(baseline, "baseline");
        this.modified = modified;
        this.patched = patched;
    }

    /**
     * A triple that considers the baseline node unchanged in both derived trees.
     */
    public static NodeTriple unchanged(Tree baseline) {
        return new NodeTriple(baseline, baseline, baseline);
    }

    public Tree getBaseline() {
        return baseline;
    }

    public Tree getModified() {
        return modified;
    }

    public Tree getPatched() {
        return patched;
    }

    @Override
    public String toString() {
        return "NodeTriple{" +
                "baseline=" + baseline +
                ", modified=" + modified +
                ", patched=" + patched +
                '}';
    }
}
