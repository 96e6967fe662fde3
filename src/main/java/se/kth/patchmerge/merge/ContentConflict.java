package se.kth.patchmerge.merge;

import com.github.gumtreediff.tree.Tree;
import se.kth.patchmerge.util.Trees;

/**
 * A baseline position where the merge kept the baseline content although a derived revision changed the node's own
 * content. The edits made to the node's content are lost there.
 */
public class ContentConflict {
    public enum Kind {
        /** Both sides changed the node's content, to different values. */
        DIVERGENT_EDIT,
        /** One side deleted the node, the other changed its content. */
        DELETE_EDIT,
        /** A content edit lost because the subtrees of both sides diverge further down. */
        DISCARDED_EDIT
    }

    private final Kind kind;
    private final Tree baseline;
    private final Tree modified;
    private final Tree patched;

    public ContentConflict(Kind kind, Tree baseline, Tree modified, Tree patched) {
        this.kind = kind;
        this.baseline = baseline;
        this.modified = modified;
        this.patched = patched;
    }

    public Kind getKind() {
        return kind;
    }

    public Tree getBaseline() {
        return baseline;
    }

    /**
     * @return The modified counterpart, or null if the modified revision deleted the node.
     */
    public Tree getModified() {
        return modified;
    }

    /**
     * @return The patched counterpart, or null if the patched revision deleted the node.
     */
    public Tree getPatched() {
        return patched;
    }

    @Override
    public String toString() {
        return kind + " at " + Trees.describe(baseline)
                + " (modified: " + Trees.describe(modified)
                + ", patched: " + Trees.describe(patched) + ")";
    }
}
