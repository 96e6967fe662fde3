package se.kth.patchmerge.merge;

import com.github.gumtreediff.tree.Tree;
import se.kth.patchmerge.util.Trees;

/**
 * A new node of the modified or patched revision for which no insertion point in the merged tree was found.
 */
public class UnanchoredNode {
    private final Revision origin;
    private final Tree node;
    private final boolean attachedToRoot;

    public UnanchoredNode(Revision origin, Tree node, boolean attachedToRoot) {
        this.origin = origin;
        this.node = node;
        this.attachedToRoot = attachedToRoot;
    }

    /**
     * @return The revision the node was added in, either {@link Revision#MODIFIED} or {@link Revision#PATCHED}.
     */
    public Revision getOrigin() {
        return origin;
    }

    /**
     * @return The node in its origin tree.
     */
    public Tree getNode() {
        return node;
    }

    /**
     * @return true iff a copy of the node was appended to the merged root.
     */
    public boolean isAttachedToRoot() {
        return attachedToRoot;
    }

    @Override
    public String toString() {
        return origin + " " + Trees.describe(node) + (attachedToRoot ? " (attached to root)" : " (not inserted)");
    }
}
