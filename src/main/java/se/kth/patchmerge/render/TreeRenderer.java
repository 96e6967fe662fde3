package se.kth.patchmerge.render;

import com.github.gumtreediff.tree.Tree;

/**
 * Turns a merged tree into text. The merge engine returns whatever a renderer produces, verbatim.
 */
@FunctionalInterface
public interface TreeRenderer {

    /**
     * @param tree Root of a tree.
     * @return A textual representation of the tree.
     * @throws RuntimeException Any failure to render; the merge engine reports it as a failed merge.
     */
    String render(Tree tree);
}
