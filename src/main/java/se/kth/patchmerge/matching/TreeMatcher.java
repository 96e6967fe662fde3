package se.kth.patchmerge.matching;

import com.github.gumtreediff.matchers.MappingStore;
import com.github.gumtreediff.tree.Tree;

/**
 * The tree matching oracle. Given two trees, computes a partial, injective correspondence from the nodes of the
 * source tree to the nodes of the destination tree.
 *
 * Implementations must be deterministic for identical inputs and safe to call concurrently; the merge engine calls
 * {@link #match(Tree, Tree)} four times per merge and never shares the returned mapping.
 */
@FunctionalInterface
public interface TreeMatcher {

    /**
     * @param src The source tree.
     * @param dst The destination tree.
     * @return A mapping where {@link MappingStore#getDstForSrc(Tree)} gives the counterpart of a source node.
     */
    MappingStore match(Tree src, Tree dst);
}
