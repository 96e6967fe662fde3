package se.kth.patchmerge.util;

import com.github.gumtreediff.tree.DefaultTree;
import com.github.gumtreediff.tree.Tree;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Helpers for copying and describing GumTree trees.
 *
 * A node belongs to exactly one tree. Nodes that cross a tree boundary are always copied with these methods, never
 * re-parented.
 */
public class Trees {

    /**
     * Copy the content of a node: type, label, source position and metadata. The copy has no parent and no children.
     *
     * @param node A node of any tree.
     * @return A detached copy of the node's content.
     */
    public static Tree copyContent(Tree node) {
        Tree copy = new DefaultTree(node.getType(), node.getLabel());
        copy.setPos(node.getPos());
        copy.setLength(node.getLength());

        Iterator<Map.Entry<String, Object>> metadata = node.getMetadata();
        while (metadata.hasNext()) {
            Map.Entry<String, Object> entry = metadata.next();
            copy.setMetadata(entry.getKey(), entry.getValue());
        }
        return copy;
    }

    /**
     * Copy a whole subtree. The copy is built bottom-up, so each node gets its children before it is handed to its
     * own parent.
     *
     * @param node Root of the subtree to copy.
     * @return A detached copy of the subtree.
     */
    public static Tree deepCopy(Tree node) {
        List<Tree> children = new ArrayList<>(node.getChildren().size());
        for (Tree child : node.getChildren()) {
            children.add(deepCopy(child));
        }
        Tree copy = copyContent(node);
        copy.setChildren(children);
        return copy;
    }

    /**
     * @return true iff both nodes have the same type and label, without regard to their children.
     */
    public static boolean sameContent(Tree a, Tree b) {
        return a.getType() == b.getType() && a.getLabel().equals(b.getLabel());
    }

    /**
     * A short, single-line description of a node for log messages.
     */
    public static String describe(Tree node) {
        if (node == null) {
            return "<none>";
        }
        StringBuilder sb = new StringBuilder(node.getType().toString());
        if (node.hasLabel()) {
            sb.append(": ").append(node.getLabel());
        }
        if (node.getLength() > 0) {
            sb.append(" [").append(node.getPos()).append(',').append(node.getEndPos()).append(']');
        }
        return sb.toString();
    }

    /**
     * @return The number of nodes in the subtree rooted in the given node, the node itself included.
     */
    public static int size(Tree node) {
        int size = 1;
        for (Tree child : node.getChildren()) {
            size += size(child);
        }
        return size;
    }
}
