package se.kth.patchmerge.render;

import com.github.gumtreediff.tree.Tree;
import se.kth.patchmerge.merge.Revision;

/**
 * Renders a tree as indented text, one node per line.
 *
 * Without revision annotations the output is GumTree's own tree text. With annotations, each node of a merged tree
 * whose content was not taken from the baseline is suffixed with the revision it came from, e.g.
 * {@code SimpleName: x <MODIFIED>}.
 */
public class TreeStringRenderer implements TreeRenderer {
    private static final String INDENT = "    ";

    private final boolean showRevisions;

    public TreeStringRenderer() {
        this(false);
    }

    public TreeStringRenderer(boolean showRevisions) {
        this.showRevisions = showRevisions;
    }

    @Override
    public String render(Tree tree) {
        if (!showRevisions) {
            return tree.toTreeString();
        }
        StringBuilder sb = new StringBuilder();
        render(tree, 0, sb);
        return sb.toString();
    }

    private static void render(Tree node, int depth, StringBuilder sb) {
        sb.append(INDENT.repeat(depth)).append(node.getType());
        if (node.hasLabel()) {
            sb.append(": ").append(node.getLabel());
        }
        Object revision = node.getMetadata(Revision.KEY);
        if (revision != null && revision != Revision.BASELINE) {
            sb.append(" <").append(revision).append('>');
        }
        sb.append('\n');

        for (Tree child : node.getChildren()) {
            render(child, depth + 1, sb);
        }
    }
}
