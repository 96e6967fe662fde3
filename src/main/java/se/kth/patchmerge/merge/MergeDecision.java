package se.kth.patchmerge.merge;

import com.github.gumtreediff.tree.Tree;
import se.kth.patchmerge.matching.NodeTriple;
import se.kth.patchmerge.util.LazyLogger;
import se.kth.patchmerge.util.Trees;

/**
 * Decides, for a single node triple, which revision's node content represents the baseline position in the merged
 * tree.
 *
 * This selects content, it does not merge it. Divergent content is not combined; divergent structure (additions) is
 * handled by {@link NewNodeInserter}.
 */
public class MergeDecision {
    private static final LazyLogger LOGGER = new LazyLogger(MergeDecision.class);

    /**
     * Structural identity of two subtrees: same shape, types and labels. Metadata, such as the revision
     * bookkeeping of merged trees, is ignored.
     *
     * @return true if both are null, false if exactly one is null, and otherwise whether the subtrees are isomorphic.
     */
    public static boolean identical(Tree a, Tree b) {
        if (a == null && b == null)
            return true;
        if (a == null || b == null)
            return false;
        return a.isIsomorphicTo(b);
    }

    /**
     * Pick the revision whose node content wins for the given triple. In order of priority:
     *
     * <ol>
     *     <li>Neither side changed the subtree: baseline.</li>
     *     <li>Only patched changed it: patched if present, else baseline.</li>
     *     <li>Only modified changed it: modified if present, else baseline.</li>
     *     <li>Both sides made the same change: modified.</li>
     *     <li>Otherwise: baseline.</li>
     * </ol>
     *
     * @param triple A node triple.
     * @return The winning revision.
     */
    public static Revision choose(NodeTriple triple) {
        Tree base = triple.getBaseline();
        Tree mod = triple.getModified();
        Tree pat = triple.getPatched();

        boolean baseModSame = identical(base, mod);
        boolean basePatSame = identical(base, pat);

        if (baseModSame && basePatSame) {
            return Revision.BASELINE;
        } else if (baseModSame) {
            return pat != null ? Revision.PATCHED : Revision.BASELINE;
        } else if (basePatSame) {
            return mod != null ? Revision.MODIFIED : Revision.BASELINE;
        } else if (mod != null && identical(mod, pat)) {
            return Revision.MODIFIED;
        } else {
            return Revision.BASELINE;
        }
    }

    /**
     * Decide which node content represents the triple's baseline position, and return a fresh copy of that
     * content. The copy has no children and carries the winning revision under {@link Revision#KEY}.
     *
     * @param triple A node triple.
     * @return A detached copy of the winning node's content.
     */
    public static Tree decide(NodeTriple triple) {
        return decide(triple, null);
    }

    /**
     * Same as {@link #decide(NodeTriple)}, but also records content conflicts in the given session.
     *
     * @param triple  A node triple.
     * @param session The session to record conflicts in, or null to not record them.
     * @return A detached copy of the winning node's content.
     */
    public static Tree decide(NodeTriple triple, MergeSession session) {
        Revision winner = choose(triple);
        Tree chosen;
        switch (winner) {
            case MODIFIED:
                chosen = triple.getModified();
                break;
            case PATCHED:
                chosen = triple.getPatched();
                break;
            default:
                chosen = triple.getBaseline();
                if (session != null) {
                    recordConflict(triple, session);
                }
        }

        LOGGER.trace(() -> winner + " wins at " + Trees.describe(triple.getBaseline()));

        Tree copy = Trees.copyContent(chosen);
        copy.setMetadata(Revision.KEY, winner);
        return copy;
    }

    /**
     * Record a conflict if the baseline won although a side changed the node's own content. Nodes whose own content
     * is unchanged on both sides, and only differ further down in their subtrees, are not conflicts at this position.
     */
    private static void recordConflict(NodeTriple triple, MergeSession session) {
        Tree base = triple.getBaseline();
        Tree mod = triple.getModified();
        Tree pat = triple.getPatched();

        ContentConflict conflict = null;
        if (mod != null && pat != null) {
            boolean modEdited = !Trees.sameContent(base, mod);
            boolean patEdited = !Trees.sameContent(base, pat);
            if (modEdited && patEdited && !Trees.sameContent(mod, pat)) {
                conflict = new ContentConflict(ContentConflict.Kind.DIVERGENT_EDIT, base, mod, pat);
            } else if (modEdited || patEdited) {
                // the subtrees diverge below, so the own-content edit loses together with the rest of the subtree
                conflict = new ContentConflict(ContentConflict.Kind.DISCARDED_EDIT, base, mod, pat);
            }
        } else if (mod != null && !Trees.sameContent(base, mod)) {
            conflict = new ContentConflict(ContentConflict.Kind.DELETE_EDIT, base, mod, null);
        } else if (pat != null && !Trees.sameContent(base, pat)) {
            conflict = new ContentConflict(ContentConflict.Kind.DELETE_EDIT, base, null, pat);
        }

        if (conflict != null) {
            ContentConflict recorded = conflict;
            LOGGER.warn(() -> "Keeping baseline content on conflict: " + recorded);
            session.addConflict(conflict);
        }
    }
}
