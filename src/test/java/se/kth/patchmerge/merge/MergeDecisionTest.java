package se.kth.patchmerge.merge;

import com.github.gumtreediff.tree.Tree;
import org.junit.jupiter.api.Test;
import se.kth.patchmerge.matching.NodeTriple;

import static org.junit.jupiter.api.Assertions.*;
import static se.kth.patchmerge.TestTrees.leaf;
import static se.kth.patchmerge.TestTrees.node;

class MergeDecisionTest {

    @Test
    void identical_shouldTreatTwoNullsAsIdentical() {
        assertTrue(MergeDecision.identical(null, null));
        assertFalse(MergeDecision.identical(leaf("a", "VariableRead", "a"), null));
        assertFalse(MergeDecision.identical(null, leaf("a", "VariableRead", "a")));
    }

    @Test
    void identical_shouldIgnoreMetadata_whenSubtreesAreIsomorphic() {
        Tree first = node("1", "Return", "", leaf("2", "VariableRead", "a"));
        Tree second = node("3", "Return", "", leaf("4", "VariableRead", "a"));

        assertTrue(MergeDecision.identical(first, second));
    }

    @Test
    void identical_shouldBeFalse_whenDescendantLabelsDiffer() {
        Tree first = node("1", "Return", "", leaf("2", "VariableRead", "a"));
        Tree second = node("1", "Return", "", leaf("2", "VariableRead", "x"));

        assertFalse(MergeDecision.identical(first, second));
    }

    @Test
    void choose_shouldPickBaseline_whenNeitherSideChanged() {
        Tree base = leaf("a", "VariableRead", "a");
        NodeTriple triple = new NodeTriple(base, leaf("a", "VariableRead", "a"), leaf("a", "VariableRead", "a"));

        assertEquals(Revision.BASELINE, MergeDecision.choose(triple));
    }

    @Test
    void choose_shouldPickPatched_whenOnlyPatchedChanged() {
        Tree base = leaf("a", "VariableRead", "a");
        NodeTriple triple = new NodeTriple(base, leaf("a", "VariableRead", "a"), leaf("a", "VariableRead", "y"));

        assertEquals(Revision.PATCHED, MergeDecision.choose(triple));
    }

    @Test
    void choose_shouldPickBaseline_whenOnlyPatchedChangedByDeleting() {
        Tree base = leaf("a", "VariableRead", "a");
        NodeTriple triple = new NodeTriple(base, leaf("a", "VariableRead", "a"), null);

        assertEquals(Revision.BASELINE, MergeDecision.choose(triple));
    }

    @Test
    void choose_shouldPickModified_whenOnlyModifiedChanged() {
        Tree base = leaf("a", "VariableRead", "a");
        NodeTriple triple = new NodeTriple(base, leaf("a", "VariableRead", "x"), leaf("a", "VariableRead", "a"));

        assertEquals(Revision.MODIFIED, MergeDecision.choose(triple));
    }

    @Test
    void choose_shouldPickBaseline_whenOnlyModifiedChangedByDeleting() {
        Tree base = leaf("a", "VariableRead", "a");
        NodeTriple triple = new NodeTriple(base, null, leaf("a", "VariableRead", "a"));

        assertEquals(Revision.BASELINE, MergeDecision.choose(triple));
    }

    @Test
    void choose_shouldPickModified_whenBothSidesMadeTheSameChange() {
        Tree base = leaf("a", "VariableRead", "a");
        NodeTriple triple = new NodeTriple(base, leaf("a", "VariableRead", "x"), leaf("a", "VariableRead", "x"));

        assertEquals(Revision.MODIFIED, MergeDecision.choose(triple));
    }

    @Test
    void choose_shouldPickBaseline_whenBothSidesChangedDifferently() {
        Tree base = leaf("a", "VariableRead", "a");
        NodeTriple triple = new NodeTriple(base, leaf("a", "VariableRead", "x"), leaf("a", "VariableRead", "y"));

        assertEquals(Revision.BASELINE, MergeDecision.choose(triple));
    }

    @Test
    void choose_shouldConsiderWholeSubtrees_whenOwnContentIsUnchanged() {
        Tree base = node("r", "Return", "", leaf("a", "VariableRead", "a"));
        Tree mod = node("r", "Return", "", leaf("a", "VariableRead", "x"));
        Tree pat = node("r", "Return", "", leaf("a", "VariableRead", "a"));

        assertEquals(Revision.MODIFIED, MergeDecision.choose(new NodeTriple(base, mod, pat)));
    }

    @Test
    void decide_shouldReturnDetachedCopyOfWinner() {
        Tree base = node("r", "Return", "", leaf("a", "VariableRead", "a"));
        Tree mod = node("r", "Return", "", leaf("a", "VariableRead", "x"));
        Tree pat = node("r", "Return", "", leaf("a", "VariableRead", "a"));

        Tree decided = MergeDecision.decide(new NodeTriple(base, mod, pat));

        assertNotSame(mod, decided);
        assertNull(decided.getParent());
        assertTrue(decided.getChildren().isEmpty());
        assertEquals("Return", decided.getType().name);
        assertEquals(Revision.MODIFIED, decided.getMetadata(Revision.KEY));
    }

    @Test
    void decide_shouldNotChangeTheTripleNodes() {
        Tree base = node("r", "Return", "", leaf("a", "VariableRead", "a"));
        Tree mod = node("r", "Return", "", leaf("a", "VariableRead", "x"));

        MergeDecision.decide(new NodeTriple(base, mod, base));

        assertEquals(1, mod.getChildren().size());
        assertNull(mod.getMetadata(Revision.KEY));
        assertNull(base.getMetadata(Revision.KEY));
    }

    @Test
    void decide_shouldRecordDivergentEdit_whenBothSidesChangedOwnContent() {
        MergeSession session = new MergeSession(MergeConfig.defaults());
        Tree base = leaf("a", "VariableRead", "a");
        Tree mod = leaf("a", "VariableRead", "x");
        Tree pat = leaf("a", "VariableRead", "y");

        Tree decided = MergeDecision.decide(new NodeTriple(base, mod, pat), session);

        assertEquals("a", decided.getLabel());
        assertEquals(1, session.getConflicts().size());
        ContentConflict conflict = session.getConflicts().get(0);
        assertEquals(ContentConflict.Kind.DIVERGENT_EDIT, conflict.getKind());
        assertSame(base, conflict.getBaseline());
        assertSame(mod, conflict.getModified());
        assertSame(pat, conflict.getPatched());
    }

    @Test
    void decide_shouldRecordDeleteEdit_whenOneSideDeletedAndTheOtherChanged() {
        MergeSession session = new MergeSession(MergeConfig.defaults());
        Tree base = leaf("a", "VariableRead", "a");
        Tree pat = leaf("a", "VariableRead", "y");

        MergeDecision.decide(new NodeTriple(base, null, pat), session);

        assertEquals(1, session.getConflicts().size());
        ContentConflict conflict = session.getConflicts().get(0);
        assertEquals(ContentConflict.Kind.DELETE_EDIT, conflict.getKind());
        assertNull(conflict.getModified());
        assertSame(pat, conflict.getPatched());
    }

    @Test
    void decide_shouldNotRecordConflict_whenOnlyDescendantsDiverge() {
        MergeSession session = new MergeSession(MergeConfig.defaults());
        Tree base = node("r", "Return", "", leaf("a", "VariableRead", "a"));
        Tree mod = node("r", "Return", "", leaf("a", "VariableRead", "x"));
        Tree pat = node("r", "Return", "", leaf("a", "VariableRead", "y"));

        Tree decided = MergeDecision.decide(new NodeTriple(base, mod, pat), session);

        assertEquals(Revision.BASELINE, decided.getMetadata(Revision.KEY));
        assertTrue(session.getConflicts().isEmpty());
    }

    @Test
    void decide_shouldRecordDiscardedEdit_whenOwnContentEditLosesToDivergingDescendants() {
        MergeSession session = new MergeSession(MergeConfig.defaults());
        Tree base = node("m", "Method", "add", leaf("b", "VariableRead", "b"));
        Tree mod = node("m", "Method", "sum", leaf("b", "VariableRead", "b"));
        Tree pat = node("m", "Method", "add", leaf("b", "VariableRead", "y"));

        Tree decided = MergeDecision.decide(new NodeTriple(base, mod, pat), session);

        assertEquals("add", decided.getLabel());
        assertEquals(1, session.getConflicts().size());
        ContentConflict conflict = session.getConflicts().get(0);
        assertEquals(ContentConflict.Kind.DISCARDED_EDIT, conflict.getKind());
        assertSame(mod, conflict.getModified());
        assertSame(pat, conflict.getPatched());
    }

    @Test
    void decide_shouldRecordDiscardedEdit_whenSameOwnContentEditHasDivergingDescendants() {
        MergeSession session = new MergeSession(MergeConfig.defaults());
        Tree base = node("m", "Method", "add", leaf("b", "VariableRead", "b"));
        Tree mod = node("m", "Method", "sum", leaf("b", "VariableRead", "x"));
        Tree pat = node("m", "Method", "sum", leaf("b", "VariableRead", "y"));

        MergeDecision.decide(new NodeTriple(base, mod, pat), session);

        assertEquals(1, session.getConflicts().size());
        assertEquals(ContentConflict.Kind.DISCARDED_EDIT, session.getConflicts().get(0).getKind());
    }

    @Test
    void decide_shouldNotRecordConflict_whenNeitherSideChanged() {
        MergeSession session = new MergeSession(MergeConfig.defaults());
        Tree base = leaf("a", "VariableRead", "a");

        MergeDecision.decide(NodeTriple.unchanged(base), session);

        assertTrue(session.getConflicts().isEmpty());
    }
}
