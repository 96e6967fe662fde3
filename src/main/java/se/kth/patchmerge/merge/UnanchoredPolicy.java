package se.kth.patchmerge.merge;

/**
 * What to do with a new node whose whole ancestor chain is new as well, i.e. a node for which no insertion point
 * in the merged tree can be derived.
 */
public enum UnanchoredPolicy {
    /** Leave the node out of the merged tree, and record and log it. */
    REPORT,
    /** Append the node to the root of the merged tree, and record and log it. */
    ATTACH_TO_ROOT,
    /** Fail the merge. */
    FAIL
}
