package se.kth.patchmerge.merge;

/**
 * Represents which revision some node of the merged tree takes its content from.
 */
public enum Revision {
    BASELINE, MODIFIED, PATCHED;

    /**
     * Metadata key under which each node of a merged tree stores the {@link Revision} its content was copied from.
     * The key is bookkeeping only, structural identity never looks at it.
     */
    public static final String KEY = "patchmerge_revision";
}
