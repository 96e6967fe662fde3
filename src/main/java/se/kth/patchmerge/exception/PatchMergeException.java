package se.kth.patchmerge.exception;

/**
 * Base exception for patchmerge exceptions.
 *
 * @author Simon Larsén
 */
public abstract class PatchMergeException extends RuntimeException {
    public PatchMergeException(String s) {
        super(s);
    }

    public PatchMergeException(String s, Throwable throwable) {
        super(s, throwable);
    }
}
