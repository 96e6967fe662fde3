package se.kth.patchmerge.exception;

/**
 * Thrown when a unified diff cannot be applied to the baseline revision.
 */
public class PatchException extends PatchMergeException {
    public PatchException(String s) {
        super(s);
    }

    public PatchException(String s, Throwable throwable) {
        super(s, throwable);
    }
}
