package se.kth.patchmerge.exception;

/**
 * Generic exception thrown when there is a critical error in the merge. A merge that throws this exception did not
 * happen; no partially merged tree is ever handed out.
 *
 * @author Simon Larsén
 */
public class MergeException extends PatchMergeException {
    public MergeException(String s) {
        super(s);
    }

    public MergeException(String s, Throwable throwable) {
        super(s, throwable);
    }
}
