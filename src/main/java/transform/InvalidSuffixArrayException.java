package transform;

/**
 * Thrown when a suffix array does not fit its text: wrong length, an entry out of range, a repeated
 * entry, or (with order validation on) two adjacent suffixes out of order. No index is built.
 */
public class InvalidSuffixArrayException extends IllegalArgumentException {

    public InvalidSuffixArrayException(String message) {
        super(message);
    }
}
