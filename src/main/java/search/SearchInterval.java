package search;

/**
 * Half-open range {@code [lo, hi)} of suffix array rows whose suffixes start with the pattern
 * suffix processed so far. {@code lo == hi} means no match.
 */
public record SearchInterval(int lo, int hi) {

    public static final SearchInterval EMPTY = new SearchInterval(0, 0);

    public SearchInterval {
        if (lo < 0 || lo > hi) {
            throw new IllegalArgumentException("invalid interval [" + lo + ", " + hi + ")");
        }
    }

    public static SearchInterval full(int length) {
        return new SearchInterval(0, length);
    }

    public boolean isEmpty() {
        return lo == hi;
    }

    public int size() {
        return hi - lo;
    }
}
