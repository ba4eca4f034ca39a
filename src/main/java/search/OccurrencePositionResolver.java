package search;

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

import java.util.Collection;
import java.util.Objects;

/**
 * Turns suffix array intervals into text offsets.
 */
public final class OccurrencePositionResolver {

    private final int[] suffixArray;
    // The sentinel-only suffix starts at n; it is never a real match.
    private final int sentinelPosition;

    public OccurrencePositionResolver(int[] suffixArray) {
        this.suffixArray = Objects.requireNonNull(suffixArray, "suffixArray");
        this.sentinelPosition = suffixArray.length - 1;
    }

    /** Distinct offsets of all intervals in ascending order, the sentinel position excluded. */
    public IntSortedSet resolve(Collection<SearchInterval> intervals) {
        IntSortedSet offsets = new IntRBTreeSet();
        for (SearchInterval interval : intervals) {
            addAll(interval, offsets);
        }
        return offsets;
    }

    public IntSortedSet resolve(SearchInterval interval) {
        IntSortedSet offsets = new IntRBTreeSet();
        addAll(interval, offsets);
        return offsets;
    }

    private void addAll(SearchInterval interval, IntSortedSet offsets) {
        for (int row = interval.lo(); row < interval.hi(); row++) {
            int offset = suffixArray[row];
            if (offset != sentinelPosition) {
                offsets.add(offset);
            }
        }
    }
}
