package suffixarray;

import java.util.Arrays;
import java.util.Objects;

/**
 * Sorts all suffix start positions with a comparison sort.
 *
 * This is a correctness-first fallback, not a performance choice: every comparison may walk the
 * common prefix of two suffixes, so highly repetitive texts cost up to O(n^2 log n). Use
 * {@link SAISSuffixArraySupplier} for anything but small inputs.
 */
public final class NaiveSuffixArraySupplier implements SuffixArraySupplier {

    @Override
    public int[] suffixArray(byte[] text) {
        Objects.requireNonNull(text, "text");
        Integer[] positions = new Integer[text.length + 1];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = i;
        }
        Arrays.sort(positions, (a, b) -> SuffixArrays.compareSuffixes(text, a, b));

        int[] sa = new int[positions.length];
        for (int i = 0; i < sa.length; i++) {
            sa[i] = positions[i];
        }
        return sa;
    }
}
