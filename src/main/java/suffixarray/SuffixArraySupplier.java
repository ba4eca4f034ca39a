package suffixarray;

/**
 * Produces the suffix array of a text terminated by a virtual sentinel.
 *
 * The returned array has {@code text.length + 1} entries, a permutation of {@code 0..n}, ordered so
 * that the suffixes they start are non-decreasing. Position {@code n} stands for the sentinel-only
 * suffix and therefore always comes first. Bytes compare as unsigned values.
 */
@FunctionalInterface
public interface SuffixArraySupplier {

    int[] suffixArray(byte[] text);
}
