package search;

/**
 * Strategy that finds every suffix array interval matching a pattern with at most
 * {@code maxMismatches} substitutions.
 */
public interface SearchAlgorithm {

    /**
     * @param symbols       pattern as alphabet ids, {@link utilities.Alphabet#UNKNOWN} for bytes not
     *                      in the text
     * @param maxMismatches substitution budget, non-negative
     * @return distinct, non-empty intervals; their positions may still need deduplication
     * @throws InvalidBudgetException if {@code maxMismatches} is negative
     */
    SearchResult search(int[] symbols, int maxMismatches);

    String name();
}
