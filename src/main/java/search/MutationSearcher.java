package search;

import transform.CTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bounded-mismatch search that lists every variant of the pattern within the substitution budget
 * and runs an exact backward search for each.
 *
 * Variants are generated by choosing the substituted positions in increasing order, so each one is
 * produced exactly once. The work grows with {@code (len * sigma)^k} whatever the text holds,
 * which makes {@link ApproximateSearcher} the better choice except for very short patterns; this
 * strategy is mainly useful as an independent cross-check.
 */
public final class MutationSearcher implements SearchAlgorithm {

    private final ExactSearcher exactSearcher;
    private final CTable cTable;

    public MutationSearcher(ExactSearcher exactSearcher, CTable cTable) {
        this.exactSearcher = Objects.requireNonNull(exactSearcher, "exactSearcher");
        this.cTable = Objects.requireNonNull(cTable, "cTable");
    }

    @Override
    public SearchResult search(int[] symbols, int maxMismatches) {
        if (maxMismatches < 0) {
            throw new InvalidBudgetException(maxMismatches);
        }
        List<SearchInterval> results = new ArrayList<>();
        long[] searched = new long[1];
        mutate(symbols.clone(), 0, maxMismatches, results, searched);
        return new SearchResult(results, searched[0]);
    }

    private void mutate(int[] variant, int from, int budget, List<SearchInterval> out, long[] searched) {
        SearchInterval interval = exactSearcher.exactMatch(variant);
        searched[0]++;
        if (!interval.isEmpty()) {
            out.add(interval);
        }
        if (budget == 0) {
            return;
        }
        final int sigma = cTable.alphabetSize();
        for (int pos = from; pos < variant.length; pos++) {
            int original = variant[pos];
            for (int s = 1; s < sigma; s++) {
                if (s == original) continue;
                variant[pos] = s;
                mutate(variant, pos + 1, budget - 1, out, searched);
            }
            variant[pos] = original;
        }
    }

    @Override
    public String name() {
        return "mutations";
    }
}
