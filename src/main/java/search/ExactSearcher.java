package search;

import rank.RankIndex;
import transform.CTable;
import utilities.Alphabet;

import java.util.Objects;

/**
 * Backward search: narrows the suffix array interval one pattern symbol at a time, last symbol
 * first, using only the C table and rank queries.
 */
public final class ExactSearcher {

    private final RankIndex rankIndex;
    private final CTable cTable;

    public ExactSearcher(RankIndex rankIndex, CTable cTable) {
        this.rankIndex = Objects.requireNonNull(rankIndex, "rankIndex");
        this.cTable = Objects.requireNonNull(cTable, "cTable");
    }

    /**
     * Interval of rows whose suffixes start with {@code symbols}. An empty pattern matches every
     * row; a symbol outside the alphabet (or the sentinel) matches none.
     */
    public SearchInterval exactMatch(int[] symbols) {
        int lo = 0;
        int hi = rankIndex.length();
        for (int k = symbols.length - 1; k >= 0; k--) {
            int symbol = symbols[k];
            if (!isSearchable(symbol)) {
                return SearchInterval.EMPTY;
            }
            int base = cTable.get(symbol);
            lo = base + rankIndex.rank(symbol, lo);
            hi = base + rankIndex.rank(symbol, hi);
            if (lo >= hi) {
                return SearchInterval.EMPTY;
            }
        }
        return new SearchInterval(lo, hi);
    }

    private boolean isSearchable(int symbol) {
        return symbol > Alphabet.SENTINEL && symbol < cTable.alphabetSize();
    }
}
