package search;

import rank.RankIndex;
import transform.CTable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Bounded-mismatch backward search by depth-first backtracking over the pattern, last position
 * first.
 *
 * Every frame tries each symbol of the alphabet at the current position: the pattern's own symbol
 * keeps the budget, any other symbol spends one substitution. A child whose interval is empty is
 * dropped as soon as it is computed. Children are pushed in descending symbol order so branches
 * are explored in ascending order, which makes the result list reproducible.
 *
 * Only query-local state is allocated, so one instance can serve concurrent queries.
 */
public final class ApproximateSearcher implements SearchAlgorithm {

    private final RankIndex rankIndex;
    private final CTable cTable;

    public ApproximateSearcher(RankIndex rankIndex, CTable cTable) {
        this.rankIndex = Objects.requireNonNull(rankIndex, "rankIndex");
        this.cTable = Objects.requireNonNull(cTable, "cTable");
    }

    public List<SearchInterval> approximateMatch(int[] symbols, int maxMismatches) {
        return search(symbols, maxMismatches).intervals();
    }

    @Override
    public SearchResult search(int[] symbols, int maxMismatches) {
        if (maxMismatches < 0) {
            throw new InvalidBudgetException(maxMismatches);
        }
        final int sigma = cTable.alphabetSize();
        List<SearchInterval> results = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(symbols.length, 0, rankIndex.length(), maxMismatches));
        long expansions = 0;

        while (!stack.isEmpty()) {
            Frame f = stack.pop();
            if (f.position() == 0) {
                results.add(new SearchInterval(f.lo(), f.hi()));
                continue;
            }
            int expected = symbols[f.position() - 1];
            // Symbol 0 is the sentinel and never part of a match.
            for (int s = sigma - 1; s >= 1; s--) {
                boolean match = s == expected;
                if (!match && f.budget() == 0) {
                    continue;
                }
                int base = cTable.get(s);
                int lo = base + rankIndex.rank(s, f.lo());
                int hi = base + rankIndex.rank(s, f.hi());
                expansions++;
                if (lo >= hi) {
                    continue;
                }
                stack.push(new Frame(f.position() - 1, lo, hi, match ? f.budget() : f.budget() - 1));
            }
        }
        return new SearchResult(results, expansions);
    }

    @Override
    public String name() {
        return "backtrack";
    }
}
