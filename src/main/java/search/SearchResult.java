package search;

import java.util.List;

/**
 * Intervals found by a {@link SearchAlgorithm}, along with how many interval updates it computed.
 */
public record SearchResult(List<SearchInterval> intervals, long branchExpansions) {
}
