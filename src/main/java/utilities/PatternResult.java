package utilities;

import search.Pattern;

public record PatternResult(Pattern p, String algorithm, int intervals, int occurrences, long branchExpansions, double totalRunTime) {
}
