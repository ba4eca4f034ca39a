package search;

/**
 * One pending branch of the approximate search: pattern positions {@code [0, position)} are still
 * to be matched, {@code [lo, hi)} is the interval for the part already consumed, and
 * {@code budget} substitutions remain.
 */
public record Frame(int position, int lo, int hi, int budget) {
}
