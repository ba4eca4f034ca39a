package FMIndex;

import rank.RankIndex;
import suffixarray.SAISSuffixArraySupplier;
import suffixarray.SuffixArraySupplier;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

// Immutable configuration for building BWTIndex instances.
public final class BWTIndexConfiguration {

    public static final String BACKTRACK = "backtrack";
    public static final String MUTATIONS = "mutations";
    private static final Set<String> ALGORITHMS = Set.of(BACKTRACK, MUTATIONS);

    private final int checkpointInterval;
    private final SuffixArraySupplier suffixArraySupplier;
    private final String searchAlgorithm;
    private final boolean validateSuffixOrder;
    private final boolean collectStats;

    private BWTIndexConfiguration(Builder builder) {
        this.checkpointInterval = builder.checkpointInterval;
        this.suffixArraySupplier = Objects.requireNonNull(builder.suffixArraySupplier, "suffixArraySupplier");
        this.searchAlgorithm = Objects.requireNonNull(builder.searchAlgorithm, "searchAlgorithm")
                .toLowerCase(Locale.ROOT);
        this.validateSuffixOrder = builder.validateSuffixOrder;
        this.collectStats = builder.collectStats;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    public static BWTIndexConfiguration defaults() { return builder().build(); }

    private void validate() {
        if (checkpointInterval <= 0) {
            throw new IllegalArgumentException("checkpointInterval must be positive");
        }
        if (!ALGORITHMS.contains(searchAlgorithm)) {
            throw new IllegalArgumentException("unknown search algorithm '" + searchAlgorithm + "', expected one of " + ALGORITHMS);
        }
    }

    public int checkpointInterval() { return checkpointInterval; }
    public SuffixArraySupplier suffixArraySupplier() { return suffixArraySupplier; }
    public String searchAlgorithm() { return searchAlgorithm; }
    public boolean validateSuffixOrder() { return validateSuffixOrder; }
    public boolean collectStats() { return collectStats; }

    public Builder toBuilder() {
        return new Builder()
                .checkpointInterval(checkpointInterval)
                .suffixArraySupplier(suffixArraySupplier)
                .searchAlgorithm(searchAlgorithm)
                .validateSuffixOrder(validateSuffixOrder)
                .collectStats(collectStats);
    }

    public static final class Builder {
        private int checkpointInterval = RankIndex.DEFAULT_CHECKPOINT_INTERVAL;
        private SuffixArraySupplier suffixArraySupplier = new SAISSuffixArraySupplier();
        private String searchAlgorithm = BACKTRACK;
        private boolean validateSuffixOrder;
        private boolean collectStats;

        private Builder() {
        }

        public Builder checkpointInterval(int checkpointInterval) {
            this.checkpointInterval = checkpointInterval;
            return this;
        }

        public Builder suffixArraySupplier(SuffixArraySupplier suffixArraySupplier) {
            this.suffixArraySupplier = suffixArraySupplier;
            return this;
        }

        public Builder searchAlgorithm(String searchAlgorithm) {
            this.searchAlgorithm = searchAlgorithm;
            return this;
        }

        public Builder validateSuffixOrder(boolean validateSuffixOrder) {
            this.validateSuffixOrder = validateSuffixOrder;
            return this;
        }

        public Builder collectStats(boolean collectStats) {
            this.collectStats = collectStats;
            return this;
        }

        public BWTIndexConfiguration build() {
            return new BWTIndexConfiguration(this);
        }
    }
}
