package tree;

// Immutable tuning knobs for building a suffix tree. None of them affect query results.
public final class SuffixTreeConfiguration {

    public static final int DEFAULT_ALPHABET_SIZE_HINT = 4;

    private static final SuffixTreeConfiguration DEFAULTS = builder().build();

    private final int alphabetSizeHint;
    private final int expectedLength;
    private final boolean checkInvariants;

    private SuffixTreeConfiguration(Builder builder) {
        this.alphabetSizeHint = builder.alphabetSizeHint;
        this.expectedLength = builder.expectedLength;
        this.checkInvariants = builder.checkInvariants;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    public static SuffixTreeConfiguration defaults() { return DEFAULTS; }

    private void validate() {
        if (alphabetSizeHint <= 0) {
            throw new IllegalArgumentException("alphabetSizeHint must be positive");
        }
        if (expectedLength < 0) {
            throw new IllegalArgumentException("expectedLength must be non-negative");
        }
    }

    public int alphabetSizeHint() { return alphabetSizeHint; }
    public int expectedLength() { return expectedLength; }
    public boolean checkInvariants() { return checkInvariants; }

    @Override
    public String toString() {
        return "SuffixTreeConfiguration{" +
                "alphabetSizeHint=" + alphabetSizeHint +
                ", expectedLength=" + expectedLength +
                ", checkInvariants=" + checkInvariants +
                '}';
    }

    public static final class Builder {
        private int alphabetSizeHint = DEFAULT_ALPHABET_SIZE_HINT;
        private int expectedLength = 0;
        private boolean checkInvariants = true;

        private Builder() {}

        // Expected number of distinct symbols; sizes the root's children map.
        public Builder alphabetSizeHint(int alphabetSizeHint) { this.alphabetSizeHint = alphabetSizeHint; return this; }

        // Expected text length; presizes the node arena.
        public Builder expectedLength(int expectedLength) { this.expectedLength = expectedLength; return this; }

        public Builder checkInvariants(boolean checkInvariants) { this.checkInvariants = checkInvariants; return this; }

        public SuffixTreeConfiguration build() {
            return new SuffixTreeConfiguration(this);
        }
    }
}
