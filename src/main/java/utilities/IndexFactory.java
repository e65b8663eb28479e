package utilities;

import index.ISubstringIndex;
import index.QuadraticSuffixTreeIndex;
import index.SuffixTreeIndex;
import tree.SuffixTreeConfiguration;
import utilities.BenchmarkEnums.IndexType;

/**
 * Central place to construct indexes for benchmarks (Ukkonen and the naive baseline).
 */
public final class IndexFactory {

    private IndexFactory() {}

    public static ISubstringIndex create(IndexType type, String text) {
        return create(type, text, SuffixTreeConfiguration.defaults());
    }

    public static ISubstringIndex create(IndexType type, String text, SuffixTreeConfiguration configuration) {
        switch (type) {
            case UKKONEN:
                return new SuffixTreeIndex(text, configuration);
            case QUADRATIC:
                return new QuadraticSuffixTreeIndex(text);
            default:
                throw new IllegalArgumentException("Unsupported index type: " + type);
        }
    }

    // Configuration tuned for a text: presized arena, alphabet hint from the distinct symbols.
    public static SuffixTreeConfiguration configurationFor(String text, boolean checkInvariants) {
        int distinct = (int) text.chars().distinct().count();
        return SuffixTreeConfiguration.builder()
                .alphabetSizeHint(Math.max(1, distinct))
                .expectedLength(text.length())
                .checkInvariants(checkInvariants)
                .build();
    }
}
