package tree;

import utilities.IndexLogger;

import java.util.List;
import java.util.Locale;

/**
 * Read-only suffix tree over a {@link SymbolSequence}, built online with Ukkonen's algorithm.
 * No terminal sentinel is appended, so suffixes that are prefixes of other suffixes stay
 * implicit; containment queries are unaffected.
 *
 * Instances are immutable once returned from {@link #buildIndex}: the node arena and the shared
 * leaf end are frozen, and any number of threads may call the {@code contains} methods without
 * synchronisation.
 */
public final class SuffixTree<T> {

    private final SymbolSequence<T> text;
    private final NodeStore store;
    private final int implicitSuffixes;

    private SuffixTree(SymbolSequence<T> text, NodeStore store, int implicitSuffixes) {
        this.text = text;
        this.store = store;
        this.implicitSuffixes = implicitSuffixes;
    }

    public static <T> SuffixTree<T> buildIndex(SymbolSequence<T> symbols) {
        return buildIndex(symbols, SuffixTreeConfiguration.defaults());
    }

    public static <T> SuffixTree<T> buildIndex(SymbolSequence<T> symbols, SuffixTreeConfiguration configuration) {
        if (symbols == null) {
            throw new InvalidInputException("symbol sequence cannot be null");
        }
        if (configuration == null) {
            throw new InvalidInputException("configuration cannot be null");
        }
        long startNs = System.nanoTime();
        UkkonenBuilder builder = new UkkonenBuilder(symbols, configuration);
        int implicit = builder.build();
        SuffixTree<T> tree = new SuffixTree<>(symbols, builder.store(), implicit);

        if (IndexLogger.isDebugEnabled()) {
            IndexLogger.debug(String.format(Locale.ROOT,
                    "Built suffix tree: symbols=%d alphabet=%d nodes=%d implicit=%d in %.3f ms",
                    symbols.length(), symbols.alphabetSize(), tree.store.size(), implicit,
                    (System.nanoTime() - startNs) / 1_000_000.0));
        }
        return tree;
    }

    public static SuffixTree<Character> buildIndex(CharSequence text) {
        return buildIndex(SymbolSequence.ofString(text));
    }

    public static SuffixTree<Character> buildIndex(CharSequence text, SuffixTreeConfiguration configuration) {
        return buildIndex(SymbolSequence.ofString(text), configuration);
    }

    public boolean contains(List<T> pattern) {
        return containsEncoded(text.encode(pattern));
    }

    /**
     * Character pattern query. Only valid for trees over characters, as built by
     * {@link #buildIndex(CharSequence)}; any other tree rejects it with {@link InvalidInputException}
     * rather than answering false.
     */
    public boolean contains(CharSequence pattern) {
        return containsEncoded(text.encode(pattern));
    }

    /**
     * Walk the pattern down from the root. Runs in O(m) for a pattern of m symbols and never
     * touches the arena's mutable state.
     */
    public boolean containsEncoded(int[] pattern) {
        if (pattern == null) {
            throw new InvalidInputException("pattern cannot be null");
        }
        if (pattern.length > text.length()) {
            return false;
        }

        int node = NodeStore.ROOT;
        int patternIndex = 0;

        while (patternIndex < pattern.length) {
            int next = store.child(node, pattern[patternIndex]);
            if (next == NodeStore.NO_CHILD) {
                return false;
            }

            int edgeStart = store.edgeStart(next);
            int edgeLen = store.edgeLength(next);
            int consumed = 0;
            while (consumed < edgeLen && patternIndex < pattern.length) {
                if (text.symbolAt(edgeStart + consumed) != pattern[patternIndex]) {
                    return false;
                }
                consumed++;
                patternIndex++;
            }

            // Whole edge matched and pattern left over: descend.
            node = next;
        }
        return true;
    }

    public int textLength() {
        return text.length();
    }

    public SymbolSequence<T> sequence() {
        return text;
    }

    public TreeStats stats() {
        int leaves = 0;
        for (int node = 1; node < store.size(); node++) {
            if (store.isLeaf(node)) {
                leaves++;
            }
        }
        return new TreeStats(store.size(), store.size() - 1 - leaves, leaves, implicitSuffixes);
    }

    // Package-private view for structural checks in tests.
    NodeStore store() {
        return store;
    }
}
