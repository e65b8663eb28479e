package tree;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

import java.util.List;

/**
 * Naive suffix tree: every suffix is inserted from the root, splitting edges where it diverges.
 * Quadratic construction, same containment semantics as {@link SuffixTree}. Kept as a baseline
 * for benchmarks and as an independent oracle in tests.
 */
public final class SuffixTreeQuadratic<T> {

    private final SymbolSequence<T> text;
    private final Node root;

    private SuffixTreeQuadratic(SymbolSequence<T> text, Node root) {
        this.text = text;
        this.root = root;
    }

    public static <T> SuffixTreeQuadratic<T> build(SymbolSequence<T> symbols) {
        if (symbols == null) {
            throw new InvalidInputException("symbol sequence cannot be null");
        }
        Node root = new Node();
        for (int i = 0; i < symbols.length(); i++) {
            insertSuffix(root, symbols, i);
        }
        return new SuffixTreeQuadratic<>(symbols, root);
    }

    public static SuffixTreeQuadratic<Character> build(CharSequence text) {
        return build(SymbolSequence.ofString(text));
    }

    public boolean contains(List<T> pattern) {
        return containsEncoded(text.encode(pattern));
    }

    public boolean contains(CharSequence pattern) {
        return containsEncoded(text.encode(pattern));
    }

    public boolean containsEncoded(int[] pattern) {
        if (pattern == null) {
            throw new InvalidInputException("pattern cannot be null");
        }
        Node current = root;
        int patternIndex = 0;
        while (patternIndex < pattern.length) {
            Edge edge = current.edges.get(pattern[patternIndex]);
            if (edge == null) {
                return false;
            }
            int edgeLen = edge.end - edge.start + 1;
            int consumed = 0;
            while (consumed < edgeLen && patternIndex < pattern.length) {
                if (text.symbolAt(edge.start + consumed) != pattern[patternIndex]) {
                    return false;
                }
                consumed++;
                patternIndex++;
            }
            current = edge.child;
        }
        return true;
    }

    public int textLength() {
        return text.length();
    }

    private static void insertSuffix(Node root, SymbolSequence<?> text, int suffixStart) {
        Node current = root;
        int index = suffixStart;
        int last = text.length() - 1;
        while (index <= last) {
            int symbol = text.symbolAt(index);
            Edge edge = current.edges.get(symbol);
            if (edge == null) {
                current.edges.put(symbol, new Edge(index, last, new Node()));
                return;
            }

            int edgeLen = edge.end - edge.start + 1;
            int matched = 0;
            while (matched < edgeLen && index + matched <= last
                    && text.symbolAt(edge.start + matched) == text.symbolAt(index + matched)) {
                matched++;
            }

            if (matched == edgeLen) {
                current = edge.child;
                index += edgeLen;
                continue;
            }
            if (index + matched > last) {
                // Suffix ends inside the edge: it is a prefix of a longer suffix.
                return;
            }

            Node split = new Node();
            current.edges.put(symbol, new Edge(edge.start, edge.start + matched - 1, split));
            split.edges.put(text.symbolAt(edge.start + matched), new Edge(edge.start + matched, edge.end, edge.child));
            split.edges.put(text.symbolAt(index + matched), new Edge(index + matched, last, new Node()));
            return;
        }
    }

    private static final class Node {
        private final Int2ObjectOpenHashMap<Edge> edges = new Int2ObjectOpenHashMap<>(4);
    }

    // Edge label as inclusive [start, end] into the text.
    private static final class Edge {
        private final int start;
        private final int end;
        private final Node child;

        private Edge(int start, int end, Node child) {
            this.start = start;
            this.end = end;
            this.child = child;
        }
    }
}
