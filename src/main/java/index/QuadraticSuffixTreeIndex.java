package index;

import tree.SuffixTreeQuadratic;
import utilities.BenchmarkEnums.IndexType;

// Baseline index built by inserting every suffix separately, O(n^2) construction.
public class QuadraticSuffixTreeIndex implements ISubstringIndex {

    private final SuffixTreeQuadratic<Character> tree;

    public QuadraticSuffixTreeIndex(String text) {
        this.tree = SuffixTreeQuadratic.build(text);
    }

    @Override
    public boolean contains(String pattern) {
        return tree.contains(pattern);
    }

    @Override
    public int textLength() {
        return tree.textLength();
    }

    @Override
    public String name() {
        return IndexType.QUADRATIC.displayName();
    }
}
