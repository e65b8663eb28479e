package index;

import tree.SuffixTree;
import tree.SuffixTreeConfiguration;
import tree.TreeStats;
import utilities.BenchmarkEnums.IndexType;

/**
 * Character index backed by the online (Ukkonen) suffix tree. Construction is linear in the text
 * length; each query is linear in the pattern length.
 */
public class SuffixTreeIndex implements ISubstringIndex {

    private final SuffixTree<Character> tree;

    public SuffixTreeIndex(String text) {
        this(text, SuffixTreeConfiguration.defaults());
    }

    public SuffixTreeIndex(String text, SuffixTreeConfiguration configuration) {
        this.tree = SuffixTree.buildIndex(text, configuration);
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
        return IndexType.UKKONEN.displayName();
    }

    public TreeStats stats() {
        return tree.stats();
    }

    public SuffixTree<Character> tree() {
        return tree;
    }
}
