package tree;

/**
 * Shape of a built suffix tree. {@code internalNodes} excludes the root; {@code implicitSuffixes}
 * counts suffixes that end inside the tree without a leaf of their own.
 */
public record TreeStats(int nodes, int internalNodes, int leaves, int implicitSuffixes) {
}
