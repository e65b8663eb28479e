package tree;

/**
 * Cursor of Ukkonen's algorithm: we are {@code length} symbols down the edge of {@code node}
 * whose first symbol is the text symbol at {@code edge}.
 */
final class ActivePoint {

    static final int UNSET = -1;

    int node = NodeStore.ROOT;
    int edge = UNSET;
    int length = 0;

    boolean atRoot() {
        return node == NodeStore.ROOT;
    }

    @Override
    public String toString() {
        return "(" + node + ", " + edge + ", " + length + ")";
    }
}
