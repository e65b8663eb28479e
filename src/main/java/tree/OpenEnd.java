package tree;

/**
 * Shared end index of every leaf edge that has not been closed by a split. Advancing it once per
 * phase lengthens all open leaves at the same time.
 */
final class OpenEnd {

    // -1 means no symbol has been consumed yet
    private int value = -1;
    private boolean frozen;

    int value() {
        return value;
    }

    int advance() {
        if (frozen) {
            throw new IllegalStateException("open end is frozen");
        }
        return ++value;
    }

    void freeze() {
        frozen = true;
    }
}
