package tree;

/**
 * Runs Ukkonen's online construction over an encoded text, one phase per symbol.
 * Overall O(n): every phase performs amortized O(1) extensions and the skip/count walk-down is
 * bounded by the tree depth it later gives back through suffix links.
 *
 * A builder is single-use and single-threaded.
 */
final class UkkonenBuilder {

    private final SymbolSequence<?> text;
    private final OpenEnd openEnd;
    private final NodeStore store;
    private final boolean checkInvariants;

    private final ActivePoint active = new ActivePoint();
    private int remainder;

    UkkonenBuilder(SymbolSequence<?> text, SuffixTreeConfiguration configuration) {
        this.text = text;
        this.openEnd = new OpenEnd();
        this.store = new NodeStore(openEnd, configuration);
        this.checkInvariants = configuration.checkInvariants();
    }

    /**
     * Process every symbol, then freeze the arena. Returns the number of suffixes left implicit,
     * i.e. suffixes that are prefixes of longer suffixes and therefore own no leaf.
     */
    int build() {
        for (int pos = 0; pos < text.length(); pos++) {
            phase(pos);
        }
        store.freeze();
        return remainder;
    }

    NodeStore store() {
        return store;
    }

    private void phase(int pos) {
        // Every open leaf now covers text[pos].
        openEnd.advance();
        remainder++;
        int lastCreatedInternal = NodeStore.NO_LINK;

        while (remainder > 0) {
            if (active.length == 0) {
                active.edge = pos;
            }

            int edgeSymbol = text.symbolAt(active.edge);
            int next = store.child(active.node, edgeSymbol);

            if (next == NodeStore.NO_CHILD) {
                // No edge starts with edgeSymbol: hang a new leaf off the active node.
                int leaf = store.newLeaf(pos, pos - remainder + 1);
                store.putChild(active.node, edgeSymbol, leaf);

                if (lastCreatedInternal != NodeStore.NO_LINK) {
                    store.setSuffixLink(lastCreatedInternal, active.node);
                    lastCreatedInternal = NodeStore.NO_LINK;
                }
            } else {
                if (walkDown(next)) {
                    continue;
                }

                int current = text.symbolAt(pos);
                if (text.symbolAt(store.edgeStart(next) + active.length) == current) {
                    // Already present implicitly; the rest of this phase is a no-op.
                    active.length++;
                    if (lastCreatedInternal != NodeStore.NO_LINK) {
                        store.setSuffixLink(lastCreatedInternal, active.node);
                    }
                    break;
                }

                int split = splitEdge(edgeSymbol, next, pos);
                if (lastCreatedInternal != NodeStore.NO_LINK) {
                    store.setSuffixLink(lastCreatedInternal, split);
                }
                lastCreatedInternal = split;
            }

            remainder--;
            checkCursor(pos);

            if (active.atRoot() && active.length > 0) {
                active.length--;
                active.edge = pos - remainder + 1;
            } else {
                int link = store.suffixLink(active.node);
                active.node = link == NodeStore.NO_LINK ? NodeStore.ROOT : link;
            }
        }
        checkCursor(pos);
    }

    /**
     * Skip/count: if the active length covers the whole edge into {@code next}, jump to it.
     * Return true when the active point moved and the extension must be retried.
     */
    private boolean walkDown(int next) {
        int edgeLength = store.edgeLength(next);
        if (active.length >= edgeLength) {
            active.edge += edgeLength;
            active.length -= edgeLength;
            active.node = next;
            return true;
        }
        return false;
    }

    // Insert an internal node active.length symbols into the edge towards next.
    private int splitEdge(int edgeSymbol, int next, int pos) {
        int start = store.edgeStart(next);
        int split = store.newInternal(start, start + active.length - 1);
        store.putChild(active.node, edgeSymbol, split);

        int leaf = store.newLeaf(pos, pos - remainder + 1);
        store.putChild(split, text.symbolAt(pos), leaf);

        store.advanceStart(next, active.length);
        store.putChild(split, text.symbolAt(store.edgeStart(next)), next);
        return split;
    }

    private void checkCursor(int pos) {
        if (!checkInvariants) {
            return;
        }
        if (remainder < 0) {
            throw new ConstructionInvariantViolation("remainder went negative at position " + pos);
        }
        if (remainder > pos + 1) {
            throw new ConstructionInvariantViolation("remainder " + remainder + " exceeds the " + (pos + 1) + " symbols read");
        }
        if (active.length < 0) {
            throw new ConstructionInvariantViolation("active length went negative at position " + pos + ", active point " + active);
        }
    }
}
