package tree;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Arena holding every node of a suffix tree. Nodes are plain int ids; the label of the single
 * edge entering a node is stored on that node as (start, end), where end is either a fixed
 * inclusive index or {@link #OPEN} to follow the shared {@link OpenEnd}.
 *
 * Leaves have no children map. Internal nodes map the first symbol of each outgoing edge to the
 * child id. Suffix links are lateral ids into the same arena, {@link #NO_LINK} when unset.
 *
 * The store is append-only and becomes read-only after {@link #freeze()}.
 */
final class NodeStore {

    static final int ROOT = 0;
    static final int NO_LINK = -1;
    static final int OPEN = -1;
    static final int NO_CHILD = -1;

    // Internal nodes rarely fan out beyond a handful of children.
    private static final int INTERNAL_FANOUT = 4;

    private final OpenEnd openEnd;
    private final boolean checkInvariants;

    private final IntArrayList edgeStart;
    private final IntArrayList edgeEnd;
    private final IntArrayList suffixLink;
    private final IntArrayList suffixStart;
    private final ObjectArrayList<Int2IntOpenHashMap> children;

    private boolean frozen;

    NodeStore(OpenEnd openEnd, SuffixTreeConfiguration configuration) {
        this.openEnd = openEnd;
        this.checkInvariants = configuration.checkInvariants();

        // A tree over n symbols has at most 2n nodes.
        int capacity = Math.max(16, 2 * configuration.expectedLength() + 1);
        this.edgeStart = new IntArrayList(capacity);
        this.edgeEnd = new IntArrayList(capacity);
        this.suffixLink = new IntArrayList(capacity);
        this.suffixStart = new IntArrayList(capacity);
        this.children = new ObjectArrayList<>(capacity);

        // root, id 0
        append(-1, -1, -1, newChildMap(configuration.alphabetSizeHint()));
    }

    // ---- construction (mutable phase) ----

    int newLeaf(int start, int suffixStartPos) {
        ensureMutable();
        checkLabel(start, openEnd.value());
        return append(start, OPEN, suffixStartPos, null);
    }

    int newInternal(int start, int fixedEnd) {
        ensureMutable();
        checkLabel(start, fixedEnd);
        return append(start, fixedEnd, -1, newChildMap(INTERNAL_FANOUT));
    }

    void putChild(int parent, int symbol, int child) {
        ensureMutable();
        Int2IntOpenHashMap map = children.get(parent);
        if (map == null) {
            throw new ConstructionInvariantViolation("node " + parent + " is a leaf and cannot own children");
        }
        map.put(symbol, child);
    }

    // Move the start of a node's incoming edge forward, used when the edge is split above it.
    void advanceStart(int node, int delta) {
        ensureMutable();
        int start = edgeStart.getInt(node) + delta;
        checkLabel(start, edgeEnd(node));
        edgeStart.set(node, start);
    }

    void setSuffixLink(int node, int target) {
        ensureMutable();
        suffixLink.set(node, target);
    }

    void freeze() {
        frozen = true;
        openEnd.freeze();
    }

    boolean isFrozen() {
        return frozen;
    }

    // ---- read access ----

    int child(int node, int symbol) {
        Int2IntOpenHashMap map = children.get(node);
        return map == null ? NO_CHILD : map.get(symbol);
    }

    int edgeStart(int node) {
        return edgeStart.getInt(node);
    }

    // Inclusive end, dereferenced at call time for open edges.
    int edgeEnd(int node) {
        int end = edgeEnd.getInt(node);
        return end == OPEN ? openEnd.value() : end;
    }

    int edgeLength(int node) {
        return edgeEnd(node) - edgeStart(node) + 1;
    }

    boolean isOpen(int node) {
        return edgeEnd.getInt(node) == OPEN;
    }

    boolean isLeaf(int node) {
        return children.get(node) == null;
    }

    int suffixLink(int node) {
        return suffixLink.getInt(node);
    }

    // Starting offset of the suffix spelled by a leaf, -1 for internal nodes.
    int suffixStart(int node) {
        return suffixStart.getInt(node);
    }

    int childCount(int node) {
        Int2IntOpenHashMap map = children.get(node);
        return map == null ? 0 : map.size();
    }

    int size() {
        return edgeStart.size();
    }

    int[] childrenOf(int node) {
        Int2IntOpenHashMap map = children.get(node);
        return map == null ? new int[0] : map.values().toIntArray();
    }

    private int append(int start, int end, int suffixStartPos, Int2IntOpenHashMap childMap) {
        int id = edgeStart.size();
        edgeStart.add(start);
        edgeEnd.add(end);
        suffixLink.add(NO_LINK);
        suffixStart.add(suffixStartPos);
        children.add(childMap);
        return id;
    }

    private Int2IntOpenHashMap newChildMap(int expected) {
        Int2IntOpenHashMap map = new Int2IntOpenHashMap(expected);
        map.defaultReturnValue(NO_CHILD);
        return map;
    }

    private void checkLabel(int start, int end) {
        if (checkInvariants && start > end) {
            throw new ConstructionInvariantViolation("edge label start " + start + " lies past its end " + end);
        }
    }

    private void ensureMutable() {
        if (frozen) {
            throw new IllegalStateException("suffix tree is frozen");
        }
    }
}
