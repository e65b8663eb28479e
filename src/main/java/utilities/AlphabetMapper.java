package utilities;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Maps arbitrary symbols onto dense integer codes so the suffix tree can work over an int[].
 * Codes start at 1; {@link #UNKNOWN} is returned for symbols that were never inserted.
 * Once frozen, the mapper only answers lookups.
 */
public class AlphabetMapper<T> {
    public static final int UNKNOWN = -1;

    int nextId = 1;
    float loadFactor = 0.75f;

    // Primitive map to avoid boxing on every lookup
    private final Object2IntOpenHashMap<T> symbolToId;

    private boolean frozen;

    public AlphabetMapper(int capacity) {
        this.symbolToId = new Object2IntOpenHashMap<>(Math.max(1, capacity), loadFactor);
        this.symbolToId.defaultReturnValue(UNKNOWN);
    }

    public int getSize() {
        return symbolToId.size();
    }

    // Insert-on-miss mapping
    public int getId(T item) {
        int id = symbolToId.getInt(item);
        if (id == UNKNOWN) {
            if (frozen) {
                throw new IllegalStateException("alphabet is frozen");
            }
            id = nextId++;
            symbolToId.put(item, id);
        }
        return id;
    }

    // Read-only mapping, UNKNOWN on miss
    public int lookup(Object item) {
        return symbolToId.getInt(item);
    }

    public void freeze() {
        this.frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }
}
