package org.Aayush.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * {@link IDMapper} backed by a fastutil open hash map for the forward lookup and a plain
 * array for the reverse lookup.
 *
 * <p>Immutable after construction and safe for concurrent reads.</p>
 */
public class FastUtilIDMapper implements IDMapper {
    private static final int MISSING = -1;

    private final Object2IntOpenHashMap<String> forward;
    private final String[] reverse;

    /**
     * Builds the mapper from ids in declaration order.
     *
     * @param externalIds distinct, non-blank ids.
     * @throws IllegalArgumentException on null list, null/blank id, or duplicate id.
     */
    public FastUtilIDMapper(List<String> externalIds) {
        if (externalIds == null) {
            throw new IllegalArgumentException("External ids cannot be null");
        }
        int size = externalIds.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new String[size];

        for (int i = 0; i < size; i++) {
            String id = externalIds.get(i);
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("External id at position " + i + " is null or blank");
            }
            if (forward.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate external id: " + id);
            }
            forward.put(id, i);
            reverse[i] = id;
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(String externalId) throws UnknownIDException {
        // getInt avoids boxing
        int id = forward.getInt(externalId);
        if (id == MISSING) {
            throw new UnknownIDException("External ID not found: " + externalId);
        }
        return id;
    }

    @Override
    public String toExternal(int internalId) {
        if (!containsInternal(internalId)) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(String externalId) {
        return forward.containsKey(externalId);
    }

    @Override
    public boolean containsInternal(int internalId) {
        return internalId >= 0 && internalId < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
