package org.Aayush.allocator.core;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.Aayush.allocator.error.ValidationException;
import org.Aayush.allocator.model.Located;

import java.util.List;

/**
 * Dense bidirectional mapping between caller ids and input positions.
 *
 * <p>Immutable and safe for concurrent reads. Construction rejects blank and duplicate ids
 * so every downstream stage can report failures by id unambiguously.</p>
 */
public final class PointIdIndex {
    public static final String REASON_BLANK_ID = "CORE_BLANK_ID";
    public static final String REASON_DUPLICATE_ID = "CORE_DUPLICATE_ID";
    public static final String REASON_UNKNOWN_ID = "CORE_UNKNOWN_ID";

    private final Object2IntOpenHashMap<String> forward;
    private final String[] reverse;

    private PointIdIndex(Object2IntOpenHashMap<String> forward, String[] reverse) {
        this.forward = forward;
        this.reverse = reverse;
    }

    /**
     * Indexes {@code located} by id in input order.
     *
     * @param kind noun used in error messages, for example {@code point} or {@code worker}.
     */
    public static PointIdIndex of(List<? extends Located> located, String kind) {
        int size = located.size();
        Object2IntOpenHashMap<String> forward = new Object2IntOpenHashMap<>(size);
        forward.defaultReturnValue(-1);
        String[] reverse = new String[size];
        for (int i = 0; i < size; i++) {
            String id = located.get(i).getId();
            if (id == null || id.isBlank()) {
                throw new ValidationException(REASON_BLANK_ID, kind + " at position " + i + " has no id");
            }
            int previous = forward.putIfAbsent(id, i);
            if (previous != -1) {
                throw new ValidationException(
                        REASON_DUPLICATE_ID,
                        id,
                        kind + " id appears at positions " + previous + " and " + i
                );
            }
            reverse[i] = id;
        }
        forward.trim();
        return new PointIdIndex(forward, reverse);
    }

    /**
     * Position of {@code id}.
     *
     * @throws ValidationException when the id is unknown.
     */
    public int indexOf(String id) {
        int index = forward.getInt(id);
        if (index == -1) {
            throw new ValidationException(REASON_UNKNOWN_ID, id, "id is not part of the input");
        }
        return index;
    }

    public String idOf(int index) {
        if (index < 0 || index >= reverse.length) {
            throw new IndexOutOfBoundsException("index out of bounds: " + index);
        }
        return reverse[index];
    }

    public boolean contains(String id) {
        return forward.containsKey(id);
    }

    public int size() {
        return reverse.length;
    }
}
