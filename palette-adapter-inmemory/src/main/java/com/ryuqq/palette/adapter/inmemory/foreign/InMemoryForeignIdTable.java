package com.ryuqq.palette.adapter.inmemory.foreign;

import com.ryuqq.palette.core.spi.ForeignIdTable;

import java.util.HashMap;
import java.util.Map;

/**
 * In-memory implementation of {@link ForeignIdTable}.
 *
 * <p>Mirrors a foreign library's id table, which stores each palette id against its
 * 0-based image offset.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public class InMemoryForeignIdTable implements ForeignIdTable {

    private final Map<Integer, String> idsByOffset = new HashMap<>();

    /**
     * Records a foreign id at the given offset.
     *
     * @param id foreign palette id
     * @param offset 0-based image offset
     * @throws IllegalArgumentException if id is null or blank, or offset is negative
     */
    public void put(String id, int offset) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative (current: " + offset + ")");
        }
        idsByOffset.put(offset, id);
    }

    @Override
    public String idAtOffset(int offset) {
        return idsByOffset.get(offset);
    }

    /**
     * Removes all ids.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        idsByOffset.clear();
    }
}
