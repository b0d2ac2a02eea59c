package com.ryuqq.palette.core.spi;

import com.ryuqq.palette.core.model.Color;

import java.util.List;

/**
 * Process-wide color accessor (the authority token).
 *
 * <p>The host exposes exactly one accessor through its {@link AccessorSlot}. Whichever
 * implementation is installed there answers every palette count and color query in the
 * process: the host's built-in default, a foreign palette library, an older copy of this
 * library, or this library itself.</p>
 *
 * <p><strong>Ownership:</strong> an implementation owns authority while the slot holds
 * a reference to its own accessor instance. Ownership is reference identity, never a flag,
 * so installing any other accessor silently revokes it.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public interface ColorAccessor {

    /**
     * Returns the number of palettes known to this accessor.
     *
     * @return palette count (indices {@code 1..count} are addressable)
     */
    int colorCount();

    /**
     * Returns the colors of the palette at the given 1-based index.
     *
     * @param index 1-based palette index
     * @return the 8 colors in {@link com.ryuqq.palette.core.model.ColorSlot} order,
     *         or null if no palette exists at that index
     */
    List<Color> colorAt(int index);
}
