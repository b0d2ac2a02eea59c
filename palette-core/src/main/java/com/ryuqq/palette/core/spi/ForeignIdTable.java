package com.ryuqq.palette.core.spi;

/**
 * Palette id table published by a foreign palette library.
 *
 * <p>The foreign library keys its palettes by image offset (0-based) rather than by
 * palette index. It is consulted only as a migration fallback when naming palettes
 * that this library did not register itself.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ForeignIdTable {

    /**
     * Looks up the foreign id registered at the given offset.
     *
     * @param offset 0-based image offset
     * @return foreign palette id, or null if the table has no entry at that offset
     */
    String idAtOffset(int offset);
}
