package com.ryuqq.palette.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ColorSlot 테스트.
 *
 * @author Palette Team
 * @since 1.0.0
 */
class ColorSlotTest {

    @Test
    void values_EightSlotsInPaletteOrder() {
        // When
        ColorSlot[] slots = ColorSlot.values();

        // Then
        assertEquals(8, ColorSlot.COUNT);
        assertEquals("PlateHighlight", slots[0].key());
        assertEquals("PlateShadow", slots[5].key());
        assertEquals("BodyHighlight", slots[7].key());
    }

    @Test
    void fromKey_KnownAndUnknownKeys() {
        // When & Then
        assertEquals(ColorSlot.BODY_COLOR, ColorSlot.fromKey("BodyColor"));
        assertNull(ColorSlot.fromKey("bodycolor"));
        assertNull(ColorSlot.fromKey(null));
    }
}
