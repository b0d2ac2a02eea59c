package com.ryuqq.palette.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Color Value Object 테스트.
 *
 * @author Palette Team
 * @since 1.0.0
 */
class ColorTest {

    @Test
    void of_ValidChannels_CreatesColor() {
        // When
        Color color = Color.of(255, 0, 128);

        // Then
        assertEquals(255, color.red());
        assertEquals(0, color.green());
        assertEquals(128, color.blue());
    }

    @Test
    void of_ChannelAboveMax_ThrowsException() {
        // When & Then
        PaletteValidationException exception = assertThrows(
            PaletteValidationException.class,
            () -> Color.of(10, 256, 10)
        );
        assertTrue(exception.getMessage().contains("green"));
    }

    @Test
    void of_NegativeChannel_ThrowsException() {
        // When & Then
        assertThrows(PaletteValidationException.class, () -> Color.of(-1, 0, 0));
    }

    @Test
    void validationException_IsIllegalArgument() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Color.of(0, 0, 300));
    }

    @Test
    void equals_SameChannels_ReturnsTrue() {
        // Given
        Color first = Color.of(1, 2, 3);
        Color second = Color.of(1, 2, 3);

        // When & Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, Color.of(3, 2, 1));
    }
}
