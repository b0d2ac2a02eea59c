package com.ryuqq.palette.application.library;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * LibraryVersion Value Object 테스트.
 *
 * @author Palette Team
 * @since 1.0.0
 */
class LibraryVersionTest {

    @Test
    void of_ValidValue_CreatesVersion() {
        // When
        LibraryVersion version = LibraryVersion.of("1.10.2");

        // Then
        assertEquals("1.10.2", version.getValue());
    }

    @Test
    void compareTo_NumericComponents_NotLexicographic() {
        // When & Then
        assertTrue(LibraryVersion.of("0.10").isAtLeast(LibraryVersion.of("0.9")));
        assertFalse(LibraryVersion.of("0.9").isAtLeast(LibraryVersion.of("0.10")));
    }

    @Test
    void compareTo_MissingComponentsAreZero() {
        // Given
        LibraryVersion shortForm = LibraryVersion.of("0.4");
        LibraryVersion longForm = LibraryVersion.of("0.4.0");

        // When & Then
        assertEquals(0, shortForm.compareTo(longForm));
        assertEquals(shortForm, longForm);
        assertEquals(shortForm.hashCode(), longForm.hashCode());
        assertTrue(LibraryVersion.of("0.4.1").isAtLeast(shortForm));
    }

    @Test
    void sort_OrdersAscending() {
        // Given
        List<LibraryVersion> versions = new ArrayList<>(List.of(
            LibraryVersion.of("0.4"), LibraryVersion.of("0.10"), LibraryVersion.of("0.3"), LibraryVersion.of("1")
        ));

        // When
        Collections.sort(versions);

        // Then
        assertThat(versions).extracting(LibraryVersion::getValue).containsExactly("0.3", "0.4", "0.10", "1");
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> LibraryVersion.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_NonNumericValue_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> LibraryVersion.of("0.4-beta"));
        assertThrows(IllegalArgumentException.class, () -> LibraryVersion.of("v1"));
        assertThrows(IllegalArgumentException.class, () -> LibraryVersion.of("1..2"));
    }

    @Test
    void toString_ContainsValue() {
        // When & Then
        assertEquals("LibraryVersion{0.4}", LibraryVersion.of("0.4").toString());
    }
}
