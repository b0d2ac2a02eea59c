package com.ryuqq.palette.application.library;

import com.ryuqq.palette.core.sync.SynchronizerConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LibraryConfig 테스트.
 *
 * @author Palette Team
 * @since 1.0.0
 */
class LibraryConfigTest {

    @Test
    void defaultConstructor_ForeignIdsEnabledWithDefaultSynchronizer() {
        // When
        LibraryConfig config = new LibraryConfig();

        // Then
        assertTrue(config.foreignIdsEnabled());
        assertEquals(new SynchronizerConfig(), config.synchronizer());
    }

    @Test
    void withForeignIdsEnabled_KeepsSynchronizer() {
        // Given
        SynchronizerConfig synchronizer = new SynchronizerConfig().withPalettePathPrefix("units/custom");

        // When
        LibraryConfig config = new LibraryConfig().withSynchronizer(synchronizer).withForeignIdsEnabled(false);

        // Then
        assertFalse(config.foreignIdsEnabled());
        assertSame(synchronizer, config.synchronizer());
    }

    @Test
    void constructor_NullSynchronizer_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new LibraryConfig(null, true)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }
}
