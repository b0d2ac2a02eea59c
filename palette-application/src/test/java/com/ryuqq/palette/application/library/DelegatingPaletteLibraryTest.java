package com.ryuqq.palette.application.library;

import com.ryuqq.palette.application.StubHost;
import com.ryuqq.palette.application.loader.LibrarySlot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * DelegatingPaletteLibrary 테스트.
 *
 * @author Palette Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DelegatingPaletteLibraryTest {

    @Mock
    private LibrarySlot slot;

    @Test
    void delegate_EmptySlot_ThrowsIllegalState() {
        // Given
        when(slot.current()).thenReturn(null);
        DelegatingPaletteLibrary handle = new DelegatingPaletteLibrary(slot, LibraryVersion.of("0.3"));

        // When & Then
        IllegalStateException exception = assertThrows(IllegalStateException.class, handle::count);
        assertTrue(exception.getMessage().contains("No palette library installed"));
    }

    @Test
    void delegate_ResolvesSlotOnEveryCall() {
        // Given
        LibraryInstance first = instance("0.3");
        LibraryInstance second = instance("0.4");
        when(slot.current()).thenReturn(first, second);
        DelegatingPaletteLibrary handle = new DelegatingPaletteLibrary(slot, LibraryVersion.of("0.3"));

        // When
        LibraryVersion before = handle.version();
        LibraryVersion after = handle.version();

        // Then
        assertEquals(LibraryVersion.of("0.3"), before);
        assertEquals(LibraryVersion.of("0.4"), after);
        assertEquals(LibraryVersion.of("0.3"), handle.loadedVersion());
        verify(slot, times(2)).current();
    }

    private static LibraryInstance instance(String version) {
        StubHost host = new StubHost(9);
        return LibraryInstance.create(LibraryVersion.of(version), host.accessorSlot, host.descriptors, null,
            new LibraryConfig());
    }

    @Test
    void constructor_NullSlot_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new DelegatingPaletteLibrary(null, LibraryVersion.of("0.3")));
    }
}
