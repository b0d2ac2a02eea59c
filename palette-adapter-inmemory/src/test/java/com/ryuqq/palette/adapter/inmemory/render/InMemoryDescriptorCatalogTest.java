package com.ryuqq.palette.adapter.inmemory.render;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * InMemoryDescriptorCatalog 테스트.
 *
 * @author Palette Team
 * @since 1.0.0
 */
class InMemoryDescriptorCatalogTest {

    @Test
    void withBaseDescriptors_SeedsMechUnitAndMechIcon() {
        // When
        InMemoryDescriptorCatalog catalog = InMemoryDescriptorCatalog.withBaseDescriptors();

        // Then
        assertThat(catalog.descriptors())
            .extracting(SpriteDescriptor::name)
            .containsExactly("MechUnit", "MechIcon");
        assertEquals(9, catalog.get("MechUnit").frameHeight());
        assertEquals(9, catalog.getPaletteCount());
    }

    @Test
    void add_SameName_ReplacesDescriptor() {
        // Given
        InMemoryDescriptorCatalog catalog = new InMemoryDescriptorCatalog();
        catalog.add("PunchMech", "units/player/mech_punch.png", 9);

        // When
        SpriteDescriptor replaced = catalog.add("PunchMech", "units/player/mech_punch_v2.png", 4);

        // Then
        assertSame(replaced, catalog.get("PunchMech"));
        assertEquals(1, catalog.descriptors().size());
    }

    @Test
    void descriptors_ReturnedView_IsReadOnly() {
        // Given
        InMemoryDescriptorCatalog catalog = InMemoryDescriptorCatalog.withBaseDescriptors();

        // When & Then
        assertThrows(UnsupportedOperationException.class, () -> catalog.descriptors().clear());
    }

    @Test
    void clear_AfterPublish_ResetsCountAndDescriptors() {
        // Given
        InMemoryDescriptorCatalog catalog = InMemoryDescriptorCatalog.withBaseDescriptors();
        catalog.publishPaletteCount(14);

        // When
        catalog.clear();

        // Then
        assertTrue(catalog.descriptors().isEmpty());
        assertEquals(9, catalog.getPaletteCount());
        assertNull(catalog.get("MechUnit"));
    }
}
