package com.ryuqq.palette.application.library;

import com.ryuqq.palette.application.StubHost;
import com.ryuqq.palette.core.model.ColorSlot;
import com.ryuqq.palette.core.model.PaletteDefinition;
import com.ryuqq.palette.core.model.PaletteValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LibraryInstance 테스트.
 *
 * @author Palette Team
 * @since 1.0.0
 */
class LibraryInstanceTest {

    private StubHost host;
    private LibraryInstance instance;

    @BeforeEach
    void setUp() {
        host = new StubHost(9);
        instance = LibraryInstance.create(LibraryVersion.of("0.4"), host.accessorSlot, host.descriptors,
            host.foreignIds::get, new LibraryConfig());
    }

    private static PaletteDefinition definition(String id, int seed) {
        return PaletteDefinition.builder(id).colors(StubHost.colors(seed)).build();
    }

    @Test
    void register_BeforeAuthority_MigratesFirst() {
        // When
        boolean added = instance.register(definition("SandDune", 1));

        // Then
        assertTrue(added);
        assertEquals(10, instance.indexOf("SandDune"));
        assertEquals("RiftWalkers", instance.idAt(1));
        assertTrue(instance.ownsAuthority());
    }

    @Test
    void register_RawColorMap_Accepted() {
        // Given
        Map<String, List<Integer>> raw = new LinkedHashMap<>();
        for (ColorSlot slot : ColorSlot.values()) {
            raw.put(slot.key(), List.of(10, 20, 30));
        }

        // When
        boolean added = instance.register("Plain", "Plain Grey", raw);

        // Then
        assertTrue(added);
        assertEquals("Plain Grey", instance.nameOf("Plain"));
    }

    @Test
    void registerAll_Batch_OneSyncPass() {
        // Given
        StubHost.Descriptor punch = host.descriptors.add("PunchMech", "units/player/mech_punch.png", 9);
        instance.ensureAuthority();

        // When
        int added = instance.registerAll(List.of(definition("A", 1), definition("B", 2), definition("A", 3)));

        // Then
        assertEquals(2, added);
        assertEquals(11, punch.frameHeight());
        assertEquals(1, host.descriptors.publishCalls());
        assertEquals(11, host.descriptors.published());
    }

    @Test
    void registerAll_InvalidDefinition_NothingCommittedAndNoTakeover() {
        // Given
        PaletteDefinition broken = PaletteDefinition.builder("Broken")
            .colors(StubHost.colors(4).subList(0, 7))
            .build();

        // When & Then
        assertThrows(PaletteValidationException.class,
            () -> instance.registerAll(List.of(definition("A", 1), broken)));
        assertEquals(0, instance.count());
        assertFalse(instance.ownsAuthority());
    }

    @Test
    void ensureAuthority_ForeignIdsDisabled_UsesIndexIds() {
        // Given
        host.accessorSlot.install(new StubHost.FixedAccessor(10));
        host.foreignIds.put(9, "FurlTeal");
        LibraryInstance withoutForeign = LibraryInstance.create(LibraryVersion.of("0.4"), host.accessorSlot,
            host.descriptors, host.foreignIds::get, new LibraryConfig().withForeignIdsEnabled(false));

        // When
        withoutForeign.ensureAuthority();

        // Then
        assertEquals("10", withoutForeign.idAt(10));
        assertNull(withoutForeign.get("FurlTeal"));
    }

    @Test
    void upgrade_SharesRegistryWithPrevious() {
        // Given
        instance.register(definition("SandDune", 1));

        // When
        LibraryInstance upgraded = LibraryInstance.upgrade(instance, LibraryVersion.of("0.5"), host.accessorSlot,
            host.descriptors, null, new LibraryConfig());
        upgraded.register(definition("Glacier", 2));

        // Then
        assertEquals(11, upgraded.count());
        assertEquals(10, upgraded.indexOf("SandDune"));
        assertEquals(11, instance.indexOf("Glacier"));
        assertTrue(upgraded.ownsAuthority());
        assertFalse(instance.ownsAuthority());
    }

    @Test
    void upgrade_SameOrOlderVersion_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> LibraryInstance.upgrade(instance,
            LibraryVersion.of("0.4"), host.accessorSlot, host.descriptors, null, new LibraryConfig()));
        assertThrows(IllegalArgumentException.class, () -> LibraryInstance.upgrade(instance,
            LibraryVersion.of("0.3"), host.accessorSlot, host.descriptors, null, new LibraryConfig()));
    }

    @Test
    void queries_UnknownValues_ReturnNull() {
        // When & Then
        assertNull(instance.get("Missing"));
        assertNull(instance.indexOf("Missing"));
        assertNull(instance.idToOffset("Missing"));
        assertNull(instance.offsetToId(-1));
        assertNull(instance.nameOf("Missing"));
        assertNull(instance.colorsAt(1));
    }

    @Test
    void register_NullDefinition_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> instance.register((PaletteDefinition) null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }
}
