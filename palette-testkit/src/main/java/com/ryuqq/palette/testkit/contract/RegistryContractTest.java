package com.ryuqq.palette.testkit.contract;

import com.ryuqq.palette.application.library.PaletteLibrary;
import com.ryuqq.palette.core.model.ColorSlot;
import com.ryuqq.palette.core.model.PaletteDefinition;
import com.ryuqq.palette.core.model.PaletteEntry;
import com.ryuqq.palette.core.model.PaletteValidationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for registration and queries.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>New ids get the next dense index; duplicate ids are no-ops</li>
 *   <li>id ↔ index and id ↔ offset round trips hold for every palette</li>
 *   <li>count never decreases and indices are never reassigned</li>
 *   <li>Invalid input fails before any state change</li>
 *   <li>Unknown ids and out-of-range indices resolve to null</li>
 * </ul>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public abstract class RegistryContractTest extends AbstractContractTest {

    @Test
    void testRegister_NewId_AssignsNextIndex() {
        // Given
        PaletteLibrary palettes = load("0.4");
        int before = palettes.count();

        // When
        boolean added = palettes.register("SandDune", "Desert Sand", rawColors(1));

        // Then
        assertTrue(added);
        assertEquals(before + 1, palettes.count());
        assertEquals(before + 1, palettes.indexOf("SandDune"));
        assertEquals("SandDune", palettes.idAt(before + 1));
        assertEquals("Desert Sand", palettes.nameOf("SandDune"));
    }

    @Test
    void testRegister_SameIdTwice_SecondIsNoOp() {
        // Given
        PaletteLibrary palettes = load("0.4");
        palettes.register("SandDune", "Desert Sand", rawColors(1));
        PaletteEntry first = palettes.get("SandDune");
        int countAfterFirst = palettes.count();

        // When: same id, different name and colors
        boolean added = palettes.register("SandDune", "Something Else", rawColors(2));

        // Then
        assertFalse(added, "Duplicate registration should report added=false");
        assertEquals(countAfterFirst, palettes.count());
        assertEquals(first, palettes.get("SandDune"));
        assertEquals("Desert Sand", palettes.nameOf("SandDune"));
    }

    @Test
    void testRegister_ManyIds_BijectionHolds() {
        // Given
        PaletteLibrary palettes = load("0.4");

        // When
        for (int i = 0; i < 25; i++) {
            palettes.register(definition("Custom" + i));
        }

        // Then
        assertEquals(9 + 25, palettes.count());
        assertBijection(palettes);
    }

    @Test
    void testOffsets_RoundTripForEveryPalette() {
        // Given
        PaletteLibrary palettes = load("0.4");
        palettes.registerAll(List.of(definition("Alpha"), definition("Beta"), definition("Gamma")));

        // When & Then
        for (int offset = 0; offset < palettes.count(); offset++) {
            assertEquals(offset, palettes.idToOffset(palettes.offsetToId(offset)));
        }
        for (String id : List.of("RiftWalkers", "SecretSquad", "Alpha", "Gamma")) {
            assertEquals(id, palettes.offsetToId(palettes.idToOffset(id)));
        }
        assertEquals(0, palettes.idToOffset("RiftWalkers"));
    }

    @Test
    void testRegister_CountIsMonotonicAndIndicesStable() {
        // Given
        PaletteLibrary palettes = load("0.4");
        List<Integer> counts = new ArrayList<>();
        Map<String, Integer> assigned = new LinkedHashMap<>();

        // When: mix of new ids and duplicates
        for (String id : List.of("A", "B", "A", "C", "B", "D")) {
            palettes.register(definition(id));
            counts.add(palettes.count());
            assigned.putIfAbsent(id, palettes.indexOf(id));
        }

        // Then
        for (int i = 1; i < counts.size(); i++) {
            assertThat(counts.get(i)).isGreaterThanOrEqualTo(counts.get(i - 1));
        }
        assigned.forEach((id, index) -> assertEquals(index, palettes.indexOf(id)));
        assertEquals(13, palettes.count());
    }

    @Test
    void testRegister_MissingSlot_FailsWithoutStateChange() {
        // Given
        PaletteLibrary palettes = load("0.4");
        Map<String, List<Integer>> sevenSlots = new LinkedHashMap<>(rawColors(3));
        sevenSlots.remove(ColorSlot.BODY_HIGHLIGHT.key());
        int before = palettes.count();

        // When & Then
        assertThatThrownBy(() -> palettes.register("x", null, sevenSlots))
            .isInstanceOf(PaletteValidationException.class)
            .hasMessageContaining("BodyHighlight");
        assertEquals(before, palettes.count());
        assertNull(palettes.get("x"));
    }

    @Test
    void testRegister_InvalidChannel_FailsWithoutStateChange() {
        // Given
        PaletteLibrary palettes = load("0.4");
        Map<String, List<Integer>> colors = new LinkedHashMap<>(rawColors(3));
        colors.put(ColorSlot.PLATE_MID.key(), List.of(12, 256, 0));

        // When & Then
        assertThrows(PaletteValidationException.class, () -> palettes.register("x", null, colors));
        assertEquals(9, palettes.count());
    }

    @Test
    void testRegister_TwoChannelColor_Fails() {
        // Given
        PaletteLibrary palettes = load("0.4");
        Map<String, List<Integer>> colors = new LinkedHashMap<>(rawColors(3));
        colors.put(ColorSlot.PLATE_MID.key(), List.of(12, 34));

        // When & Then
        assertThatThrownBy(() -> palettes.register("x", null, colors))
            .isInstanceOf(PaletteValidationException.class)
            .hasMessageContaining("three integers");
    }

    @Test
    void testRegister_MissingOrEmptyId_Fails() {
        // Given
        PaletteLibrary palettes = load("0.4");

        // When & Then
        assertThrows(PaletteValidationException.class, () -> palettes.register("", null, rawColors(4)));
        assertThrows(PaletteValidationException.class, () -> palettes.register(null, null, rawColors(4)));
        assertEquals(9, palettes.count());
    }

    @Test
    void testRegister_WhitespaceIdAndEmptyName_Accepted() {
        // Given
        PaletteLibrary palettes = load("0.4");

        // When
        boolean spaceId = palettes.register(" ", null, rawColors(4));
        boolean emptyName = palettes.register("Named", "", rawColors(5));

        // Then
        assertTrue(spaceId);
        assertTrue(emptyName);
        assertEquals(10, palettes.indexOf(" "));
        assertEquals(" ", palettes.nameOf(" "));
        assertEquals("", palettes.nameOf("Named"));
        assertEquals(11, palettes.count());
    }

    @Test
    void testRegisterAll_OneInvalid_NothingRegistered() {
        // Given
        PaletteLibrary palettes = load("0.4");
        PaletteDefinition invalid = new PaletteDefinition("Broken", null, Map.of());

        // When & Then
        assertThrows(PaletteValidationException.class,
            () -> palettes.registerAll(List.of(definition("Valid"), invalid)));
        assertNull(palettes.get("Valid"));
        assertEquals(9, palettes.count());
    }

    @Test
    void testRegisterAll_DuplicateWithinBatch_CountedOnce() {
        // Given
        PaletteLibrary palettes = load("0.4");

        // When
        int added = palettes.registerAll(List.of(definition("Twin"), definition("Twin"), definition("Solo")));

        // Then
        assertEquals(2, added);
        assertEquals(11, palettes.count());
    }

    @Test
    void testNameOf_FallsBackToId() {
        // Given
        PaletteLibrary palettes = load("0.4");
        palettes.register(definition("Unnamed"));

        // When & Then
        assertEquals("Unnamed", palettes.nameOf("Unnamed"));
        assertNull(palettes.get("Unnamed").name());
        assertEquals("Archive Olive", palettes.nameOf("RiftWalkers"));
    }

    @Test
    void testQueries_UnknownValues_ReturnNull() {
        // Given
        PaletteLibrary palettes = load("0.4");

        // When & Then
        assertNull(palettes.get("Missing"));
        assertNull(palettes.indexOf("Missing"));
        assertNull(palettes.idToOffset("Missing"));
        assertNull(palettes.nameOf("Missing"));
        assertNull(palettes.idAt(0));
        assertNull(palettes.idAt(palettes.count() + 1));
        assertNull(palettes.offsetToId(-1));
        assertNull(palettes.offsetToId(palettes.count()));
        assertNull(palettes.colorsAt(palettes.count() + 1));
    }

    @Test
    void testColorsAt_ReturnsRegisteredColorsInSlotOrder() {
        // Given
        PaletteLibrary palettes = load("0.4");
        palettes.register("SandDune", null, rawColors(7));

        // When
        int index = palettes.indexOf("SandDune");

        // Then
        assertEquals(colors(7), palettes.colorsAt(index));
        assertEquals(colors(7), palettes.get("SandDune").colors());
    }
}
