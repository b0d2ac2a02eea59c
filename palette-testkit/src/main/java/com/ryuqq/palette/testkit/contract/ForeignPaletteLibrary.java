package com.ryuqq.palette.testkit.contract;

import com.ryuqq.palette.core.model.Color;
import com.ryuqq.palette.core.spi.AccessorSlot;
import com.ryuqq.palette.core.spi.ColorAccessor;

import java.util.ArrayList;
import java.util.List;

/**
 * Foreign palette library living in the same host process.
 *
 * <p>Mirrors what a third-party implementation does: it wraps whatever accessor was
 * installed when it loaded, appends its own palettes after it, publishes their ids
 * by image offset and installs itself as the process-wide accessor.</p>
 *
 * <p>{@link #claimExtra(int)} makes it report more palettes than it can return,
 * simulating an inconsistent implementation.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public class ForeignPaletteLibrary implements ColorAccessor {

    private final ColorAccessor previous;
    private final int baseCount;
    private final List<List<Color>> palettes = new ArrayList<>();
    private int extraClaimed;

    private ForeignPaletteLibrary(ColorAccessor previous) {
        this.previous = previous;
        this.baseCount = previous.colorCount();
    }

    /**
     * Loads the foreign library on top of the currently installed accessor.
     *
     * @param slot host accessor slot
     * @return the installed foreign library
     */
    public static ForeignPaletteLibrary installOn(AccessorSlot slot) {
        ForeignPaletteLibrary library = new ForeignPaletteLibrary(slot.current());
        slot.install(library);
        return library;
    }

    /**
     * Adds a palette and publishes its id.
     *
     * @param fixture host fixture receiving the foreign id
     * @param id foreign id
     * @param colors the 8 colors
     * @return 1-based index of the added palette
     */
    public int add(HostFixture fixture, String id, List<Color> colors) {
        palettes.add(List.copyOf(colors));
        int index = baseCount + palettes.size();
        fixture.putForeignId(id, index - 1);
        return index;
    }

    /**
     * Adds a palette without publishing an id for it.
     *
     * @param colors the 8 colors
     * @return 1-based index of the added palette
     */
    public int addUnnamed(List<Color> colors) {
        palettes.add(List.copyOf(colors));
        return baseCount + palettes.size();
    }

    /**
     * Reports {@code extra} more palettes than this library can return.
     *
     * @param extra number of phantom palettes
     */
    public void claimExtra(int extra) {
        this.extraClaimed = extra;
    }

    @Override
    public int colorCount() {
        return baseCount + palettes.size() + extraClaimed;
    }

    @Override
    public List<Color> colorAt(int index) {
        if (index >= 1 && index <= baseCount) {
            return previous.colorAt(index);
        }
        int local = index - baseCount - 1;
        if (local >= 0 && local < palettes.size()) {
            return palettes.get(local);
        }
        return null;
    }

    @Override
    public String toString() {
        return "ForeignPaletteLibrary{count=" + (baseCount + palettes.size()) + '}';
    }
}
