package com.ryuqq.palette.adapter.inmemory.render;

import com.ryuqq.palette.core.authority.BuiltinPalettes;
import com.ryuqq.palette.core.spi.DescriptorCatalog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-memory implementation of {@link DescriptorCatalog}.
 *
 * <p>Descriptors are kept by name in insertion order. The catalog also mirrors the
 * published palette count, the way a host keeps a global colors counter.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryDescriptorCatalog catalog = InMemoryDescriptorCatalog.withBaseDescriptors();
 * catalog.add("PunchMech", "units/player/mech_punch.png", 9);
 * catalog.add("Explosion", "effects/explo.png", 5);
 * </pre>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public class InMemoryDescriptorCatalog implements DescriptorCatalog {

    private final Map<String, SpriteDescriptor> descriptors = new LinkedHashMap<>();
    private int paletteCount;

    /**
     * Creates an empty catalog.
     */
    public InMemoryDescriptorCatalog() {
        this.paletteCount = BuiltinPalettes.COUNT;
    }

    /**
     * Creates a catalog seeded with the host's base mech descriptors, sized for the built-in palettes.
     *
     * <p>"MechUnit" uses the palette sprite path; "MechIcon" does not and relies on being a
     * base descriptor to stay in sync.</p>
     *
     * @return seeded catalog
     */
    public static InMemoryDescriptorCatalog withBaseDescriptors() {
        InMemoryDescriptorCatalog catalog = new InMemoryDescriptorCatalog();
        catalog.addBaseDescriptors();
        return catalog;
    }

    /**
     * Adds the base mech descriptors sized for the built-in palettes.
     */
    public void addBaseDescriptors() {
        add("MechUnit", "units/player/mech_base.png", BuiltinPalettes.COUNT);
        add("MechIcon", "ui/mech_icon.png", BuiltinPalettes.COUNT);
    }

    /**
     * Adds or replaces a descriptor.
     *
     * @param name descriptor name
     * @param spritePath sprite path
     * @param frameHeight frame height
     * @return the added descriptor
     */
    public SpriteDescriptor add(String name, String spritePath, int frameHeight) {
        SpriteDescriptor descriptor = new SpriteDescriptor(name, spritePath, frameHeight);
        descriptors.put(name, descriptor);
        return descriptor;
    }

    /**
     * Looks up a descriptor by name.
     *
     * @param name descriptor name
     * @return descriptor, or null if absent
     */
    public SpriteDescriptor get(String name) {
        return descriptors.get(name);
    }

    @Override
    public Collection<SpriteDescriptor> descriptors() {
        return Collections.unmodifiableCollection(descriptors.values());
    }

    @Override
    public void publishPaletteCount(int paletteCount) {
        this.paletteCount = paletteCount;
    }

    /**
     * Returns the last published palette count.
     *
     * @return palette count
     */
    public int getPaletteCount() {
        return paletteCount;
    }

    /**
     * Removes all descriptors.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        descriptors.clear();
        paletteCount = BuiltinPalettes.COUNT;
    }
}
