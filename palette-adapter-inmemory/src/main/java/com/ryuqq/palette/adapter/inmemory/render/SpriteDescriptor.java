package com.ryuqq.palette.adapter.inmemory.render;

import com.ryuqq.palette.core.spi.DependentDescriptor;

/**
 * Mutable sprite animation descriptor held by {@link InMemoryDescriptorCatalog}.
 *
 * @author Palette Team
 * @since 1.0.0
 */
public class SpriteDescriptor implements DependentDescriptor {

    private final String name;
    private final String spritePath;
    private int frameHeight;

    /**
     * Creates a descriptor.
     *
     * @param name descriptor name
     * @param spritePath sprite path (may be null)
     * @param frameHeight initial frame height
     * @throws IllegalArgumentException if name is null or blank, or frameHeight is negative
     */
    public SpriteDescriptor(String name, String spritePath, int frameHeight) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (frameHeight < 0) {
            throw new IllegalArgumentException("frameHeight must be non-negative (current: " + frameHeight + ")");
        }
        this.name = name;
        this.spritePath = spritePath;
        this.frameHeight = frameHeight;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String spritePath() {
        return spritePath;
    }

    @Override
    public int frameHeight() {
        return frameHeight;
    }

    @Override
    public void setFrameHeight(int frameHeight) {
        this.frameHeight = frameHeight;
    }

    @Override
    public String toString() {
        return "SpriteDescriptor{" + name + ", " + spritePath + ", height=" + frameHeight + '}';
    }
}
