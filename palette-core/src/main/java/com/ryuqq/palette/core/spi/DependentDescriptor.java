package com.ryuqq.palette.core.spi;

/**
 * Host render descriptor whose frame count may track the palette count.
 *
 * <p>Sprite sheets loaded from the palette-bearing asset path hold one vertical frame per
 * palette, so their frame height must grow with the registry. The registry never creates
 * or destroys descriptors; it only rewrites {@link #setFrameHeight(int)}.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public interface DependentDescriptor {

    /**
     * Host-side name of the descriptor (e.g. "MechUnit").
     *
     * @return descriptor name
     */
    String name();

    /**
     * Sprite path of the descriptor's image (e.g. "units/player/mech_punch.png").
     *
     * @return sprite path, may be null for descriptors without an image
     */
    String spritePath();

    /**
     * Current frame height (number of vertical frames).
     *
     * @return frame height
     */
    int frameHeight();

    /**
     * Updates the frame height.
     *
     * @param frameHeight new frame height
     */
    void setFrameHeight(int frameHeight);
}
