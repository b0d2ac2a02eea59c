package com.ryuqq.palette.core.spi;

import java.util.Collection;

/**
 * Host-visible set of render descriptors.
 *
 * <p>The catalog is opaque to the registry beyond each descriptor's sprite path and
 * frame height.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public interface DescriptorCatalog {

    /**
     * Returns every descriptor reachable by the host.
     *
     * @return descriptors (may be empty, never null)
     */
    Collection<? extends DependentDescriptor> descriptors();

    /**
     * Publishes the palette count to the host's render layer.
     *
     * <p>Hosts that mirror the palette count outside of any descriptor (e.g. a global
     * "colors" counter) update it here. The default does nothing.</p>
     *
     * @param paletteCount current palette count
     */
    default void publishPaletteCount(int paletteCount) {
    }
}
