package com.ryuqq.palette.testkit.contract;

import com.ryuqq.palette.application.loader.PaletteHost;
import com.ryuqq.palette.core.spi.DependentDescriptor;

/**
 * Host under test, as seen by the contract suites.
 *
 * <p>Each adapter module supplies an implementation so the same suites can drive any
 * host: the suites only need to seed descriptors and foreign ids and to observe what
 * the library published.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public interface HostFixture {

    /**
     * Returns the host boundary handed to the loader.
     *
     * @return PaletteHost
     */
    PaletteHost host();

    /**
     * Adds a render descriptor to the host.
     *
     * @param name descriptor name
     * @param spritePath sprite path
     * @param frameHeight initial frame height
     * @return the added descriptor
     */
    DependentDescriptor addDescriptor(String name, String spritePath, int frameHeight);

    /**
     * Looks up a render descriptor by name.
     *
     * @param name descriptor name
     * @return descriptor, or null if absent
     */
    DependentDescriptor descriptor(String name);

    /**
     * Records a foreign library id at a 0-based offset.
     *
     * @param id foreign id
     * @param offset 0-based image offset
     */
    void putForeignId(String id, int offset);

    /**
     * Returns the palette count last published to the host's render layer.
     *
     * @return published palette count
     */
    int publishedPaletteCount();

    /**
     * Restores the host to a freshly started state.
     */
    void clear();
}
