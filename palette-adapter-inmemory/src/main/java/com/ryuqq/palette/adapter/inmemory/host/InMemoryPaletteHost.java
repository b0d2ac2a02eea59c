package com.ryuqq.palette.adapter.inmemory.host;

import com.ryuqq.palette.adapter.inmemory.foreign.InMemoryForeignIdTable;
import com.ryuqq.palette.adapter.inmemory.render.InMemoryDescriptorCatalog;
import com.ryuqq.palette.application.loader.PaletteHost;

/**
 * In-memory host process for testing and reference purposes.
 *
 * <p>Bundles every host boundary the library needs into one object, keeping the
 * concrete types reachable for test setup and assertions.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Single process, no real rendering layer</li>
 *   <li>State lost on process restart</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryPaletteHost host = new InMemoryPaletteHost();
 * PaletteLibrary palettes = new PaletteLibraryLoader(host.toPaletteHost()).load(LibraryVersion.of("0.4"));
 * </pre>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public class InMemoryPaletteHost {

    private final InMemoryAccessorSlot accessorSlot;
    private final InMemoryDescriptorCatalog descriptors;
    private final InMemoryForeignIdTable foreignIds;
    private final InMemoryLibrarySlot librarySlot;

    /**
     * Creates a host exposing only its built-in palettes and base descriptors.
     */
    public InMemoryPaletteHost() {
        this.accessorSlot = new InMemoryAccessorSlot();
        this.descriptors = InMemoryDescriptorCatalog.withBaseDescriptors();
        this.foreignIds = new InMemoryForeignIdTable();
        this.librarySlot = new InMemoryLibrarySlot();
    }

    /**
     * Returns the host boundary consumed by the loader.
     *
     * @return PaletteHost
     */
    public PaletteHost toPaletteHost() {
        return new PaletteHost(accessorSlot, descriptors, foreignIds, librarySlot);
    }

    public InMemoryAccessorSlot getAccessorSlot() {
        return accessorSlot;
    }

    public InMemoryDescriptorCatalog getDescriptors() {
        return descriptors;
    }

    public InMemoryForeignIdTable getForeignIds() {
        return foreignIds;
    }

    public InMemoryLibrarySlot getLibrarySlot() {
        return librarySlot;
    }

    /**
     * Clears all host state back to a freshly started host.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        accessorSlot.clear();
        descriptors.clear();
        descriptors.addBaseDescriptors();
        foreignIds.clear();
        librarySlot.clear();
    }
}
