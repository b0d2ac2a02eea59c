package com.ryuqq.palette.adapter.inmemory.host;

import com.ryuqq.palette.application.library.LibraryInstance;
import com.ryuqq.palette.application.loader.LibrarySlot;

/**
 * In-memory implementation of {@link LibrarySlot}.
 *
 * @author Palette Team
 * @since 1.0.0
 */
public class InMemoryLibrarySlot implements LibrarySlot {

    private LibraryInstance current;

    @Override
    public LibraryInstance current() {
        return current;
    }

    @Override
    public void install(LibraryInstance instance) {
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
        this.current = instance;
    }

    /**
     * Removes the installed instance.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        this.current = null;
    }
}
