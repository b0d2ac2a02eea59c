package com.ryuqq.palette.adapter.inmemory.host;

import com.ryuqq.palette.core.spi.AccessorSlot;
import com.ryuqq.palette.core.spi.ColorAccessor;

/**
 * In-memory implementation of {@link AccessorSlot}.
 *
 * <p>Starts with the host's {@link BuiltinColorAccessor} installed, the way a freshly
 * started host exposes only its built-in palettes.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public class InMemoryAccessorSlot implements AccessorSlot {

    private final ColorAccessor defaultAccessor;
    private ColorAccessor current;
    private int installCount;

    /**
     * Creates a slot with the built-in accessor installed.
     */
    public InMemoryAccessorSlot() {
        this(new BuiltinColorAccessor());
    }

    /**
     * Creates a slot with the given default accessor installed.
     *
     * @param defaultAccessor the accessor installed at host start
     * @throws IllegalArgumentException if defaultAccessor is null
     */
    public InMemoryAccessorSlot(ColorAccessor defaultAccessor) {
        if (defaultAccessor == null) {
            throw new IllegalArgumentException("defaultAccessor cannot be null");
        }
        this.defaultAccessor = defaultAccessor;
        this.current = defaultAccessor;
    }

    @Override
    public ColorAccessor current() {
        return current;
    }

    @Override
    public void install(ColorAccessor accessor) {
        if (accessor == null) {
            throw new IllegalArgumentException("accessor cannot be null");
        }
        this.current = accessor;
        this.installCount++;
    }

    /**
     * Returns how many times an accessor has been installed.
     *
     * <p>This method is used for test assertions.</p>
     *
     * @return install count
     */
    public int getInstallCount() {
        return installCount;
    }

    /**
     * Restores the default accessor.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        this.current = defaultAccessor;
        this.installCount = 0;
    }
}
