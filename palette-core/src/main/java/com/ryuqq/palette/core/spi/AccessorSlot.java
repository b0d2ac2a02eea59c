package com.ryuqq.palette.core.spi;

/**
 * Host-owned, mutable binding of the process-wide {@link ColorAccessor}.
 *
 * <p>Any code in the process may rebind the slot. The Authority Manager reads the
 * currently installed accessor to migrate entries and then installs its own.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>{@link #current()} never returns null once the host is initialized</li>
 *   <li>{@link #install(ColorAccessor)} replaces the binding for every caller in the process</li>
 * </ul>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public interface AccessorSlot {

    /**
     * Returns the accessor currently installed.
     *
     * @return installed accessor
     */
    ColorAccessor current();

    /**
     * Installs an accessor, replacing the previous binding.
     *
     * @param accessor accessor to install
     * @throws IllegalArgumentException if accessor is null
     */
    void install(ColorAccessor accessor);
}
