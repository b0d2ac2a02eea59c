/**
 * Service Provider Interface (SPI) package - the host boundary.
 *
 * <p>This package defines the interfaces a host must implement so the registry can
 * take authority over palette queries and keep render descriptors in sync.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.palette.core.spi.ColorAccessor} - Process-wide palette count and color lookup</li>
 *   <li>{@link com.ryuqq.palette.core.spi.AccessorSlot} - Mutable binding of the installed accessor</li>
 *   <li>{@link com.ryuqq.palette.core.spi.ForeignIdTable} - Optional id table of a foreign palette library</li>
 *   <li>{@link com.ryuqq.palette.core.spi.DependentDescriptor} - Render descriptor tracking the palette count</li>
 *   <li>{@link com.ryuqq.palette.core.spi.DescriptorCatalog} - Set of descriptors reachable by the host</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g. palette-adapter-inmemory) provide concrete implementations.</p>
 *
 * @since 1.0.0
 * @author Palette Team
 */
package com.ryuqq.palette.core.spi;
