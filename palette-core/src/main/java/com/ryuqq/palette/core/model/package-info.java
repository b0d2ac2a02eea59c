/**
 * Palette domain model.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.palette.core.model.Color} - RGB color, channels 0..255</li>
 *   <li>{@link com.ryuqq.palette.core.model.ColorSlot} - The 8 semantic color slots of a palette</li>
 *   <li>{@link com.ryuqq.palette.core.model.PaletteEntry} - Registered palette (id, name, colors, index)</li>
 *   <li>{@link com.ryuqq.palette.core.model.PaletteDefinition} - Raw registration input</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Registered entries never change after creation</li>
 *   <li><strong>Validation:</strong> Invalid input raises {@link com.ryuqq.palette.core.model.PaletteValidationException}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Palette Team
 */
package com.ryuqq.palette.core.model;
