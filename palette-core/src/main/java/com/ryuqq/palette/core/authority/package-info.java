/**
 * Authority handoff over the process-wide color accessor.
 *
 * <p>{@link com.ryuqq.palette.core.authority.AuthorityManager} migrates palettes owned by
 * whichever implementation is currently installed, in strict index order, and then installs
 * this registry's {@link com.ryuqq.palette.core.authority.RegistryColorAccessor}.</p>
 *
 * <h2>Naming Migrated Palettes</h2>
 * <ol>
 *   <li>{@link com.ryuqq.palette.core.authority.BuiltinPalettes} - host built-in ids and names (1..9)</li>
 *   <li>{@link com.ryuqq.palette.core.authority.ForeignIdResolver} - foreign library id table (offset keyed)</li>
 *   <li>{@link com.ryuqq.palette.core.authority.NameResolver#indexFallback()} - stringified index</li>
 * </ol>
 *
 * @since 1.0.0
 * @author Palette Team
 */
package com.ryuqq.palette.core.authority;
