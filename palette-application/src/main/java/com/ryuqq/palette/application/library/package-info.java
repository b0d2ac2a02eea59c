/**
 * 팔레트 라이브러리 공개 API.
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.palette.application.library.PaletteLibrary} - 공개 API</li>
 *   <li>{@link com.ryuqq.palette.application.library.LibraryInstance} - 특정 버전의 구현체</li>
 *   <li>{@link com.ryuqq.palette.application.library.DelegatingPaletteLibrary} - 공유 슬롯 위임 핸들</li>
 *   <li>{@link com.ryuqq.palette.application.library.LibraryVersion} - 버전 비교</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * application (PaletteLibrary, LibraryInstance, PaletteLibraryLoader)
 *   ↓ depends on
 * core (PaletteRegistry, AuthorityManager, DependentSynchronizer, spi)
 * </pre>
 *
 * @author Palette Team
 * @since 1.0.0
 */
package com.ryuqq.palette.application.library;
