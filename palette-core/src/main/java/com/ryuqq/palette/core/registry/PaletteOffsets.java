package com.ryuqq.palette.core.registry;

import com.ryuqq.palette.core.model.PaletteEntry;

/**
 * 1-based 인덱스 공간과 0-based 오프셋 공간 사이의 변환.
 *
 * <p>일부 소비자(예: 유닛의 이미지 오프셋)는 인덱스 대신 {@code offset = index - 1}을 사용합니다.
 * 독립 상태 없이 {@link PaletteRegistry} 위의 순수 함수로만 구성됩니다.</p>
 *
 * <p><strong>왕복 법칙:</strong></p>
 * <ul>
 *   <li>등록된 모든 id: {@code offsetToId(idToOffset(id)) == id}</li>
 *   <li>{@code 0 <= k < count()}: {@code idToOffset(offsetToId(k)) == k}</li>
 * </ul>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class PaletteOffsets {

    // Utility class - prevent instantiation
    private PaletteOffsets() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 오프셋의 팔레트 ID 조회.
     *
     * @param registry 레지스트리
     * @param offset 0-based 오프셋
     * @return ID, 범위를 벗어나면 null
     */
    public static String offsetToId(PaletteRegistry registry, int offset) {
        requireRegistry(registry);
        PaletteEntry entry = registry.byIndex(offsetToIndex(offset));
        return entry != null ? entry.id() : null;
    }

    /**
     * 팔레트 ID의 오프셋 조회.
     *
     * @param registry 레지스트리
     * @param id 팔레트 ID
     * @return 0-based 오프셋, 없으면 null
     */
    public static Integer idToOffset(PaletteRegistry registry, String id) {
        requireRegistry(registry);
        PaletteEntry entry = registry.get(id);
        return entry != null ? indexToOffset(entry.index()) : null;
    }

    /**
     * 인덱스 → 오프셋.
     *
     * @param index 1-based 인덱스
     * @return 0-based 오프셋
     */
    public static int indexToOffset(int index) {
        return index - 1;
    }

    /**
     * 오프셋 → 인덱스.
     *
     * @param offset 0-based 오프셋
     * @return 1-based 인덱스
     */
    public static int offsetToIndex(int offset) {
        return offset + 1;
    }

    private static void requireRegistry(PaletteRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
    }
}
