package com.ryuqq.palette.core.model;

import java.util.List;

/**
 * 레지스트리에 등록된 팔레트.
 *
 * <p>등록 시점에 {@link com.ryuqq.palette.core.registry.PaletteRegistry}가 한 번 생성하며
 * 이후 어떤 필드도 변경되지 않습니다. 같은 ID로 다시 등록해도 이름과 색상은 덮어쓰지 않습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>colors는 정확히 {@link ColorSlot#COUNT}개</li>
 *   <li>index는 1 이상 (1-based, 조밀하게 할당)</li>
 * </ul>
 *
 * @author Palette Team
 * @since 1.0.0
 * @param id 팔레트 ID
 * @param name 이름 (null이면 ID를 표시 이름으로 사용)
 * @param colors {@link ColorSlot} 순서의 색상 목록
 * @param index 1-based 인덱스
 */
public record PaletteEntry(String id, String name, List<Color> colors, int index) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PaletteEntry {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("id cannot be null or empty");
        }
        if (colors == null || colors.size() != ColorSlot.COUNT) {
            throw new IllegalArgumentException(
                "colors must contain exactly " + ColorSlot.COUNT + " entries (current: "
                    + (colors == null ? null : colors.size()) + ")"
            );
        }
        if (index < 1) {
            throw new IllegalArgumentException("index must be positive (current: " + index + ")");
        }
        colors = List.copyOf(colors);
    }

    /**
     * 표시 이름 조회.
     *
     * @return 이름, 이름이 없으면 ID
     */
    public String displayName() {
        return name != null ? name : id;
    }
}
