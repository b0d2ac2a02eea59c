package com.ryuqq.palette.core.validation;

import com.ryuqq.palette.core.model.Color;

import java.util.List;

/**
 * 검증을 통과한 등록 요청.
 *
 * @author Palette Team
 * @since 1.0.0
 * @param id 팔레트 ID
 * @param name 이름 (null 허용)
 * @param colors {@link com.ryuqq.palette.core.model.ColorSlot} 순서의 8개 색상
 */
public record ValidatedPalette(String id, String name, List<Color> colors) {
}
