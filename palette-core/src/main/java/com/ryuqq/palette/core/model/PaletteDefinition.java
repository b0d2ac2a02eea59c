package com.ryuqq.palette.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 팔레트 등록 요청 (원시 입력).
 *
 * <p>색상은 슬롯 키 → 채널 값 목록 형태로 전달되며, 검증은
 * {@link com.ryuqq.palette.core.validation.ColorValidator}가 담당합니다.
 * 이 record는 입력을 보관만 하고 검증하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PaletteDefinition definition = PaletteDefinition.builder("SandDune")
 *     .name("Desert Sand")
 *     .color(ColorSlot.PLATE_HIGHLIGHT, 255, 236, 179)
 *     .color(ColorSlot.PLATE_LIGHT, 222, 196, 136)
 *     // ... 나머지 6개 슬롯
 *     .build();
 * </pre>
 *
 * @author Palette Team
 * @since 1.0.0
 * @param id 팔레트 ID
 * @param name 사람이 읽을 수 있는 이름 (null 허용)
 * @param colors 슬롯 키 → [red, green, blue]
 */
public record PaletteDefinition(String id, String name, Map<String, List<Integer>> colors) {

    /**
     * Compact constructor (방어적 복사).
     */
    public PaletteDefinition {
        colors = colors == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(colors));
    }

    /**
     * Builder 생성.
     *
     * @param id 팔레트 ID
     * @return Builder
     */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * PaletteDefinition Builder.
     */
    public static final class Builder {

        private final String id;
        private String name;
        private final Map<String, List<Integer>> colors = new LinkedHashMap<>();

        private Builder(String id) {
            this.id = id;
        }

        /**
         * 이름 설정.
         *
         * @param name 이름
         * @return this
         */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * 슬롯 색상 설정.
         *
         * @param slot 색상 슬롯
         * @param red 빨강
         * @param green 초록
         * @param blue 파랑
         * @return this
         */
        public Builder color(ColorSlot slot, int red, int green, int blue) {
            colors.put(slot.key(), List.of(red, green, blue));
            return this;
        }

        /**
         * 원시 슬롯 키로 색상 설정.
         *
         * @param key 슬롯 키 (예: "BodyColor")
         * @param channels 채널 값 목록
         * @return this
         */
        public Builder color(String key, List<Integer> channels) {
            colors.put(key, channels == null ? null : new ArrayList<>(channels));
            return this;
        }

        /**
         * 8개 슬롯 모두를 순서대로 설정.
         *
         * @param palette {@link ColorSlot} 순서의 색상 목록
         * @return this
         */
        public Builder colors(List<Color> palette) {
            ColorSlot[] slots = ColorSlot.values();
            for (int i = 0; i < palette.size() && i < slots.length; i++) {
                Color color = palette.get(i);
                color(slots[i], color.red(), color.green(), color.blue());
            }
            return this;
        }

        /**
         * PaletteDefinition 생성.
         *
         * @return PaletteDefinition
         */
        public PaletteDefinition build() {
            return new PaletteDefinition(id, name, colors);
        }
    }
}
