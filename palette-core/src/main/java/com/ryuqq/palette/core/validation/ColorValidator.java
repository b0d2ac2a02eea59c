package com.ryuqq.palette.core.validation;

import com.ryuqq.palette.core.model.Color;
import com.ryuqq.palette.core.model.ColorSlot;
import com.ryuqq.palette.core.model.PaletteDefinition;
import com.ryuqq.palette.core.model.PaletteValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 팔레트 원시 입력 정규화 및 검증.
 *
 * <p>슬롯 키 → 채널 목록 형태의 입력을 {@link ColorSlot} 순서의
 * {@link Color} 목록으로 변환합니다. 검증은 레지스트리 상태를 변경하기 전에
 * 모두 끝나야 하므로, 이 클래스는 상태를 가지지 않습니다.</p>
 *
 * <p><strong>검증 규칙:</strong></p>
 * <ul>
 *   <li>ID: null 또는 빈 문자열 불가</li>
 *   <li>이름: null 또는 임의의 문자열 (null이면 ID로 표시)</li>
 *   <li>색상: 8개 슬롯 모두 존재, 각 슬롯은 정확히 3개 채널 (0~255)</li>
 *   <li>알 수 없는 슬롯 키는 경고 로그 후 무시</li>
 * </ul>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class ColorValidator {

    private static final Logger log = LoggerFactory.getLogger(ColorValidator.class);
    private static final int CHANNELS = 3;

    // Utility class - prevent instantiation
    private ColorValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 등록 요청 전체 검증.
     *
     * @param definition 등록 요청
     * @return 검증된 팔레트
     * @throws PaletteValidationException 검증 실패 시
     */
    public static ValidatedPalette validate(PaletteDefinition definition) {
        if (definition == null) {
            throw new PaletteValidationException("Palette definition cannot be null");
        }
        validateId(definition.id());
        List<Color> colors = normalize(definition.colors());
        return new ValidatedPalette(definition.id(), definition.name(), colors);
    }

    /**
     * 팔레트 ID 검증.
     *
     * @param id 팔레트 ID
     * @throws PaletteValidationException null 또는 빈 문자열인 경우
     */
    public static void validateId(String id) {
        if (id == null || id.isEmpty()) {
            throw new PaletteValidationException("Invalid palette, missing string ID");
        }
    }

    /**
     * 슬롯 키 기반 원시 색상을 {@link ColorSlot} 순서의 목록으로 변환.
     *
     * @param raw 슬롯 키 → [red, green, blue]
     * @return 8개 색상 목록 (불변)
     * @throws PaletteValidationException 슬롯 누락 또는 채널 오류 시
     */
    public static List<Color> normalize(Map<String, List<Integer>> raw) {
        if (raw == null) {
            throw new PaletteValidationException("Palette colors cannot be null");
        }
        for (String key : raw.keySet()) {
            if (ColorSlot.fromKey(key) == null) {
                log.warn("Ignoring unknown color slot key '{}'", key);
            }
        }
        List<Color> colors = new ArrayList<>(ColorSlot.COUNT);
        for (ColorSlot slot : ColorSlot.values()) {
            List<Integer> channels = raw.get(slot.key());
            if (channels == null) {
                throw new PaletteValidationException("Invalid palette, missing key " + slot.key());
            }
            colors.add(toColor(slot, channels));
        }
        return List.copyOf(colors);
    }

    /**
     * 이미 변환된 색상 목록 검증.
     *
     * <p>호스트 접근자가 돌려준 색상 데이터처럼 슬롯 키가 없는 입력에 사용합니다.</p>
     *
     * @param colors 색상 목록
     * @return 불변 복사본
     * @throws PaletteValidationException 8개가 아니거나 null 요소가 있는 경우
     */
    public static List<Color> validateColors(List<Color> colors) {
        if (colors == null) {
            throw new PaletteValidationException("Palette colors cannot be null");
        }
        if (colors.size() != ColorSlot.COUNT) {
            throw new PaletteValidationException(
                "Palette must contain exactly " + ColorSlot.COUNT + " colors (current: " + colors.size() + ")"
            );
        }
        for (int i = 0; i < colors.size(); i++) {
            if (colors.get(i) == null) {
                throw new PaletteValidationException(
                    "Invalid palette, missing key " + ColorSlot.values()[i].key()
                );
            }
        }
        return List.copyOf(colors);
    }

    private static Color toColor(ColorSlot slot, List<Integer> channels) {
        if (channels.size() != CHANNELS) {
            throw new PaletteValidationException(
                "Color must contain three integers (slot: " + slot.key() + ", current: " + channels.size() + ")"
            );
        }
        for (Integer channel : channels) {
            if (channel == null) {
                throw new PaletteValidationException("Color must contain three integers (slot: " + slot.key() + ")");
            }
        }
        return Color.of(channels.get(0), channels.get(1), channels.get(2));
    }
}
