package com.ryuqq.palette.core.model;

/**
 * 팔레트의 8개 의미 슬롯.
 *
 * <p>선언 순서가 곧 {@link PaletteEntry#colors()}의 색상 순서입니다.</p>
 *
 * <pre>
 * 1. PlateHighlight   5. PlateOutline
 * 2. PlateLight       6. PlateShadow
 * 3. PlateMid         7. BodyColor
 * 4. PlateDark        8. BodyHighlight
 * </pre>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public enum ColorSlot {

    PLATE_HIGHLIGHT("PlateHighlight"),
    PLATE_LIGHT("PlateLight"),
    PLATE_MID("PlateMid"),
    PLATE_DARK("PlateDark"),
    PLATE_OUTLINE("PlateOutline"),
    PLATE_SHADOW("PlateShadow"),
    BODY_COLOR("BodyColor"),
    BODY_HIGHLIGHT("BodyHighlight");

    /**
     * 팔레트 한 개가 가지는 색상 수.
     */
    public static final int COUNT = values().length;

    private final String key;

    ColorSlot(String key) {
        this.key = key;
    }

    /**
     * 원시 입력에서 사용하는 슬롯 키 (예: "PlateHighlight").
     *
     * @return 슬롯 키
     */
    public String key() {
        return key;
    }

    /**
     * 슬롯 키로 ColorSlot 조회.
     *
     * @param key 슬롯 키 (null 허용)
     * @return 일치하는 ColorSlot, 없으면 null
     */
    public static ColorSlot fromKey(String key) {
        for (ColorSlot slot : values()) {
            if (slot.key.equals(key)) {
                return slot;
            }
        }
        return null;
    }
}
