package com.ryuqq.palette.core.model;

/**
 * 팔레트를 구성하는 단일 색상 (RGB).
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>각 채널(red, green, blue)은 0~255 범위의 정수</li>
 * </ul>
 *
 * @author Palette Team
 * @since 1.0.0
 * @param red 빨강 채널 (0~255)
 * @param green 초록 채널 (0~255)
 * @param blue 파랑 채널 (0~255)
 */
public record Color(int red, int green, int blue) {

    /**
     * 채널 최소값.
     */
    public static final int MIN_CHANNEL = 0;

    /**
     * 채널 최대값.
     */
    public static final int MAX_CHANNEL = 255;

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws PaletteValidationException 채널 값이 범위를 벗어난 경우
     */
    public Color {
        requireChannel("red", red);
        requireChannel("green", green);
        requireChannel("blue", blue);
    }

    /**
     * Color 생성.
     *
     * @param red 빨강 채널
     * @param green 초록 채널
     * @param blue 파랑 채널
     * @return Color 인스턴스
     * @throws PaletteValidationException 채널 값이 범위를 벗어난 경우
     */
    public static Color of(int red, int green, int blue) {
        return new Color(red, green, blue);
    }

    private static void requireChannel(String channel, int value) {
        if (value < MIN_CHANNEL || value > MAX_CHANNEL) {
            throw new PaletteValidationException(
                String.format("Color channel %s must be between %d and %d (current: %d)",
                    channel, MIN_CHANNEL, MAX_CHANNEL, value)
            );
        }
    }
}
