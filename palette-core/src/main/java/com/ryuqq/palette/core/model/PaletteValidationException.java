package com.ryuqq.palette.core.model;

/**
 * 팔레트 등록 입력이 유효하지 않을 때 발생하는 예외.
 *
 * <p>검증 실패는 해당 등록 호출에만 치명적이며, 레지스트리 상태는 변경되지 않습니다.</p>
 *
 * <p><strong>발생 조건:</strong></p>
 * <ul>
 *   <li>ID가 null 이거나 빈 문자열</li>
 *   <li>이름이 빈 문자열 (null은 허용)</li>
 *   <li>8개 색상 슬롯 중 누락된 슬롯이 있는 경우</li>
 *   <li>색상이 3개 채널(0~255)로 구성되지 않은 경우</li>
 * </ul>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public class PaletteValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public PaletteValidationException(String message) {
        super(message);
    }
}
