package com.ryuqq.palette.core.sync;

import java.util.Set;

/**
 * DependentSynchronizer 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>palettePathPrefix: 팔레트를 사용하는 스프라이트 경로 접두사 (기본 "units/player")</li>
 *   <li>baseDescriptorNames: 경로와 관계없이 항상 팔레트를 사용하는 기본 descriptor 이름
 *       (기본 "MechUnit", "MechIcon")</li>
 * </ul>
 *
 * @author Palette Team
 * @since 1.0.0
 * @param palettePathPrefix 팔레트 스프라이트 경로 접두사 (빈 문자열 불가)
 * @param baseDescriptorNames 기본 descriptor 이름 집합
 */
public record SynchronizerConfig(String palettePathPrefix, Set<String> baseDescriptorNames) {

    /**
     * 기본 팔레트 스프라이트 경로 접두사.
     */
    public static final String DEFAULT_PALETTE_PATH_PREFIX = "units/player";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: palettePathPrefix="units/player", baseDescriptorNames={"MechUnit", "MechIcon"}</p>
     */
    public SynchronizerConfig() {
        this(DEFAULT_PALETTE_PATH_PREFIX, Set.of("MechUnit", "MechIcon"));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SynchronizerConfig {
        if (palettePathPrefix == null || palettePathPrefix.isBlank()) {
            throw new IllegalArgumentException(
                "palettePathPrefix cannot be null or blank (current: " + palettePathPrefix + ")"
            );
        }
        if (baseDescriptorNames == null) {
            throw new IllegalArgumentException("baseDescriptorNames cannot be null");
        }
        baseDescriptorNames = Set.copyOf(baseDescriptorNames);
    }

    /**
     * palettePathPrefix만 변경한 새 인스턴스 생성.
     *
     * @param palettePathPrefix 새로운 경로 접두사
     * @return 새 SynchronizerConfig 인스턴스
     */
    public SynchronizerConfig withPalettePathPrefix(String palettePathPrefix) {
        return new SynchronizerConfig(palettePathPrefix, this.baseDescriptorNames);
    }

    /**
     * baseDescriptorNames만 변경한 새 인스턴스 생성.
     *
     * @param baseDescriptorNames 새로운 기본 descriptor 이름 집합
     * @return 새 SynchronizerConfig 인스턴스
     */
    public SynchronizerConfig withBaseDescriptorNames(Set<String> baseDescriptorNames) {
        return new SynchronizerConfig(this.palettePathPrefix, baseDescriptorNames);
    }
}
