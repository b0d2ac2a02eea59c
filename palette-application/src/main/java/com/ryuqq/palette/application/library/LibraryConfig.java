package com.ryuqq.palette.application.library;

import com.ryuqq.palette.core.sync.SynchronizerConfig;

/**
 * 팔레트 라이브러리 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>synchronizer: descriptor 동기화 설정 (기본 {@link SynchronizerConfig#SynchronizerConfig()})</li>
 *   <li>foreignIdsEnabled: 마이그레이션 시 외부 라이브러리 ID 표 사용 여부 (기본 true)</li>
 * </ul>
 *
 * @author Palette Team
 * @since 1.0.0
 * @param synchronizer descriptor 동기화 설정
 * @param foreignIdsEnabled 외부 ID 표 사용 여부
 */
public record LibraryConfig(SynchronizerConfig synchronizer, boolean foreignIdsEnabled) {

    /**
     * 기본 설정 생성자.
     */
    public LibraryConfig() {
        this(new SynchronizerConfig(), true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException synchronizer가 null인 경우
     */
    public LibraryConfig {
        if (synchronizer == null) {
            throw new IllegalArgumentException("synchronizer cannot be null");
        }
    }

    /**
     * synchronizer만 변경한 새 인스턴스 생성.
     *
     * @param synchronizer 새로운 동기화 설정
     * @return 새 LibraryConfig 인스턴스
     */
    public LibraryConfig withSynchronizer(SynchronizerConfig synchronizer) {
        return new LibraryConfig(synchronizer, this.foreignIdsEnabled);
    }

    /**
     * foreignIdsEnabled만 변경한 새 인스턴스 생성.
     *
     * @param foreignIdsEnabled 외부 ID 표 사용 여부
     * @return 새 LibraryConfig 인스턴스
     */
    public LibraryConfig withForeignIdsEnabled(boolean foreignIdsEnabled) {
        return new LibraryConfig(this.synchronizer, foreignIdsEnabled);
    }
}
