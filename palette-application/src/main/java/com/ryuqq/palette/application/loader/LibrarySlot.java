package com.ryuqq.palette.application.loader;

import com.ryuqq.palette.application.library.LibraryInstance;

/**
 * 프로세스 범위의 공유 라이브러리 슬롯.
 *
 * <p>같은 프로세스에 로드된 모든 라이브러리 사본이 이 슬롯 하나를 공유하며,
 * 버전 중재에서 이긴 인스턴스가 설치됩니다.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public interface LibrarySlot {

    /**
     * 현재 설치된 인스턴스 조회.
     *
     * @return 인스턴스, 아직 없으면 null
     */
    LibraryInstance current();

    /**
     * 인스턴스 설치.
     *
     * @param instance 설치할 인스턴스
     * @throws IllegalArgumentException instance가 null인 경우
     */
    void install(LibraryInstance instance);
}
