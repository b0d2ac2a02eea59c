package com.ryuqq.palette.application.loader;

import com.ryuqq.palette.application.library.DelegatingPaletteLibrary;
import com.ryuqq.palette.application.library.LibraryConfig;
import com.ryuqq.palette.application.library.LibraryInstance;
import com.ryuqq.palette.application.library.LibraryVersion;
import com.ryuqq.palette.application.library.PaletteLibrary;
import com.ryuqq.palette.core.authority.MigrationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 라이브러리 사본 로더 (버전 중재).
 *
 * <p>각 라이브러리 사본은 로드 시점에 자신을 공유 슬롯에 제안합니다.
 * 로드 순서와 관계없이 가장 높은 버전이 권한을 가지며, 등록된 데이터는 손실되지 않습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. existing = librarySlot.current()
 * 2. existing.version &gt;= 내 버전 → 기존 인스턴스 채택 (새 상태 생성 안 함)
 *    existing 없음               → 새 인스턴스 생성 후 설치
 *    existing.version &lt; 내 버전  → existing의 레지스트리를 넘겨받은 새 인스턴스 설치
 * 3. 현재 인스턴스.ensureAuthority() (로드 시점 권한 확보)
 * 4. 슬롯에 위임하는 핸들 반환
 * </pre>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class PaletteLibraryLoader {

    private static final Logger log = LoggerFactory.getLogger(PaletteLibraryLoader.class);

    private final PaletteHost host;

    /**
     * 생성자.
     *
     * @param host 호스트 경계
     * @throws IllegalArgumentException host가 null인 경우
     */
    public PaletteLibraryLoader(PaletteHost host) {
        if (host == null) {
            throw new IllegalArgumentException("host cannot be null");
        }
        this.host = host;
    }

    /**
     * 기본 설정으로 로드.
     *
     * @param version 로드하는 사본의 버전
     * @return 공유 인스턴스에 위임하는 핸들
     */
    public PaletteLibrary load(LibraryVersion version) {
        return load(version, new LibraryConfig());
    }

    /**
     * 로드 및 버전 중재.
     *
     * @param version 로드하는 사본의 버전
     * @param config 설정 (이 사본이 이길 때만 적용)
     * @return 공유 인스턴스에 위임하는 핸들
     * @throws IllegalArgumentException version 또는 config가 null인 경우
     */
    public PaletteLibrary load(LibraryVersion version, LibraryConfig config) {
        if (version == null) {
            throw new IllegalArgumentException("version cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        LibrarySlot slot = host.librarySlot();
        LibraryInstance existing = slot.current();

        if (existing != null && existing.version().isAtLeast(version)) {
            log.info("Palette library {} already installed, {} delegates to it",
                existing.version().getValue(), version.getValue());
        } else if (existing == null) {
            slot.install(LibraryInstance.create(version, host.accessorSlot(), host.descriptors(), host.foreignIds(), config));
            log.info("Palette library {} installed", version.getValue());
        } else {
            slot.install(LibraryInstance.upgrade(existing, version, host.accessorSlot(), host.descriptors(),
                host.foreignIds(), config));
            log.info("Palette library upgraded {} -> {}, {} palettes carried forward",
                existing.version().getValue(), version.getValue(), existing.count());
        }

        MigrationResult result = slot.current().ensureAuthority();
        if (result.hasGap()) {
            log.warn("Palette library {} took authority with a migration gap at index {}",
                slot.current().version().getValue(), result.gapIndex());
        }
        return new DelegatingPaletteLibrary(slot, version);
    }
}
