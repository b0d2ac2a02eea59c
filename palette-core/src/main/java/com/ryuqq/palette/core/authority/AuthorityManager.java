package com.ryuqq.palette.core.authority;

import com.ryuqq.palette.core.model.Color;
import com.ryuqq.palette.core.model.PaletteValidationException;
import com.ryuqq.palette.core.registry.PaletteRegistry;
import com.ryuqq.palette.core.spi.AccessorSlot;
import com.ryuqq.palette.core.spi.ColorAccessor;
import com.ryuqq.palette.core.spi.ForeignIdTable;
import com.ryuqq.palette.core.validation.ColorValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 호스트 색상 접근자 권한 관리자.
 *
 * <p>슬롯에 설치된 접근자가 이 레지스트리의 것이 아니면, 그 접근자가 알고 있는 팔레트 중
 * 레지스트리에 없는 것을 인덱스 순서대로 가져온 뒤 자신의 접근자를 설치합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 슬롯 == 자신의 접근자 → 즉시 반환 (owned)
 * 2. hostN = 설치된 접근자.colorCount()
 * 3. index = N+1 .. hostN (오름차순):
 *    a. colors = 설치된 접근자.colorAt(index)
 *    b. id   = 기본 ID 표 → 외부 ID 표 (오프셋 변환) → 인덱스 문자열
 *    c. name = 기본 이름 표 → 외부 ID 표 → id
 *    d. registry.registerAt(id, index, name, colors)
 * 4. 색상 누락/오류 또는 ID 충돌 → 해당 인덱스에서 중단 (경고 로그, 예외 없음)
 * 5. 자신의 접근자를 슬롯에 설치
 * </pre>
 *
 * <p><strong>마이그레이션 공백:</strong> 외부 구현이 일시적으로 불일치하더라도
 * 이 레지스트리가 권한을 가져오는 것을 막지 못합니다.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class AuthorityManager {

    private static final Logger log = LoggerFactory.getLogger(AuthorityManager.class);

    private final PaletteRegistry registry;
    private final AccessorSlot slot;
    private final RegistryColorAccessor ownAccessor;
    private final ResolverChain idChain;
    private final ResolverChain nameChain;

    /**
     * 생성자.
     *
     * @param registry 레지스트리
     * @param slot 호스트 접근자 슬롯
     * @param idChain ID 해석 체인 (마지막 단계는 항상 값을 반환해야 함)
     * @param nameChain 이름 해석 체인 (해석 실패 시 ID를 이름으로 사용)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public AuthorityManager(PaletteRegistry registry, AccessorSlot slot,
                            ResolverChain idChain, ResolverChain nameChain) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (slot == null) {
            throw new IllegalArgumentException("slot cannot be null");
        }
        if (idChain == null) {
            throw new IllegalArgumentException("idChain cannot be null");
        }
        if (nameChain == null) {
            throw new IllegalArgumentException("nameChain cannot be null");
        }
        this.registry = registry;
        this.slot = slot;
        this.idChain = idChain;
        this.nameChain = nameChain;
        this.ownAccessor = new RegistryColorAccessor(registry);
    }

    /**
     * 기본 해석 체인으로 생성.
     *
     * <p>ID: 기본 ID 표 → 외부 ID 표 → 인덱스 문자열.
     * 이름: 기본 이름 표 → 외부 ID 표.</p>
     *
     * @param registry 레지스트리
     * @param slot 호스트 접근자 슬롯
     * @param foreignIds 외부 라이브러리 ID 표 (없으면 null)
     * @return AuthorityManager
     */
    public static AuthorityManager create(PaletteRegistry registry, AccessorSlot slot, ForeignIdTable foreignIds) {
        List<NameResolver> ids = new ArrayList<>();
        List<NameResolver> names = new ArrayList<>();
        ids.add(BuiltinPalettes.idResolver());
        names.add(BuiltinPalettes.nameResolver());
        if (foreignIds != null) {
            ForeignIdResolver foreign = new ForeignIdResolver(foreignIds);
            ids.add(foreign);
            names.add(foreign);
        }
        ids.add(NameResolver.indexFallback());
        return new AuthorityManager(registry, slot, new ResolverChain(ids), new ResolverChain(names));
    }

    /**
     * 권한 보유 여부.
     *
     * @return 슬롯에 자신의 접근자가 설치되어 있으면 true
     */
    public boolean isOwned() {
        return slot.current() == ownAccessor;
    }

    /**
     * 이 레지스트리의 접근자.
     *
     * @return 접근자
     */
    public ColorAccessor accessor() {
        return ownAccessor;
    }

    /**
     * 권한 확보 (멱등).
     *
     * <p>로드 시점과 모든 변경 호출 전에 호출됩니다. 이미 권한을 보유하고 있으면 아무것도 하지 않습니다.</p>
     *
     * @return 마이그레이션 결과
     */
    public MigrationResult ensureAuthority() {
        ColorAccessor installed = slot.current();
        if (installed == ownAccessor) {
            return MigrationResult.owned(registry.count());
        }

        int before = registry.count();
        int hostCount = readHostCount(installed, before);
        Integer gapIndex = null;

        for (int index = before + 1; index <= hostCount; index++) {
            if (!migrate(installed, index)) {
                gapIndex = index;
                break;
            }
        }

        int migrated = registry.count() - before;
        slot.install(ownAccessor);

        log.info("Palette authority taken over from {}: {} migrated, host count {}, registry count {}",
            installed, migrated, hostCount, registry.count());
        return new MigrationResult(false, migrated, hostCount, gapIndex);
    }

    private int readHostCount(ColorAccessor installed, int fallback) {
        if (installed == null) {
            return fallback;
        }
        try {
            return installed.colorCount();
        } catch (RuntimeException e) {
            log.warn("Installed accessor {} failed to report its palette count, skipping migration", installed, e);
            return fallback;
        }
    }

    /**
     * 단일 인덱스 마이그레이션.
     *
     * @return 성공 여부 (false면 공백으로 처리하고 중단)
     */
    private boolean migrate(ColorAccessor installed, int index) {
        List<Color> colors;
        try {
            colors = installed.colorAt(index);
        } catch (RuntimeException e) {
            log.warn("Migration gap at index {}: accessor {} failed to return colors", index, installed, e);
            return false;
        }
        if (colors == null) {
            log.warn("Migration gap at index {}: no color data from {}", index, installed);
            return false;
        }
        try {
            colors = ColorValidator.validateColors(colors);
        } catch (PaletteValidationException e) {
            log.warn("Migration gap at index {}: invalid color data ({})", index, e.getMessage());
            return false;
        }

        String id = idChain.resolve(index, candidate -> !registry.contains(candidate));
        if (id == null) {
            log.warn("Migration gap at index {}: no unregistered id candidate", index);
            return false;
        }
        String name = nameChain.resolve(index);
        registry.registerAt(id, index, name != null ? name : id, colors);
        log.debug("Migrated palette {} at index {}", id, index);
        return true;
    }
}
