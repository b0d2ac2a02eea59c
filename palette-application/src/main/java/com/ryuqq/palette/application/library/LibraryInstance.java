package com.ryuqq.palette.application.library;

import com.ryuqq.palette.core.authority.AuthorityManager;
import com.ryuqq.palette.core.authority.MigrationResult;
import com.ryuqq.palette.core.model.Color;
import com.ryuqq.palette.core.model.PaletteDefinition;
import com.ryuqq.palette.core.model.PaletteEntry;
import com.ryuqq.palette.core.registry.PaletteOffsets;
import com.ryuqq.palette.core.registry.PaletteRegistry;
import com.ryuqq.palette.core.spi.AccessorSlot;
import com.ryuqq.palette.core.spi.DescriptorCatalog;
import com.ryuqq.palette.core.spi.ForeignIdTable;
import com.ryuqq.palette.core.sync.DependentSynchronizer;
import com.ryuqq.palette.core.validation.ColorValidator;
import com.ryuqq.palette.core.validation.ValidatedPalette;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 특정 버전의 팔레트 라이브러리 구현체.
 *
 * <p>레지스트리, 권한 관리자, descriptor 동기화를 묶어 {@link PaletteLibrary} 연산을 수행합니다.
 * 프로세스에는 버전 중재에서 이긴 인스턴스 하나만 공유 슬롯에 설치됩니다.</p>
 *
 * <p><strong>등록 흐름:</strong></p>
 * <pre>
 * 1. 모든 요청 검증 (실패 시 상태 변경 없이 예외)
 * 2. ensureAuthority() → 필요 시 마이그레이션 + 접근자 설치
 * 3. registry.register() (이미 존재하는 ID는 무시)
 * 4. 추가된 수만큼 descriptor 동기화 (배치당 한 번)
 * </pre>
 *
 * <p><strong>업그레이드:</strong> 더 높은 버전이 로드되면 이전 인스턴스의
 * {@link PaletteRegistry}를 그대로 넘겨받아 등록된 데이터와 인덱스를 보존합니다.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class LibraryInstance implements PaletteLibrary {

    private static final Logger log = LoggerFactory.getLogger(LibraryInstance.class);

    private final LibraryVersion version;
    private final PaletteRegistry registry;
    private final AuthorityManager authority;
    private final DependentSynchronizer synchronizer;
    private final DescriptorCatalog catalog;

    private LibraryInstance(LibraryVersion version, PaletteRegistry registry, AccessorSlot accessorSlot,
                            DescriptorCatalog catalog, ForeignIdTable foreignIds, LibraryConfig config) {
        if (version == null) {
            throw new IllegalArgumentException("version cannot be null");
        }
        if (accessorSlot == null) {
            throw new IllegalArgumentException("accessorSlot cannot be null");
        }
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.version = version;
        this.registry = registry;
        this.catalog = catalog;
        this.authority = AuthorityManager.create(registry, accessorSlot, config.foreignIdsEnabled() ? foreignIds : null);
        this.synchronizer = new DependentSynchronizer(config.synchronizer());
    }

    /**
     * 빈 레지스트리로 새 인스턴스 생성.
     *
     * @param version 라이브러리 버전
     * @param accessorSlot 호스트 접근자 슬롯
     * @param catalog 호스트 descriptor 목록
     * @param foreignIds 외부 라이브러리 ID 표 (없으면 null)
     * @param config 설정
     * @return LibraryInstance
     */
    public static LibraryInstance create(LibraryVersion version, AccessorSlot accessorSlot,
                                         DescriptorCatalog catalog, ForeignIdTable foreignIds, LibraryConfig config) {
        return new LibraryInstance(version, new PaletteRegistry(), accessorSlot, catalog, foreignIds, config);
    }

    /**
     * 이전 버전 인스턴스의 상태를 넘겨받아 새 인스턴스 생성.
     *
     * @param previous 이전 버전 인스턴스
     * @param version 새 버전 (previous보다 높아야 함)
     * @param accessorSlot 호스트 접근자 슬롯
     * @param catalog 호스트 descriptor 목록
     * @param foreignIds 외부 라이브러리 ID 표 (없으면 null)
     * @param config 설정
     * @return LibraryInstance
     * @throws IllegalArgumentException previous가 null이거나 version이 더 높지 않은 경우
     */
    public static LibraryInstance upgrade(LibraryInstance previous, LibraryVersion version, AccessorSlot accessorSlot,
                                          DescriptorCatalog catalog, ForeignIdTable foreignIds, LibraryConfig config) {
        if (previous == null) {
            throw new IllegalArgumentException("previous cannot be null");
        }
        if (version == null || previous.version.isAtLeast(version)) {
            throw new IllegalArgumentException(
                "Upgrade requires a newer version (current: " + previous.version + ", requested: " + version + ")"
            );
        }
        return new LibraryInstance(version, previous.registry, accessorSlot, catalog, foreignIds, config);
    }

    @Override
    public LibraryVersion version() {
        return version;
    }

    @Override
    public MigrationResult ensureAuthority() {
        return authority.ensureAuthority();
    }

    /**
     * 호스트 접근자 권한 보유 여부.
     *
     * @return 권한을 보유하면 true
     */
    public boolean ownsAuthority() {
        return authority.isOwned();
    }

    @Override
    public boolean register(String id, String name, Map<String, List<Integer>> colors) {
        return register(new PaletteDefinition(id, name, colors));
    }

    @Override
    public boolean register(PaletteDefinition definition) {
        return registerAll(List.of(definitionOrFail(definition))) > 0;
    }

    @Override
    public int registerAll(List<PaletteDefinition> definitions) {
        if (definitions == null) {
            throw new IllegalArgumentException("definitions cannot be null");
        }
        List<ValidatedPalette> validated = new ArrayList<>(definitions.size());
        for (PaletteDefinition definition : definitions) {
            validated.add(ColorValidator.validate(definition));
        }

        ensureAuthority();

        int added = 0;
        for (ValidatedPalette palette : validated) {
            if (registry.register(palette)) {
                added++;
            } else {
                log.debug("Palette {} already registered, ignoring", palette.id());
            }
        }

        synchronizer.syncAfterGrowth(added, registry.count(), catalog);
        if (added > 0) {
            log.info("Registered {} palettes (requested {}), palette count {}", added, validated.size(), registry.count());
        }
        return added;
    }

    @Override
    public PaletteEntry get(String id) {
        return registry.get(id);
    }

    @Override
    public Integer indexOf(String id) {
        return registry.indexOf(id);
    }

    @Override
    public String idAt(int index) {
        return registry.idAt(index);
    }

    @Override
    public String offsetToId(int offset) {
        return PaletteOffsets.offsetToId(registry, offset);
    }

    @Override
    public Integer idToOffset(String id) {
        return PaletteOffsets.idToOffset(registry, id);
    }

    @Override
    public String nameOf(String id) {
        PaletteEntry entry = registry.get(id);
        return entry != null ? entry.displayName() : null;
    }

    @Override
    public List<Color> colorsAt(int index) {
        PaletteEntry entry = registry.byIndex(index);
        return entry != null ? entry.colors() : null;
    }

    @Override
    public int count() {
        return registry.count();
    }

    @Override
    public String toString() {
        return "LibraryInstance{version=" + version.getValue() + ", count=" + registry.count() + '}';
    }

    private static PaletteDefinition definitionOrFail(PaletteDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        return definition;
    }
}
