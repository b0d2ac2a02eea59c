package com.ryuqq.palette.application.library;

import com.ryuqq.palette.application.loader.LibrarySlot;
import com.ryuqq.palette.core.authority.MigrationResult;
import com.ryuqq.palette.core.model.Color;
import com.ryuqq.palette.core.model.PaletteDefinition;
import com.ryuqq.palette.core.model.PaletteEntry;

import java.util.List;
import java.util.Map;

/**
 * 공유 슬롯의 현재 인스턴스에 위임하는 핸들.
 *
 * <p>각 라이브러리 사본은 이 핸들을 받습니다. 호출마다 슬롯을 다시 조회하므로
 * 나중에 더 높은 버전이 설치되면 이전 사본의 호출도 자동으로 새 인스턴스로 향합니다.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class DelegatingPaletteLibrary implements PaletteLibrary {

    private final LibrarySlot slot;
    private final LibraryVersion loadedVersion;

    /**
     * 생성자.
     *
     * @param slot 공유 라이브러리 슬롯
     * @param loadedVersion 이 핸들을 로드한 사본의 버전
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DelegatingPaletteLibrary(LibrarySlot slot, LibraryVersion loadedVersion) {
        if (slot == null) {
            throw new IllegalArgumentException("slot cannot be null");
        }
        if (loadedVersion == null) {
            throw new IllegalArgumentException("loadedVersion cannot be null");
        }
        this.slot = slot;
        this.loadedVersion = loadedVersion;
    }

    /**
     * 이 핸들을 로드한 사본의 버전 (실제 동작하는 버전은 {@link #version()}).
     *
     * @return 로드한 버전
     */
    public LibraryVersion loadedVersion() {
        return loadedVersion;
    }

    /**
     * 현재 권한을 가진 인스턴스 조회.
     *
     * @return 현재 인스턴스
     * @throws IllegalStateException 슬롯이 비어 있는 경우
     */
    public LibraryInstance delegate() {
        LibraryInstance current = slot.current();
        if (current == null) {
            throw new IllegalStateException("No palette library installed in the shared slot");
        }
        return current;
    }

    @Override
    public LibraryVersion version() {
        return delegate().version();
    }

    @Override
    public MigrationResult ensureAuthority() {
        return delegate().ensureAuthority();
    }

    @Override
    public boolean register(String id, String name, Map<String, List<Integer>> colors) {
        return delegate().register(id, name, colors);
    }

    @Override
    public boolean register(PaletteDefinition definition) {
        return delegate().register(definition);
    }

    @Override
    public int registerAll(List<PaletteDefinition> definitions) {
        return delegate().registerAll(definitions);
    }

    @Override
    public PaletteEntry get(String id) {
        return delegate().get(id);
    }

    @Override
    public Integer indexOf(String id) {
        return delegate().indexOf(id);
    }

    @Override
    public String idAt(int index) {
        return delegate().idAt(index);
    }

    @Override
    public String offsetToId(int offset) {
        return delegate().offsetToId(offset);
    }

    @Override
    public Integer idToOffset(String id) {
        return delegate().idToOffset(id);
    }

    @Override
    public String nameOf(String id) {
        return delegate().nameOf(id);
    }

    @Override
    public List<Color> colorsAt(int index) {
        return delegate().colorsAt(index);
    }

    @Override
    public int count() {
        return delegate().count();
    }
}
