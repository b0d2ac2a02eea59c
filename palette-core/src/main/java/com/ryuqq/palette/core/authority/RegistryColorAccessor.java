package com.ryuqq.palette.core.authority;

import com.ryuqq.palette.core.model.Color;
import com.ryuqq.palette.core.model.PaletteEntry;
import com.ryuqq.palette.core.registry.PaletteRegistry;
import com.ryuqq.palette.core.spi.ColorAccessor;

import java.util.List;

/**
 * {@link PaletteRegistry}를 호스트 질의에 노출하는 접근자.
 *
 * <p>{@link AuthorityManager}마다 인스턴스가 하나이며, 슬롯에 이 인스턴스가
 * 설치되어 있는지(참조 동일성)로 권한 보유 여부를 판단합니다.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class RegistryColorAccessor implements ColorAccessor {

    private final PaletteRegistry registry;

    /**
     * 생성자.
     *
     * @param registry 레지스트리
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public RegistryColorAccessor(PaletteRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    @Override
    public int colorCount() {
        return registry.count();
    }

    @Override
    public List<Color> colorAt(int index) {
        PaletteEntry entry = registry.byIndex(index);
        return entry != null ? entry.colors() : null;
    }

    @Override
    public String toString() {
        return "RegistryColorAccessor{count=" + registry.count() + '}';
    }
}
