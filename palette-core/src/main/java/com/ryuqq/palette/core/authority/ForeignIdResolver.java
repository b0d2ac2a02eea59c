package com.ryuqq.palette.core.authority;

import com.ryuqq.palette.core.registry.PaletteOffsets;
import com.ryuqq.palette.core.spi.ForeignIdTable;

/**
 * 외부 팔레트 라이브러리의 ID 표를 조회하는 resolver.
 *
 * <p>외부 라이브러리는 0-based 이미지 오프셋으로 ID를 저장하므로
 * 인덱스를 오프셋으로 변환한 뒤 조회합니다.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class ForeignIdResolver implements NameResolver {

    private final ForeignIdTable table;

    /**
     * 생성자.
     *
     * @param table 외부 라이브러리 ID 표
     * @throws IllegalArgumentException table이 null인 경우
     */
    public ForeignIdResolver(ForeignIdTable table) {
        if (table == null) {
            throw new IllegalArgumentException("table cannot be null");
        }
        this.table = table;
    }

    @Override
    public String resolve(int index) {
        return table.idAtOffset(PaletteOffsets.indexToOffset(index));
    }
}
