package com.ryuqq.palette.application.loader;

import com.ryuqq.palette.core.spi.AccessorSlot;
import com.ryuqq.palette.core.spi.DescriptorCatalog;
import com.ryuqq.palette.core.spi.ForeignIdTable;

/**
 * 라이브러리가 사용하는 호스트 경계 묶음.
 *
 * @author Palette Team
 * @since 1.0.0
 * @param accessorSlot 프로세스 색상 접근자 슬롯
 * @param descriptors 호스트 render descriptor 목록
 * @param foreignIds 외부 라이브러리 ID 표 (없으면 null)
 * @param librarySlot 공유 라이브러리 슬롯
 */
public record PaletteHost(AccessorSlot accessorSlot, DescriptorCatalog descriptors,
                          ForeignIdTable foreignIds, LibrarySlot librarySlot) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 필수 항목이 null인 경우
     */
    public PaletteHost {
        if (accessorSlot == null) {
            throw new IllegalArgumentException("accessorSlot cannot be null");
        }
        if (descriptors == null) {
            throw new IllegalArgumentException("descriptors cannot be null");
        }
        if (librarySlot == null) {
            throw new IllegalArgumentException("librarySlot cannot be null");
        }
    }
}
