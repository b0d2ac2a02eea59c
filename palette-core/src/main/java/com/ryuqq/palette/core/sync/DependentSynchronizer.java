package com.ryuqq.palette.core.sync;

import com.ryuqq.palette.core.spi.DependentDescriptor;
import com.ryuqq.palette.core.spi.DescriptorCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 팔레트 증가 후 render descriptor 프레임 높이 동기화.
 *
 * <p>팔레트 경로의 스프라이트는 팔레트마다 세로 프레임 하나를 가지므로,
 * 팔레트 수가 늘어나면 프레임 높이도 같이 늘어나야 이미지가 올바르게 잘립니다.</p>
 *
 * <p><strong>갱신 조건:</strong></p>
 * <pre>
 * threshold = newCount - addedCount   (증가 전 팔레트 수)
 *
 * threshold &lt;= frameHeight &lt; newCount
 *   AND (spritePath가 palettePathPrefix로 시작 OR 기본 descriptor)
 *   → frameHeight = newCount
 * </pre>
 *
 * <p>범위를 벗어난 높이는 같은 경로 접두사를 쓰더라도 호출자 고유의 프레임 수이므로 건드리지 않습니다.</p>
 *
 * <p>배치 하나당 한 번, 배치의 모든 팔레트가 등록된 후 호출됩니다.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class DependentSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(DependentSynchronizer.class);

    private final SynchronizerConfig config;

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public DependentSynchronizer(SynchronizerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * 증가 후 descriptor 갱신.
     *
     * @param addedCount 이번 배치에서 새로 추가된 팔레트 수
     * @param newCount 증가 후 팔레트 수
     * @param catalog 호스트 descriptor 목록
     * @return 갱신된 descriptor 수
     * @throws IllegalArgumentException catalog가 null이거나 addedCount가 범위를 벗어난 경우
     */
    public int syncAfterGrowth(int addedCount, int newCount, DescriptorCatalog catalog) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        if (addedCount < 0 || addedCount > newCount) {
            throw new IllegalArgumentException(
                "addedCount must be between 0 and newCount (current: " + addedCount + ", newCount: " + newCount + ")"
            );
        }
        if (addedCount == 0) {
            return 0;
        }

        int threshold = newCount - addedCount;
        int updated = 0;
        for (DependentDescriptor descriptor : catalog.descriptors()) {
            if (isAffected(descriptor, threshold, newCount)) {
                log.debug("Descriptor {} frame height {} -> {}", descriptor.name(), descriptor.frameHeight(), newCount);
                descriptor.setFrameHeight(newCount);
                updated++;
            }
        }
        catalog.publishPaletteCount(newCount);

        log.debug("Synchronized {} descriptors to palette count {}", updated, newCount);
        return updated;
    }

    private boolean isAffected(DependentDescriptor descriptor, int threshold, int newCount) {
        int height = descriptor.frameHeight();
        if (height < threshold || height >= newCount) {
            return false;
        }
        return usesPalettes(descriptor) || isBaseDescriptor(descriptor);
    }

    private boolean isBaseDescriptor(DependentDescriptor descriptor) {
        String name = descriptor.name();
        return name != null && config.baseDescriptorNames().contains(name);
    }

    private boolean usesPalettes(DependentDescriptor descriptor) {
        String path = descriptor.spritePath();
        return path != null && path.startsWith(config.palettePathPrefix());
    }
}
