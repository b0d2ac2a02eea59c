package com.ryuqq.palette.core.authority;

/**
 * 권한 확보 결과.
 *
 * @author Palette Team
 * @since 1.0.0
 * @param alreadyOwned 호출 전에 이미 권한을 보유했는지 여부 (true면 아무 작업도 하지 않음)
 * @param migrated 마이그레이션한 팔레트 수
 * @param hostCount 설치되어 있던 접근자가 보고한 팔레트 수
 * @param gapIndex 마이그레이션이 중단된 인덱스, 중단 없이 끝났으면 null
 */
public record MigrationResult(boolean alreadyOwned, int migrated, int hostCount, Integer gapIndex) {

    /**
     * 이미 권한을 보유한 경우의 결과.
     *
     * @param count 현재 팔레트 수
     * @return MigrationResult
     */
    public static MigrationResult owned(int count) {
        return new MigrationResult(true, 0, count, null);
    }

    /**
     * 마이그레이션 중 공백(gap)이 있었는지 여부.
     *
     * @return 공백이 있었으면 true
     */
    public boolean hasGap() {
        return gapIndex != null;
    }
}
