package com.ryuqq.palette.core.authority;

/**
 * 인덱스 → 이름(또는 ID) 해석 전략.
 *
 * <p>마이그레이션 시 다른 구현체에서 넘어온 팔레트에 ID와 이름을 붙이기 위해
 * 우선순위 순서로 평가됩니다. 해석할 수 없으면 null을 반환합니다.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface NameResolver {

    /**
     * 인덱스에 대응하는 이름 해석.
     *
     * @param index 1-based 팔레트 인덱스
     * @return 이름, 해석할 수 없으면 null
     */
    String resolve(int index);

    /**
     * 인덱스를 문자열로 변환하는 최종 fallback.
     *
     * @return 항상 값을 반환하는 resolver
     */
    static NameResolver indexFallback() {
        return Integer::toString;
    }
}
