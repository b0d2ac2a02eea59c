package com.ryuqq.palette.core.authority;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Predicate;

/**
 * 우선순위 순서로 평가하는 {@link NameResolver} 목록.
 *
 * <p>앞선 resolver가 null을 반환하거나, 예외를 던지거나, 후보가 거부되면 다음 resolver로 넘어갑니다.
 * 외부 ID 표처럼 일시적으로 불일치할 수 있는 출처가 체인 전체를 멈추지 못합니다.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class ResolverChain {

    private static final Logger log = LoggerFactory.getLogger(ResolverChain.class);

    private final List<NameResolver> resolvers;

    /**
     * 생성자.
     *
     * @param resolvers 우선순위 순서의 resolver 목록
     * @throws IllegalArgumentException resolvers가 null이거나 null 요소를 포함하는 경우
     */
    public ResolverChain(List<NameResolver> resolvers) {
        if (resolvers == null) {
            throw new IllegalArgumentException("resolvers cannot be null");
        }
        for (NameResolver resolver : resolvers) {
            if (resolver == null) {
                throw new IllegalArgumentException("resolvers cannot contain null");
            }
        }
        this.resolvers = List.copyOf(resolvers);
    }

    /**
     * 첫 번째로 해석된 값 반환.
     *
     * @param index 1-based 인덱스
     * @return 해석된 값, 모두 실패하면 null
     */
    public String resolve(int index) {
        return resolve(index, candidate -> true);
    }

    /**
     * 조건을 만족하는 첫 번째 해석 값 반환.
     *
     * @param index 1-based 인덱스
     * @param accept 후보 수락 조건
     * @return 해석된 값, 모두 실패하면 null
     */
    public String resolve(int index, Predicate<String> accept) {
        for (NameResolver resolver : resolvers) {
            String candidate;
            try {
                candidate = resolver.resolve(index);
            } catch (RuntimeException e) {
                log.warn("Resolver {} failed at index {}, trying the next one", resolver, index, e);
                continue;
            }
            if (candidate != null && !candidate.isEmpty() && accept.test(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
