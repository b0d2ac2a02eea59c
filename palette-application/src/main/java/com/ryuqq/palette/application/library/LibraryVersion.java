package com.ryuqq.palette.application.library;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * 팔레트 라이브러리 버전.
 *
 * <p>같은 프로세스에 여러 사본이 로드될 때 가장 높은 버전이 권한을 가지도록
 * 비교하는 데 사용합니다.</p>
 *
 * <p><strong>비교 규칙:</strong> 점으로 구분된 숫자를 앞에서부터 숫자로 비교하며,
 * 누락된 자리는 0으로 취급합니다 (예: "0.4" == "0.4.0", "0.10" &gt; "0.9").</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>패턴: 숫자와 점만 허용 (예: 0.4, 1.10.2)</li>
 * </ul>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class LibraryVersion implements Comparable<LibraryVersion> {

    private static final Pattern VALID_PATTERN = Pattern.compile("^\\d+(\\.\\d+)*$");

    private final String value;
    private final int[] components;

    private LibraryVersion(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("LibraryVersion cannot be null or blank");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("LibraryVersion must be dot separated numbers (current: " + value + ")");
        }
        this.value = value;
        this.components = Arrays.stream(value.split("\\.")).mapToInt(Integer::parseInt).toArray();
    }

    /**
     * LibraryVersion 생성.
     *
     * @param value 버전 문자열 (예: "0.4")
     * @return LibraryVersion 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static LibraryVersion of(String value) {
        return new LibraryVersion(value);
    }

    /**
     * 버전 문자열 조회.
     *
     * @return 버전 문자열
     */
    public String getValue() {
        return value;
    }

    /**
     * 이 버전이 other 이상인지 확인.
     *
     * @param other 비교 대상
     * @return this &gt;= other
     */
    public boolean isAtLeast(LibraryVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(LibraryVersion other) {
        int length = Math.max(components.length, other.components.length);
        for (int i = 0; i < length; i++) {
            int mine = i < components.length ? components[i] : 0;
            int theirs = i < other.components.length ? other.components[i] : 0;
            if (mine != theirs) {
                return Integer.compare(mine, theirs);
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return compareTo((LibraryVersion) o) == 0;
    }

    @Override
    public int hashCode() {
        int end = components.length;
        while (end > 1 && components[end - 1] == 0) {
            end--;
        }
        return Arrays.hashCode(Arrays.copyOf(components, end));
    }

    @Override
    public String toString() {
        return "LibraryVersion{" + value + '}';
    }
}
