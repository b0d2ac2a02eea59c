package com.ryuqq.palette.core.authority;

/**
 * 호스트 기본 팔레트 (인덱스 1~9) 의 ID와 이름 표.
 *
 * <p>호스트는 색상 데이터만 제공하므로, 마이그레이션할 때 기본 팔레트에
 * 안정적인 ID와 사람이 읽을 수 있는 이름을 붙이는 데 사용합니다.</p>
 *
 * <pre>
 * index  id               name
 *   1    RiftWalkers      Archive Olive
 *   2    RustingHulks     Rust Orange
 *   3    ZenithGuard      Pinnacle Dark Blue
 *   4    Blitzkrieg       Detrius Yellow
 *   5    SteelJudoka      Archive Shivan
 *   6    FlameBehemoths   Rust Red
 *   7    FrozenTitans     Pinnacle Ice Blue
 *   8    HazardousMechs   Detrius Tan
 *   9    SecretSquad      Vek Purple
 * </pre>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class BuiltinPalettes {

    /**
     * 기본 팔레트 수.
     */
    public static final int COUNT = 9;

    private static final String[] IDS = {
        "RiftWalkers",
        "RustingHulks",
        "ZenithGuard",
        "Blitzkrieg",
        "SteelJudoka",
        "FlameBehemoths",
        "FrozenTitans",
        "HazardousMechs",
        "SecretSquad"
    };

    private static final String[] NAMES = {
        "Archive Olive",
        "Rust Orange",
        "Pinnacle Dark Blue",
        "Detrius Yellow",
        "Archive Shivan",
        "Rust Red",
        "Pinnacle Ice Blue",
        "Detrius Tan",
        "Vek Purple"
    };

    // Utility class - prevent instantiation
    private BuiltinPalettes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 기본 팔레트 ID 조회.
     *
     * @param index 1-based 인덱스
     * @return ID, 기본 팔레트가 아니면 null
     */
    public static String idAt(int index) {
        return isBuiltin(index) ? IDS[index - 1] : null;
    }

    /**
     * 기본 팔레트 이름 조회.
     *
     * @param index 1-based 인덱스
     * @return 이름, 기본 팔레트가 아니면 null
     */
    public static String nameAt(int index) {
        return isBuiltin(index) ? NAMES[index - 1] : null;
    }

    /**
     * 기본 팔레트 인덱스 여부.
     *
     * @param index 1-based 인덱스
     * @return 1~9 인 경우 true
     */
    public static boolean isBuiltin(int index) {
        return index >= 1 && index <= COUNT;
    }

    /**
     * ID 표 기반 resolver.
     *
     * @return ID resolver
     */
    public static NameResolver idResolver() {
        return BuiltinPalettes::idAt;
    }

    /**
     * 이름 표 기반 resolver.
     *
     * @return 이름 resolver
     */
    public static NameResolver nameResolver() {
        return BuiltinPalettes::nameAt;
    }
}
