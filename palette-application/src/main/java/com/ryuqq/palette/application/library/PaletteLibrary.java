package com.ryuqq.palette.application.library;

import com.ryuqq.palette.core.authority.MigrationResult;
import com.ryuqq.palette.core.model.Color;
import com.ryuqq.palette.core.model.PaletteDefinition;
import com.ryuqq.palette.core.model.PaletteEntry;

import java.util.List;
import java.util.Map;

/**
 * 팔레트 라이브러리 공개 API.
 *
 * <p>모든 조회는 존재하지 않으면 null을 반환하며 예외를 던지지 않습니다.
 * 등록은 같은 ID에 대해 멱등입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PaletteLibrary palettes = new PaletteLibraryLoader(host).load(LibraryVersion.of("0.4"));
 *
 * boolean added = palettes.register(PaletteDefinition.builder("SandDune")
 *     .name("Desert Sand")
 *     .colors(colors)
 *     .build());
 *
 * int offset = palettes.idToOffset("SandDune");   // 유닛 이미지 오프셋
 * String id = palettes.offsetToId(offset);         // "SandDune"
 * </pre>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public interface PaletteLibrary {

    /**
     * 라이브러리 버전.
     *
     * @return 버전
     */
    LibraryVersion version();

    /**
     * 호스트 색상 접근자 권한 확보 (멱등).
     *
     * <p>읽기/쓰기 전에 조건 없이 호출해도 안전합니다.</p>
     *
     * @return 마이그레이션 결과
     */
    MigrationResult ensureAuthority();

    /**
     * 팔레트 등록.
     *
     * @param id 팔레트 ID
     * @param name 이름 (null이면 ID를 표시 이름으로 사용)
     * @param colors 슬롯 키 → [red, green, blue] (8개 슬롯)
     * @return 새로 추가된 경우 true, 이미 존재하면 false
     * @throws com.ryuqq.palette.core.model.PaletteValidationException 검증 실패 시 (상태 변경 없음)
     */
    boolean register(String id, String name, Map<String, List<Integer>> colors);

    /**
     * 팔레트 등록.
     *
     * @param definition 등록 요청
     * @return 새로 추가된 경우 true, 이미 존재하면 false
     * @throws com.ryuqq.palette.core.model.PaletteValidationException 검증 실패 시 (상태 변경 없음)
     */
    boolean register(PaletteDefinition definition);

    /**
     * 여러 팔레트를 한 번에 등록.
     *
     * <p>모든 요청을 먼저 검증한 뒤 등록하며, descriptor 동기화는 배치 전체에 대해 한 번만 수행합니다.</p>
     *
     * @param definitions 등록 요청 목록
     * @return 새로 추가된 팔레트 수
     * @throws com.ryuqq.palette.core.model.PaletteValidationException 하나라도 검증 실패 시 (상태 변경 없음)
     */
    int registerAll(List<PaletteDefinition> definitions);

    /**
     * ID로 팔레트 조회.
     *
     * @param id 팔레트 ID
     * @return 팔레트, 없으면 null
     */
    PaletteEntry get(String id);

    /**
     * ID의 인덱스 조회.
     *
     * @param id 팔레트 ID
     * @return 1-based 인덱스, 없으면 null
     */
    Integer indexOf(String id);

    /**
     * 인덱스의 ID 조회.
     *
     * @param index 1-based 인덱스
     * @return ID, 없으면 null
     */
    String idAt(int index);

    /**
     * 오프셋의 ID 조회.
     *
     * @param offset 0-based 오프셋
     * @return ID, 없으면 null
     */
    String offsetToId(int offset);

    /**
     * ID의 오프셋 조회.
     *
     * @param id 팔레트 ID
     * @return 0-based 오프셋, 없으면 null
     */
    Integer idToOffset(String id);

    /**
     * 팔레트 표시 이름 조회.
     *
     * @param id 팔레트 ID
     * @return 이름 (이름이 없으면 ID), 팔레트가 없으면 null
     */
    String nameOf(String id);

    /**
     * 인덱스의 색상 조회.
     *
     * @param index 1-based 인덱스
     * @return 8개 색상, 없으면 null
     */
    List<Color> colorsAt(int index);

    /**
     * 등록된 팔레트 수.
     *
     * @return 팔레트 수
     */
    int count();
}
