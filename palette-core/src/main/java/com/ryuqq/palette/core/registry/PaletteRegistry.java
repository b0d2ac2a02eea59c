package com.ryuqq.palette.core.registry;

import com.ryuqq.palette.core.model.Color;
import com.ryuqq.palette.core.model.PaletteEntry;
import com.ryuqq.palette.core.validation.ColorValidator;
import com.ryuqq.palette.core.validation.ValidatedPalette;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 팔레트 ID ↔ 인덱스 전단사(bijection) 저장소.
 *
 * <p>순수 자료구조이며 I/O나 호스트 상태에 접근하지 않습니다.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>entries:</strong> HashMap&lt;String, PaletteEntry&gt; - ID → 팔레트 (O(1) 조회)</li>
 *   <li><strong>ids:</strong> ArrayList&lt;String&gt; - 인덱스 → ID, 위치 i에 인덱스 i+1 (조밀한 1-based 공간)</li>
 * </ul>
 *
 * <p><strong>불변식 (모든 연산 후 유지):</strong></p>
 * <ul>
 *   <li>전단사: {@code idAt(indexOf(id)) == id}</li>
 *   <li>단조 증가: count()는 감소하지 않으며 인덱스는 재할당/재사용되지 않음</li>
 *   <li>유일성: 같은 ID를 다시 등록하면 아무 변화 없음 (멱등)</li>
 * </ul>
 *
 * <p>삭제나 수정 연산은 존재하지 않습니다.</p>
 *
 * <p><strong>Thread Safety:</strong> 단일 제어 루프에서만 사용되므로 동기화하지 않습니다.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class PaletteRegistry {

    private final Map<String, PaletteEntry> entries;
    private final List<String> ids;

    /**
     * 빈 레지스트리 생성.
     */
    public PaletteRegistry() {
        this.entries = new HashMap<>();
        this.ids = new ArrayList<>();
    }

    /**
     * 팔레트 등록 (다음 인덱스 자동 할당).
     *
     * <p>이미 존재하는 ID인 경우 false를 반환하며 이름과 색상을 포함한 어떤 것도 변경하지 않습니다.</p>
     *
     * @param id 팔레트 ID
     * @param name 이름 (null 허용)
     * @param colors 8개 색상
     * @return 새로 추가된 경우 true
     * @throws com.ryuqq.palette.core.model.PaletteValidationException 검증 실패 시 (상태 변경 없음)
     */
    public boolean register(String id, String name, List<Color> colors) {
        ColorValidator.validateId(id);
        List<Color> validated = ColorValidator.validateColors(colors);

        if (entries.containsKey(id)) {
            return false;
        }
        append(id, name, validated);
        return true;
    }

    /**
     * 검증된 팔레트 등록.
     *
     * @param palette 검증된 팔레트
     * @return 새로 추가된 경우 true
     */
    public boolean register(ValidatedPalette palette) {
        if (palette == null) {
            throw new IllegalArgumentException("palette cannot be null");
        }
        return register(palette.id(), palette.name(), palette.colors());
    }

    /**
     * 지정한 인덱스에 팔레트 설치 (마이그레이션 전용).
     *
     * <p>다른 구현체에 이미 존재하던 팔레트를 같은 인덱스로 재생할 때 사용합니다.
     * 마이그레이션은 엄격한 인덱스 순서로 진행되어야 하므로 index는 반드시 count()+1 이어야 합니다.</p>
     *
     * @param id 팔레트 ID
     * @param index 설치할 인덱스 (count()+1)
     * @param name 이름 (null 허용)
     * @param colors 8개 색상
     * @return 생성된 팔레트
     * @throws com.ryuqq.palette.core.model.PaletteValidationException 검증 실패 시
     * @throws IllegalStateException index가 count()+1이 아니거나 ID가 이미 존재하는 경우
     */
    public PaletteEntry registerAt(String id, int index, String name, List<Color> colors) {
        ColorValidator.validateId(id);
        List<Color> validated = ColorValidator.validateColors(colors);

        int expected = count() + 1;
        if (index != expected) {
            throw new IllegalStateException(
                String.format("Out-of-order install for %s: expected index %d but was %d", id, expected, index)
            );
        }
        if (entries.containsKey(id)) {
            throw new IllegalStateException(
                String.format("Palette %s already registered at index %d", id, entries.get(id).index())
            );
        }
        return append(id, name, validated);
    }

    /**
     * ID로 팔레트 조회.
     *
     * @param id 팔레트 ID
     * @return 팔레트, 없으면 null
     */
    public PaletteEntry get(String id) {
        if (id == null) {
            return null;
        }
        return entries.get(id);
    }

    /**
     * 인덱스로 팔레트 조회.
     *
     * @param index 1-based 인덱스
     * @return 팔레트, 범위를 벗어나면 null
     */
    public PaletteEntry byIndex(int index) {
        String id = idAt(index);
        return id != null ? entries.get(id) : null;
    }

    /**
     * 인덱스의 ID 조회.
     *
     * @param index 1-based 인덱스
     * @return ID, 범위를 벗어나면 null
     */
    public String idAt(int index) {
        if (index < 1 || index > ids.size()) {
            return null;
        }
        return ids.get(index - 1);
    }

    /**
     * ID의 인덱스 조회.
     *
     * @param id 팔레트 ID
     * @return 1-based 인덱스, 없으면 null
     */
    public Integer indexOf(String id) {
        PaletteEntry entry = get(id);
        return entry != null ? entry.index() : null;
    }

    /**
     * ID 등록 여부.
     *
     * @param id 팔레트 ID
     * @return 등록된 경우 true
     */
    public boolean contains(String id) {
        return id != null && entries.containsKey(id);
    }

    /**
     * 등록된 팔레트 수 (N).
     *
     * @return 팔레트 수
     */
    public int count() {
        return ids.size();
    }

    private PaletteEntry append(String id, String name, List<Color> colors) {
        PaletteEntry entry = new PaletteEntry(id, name, colors, ids.size() + 1);
        entries.put(id, entry);
        ids.add(id);
        return entry;
    }
}
