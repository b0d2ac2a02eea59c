package com.ryuqq.palette.adapter.inmemory.host;

import com.ryuqq.palette.core.authority.BuiltinPalettes;
import com.ryuqq.palette.core.model.Color;
import com.ryuqq.palette.core.spi.ColorAccessor;

import java.util.List;

/**
 * 호스트 기본 색상 접근자 (인덱스 1~9).
 *
 * <p>어떤 라이브러리도 권한을 가져가기 전에 슬롯에 설치되어 있는 접근자입니다.
 * 팔레트 ID는 모르며 인덱스별 색상만 제공합니다.</p>
 *
 * @author Palette Team
 * @since 1.0.0
 */
public final class BuiltinColorAccessor implements ColorAccessor {

    private static final List<List<Color>> PALETTES = List.of(
        palette(new int[][] {{255, 226, 171}, {255, 198, 138}, {186, 128, 76}, {96, 68, 43}, {24, 16, 10}, {64, 58, 32}, {116, 112, 62}, {164, 160, 94}}),
        palette(new int[][] {{255, 230, 170}, {245, 170, 80}, {207, 110, 40}, {120, 58, 24}, {30, 14, 8}, {70, 56, 52}, {130, 108, 96}, {182, 160, 146}}),
        palette(new int[][] {{208, 232, 255}, {120, 170, 230}, {62, 102, 170}, {32, 52, 96}, {8, 12, 24}, {40, 44, 58}, {82, 88, 110}, {140, 146, 170}}),
        palette(new int[][] {{255, 248, 180}, {250, 220, 80}, {210, 170, 40}, {120, 92, 24}, {30, 22, 6}, {60, 56, 50}, {110, 104, 92}, {170, 162, 146}}),
        palette(new int[][] {{230, 230, 212}, {182, 184, 160}, {128, 132, 110}, {72, 76, 62}, {16, 18, 14}, {50, 70, 50}, {90, 122, 88}, {140, 176, 134}}),
        palette(new int[][] {{255, 200, 170}, {232, 112, 88}, {178, 56, 44}, {100, 28, 24}, {26, 8, 6}, {62, 50, 48}, {114, 96, 92}, {168, 150, 146}}),
        palette(new int[][] {{232, 250, 255}, {170, 220, 240}, {108, 170, 200}, {56, 102, 128}, {12, 24, 32}, {52, 62, 70}, {100, 116, 128}, {156, 172, 184}}),
        palette(new int[][] {{246, 226, 196}, {214, 180, 136}, {166, 128, 88}, {96, 72, 48}, {22, 16, 10}, {70, 64, 56}, {122, 114, 102}, {178, 170, 156}}),
        palette(new int[][] {{240, 200, 255}, {186, 120, 220}, {132, 66, 170}, {72, 32, 100}, {16, 6, 24}, {54, 44, 62}, {100, 86, 114}, {156, 140, 172}})
    );

    /**
     * 기본 팔레트 색상 조회.
     *
     * @param index 1-based 인덱스
     * @return 8개 색상, 기본 팔레트가 아니면 null
     */
    public static List<Color> builtinColors(int index) {
        return BuiltinPalettes.isBuiltin(index) ? PALETTES.get(index - 1) : null;
    }

    @Override
    public int colorCount() {
        return BuiltinPalettes.COUNT;
    }

    @Override
    public List<Color> colorAt(int index) {
        return builtinColors(index);
    }

    @Override
    public String toString() {
        return "BuiltinColorAccessor{count=" + BuiltinPalettes.COUNT + '}';
    }

    private static List<Color> palette(int[][] channels) {
        Color[] colors = new Color[channels.length];
        for (int i = 0; i < channels.length; i++) {
            colors[i] = Color.of(channels[i][0], channels[i][1], channels[i][2]);
        }
        return List.of(colors);
    }
}
