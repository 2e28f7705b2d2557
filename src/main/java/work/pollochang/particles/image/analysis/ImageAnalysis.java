package work.pollochang.particles.image.analysis;

import work.pollochang.particles.image.core.Rgba;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 圖片分析結果。
 *
 * @param dominantColors 代表色，最多 {@link ImageAnalyzer#MAX_DOMINANT_COLORS} 個
 * @param contrast       平均局部對比 (0..1)
 * @param edgeDensity    高對比取樣點佔比 (0..1)
 * @param saturation     平均通道差 (0..1)
 * @param complexity     綜合複雜度 (0..10)
 * @param brightness     平均亮度 (0..1)
 * @param averageColor   平均顏色
 * @param colorVariance  三個通道變異數的平均
 * @param pixelDensity   不透明取樣點佔比 (0..1)
 * @param sampledPixels  實際分析的取樣點數量
 */
public record ImageAnalysis(
        List<DominantColor> dominantColors,
        float contrast,
        float edgeDensity,
        float saturation,
        float complexity,
        float brightness,
        Rgba averageColor,
        float colorVariance,
        float pixelDensity,
        int sampledPixels
) {

    public ImageAnalysis {
        dominantColors = List.copyOf(dominantColors);
    }

    public List<Rgba> dominantRgb() {
        return dominantColors.stream().map(DominantColor::color).collect(Collectors.toList());
    }
}
