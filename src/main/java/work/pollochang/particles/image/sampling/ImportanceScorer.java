package work.pollochang.particles.image.sampling;

import work.pollochang.particles.image.core.PixelAccessor;
import work.pollochang.particles.image.core.Rgba;

import java.util.List;

/**
 * 計算像素重要度分數。
 * <p>
 * {@code score = clamp01(cw·contrast + sw·saturation + 0.3·uniqueness − 2·backgroundPenalty)}
 * <ul>
 *     <li>contrast：與 {@code edgeRadius} 範圍內鄰居的平均 RGB 距離，除以 √3 使其落在 0..1</li>
 *     <li>saturation：通道最大值與最小值的差</li>
 *     <li>uniqueness：與最接近的代表色之距離 (上限 1)，沒有代表色時為 0</li>
 *     <li>backgroundPenalty：偏亮且低飽和的像素 (亮度 &gt; 0.8 且飽和度 &lt; 0.2)</li>
 * </ul>
 *
 * @author PolloChang
 * @since 0.1.0
 */
public final class ImportanceScorer {

    static final float UNIQUENESS_WEIGHT = 0.3f;
    static final float BACKGROUND_PENALTY_WEIGHT = 2.0f;
    private static final float SQRT3 = (float) Math.sqrt(3.0);

    private final PixelAccessor accessor;
    private final float contrastWeight;
    private final float saturationWeight;
    private final int radius;
    private final List<Rgba> dominantColors;

    public ImportanceScorer(PixelAccessor accessor, SamplingParams params, List<Rgba> dominantColors) {
        this.accessor = accessor;
        this.contrastWeight = params.contrastWeight();
        this.saturationWeight = params.saturationWeight();
        this.radius = Math.max(1, params.edgeRadius());
        this.dominantColors = dominantColors;
    }

    public float score(int x, int y) {
        return score(x, y, accessor.colorAt(x, y));
    }

    public float score(int x, int y, Rgba color) {
        float saturation = color.channelSpread();
        float value = contrastWeight * contrast(x, y, color)
                + saturationWeight * saturation
                + UNIQUENESS_WEIGHT * uniqueness(color)
                - BACKGROUND_PENALTY_WEIGHT * backgroundPenalty(color, saturation);
        return Math.max(0f, Math.min(1f, value));
    }

    /** 接近純白且幾乎無色的像素視為背景，不列入候選。 */
    public static boolean isWhiteBackground(Rgba color) {
        return color.brightness() > 0.95f && color.channelSpread() < 0.05f;
    }

    float contrast(int x, int y, Rgba center) {
        float sum = 0f;
        int count = 0;
        for (int dy = -radius; dy <= radius; dy++) {
            for (int dx = -radius; dx <= radius; dx++) {
                if ((dx == 0 && dy == 0) || !accessor.contains(x + dx, y + dy)) {
                    continue;
                }
                sum += center.rgbDistance(accessor.colorAt(x + dx, y + dy));
                count++;
            }
        }
        return count == 0 ? 0f : sum / count / SQRT3;
    }

    float uniqueness(Rgba color) {
        if (dominantColors.isEmpty()) {
            return 0f;
        }
        float min = Float.MAX_VALUE;
        for (Rgba dominant : dominantColors) {
            min = Math.min(min, color.rgbDistance(dominant));
        }
        return Math.min(1f, min);
    }

    static float backgroundPenalty(Rgba color, float saturation) {
        float brightness = color.brightness();
        if (brightness > 0.8f && saturation < 0.2f) {
            return (brightness - 0.8f) / 0.2f * (1f - saturation);
        }
        return 0f;
    }
}
