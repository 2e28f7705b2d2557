package work.pollochang.particles.image.sampling;

import lombok.With;
import work.pollochang.particles.image.core.GenerationError;
import work.pollochang.particles.image.core.GenerationException;

/**
 * 單次產生請求的取樣參數，建立後不再變動。
 *
 * @param importanceThreshold     重要度門檻，分數達到此值的像素才算重要
 * @param contrastWeight          局部對比的權重
 * @param saturationWeight        飽和度的權重
 * @param edgeRadius              計算局部對比時的鄰域半徑
 * @param importantSamplingRatio  重要像素佔目標數量的比例 (0..1)
 * @param topBottomRatio          重要像素中來自上半部的比例 (0..1)
 * @param antiClustering          是否先以分帶方式稀釋候選點
 */
@With
public record SamplingParams(
        float importanceThreshold,
        float contrastWeight,
        float saturationWeight,
        int edgeRadius,
        float importantSamplingRatio,
        float topBottomRatio,
        boolean antiClustering
) {

    public static final SamplingParams DEFAULT = new SamplingParams(0.3f, 0.4f, 0.3f, 2, 0.7f, 0.5f, false);

    public void validate() throws GenerationException {
        if (importanceThreshold < 0f || importanceThreshold > 1f) {
            throw invalid("importanceThreshold 必須介於 0 與 1: " + importanceThreshold);
        }
        if (contrastWeight < 0f || saturationWeight < 0f) {
            throw invalid("權重不可為負數");
        }
        if (edgeRadius < 1) {
            throw invalid("edgeRadius 必須至少為 1: " + edgeRadius);
        }
        if (importantSamplingRatio < 0f || importantSamplingRatio > 1f) {
            throw invalid("importantSamplingRatio 必須介於 0 與 1: " + importantSamplingRatio);
        }
        if (topBottomRatio < 0f || topBottomRatio > 1f) {
            throw invalid("topBottomRatio 必須介於 0 與 1: " + topBottomRatio);
        }
    }

    private static GenerationException invalid(String message) {
        return new GenerationException(GenerationError.INVALID_CONFIGURATION, message);
    }
}
