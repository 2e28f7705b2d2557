package work.pollochang.particles.image.sampling;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.particles.image.analysis.ImageAnalysis;

/**
 * 依圖片分析結果調整基礎取樣參數，只用於 HIGH 與 ULTRA 品質。
 * <ul>
 *     <li>門檻：{@code base × (1 + edgeBias × (edgeDensity − 0.5))}，邊緣多的圖更挑剔</li>
 *     <li>權重：對比度或飽和度偏離 0.5 時往同方向調整</li>
 *     <li>鄰域半徑：依複雜度加 1 或 2</li>
 *     <li>重要比例：加上 {@code min(detailBoostMax, complexity / 10 × detailBoostScale)}</li>
 * </ul>
 */
@Slf4j
public class SamplingParamsTuner {

    private final AnalysisSamplingTuning tuning;

    public SamplingParamsTuner() {
        this(AnalysisSamplingTuning.DEFAULT);
    }

    public SamplingParamsTuner(AnalysisSamplingTuning tuning) {
        this.tuning = tuning;
    }

    public SamplingParams tune(SamplingParams base, ImageAnalysis analysis) {
        float threshold = clamp(base.importanceThreshold() * (1f + tuning.edgeBiasStrength() * (analysis.edgeDensity() - 0.5f)),
                tuning.thresholdMin(), tuning.thresholdMax());
        float contrastWeight = clamp(base.contrastWeight() * (1f + tuning.contrastWeightScale() * (analysis.contrast() - 0.5f)),
                tuning.weightMin(), tuning.weightMax());
        float saturationWeight = clamp(base.saturationWeight() * (1f + tuning.saturationWeightScale() * (analysis.saturation() - 0.5f)),
                tuning.weightMin(), tuning.weightMax());

        int radius = base.edgeRadius();
        if (analysis.complexity() >= tuning.complexityHigh()) {
            radius += tuning.radiusBoostHigh();
        } else if (analysis.complexity() >= tuning.complexityMid()) {
            radius += tuning.radiusBoostMid();
        }

        float detailBoost = Math.min(tuning.detailBoostMax(), analysis.complexity() / 10f * tuning.detailBoostScale());
        float importantRatio = clamp(base.importantSamplingRatio() + detailBoost,
                tuning.importantRatioMin(), tuning.importantRatioMax());

        SamplingParams tuned = base
                .withImportanceThreshold(threshold)
                .withContrastWeight(contrastWeight)
                .withSaturationWeight(saturationWeight)
                .withEdgeRadius(radius)
                .withImportantSamplingRatio(importantRatio);
        log.debug("依分析結果調整取樣參數: {} -> {}", base, tuned);
        return tuned;
    }

    private static float clamp(float value, float min, float max) {
        return Math.max(min, Math.min(max, value));
    }
}
