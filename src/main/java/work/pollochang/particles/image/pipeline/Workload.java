package work.pollochang.particles.image.pipeline;

import work.pollochang.particles.image.config.GenerationConfig;
import work.pollochang.particles.image.config.QualityPreset;
import work.pollochang.particles.image.config.SamplingStrategyType;

/**
 * 執行策略評估用的工作量描述。
 */
public record Workload(
        int imageWidth,
        int imageHeight,
        int particleCount,
        QualityPreset preset,
        SamplingStrategyType strategy,
        int maxConcurrency
) {

    public static Workload of(GenerationConfig config, int imageWidth, int imageHeight) {
        return new Workload(imageWidth, imageHeight, config.targetParticleCount(),
                config.qualityPreset(), config.samplingStrategy(), config.maxConcurrency());
    }

    public long imageArea() {
        return (long) imageWidth * imageHeight;
    }

    /** 取樣策略與品質預設的複雜度倍數乘積 */
    public double complexity() {
        return strategy.complexityMultiplier() * preset.complexityMultiplier();
    }
}
