package work.pollochang.particles.image.config;

import lombok.With;
import work.pollochang.particles.image.core.GenerationError;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.sampling.SamplingParams;

/**
 * 單次粒子產生的設定，由呼叫端提供，產生期間不可變動。
 * <p>
 * 透過 {@link #draft()}、{@link #standard()}、{@link #high()}、{@link #ultra()} 取得預設值，
 * 再以 Lombok 產生的 {@code withXxx} 方法調整個別欄位。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@With
public record GenerationConfig(
        int targetParticleCount,
        QualityPreset qualityPreset,
        SamplingStrategyType samplingStrategy,
        AdvancedAlgorithm advancedAlgorithm,
        boolean cachingEnabled,
        int maxConcurrency,
        DisplayMode displayMode,
        float minParticleSize,
        float maxParticleSize,
        float importanceThreshold,
        float contrastWeight,
        float saturationWeight,
        int edgeRadius,
        float importantSamplingRatio,
        float topBottomRatio,
        boolean antiClustering,
        boolean validateImportance,
        long cacheSizeLimitBytes
) {

    /** 預設快取容量上限 100 MB */
    public static final long DEFAULT_CACHE_SIZE_LIMIT = 100L * 1024 * 1024;

    public static GenerationConfig standard() {
        return new GenerationConfig(1000, QualityPreset.STANDARD, SamplingStrategyType.IMPORTANCE,
                AdvancedAlgorithm.BLUE_NOISE, true, 4, DisplayMode.FIT, 1f, 16f,
                0.3f, 0.4f, 0.3f, 2, 0.7f, 0.5f, false, false, DEFAULT_CACHE_SIZE_LIMIT);
    }

    public static GenerationConfig draft() {
        return new GenerationConfig(500, QualityPreset.DRAFT, SamplingStrategyType.UNIFORM,
                AdvancedAlgorithm.BLUE_NOISE, false, 2, DisplayMode.FIT, 1f, 16f,
                0.1f, 0.2f, 0.1f, 1, 0.7f, 0.5f, false, false, DEFAULT_CACHE_SIZE_LIMIT);
    }

    public static GenerationConfig high() {
        return new GenerationConfig(2000, QualityPreset.HIGH, SamplingStrategyType.HYBRID,
                AdvancedAlgorithm.BLUE_NOISE, true, 4, DisplayMode.FIT, 1f, 16f,
                0.45f, 0.45f, 0.35f, 3, 0.7f, 0.5f, false, false, DEFAULT_CACHE_SIZE_LIMIT);
    }

    public static GenerationConfig ultra() {
        return new GenerationConfig(5000, QualityPreset.ULTRA, SamplingStrategyType.HYBRID,
                AdvancedAlgorithm.BLUE_NOISE, true, 4, DisplayMode.FIT, 1f, 16f,
                0.5f, 0.5f, 0.4f, 3, 0.7f, 0.5f, false, false, DEFAULT_CACHE_SIZE_LIMIT);
    }

    public static GenerationConfig forPreset(QualityPreset preset) {
        switch (preset) {
            case DRAFT:
                return draft();
            case HIGH:
                return high();
            case ULTRA:
                return ultra();
            case STANDARD:
            default:
                return standard();
        }
    }

    /** 依設定欄位組出的基礎取樣參數 (尚未依分析結果調整)。 */
    public SamplingParams samplingParams() {
        return new SamplingParams(importanceThreshold, contrastWeight, saturationWeight, edgeRadius,
                importantSamplingRatio, topBottomRatio, antiClustering);
    }

    /**
     * 取樣策略在快取鍵與日誌中使用的名稱，例如 {@code importance} 或 {@code advanced-blueNoise}。
     */
    public String strategyKey() {
        if (samplingStrategy == SamplingStrategyType.ADVANCED) {
            return samplingStrategy.key() + "-" + advancedAlgorithm.key();
        }
        return samplingStrategy.key();
    }

    /**
     * 檢查設定是否可用於產生。
     *
     * @throws GenerationException 任何欄位不合法時拋出 {@link GenerationError#INVALID_CONFIGURATION}
     */
    public void validate() throws GenerationException {
        if (targetParticleCount <= 0) {
            throw invalid("目標粒子數量必須大於 0: " + targetParticleCount);
        }
        if (qualityPreset == null || samplingStrategy == null || displayMode == null) {
            throw invalid("qualityPreset、samplingStrategy 與 displayMode 不可為 null");
        }
        if (samplingStrategy == SamplingStrategyType.ADVANCED && advancedAlgorithm == null) {
            throw invalid("ADVANCED 策略必須指定 advancedAlgorithm");
        }
        if (maxConcurrency < 1) {
            throw invalid("maxConcurrency 必須至少為 1: " + maxConcurrency);
        }
        if (minParticleSize <= 0f || maxParticleSize < minParticleSize) {
            throw invalid("粒子大小範圍無效: [" + minParticleSize + ", " + maxParticleSize + "]");
        }
        if (cachingEnabled && cacheSizeLimitBytes <= 0) {
            throw invalid("快取容量上限必須大於 0: " + cacheSizeLimitBytes);
        }
        samplingParams().validate();
    }

    private static GenerationException invalid(String message) {
        return new GenerationException(GenerationError.INVALID_CONFIGURATION, message);
    }
}
