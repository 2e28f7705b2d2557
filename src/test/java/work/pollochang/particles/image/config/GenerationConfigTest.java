package work.pollochang.particles.image.config;

import org.junit.jupiter.api.Test;
import work.pollochang.particles.image.core.GenerationError;
import work.pollochang.particles.image.core.GenerationException;

import static org.junit.jupiter.api.Assertions.*;

class GenerationConfigTest {

    /**
     * 各品質預設的基本值
     */
    @Test
    void testPresets_ShouldHaveExpectedDefaults() throws GenerationException {
        assertEquals(500, GenerationConfig.draft().targetParticleCount());
        assertEquals(SamplingStrategyType.UNIFORM, GenerationConfig.draft().samplingStrategy());
        assertFalse(GenerationConfig.draft().cachingEnabled());

        assertEquals(1000, GenerationConfig.standard().targetParticleCount());
        assertEquals(SamplingStrategyType.IMPORTANCE, GenerationConfig.standard().samplingStrategy());

        assertEquals(2000, GenerationConfig.high().targetParticleCount());
        assertEquals(5000, GenerationConfig.ultra().targetParticleCount());
        assertEquals(SamplingStrategyType.HYBRID, GenerationConfig.ultra().samplingStrategy());

        for (QualityPreset preset : QualityPreset.values()) {
            GenerationConfig config = GenerationConfig.forPreset(preset);
            assertEquals(preset, config.qualityPreset());
            config.validate();
        }
    }

    @Test
    void testOnlyHighAndUltra_ShouldUseAnalysisTuning() {
        assertFalse(QualityPreset.DRAFT.usesAnalysisTuning());
        assertFalse(QualityPreset.STANDARD.usesAnalysisTuning());
        assertTrue(QualityPreset.HIGH.usesAnalysisTuning());
        assertTrue(QualityPreset.ULTRA.usesAnalysisTuning());
    }

    @Test
    void testStrategyKey() {
        assertEquals("importance", GenerationConfig.standard().strategyKey());
        GenerationConfig advanced = GenerationConfig.standard()
                .withSamplingStrategy(SamplingStrategyType.ADVANCED)
                .withAdvancedAlgorithm(AdvancedAlgorithm.VAN_DER_CORPUT);
        assertEquals("advanced-" + AdvancedAlgorithm.VAN_DER_CORPUT.key(), advanced.strategyKey());
    }

    /**
     * 不合法的欄位應拋出 INVALID_CONFIGURATION
     */
    @Test
    void testValidate_InvalidFields_ShouldThrowInvalidConfiguration() {
        GenerationConfig base = GenerationConfig.standard();
        GenerationConfig[] invalid = {
                base.withTargetParticleCount(0),
                base.withMaxConcurrency(0),
                base.withMinParticleSize(0f),
                base.withMaxParticleSize(0.5f),
                base.withImportanceThreshold(1.5f),
                base.withTopBottomRatio(-0.1f),
                base.withEdgeRadius(0),
                base.withSamplingStrategy(null),
                base.withSamplingStrategy(SamplingStrategyType.ADVANCED).withAdvancedAlgorithm(null),
                base.withCacheSizeLimitBytes(0)
        };
        for (GenerationConfig config : invalid) {
            GenerationException e = assertThrows(GenerationException.class, config::validate, config.toString());
            assertEquals(GenerationError.INVALID_CONFIGURATION, e.getError());
        }
    }

    /**
     * 關閉快取時不檢查快取容量
     */
    @Test
    void testValidate_CacheLimitIgnoredWhenCachingDisabled() {
        GenerationConfig config = GenerationConfig.standard().withCachingEnabled(false).withCacheSizeLimitBytes(0);

        assertDoesNotThrow(config::validate);
    }
}
