package work.pollochang.particles.image.sampling;

import org.junit.jupiter.api.Test;
import work.pollochang.particles.image.analysis.ImageAnalysis;
import work.pollochang.particles.image.core.Rgba;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SamplingParamsTunerTest {

    private final SamplingParamsTuner tuner = new SamplingParamsTuner();

    private static ImageAnalysis analysis(float contrast, float edgeDensity, float saturation, float complexity) {
        return new ImageAnalysis(List.of(), contrast, edgeDensity, saturation, complexity, 0.5f,
                new Rgba(0.5f, 0.5f, 0.5f, 1f), 0.1f, 1f, 1000);
    }

    /**
     * 中性分析結果只影響半徑與重要點比例
     */
    @Test
    void testNeutralAnalysis_ShouldKeepWeightsAndThreshold() {
        SamplingParams tuned = tuner.tune(SamplingParams.DEFAULT, analysis(0.5f, 0.5f, 0.5f, 8f));

        assertEquals(0.3f, tuned.importanceThreshold(), 1e-6);
        assertEquals(0.4f, tuned.contrastWeight(), 1e-6);
        assertEquals(0.3f, tuned.saturationWeight(), 1e-6);
        assertEquals(4, tuned.edgeRadius());
        assertEquals(0.82f, tuned.importantSamplingRatio(), 1e-5);
    }

    /**
     * 中等複雜度只將半徑加 1，低複雜度不變
     */
    @Test
    void testComplexityLevels_ShouldBoostRadiusStepwise() {
        assertEquals(3, tuner.tune(SamplingParams.DEFAULT, analysis(0.5f, 0.5f, 0.5f, 5f)).edgeRadius());
        assertEquals(2, tuner.tune(SamplingParams.DEFAULT, analysis(0.5f, 0.5f, 0.5f, 1f)).edgeRadius());
    }

    /**
     * 調整後的值應落在限制範圍內
     */
    @Test
    void testExtremeAnalysis_ShouldClampValues() {
        SamplingParams base = SamplingParams.DEFAULT
                .withImportanceThreshold(1f)
                .withContrastWeight(5f)
                .withImportantSamplingRatio(0.95f);
        SamplingParams tuned = tuner.tune(base, analysis(1f, 1f, 1f, 10f));

        assertEquals(0.9f, tuned.importanceThreshold(), 1e-6);
        assertEquals(2.0f, tuned.contrastWeight(), 1e-6);
        assertEquals(0.9f, tuned.importantSamplingRatio(), 1e-6);
        assertTrue(tuned.saturationWeight() >= 0.1f && tuned.saturationWeight() <= 2.0f);
    }
}
