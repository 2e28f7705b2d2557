package work.pollochang.particles.image.sampling;

import org.junit.jupiter.api.Test;
import work.pollochang.particles.image.TestImages;
import work.pollochang.particles.image.config.GenerationConfig;
import work.pollochang.particles.image.config.SamplingStrategyType;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.PixelAccessor;
import work.pollochang.particles.image.core.Rgba;
import work.pollochang.particles.image.core.Sample;
import work.pollochang.particles.image.core.SampleSet;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ImportanceSamplingTest {

    private static final Rgba RED = new Rgba(1f, 0f, 0f, 1f);

    /**
     * 4x4 黑色影像中唯一的飽和紅色像素
     */
    private PixelAccessor redDotAccessor() throws GenerationException {
        BufferedImage image = TestImages.solid(4, 4, Color.BLACK);
        image.setRGB(1, 1, 0xffff0000);
        return PixelAccessor.fromImage(image);
    }

    /**
     * 門檻 0.5 時紅色像素應被選入
     */
    @Test
    void testSaturatedRedPixel_ShouldBeIncluded() throws GenerationException {
        SamplingRequest request = SamplingRequest.of(redDotAccessor(), 4,
                SamplingParams.DEFAULT.withImportanceThreshold(0.5f)).withRandom(new Random(3));

        List<Sample> samples = new ImportanceSampling().sample(request);

        assertEquals(4, samples.size());
        assertTrue(samples.stream().anyMatch(s -> s.x() == 1 && s.y() == 1 && s.color().equals(RED)));
    }

    /**
     * 只有紅色像素達到門檻
     */
    @Test
    void testScoreCandidates_ShouldOnlyReturnRedPixel() throws GenerationException {
        SamplingRequest request = SamplingRequest.of(redDotAccessor(), 4,
                SamplingParams.DEFAULT.withImportanceThreshold(0.5f));

        List<ScoredPixel> candidates = new ImportanceSampling().scoreCandidates(request, 0.5f);

        assertEquals(1, candidates.size());
        assertEquals(1, candidates.get(0).x());
        assertEquals(1, candidates.get(0).y());
    }

    /**
     * 經由 PixelSampler 執行時 (不經過分布檢查) 紅色像素同樣保留
     */
    @Test
    void testPixelSamplerImportance_ShouldKeepRedPixel() throws GenerationException {
        GenerationConfig config = GenerationConfig.standard()
                .withSamplingStrategy(SamplingStrategyType.IMPORTANCE)
                .withImportanceThreshold(0.5f)
                .withTargetParticleCount(4);
        SamplingRequest request = SamplingRequest.of(redDotAccessor(), 4, config.samplingParams())
                .withRandom(new Random(11));

        List<Sample> samples = new PixelSampler().sample(request, config);

        assertEquals(4, samples.size());
        assertTrue(samples.stream().anyMatch(s -> s.x() == 1 && s.y() == 1));
    }

    /**
     * 白色背景與透明像素不應成為候選
     */
    @Test
    void testWhiteAndTransparentPixels_ShouldBeSkipped() throws GenerationException {
        BufferedImage image = TestImages.solid(10, 10, Color.WHITE);
        image.setRGB(0, 0, 0x00ff0000);
        SamplingRequest request = SamplingRequest.of(PixelAccessor.fromImage(image), 10,
                SamplingParams.DEFAULT.withImportanceThreshold(0f));

        assertTrue(new ImportanceSampling().scoreCandidates(request, 0f).isEmpty());
        assertTrue(ImportanceScorer.isWhiteBackground(new Rgba(1f, 1f, 1f, 1f)));
        assertFalse(ImportanceScorer.isWhiteBackground(RED));
    }

    /**
     * 上下比例 1.0 時重要點應全部來自上半部
     */
    @Test
    void testTopBottomRatio_ShouldPreferTopHalf() throws GenerationException {
        BufferedImage image = TestImages.solid(40, 40, Color.BLACK);
        for (int y = 0; y < 40; y += 4) {
            for (int x = 0; x < 40; x += 4) {
                image.setRGB(x, y, 0xffff0000);
            }
        }
        SamplingParams params = SamplingParams.DEFAULT
                .withImportanceThreshold(0.5f)
                .withImportantSamplingRatio(1f)
                .withTopBottomRatio(1f);
        SamplingRequest request = SamplingRequest.of(PixelAccessor.fromImage(image), 20, params)
                .withRandom(new Random(5));

        SampleSet set = new SampleSet();
        int added = new ImportanceSampling().selectImportant(request, 20, 0.5f, set);

        assertEquals(20, added);
        assertTrue(set.toList().stream().allMatch(s -> s.y() < 20));
    }
    /**
     * 同分的候選點依掃描順序選取，先掃描到的優先
     */
    @Test
    void testEqualScores_ShouldPreferFirstScanned() throws GenerationException {
        BufferedImage image = TestImages.solid(20, 4, Color.BLACK);
        for (int x = 1; x < 20; x += 4) {
            image.setRGB(x, 1, 0xffff0000);
        }
        SamplingRequest request = SamplingRequest.of(PixelAccessor.fromImage(image), 3,
                SamplingParams.DEFAULT.withImportanceThreshold(0.5f).withTopBottomRatio(1f));
        ImportanceSampling sampling = new ImportanceSampling();

        List<ScoredPixel> candidates = sampling.scoreCandidates(request, 0.5f);
        assertEquals(5, candidates.size());
        assertTrue(candidates.stream().allMatch(c -> c.score() == candidates.get(0).score()));

        SampleSet set = new SampleSet();
        int added = sampling.selectImportant(request, 3, 0.5f, set);

        assertEquals(3, added);
        assertEquals(List.of(1, 5, 9), set.toList().stream().map(Sample::x).toList());
    }

    /**
     * 黑點被白色完全包圍時對比度為 1，不會超出 0..1
     */
    @Test
    void testContrast_ShouldBeNormalizedToUnitRange() throws GenerationException {
        BufferedImage image = TestImages.solid(3, 3, Color.WHITE);
        image.setRGB(1, 1, 0xff000000);
        ImportanceScorer scorer = new ImportanceScorer(PixelAccessor.fromImage(image),
                SamplingParams.DEFAULT.withEdgeRadius(1), List.of());

        float contrast = scorer.contrast(1, 1, new Rgba(0f, 0f, 0f, 1f));

        assertEquals(1f, contrast, 1e-4f);
    }
}
