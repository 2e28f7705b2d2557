package work.pollochang.particles.image.sampling;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import work.pollochang.particles.image.TestImages;
import work.pollochang.particles.image.config.AdvancedAlgorithm;
import work.pollochang.particles.image.config.GenerationConfig;
import work.pollochang.particles.image.config.SamplingStrategyType;
import work.pollochang.particles.image.core.CancellationToken;
import work.pollochang.particles.image.core.GenerationError;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.PixelAccessor;
import work.pollochang.particles.image.core.Sample;
import work.pollochang.particles.image.sampling.advanced.BlueNoiseSampling;
import work.pollochang.particles.image.sampling.advanced.StratifiedBandSampling;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class PixelSamplerTest {

    private final PixelSampler sampler = new PixelSampler();

    static Stream<Arguments> strategies() {
        List<Arguments> arguments = new ArrayList<>();
        for (SamplingStrategyType type : SamplingStrategyType.values()) {
            if (type == SamplingStrategyType.ADVANCED) {
                for (AdvancedAlgorithm algorithm : AdvancedAlgorithm.values()) {
                    arguments.add(Arguments.of(type, algorithm));
                }
            } else {
                arguments.add(Arguments.of(type, AdvancedAlgorithm.BLUE_NOISE));
            }
        }
        return arguments.stream();
    }

    private static GenerationConfig config(SamplingStrategyType type, AdvancedAlgorithm algorithm, int target) {
        return GenerationConfig.standard()
                .withSamplingStrategy(type)
                .withAdvancedAlgorithm(algorithm)
                .withTargetParticleCount(target);
    }

    private static SamplingRequest request(PixelAccessor accessor, GenerationConfig config) {
        return SamplingRequest.of(accessor, config.targetParticleCount(), config.samplingParams())
                .withRandom(new Random(2024));
    }

    /**
     * 所有策略都應回傳恰好目標數量、不重複且不越界的點
     */
    @ParameterizedTest
    @MethodSource("strategies")
    void testEveryStrategy_ShouldReturnExactUniqueInBoundsSamples(SamplingStrategyType type,
                                                                  AdvancedAlgorithm algorithm) throws GenerationException {
        PixelAccessor accessor = PixelAccessor.fromImage(TestImages.checkerboard(120, 90, 9));
        GenerationConfig config = config(type, algorithm, 500);

        List<Sample> samples = sampler.sample(request(accessor, config), config);

        assertEquals(500, samples.size());
        Set<Long> positions = new HashSet<>();
        for (Sample s : samples) {
            assertTrue(accessor.contains(s.x(), s.y()), "越界: " + s);
            assertTrue(positions.add(s.positionKey()), "重複: " + s);
        }
    }

    /**
     * 目標數量等於總像素時應回傳每個像素恰好一次
     */
    @ParameterizedTest
    @MethodSource("strategies")
    void testTargetEqualsTotal_ShouldReturnEveryPixelOnce(SamplingStrategyType type,
                                                         AdvancedAlgorithm algorithm) throws GenerationException {
        PixelAccessor accessor = PixelAccessor.fromImage(TestImages.solid(100, 100, Color.ORANGE));
        GenerationConfig config = config(type, algorithm, 10_000);

        List<Sample> samples = sampler.sample(request(accessor, config), config);

        assertEquals(10_000, samples.size());
        assertEquals(10_000, samples.stream().map(Sample::positionKey).distinct().count());
    }

    /**
     * 目標數量大於總像素時只回傳總像素數
     */
    @Test
    void testTargetAboveTotal_ShouldCapAtTotalPixels() throws GenerationException {
        PixelAccessor accessor = PixelAccessor.fromImage(TestImages.solid(20, 10, Color.CYAN));
        GenerationConfig config = config(SamplingStrategyType.UNIFORM, AdvancedAlgorithm.BLUE_NOISE, 500);

        List<Sample> samples = sampler.sample(request(accessor, config), config);

        assertEquals(200, samples.size());
        assertEquals(0, samples.get(0).x());
        assertEquals(19, samples.get(199).x());
        assertEquals(9, samples.get(199).y());
    }

    /**
     * 目標數量非正數應拋出 INVALID_CONFIGURATION
     */
    @Test
    void testNonPositiveTarget_ShouldThrowInvalidConfiguration() throws GenerationException {
        PixelAccessor accessor = PixelAccessor.fromImage(TestImages.solid(10, 10, Color.CYAN));
        GenerationConfig config = GenerationConfig.standard();
        SamplingRequest request = SamplingRequest.of(accessor, 0, config.samplingParams());

        GenerationException e = assertThrows(GenerationException.class, () -> sampler.sample(request, config));
        assertEquals(GenerationError.INVALID_CONFIGURATION, e.getError());
    }

    /**
     * 策略選擇應對應到設定
     */
    @Test
    void testStrategyFor_ShouldDispatchOnConfig() {
        GenerationConfig base = GenerationConfig.standard();
        assertInstanceOf(UniformSampling.class,
                PixelSampler.strategyFor(base.withSamplingStrategy(SamplingStrategyType.UNIFORM)));
        assertInstanceOf(HybridSampling.class,
                PixelSampler.strategyFor(base.withSamplingStrategy(SamplingStrategyType.HYBRID)));
        assertInstanceOf(BlueNoiseSampling.class, PixelSampler.strategyFor(base
                .withSamplingStrategy(SamplingStrategyType.ADVANCED)
                .withAdvancedAlgorithm(AdvancedAlgorithm.BLUE_NOISE)));
        assertEquals("stratified-adaptive", PixelSampler.advanced(AdvancedAlgorithm.ADAPTIVE).name());
        assertInstanceOf(StratifiedBandSampling.class, PixelSampler.advanced(AdvancedAlgorithm.UNIFORM));
    }

    /**
     * 已取消時應拋出 CANCELLED
     */
    @Test
    void testCancelledRequest_ShouldThrowCancelled() throws GenerationException {
        PixelAccessor accessor = PixelAccessor.fromImage(TestImages.checkerboard(64, 64, 4));
        GenerationConfig config = config(SamplingStrategyType.ADVANCED, AdvancedAlgorithm.BLUE_NOISE, 300);
        CancellationToken token = new CancellationToken();
        token.cancel();

        GenerationException e = assertThrows(GenerationException.class,
                () -> sampler.sample(request(accessor, config).withToken(token), config));
        assertTrue(e.isCancelled());
    }
    /**
     * 上白下黑的大圖需要大量上下平衡替換，仍應在合理時間內回傳恰好目標數量
     */
    @Test
    void testLargeLopsidedImage_ShouldRebalanceWithinTimeLimit() throws GenerationException {
        BufferedImage image = TestImages.solid(600, 600, Color.BLACK);
        for (int y = 0; y < 300; y++) {
            for (int x = 0; x < 600; x++) {
                image.setRGB(x, y, 0xffffffff);
            }
        }
        PixelAccessor accessor = PixelAccessor.fromImage(image);
        GenerationConfig config = config(SamplingStrategyType.ADVANCED, AdvancedAlgorithm.ADAPTIVE, 36_000);

        List<Sample> samples = assertTimeoutPreemptively(Duration.ofSeconds(20),
                () -> sampler.sample(request(accessor, config), config));

        assertEquals(36_000, samples.size());
        assertEquals(36_000, samples.stream().map(Sample::positionKey).distinct().count());
    }
}
