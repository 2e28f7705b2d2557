package work.pollochang.particles.image.sampling;

import org.junit.jupiter.api.Test;
import work.pollochang.particles.image.TestImages;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.PixelAccessor;
import work.pollochang.particles.image.core.Sample;

import java.awt.Color;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class UniformSamplingTest {

    /**
     * 100x100 取 50 個點，間距應為 200，且 50 個點皆不重複
     */
    @Test
    void testHundredSquareFiftyTargets_ShouldUseStrideTwoHundred() throws GenerationException {
        PixelAccessor accessor = PixelAccessor.fromImage(TestImages.solid(100, 100, Color.GRAY));
        List<Sample> samples = new UniformSampling()
                .sample(SamplingRequest.of(accessor, 50, SamplingParams.DEFAULT).withRandom(new Random(1)));

        assertEquals(200, UniformSampling.stride(10_000, 50));
        assertEquals(50, samples.size());
        assertEquals(50, samples.stream().map(Sample::positionKey).distinct().count());
        for (int i = 0; i < samples.size(); i++) {
            int index = samples.get(i).y() * 100 + samples.get(i).x();
            assertEquals(i * 200, index);
        }
    }

    /**
     * 間距至少為 1
     */
    @Test
    void testStride_ShouldNeverBeBelowOne() {
        assertEquals(1, UniformSampling.stride(10, 50));
        assertEquals(1, UniformSampling.stride(10, 10));
        assertEquals(4, UniformSampling.stride(10, 3));
    }

    /**
     * 間距取整數造成不足時，應以隨機點補滿
     */
    @Test
    void testStrideShortfall_ShouldBeFilledRandomly() throws GenerationException {
        PixelAccessor accessor = PixelAccessor.fromImage(TestImages.solid(10, 10, Color.GRAY));
        // ceil(100 / 40) = 3 -> 只取得 34 個
        List<Sample> samples = new UniformSampling()
                .sample(SamplingRequest.of(accessor, 40, SamplingParams.DEFAULT).withRandom(new Random(7)));

        assertEquals(40, samples.stream().map(Sample::positionKey).distinct().count());
    }
}
