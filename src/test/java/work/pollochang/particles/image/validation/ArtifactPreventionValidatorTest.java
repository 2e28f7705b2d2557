package work.pollochang.particles.image.validation;

import org.junit.jupiter.api.Test;
import work.pollochang.particles.image.TestImages;
import work.pollochang.particles.image.core.CancellationToken;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.PixelAccessor;
import work.pollochang.particles.image.core.Sample;

import java.awt.Color;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactPreventionValidatorTest {

    private final ArtifactPreventionValidator validator = new ArtifactPreventionValidator();

    private static List<Sample> cornerBlock(PixelAccessor accessor, int side) {
        List<Sample> samples = new ArrayList<>();
        for (int y = 0; y < side; y++) {
            for (int x = 0; x < side; x++) {
                samples.add(accessor.sampleAt(x, y));
            }
        }
        return samples;
    }

    /**
     * 全部擠在左上角的取樣應被判定為覆蓋不足、上下失衡且群聚
     */
    @Test
    void testInspectCornerBlock_ShouldReportAllProblems() throws GenerationException {
        PixelAccessor accessor = PixelAccessor.fromImage(TestImages.solid(200, 200, Color.DARK_GRAY));
        DistributionReport report = validator.inspect(cornerBlock(accessor, 8), accessor);

        assertEquals(1f / 16, report.coverage(), 1e-6);
        assertTrue(report.coverageDeficient());
        assertEquals(1f, report.topShare(), 1e-6);
        assertEquals(0.5f, report.expectedTopShare(), 1e-6);
        assertTrue(report.verticallyImbalanced());
        assertTrue(report.clustered());
        assertEquals(3, report.missingCorners());
    }

    /**
     * 修正後數量不變、不重複，且群聚與上下失衡的程度降低
     */
    @Test
    void testValidateAndCorrect_ShouldSpreadClusteredSamples() throws GenerationException {
        PixelAccessor accessor = PixelAccessor.fromImage(TestImages.solid(200, 200, Color.DARK_GRAY));
        List<Sample> block = cornerBlock(accessor, 8);
        DistributionReport before = validator.inspect(block, accessor);

        List<Sample> corrected = validator.validateAndCorrect(block, accessor, 64, new Random(17),
                CancellationToken.NONE);
        DistributionReport after = validator.inspect(corrected, accessor);

        assertEquals(64, corrected.size());
        assertEquals(64, corrected.stream().map(Sample::positionKey).distinct().count());
        assertTrue(corrected.stream().allMatch(s -> accessor.contains(s.x(), s.y())));
        assertTrue(after.clusteredFraction() < before.clusteredFraction());
        assertTrue(Math.abs(after.topShare() - after.expectedTopShare())
                < Math.abs(before.topShare() - before.expectedTopShare()));
    }

    /**
     * 越界點應被夾回範圍內，重複點應被移除
     */
    @Test
    void testOutOfBoundsAndDuplicates_ShouldBeSanitized() throws GenerationException {
        PixelAccessor accessor = PixelAccessor.fromImage(TestImages.solid(200, 200, Color.DARK_GRAY));
        List<Sample> samples = List.of(
                new Sample(-5, 3, accessor.colorAt(0, 3)),
                new Sample(0, 3, accessor.colorAt(0, 3)),
                new Sample(250, 10, accessor.colorAt(199, 10)),
                new Sample(10, 10, accessor.colorAt(10, 10)));

        List<Sample> corrected = validator.validateAndCorrect(samples, accessor, 10, new Random(1),
                CancellationToken.NONE);

        assertEquals(3, corrected.size());
        assertEquals(3, corrected.stream().map(Sample::positionKey).distinct().count());
        assertTrue(corrected.stream().allMatch(s -> accessor.contains(s.x(), s.y())));
    }

    /**
     * 結果不應超過目標數量
     */
    @Test
    void testResult_ShouldNeverExceedTarget() throws GenerationException {
        PixelAccessor accessor = PixelAccessor.fromImage(TestImages.solid(50, 50, Color.DARK_GRAY));
        List<Sample> corrected = validator.validateAndCorrect(cornerBlock(accessor, 10), accessor, 30,
                new Random(4), CancellationToken.NONE);

        assertTrue(corrected.size() <= 30);
    }

    /**
     * 取樣間距太小時不檢查群聚
     */
    @Test
    void testShouldCheckClustering_ShouldDependOnSpacing() throws GenerationException {
        PixelAccessor accessor = PixelAccessor.fromImage(TestImages.solid(100, 100, Color.DARK_GRAY));

        assertFalse(ArtifactPreventionValidator.shouldCheckClustering(100, accessor));
        assertTrue(ArtifactPreventionValidator.shouldCheckClustering(10, accessor));
        assertFalse(ArtifactPreventionValidator.shouldCheckClustering(0, accessor));
    }

    /**
     * 分散的點不應被判定為群聚
     */
    @Test
    void testSpreadSamples_ShouldNotBeClustered() {
        List<Sample> spread = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            spread.add(new Sample(i * 20, i * 20, null));
        }
        assertTrue(ArtifactPreventionValidator.clusteredSamples(spread).isEmpty());
    }
}
