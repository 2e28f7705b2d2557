package work.pollochang.particles.image.analysis;

import org.junit.jupiter.api.Test;
import work.pollochang.particles.image.TestImages;
import work.pollochang.particles.image.core.CancellationToken;
import work.pollochang.particles.image.core.GenerationError;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.PixelAccessor;
import work.pollochang.particles.image.core.Rgba;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ImageAnalyzerTest {

    private final ImageAnalyzer analyzer = new ImageAnalyzer();

    /**
     * 單色影像：沒有對比與邊緣，代表色即為該顏色
     */
    @Test
    void testSolidImage_ShouldHaveNoContrastAndSingleDominantColor() throws GenerationException {
        ImageAnalysis analysis = analyzer.analyze(TestImages.solid(64, 64, Color.RED));

        assertEquals(0f, analysis.contrast(), 1e-6);
        assertEquals(0f, analysis.edgeDensity(), 1e-6);
        assertEquals(0f, analysis.complexity(), 1e-6);
        assertEquals(1f, analysis.saturation(), 1e-6);
        assertEquals(1f, analysis.pixelDensity(), 1e-6);
        assertEquals(1, analysis.dominantColors().size());
        assertEquals(new Rgba(1f, 0f, 0f, 1f), analysis.dominantColors().get(0).color());
        assertEquals(1f, analysis.dominantColors().get(0).share(), 1e-6);
    }

    /**
     * 黑白分界的影像應偵測到邊緣
     */
    @Test
    void testHalfBlackHalfWhite_ShouldDetectEdges() throws GenerationException {
        ImageAnalysis analysis = analyzer.analyze(TestImages.halfBlackHalfWhite(100, 100));

        assertTrue(analysis.contrast() > 0f);
        assertTrue(analysis.edgeDensity() > 0f);
        assertTrue(analysis.complexity() > 0f && analysis.complexity() <= 10f);
        assertEquals(2, analysis.dominantColors().size());
        assertEquals(0.5f, analysis.brightness(), 0.02f);
    }

    /**
     * 完全透明的影像應拋出 INVALID_IMAGE
     */
    @Test
    void testFullyTransparentImage_ShouldThrowInvalidImage() {
        BufferedImage transparent = new BufferedImage(20, 20, BufferedImage.TYPE_INT_ARGB);

        GenerationException e = assertThrows(GenerationException.class, () -> analyzer.analyze(transparent));
        assertEquals(GenerationError.INVALID_IMAGE, e.getError());
    }

    /**
     * 平行分析與依序分析的結果應一致
     */
    @Test
    void testParallelAnalysis_ShouldMatchSequential() throws Exception {
        PixelAccessor accessor = PixelAccessor.fromImage(TestImages.checkerboard(600, 400, 7));
        ExecutorService workers = Executors.newFixedThreadPool(4);
        try {
            ImageAnalysis sequential = analyzer.analyze(accessor);
            ImageAnalysis parallel = analyzer.analyze(accessor, workers, 4, CancellationToken.NONE);

            assertEquals(sequential.sampledPixels(), parallel.sampledPixels());
            assertEquals(sequential.contrast(), parallel.contrast(), 1e-5);
            assertEquals(sequential.edgeDensity(), parallel.edgeDensity(), 1e-6);
            assertEquals(sequential.saturation(), parallel.saturation(), 1e-5);
            assertEquals(sequential.dominantColors().size(), parallel.dominantColors().size());
            for (int i = 0; i < sequential.dominantColors().size(); i++) {
                assertEquals(sequential.dominantColors().get(i).color(), parallel.dominantColors().get(i).color());
            }
        } finally {
            workers.shutdownNow();
            workers.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    /**
     * 已取消的 token 應讓分析拋出 CANCELLED
     */
    @Test
    void testCancelledToken_ShouldStopAnalysis() throws GenerationException {
        PixelAccessor accessor = PixelAccessor.fromImage(TestImages.solid(50, 50, Color.BLUE));
        CancellationToken token = new CancellationToken();
        token.cancel();

        GenerationException e = assertThrows(GenerationException.class,
                () -> analyzer.analyze(accessor, null, 1, token));
        assertTrue(e.isCancelled());
    }

    /**
     * 超過上限的影像應先縮小再分析
     */
    @Test
    void testLargeImage_ShouldBeDownscaledBeforeAnalysis() throws GenerationException {
        ImageAnalysis analysis = analyzer.analyze(TestImages.solid(3000, 10, Color.GREEN));

        // 縮小後寬 2048，網格間距 8 -> 每列 256 個取樣點
        assertTrue(analysis.sampledPixels() <= 256 * 2);
        assertTrue(analysis.pixelDensity() > 0.9f);
    }
}
