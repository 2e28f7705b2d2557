package work.pollochang.particles.image;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.particles.image.assembly.Viewport;
import work.pollochang.particles.image.cache.CacheManager;
import work.pollochang.particles.image.config.GenerationConfig;
import work.pollochang.particles.image.coordinator.GenerationCoordinator;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.pipeline.SequentialExecutionStrategy;
import work.pollochang.particles.image.report.GenerationOutcome;
import work.pollochang.particles.image.report.GenerationReport;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GenerationBatchTest {

    private static final GenerationConfig CONFIG = GenerationConfig.standard()
            .withTargetParticleCount(120)
            .withCachingEnabled(false);

    private static Path writePng(Path dir, String name) throws IOException {
        Path file = dir.resolve(name);
        ImageIO.write(TestImages.checkerboard(60, 40, 5), "png", file.toFile());
        return file;
    }

    private static GenerationBatch batch(Path outputDir) {
        GenerationBatch batch = new GenerationBatch();
        batch.setOutputDir(outputDir);
        batch.setConfig(CONFIG);
        batch.setExecutionStrategy(new SequentialExecutionStrategy());
        batch.setThreadCount(2);
        batch.setSeed(3L);
        return batch;
    }

    /**
     * 處理單張 PNG 並寫出粒子 JSON
     */
    @Test
    void testProcessImage_ShouldWriteParticleDocument(@TempDir Path dir) throws IOException {
        Path png = writePng(dir, "sample.png");
        Path out = dir.resolve("out");
        GenerationBatch batch = batch(out);
        batch.setViewport(new Viewport(120, 80));
        Files.createDirectories(out);

        GenerationReport report = batch.processImage(png,
                new GenerationCoordinator(null, new SequentialExecutionStrategy()));

        assertEquals(GenerationOutcome.GENERATED_SUCCESS, report.outcome());
        assertEquals(120, report.particleCount());
        JsonNode document = new ObjectMapper().readTree(out.resolve("sample" + GenerationBatch.OUTPUT_SUFFIX).toFile());
        assertEquals(60, document.get("imageWidth").asInt());
        assertEquals(40, document.get("imageHeight").asInt());
        assertEquals(120, document.get("viewportWidth").asInt());
        assertEquals("standard", document.get("preset").asText());
        assertEquals("importance", document.get("strategy").asText());
        assertFalse(document.get("fromCache").asBoolean());
        assertEquals(120, document.get("particles").size());
        JsonNode first = document.get("particles").get(0);
        assertTrue(first.has("x") && first.has("y") && first.has("size") && first.has("color"));
    }

    @Test
    void testProcessImage_MissingFile_ShouldBeSkipped(@TempDir Path dir) {
        GenerationReport report = batch(dir).processImage(dir.resolve("absent.png"),
                new GenerationCoordinator(null, new SequentialExecutionStrategy()));

        assertEquals(GenerationOutcome.SKIPPED_NOT_FOUND, report.outcome());
        assertEquals(0, report.particleCount());
    }

    @Test
    void testProcessImage_CorruptFile_ShouldFail(@TempDir Path dir) throws IOException {
        Path broken = Files.writeString(dir.resolve("broken.png"), "not an image");

        GenerationReport report = batch(dir).processImage(broken,
                new GenerationCoordinator(null, new SequentialExecutionStrategy()));

        assertFalse(report.outcome().isSuccess());
        assertNotEquals(GenerationOutcome.SKIPPED_NOT_FOUND, report.outcome());
    }

    /**
     * 檔案列表中的每一行都會處理，相同尺寸的第二張圖命中共用快取
     */
    @Test
    void testExecute_FileListWithSharedCache_ShouldCountOutcomes(@TempDir Path dir) throws IOException, GenerationException {
        Path a = writePng(dir, "a.png");
        Path b = writePng(dir, "b.png");
        Path list = Files.write(dir.resolve("list.txt"),
                List.of(a.toString(), "", dir.resolve("missing.png").toString()));
        Path out = dir.resolve("out");
        CacheManager cache = CacheManager.open(dir.resolve("cache"), CacheManager.DEFAULT_MAX_SIZE);

        GenerationBatch first = batch(out);
        first.setConfig(CONFIG.withCachingEnabled(true));
        first.setFileList(list);
        first.setCacheManager(cache);
        Map<GenerationOutcome, Long> counts = first.execute();

        assertEquals(1L, counts.get(GenerationOutcome.GENERATED_SUCCESS));
        assertEquals(1L, counts.get(GenerationOutcome.SKIPPED_NOT_FOUND));
        assertTrue(Files.exists(out.resolve("a" + GenerationBatch.OUTPUT_SUFFIX)));

        GenerationBatch second = batch(out);
        second.setConfig(CONFIG.withCachingEnabled(true));
        second.setInputFile(b);
        second.setCacheManager(cache);
        Map<GenerationOutcome, Long> secondCounts = second.execute();

        assertEquals(1L, secondCounts.get(GenerationOutcome.CACHE_HIT));
        JsonNode document = new ObjectMapper().readTree(out.resolve("b" + GenerationBatch.OUTPUT_SUFFIX).toFile());
        assertTrue(document.get("fromCache").asBoolean());
        cache.close();
    }
}
