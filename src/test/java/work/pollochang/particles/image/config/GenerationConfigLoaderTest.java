package work.pollochang.particles.image.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.particles.image.core.GenerationError;
import work.pollochang.particles.image.core.GenerationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GenerationConfigLoaderTest {

    /**
     * 指定的欄位覆蓋預設值，未指定的欄位維持預設
     */
    @Test
    void testLoad_ShouldOverlayFieldsOnPreset(@TempDir Path dir) throws IOException, GenerationException {
        Path file = Files.writeString(dir.resolve("config.json"),
                "{ \"preset\": \"high\", \"targetParticleCount\": 1234, \"samplingStrategy\": \"advanced\","
                        + " \"advancedAlgorithm\": \"HASH_BASED\", \"displayMode\": \"fill\" }");

        GenerationConfig config = GenerationConfigLoader.load(file);

        assertEquals(QualityPreset.HIGH, config.qualityPreset());
        assertEquals(1234, config.targetParticleCount());
        assertEquals(SamplingStrategyType.ADVANCED, config.samplingStrategy());
        assertEquals(AdvancedAlgorithm.HASH_BASED, config.advancedAlgorithm());
        assertEquals(DisplayMode.FILL, config.displayMode());
        assertEquals(GenerationConfig.high().importanceThreshold(), config.importanceThreshold());
        assertEquals(GenerationConfig.high().edgeRadius(), config.edgeRadius());
    }

    /**
     * 沒有 preset 時以 standard 為基礎，未知欄位被忽略
     */
    @Test
    void testLoad_WithoutPreset_ShouldUseStandard(@TempDir Path dir) throws IOException, GenerationException {
        Path file = Files.writeString(dir.resolve("config.json"),
                "{ \"maxConcurrency\": 1, \"comment\": \"ignored\" }");

        GenerationConfig config = GenerationConfigLoader.load(file);

        assertEquals(GenerationConfig.standard().withMaxConcurrency(1), config);
    }

    @Test
    void testLoad_MissingFile_ShouldThrowInvalidConfiguration(@TempDir Path dir) {
        GenerationException e = assertThrows(GenerationException.class,
                () -> GenerationConfigLoader.load(dir.resolve("absent.json")));
        assertEquals(GenerationError.INVALID_CONFIGURATION, e.getError());
    }

    @Test
    void testLoad_MalformedJson_ShouldThrowInvalidConfiguration(@TempDir Path dir) throws IOException {
        Path broken = Files.writeString(dir.resolve("broken.json"), "{ \"targetParticleCount\": ");
        Path array = Files.writeString(dir.resolve("array.json"), "[1, 2]");
        Path badEnum = Files.writeString(dir.resolve("enum.json"), "{ \"preset\": \"extreme\" }");

        for (Path file : new Path[]{broken, array, badEnum}) {
            GenerationException e = assertThrows(GenerationException.class, () -> GenerationConfigLoader.load(file));
            assertEquals(GenerationError.INVALID_CONFIGURATION, e.getError());
        }
    }
}
