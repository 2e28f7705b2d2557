package work.pollochang.particles.image.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.particles.image.core.GenerationError;
import work.pollochang.particles.image.core.GenerationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 從 JSON 檔案讀取 {@link GenerationConfig}。
 * <p>
 * 檔案中可用 {@code "preset"} 指定基礎預設 (預設為 standard)，其餘欄位覆蓋在預設值之上，
 * 未出現的欄位維持預設值。
 */
@Slf4j
public final class GenerationConfigLoader {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private GenerationConfigLoader() {}

    public static GenerationConfig load(Path path) throws GenerationException {
        if (!Files.exists(path)) {
            throw new GenerationException(GenerationError.INVALID_CONFIGURATION, "設定檔不存在: " + path);
        }
        try {
            JsonNode root = MAPPER.readTree(path.toFile());
            GenerationConfig config = merge(root);
            log.info("成功從 {} 讀取產生設定 (preset={}, strategy={})", path, config.qualityPreset(), config.strategyKey());
            return config;
        } catch (IOException e) {
            throw new GenerationException(GenerationError.INVALID_CONFIGURATION, "無法解析設定檔: " + path, e);
        }
    }

    static GenerationConfig merge(JsonNode overrides) throws IOException, GenerationException {
        if (overrides == null || !overrides.isObject()) {
            throw new GenerationException(GenerationError.INVALID_CONFIGURATION, "設定內容必須是 JSON 物件");
        }
        ObjectNode fields = ((ObjectNode) overrides).deepCopy();
        QualityPreset preset = QualityPreset.STANDARD;
        JsonNode presetNode = fields.remove("preset");
        if (presetNode != null) {
            preset = MAPPER.treeToValue(presetNode, QualityPreset.class);
        }

        ObjectNode base = MAPPER.valueToTree(GenerationConfig.forPreset(preset));
        base.setAll(fields);
        return MAPPER.treeToValue(base, GenerationConfig.class);
    }
}
