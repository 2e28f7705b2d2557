package work.pollochang.particles.image.tools;

import work.pollochang.particles.image.config.GenerationConfig;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public class CacheTools {

    /** 快取鍵格式版本，取樣結果格式改變時遞增 */
    public static final String KEY_VERSION = "particles_v1";
    public static final String PAYLOAD_SUFFIX = ".cache";

    /**
     * 產生快取鍵。
     * <p>
     * 鍵只由圖片尺寸與設定組成，不包含像素內容：尺寸與設定相同的兩張不同圖片會共用同一個快取項目。
     * @param width  圖片寬度
     * @param height 圖片高度
     * @param config 產生設定
     * @return 例如 {@code particles_v1_100x80_1000_standard_importance}
     */
    public static String createKey(int width, int height, GenerationConfig config) {
        return String.format("%s_%dx%d_%d_%s_%s",
                KEY_VERSION,
                width,
                height,
                config.targetParticleCount(),
                config.qualityPreset().key(),
                config.strategyKey());
    }

    /**
     * 快取鍵對應的 payload 檔名：SHA-256 十六進位字串加上 {@value #PAYLOAD_SUFFIX}。
     */
    public static String payloadFileName(String key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(key.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash) + PAYLOAD_SUFFIX;
        } catch (NoSuchAlgorithmException e) {
            // 每個 JDK 都必須提供 SHA-256
            throw new IllegalStateException("SHA-256 不可用", e);
        }
    }
}
