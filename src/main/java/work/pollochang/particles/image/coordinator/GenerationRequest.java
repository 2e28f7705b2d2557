package work.pollochang.particles.image.coordinator;

import work.pollochang.particles.image.analysis.ImageAnalysis;
import work.pollochang.particles.image.assembly.Viewport;
import work.pollochang.particles.image.config.GenerationConfig;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * 一次產生請求。
 *
 * @param image               已解碼的圖片，產生期間視為唯讀
 * @param config              產生設定
 * @param viewport            目標畫面，為 null 時使用圖片尺寸
 * @param precomputedAnalysis 先前算好的圖片分析，為 null 時重新分析
 * @param seed                隨機種子，為 null 時每次不同
 */
public record GenerationRequest(
        BufferedImage image,
        GenerationConfig config,
        Viewport viewport,
        ImageAnalysis precomputedAnalysis,
        Long seed
) {

    public GenerationRequest {
        Objects.requireNonNull(image, "image must not be null");
        Objects.requireNonNull(config, "config must not be null");
    }

    public static GenerationRequest of(BufferedImage image, GenerationConfig config) {
        return new GenerationRequest(image, config, null, null, null);
    }

    public GenerationRequest withViewport(Viewport viewport) {
        return new GenerationRequest(image, config, viewport, precomputedAnalysis, seed);
    }

    public GenerationRequest withSeed(long seed) {
        return new GenerationRequest(image, config, viewport, precomputedAnalysis, seed);
    }

    public GenerationRequest withPrecomputedAnalysis(ImageAnalysis analysis) {
        return new GenerationRequest(image, config, viewport, analysis, seed);
    }
}
