package work.pollochang.particles.image.pipeline;

import lombok.Getter;
import lombok.Setter;
import work.pollochang.particles.image.analysis.ImageAnalysis;
import work.pollochang.particles.image.assembly.Particle;
import work.pollochang.particles.image.assembly.Viewport;
import work.pollochang.particles.image.config.GenerationConfig;
import work.pollochang.particles.image.core.CancellationToken;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.PixelAccessor;
import work.pollochang.particles.image.core.Sample;
import work.pollochang.particles.image.sampling.SamplingParams;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * 一次產生流程的輸入與各階段的中間結果。只在執行管線的執行緒上讀寫。
 */
@Getter
public class GenerationContext {

    private final BufferedImage image;
    private final PixelAccessor accessor;
    private final GenerationConfig config;
    private final Viewport viewport;
    private final CancellationToken token;
    private final Random random;
    /** 快取鍵，為 null 時不寫入快取 */
    private final String cacheKey;

    @Setter
    private ImageAnalysis analysis;
    @Setter
    private SamplingParams samplingParams;
    @Setter
    private List<Sample> samples;
    @Setter
    private List<Particle> particles;
    @Setter
    private boolean cached;

    public GenerationContext(BufferedImage image, GenerationConfig config, Viewport viewport,
                             CancellationToken token, Random random, String cacheKey) throws GenerationException {
        this(image, PixelAccessor.fromImage(image), config, viewport, token, random, cacheKey);
    }

    GenerationContext(BufferedImage image, PixelAccessor accessor, GenerationConfig config, Viewport viewport,
                      CancellationToken token, Random random, String cacheKey) {
        this.image = Objects.requireNonNull(image, "image must not be null");
        this.accessor = Objects.requireNonNull(accessor, "accessor must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.viewport = viewport == null ? Viewport.ofImage(accessor.width(), accessor.height()) : viewport;
        this.token = Objects.requireNonNull(token, "token must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.cacheKey = cacheKey;
    }

    public int imageWidth() {
        return accessor.width();
    }

    public int imageHeight() {
        return accessor.height();
    }
}
