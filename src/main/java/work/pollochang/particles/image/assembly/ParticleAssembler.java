package work.pollochang.particles.image.assembly;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.particles.image.config.DisplayMode;
import work.pollochang.particles.image.config.GenerationConfig;
import work.pollochang.particles.image.core.GenerationError;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.Sample;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 將取樣點依顯示模式轉換到畫面座標，再轉為正規化裝置座標。
 */
@Slf4j
public class ParticleAssembler {

    public List<Particle> assemble(List<Sample> samples, int imageWidth, int imageHeight,
                                   Viewport viewport, GenerationConfig config) throws GenerationException {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(viewport, "viewport must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (samples.isEmpty()) {
            throw new GenerationException(GenerationError.INSUFFICIENT_SAMPLES, "沒有可組裝的取樣點");
        }
        if (imageWidth <= 0 || imageHeight <= 0) {
            throw new GenerationException(GenerationError.INVALID_IMAGE, "圖片尺寸無效: " + imageWidth + "x" + imageHeight);
        }
        if (viewport.width() <= 0 || viewport.height() <= 0) {
            throw new GenerationException(GenerationError.INVALID_CONFIGURATION,
                    "畫面尺寸無效: " + viewport.width() + "x" + viewport.height());
        }

        Transform t = transform(config.displayMode(), imageWidth, imageHeight, viewport);
        float base = Math.max(1f, (float) Math.ceil(Math.min(t.scaleX(), t.scaleY())));
        float size = Math.max(config.minParticleSize(),
                Math.min(config.maxParticleSize(), base * config.qualityPreset().particleSizeMultiplier()));

        List<Particle> particles = new ArrayList<>(samples.size());
        for (Sample s : samples) {
            double screenX = t.offsetX() + (s.x() + 0.5) * t.scaleX();
            double screenY = t.offsetY() + (s.y() + 0.5) * t.scaleY();
            float ndcX = (float) (screenX / viewport.width() * 2.0 - 1.0);
            float ndcY = (float) (1.0 - screenY / viewport.height() * 2.0);
            particles.add(new Particle(ndcX, ndcY, s.color(), size));
        }
        log.debug("組裝 {} 個粒子 ({} 模式, 縮放 {}x{}, 粒子大小 {})",
                particles.size(), config.displayMode(), t.scaleX(), t.scaleY(), size);
        return particles;
    }

    static Transform transform(DisplayMode mode, int imageWidth, int imageHeight, Viewport viewport) {
        double sx = (double) viewport.width() / imageWidth;
        double sy = (double) viewport.height() / imageHeight;
        double scaleX;
        double scaleY;
        switch (mode) {
            case FILL:
                scaleX = scaleY = Math.max(sx, sy);
                break;
            case STRETCH:
                scaleX = sx;
                scaleY = sy;
                break;
            case CENTER:
                scaleX = scaleY = 1.0;
                break;
            case FIT:
            default:
                scaleX = scaleY = Math.min(sx, sy);
                break;
        }
        double offsetX = (viewport.width() - imageWidth * scaleX) / 2.0;
        double offsetY = (viewport.height() - imageHeight * scaleY) / 2.0;
        return new Transform(scaleX, scaleY, offsetX, offsetY);
    }

    record Transform(double scaleX, double scaleY, double offsetX, double offsetY) {}
}
