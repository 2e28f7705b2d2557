package work.pollochang.particles.image.report;

import work.pollochang.particles.image.assembly.Particle;

import java.util.List;

/**
 * 批次輸出的 JSON 文件，每張圖片一份。
 */
public record ParticleDocument(
        String source,
        int imageWidth,
        int imageHeight,
        int viewportWidth,
        int viewportHeight,
        String preset,
        String strategy,
        boolean fromCache,
        List<Particle> particles
) {}
