package work.pollochang.particles.image.pipeline;

import work.pollochang.particles.image.analysis.ImageAnalysis;
import work.pollochang.particles.image.assembly.Particle;
import work.pollochang.particles.image.core.Sample;

import java.util.List;

/**
 * 產生結果。
 *
 * @param particles     粒子，順序與取樣點相同
 * @param samples       取樣點
 * @param analysis      圖片分析結果，命中快取時可能為 null
 * @param fromCache     是否直接由快取取得取樣點
 * @param elapsedMillis 耗時
 */
public record GenerationResult(
        List<Particle> particles,
        List<Sample> samples,
        ImageAnalysis analysis,
        boolean fromCache,
        long elapsedMillis
) {

    public GenerationResult {
        particles = List.copyOf(particles);
        samples = List.copyOf(samples);
    }
}
