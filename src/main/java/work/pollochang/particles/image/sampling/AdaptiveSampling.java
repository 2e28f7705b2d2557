package work.pollochang.particles.image.sampling;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.Sample;
import work.pollochang.particles.image.core.SampleSet;

import java.util.List;

/**
 * 70% 以提高後的門檻做重要度取樣，其餘 30% 以均勻格點補滿，不重複已選位置。
 */
@Slf4j
public class AdaptiveSampling implements SamplingStrategy {

    static final float IMPORTANT_SHARE = 0.7f;
    static final float THRESHOLD_BOOST = 1.2f;

    private final ImportanceSampling importance = new ImportanceSampling();

    @Override
    public String name() {
        return "adaptive";
    }

    @Override
    public List<Sample> sample(SamplingRequest request) throws GenerationException {
        int target = request.targetCount();
        SampleSet set = new SampleSet(target);

        float threshold = Math.min(1f, request.params().importanceThreshold() * THRESHOLD_BOOST);
        int important = importance.selectImportant(request, Math.round(target * IMPORTANT_SHARE), threshold, set);

        int grid = SampleFill.gridFill(request.accessor(), set, target - set.size(), false);
        int random = SampleFill.randomFill(request.accessor(), set, target - set.size(), request.random(), request.token());
        log.debug("自適應取樣: 重要點 {} (門檻 {}), 格點 {}, 隨機 {}", important, threshold, grid, random);
        return set.toList();
    }
}
