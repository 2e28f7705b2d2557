package work.pollochang.particles.image.sampling;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.Sample;
import work.pollochang.particles.image.core.SampleSet;

import java.util.List;

/**
 * 三層混合取樣：
 * 40% 門檻 ×1.5 的「非常重要」點，40% 門檻 ×0.5 的「中等重要」點 (排除已選)，20% 均勻補點。
 * 前一層不足的名額順延給下一層。
 */
@Slf4j
public class HybridSampling implements SamplingStrategy {

    static final float VERY_IMPORTANT_SHARE = 0.4f;
    static final float MODERATE_SHARE = 0.4f;

    private final ImportanceSampling importance = new ImportanceSampling();

    @Override
    public String name() {
        return "hybrid";
    }

    @Override
    public List<Sample> sample(SamplingRequest request) throws GenerationException {
        int target = request.targetCount();
        float threshold = request.params().importanceThreshold();
        SampleSet set = new SampleSet(target);

        int veryImportant = importance.selectImportant(request,
                Math.round(target * VERY_IMPORTANT_SHARE), Math.min(1f, threshold * 1.5f), set);

        int moderateQuota = Math.round(target * (VERY_IMPORTANT_SHARE + MODERATE_SHARE)) - set.size();
        int moderate = importance.selectImportant(request, moderateQuota, threshold * 0.5f, set);

        int grid = SampleFill.gridFill(request.accessor(), set, target - set.size(), false);
        int random = SampleFill.randomFill(request.accessor(), set, target - set.size(), request.random(), request.token());
        log.debug("混合取樣: 非常重要 {}, 中等重要 {}, 格點 {}, 隨機 {}", veryImportant, moderate, grid, random);
        return set.toList();
    }
}
