package work.pollochang.particles.image.sampling;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.PixelAccessor;
import work.pollochang.particles.image.core.Sample;
import work.pollochang.particles.image.core.SampleSet;

import java.util.List;

/**
 * 以固定間距 {@code ⌈總像素 / 目標數量⌉} 依掃描順序取樣，不足的部分隨機補齊。
 */
@Slf4j
public class UniformSampling implements SamplingStrategy {

    @Override
    public String name() {
        return "uniform";
    }

    @Override
    public List<Sample> sample(SamplingRequest request) throws GenerationException {
        PixelAccessor accessor = request.accessor();
        int target = request.targetCount();
        int total = accessor.totalPixels();
        int stride = stride(total, target);

        SampleSet set = new SampleSet(target);
        for (long i = 0; i < total && set.size() < target; i += stride) {
            int index = (int) i;
            set.add(accessor.sampleAt(index % accessor.width(), index / accessor.width()));
        }

        int missing = target - set.size();
        if (missing > 0) {
            int added = SampleFill.randomFill(accessor, set, missing, request.random(), request.token());
            log.debug("均勻取樣間距 {} 只取得 {} 個點，隨機補上 {} 個", stride, set.size() - added, added);
        }
        return set.toList();
    }

    static int stride(int totalPixels, int target) {
        return Math.max(1, (int) Math.ceil((double) totalPixels / target));
    }
}
