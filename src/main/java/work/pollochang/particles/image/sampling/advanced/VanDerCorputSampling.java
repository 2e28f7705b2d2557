package work.pollochang.particles.image.sampling.advanced;

import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.PixelAccessor;
import work.pollochang.particles.image.core.Sample;
import work.pollochang.particles.image.core.SampleSet;
import work.pollochang.particles.image.sampling.SamplingRequest;
import work.pollochang.particles.image.sampling.SamplingStrategy;

import java.util.List;

/**
 * Van der Corput 低差異序列取樣：x 軸以 2 為底，y 軸以 3 為底。完全確定性，不使用亂數。
 * 量化到像素後重複的位置會略過並繼續往後取，索引數量有上限。
 */
public class VanDerCorputSampling implements SamplingStrategy {

    @Override
    public String name() {
        return "vanDerCorput";
    }

    @Override
    public List<Sample> sample(SamplingRequest request) throws GenerationException {
        PixelAccessor accessor = request.accessor();
        int w = accessor.width();
        int h = accessor.height();
        int target = request.targetCount();
        long budget = 4L * target + 64;

        SampleSet set = new SampleSet(target);
        for (long i = 0; i < budget && set.size() < target; i++) {
            if ((i & 4095) == 0) {
                request.token().throwIfCancelled();
            }
            int x = Math.min(w - 1, (int) (radicalInverse(i, 2) * w));
            int y = Math.min(h - 1, (int) (radicalInverse(i, 3) * h));
            if (!set.contains(x, y)) {
                set.add(accessor.sampleAt(x, y));
            }
        }
        return set.toList();
    }

    /** 將 index 以 base 進位的各位數鏡射到小數點後，結果介於 [0, 1)。 */
    static double radicalInverse(long index, int base) {
        double result = 0.0;
        double fraction = 1.0 / base;
        long n = index;
        while (n > 0) {
            result += (n % base) * fraction;
            n /= base;
            fraction /= base;
        }
        return result;
    }
}
