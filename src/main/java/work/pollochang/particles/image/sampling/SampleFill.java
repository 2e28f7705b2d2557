package work.pollochang.particles.image.sampling;

import work.pollochang.particles.image.core.CancellationToken;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.PixelAccessor;
import work.pollochang.particles.image.core.Sample;
import work.pollochang.particles.image.core.SampleSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 各策略共用的補點方法。所有方法都只加入尚未使用的位置，並回傳實際加入的數量。
 */
public final class SampleFill {

    /** 隨機補點的嘗試次數上限為 {@code 需要數量 × 此倍數} */
    public static final int MAX_ATTEMPTS_MULTIPLIER = 15;
    public static final float OPAQUE_ALPHA = 0.1f;

    private SampleFill() {}

    /**
     * 在覆蓋整張圖的均勻格點上補點，格點數量約等於 {@code needed}。
     * 格點落在已使用 (或 {@code opaqueOnly} 時為透明) 的像素就略過，因此可能補不滿。
     */
    public static int gridFill(PixelAccessor accessor, SampleSet set, int needed, boolean opaqueOnly) {
        if (needed <= 0) {
            return 0;
        }
        int w = accessor.width();
        int h = accessor.height();
        int columns = (int) Math.max(1, Math.min(w, Math.round(Math.sqrt((double) needed * w / h))));
        int rows = (int) Math.max(1, Math.min(h, Math.ceil((double) needed / columns)));

        int added = 0;
        for (int j = 0; j < rows && added < needed; j++) {
            int y = (int) ((j + 0.5) * h / rows);
            for (int i = 0; i < columns && added < needed; i++) {
                int x = (int) ((i + 0.5) * w / columns);
                if (opaqueOnly && accessor.alphaAt(x, y) <= OPAQUE_ALPHA) {
                    continue;
                }
                if (!set.contains(x, y) && set.add(accessor.sampleAt(x, y))) {
                    added++;
                }
            }
        }
        return added;
    }

    /**
     * 隨機補點，嘗試次數有上限；達到上限時接受部分結果。
     */
    public static int randomFill(PixelAccessor accessor, SampleSet set, int needed, Random random,
                                 CancellationToken token) throws GenerationException {
        if (needed <= 0) {
            return 0;
        }
        long maxAttempts = (long) needed * MAX_ATTEMPTS_MULTIPLIER;
        int added = 0;
        for (long attempt = 0; attempt < maxAttempts && added < needed; attempt++) {
            if ((attempt & 1023) == 0) {
                token.throwIfCancelled();
            }
            int x = random.nextInt(accessor.width());
            int y = random.nextInt(accessor.height());
            if (!set.contains(x, y) && set.add(accessor.sampleAt(x, y))) {
                added++;
            }
        }
        return added;
    }

    /**
     * 依掃描順序補上未使用的像素。只要圖片還有未使用的像素就一定補得滿。
     */
    public static int scanFill(PixelAccessor accessor, SampleSet set, int needed) {
        int added = 0;
        int w = accessor.width();
        int total = accessor.totalPixels();
        for (int i = 0; i < total && added < needed; i++) {
            int x = i % w;
            int y = i / w;
            if (!set.contains(x, y) && set.add(accessor.sampleAt(x, y))) {
                added++;
            }
        }
        return added;
    }

    /** 依掃描順序回傳每一個像素恰好一次。 */
    public static List<Sample> allPixels(PixelAccessor accessor) {
        List<Sample> samples = new ArrayList<>(accessor.totalPixels());
        for (int y = 0; y < accessor.height(); y++) {
            for (int x = 0; x < accessor.width(); x++) {
                samples.add(accessor.sampleAt(x, y));
            }
        }
        return samples;
    }
}
