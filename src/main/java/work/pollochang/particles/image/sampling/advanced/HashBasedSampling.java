package work.pollochang.particles.image.sampling.advanced;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.particles.image.core.GenerationError;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.PixelAccessor;
import work.pollochang.particles.image.core.SampleSet;
import work.pollochang.particles.image.core.Sample;
import work.pollochang.particles.image.sampling.SamplingRequest;
import work.pollochang.particles.image.sampling.SamplingStrategy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 雜湊取樣。
 * <p>
 * 每個輸出索引以 MurmurHash3 的 fmix32 混合後直接得到 (x, y)，索引之間互不相依，
 * 可以切段交給執行緒池計算。各段結果寫入同一個累積緩衝區，緩衝區由單一把鎖保護；
 * 完成後依索引排序再去重，因此結果與執行緒排程無關。
 * 去重後數量不足時，以後續索引再算一輪，輪數有上限。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class HashBasedSampling implements SamplingStrategy {

    public static final int SEED = 0x9E3779B9;
    static final int MAX_ROUNDS = 8;
    /** 每段至少的索引數，太小的工作不值得切段 */
    static final int MIN_CHUNK = 4096;
    private static final int APPEND_BLOCK = 256;

    @Override
    public String name() {
        return "hashBased";
    }

    @Override
    public List<Sample> sample(SamplingRequest request) throws GenerationException {
        PixelAccessor accessor = request.accessor();
        int target = request.targetCount();
        SampleSet set = new SampleSet(target);

        long nextIndex = 0;
        for (int round = 0; round < MAX_ROUNDS && set.size() < target; round++) {
            request.token().throwIfCancelled();
            int needed = target - set.size();
            int batch = round == 0 ? needed : (int) Math.min(Integer.MAX_VALUE / 2, needed * 2L);
            for (HashedPosition p : computeBatch(request, nextIndex, batch)) {
                if (set.size() >= target) {
                    break;
                }
                if (!set.contains(p.x(), p.y())) {
                    set.add(accessor.sampleAt(p.x(), p.y()));
                }
            }
            nextIndex += batch;
        }
        log.debug("雜湊取樣: 使用索引 0..{} 取得 {}/{}", nextIndex, set.size(), target);
        return set.toList();
    }

    private List<HashedPosition> computeBatch(SamplingRequest request, long start, int count)
            throws GenerationException {
        int width = request.accessor().width();
        int height = request.accessor().height();
        List<HashedPosition> accumulator = new ArrayList<>(count);
        ReentrantLock lock = new ReentrantLock();

        ExecutorService workers = request.workers();
        int chunks = 1;
        if (workers != null && request.parallelism() > 1 && count >= 2 * MIN_CHUNK) {
            chunks = Math.min(request.parallelism(), count / MIN_CHUNK);
        }

        if (chunks == 1) {
            computeRange(start, start + count, width, height, accumulator, lock);
        } else {
            List<Callable<Void>> tasks = new ArrayList<>(chunks);
            long perChunk = (count + chunks - 1) / chunks;
            for (long from = start; from < start + count; from += perChunk) {
                final long f = from;
                final long t = Math.min(start + count, from + perChunk);
                tasks.add(() -> {
                    computeRange(f, t, width, height, accumulator, lock);
                    return null;
                });
            }
            try {
                for (Future<Void> future : workers.invokeAll(tasks)) {
                    future.get();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt(); // 恢復中斷狀態
                throw new GenerationException(GenerationError.CANCELLED, "雜湊取樣被中斷", e);
            } catch (ExecutionException e) {
                throw new GenerationException(GenerationError.STAGE_FAILED, "雜湊取樣工作失敗", e.getCause());
            }
        }

        accumulator.sort(Comparator.comparingLong(HashedPosition::index));
        return accumulator;
    }

    private static void computeRange(long from, long to, int width, int height,
                                     List<HashedPosition> accumulator, ReentrantLock lock) {
        List<HashedPosition> block = new ArrayList<>(APPEND_BLOCK);
        for (long i = from; i < to; i++) {
            block.add(position(i, width, height));
            if (block.size() == APPEND_BLOCK || i == to - 1) {
                lock.lock();
                try {
                    accumulator.addAll(block);
                } finally {
                    lock.unlock();
                }
                block.clear();
            }
        }
    }

    static HashedPosition position(long index, int width, int height) {
        int h1 = mix((int) index ^ (int) (index >>> 32) ^ SEED);
        int h2 = mix(h1 + SEED);
        return new HashedPosition(index, Integer.remainderUnsigned(h1, width), Integer.remainderUnsigned(h2, height));
    }

    /** MurmurHash3 fmix32 */
    static int mix(int h) {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }

    record HashedPosition(long index, int x, int y) {}
}
