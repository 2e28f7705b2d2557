package work.pollochang.particles.image.sampling.advanced;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.PixelAccessor;
import work.pollochang.particles.image.core.Sample;
import work.pollochang.particles.image.core.SampleSet;
import work.pollochang.particles.image.sampling.SamplingRequest;
import work.pollochang.particles.image.sampling.SamplingStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 藍噪聲取樣 (Mitchell best-candidate)。
 * <p>
 * 每加入一個點，先隨機抽 {@value #CANDIDATES_PER_POINT} 個候選位置，保留與既有點最近距離最大的那一個。
 * 最近距離透過均勻網格查詢，只檢查可能比目前最佳值更近的網格環。
 * 每 {@value #CANCELLATION_CHECK_INTERVAL} 個點檢查一次取消旗標。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class BlueNoiseSampling implements SamplingStrategy {

    public static final int CANDIDATES_PER_POINT = 32;
    static final int CANCELLATION_CHECK_INTERVAL = 64;
    /** 連續這麼多輪的候選位置都已被佔用時放棄，剩餘名額交由呼叫端補齊 */
    static final int MAX_CONSECUTIVE_FAILURES = 64;

    private final int candidatesPerPoint;

    public BlueNoiseSampling() {
        this(CANDIDATES_PER_POINT);
    }

    public BlueNoiseSampling(int candidatesPerPoint) {
        if (candidatesPerPoint < 1) {
            throw new IllegalArgumentException("candidatesPerPoint must be positive: " + candidatesPerPoint);
        }
        this.candidatesPerPoint = candidatesPerPoint;
    }

    @Override
    public String name() {
        return "blueNoise";
    }

    @Override
    public List<Sample> sample(SamplingRequest request) throws GenerationException {
        PixelAccessor accessor = request.accessor();
        Random random = request.random();
        int w = accessor.width();
        int h = accessor.height();
        int target = request.targetCount();

        int cellSize = Math.max(1, (int) Math.sqrt((double) w * h / target));
        PointGrid grid = new PointGrid(w, h, cellSize);
        SampleSet set = new SampleSet(target);

        int failures = 0;
        long iteration = 0;
        while (set.size() < target && failures < MAX_CONSECUTIVE_FAILURES) {
            if (iteration++ % CANCELLATION_CHECK_INTERVAL == 0) {
                request.token().throwIfCancelled();
            }
            int bestX = -1;
            int bestY = -1;
            long bestDistance = -1;
            for (int c = 0; c < candidatesPerPoint; c++) {
                int x = random.nextInt(w);
                int y = random.nextInt(h);
                if (set.contains(x, y)) {
                    continue;
                }
                long distance = grid.nearestDistanceSquared(x, y);
                if (distance > bestDistance) {
                    bestDistance = distance;
                    bestX = x;
                    bestY = y;
                }
            }
            if (bestX < 0) {
                failures++;
                continue;
            }
            failures = 0;
            set.add(accessor.sampleAt(bestX, bestY));
            grid.add(bestX, bestY);
        }

        if (set.size() < target) {
            log.debug("藍噪聲取樣在 {} 輪候選皆被佔用後停止，取得 {}/{}", MAX_CONSECUTIVE_FAILURES, set.size(), target);
        }
        return set.toList();
    }

    /** 以固定大小網格儲存已接受的點，加速最近距離查詢 */
    private static final class PointGrid {
        private final int cellSize;
        private final int columns;
        private final int rows;
        private final List<List<int[]>> cells;

        PointGrid(int width, int height, int cellSize) {
            this.cellSize = cellSize;
            this.columns = (width + cellSize - 1) / cellSize;
            this.rows = (height + cellSize - 1) / cellSize;
            this.cells = new ArrayList<>(columns * rows);
            for (int i = 0; i < columns * rows; i++) {
                cells.add(new ArrayList<>(2));
            }
        }

        void add(int x, int y) {
            cells.get((y / cellSize) * columns + x / cellSize).add(new int[]{x, y});
        }

        /** 沒有任何點時回傳 {@link Long#MAX_VALUE} */
        long nearestDistanceSquared(int x, int y) {
            int cx = x / cellSize;
            int cy = y / cellSize;
            long best = Long.MAX_VALUE;
            int maxRing = Math.max(columns, rows);
            for (int ring = 0; ring <= maxRing; ring++) {
                if (ring > 0 && best != Long.MAX_VALUE) {
                    // 第 ring 環上任何點的距離至少為 (ring - 1) * cellSize
                    long bound = (long) (ring - 1) * cellSize;
                    if (bound * bound >= best) {
                        break;
                    }
                }
                for (int gy = cy - ring; gy <= cy + ring; gy++) {
                    if (gy < 0 || gy >= rows) {
                        continue;
                    }
                    boolean edgeRow = gy == cy - ring || gy == cy + ring;
                    int stepX = edgeRow ? 1 : Math.max(1, 2 * ring);
                    for (int gx = cx - ring; gx <= cx + ring; gx += stepX) {
                        if (gx < 0 || gx >= columns) {
                            continue;
                        }
                        for (int[] p : cells.get(gy * columns + gx)) {
                            long dx = p[0] - x;
                            long dy = p[1] - y;
                            best = Math.min(best, dx * dx + dy * dy);
                        }
                    }
                }
            }
            return best;
        }
    }
}
