package work.pollochang.particles.image.validation;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.particles.image.core.CancellationToken;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.PixelAccessor;
import work.pollochang.particles.image.core.Sample;
import work.pollochang.particles.image.core.SampleSet;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * 取樣結果的後處理檢查。
 * <p>
 * 分布在技術上合法但視覺上退化時 (覆蓋不足、上下失衡、局部群聚、角落空白)，
 * 以從不足區域抽出的不透明像素替換過多區域的點，數量永遠不超過目標。
 * 同時做最後一次的座標夾限與去重。
 * <p>
 * 內容分布 (哪些網格或半部有不透明像素) 以間距掃描估計，替換點的嘗試次數有上限，
 * 找不到替換點時保留原本的點。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class ArtifactPreventionValidator {

    static final int COVERAGE_GRID = 4;
    static final float MIN_COVERAGE = 0.85f;
    static final float VERTICAL_TOLERANCE = 0.2f;
    static final int CLUSTER_DISTANCE = 6;
    static final int CLUSTER_NEIGHBORS = 3;
    static final float CLUSTERED_FRACTION_LIMIT = 0.1f;
    /** 平均間距不大於此值時，點本來就很密，不做群聚檢查 */
    static final double MIN_SPACING_FOR_CLUSTER_CHECK = 2.0 * CLUSTER_DISTANCE;
    static final float CORNER_MARGIN = 0.1f;
    static final int ATTEMPTS_PER_REPLACEMENT = 15;
    static final float OPAQUE_ALPHA = 0.1f;
    private static final int LAYOUT_SCAN_LIMIT = 128;

    /**
     * 檢查並修正取樣分布。
     *
     * @param samples     策略產生的取樣點
     * @param accessor    像素存取器
     * @param targetCount 目標數量，結果不會超過此值
     * @param random      替換點的隨機來源
     * @param token       取消旗標
     * @return 修正後的取樣點
     * @throws GenerationException 被取消時拋出
     */
    public List<Sample> validateAndCorrect(List<Sample> samples, PixelAccessor accessor, int targetCount,
                                           Random random, CancellationToken token) throws GenerationException {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(accessor, "accessor must not be null");

        SampleSet set = sanitize(samples, accessor, targetCount);
        if (set.isEmpty()) {
            return set.toList();
        }
        ContentLayout layout = ContentLayout.scan(accessor);

        token.throwIfCancelled();
        int coverageFixes = fixCoverage(set, accessor, layout, targetCount, random);
        token.throwIfCancelled();
        int verticalFixes = fixVerticalBalance(set, accessor, layout, random);
        token.throwIfCancelled();
        int clusterFixes = fixClustering(set, accessor, random);
        token.throwIfCancelled();
        int cornerFixes = fixCorners(set, accessor, targetCount);

        List<Sample> result = set.toList();
        if (result.size() > targetCount) {
            result = new ArrayList<>(result.subList(0, targetCount));
        }
        if (coverageFixes + verticalFixes + clusterFixes + cornerFixes > 0) {
            log.debug("分布修正: 覆蓋 {}, 上下平衡 {}, 群聚 {}, 角落 {} -> {}",
                    coverageFixes, verticalFixes, clusterFixes, cornerFixes, inspect(result, accessor));
        }
        return result;
    }

    /**
     * 只檢查、不修正。
     */
    public DistributionReport inspect(List<Sample> samples, PixelAccessor accessor) {
        ContentLayout layout = ContentLayout.scan(accessor);
        int n = samples.size();
        if (n == 0) {
            return new DistributionReport(0f, 0f, layout.expectedTopShare(), 0f, 0);
        }
        int[] perCell = countPerCell(samples, accessor);
        int contentCells = 0;
        int covered = 0;
        for (int c = 0; c < perCell.length; c++) {
            if (layout.cellHasContent[c]) {
                contentCells++;
                if (perCell[c] > 0) {
                    covered++;
                }
            }
        }
        float coverage = contentCells == 0 ? 1f : (float) covered / contentCells;
        float clustered = shouldCheckClustering(n, accessor)
                ? (float) clusteredSamples(samples).size() / n : 0f;
        int missingCorners = 0;
        for (int[] corner : cornerCenters(accessor)) {
            if (accessor.alphaAt(corner[0], corner[1]) > OPAQUE_ALPHA && !hasSampleInCorner(samples, accessor, corner)) {
                missingCorners++;
            }
        }
        return new DistributionReport(coverage, topShare(samples, accessor), layout.expectedTopShare(), clustered, missingCorners);
    }

    private SampleSet sanitize(List<Sample> samples, PixelAccessor accessor, int targetCount) {
        SampleSet set = new SampleSet(Math.min(samples.size(), targetCount));
        int clamped = 0;
        int duplicates = 0;
        for (Sample s : samples) {
            if (set.size() >= targetCount) {
                break;
            }
            Sample candidate = s;
            if (!accessor.contains(s.x(), s.y())) {
                int x = Math.max(0, Math.min(accessor.width() - 1, s.x()));
                int y = Math.max(0, Math.min(accessor.height() - 1, s.y()));
                candidate = accessor.sampleAt(x, y);
                clamped++;
            }
            if (!set.add(candidate)) {
                duplicates++;
            }
        }
        if (clamped > 0 || duplicates > 0) {
            log.warn("取樣結果含有 {} 個越界點與 {} 個重複點，已修正", clamped, duplicates);
        }
        return set;
    }

    // ---- 覆蓋率 ----

    private int fixCoverage(SampleSet set, PixelAccessor accessor, ContentLayout layout, int targetCount, Random random) {
        int[] perCell = countPerCell(set.toList(), accessor);
        int contentCells = 0;
        int covered = 0;
        for (int c = 0; c < perCell.length; c++) {
            if (layout.cellHasContent[c]) {
                contentCells++;
                if (perCell[c] > 0) {
                    covered++;
                }
            }
        }
        // 點數比有內容的網格還少時不可能全部覆蓋
        if (contentCells == 0 || set.size() < contentCells || (float) covered / contentCells >= MIN_COVERAGE) {
            return 0;
        }

        int fixes = 0;
        for (int c = 0; c < perCell.length; c++) {
            if (!layout.cellHasContent[c] || perCell[c] > 0) {
                continue;
            }
            Sample replacement = findInRegion(set, accessor, cellBounds(accessor, c), random);
            if (replacement == null) {
                continue;
            }
            if (set.size() >= targetCount) {
                int crowded = mostPopulatedCell(perCell);
                Sample victim = lastSampleInCell(set, accessor, crowded);
                if (victim == null || perCell[crowded] <= 1) {
                    continue;
                }
                set.remove(victim);
                perCell[crowded]--;
            }
            set.add(replacement);
            perCell[c]++;
            fixes++;
        }
        return fixes;
    }

    // ---- 上下平衡 ----

    private int fixVerticalBalance(SampleSet set, PixelAccessor accessor, ContentLayout layout, Random random) {
        List<Sample> current = set.toList();
        float topShare = topShare(current, accessor);
        float expected = layout.expectedTopShare();
        if (Math.abs(topShare - expected) <= VERTICAL_TOLERANCE) {
            return 0;
        }

        boolean topHeavy = topShare > expected;
        int moves = Math.round(Math.abs(topShare - expected) * current.size());
        int half = accessor.height() / 2;
        int[] target = topHeavy
                ? new int[]{0, half, accessor.width(), accessor.height()}
                : new int[]{0, 0, accessor.width(), Math.max(1, half)};

        int fixes = 0;
        for (int i = current.size() - 1; i >= 0 && fixes < moves; i--) {
            Sample victim = current.get(i);
            boolean inTop = victim.y() < half;
            if (inTop != topHeavy) {
                continue;
            }
            Sample replacement = findInRegion(set, accessor, target, random);
            if (replacement == null) {
                break;
            }
            set.remove(victim);
            set.add(replacement);
            fixes++;
        }
        return fixes;
    }

    // ---- 群聚 ----

    private int fixClustering(SampleSet set, PixelAccessor accessor, Random random) {
        List<Sample> current = set.toList();
        if (!shouldCheckClustering(current.size(), accessor)) {
            return 0;
        }
        List<Sample> clustered = clusteredSamples(current);
        if ((float) clustered.size() / current.size() <= CLUSTERED_FRACTION_LIMIT) {
            return 0;
        }

        SpatialHash hash = new SpatialHash(current);
        int[] whole = {0, 0, accessor.width(), accessor.height()};
        int fixes = 0;
        for (Sample s : clustered) {
            if (hash.neighbors(s.x(), s.y(), true) < CLUSTER_NEIGHBORS) {
                continue; // 先前的替換已讓此點不再群聚
            }
            for (int attempt = 0; attempt < ATTEMPTS_PER_REPLACEMENT; attempt++) {
                Sample replacement = findInRegion(set, accessor, whole, random);
                if (replacement == null) {
                    break;
                }
                if (hash.neighbors(replacement.x(), replacement.y(), false) == 0) {
                    set.remove(s);
                    hash.remove(s);
                    set.add(replacement);
                    hash.add(replacement);
                    fixes++;
                    break;
                }
            }
        }
        return fixes;
    }

    static boolean shouldCheckClustering(int n, PixelAccessor accessor) {
        return n > 0 && Math.sqrt((double) accessor.totalPixels() / n) > MIN_SPACING_FOR_CLUSTER_CHECK;
    }

    static List<Sample> clusteredSamples(List<Sample> samples) {
        SpatialHash hash = new SpatialHash(samples);
        List<Sample> clustered = new ArrayList<>();
        for (Sample s : samples) {
            if (hash.neighbors(s.x(), s.y(), true) >= CLUSTER_NEIGHBORS) {
                clustered.add(s);
            }
        }
        return clustered;
    }

    // ---- 角落 ----

    private int fixCorners(SampleSet set, PixelAccessor accessor, int targetCount) {
        if (set.size() < COVERAGE_GRID * COVERAGE_GRID) {
            return 0;
        }
        int fixes = 0;
        for (int[] corner : cornerCenters(accessor)) {
            if (accessor.alphaAt(corner[0], corner[1]) <= OPAQUE_ALPHA
                    || set.contains(corner[0], corner[1])
                    || hasSampleInCorner(set.toList(), accessor, corner)) {
                continue;
            }
            if (set.size() >= targetCount) {
                int[] perCell = countPerCell(set.toList(), accessor);
                int crowded = mostPopulatedCell(perCell);
                Sample victim = lastSampleInCell(set, accessor, crowded);
                if (victim == null || perCell[crowded] <= 1) {
                    continue;
                }
                set.remove(victim);
            }
            set.add(accessor.sampleAt(corner[0], corner[1]));
            fixes++;
        }
        return fixes;
    }

    private static List<int[]> cornerCenters(PixelAccessor accessor) {
        int mx = Math.max(1, Math.round(accessor.width() * CORNER_MARGIN));
        int my = Math.max(1, Math.round(accessor.height() * CORNER_MARGIN));
        int left = mx / 2;
        int right = accessor.width() - 1 - mx / 2;
        int top = my / 2;
        int bottom = accessor.height() - 1 - my / 2;
        return List.of(new int[]{left, top}, new int[]{right, top}, new int[]{left, bottom}, new int[]{right, bottom});
    }

    private static boolean hasSampleInCorner(List<Sample> samples, PixelAccessor accessor, int[] corner) {
        int mx = Math.max(1, Math.round(accessor.width() * CORNER_MARGIN));
        int my = Math.max(1, Math.round(accessor.height() * CORNER_MARGIN));
        int x0 = corner[0] < accessor.width() / 2 ? 0 : accessor.width() - mx;
        int y0 = corner[1] < accessor.height() / 2 ? 0 : accessor.height() - my;
        for (Sample s : samples) {
            if (s.x() >= x0 && s.x() < x0 + mx && s.y() >= y0 && s.y() < y0 + my) {
                return true;
            }
        }
        return false;
    }

    // ---- 共用 ----

    /**
     * 在 {@code [x0, y0, x1, y1)} 範圍內找一個未使用的不透明像素：先隨機嘗試，再以間距掃描。
     */
    private static Sample findInRegion(SampleSet set, PixelAccessor accessor, int[] region, Random random) {
        int x0 = region[0];
        int y0 = region[1];
        int w = region[2] - x0;
        int h = region[3] - y0;
        if (w <= 0 || h <= 0) {
            return null;
        }
        for (int attempt = 0; attempt < ATTEMPTS_PER_REPLACEMENT; attempt++) {
            int x = x0 + random.nextInt(w);
            int y = y0 + random.nextInt(h);
            if (!set.contains(x, y) && accessor.alphaAt(x, y) > OPAQUE_ALPHA) {
                return accessor.sampleAt(x, y);
            }
        }
        int step = Math.max(1, (int) Math.sqrt((double) w * h / 1024));
        for (int y = y0; y < y0 + h; y += step) {
            for (int x = x0; x < x0 + w; x += step) {
                if (!set.contains(x, y) && accessor.alphaAt(x, y) > OPAQUE_ALPHA) {
                    return accessor.sampleAt(x, y);
                }
            }
        }
        return null;
    }

    private static int cellIndex(PixelAccessor accessor, int x, int y) {
        int cx = Math.min(COVERAGE_GRID - 1, x * COVERAGE_GRID / accessor.width());
        int cy = Math.min(COVERAGE_GRID - 1, y * COVERAGE_GRID / accessor.height());
        return cy * COVERAGE_GRID + cx;
    }

    private static int[] cellBounds(PixelAccessor accessor, int cell) {
        int cx = cell % COVERAGE_GRID;
        int cy = cell / COVERAGE_GRID;
        int x0 = (cx * accessor.width() + COVERAGE_GRID - 1) / COVERAGE_GRID;
        int y0 = (cy * accessor.height() + COVERAGE_GRID - 1) / COVERAGE_GRID;
        int x1 = ((cx + 1) * accessor.width() + COVERAGE_GRID - 1) / COVERAGE_GRID;
        int y1 = ((cy + 1) * accessor.height() + COVERAGE_GRID - 1) / COVERAGE_GRID;
        return new int[]{x0, y0, Math.min(accessor.width(), x1), Math.min(accessor.height(), y1)};
    }

    private static int[] countPerCell(List<Sample> samples, PixelAccessor accessor) {
        int[] perCell = new int[COVERAGE_GRID * COVERAGE_GRID];
        for (Sample s : samples) {
            perCell[cellIndex(accessor, s.x(), s.y())]++;
        }
        return perCell;
    }

    private static int mostPopulatedCell(int[] perCell) {
        int best = 0;
        for (int c = 1; c < perCell.length; c++) {
            if (perCell[c] > perCell[best]) {
                best = c;
            }
        }
        return best;
    }

    private static Sample lastSampleInCell(SampleSet set, PixelAccessor accessor, int cell) {
        List<Sample> current = set.toList();
        for (int i = current.size() - 1; i >= 0; i--) {
            Sample s = current.get(i);
            if (cellIndex(accessor, s.x(), s.y()) == cell) {
                return s;
            }
        }
        return null;
    }

    private static float topShare(List<Sample> samples, PixelAccessor accessor) {
        if (samples.isEmpty()) {
            return 0f;
        }
        int half = accessor.height() / 2;
        long top = samples.stream().filter(s -> s.y() < half).count();
        return (float) top / samples.size();
    }

    /** 以間距掃描估計內容位置 */
    private static final class ContentLayout {
        final boolean[] cellHasContent = new boolean[COVERAGE_GRID * COVERAGE_GRID];
        long opaqueTop;
        long opaqueBottom;

        static ContentLayout scan(PixelAccessor accessor) {
            ContentLayout layout = new ContentLayout();
            int stepX = Math.max(1, accessor.width() / LAYOUT_SCAN_LIMIT);
            int stepY = Math.max(1, accessor.height() / LAYOUT_SCAN_LIMIT);
            int half = accessor.height() / 2;
            for (int y = 0; y < accessor.height(); y += stepY) {
                for (int x = 0; x < accessor.width(); x += stepX) {
                    if (accessor.alphaAt(x, y) <= OPAQUE_ALPHA) {
                        continue;
                    }
                    layout.cellHasContent[cellIndex(accessor, x, y)] = true;
                    if (y < half) {
                        layout.opaqueTop++;
                    } else {
                        layout.opaqueBottom++;
                    }
                }
            }
            return layout;
        }

        float expectedTopShare() {
            long total = opaqueTop + opaqueBottom;
            return total == 0 ? 0.5f : (float) opaqueTop / total;
        }
    }

    /** 以 {@value #CLUSTER_DISTANCE} 像素為格的空間雜湊，用來計算鄰近點數 */
    private static final class SpatialHash {
        private final Map<Long, List<Sample>> cells = new HashMap<>();

        SpatialHash(List<Sample> samples) {
            samples.forEach(this::add);
        }

        void add(Sample s) {
            cells.computeIfAbsent(key(s.x() / CLUSTER_DISTANCE, s.y() / CLUSTER_DISTANCE), k -> new ArrayList<>()).add(s);
        }

        void remove(Sample s) {
            List<Sample> bucket = cells.get(key(s.x() / CLUSTER_DISTANCE, s.y() / CLUSTER_DISTANCE));
            if (bucket != null) {
                bucket.removeIf(o -> o.x() == s.x() && o.y() == s.y());
            }
        }

        /** 距離 (x, y) 不超過 {@value #CLUSTER_DISTANCE} 的點數；{@code excludeSelf} 時不計入同一位置 */
        int neighbors(int x, int y, boolean excludeSelf) {
            int cx = x / CLUSTER_DISTANCE;
            int cy = y / CLUSTER_DISTANCE;
            int count = 0;
            long limit = (long) CLUSTER_DISTANCE * CLUSTER_DISTANCE;
            for (int dy = -1; dy <= 1; dy++) {
                for (int dx = -1; dx <= 1; dx++) {
                    List<Sample> bucket = cells.get(key(cx + dx, cy + dy));
                    if (bucket == null) {
                        continue;
                    }
                    for (Sample o : bucket) {
                        if (excludeSelf && o.x() == x && o.y() == y) {
                            continue;
                        }
                        long ddx = o.x() - x;
                        long ddy = o.y() - y;
                        if (ddx * ddx + ddy * ddy <= limit) {
                            count++;
                        }
                    }
                }
            }
            return count;
        }

        private static long key(int cx, int cy) {
            return Sample.positionKey(cx, cy);
        }
    }
}
