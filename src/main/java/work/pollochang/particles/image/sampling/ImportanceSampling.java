package work.pollochang.particles.image.sampling;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.PixelAccessor;
import work.pollochang.particles.image.core.Rgba;
import work.pollochang.particles.image.core.Sample;
import work.pollochang.particles.image.core.SampleSet;
import work.pollochang.particles.image.sampling.advanced.StratifiedBandSampling;

import java.util.ArrayList;
import java.util.List;

/**
 * 重要度取樣。
 * <p>
 * 流程：
 * <ol>
 *     <li>掃描像素 (大圖以間距掃描)，略過透明與白色背景，保留分數達門檻的候選點</li>
 *     <li>取 {@code round(目標 × importantSamplingRatio)} 個重要點，
 *         其中 {@code topBottomRatio} 比例來自上半部，其餘來自下半部，一半不足時由另一半補上</li>
 *     <li>剩餘名額依序以不透明像素的均勻格點、剩下的候選點、有限次數的隨機補點填入</li>
 * </ol>
 * 開啟 {@code antiClustering} 時，重要點改以分帶方式挑選，避免集中在同一區域。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class ImportanceSampling implements SamplingStrategy {

    /** 每個軸向最多掃描的像素數，超過時以間距掃描 */
    static final int SCAN_LIMIT = 512;

    @Override
    public String name() {
        return "importance";
    }

    @Override
    public List<Sample> sample(SamplingRequest request) throws GenerationException {
        PixelAccessor accessor = request.accessor();
        SamplingParams params = request.params();
        int target = request.targetCount();

        SampleSet set = new SampleSet(target);
        List<ScoredPixel> candidates = scoreCandidates(request, params.importanceThreshold());
        int importantQuota = Math.round(target * params.importantSamplingRatio());
        int important = selectBalanced(request, candidates, importantQuota, set);

        int gridAdded = SampleFill.gridFill(accessor, set, target - set.size(), true);

        int leftoverAdded = 0;
        if (set.size() < target) {
            List<ScoredPixel> remaining = new ArrayList<>(candidates);
            remaining.sort(ScoredPixel.BY_SCORE_DESC);
            for (ScoredPixel c : remaining) {
                if (set.size() >= target) {
                    break;
                }
                if (set.add(accessor.sampleAt(c.x(), c.y()))) {
                    leftoverAdded++;
                }
            }
        }

        int randomAdded = SampleFill.randomFill(accessor, set, target - set.size(), request.random(), request.token());
        log.debug("重要度取樣: 候選 {}, 重要點 {}/{}, 格點補 {}, 候選補 {}, 隨機補 {}",
                candidates.size(), important, importantQuota, gridAdded, leftoverAdded, randomAdded);
        return set.toList();
    }

    /**
     * 挑出最多 {@code quota} 個分數不低於 {@code threshold} 且尚未使用的像素，加入 {@code set}。
     *
     * @return 實際加入的數量
     */
    int selectImportant(SamplingRequest request, int quota, float threshold, SampleSet set)
            throws GenerationException {
        return selectBalanced(request, scoreCandidates(request, threshold), quota, set);
    }

    /**
     * 依掃描順序計算分數，回傳分數不低於門檻的候選點。
     */
    List<ScoredPixel> scoreCandidates(SamplingRequest request, float threshold) throws GenerationException {
        PixelAccessor accessor = request.accessor();
        int strideX = Math.max(1, accessor.width() / SCAN_LIMIT);
        int strideY = Math.max(1, accessor.height() / SCAN_LIMIT);
        ImportanceScorer scorer = new ImportanceScorer(accessor, request.params(), request.dominantColors());

        List<ScoredPixel> candidates = new ArrayList<>();
        int order = 0;
        for (int y = 0; y < accessor.height(); y += strideY) {
            request.token().throwIfCancelled();
            for (int x = 0; x < accessor.width(); x += strideX) {
                Rgba color = accessor.colorAt(x, y);
                if (color.a() <= SampleFill.OPAQUE_ALPHA || ImportanceScorer.isWhiteBackground(color)) {
                    continue;
                }
                float score = scorer.score(x, y, color);
                if (score >= threshold) {
                    candidates.add(new ScoredPixel(x, y, score, order++));
                }
            }
        }
        return candidates;
    }

    private int selectBalanced(SamplingRequest request, List<ScoredPixel> candidates, int quota, SampleSet set) {
        if (quota <= 0 || candidates.isEmpty()) {
            return 0;
        }
        PixelAccessor accessor = request.accessor();
        List<ScoredPixel> unused = new ArrayList<>(candidates.size());
        for (ScoredPixel c : candidates) {
            if (!set.contains(c.x(), c.y())) {
                unused.add(c);
            }
        }

        if (request.params().antiClustering() && unused.size() > quota) {
            int added = 0;
            for (ScoredPixel c : StratifiedBandSampling.stratify(unused, quota, accessor.height())) {
                if (set.add(accessor.sampleAt(c.x(), c.y()))) {
                    added++;
                }
            }
            return added;
        }

        List<ScoredPixel> top = new ArrayList<>();
        List<ScoredPixel> bottom = new ArrayList<>();
        for (ScoredPixel c : unused) {
            if (c.y() < accessor.height() / 2) {
                top.add(c);
            } else {
                bottom.add(c);
            }
        }
        top.sort(ScoredPixel.BY_SCORE_DESC);
        bottom.sort(ScoredPixel.BY_SCORE_DESC);

        int topQuota = Math.round(quota * request.params().topBottomRatio());
        int bottomQuota = quota - topQuota;
        int takeTop = Math.min(topQuota, top.size());
        int takeBottom = Math.min(bottomQuota, bottom.size());

        int added = 0;
        for (ScoredPixel c : top.subList(0, takeTop)) {
            if (set.add(accessor.sampleAt(c.x(), c.y()))) {
                added++;
            }
        }
        for (ScoredPixel c : bottom.subList(0, takeBottom)) {
            if (set.add(accessor.sampleAt(c.x(), c.y()))) {
                added++;
            }
        }

        // 其中一半不足時，以另一半剩下的高分候選補上
        if (added < quota) {
            List<ScoredPixel> rest = new ArrayList<>(top.subList(takeTop, top.size()));
            rest.addAll(bottom.subList(takeBottom, bottom.size()));
            rest.sort(ScoredPixel.BY_SCORE_DESC);
            for (ScoredPixel c : rest) {
                if (added >= quota) {
                    break;
                }
                if (set.add(accessor.sampleAt(c.x(), c.y()))) {
                    added++;
                }
            }
        }
        return added;
    }
}
