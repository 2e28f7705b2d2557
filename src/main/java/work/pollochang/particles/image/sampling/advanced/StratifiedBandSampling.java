package work.pollochang.particles.image.sampling.advanced;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.PixelAccessor;
import work.pollochang.particles.image.core.Rgba;
import work.pollochang.particles.image.core.Sample;
import work.pollochang.particles.image.core.SampleSet;
import work.pollochang.particles.image.sampling.SampleFill;
import work.pollochang.particles.image.sampling.SamplingRequest;
import work.pollochang.particles.image.sampling.SamplingStrategy;
import work.pollochang.particles.image.sampling.ScoredPixel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * 分帶取樣。
 * <p>
 * 將圖片切成 {@value #BAND_COUNT} 條水平帶，依各帶的「重要度質量」按比例分配配額：
 * <ul>
 *     <li>{@code weighted = true}：質量為 alpha × 亮度，帶內由分數最高的像素開始挑選</li>
 *     <li>{@code weighted = false}：質量為不透明像素數，帶內以等間距挑選</li>
 * </ul>
 * 配額未滿時，第二輪以任何未使用的候選像素補上，最後才隨機補點。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class StratifiedBandSampling implements SamplingStrategy {

    public static final int BAND_COUNT = 16;

    private final boolean weighted;

    public StratifiedBandSampling(boolean weighted) {
        this.weighted = weighted;
    }

    @Override
    public String name() {
        return weighted ? "stratified-adaptive" : "stratified-uniform";
    }

    @Override
    public List<Sample> sample(SamplingRequest request) throws GenerationException {
        PixelAccessor accessor = request.accessor();
        int target = request.targetCount();
        int total = accessor.totalPixels();
        // 候選點數量至少約為目標的 4 倍
        int stride = Math.max(1, (int) Math.floor(Math.sqrt(total / (4.0 * target))));

        int bands = Math.min(BAND_COUNT, accessor.height());
        int bandHeight = (accessor.height() + bands - 1) / bands;
        List<List<ScoredPixel>> perBand = new ArrayList<>(bands);
        for (int b = 0; b < bands; b++) {
            perBand.add(new ArrayList<>());
        }
        double[] mass = new double[bands];

        int order = 0;
        for (int y = 0; y < accessor.height(); y += stride) {
            request.token().throwIfCancelled();
            int band = Math.min(bands - 1, y / bandHeight);
            for (int x = 0; x < accessor.width(); x += stride) {
                Rgba c = accessor.colorAt(x, y);
                if (c.a() <= SampleFill.OPAQUE_ALPHA) {
                    continue;
                }
                float score = weighted ? c.a() * c.luminance() : 1f;
                perBand.get(band).add(new ScoredPixel(x, y, score, order++));
                mass[band] += score;
            }
        }
        if (weighted && Arrays.stream(mass).sum() <= 0.0) {
            log.debug("所有分帶亮度質量為 0，改以像素數量分配配額");
            for (int b = 0; b < bands; b++) {
                mass[b] = perBand.get(b).size();
            }
        }

        int[] quotas = allocate(mass, target);
        SampleSet set = new SampleSet(target);
        for (int b = 0; b < bands; b++) {
            List<ScoredPixel> band = perBand.get(b);
            int quota = Math.min(quotas[b], band.size());
            if (quota == 0) {
                continue;
            }
            if (weighted) {
                band.sort(ScoredPixel.BY_SCORE_DESC);
                for (int k = 0; k < quota; k++) {
                    add(accessor, set, band.get(k));
                }
            } else {
                double step = (double) band.size() / quota;
                for (int k = 0; k < quota; k++) {
                    add(accessor, set, band.get((int) (k * step)));
                }
            }
        }

        int firstPass = set.size();
        for (List<ScoredPixel> band : perBand) {
            for (ScoredPixel c : band) {
                if (set.size() >= target) {
                    break;
                }
                add(accessor, set, c);
            }
        }
        SampleFill.randomFill(accessor, set, target - set.size(), request.random(), request.token());
        log.debug("分帶取樣 ({}): 分帶 {}, 間距 {}, 第一輪 {}, 最終 {}", name(), bands, stride, firstPass, set.size());
        return set.toList();
    }

    /**
     * 依質量比例分配配額，整數捨去後剩下的名額依質量由大到小輪流分配。
     */
    static int[] allocate(double[] mass, int quota) {
        int[] quotas = new int[mass.length];
        double totalMass = Arrays.stream(mass).sum();
        int assigned = 0;
        if (totalMass > 0) {
            for (int b = 0; b < mass.length; b++) {
                quotas[b] = (int) Math.floor(quota * mass[b] / totalMass);
                assigned += quotas[b];
            }
        }
        Integer[] byMass = IntStream.range(0, mass.length).boxed()
                .sorted(Comparator.comparingDouble((Integer b) -> mass[b]).reversed())
                .toArray(Integer[]::new);
        for (int i = 0; assigned < quota; i = (i + 1) % byMass.length) {
            quotas[byMass[i]]++;
            assigned++;
        }
        return quotas;
    }

    /**
     * 從候選點中挑出最多 {@code quota} 個，依分數質量分配到各水平帶，避免全部集中在同一區域。
     * 帶內取分數最高者，分配不完的名額再由剩下的最高分候選補上。
     */
    public static List<ScoredPixel> stratify(List<ScoredPixel> candidates, int quota, int height) {
        int bands = Math.max(1, Math.min(BAND_COUNT, height));
        int bandHeight = (height + bands - 1) / bands;
        List<List<ScoredPixel>> perBand = new ArrayList<>(bands);
        for (int b = 0; b < bands; b++) {
            perBand.add(new ArrayList<>());
        }
        double[] mass = new double[bands];
        for (ScoredPixel c : candidates) {
            int band = Math.min(bands - 1, c.y() / bandHeight);
            perBand.get(band).add(c);
            mass[band] += Math.max(c.score(), 1e-6f);
        }

        int[] quotas = allocate(mass, quota);
        List<ScoredPixel> selected = new ArrayList<>(quota);
        List<ScoredPixel> rest = new ArrayList<>();
        for (int b = 0; b < bands; b++) {
            List<ScoredPixel> band = perBand.get(b);
            band.sort(ScoredPixel.BY_SCORE_DESC);
            int take = Math.min(quotas[b], band.size());
            selected.addAll(band.subList(0, take));
            rest.addAll(band.subList(take, band.size()));
        }
        rest.sort(ScoredPixel.BY_SCORE_DESC);
        for (int i = 0; i < rest.size() && selected.size() < quota; i++) {
            selected.add(rest.get(i));
        }
        return selected;
    }

    private static void add(PixelAccessor accessor, SampleSet set, ScoredPixel c) {
        if (!set.contains(c.x(), c.y())) {
            set.add(accessor.sampleAt(c.x(), c.y()));
        }
    }
}
