package work.pollochang.particles.image.analysis;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.particles.image.core.CancellationToken;
import work.pollochang.particles.image.core.GenerationError;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.PixelAccessor;
import work.pollochang.particles.image.core.Rgba;
import work.pollochang.particles.image.tools.ImageTools;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * 圖片內容分析器。
 * <p>
 * 在有上限的網格上取樣 (不逐一走訪每個像素)，計算：
 * <ul>
 *     <li>每個取樣點與相鄰像素的平均顏色距離 (局部對比)</li>
 *     <li>通道差 (飽和度)</li>
 *     <li>局部對比超過 {@value #EDGE_THRESHOLD} 的取樣點佔比 (邊緣密度)</li>
 *     <li>量化直方圖中出現最多的顏色 (代表色)</li>
 * </ul>
 * 可交由執行緒池分段掃描，各段回傳自己的統計結果後再合併。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class ImageAnalyzer {

    /** 以 BufferedImage 分析時，先縮小到最長邊不超過此值 */
    public static final int MAX_ANALYSIS_DIMENSION = 2048;
    /** 網格每個軸向最多的取樣點數 */
    public static final int GRID_LIMIT = 256;
    public static final int MAX_DOMINANT_COLORS = 5;

    static final float ALPHA_THRESHOLD = 0.1f;
    static final float EDGE_THRESHOLD = 0.15f;
    private static final int QUANTIZATION_LEVELS = 8;
    private static final float SQRT3 = (float) Math.sqrt(3.0);

    public ImageAnalysis analyze(BufferedImage image) throws GenerationException {
        Objects.requireNonNull(image, "image must not be null");
        BufferedImage target = ImageTools.downscaleToMaxDimension(image, MAX_ANALYSIS_DIMENSION);
        if (target != image) {
            log.debug("分析前將圖片由 {}x{} 縮小為 {}x{}", image.getWidth(), image.getHeight(),
                    target.getWidth(), target.getHeight());
        }
        return analyze(PixelAccessor.fromImage(target));
    }

    public ImageAnalysis analyze(PixelAccessor accessor) throws GenerationException {
        return analyze(accessor, null, 1, CancellationToken.NONE);
    }

    /**
     * 分析圖片。
     *
     * @param accessor    像素存取器
     * @param workers     執行緒池，為 null 時在呼叫端執行緒上依序掃描
     * @param parallelism 分段數量
     * @param token       取消旗標，每掃描完一列網格檢查一次
     * @return 分析結果
     * @throws GenerationException 圖片中沒有不透明像素時拋出 {@link GenerationError#INVALID_IMAGE}；
     *                             被取消時拋出 {@link GenerationError#CANCELLED}
     */
    public ImageAnalysis analyze(PixelAccessor accessor, ExecutorService workers, int parallelism,
                                 CancellationToken token) throws GenerationException {
        Objects.requireNonNull(accessor, "accessor must not be null");
        Objects.requireNonNull(token, "token must not be null");

        int step = gridStep(accessor);
        int gridRows = (accessor.height() + step - 1) / step;
        int chunks = workers == null ? 1 : Math.max(1, Math.min(parallelism, gridRows));

        RegionStats total = new RegionStats();
        if (chunks == 1) {
            total.merge(scanRows(accessor, step, 0, gridRows, token));
        } else {
            for (RegionStats partial : scanInParallel(accessor, step, gridRows, chunks, workers, token)) {
                total.merge(partial);
            }
        }

        ImageAnalysis analysis = summarize(total);
        log.debug("圖片分析完成 {}x{} (網格間距 {}, 分段 {}) -> 對比 {}, 邊緣密度 {}, 飽和度 {}, 複雜度 {}",
                accessor.width(), accessor.height(), step, chunks,
                analysis.contrast(), analysis.edgeDensity(), analysis.saturation(), analysis.complexity());
        return analysis;
    }

    static int gridStep(PixelAccessor accessor) {
        int maxDim = Math.max(accessor.width(), accessor.height());
        return Math.max(1, (maxDim + GRID_LIMIT - 1) / GRID_LIMIT);
    }

    private List<RegionStats> scanInParallel(PixelAccessor accessor, int step, int gridRows, int chunks,
                                             ExecutorService workers, CancellationToken token)
            throws GenerationException {
        List<Callable<RegionStats>> tasks = new ArrayList<>(chunks);
        int rowsPerChunk = (gridRows + chunks - 1) / chunks;
        for (int start = 0; start < gridRows; start += rowsPerChunk) {
            final int from = start;
            final int to = Math.min(gridRows, start + rowsPerChunk);
            tasks.add(() -> scanRows(accessor, step, from, to, token));
        }

        List<RegionStats> results = new ArrayList<>(tasks.size());
        try {
            for (Future<RegionStats> future : workers.invokeAll(tasks)) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt(); // 恢復中斷狀態
            throw new GenerationException(GenerationError.CANCELLED, "圖片分析被中斷", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof GenerationException) {
                throw (GenerationException) e.getCause();
            }
            throw new GenerationException(GenerationError.STAGE_FAILED, "圖片分析失敗", e.getCause());
        }
        return results;
    }

    private RegionStats scanRows(PixelAccessor accessor, int step, int fromRow, int toRow,
                                 CancellationToken token) throws GenerationException {
        RegionStats stats = new RegionStats();
        for (int gy = fromRow; gy < toRow; gy++) {
            token.throwIfCancelled();
            int y = gy * step;
            for (int x = 0; x < accessor.width(); x += step) {
                stats.samples++;
                Rgba c = accessor.colorAt(x, y);
                if (c.a() <= ALPHA_THRESHOLD) {
                    continue;
                }
                float contrast = localContrast(accessor, x, y, c);
                stats.add(c, contrast);
            }
        }
        return stats;
    }

    /** 與 8 個相鄰不透明像素的平均 RGB 距離，正規化到 0..1。 */
    static float localContrast(PixelAccessor accessor, int x, int y, Rgba center) {
        float sum = 0f;
        int count = 0;
        for (int dy = -1; dy <= 1; dy++) {
            for (int dx = -1; dx <= 1; dx++) {
                if ((dx == 0 && dy == 0) || !accessor.contains(x + dx, y + dy)) {
                    continue;
                }
                Rgba n = accessor.colorAt(x + dx, y + dy);
                if (n.a() <= ALPHA_THRESHOLD) {
                    continue;
                }
                sum += center.rgbDistance(n);
                count++;
            }
        }
        return count == 0 ? 0f : sum / count / SQRT3;
    }

    private ImageAnalysis summarize(RegionStats s) throws GenerationException {
        if (s.opaque == 0) {
            throw new GenerationException(GenerationError.INVALID_IMAGE, "圖片中沒有不透明的像素");
        }
        double n = s.opaque;
        double avgR = s.sumR / n;
        double avgG = s.sumG / n;
        double avgB = s.sumB / n;
        double variance = ((s.sumSqR / n - avgR * avgR)
                + (s.sumSqG / n - avgG * avgG)
                + (s.sumSqB / n - avgB * avgB)) / 3.0;

        float contrast = (float) (s.sumContrast / n);
        float edgeDensity = (float) (s.edges / n);
        float complexity = (float) Math.min(10.0, edgeDensity * 20.0 * 0.7 + contrast * 10.0 * 0.3);

        List<DominantColor> dominant = s.histogram.entrySet().stream()
                .sorted(Comparator.<Map.Entry<Integer, Integer>>comparingInt(Map.Entry::getValue).reversed()
                        .thenComparingInt(Map.Entry::getKey))
                .limit(MAX_DOMINANT_COLORS)
                .map(e -> new DominantColor(dequantize(e.getKey()), (float) (e.getValue() / n)))
                .collect(Collectors.toList());

        return new ImageAnalysis(
                dominant,
                contrast,
                edgeDensity,
                (float) (s.sumSaturation / n),
                complexity,
                (float) ((avgR + avgG + avgB) / 3.0),
                new Rgba((float) avgR, (float) avgG, (float) avgB, 1f),
                (float) Math.max(0.0, variance),
                (float) (s.opaque / (double) s.samples),
                s.samples);
    }

    static int quantize(Rgba c) {
        int levels = QUANTIZATION_LEVELS + 1;
        int r = Math.round(c.r() * QUANTIZATION_LEVELS);
        int g = Math.round(c.g() * QUANTIZATION_LEVELS);
        int b = Math.round(c.b() * QUANTIZATION_LEVELS);
        return (r * levels + g) * levels + b;
    }

    static Rgba dequantize(int key) {
        int levels = QUANTIZATION_LEVELS + 1;
        int b = key % levels;
        int g = (key / levels) % levels;
        int r = key / (levels * levels);
        return new Rgba(r / (float) QUANTIZATION_LEVELS, g / (float) QUANTIZATION_LEVELS,
                b / (float) QUANTIZATION_LEVELS, 1f);
    }

    /** 單一掃描區段的累計值，各執行緒各自擁有一份，最後再合併 */
    private static final class RegionStats {
        int samples;
        int opaque;
        int edges;
        double sumR, sumG, sumB;
        double sumSqR, sumSqG, sumSqB;
        double sumSaturation;
        double sumContrast;
        final Map<Integer, Integer> histogram = new HashMap<>();

        void add(Rgba c, float contrast) {
            opaque++;
            sumR += c.r();
            sumG += c.g();
            sumB += c.b();
            sumSqR += c.r() * c.r();
            sumSqG += c.g() * c.g();
            sumSqB += c.b() * c.b();
            sumSaturation += c.channelSpread();
            sumContrast += contrast;
            if (contrast > EDGE_THRESHOLD) {
                edges++;
            }
            histogram.merge(quantize(c), 1, Integer::sum);
        }

        void merge(RegionStats other) {
            samples += other.samples;
            opaque += other.opaque;
            edges += other.edges;
            sumR += other.sumR;
            sumG += other.sumG;
            sumB += other.sumB;
            sumSqR += other.sumSqR;
            sumSqG += other.sumSqG;
            sumSqB += other.sumSqB;
            sumSaturation += other.sumSaturation;
            sumContrast += other.sumContrast;
            other.histogram.forEach((k, v) -> histogram.merge(k, v, Integer::sum));
        }
    }
}
