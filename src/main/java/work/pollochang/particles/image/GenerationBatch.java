package work.pollochang.particles.image;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.particles.image.assembly.Viewport;
import work.pollochang.particles.image.cache.CacheManager;
import work.pollochang.particles.image.config.GenerationConfig;
import work.pollochang.particles.image.coordinator.GenerationCoordinator;
import work.pollochang.particles.image.coordinator.GenerationRequest;
import work.pollochang.particles.image.core.DecodedImage;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.ImageDecoding;
import work.pollochang.particles.image.pipeline.AdaptiveExecutionStrategy;
import work.pollochang.particles.image.pipeline.ExecutionStrategy;
import work.pollochang.particles.image.pipeline.GenerationResult;
import work.pollochang.particles.image.report.GenerationOutcome;
import work.pollochang.particles.image.report.GenerationReport;
import work.pollochang.particles.image.report.ParticleDocument;
import work.pollochang.particles.image.tools.FileTools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * 進行批次粒子產生，每張圖片輸出一份 {@code <檔名>.particles.json}。
 */
@Setter
@Slf4j
public class GenerationBatch {

    static final String OUTPUT_SUFFIX = ".particles.json";

    /** 單一圖片，與 fileList 擇一 */
    private Path inputFile;
    /** 每行一個圖片路徑的文字檔 */
    private Path fileList;
    private Path outputDir;
    private GenerationConfig config = GenerationConfig.standard();
    /** 為 null 時使用各圖片自己的尺寸 */
    private Viewport viewport;
    private CacheManager cacheManager;
    private ExecutionStrategy executionStrategy;
    private int threadCount = Math.max(1, Runtime.getRuntime().availableProcessors());
    private long timeOutMinutes = 60;
    private Long seed;

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * @return 各結果的計數
     */
    public Map<GenerationOutcome, Long> execute() {
        FileTools.ensureDirectoryExists(outputDir);

        // 使用 EnumMap 和 AtomicLong 進行線程安全的計數
        Map<GenerationOutcome, AtomicLong> counters = new EnumMap<>(GenerationOutcome.class);
        for (GenerationOutcome outcome : GenerationOutcome.values()) {
            counters.put(outcome, new AtomicLong(0));
        }
        AtomicLong totalFiles = new AtomicLong(0);
        AtomicLong totalParticles = new AtomicLong(0);

        List<Path> inputs;
        try {
            inputs = collectInputs();
        } catch (IOException e) {
            log.error("讀取檔案列表失敗: {}", fileList, e);
            return snapshot(counters);
        }

        ExecutionStrategy strategy = executionStrategy == null ? new AdaptiveExecutionStrategy() : executionStrategy;
        log.info("建立固定大小為 {} 的執行緒池，處理 {} 個檔案。", threadCount, inputs.size());
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        try {
            for (Path inputPath : inputs) {
                totalFiles.incrementAndGet();
                executor.submit(() -> {
                    // 每個任務使用自己的協調器，快取由所有任務共用
                    GenerationCoordinator coordinator = new GenerationCoordinator(cacheManager, strategy);
                    GenerationReport report = processImage(inputPath, coordinator);
                    counters.get(report.outcome()).incrementAndGet();
                    totalParticles.addAndGet(report.particleCount());
                });
            }

            log.info("所有任務已提交，等待處理完成...");
            executor.shutdown();
            if (!executor.awaitTermination(timeOutMinutes, TimeUnit.MINUTES)) {
                log.warn("執行緒池等待逾時，部分任務可能未完成。");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("執行緒池被中斷。", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt(); // 恢復中斷狀態
        }

        long successCount = counters.get(GenerationOutcome.GENERATED_SUCCESS).get();
        long cacheHitCount = counters.get(GenerationOutcome.CACHE_HIT).get();
        long skippedCount = counters.get(GenerationOutcome.SKIPPED_NOT_FOUND).get();
        long failedCount = totalFiles.get() - successCount - cacheHitCount - skippedCount;

        log.info("========================================產生結果報告========================================");
        log.info(" 總計: {}, 成功產生: {}, 命中快取: {}, 跳過: {}, 失敗: {}",
                totalFiles.get(), successCount, cacheHitCount, skippedCount, failedCount);
        log.info(" 粒子總數: {}", totalParticles.get());
        if (cacheManager != null) {
            log.info(" 快取: {} 筆，共 {} / {}", cacheManager.count(),
                    FileTools.formatFileSize(cacheManager.size()), FileTools.formatFileSize(cacheManager.maxSizeBytes()));
        }
        log.info("========================================產生結果報告========================================");
        return snapshot(counters);
    }

    GenerationReport processImage(Path inputPath, GenerationCoordinator coordinator) {
        long start = System.nanoTime();
        if (!Files.isReadable(inputPath)) {
            log.warn("{} - 檔案不存在或不可讀，跳過", inputPath);
            return GenerationReport.failed(GenerationOutcome.SKIPPED_NOT_FOUND);
        }
        try (DecodedImage decoded = ImageDecoding.decode(inputPath)) {
            if (decoded.downsampled()) {
                log.info("{} - 圖片過大，解碼時降採樣 1/{} ({}x{})", inputPath, decoded.subsampling(),
                        decoded.width(), decoded.height());
            }
            GenerationRequest request = new GenerationRequest(decoded.image(), config, viewport, null, seed);
            GenerationResult result = coordinator.generate(request, (fraction, stage) ->
                    log.debug("{} - {} ({}%)", inputPath, stage, Math.round(fraction * 100)));

            Path output = outputDir.resolve(FileTools.baseName(inputPath) + OUTPUT_SUFFIX);
            Viewport target = viewport == null ? Viewport.ofImage(decoded.width(), decoded.height()) : viewport;
            ParticleDocument document = new ParticleDocument(
                    inputPath.toString(),
                    decoded.width(),
                    decoded.height(),
                    target.width(),
                    target.height(),
                    config.qualityPreset().key(),
                    config.strategyKey(),
                    result.fromCache(),
                    result.particles());
            FileTools.writeAtomically(output, mapper.writeValueAsBytes(document));

            long elapsed = (System.nanoTime() - start) / 1_000_000;
            log.info("{} - 處理成功 -> {} ({} 個粒子, {} ms{})", inputPath, output, result.particles().size(),
                    elapsed, result.fromCache() ? ", 命中快取" : "");
            GenerationOutcome outcome = result.fromCache() ? GenerationOutcome.CACHE_HIT : GenerationOutcome.GENERATED_SUCCESS;
            return new GenerationReport(outcome, result.particles().size(), elapsed);
        } catch (GenerationException e) {
            log.warn("{} - 產生失敗: {}", inputPath, e.getMessage(), e);
            return GenerationReport.failed(GenerationOutcome.fromError(e.getError()));
        } catch (IOException e) {
            log.warn("{} - 處理圖片時發生 I/O 錯誤 (可能非支援格式或檔案損毀)", inputPath, e);
            return GenerationReport.failed(GenerationOutcome.FAILED_IO_ERROR);
        } catch (OutOfMemoryError e) {
            log.error("{} - 處理檔案時發生記憶體溢位錯誤 (圖片可能過大)", inputPath, e);
            return GenerationReport.failed(GenerationOutcome.FAILED_OUT_OF_MEMORY);
        } catch (Exception e) {
            log.error("{} - 處理檔案時發生未知錯誤", inputPath, e);
            return GenerationReport.failed(GenerationOutcome.FAILED_UNKNOWN);
        }
    }

    private List<Path> collectInputs() throws IOException {
        List<Path> inputs = new ArrayList<>();
        if (inputFile != null) {
            inputs.add(inputFile);
        }
        if (fileList != null) {
            try (Stream<String> lines = Files.lines(fileList)) {
                lines.map(String::trim)
                        .filter(line -> !line.isEmpty())
                        .forEach(line -> inputs.add(Paths.get(line)));
            }
        }
        return inputs;
    }

    private static Map<GenerationOutcome, Long> snapshot(Map<GenerationOutcome, AtomicLong> counters) {
        Map<GenerationOutcome, Long> result = new EnumMap<>(GenerationOutcome.class);
        counters.forEach((outcome, count) -> result.put(outcome, count.get()));
        return result;
    }
}
