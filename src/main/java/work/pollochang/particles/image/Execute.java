package work.pollochang.particles.image;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import work.pollochang.particles.image.assembly.Viewport;
import work.pollochang.particles.image.cache.CacheManager;
import work.pollochang.particles.image.config.AdvancedAlgorithm;
import work.pollochang.particles.image.config.DisplayMode;
import work.pollochang.particles.image.config.GenerationConfig;
import work.pollochang.particles.image.config.GenerationConfigLoader;
import work.pollochang.particles.image.config.QualityPreset;
import work.pollochang.particles.image.config.SamplingStrategyType;
import work.pollochang.particles.image.core.GenerationError;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.report.GenerationOutcome;
import work.pollochang.particles.image.tools.FileTools;

import java.io.File;
import java.util.Map;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "image-particles",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        description = "將圖片轉換為粒子點雲 (JSON)")
public class Execute implements Callable<Integer> {

    enum CacheBackend { FILE, H2 }

    static final int EXIT_INVALID_INPUT = 2;
    static final int EXIT_FAILURES = 1;

    @Option(names = {"-i", "--input"}, description = "單一圖片檔案。")
    private File inputFile;

    @Option(names = {"-f", "--file-list"}, description = "包含圖片路徑的文字檔案，每行一個。")
    private File fileList;

    @Option(names = {"-o", "--output-dir"}, required = true, description = "粒子 JSON 的儲存目錄。")
    private File saveDir;

    @Option(names = {"--config"}, description = "JSON 設定檔，檔案中的欄位覆蓋預設值。")
    private File configFile;

    @Option(names = {"-p", "--preset"}, description = "品質預設: ${COMPLETION-CANDIDATES} (預設: STANDARD)。")
    private QualityPreset preset;

    @Option(names = {"-s", "--strategy"}, description = "取樣策略: ${COMPLETION-CANDIDATES}。")
    private SamplingStrategyType strategy;

    @Option(names = {"-a", "--algorithm"}, description = "進階取樣演算法: ${COMPLETION-CANDIDATES}。")
    private AdvancedAlgorithm algorithm;

    @Option(names = {"-n", "--count"}, description = "目標粒子數量。")
    private Integer count;

    @Option(names = {"-d", "--display-mode"}, description = "顯示模式: ${COMPLETION-CANDIDATES}。")
    private DisplayMode displayMode;

    @Option(names = {"--viewport"}, description = "目標畫面尺寸，格式為 寬x高，例如 1920x1080 (預設: 圖片尺寸)。")
    private String viewport;

    @Option(names = {"-c", "--concurrency"}, description = "單張圖片的最大工作執行緒數量。")
    private Integer concurrency;

    @Option(names = {"--cache-dir"}, defaultValue = "particle-cache", description = "取樣快取的目錄 (預設: particle-cache)。")
    private File cacheDir;

    @Option(names = {"--cache-size"}, description = "快取容量上限 (bytes)。")
    private Long cacheSize;

    @Option(names = {"--cache-backend"}, defaultValue = "FILE", description = "快取儲存方式: ${COMPLETION-CANDIDATES} (預設: FILE)。")
    private CacheBackend cacheBackend;

    @Option(names = {"--no-cache"}, description = "停用快取。")
    private boolean noCache;

    @Option(names = {"--seed"}, description = "隨機種子，指定後結果可重現。")
    private Long seed;

    @Option(names = {"-t", "--threads"}, description = "同時處理的圖片數量 (預設: CPU 核心數)。")
    private Integer threads;

    @Option(names = {"--timeOut"}, defaultValue = "60", description = "設定執行時間超時(分鐘) (預設: 60 分鐘)。")
    private long timeOutMinutes;

    @Override
    public Integer call() throws Exception {
        if (inputFile == null && fileList == null) {
            log.error("必須指定 --input 或 --file-list 其中之一");
            return EXIT_INVALID_INPUT;
        }

        GenerationConfig config;
        Viewport target;
        try {
            config = buildConfig();
            target = parseViewport(viewport);
        } catch (GenerationException e) {
            log.error("設定無效: {}", e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        log.info("========================================粒子產生參數設定========================================");
        log.info("來源圖片: {}", inputFile == null ? "-" : inputFile.getAbsolutePath());
        log.info("來源列表: {}", fileList == null ? "-" : fileList.getAbsolutePath());
        log.info("輸出目錄: {}", saveDir.getAbsolutePath());
        log.info("品質預設: {}, 取樣策略: {}, 目標數量: {}", config.qualityPreset(), config.strategyKey(),
                config.targetParticleCount());
        log.info("顯示模式: {}, 畫面: {}", config.displayMode(), target == null ? "圖片尺寸" : viewport);
        log.info("快取: {}", config.cachingEnabled()
                ? cacheBackend + " " + cacheDir.getAbsolutePath() + " (" + FileTools.formatFileSize(config.cacheSizeLimitBytes()) + ")"
                : "停用");
        log.info("設定超時執行時間: {} 分鐘", timeOutMinutes);
        log.info("========================================粒子產生參數設定========================================");

        CacheManager cacheManager = null;
        try {
            if (config.cachingEnabled()) {
                cacheManager = cacheBackend == CacheBackend.H2
                        ? CacheManager.openH2(cacheDir.toPath().resolve("particle-cache"), config.cacheSizeLimitBytes(), false)
                        : CacheManager.open(cacheDir.toPath(), config.cacheSizeLimitBytes());
            }
        } catch (GenerationException e) {
            log.warn("無法建立快取，本次不使用快取: {}", e.getMessage(), e);
        }

        Map<GenerationOutcome, Long> counts;
        try {
            GenerationBatch batch = new GenerationBatch();
            batch.setInputFile(inputFile == null ? null : inputFile.toPath());
            batch.setFileList(fileList == null ? null : fileList.toPath());
            batch.setOutputDir(saveDir.toPath());
            batch.setConfig(config);
            batch.setViewport(target);
            batch.setCacheManager(cacheManager);
            batch.setSeed(seed);
            batch.setTimeOutMinutes(timeOutMinutes);
            if (threads != null) {
                batch.setThreadCount(Math.max(1, threads));
            }
            counts = batch.execute();
        } finally {
            if (cacheManager != null) {
                cacheManager.close();
            }
        }

        long failed = counts.entrySet().stream()
                .filter(e -> !e.getKey().isSuccess() && e.getKey() != GenerationOutcome.SKIPPED_NOT_FOUND)
                .mapToLong(Map.Entry::getValue)
                .sum();
        log.info("所有任務執行完畢");
        return failed == 0 ? 0 : EXIT_FAILURES;
    }

    GenerationConfig buildConfig() throws GenerationException {
        GenerationConfig config;
        if (configFile != null) {
            config = GenerationConfigLoader.load(configFile.toPath());
            if (preset != null) {
                config = config.withQualityPreset(preset);
            }
        } else {
            config = GenerationConfig.forPreset(preset == null ? QualityPreset.STANDARD : preset);
        }
        if (strategy != null) {
            config = config.withSamplingStrategy(strategy);
        }
        if (algorithm != null) {
            config = config.withAdvancedAlgorithm(algorithm);
        }
        if (count != null) {
            config = config.withTargetParticleCount(count);
        }
        if (displayMode != null) {
            config = config.withDisplayMode(displayMode);
        }
        if (concurrency != null) {
            config = config.withMaxConcurrency(concurrency);
        }
        if (cacheSize != null) {
            config = config.withCacheSizeLimitBytes(cacheSize);
        }
        if (noCache) {
            config = config.withCachingEnabled(false);
        }
        config.validate();
        return config;
    }

    static Viewport parseViewport(String value) throws GenerationException {
        if (value == null || value.isBlank()) {
            return null;
        }
        String[] parts = value.trim().toLowerCase().split("x");
        try {
            if (parts.length == 2) {
                int width = Integer.parseInt(parts[0].trim());
                int height = Integer.parseInt(parts[1].trim());
                if (width > 0 && height > 0) {
                    return new Viewport(width, height);
                }
            }
        } catch (NumberFormatException e) {
            throw new GenerationException(GenerationError.INVALID_CONFIGURATION,
                    "畫面尺寸格式錯誤: " + value, e);
        }
        throw new GenerationException(GenerationError.INVALID_CONFIGURATION,
                "畫面尺寸格式錯誤: " + value);
    }

    static CommandLine commandLine() {
        return new CommandLine(new Execute()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
