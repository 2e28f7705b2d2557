package work.pollochang.particles.image.pipeline;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.particles.image.analysis.ImageAnalysis;
import work.pollochang.particles.image.analysis.ImageAnalyzer;
import work.pollochang.particles.image.assembly.ParticleAssembler;
import work.pollochang.particles.image.cache.CacheManager;
import work.pollochang.particles.image.config.GenerationConfig;
import work.pollochang.particles.image.core.GenerationError;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.PixelAccessor;
import work.pollochang.particles.image.sampling.PixelSampler;
import work.pollochang.particles.image.sampling.SamplingParams;
import work.pollochang.particles.image.sampling.SamplingParamsTuner;
import work.pollochang.particles.image.sampling.SamplingRequest;
import work.pollochang.particles.image.tools.ImageTools;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 依序執行 分析 → 取樣 → 組裝 → 快取 四個階段。
 * <p>
 * 執行順序由 {@link ExecutionStrategy#dependencies(GenerationStage)} 做拓撲排序決定，同層以優先度排序；
 * 每個階段開始前與結束後都會檢查取消旗標，被取消時丟棄該階段的結果並拋出 {@link GenerationError#CANCELLED}。
 * 需要多個工作執行緒的階段共用一個固定大小的執行緒池，流程結束時關閉。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class GenerationPipeline {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ImageAnalyzer analyzer;
    private final SamplingParamsTuner tuner;
    private final PixelSampler sampler;
    private final ParticleAssembler assembler;
    private final CacheManager cache;

    public GenerationPipeline(CacheManager cache) {
        this(new ImageAnalyzer(), new SamplingParamsTuner(), new PixelSampler(), new ParticleAssembler(), cache);
    }

    /**
     * @param cache 快取，可為 null (不快取)
     */
    public GenerationPipeline(ImageAnalyzer analyzer, SamplingParamsTuner tuner, PixelSampler sampler,
                              ParticleAssembler assembler, CacheManager cache) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.tuner = Objects.requireNonNull(tuner, "tuner must not be null");
        this.sampler = Objects.requireNonNull(sampler, "sampler must not be null");
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
        this.cache = cache;
    }

    public GenerationResult execute(GenerationContext context, ExecutionStrategy strategy,
                                    ProgressListener listener) throws GenerationException {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        Objects.requireNonNull(listener, "listener must not be null");

        GenerationConfig config = context.getConfig();
        strategy.validate(config);

        Set<GenerationStage> included = EnumSet.of(GenerationStage.ANALYSIS, GenerationStage.SAMPLING,
                GenerationStage.ASSEMBLY);
        if (config.cachingEnabled() && cache != null && context.getCacheKey() != null) {
            included.add(GenerationStage.CACHING);
        }
        List<GenerationStage> plan = plan(strategy, included);

        Workload workload = Workload.of(config, context.imageWidth(), context.imageHeight());
        Map<GenerationStage, Integer> workerCounts = new EnumMap<>(GenerationStage.class);
        int poolSize = 1;
        for (GenerationStage stage : plan) {
            int n = strategy.canParallelize(stage) ? Math.min(ExecutionStrategy.MAX_WORKERS,
                    Math.max(1, strategy.workerCount(stage, workload))) : 1;
            workerCounts.put(stage, n);
            poolSize = Math.max(poolSize, n);
        }
        log.info("{}x{} - 執行策略 {}，目標 {} 個粒子，預估耗時 {} ms，執行緒 {}",
                context.imageWidth(), context.imageHeight(), strategy.name(), config.targetParticleCount(),
                strategy.estimateExecutionTime(workload).toMillis(), poolSize);

        long start = System.nanoTime();
        ExecutorService workers = poolSize > 1 ? Executors.newFixedThreadPool(poolSize) : null;
        try {
            for (int i = 0; i < plan.size(); i++) {
                GenerationStage stage = plan.get(i);
                context.getToken().throwIfCancelled();
                long stageStart = System.nanoTime();
                int n = workerCounts.get(stage);
                runStage(stage, context, n > 1 ? workers : null, n);
                context.getToken().throwIfCancelled();
                log.debug("{} - 完成，耗時 {} ms (執行緒 {})", stage.getDisplayName(),
                        (System.nanoTime() - stageStart) / 1_000_000, n);
                listener.onProgress((float) (i + 1) / (plan.size() + 1), stage.getDisplayName());
            }
        } catch (RuntimeException e) {
            throw new GenerationException(GenerationError.STAGE_FAILED, "產生流程發生未預期的錯誤: " + e.getMessage(), e);
        } finally {
            shutdown(workers);
        }

        return new GenerationResult(context.getParticles(), context.getSamples(), context.getAnalysis(), false,
                (System.nanoTime() - start) / 1_000_000);
    }

    /**
     * 依相依關係排出執行順序，同時可執行的階段中優先度高者先執行。
     * 相依於未納入的階段視為已滿足。
     *
     * @throws GenerationException 相依關係有循環時拋出 {@link GenerationError#INVALID_CONFIGURATION}
     */
    static List<GenerationStage> plan(ExecutionStrategy strategy, Set<GenerationStage> included)
            throws GenerationException {
        Map<GenerationStage, Integer> pending = new EnumMap<>(GenerationStage.class);
        Map<GenerationStage, List<GenerationStage>> dependents = new EnumMap<>(GenerationStage.class);
        for (GenerationStage stage : included) {
            int count = 0;
            for (GenerationStage dependency : strategy.dependencies(stage)) {
                if (included.contains(dependency)) {
                    count++;
                    dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(stage);
                }
            }
            pending.put(stage, count);
        }

        Comparator<GenerationStage> order = Comparator
                .comparingInt((GenerationStage s) -> strategy.priority(s).ordinal()).reversed()
                .thenComparingInt(GenerationStage::ordinal);
        PriorityQueue<GenerationStage> ready = new PriorityQueue<>(order);
        pending.forEach((stage, count) -> {
            if (count == 0) {
                ready.add(stage);
            }
        });

        List<GenerationStage> plan = new ArrayList<>(included.size());
        while (!ready.isEmpty()) {
            GenerationStage stage = ready.poll();
            plan.add(stage);
            for (GenerationStage next : dependents.getOrDefault(stage, List.of())) {
                int remaining = pending.merge(next, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(next);
                }
            }
        }
        if (plan.size() != included.size()) {
            throw new GenerationException(GenerationError.INVALID_CONFIGURATION,
                    "執行策略 " + strategy.name() + " 的階段相依關係有循環");
        }
        return plan;
    }

    private void runStage(GenerationStage stage, GenerationContext context, ExecutorService workers,
                          int parallelism) throws GenerationException {
        switch (stage) {
            case ANALYSIS:
                runAnalysis(context, workers, parallelism);
                break;
            case SAMPLING:
                runSampling(context, workers, parallelism);
                break;
            case ASSEMBLY:
                context.setParticles(assembler.assemble(context.getSamples(), context.imageWidth(),
                        context.imageHeight(), context.getViewport(), context.getConfig()));
                break;
            case CACHING:
                runCaching(context);
                break;
            default:
                throw new IllegalStateException("未知的階段: " + stage);
        }
    }

    private void runAnalysis(GenerationContext context, ExecutorService workers, int parallelism)
            throws GenerationException {
        ImageAnalysis analysis = context.getAnalysis();
        if (analysis == null) {
            BufferedImage image = context.getImage();
            PixelAccessor accessor = context.getAccessor();
            BufferedImage reduced = ImageTools.downscaleToMaxDimension(image, ImageAnalyzer.MAX_ANALYSIS_DIMENSION);
            if (reduced != image) {
                accessor = PixelAccessor.fromImage(reduced);
            }
            analysis = analyzer.analyze(accessor, workers, parallelism, context.getToken());
            context.setAnalysis(analysis);
        } else {
            log.debug("使用預先計算的圖片分析結果");
        }

        GenerationConfig config = context.getConfig();
        SamplingParams base = config.samplingParams();
        context.setSamplingParams(config.qualityPreset().usesAnalysisTuning() ? tuner.tune(base, analysis) : base);
    }

    private void runSampling(GenerationContext context, ExecutorService workers, int parallelism)
            throws GenerationException {
        GenerationConfig config = context.getConfig();
        SamplingRequest request = new SamplingRequest(
                context.getAccessor(),
                config.targetParticleCount(),
                context.getSamplingParams(),
                context.getAnalysis().dominantRgb(),
                context.getToken(),
                context.getRandom(),
                workers,
                parallelism);
        context.setSamples(sampler.sample(request, config));
    }

    private void runCaching(GenerationContext context) {
        boolean stored = cache.put(context.getCacheKey(), context.getSamples());
        context.setCached(stored);
        if (!stored) {
            log.warn("{} - 取樣結果未寫入快取，本次結果仍然有效", context.getCacheKey());
        }
    }

    private static void shutdown(ExecutorService workers) {
        if (workers == null) {
            return;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("工作執行緒池等待逾時，強制關閉。");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("工作執行緒池被中斷。", e);
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
