package work.pollochang.particles.image.coordinator;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.particles.image.assembly.Particle;
import work.pollochang.particles.image.assembly.ParticleAssembler;
import work.pollochang.particles.image.assembly.Viewport;
import work.pollochang.particles.image.cache.CacheManager;
import work.pollochang.particles.image.config.GenerationConfig;
import work.pollochang.particles.image.core.CancellationToken;
import work.pollochang.particles.image.core.GenerationError;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.Sample;
import work.pollochang.particles.image.pipeline.AdaptiveExecutionStrategy;
import work.pollochang.particles.image.pipeline.ExecutionStrategy;
import work.pollochang.particles.image.pipeline.GenerationContext;
import work.pollochang.particles.image.pipeline.GenerationPipeline;
import work.pollochang.particles.image.pipeline.GenerationResult;
import work.pollochang.particles.image.pipeline.ProgressListener;
import work.pollochang.particles.image.tools.CacheTools;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 產生流程的進入點。
 * <p>
 * 狀態轉換：IDLE → GENERATING → (COMPLETED | CANCELLED | FAILED) → IDLE。
 * 同一個實例同時只允許一個產生請求，第二個請求會收到 {@link GenerationError#GENERATION_IN_PROGRESS}。
 * 啟用快取時先查快取，命中則跳過分析與取樣，只重新組裝粒子。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class GenerationCoordinator {

    private final GenerationPipeline pipeline;
    private final ParticleAssembler assembler;
    private final CacheManager cache;
    private final ExecutionStrategy strategy;

    /** 執行中請求的取消旗標，為 null 時表示 IDLE；狀態與旗標以同一次 CAS 發布 */
    private final AtomicReference<CancellationToken> running = new AtomicReference<>();
    private volatile GenerationState lastOutcome = GenerationState.IDLE;

    public GenerationCoordinator(CacheManager cache) {
        this(cache, new AdaptiveExecutionStrategy());
    }

    public GenerationCoordinator(CacheManager cache, ExecutionStrategy strategy) {
        this(new GenerationPipeline(cache), new ParticleAssembler(), cache, strategy);
    }

    /**
     * @param cache 快取，可為 null；應與 pipeline 使用同一個實例
     */
    public GenerationCoordinator(GenerationPipeline pipeline, ParticleAssembler assembler, CacheManager cache,
                                 ExecutionStrategy strategy) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        this.cache = cache;
    }

    /**
     * 產生粒子，阻塞到完成為止。進度在呼叫端執行緒上同步回報，結束時回報 {@code (1.0, "complete")}。
     *
     * @throws GenerationException 設定或圖片無效、取樣不足、被取消，或已有其他請求在執行中
     */
    public GenerationResult generate(GenerationRequest request, ProgressListener listener)
            throws GenerationException {
        Objects.requireNonNull(request, "request must not be null");
        ProgressListener progress = listener == null ? ProgressListener.NONE : listener;

        CancellationToken token = new CancellationToken();
        if (!running.compareAndSet(null, token)) {
            throw new GenerationException(GenerationError.GENERATION_IN_PROGRESS, "已有產生請求正在執行");
        }
        GenerationState outcome = GenerationState.FAILED;
        try {
            GenerationResult result = doGenerate(request, progress, token);
            outcome = GenerationState.COMPLETED;
            return result;
        } catch (GenerationException e) {
            outcome = e.isCancelled() ? GenerationState.CANCELLED : GenerationState.FAILED;
            if (e.isCancelled()) {
                log.info("產生已取消");
            } else {
                log.error("產生失敗: {}", e.getMessage());
            }
            throw e;
        } finally {
            lastOutcome = outcome;
            running.set(null);
        }
    }

    public CompletableFuture<GenerationResult> generateAsync(GenerationRequest request, ProgressListener listener) {
        return generateAsync(request, listener, ForkJoinPool.commonPool());
    }

    /**
     * 在指定的執行器上產生。失敗時 future 以 {@link CompletionException} 包裝 {@link GenerationException} 結束。
     */
    public CompletableFuture<GenerationResult> generateAsync(GenerationRequest request, ProgressListener listener,
                                                             Executor executor) {
        Objects.requireNonNull(executor, "executor must not be null");
        return CompletableFuture.supplyAsync(() -> {
            try {
                return generate(request, listener);
            } catch (GenerationException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    /** 要求目前的產生流程在下一個檢查點停止；沒有執行中的請求時不做任何事 */
    public void cancelGeneration() {
        CancellationToken token = running.get();
        if (token != null) {
            log.info("收到取消要求");
            token.cancel();
        }
    }

    public GenerationState currentState() {
        return running.get() == null ? GenerationState.IDLE : GenerationState.GENERATING;
    }

    /** 最近一次請求的結果狀態，尚未執行過時為 IDLE */
    public GenerationState lastOutcome() {
        return lastOutcome;
    }

    private GenerationResult doGenerate(GenerationRequest request, ProgressListener listener,
                                        CancellationToken token) throws GenerationException {
        long start = System.nanoTime();
        GenerationConfig config = request.config();
        config.validate();
        BufferedImage image = request.image();
        int width = image.getWidth();
        int height = image.getHeight();
        Viewport viewport = request.viewport() == null ? Viewport.ofImage(width, height) : request.viewport();

        String key = null;
        if (config.cachingEnabled() && cache != null) {
            key = CacheTools.createKey(width, height, config);
            Optional<List<Sample>> hit = cache.get(key);
            if (hit.isPresent()) {
                // 快取鍵只由尺寸與設定決定，相同尺寸的不同圖片會共用同一筆
                log.debug("{} - 命中快取，略過分析與取樣", key);
                token.throwIfCancelled();
                List<Particle> particles = assembler.assemble(hit.get(), width, height, viewport, config);
                listener.onProgress(1f, ProgressListener.COMPLETE);
                return new GenerationResult(particles, hit.get(), request.precomputedAnalysis(), true,
                        (System.nanoTime() - start) / 1_000_000);
            }
        }

        token.throwIfCancelled();
        Random random = request.seed() == null ? new Random() : new Random(request.seed());
        GenerationContext context = new GenerationContext(image, config, viewport, token, random, key);
        if (request.precomputedAnalysis() != null) {
            context.setAnalysis(request.precomputedAnalysis());
        }
        GenerationResult result = pipeline.execute(context, strategy, listener);
        listener.onProgress(1f, ProgressListener.COMPLETE);
        log.info("{}x{} - 產生 {} 個粒子，耗時 {} ms", width, height, result.particles().size(),
                (System.nanoTime() - start) / 1_000_000);
        return result;
    }
}
