package work.pollochang.particles.image.pipeline;

import work.pollochang.particles.image.config.GenerationConfig;
import work.pollochang.particles.image.core.GenerationError;
import work.pollochang.particles.image.core.GenerationException;

import java.time.Duration;

/**
 * 分析與取樣階段可使用多個工作執行緒：
 * 圖片面積超過 {@value #ANALYSIS_AREA_THRESHOLD} 像素時平行分析，
 * 粒子數超過 {@value #SAMPLING_COUNT_THRESHOLD} 時平行取樣。
 * 組裝與快取永遠依序執行。
 */
public class ParallelExecutionStrategy implements ExecutionStrategy {

    static final long ANALYSIS_AREA_THRESHOLD = 1_000_000L;
    static final int SAMPLING_COUNT_THRESHOLD = 5_000;
    static final int OPTIMAL_PARTICLE_THRESHOLD = 10_000;

    private final int maxWorkers;

    public ParallelExecutionStrategy() {
        this(MAX_WORKERS);
    }

    public ParallelExecutionStrategy(int maxWorkers) {
        this.maxWorkers = Math.max(1, Math.min(MAX_WORKERS, maxWorkers));
    }

    @Override
    public String name() {
        return "parallel(" + maxWorkers + ")";
    }

    @Override
    public boolean canParallelize(GenerationStage stage) {
        return stage == GenerationStage.ANALYSIS || stage == GenerationStage.SAMPLING;
    }

    @Override
    public void validate(GenerationConfig config) throws GenerationException {
        config.validate();
        if (config.maxConcurrency() <= 1) {
            throw new GenerationException(GenerationError.INVALID_CONFIGURATION,
                    "平行執行需要 maxConcurrency 大於 1: " + config.maxConcurrency());
        }
    }

    @Override
    public Duration estimateExecutionTime(Workload workload) {
        double seconds = ExecutionEstimates.BASE_SECONDS
                + ExecutionEstimates.analysis(workload) / workerCount(GenerationStage.ANALYSIS, workload)
                + ExecutionEstimates.sampling(workload) / workerCount(GenerationStage.SAMPLING, workload)
                + ExecutionEstimates.assembly(workload);
        return ExecutionEstimates.toDuration(seconds);
    }

    @Override
    public int workerCount(GenerationStage stage, Workload workload) {
        int workers = Math.max(1, Math.min(maxWorkers, workload.maxConcurrency()));
        switch (stage) {
            case ANALYSIS:
                return workload.imageArea() > ANALYSIS_AREA_THRESHOLD ? workers : 1;
            case SAMPLING:
                return workload.particleCount() > SAMPLING_COUNT_THRESHOLD ? workers : 1;
            default:
                return 1;
        }
    }

    @Override
    public boolean isOptimal(Workload workload) {
        boolean large = workload.particleCount() > OPTIMAL_PARTICLE_THRESHOLD
                || workload.imageArea() > ANALYSIS_AREA_THRESHOLD;
        return large && Math.min(maxWorkers, workload.maxConcurrency()) > 1;
    }

    public int maxWorkers() {
        return maxWorkers;
    }
}
