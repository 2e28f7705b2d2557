package work.pollochang.particles.image.pipeline;

import work.pollochang.particles.image.config.GenerationConfig;
import work.pollochang.particles.image.core.GenerationException;

import java.time.Duration;

/**
 * 所有階段都在呼叫端執行緒上依序執行。粒子數少於 {@value #OPTIMAL_PARTICLE_LIMIT} 時最合適。
 */
public class SequentialExecutionStrategy implements ExecutionStrategy {

    static final int OPTIMAL_PARTICLE_LIMIT = 100_000;

    @Override
    public String name() {
        return "sequential";
    }

    @Override
    public boolean canParallelize(GenerationStage stage) {
        return false;
    }

    @Override
    public void validate(GenerationConfig config) throws GenerationException {
        config.validate();
    }

    @Override
    public Duration estimateExecutionTime(Workload workload) {
        return ExecutionEstimates.toDuration(ExecutionEstimates.sequentialTotal(workload));
    }

    @Override
    public int workerCount(GenerationStage stage, Workload workload) {
        return 1;
    }

    @Override
    public boolean isOptimal(Workload workload) {
        return workload.particleCount() < OPTIMAL_PARTICLE_LIMIT;
    }
}
