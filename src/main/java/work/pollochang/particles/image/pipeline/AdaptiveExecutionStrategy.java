package work.pollochang.particles.image.pipeline;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.particles.image.config.GenerationConfig;
import work.pollochang.particles.image.core.GenerationException;

import java.time.Duration;
import java.util.Objects;

/**
 * 依工作量自動選擇執行方式：
 * <ul>
 *     <li>LIGHT → 依序執行</li>
 *     <li>MEDIUM → 最多 2 個工作執行緒</li>
 *     <li>HEAVY → 最多 {@link ExecutionStrategy#MAX_WORKERS} 個；核心數少於 4 或記憶體吃緊時降為 2 個</li>
 * </ul>
 * 設定的 maxConcurrency 為 1 時一律依序執行。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class AdaptiveExecutionStrategy implements ExecutionStrategy {

    static final long HEAVY_AREA = 2_000_000L;
    static final int HEAVY_COUNT = 20_000;
    static final long MEDIUM_AREA = 500_000L;
    static final int MEDIUM_COUNT = 5_000;
    static final double MAX_SPEEDUP = 2.5;
    static final double PARALLEL_OVERHEAD_SECONDS = 0.05;

    private final DeviceCapabilities device;
    private final SequentialExecutionStrategy sequential = new SequentialExecutionStrategy();

    public AdaptiveExecutionStrategy() {
        this(DeviceCapabilities.current());
    }

    public AdaptiveExecutionStrategy(DeviceCapabilities device) {
        this.device = Objects.requireNonNull(device, "device must not be null");
    }

    @Override
    public String name() {
        return "adaptive";
    }

    public static WorkloadClass classify(Workload workload) {
        if (workload.imageArea() > HEAVY_AREA || workload.particleCount() > HEAVY_COUNT) {
            return WorkloadClass.HEAVY;
        }
        if (workload.imageArea() > MEDIUM_AREA || workload.particleCount() > MEDIUM_COUNT) {
            return WorkloadClass.MEDIUM;
        }
        return WorkloadClass.LIGHT;
    }

    /** 此工作量實際採用的策略 */
    public ExecutionStrategy select(Workload workload) {
        if (workload.maxConcurrency() <= 1) {
            return sequential;
        }
        switch (classify(workload)) {
            case HEAVY:
                boolean constrained = device.processorCount() < 4 || device.memoryConstrained();
                return new ParallelExecutionStrategy(constrained ? 2 : MAX_WORKERS);
            case MEDIUM:
                return new ParallelExecutionStrategy(2);
            case LIGHT:
            default:
                return sequential;
        }
    }

    @Override
    public boolean canParallelize(GenerationStage stage) {
        return stage == GenerationStage.ANALYSIS || stage == GenerationStage.SAMPLING;
    }

    @Override
    public void validate(GenerationConfig config) throws GenerationException {
        config.validate();
    }

    @Override
    public Duration estimateExecutionTime(Workload workload) {
        ExecutionStrategy selected = select(workload);
        double sequentialSeconds = ExecutionEstimates.sequentialTotal(workload);
        if (selected == sequential) {
            return ExecutionEstimates.toDuration(sequentialSeconds);
        }
        int workers = Math.max(selected.workerCount(GenerationStage.ANALYSIS, workload),
                selected.workerCount(GenerationStage.SAMPLING, workload));
        double speedup = Math.min(MAX_SPEEDUP, workers);
        return ExecutionEstimates.toDuration(sequentialSeconds / speedup + PARALLEL_OVERHEAD_SECONDS);
    }

    @Override
    public int workerCount(GenerationStage stage, Workload workload) {
        int workers = select(workload).workerCount(stage, workload);
        log.debug("{} - 工作量 {}，使用 {} 個工作執行緒", stage.getDisplayName(), classify(workload), workers);
        return workers;
    }

    @Override
    public boolean isOptimal(Workload workload) {
        return true;
    }

    public DeviceCapabilities device() {
        return device;
    }
}
