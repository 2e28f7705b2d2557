package work.pollochang.particles.image.pipeline;

import work.pollochang.particles.image.config.GenerationConfig;
import work.pollochang.particles.image.core.GenerationException;

import java.time.Duration;
import java.util.List;

/**
 * 決定管線各階段如何執行。
 * <p>
 * 不論策略為何，階段順序永遠是 分析 → 取樣 → 組裝 → 快取；策略只決定階段內部是否使用多個工作執行緒。
 * 組裝與快取會修改共用的累積狀態，永遠依序執行。
 *
 * @author PolloChang
 * @since 0.1.0
 */
public interface ExecutionStrategy {

    /** 工作執行緒數量的硬上限，避免過度訂閱 CPU */
    int MAX_WORKERS = 4;

    String name();

    boolean canParallelize(GenerationStage stage);

    default List<GenerationStage> dependencies(GenerationStage stage) {
        switch (stage) {
            case SAMPLING:
                return List.of(GenerationStage.ANALYSIS);
            case ASSEMBLY:
                return List.of(GenerationStage.SAMPLING);
            case CACHING:
                return List.of(GenerationStage.ASSEMBLY);
            case ANALYSIS:
            default:
                return List.of();
        }
    }

    default StagePriority priority(GenerationStage stage) {
        switch (stage) {
            case SAMPLING:
                return StagePriority.CRITICAL;
            case ANALYSIS:
                return StagePriority.HIGH;
            case ASSEMBLY:
                return StagePriority.NORMAL;
            case CACHING:
            default:
                return StagePriority.LOW;
        }
    }

    /**
     * 在執行前檢查設定是否適用於此策略。
     *
     * @throws GenerationException 不適用時拋出 {@link work.pollochang.particles.image.core.GenerationError#INVALID_CONFIGURATION}
     */
    void validate(GenerationConfig config) throws GenerationException;

    /** 啟發式的執行時間估計，僅供紀錄參考 */
    Duration estimateExecutionTime(Workload workload);

    /** 指定階段要使用的工作執行緒數量，1 表示在呼叫端執行緒上依序執行 */
    int workerCount(GenerationStage stage, Workload workload);

    boolean isOptimal(Workload workload);
}
