package work.pollochang.particles.image.pipeline;

/**
 * 執行環境的硬體快照 (CPU 核心數、JVM 記憶體)。{@link #current()} 在行程內只擷取一次。
 */
public record DeviceCapabilities(int processorCount, long maxMemoryBytes, long freeMemoryBytes) {

    /** 低於此值視為記憶體吃緊 */
    public static final long LOW_MEMORY_THRESHOLD = 256L * 1024 * 1024;

    public static DeviceCapabilities current() {
        return Holder.SNAPSHOT;
    }

    static DeviceCapabilities capture() {
        Runtime runtime = Runtime.getRuntime();
        long used = runtime.totalMemory() - runtime.freeMemory();
        return new DeviceCapabilities(
                Math.max(1, runtime.availableProcessors()),
                runtime.maxMemory(),
                Math.max(0, runtime.maxMemory() - used));
    }

    public boolean memoryConstrained() {
        return freeMemoryBytes < LOW_MEMORY_THRESHOLD;
    }

    private static final class Holder {
        private static final DeviceCapabilities SNAPSHOT = capture();
    }
}
