package work.pollochang.particles.image.pipeline;

public enum StagePriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
