package work.pollochang.particles.image.pipeline;

import java.time.Duration;

/**
 * 單執行緒下各階段的時間估計 (秒)。
 */
final class ExecutionEstimates {

    static final double BASE_SECONDS = 0.05;

    private ExecutionEstimates() {}

    static double analysis(Workload w) {
        return w.imageArea() * 1e-7 * w.complexity();
    }

    static double sampling(Workload w) {
        return w.particleCount() * 5e-5 * w.complexity();
    }

    static double assembly(Workload w) {
        return w.particleCount() * 2e-5;
    }

    static double sequentialTotal(Workload w) {
        return BASE_SECONDS + analysis(w) + sampling(w) + assembly(w);
    }

    static Duration toDuration(double seconds) {
        return Duration.ofNanos((long) (seconds * 1_000_000_000L));
    }
}
