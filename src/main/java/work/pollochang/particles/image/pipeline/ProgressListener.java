package work.pollochang.particles.image.pipeline;

/**
 * 進度回報。{@code fraction} 介於 0 與 1，每個階段完成時至少呼叫一次，結束時以 {@code (1.0, "complete")} 呼叫。
 * 在執行產生的執行緒上同步呼叫。
 */
@FunctionalInterface
public interface ProgressListener {

    String COMPLETE = "complete";

    ProgressListener NONE = (fraction, stage) -> { };

    void onProgress(float fraction, String stage);
}
