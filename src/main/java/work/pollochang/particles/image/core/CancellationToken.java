package work.pollochang.particles.image.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 協作式取消旗標。長時間的迴圈應定期呼叫 {@link #throwIfCancelled()}。
 */
public final class CancellationToken {

    /** 永遠不會被取消的 token，給不需要取消的呼叫端使用 */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final boolean cancellable;

    public CancellationToken() {
        this(true);
    }

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public void cancel() {
        if (cancellable) {
            cancelled.set(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() throws GenerationException {
        if (cancelled.get()) {
            throw new GenerationException(GenerationError.CANCELLED, "產生已被取消");
        }
    }
}
