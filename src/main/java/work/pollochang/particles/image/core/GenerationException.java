package work.pollochang.particles.image.core;

import java.util.Objects;

/**
 * 粒子產生流程中所有可回報給呼叫端的錯誤。
 * <p>
 * 錯誤種類由 {@link GenerationError} 區分，呼叫端應以 {@link #getError()} 判斷，
 * 而不是解析訊息文字。取消 ({@link GenerationError#CANCELLED}) 是一種正常結果，
 * 只是透過同一個通道傳遞。
 *
 * @author PolloChang
 * @since 0.1.0
 */
public class GenerationException extends Exception {

    private final GenerationError error;

    public GenerationException(GenerationError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error must not be null");
    }

    public GenerationException(GenerationError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error must not be null");
    }

    public GenerationError getError() {
        return error;
    }

    public boolean isCancelled() {
        return error == GenerationError.CANCELLED;
    }

    @Override
    public String toString() {
        return "GenerationException[" + error + "]: " + getMessage();
    }
}
