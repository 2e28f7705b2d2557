package work.pollochang.particles.image.report;

import work.pollochang.particles.image.core.GenerationError;

public enum GenerationOutcome {
    GENERATED_SUCCESS("成功產生"),
    CACHE_HIT("命中快取"),
    SKIPPED_NOT_FOUND("來源檔案不存在"),
    FAILED_INVALID_IMAGE("圖片無效"),
    FAILED_INVALID_CONFIGURATION("設定無效"),
    FAILED_INSUFFICIENT_SAMPLES("取樣不足"),
    FAILED_CANCELLED("已取消"),
    FAILED_IO_ERROR("IO錯誤"),
    FAILED_OUT_OF_MEMORY("記憶體溢位"),
    FAILED_UNKNOWN("未知錯誤");

    private final String description;
    GenerationOutcome(String description) { this.description = description; }
    public String getDescription() { return description; }

    public boolean isSuccess() {
        return this == GENERATED_SUCCESS || this == CACHE_HIT;
    }

    public static GenerationOutcome fromError(GenerationError error) {
        switch (error) {
            case INVALID_IMAGE:
                return FAILED_INVALID_IMAGE;
            case INVALID_CONFIGURATION:
                return FAILED_INVALID_CONFIGURATION;
            case INSUFFICIENT_SAMPLES:
                return FAILED_INSUFFICIENT_SAMPLES;
            case CANCELLED:
                return FAILED_CANCELLED;
            case CACHE_CREATION_FAILED:
                return FAILED_IO_ERROR;
            default:
                return FAILED_UNKNOWN;
        }
    }
}
