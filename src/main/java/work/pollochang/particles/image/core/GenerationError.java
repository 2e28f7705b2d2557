package work.pollochang.particles.image.core;

public enum GenerationError {
    INVALID_IMAGE("無效的圖片"),
    INVALID_CONFIGURATION("無效的產生設定"),
    INSUFFICIENT_SAMPLES("取樣點數量不足"),
    CACHE_CREATION_FAILED("無法建立快取"),
    CANCELLED("產生已取消"),
    GENERATION_IN_PROGRESS("已有產生任務執行中"),
    STAGE_FAILED("管線階段執行失敗");

    private final String description;
    GenerationError(String description) { this.description = description; }
    public String getDescription() { return description; }
}
