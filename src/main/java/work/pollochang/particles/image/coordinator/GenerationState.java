package work.pollochang.particles.image.coordinator;

public enum GenerationState {
    IDLE("閒置"),
    GENERATING("產生中"),
    COMPLETED("已完成"),
    CANCELLED("已取消"),
    FAILED("失敗");

    private final String description;
    GenerationState(String description) { this.description = description; }
    public String getDescription() { return description; }
}
