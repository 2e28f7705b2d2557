package work.pollochang.particles.image.pipeline;

public enum WorkloadClass {
    LIGHT("輕量"),
    MEDIUM("中等"),
    HEAVY("重量");

    private final String description;
    WorkloadClass(String description) { this.description = description; }
    public String getDescription() { return description; }
}
