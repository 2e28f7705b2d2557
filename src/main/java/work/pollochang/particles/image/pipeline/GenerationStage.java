package work.pollochang.particles.image.pipeline;

public enum GenerationStage {
    ANALYSIS("Image Analysis"),
    SAMPLING("Pixel Sampling"),
    ASSEMBLY("Particle Assembly"),
    CACHING("Result Caching");

    private final String displayName;
    GenerationStage(String displayName) { this.displayName = displayName; }
    public String getDisplayName() { return displayName; }
}
