package work.pollochang.particles.image.config;

public enum SamplingStrategyType {
    UNIFORM("uniform", 1.0),
    IMPORTANCE("importance", 1.2),
    ADAPTIVE("adaptive", 1.3),
    HYBRID("hybrid", 1.5),
    ADVANCED("advanced", 1.8);

    private final String key;
    private final double complexityMultiplier;

    SamplingStrategyType(String key, double complexityMultiplier) {
        this.key = key;
        this.complexityMultiplier = complexityMultiplier;
    }

    public String key() { return key; }
    public double complexityMultiplier() { return complexityMultiplier; }
}
