package work.pollochang.particles.image.config;

/**
 * 品質預設。
 * {@code particleSizeMultiplier} 用於粒子組裝，{@code complexityMultiplier} 用於執行時間估算。
 */
public enum QualityPreset {
    DRAFT("draft", 2.0f, 0.5),
    STANDARD("standard", 1.5f, 1.0),
    HIGH("high", 1.2f, 1.4),
    ULTRA("ultra", 1.0f, 1.8);

    private final String key;
    private final float particleSizeMultiplier;
    private final double complexityMultiplier;

    QualityPreset(String key, float particleSizeMultiplier, double complexityMultiplier) {
        this.key = key;
        this.particleSizeMultiplier = particleSizeMultiplier;
        this.complexityMultiplier = complexityMultiplier;
    }

    public String key() { return key; }
    public float particleSizeMultiplier() { return particleSizeMultiplier; }
    public double complexityMultiplier() { return complexityMultiplier; }

    /** 只有 HIGH 與 ULTRA 依分析結果調整取樣參數，DRAFT/STANDARD 直接使用基礎參數。 */
    public boolean usesAnalysisTuning() {
        return this == HIGH || this == ULTRA;
    }
}
