package work.pollochang.particles.image.config;

/**
 * {@link SamplingStrategyType#ADVANCED} 底下可選用的演算法。
 */
public enum AdvancedAlgorithm {
    /** 分帶取樣，各帶配額依像素數量分配 */
    UNIFORM("uniform"),
    BLUE_NOISE("blueNoise"),
    VAN_DER_CORPUT("vanDerCorput"),
    HASH_BASED("hashBased"),
    /** 分帶取樣，各帶配額依 alpha × 亮度分配 */
    ADAPTIVE("adaptive");

    private final String key;

    AdvancedAlgorithm(String key) { this.key = key; }

    public String key() { return key; }
}
