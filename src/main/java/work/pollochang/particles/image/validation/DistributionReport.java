package work.pollochang.particles.image.validation;

/**
 * 取樣分布的檢查結果。
 *
 * @param coverage          有內容的 4×4 網格中，至少有一個取樣點的比例
 * @param topShare          取樣點落在上半部的比例
 * @param expectedTopShare  不透明像素落在上半部的比例
 * @param clusteredFraction 被判定為群聚的取樣點比例 (未檢查時為 0)
 * @param missingCorners    有內容但沒有取樣點的角落數
 */
public record DistributionReport(
        float coverage,
        float topShare,
        float expectedTopShare,
        float clusteredFraction,
        int missingCorners
) {

    public boolean coverageDeficient() {
        return coverage < ArtifactPreventionValidator.MIN_COVERAGE;
    }

    public boolean verticallyImbalanced() {
        return Math.abs(topShare - expectedTopShare) > ArtifactPreventionValidator.VERTICAL_TOLERANCE;
    }

    public boolean clustered() {
        return clusteredFraction > ArtifactPreventionValidator.CLUSTERED_FRACTION_LIMIT;
    }
}
