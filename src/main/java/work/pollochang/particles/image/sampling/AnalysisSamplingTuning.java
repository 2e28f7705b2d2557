package work.pollochang.particles.image.sampling;

/**
 * 依圖片分析結果調整取樣參數時使用的常數。
 *
 * @param edgeBiasStrength      邊緣密度對門檻的影響程度
 * @param thresholdMin          調整後門檻下限
 * @param thresholdMax          調整後門檻上限
 * @param contrastWeightScale   對比權重的調整幅度
 * @param saturationWeightScale 飽和度權重的調整幅度
 * @param weightMin             權重下限
 * @param weightMax             權重上限
 * @param complexityMid         複雜度達此值時鄰域半徑 +{@code radiusBoostMid}
 * @param complexityHigh        複雜度達此值時鄰域半徑 +{@code radiusBoostHigh}
 * @param radiusBoostMid        中等複雜度的半徑增量
 * @param radiusBoostHigh       高複雜度的半徑增量
 * @param detailBoostScale      複雜度 (0..10 正規化到 0..1) 轉成重要比例增量的倍數
 * @param detailBoostMax        重要比例增量上限
 * @param importantRatioMin     調整後重要比例下限
 * @param importantRatioMax     調整後重要比例上限
 */
public record AnalysisSamplingTuning(
        float edgeBiasStrength,
        float thresholdMin,
        float thresholdMax,
        float contrastWeightScale,
        float saturationWeightScale,
        float weightMin,
        float weightMax,
        float complexityMid,
        float complexityHigh,
        int radiusBoostMid,
        int radiusBoostHigh,
        float detailBoostScale,
        float detailBoostMax,
        float importantRatioMin,
        float importantRatioMax
) {

    public static final AnalysisSamplingTuning DEFAULT = new AnalysisSamplingTuning(
            0.6f, 0.05f, 0.9f,
            0.5f, 0.5f, 0.1f, 2.0f,
            4f, 7f, 1, 2,
            0.15f, 0.2f, 0.3f, 0.9f);
}
