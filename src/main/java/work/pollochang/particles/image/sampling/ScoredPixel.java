package work.pollochang.particles.image.sampling;

import java.util.Comparator;

/**
 * 帶有重要度分數的候選像素，{@code order} 為掃描順序。
 */
public record ScoredPixel(int x, int y, float score, int order) {

    /** 分數由高到低，同分時先掃描到的優先 */
    public static final Comparator<ScoredPixel> BY_SCORE_DESC =
            Comparator.comparingDouble(ScoredPixel::score).reversed()
                    .thenComparingInt(ScoredPixel::order);
}
