package work.pollochang.particles.image.sampling;

import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.Sample;

import java.util.List;

/**
 * 取樣策略。
 * <p>
 * 回傳的取樣點數量<b>最多</b>為 {@link SamplingRequest#targetCount()}，不足的部分由呼叫端補齊；
 * 一般情況下不會有重複的 (x, y)，座標一定落在圖片範圍內。
 * 分數相同時以掃描順序決定，相同輸入得到相同的排序結果。
 */
public interface SamplingStrategy {

    /** 日誌與快取鍵中使用的名稱 */
    String name();

    List<Sample> sample(SamplingRequest request) throws GenerationException;
}
