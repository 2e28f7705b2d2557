package work.pollochang.particles.image.sampling;

import lombok.With;
import work.pollochang.particles.image.core.CancellationToken;
import work.pollochang.particles.image.core.PixelAccessor;
import work.pollochang.particles.image.core.Rgba;

import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ExecutorService;

/**
 * 一次取樣呼叫的全部輸入。
 *
 * @param accessor       唯讀像素存取器
 * @param targetCount    目標數量
 * @param params         取樣參數
 * @param dominantColors 代表色，可為空
 * @param token          取消旗標
 * @param random         隨機來源，只在呼叫端執行緒上使用
 * @param workers        可用的執行緒池，為 null 時不做執行緒平行
 * @param parallelism    可使用的工作執行緒數量
 */
@With
public record SamplingRequest(
        PixelAccessor accessor,
        int targetCount,
        SamplingParams params,
        List<Rgba> dominantColors,
        CancellationToken token,
        Random random,
        ExecutorService workers,
        int parallelism
) {

    public SamplingRequest {
        Objects.requireNonNull(accessor, "accessor must not be null");
        Objects.requireNonNull(params, "params must not be null");
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(random, "random must not be null");
        dominantColors = dominantColors == null ? List.of() : List.copyOf(dominantColors);
    }

    public static SamplingRequest of(PixelAccessor accessor, int targetCount, SamplingParams params) {
        return new SamplingRequest(accessor, targetCount, params, List.of(), CancellationToken.NONE,
                new Random(), null, 1);
    }
}
