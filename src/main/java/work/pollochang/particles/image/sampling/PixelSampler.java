package work.pollochang.particles.image.sampling;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.particles.image.config.AdvancedAlgorithm;
import work.pollochang.particles.image.config.GenerationConfig;
import work.pollochang.particles.image.config.SamplingStrategyType;
import work.pollochang.particles.image.core.GenerationError;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.PixelAccessor;
import work.pollochang.particles.image.core.Sample;
import work.pollochang.particles.image.core.SampleSet;
import work.pollochang.particles.image.sampling.advanced.BlueNoiseSampling;
import work.pollochang.particles.image.sampling.advanced.HashBasedSampling;
import work.pollochang.particles.image.sampling.advanced.StratifiedBandSampling;
import work.pollochang.particles.image.sampling.advanced.VanDerCorputSampling;
import work.pollochang.particles.image.validation.ArtifactPreventionValidator;

import java.util.List;
import java.util.Objects;

/**
 * 取樣階段的入口：依設定選擇策略，執行分布檢查，並保證輸出數量。
 * <p>
 * 輸出保證：
 * <ul>
 *     <li>目標數量小於總像素時，恰好回傳目標數量個不重複的點</li>
 *     <li>目標數量大於等於總像素時，依掃描順序回傳每個像素恰好一次</li>
 *     <li>所有座標都在圖片範圍內</li>
 * </ul>
 * 策略不足的部分先以有限次數的隨機補點、再以掃描順序補齊；
 * 策略完全沒有產生任何點時視為 {@link GenerationError#INSUFFICIENT_SAMPLES}。
 * 重要度取樣預設不經過分布檢查，除非設定了 {@code validateImportance}。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class PixelSampler {

    private final ArtifactPreventionValidator validator;

    public PixelSampler() {
        this(new ArtifactPreventionValidator());
    }

    public PixelSampler(ArtifactPreventionValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    public static SamplingStrategy strategyFor(GenerationConfig config) {
        switch (config.samplingStrategy()) {
            case UNIFORM:
                return new UniformSampling();
            case IMPORTANCE:
                return new ImportanceSampling();
            case ADAPTIVE:
                return new AdaptiveSampling();
            case HYBRID:
                return new HybridSampling();
            case ADVANCED:
                return advanced(config.advancedAlgorithm());
            default:
                throw new IllegalArgumentException("未知的取樣策略: " + config.samplingStrategy());
        }
    }

    static SamplingStrategy advanced(AdvancedAlgorithm algorithm) {
        switch (algorithm) {
            case BLUE_NOISE:
                return new BlueNoiseSampling();
            case VAN_DER_CORPUT:
                return new VanDerCorputSampling();
            case HASH_BASED:
                return new HashBasedSampling();
            case UNIFORM:
                return new StratifiedBandSampling(false);
            case ADAPTIVE:
                return new StratifiedBandSampling(true);
            default:
                throw new IllegalArgumentException("未知的進階演算法: " + algorithm);
        }
    }

    public List<Sample> sample(SamplingRequest request, GenerationConfig config) throws GenerationException {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(config, "config must not be null");
        PixelAccessor accessor = request.accessor();
        int target = request.targetCount();
        if (target <= 0) {
            throw new GenerationException(GenerationError.INVALID_CONFIGURATION, "目標取樣數量必須大於 0: " + target);
        }

        if (target >= accessor.totalPixels()) {
            log.debug("目標數量 {} 不小於總像素 {}，回傳全部像素", target, accessor.totalPixels());
            return SampleFill.allPixels(accessor);
        }

        SamplingStrategy strategy = strategyFor(config);
        long start = System.nanoTime();
        List<Sample> raw = strategy.sample(request);
        request.token().throwIfCancelled();
        if (raw.isEmpty()) {
            throw new GenerationException(GenerationError.INSUFFICIENT_SAMPLES,
                    "取樣策略 " + strategy.name() + " 沒有產生任何可用的點");
        }

        boolean validate = config.samplingStrategy() != SamplingStrategyType.IMPORTANCE || config.validateImportance();
        List<Sample> checked = validate
                ? validator.validateAndCorrect(raw, accessor, target, request.random(), request.token())
                : raw;

        SampleSet set = new SampleSet(target);
        for (Sample s : checked) {
            if (set.size() >= target) {
                break;
            }
            if (accessor.contains(s.x(), s.y())) {
                set.add(s);
            }
        }

        int missing = target - set.size();
        if (missing > 0) {
            int random = SampleFill.randomFill(accessor, set, missing, request.random(), request.token());
            int scanned = SampleFill.scanFill(accessor, set, target - set.size());
            log.debug("{} - 取樣不足 {} 個，隨機補 {} 個，掃描補 {} 個", strategy.name(), missing, random, scanned);
        }

        List<Sample> result = set.toList();
        if (result.size() != target) {
            throw new GenerationException(GenerationError.INSUFFICIENT_SAMPLES,
                    "取樣數量 " + result.size() + " 與目標 " + target + " 不一致");
        }
        log.debug("{} - 取樣完成 {} 個點 (原始 {}, 檢查 {}), 耗時 {} ms", strategy.name(), result.size(), raw.size(),
                validate, (System.nanoTime() - start) / 1_000_000);
        return result;
    }
}
