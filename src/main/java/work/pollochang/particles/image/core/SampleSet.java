package work.pollochang.particles.image.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 依加入順序保存取樣點，並拒絕重複的 (x, y)。加入、查詢與移除皆為 O(1)。非執行緒安全。
 */
public final class SampleSet {

    private final Map<Long, Sample> samples;

    public SampleSet() {
        this(16);
    }

    public SampleSet(int expectedSize) {
        this.samples = new LinkedHashMap<>(Math.max(16, expectedSize * 2));
    }

    /** @return 位置尚未出現過而成功加入時為 true */
    public boolean add(Sample sample) {
        return samples.putIfAbsent(sample.positionKey(), sample) == null;
    }

    public boolean contains(int x, int y) {
        return samples.containsKey(Sample.positionKey(x, y));
    }

    /** 移除指定位置的取樣點，保持其餘順序不變。 */
    public boolean remove(Sample sample) {
        return samples.remove(sample.positionKey()) != null;
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    /** 加入順序的快照 */
    public List<Sample> toList() {
        return new ArrayList<>(samples.values());
    }
}
