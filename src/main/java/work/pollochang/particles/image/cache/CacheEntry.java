package work.pollochang.particles.image.cache;

/**
 * 快取索引中的一筆紀錄。時間皆為 epoch 毫秒。
 */
public record CacheEntry(String key, String fileName, long sizeBytes, long createdAt, long lastAccessed) {

    public CacheEntry touchedAt(long timestamp) {
        return new CacheEntry(key, fileName, sizeBytes, createdAt, timestamp);
    }
}
