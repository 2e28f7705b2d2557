package work.pollochang.particles.image.cache;

import java.io.IOException;
import java.util.Map;

/**
 * 快取的持久化層：一份索引與每個項目一份 payload。
 * 實作不需要自行同步，{@link CacheManager} 保證同一時間只有一個寫入者。
 */
public interface CacheStore extends AutoCloseable {

    /** 讀取索引；索引不存在時回傳空 Map。回傳順序即為項目建立順序。 */
    Map<String, CacheEntry> loadIndex() throws IOException;

    void saveIndex(Map<String, CacheEntry> index) throws IOException;

    void writePayload(String fileName, byte[] payload) throws IOException;

    /** @throws java.nio.file.NoSuchFileException payload 不存在時 */
    byte[] readPayload(String fileName) throws IOException;

    void deletePayload(String fileName) throws IOException;

    /** 刪除所有 payload 與索引 */
    void deleteAll() throws IOException;

    String describe();

    @Override
    void close();
}
