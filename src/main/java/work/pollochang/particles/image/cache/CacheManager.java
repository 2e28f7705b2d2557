package work.pollochang.particles.image.cache;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.particles.image.core.GenerationError;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.Sample;
import work.pollochang.particles.image.tools.CacheTools;
import work.pollochang.particles.image.tools.FileTools;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 有容量上限、以 LRU 淘汰的取樣結果快取。
 * <p>
 * 索引 (key → {@link CacheEntry}) 是磁碟內容的唯一依據。{@link #put} 在寫入前先淘汰
 * {@code lastAccessed} 最舊的項目，直到寫入後的總大小不超過上限；{@link #get} 命中時更新
 * {@code lastAccessed}。所有會修改索引或 payload 的操作都持有寫入鎖，唯讀查詢使用讀取鎖。
 * <p>
 * 寫入失敗只記錄警告並回傳 {@code false}，不影響產生流程。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class CacheManager implements AutoCloseable {

    public static final long DEFAULT_MAX_SIZE = 100L * 1024 * 1024;

    private final CacheStore store;
    private final long maxSizeBytes;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, CacheEntry> index;
    private long totalSize;

    public CacheManager(CacheStore store, long maxSizeBytes, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (maxSizeBytes <= 0) {
            throw new IllegalArgumentException("maxSizeBytes must be positive: " + maxSizeBytes);
        }
        this.maxSizeBytes = maxSizeBytes;
        this.index = loadIndex(store);
        this.totalSize = index.values().stream().mapToLong(CacheEntry::sizeBytes).sum();
        log.info("快取初始化完成 {} (項目 {}, 已用 {} / 上限 {})", store.describe(), index.size(),
                FileTools.formatFileSize(totalSize), FileTools.formatFileSize(maxSizeBytes));
    }

    /**
     * 在目錄中開啟檔案快取。
     *
     * @throws GenerationException 無法建立快取目錄時拋出 {@link GenerationError#CACHE_CREATION_FAILED}
     */
    public static CacheManager open(Path directory, long maxSizeBytes) throws GenerationException {
        try {
            return new CacheManager(new FileCacheStore(directory), maxSizeBytes, Clock.systemUTC());
        } catch (RuntimeException e) {
            throw new GenerationException(GenerationError.CACHE_CREATION_FAILED, "無法建立快取目錄: " + directory, e);
        }
    }

    /**
     * 開啟 H2 快取。
     *
     * @throws GenerationException 無法連線或建立資料表時拋出 {@link GenerationError#CACHE_CREATION_FAILED}
     */
    public static CacheManager openH2(Path dbPath, long maxSizeBytes, boolean autoServer) throws GenerationException {
        try {
            Path parent = dbPath.toAbsolutePath().getParent();
            if (parent != null) {
                FileTools.ensureDirectoryExists(parent);
            }
            return new CacheManager(new H2CacheStore(dbPath, autoServer), maxSizeBytes, Clock.systemUTC());
        } catch (RuntimeException e) {
            throw new GenerationException(GenerationError.CACHE_CREATION_FAILED, "無法建立 H2 快取: " + dbPath, e);
        }
    }

    private static Map<String, CacheEntry> loadIndex(CacheStore store) {
        try {
            return new LinkedHashMap<>(store.loadIndex());
        } catch (IOException e) {
            log.warn("讀取快取索引 {} 失敗，將使用新的空快取。", store.describe(), e);
            return new LinkedHashMap<>();
        }
    }

    /**
     * 讀取快取。命中時更新最後存取時間；payload 遺失或損毀時移除該項目並視為未命中。
     */
    public Optional<List<Sample>> get(String key) {
        Objects.requireNonNull(key, "key must not be null");
        lock.writeLock().lock();
        try {
            CacheEntry entry = index.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            List<Sample> samples;
            try {
                samples = SampleCodec.decode(store.readPayload(entry.fileName()));
            } catch (IOException e) {
                log.warn("{} - 快取內容遺失或損毀，移除該項目", key, e);
                removeEntry(entry);
                persistIndex();
                return Optional.empty();
            }
            index.put(key, entry.touchedAt(clock.millis()));
            persistIndex();
            log.debug("{} - 快取命中 ({} 個點)", key, samples.size());
            return Optional.of(samples);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 寫入快取。同一個 key 的舊項目會先被取代；必要時先以 LRU 淘汰舊項目。
     *
     * @return 成功寫入時為 true
     */
    public boolean put(String key, List<Sample> samples) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(samples, "samples must not be null");
        byte[] payload;
        try {
            payload = SampleCodec.encode(samples);
        } catch (IOException e) {
            log.warn("{} - 無法序列化取樣結果，略過快取", key, e);
            return false;
        }
        if (payload.length > maxSizeBytes) {
            log.warn("{} - 內容大小 {} 超過快取上限 {}，略過快取", key,
                    FileTools.formatFileSize(payload.length), FileTools.formatFileSize(maxSizeBytes));
            return false;
        }

        lock.writeLock().lock();
        try {
            CacheEntry existing = index.get(key);
            if (existing != null) {
                removeEntry(existing);
            }
            evictFor(payload.length);

            String fileName = CacheTools.payloadFileName(key);
            try {
                store.writePayload(fileName, payload);
            } catch (IOException e) {
                log.warn("{} - 寫入快取內容失敗", key, e);
                persistIndex();
                return false;
            }
            long now = clock.millis();
            index.put(key, new CacheEntry(key, fileName, payload.length, now, now));
            totalSize += payload.length;
            persistIndex();
            log.debug("{} - 已寫入快取 ({}, 總計 {})", key,
                    FileTools.formatFileSize(payload.length), FileTools.formatFileSize(totalSize));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** 刪除所有快取項目與 payload。 */
    public void clear() {
        lock.writeLock().lock();
        try {
            store.deleteAll();
            index.clear();
            totalSize = 0;
            log.info("{} - 快取已清除", store.describe());
        } catch (IOException e) {
            log.warn("{} - 清除快取失敗", store.describe(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean contains(String key) {
        lock.readLock().lock();
        try {
            return index.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** 目前所有 payload 的總位元組數 */
    public long size() {
        lock.readLock().lock();
        try {
            return totalSize;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int count() {
        lock.readLock().lock();
        try {
            return index.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long maxSizeBytes() {
        return maxSizeBytes;
    }

    /** 目前索引的快照 */
    public List<CacheEntry> entries() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(index.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    // 以下方法必須在持有寫入鎖時呼叫

    private void evictFor(long incoming) {
        if (totalSize + incoming <= maxSizeBytes) {
            return;
        }
        List<CacheEntry> byAge = new ArrayList<>(index.values());
        byAge.sort(Comparator.comparingLong(CacheEntry::lastAccessed));
        int evicted = 0;
        for (CacheEntry entry : byAge) {
            if (totalSize + incoming <= maxSizeBytes) {
                break;
            }
            removeEntry(entry);
            evicted++;
        }
        log.debug("LRU 淘汰 {} 個項目，目前總計 {}", evicted, FileTools.formatFileSize(totalSize));
    }

    private void removeEntry(CacheEntry entry) {
        index.remove(entry.key());
        totalSize -= entry.sizeBytes();
        try {
            store.deletePayload(entry.fileName());
        } catch (IOException e) {
            log.warn("{} - 刪除快取內容 {} 失敗", entry.key(), entry.fileName(), e);
        }
    }

    private void persistIndex() {
        try {
            store.saveIndex(index);
        } catch (IOException e) {
            log.warn("{} - 儲存快取索引失敗", store.describe(), e);
        }
    }

    @Override
    public void close() {
        store.close();
    }
}
