package work.pollochang.particles.image.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.particles.image.tools.CacheTools;
import work.pollochang.particles.image.tools.FileTools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 以目錄保存快取：{@value #INDEX_FILE} 為索引，每個項目一個 payload 檔案。
 */
@Slf4j
public class FileCacheStore implements CacheStore {

    public static final String INDEX_FILE = "cache_index.json";

    private final Path directory;
    private final ObjectMapper mapper;

    /**
     * @param directory 快取目錄，不存在時會建立
     * @throws RuntimeException 無法建立目錄時
     */
    public FileCacheStore(Path directory) {
        this.directory = directory;
        FileTools.ensureDirectoryExists(directory);
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT); // 讓 JSON 格式化，方便閱讀
    }

    @Override
    public Map<String, CacheEntry> loadIndex() throws IOException {
        Path indexPath = directory.resolve(INDEX_FILE);
        if (!Files.exists(indexPath)) {
            log.info("快取索引 {} 不存在，將建立新的空快取。", indexPath);
            return new LinkedHashMap<>();
        }
        // 使用 TypeReference 來讓 Jackson 知道要轉換成的 Map 型別
        Map<String, CacheEntry> index = mapper.readValue(indexPath.toFile(), new TypeReference<LinkedHashMap<String, CacheEntry>>() {});
        log.info("成功從 {} 讀取 {} 筆快取紀錄。", indexPath, index.size());
        return index;
    }

    @Override
    public void saveIndex(Map<String, CacheEntry> index) throws IOException {
        FileTools.writeAtomically(directory.resolve(INDEX_FILE), mapper.writeValueAsBytes(index));
    }

    @Override
    public void writePayload(String fileName, byte[] payload) throws IOException {
        FileTools.writeAtomically(directory.resolve(fileName), payload);
    }

    @Override
    public byte[] readPayload(String fileName) throws IOException {
        return Files.readAllBytes(directory.resolve(fileName));
    }

    @Override
    public void deletePayload(String fileName) throws IOException {
        Files.deleteIfExists(directory.resolve(fileName));
    }

    @Override
    public void deleteAll() throws IOException {
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                    .filter(p -> p.getFileName().toString().endsWith(CacheTools.PAYLOAD_SUFFIX)
                            || p.getFileName().toString().equals(INDEX_FILE))
                    .collect(Collectors.toList());
        }
        for (Path file : files) {
            Files.deleteIfExists(file);
        }
        log.info("{} - 已刪除 {} 個快取檔案", directory, files.size());
    }

    @Override
    public String describe() {
        return directory.toAbsolutePath().toString();
    }

    @Override
    public void close() {
        log.debug("{} - 檔案快取已關閉", directory);
    }
}
