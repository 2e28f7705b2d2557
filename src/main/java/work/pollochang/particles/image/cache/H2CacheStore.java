package work.pollochang.particles.image.cache;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * H2 快取儲存層。
 * 將快取索引與 payload 存放在同一個內嵌 H2 資料庫中，所有寫入都在交易內完成。
 */
@Slf4j
public class H2CacheStore implements CacheStore {

    private final Connection connection;
    private final String dbPath;

    // 使用 MERGE 陳述式來實現 "upsert" (update or insert) 功能
    private static final String MERGE_PAYLOAD_SQL = "MERGE INTO CACHE_PAYLOAD (FILE_NAME, PAYLOAD) KEY(FILE_NAME) VALUES (?, ?)";
    private static final String INSERT_INDEX_SQL = "INSERT INTO CACHE_INDEX " +
            "(CACHE_KEY, FILE_NAME, SIZE_BYTES, CREATED_AT, LAST_ACCESSED, ENTRY_ORDER) VALUES (?, ?, ?, ?, ?, ?)";
    private static final int MAX_BATCH_SIZE = 1000;

    /**
     * 建構子，連線並初始化資料表。
     * @param dbPath     H2 資料庫檔案的路徑
     * @param autoServer 是否允許多個進程同時存取同一個資料庫
     * @throws RuntimeException 無法建立連線或初始化資料表時
     */
    public H2CacheStore(Path dbPath, boolean autoServer) {
        // 移除 .mv.db 副檔名 (如果有的話)，因為 JDBC URL 不需要
        String pathStr = dbPath.toAbsolutePath().toString().replace(".mv.db", "");
        this.dbPath = pathStr;
        String jdbcUrl = autoServer
                ? String.format("jdbc:h2:%s;AUTO_SERVER=TRUE", pathStr)
                : String.format("jdbc:h2:%s", pathStr);
        try {
            this.connection = DriverManager.getConnection(jdbcUrl, "sa", "");
            log.info("成功連線至 H2 資料庫: {}", dbPath);
        } catch (SQLException e) {
            throw new RuntimeException("無法建立 H2 資料庫連線: " + jdbcUrl, e);
        }
        initSchema();
    }

    /**
     * 初始化資料庫，如果資料表不存在，則建立它。
     */
    private void initSchema() {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS CACHE_INDEX (" +
                    "CACHE_KEY VARCHAR(1024) PRIMARY KEY, " +
                    "FILE_NAME VARCHAR(128) NOT NULL, " +
                    "SIZE_BYTES BIGINT NOT NULL, " +
                    "CREATED_AT BIGINT NOT NULL, " +
                    "LAST_ACCESSED BIGINT NOT NULL, " +
                    "ENTRY_ORDER INT NOT NULL" +
                    ")");
            stmt.execute("CREATE TABLE IF NOT EXISTS CACHE_PAYLOAD (" +
                    "FILE_NAME VARCHAR(128) PRIMARY KEY, " +
                    "PAYLOAD BLOB NOT NULL" +
                    ")");
            log.info("H2 資料表 'CACHE_INDEX' 與 'CACHE_PAYLOAD' 已確認存在。");
        } catch (SQLException e) {
            close();
            throw new RuntimeException("無法初始化 H2 資料庫 Schema", e);
        }
    }

    @Override
    public Map<String, CacheEntry> loadIndex() throws IOException {
        Map<String, CacheEntry> index = new LinkedHashMap<>();
        String selectSql = "SELECT CACHE_KEY, FILE_NAME, SIZE_BYTES, CREATED_AT, LAST_ACCESSED " +
                "FROM CACHE_INDEX ORDER BY ENTRY_ORDER";
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(selectSql)) {
            while (rs.next()) {
                CacheEntry entry = new CacheEntry(
                        rs.getString("CACHE_KEY"),
                        rs.getString("FILE_NAME"),
                        rs.getLong("SIZE_BYTES"),
                        rs.getLong("CREATED_AT"),
                        rs.getLong("LAST_ACCESSED"));
                index.put(entry.key(), entry);
            }
        } catch (SQLException e) {
            throw new IOException("從 H2 載入快取索引時發生錯誤", e);
        }
        log.info("從 H2 資料庫成功載入 {} 筆快取紀錄。", index.size());
        return index;
    }

    /**
     * 以整批取代的方式寫回索引。使用批次處理並在單一交易內完成，失敗時回滾。
     */
    @Override
    public void saveIndex(Map<String, CacheEntry> index) throws IOException {
        inTransaction(() -> {
            try (Statement delete = connection.createStatement();
                 PreparedStatement ps = connection.prepareStatement(INSERT_INDEX_SQL)) {
                delete.executeUpdate("DELETE FROM CACHE_INDEX");
                int batchSize = 0;
                for (CacheEntry entry : index.values()) {
                    ps.setString(1, entry.key());
                    ps.setString(2, entry.fileName());
                    ps.setLong(3, entry.sizeBytes());
                    ps.setLong(4, entry.createdAt());
                    ps.setLong(5, entry.lastAccessed());
                    ps.setInt(6, batchSize);
                    ps.addBatch();
                    batchSize++;
                    if (batchSize % MAX_BATCH_SIZE == 0) {
                        ps.executeBatch();
                        log.debug("已提交 {} 筆索引紀錄至 H2...", batchSize);
                    }
                }
                // 執行剩餘的批次
                if (batchSize % MAX_BATCH_SIZE != 0) {
                    ps.executeBatch();
                }
            }
        });
    }

    @Override
    public void writePayload(String fileName, byte[] payload) throws IOException {
        inTransaction(() -> {
            try (PreparedStatement ps = connection.prepareStatement(MERGE_PAYLOAD_SQL)) {
                ps.setString(1, fileName);
                ps.setBytes(2, payload);
                ps.executeUpdate();
            }
        });
    }

    @Override
    public byte[] readPayload(String fileName) throws IOException {
        try (PreparedStatement ps = connection.prepareStatement("SELECT PAYLOAD FROM CACHE_PAYLOAD WHERE FILE_NAME = ?")) {
            ps.setString(1, fileName);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new NoSuchFileException(fileName);
                }
                return rs.getBytes(1);
            }
        } catch (SQLException e) {
            throw new IOException("從 H2 讀取快取內容失敗: " + fileName, e);
        }
    }

    @Override
    public void deletePayload(String fileName) throws IOException {
        inTransaction(() -> {
            try (PreparedStatement ps = connection.prepareStatement("DELETE FROM CACHE_PAYLOAD WHERE FILE_NAME = ?")) {
                ps.setString(1, fileName);
                ps.executeUpdate();
            }
        });
    }

    @Override
    public void deleteAll() throws IOException {
        inTransaction(() -> {
            try (Statement stmt = connection.createStatement()) {
                stmt.executeUpdate("DELETE FROM CACHE_PAYLOAD");
                stmt.executeUpdate("DELETE FROM CACHE_INDEX");
            }
        });
        log.info("{} - 已清除 H2 快取資料", dbPath);
    }

    @Override
    public String describe() {
        return "h2:" + dbPath;
    }

    private void inTransaction(SqlWork work) throws IOException {
        try {
            // 關閉自動提交，手動管理交易
            connection.setAutoCommit(false);
            work.run();
            connection.commit();
        } catch (SQLException e) {
            try {
                connection.rollback(); // 如果出錯，則回滾交易
                log.warn("H2 交易已回滾。");
            } catch (SQLException ex) {
                log.error("回滾 H2 交易失敗", ex);
            }
            throw new IOException("H2 快取寫入失敗", e);
        } finally {
            try {
                connection.setAutoCommit(true); // 恢復自動提交模式
            } catch (SQLException e) {
                log.error("無法恢復 H2 連線的自動提交模式", e);
            }
        }
    }

    @FunctionalInterface
    private interface SqlWork {
        void run() throws SQLException;
    }

    /**
     * 關閉資料庫連線，釋放資源。
     */
    @Override
    public void close() {
        if (connection != null) {
            try {
                log.info("正在關閉 H2 資料庫連線...");
                connection.close();
                log.info("H2 資料庫連線已關閉。");
            } catch (SQLException e) {
                log.error("關閉 H2 資料庫連線時發生錯誤。", e);
            }
        }
    }
}
