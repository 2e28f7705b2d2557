package work.pollochang.particles.image.tools;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.text.DecimalFormat;

@Slf4j
public class FileTools {

    /**
     * 確保指定的目錄存在，如果不存在則建立它。
     * @param directoryPath 要檢查或建立的目錄路徑
     */
    public static void ensureDirectoryExists(Path directoryPath) {
        if (!Files.isDirectory(directoryPath)) {
            try {
                Files.createDirectories(directoryPath);
                log.info("{} - 目標目錄已建立", directoryPath);
            } catch (IOException e) {
                // 拋出 RuntimeException 使上層能夠捕獲並中止程式
                throw new RuntimeException("無法建立目錄: " + directoryPath, e);
            }
        } else {
            log.debug("{} - 目標目錄已存在", directoryPath);
        }
    }

    /**
     * 先寫入同目錄下的暫存檔再搬移到目標位置，讀取端不會看到寫到一半的檔案。
     * @param target 目標檔案
     * @param bytes  檔案內容
     * @throws IOException 寫入或搬移失敗
     */
    public static void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Path temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, bytes);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("{} - 檔案系統不支援原子搬移，改用一般搬移", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /** 去掉副檔名的檔名，例如 {@code photo.png} → {@code photo} */
    public static String baseName(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public static String formatFileSize(long size) {
        if (size <= 0) return "0 B";
        final String[] units = new String[]{"B", "KB", "MB", "GB", "TB"};
        int digitGroups = (int) (Math.log10(size) / Math.log10(1024));
        return new DecimalFormat("#,##0.#").format(size / Math.pow(1024, digitGroups)) + " " + units[digitGroups];
    }

}
