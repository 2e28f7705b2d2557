package work.pollochang.particles.image.core;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.spi.IIORegistry;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * 圖片解碼工具類
 */
@Slf4j
public final class ImageDecoding {

    /** 解碼時最長邊的目標上限，超過時以二次取樣讀取 */
    public static final int PREFERRED_MAX_DIM = 4096;

    // 註冊 ImageIO 外掛程式，禁用磁碟快取，強制使用記憶體操作，避免 I/O 瓶頸。
    static {
        IIORegistry.getDefaultInstance().registerApplicationClasspathSpis();
        ImageIO.setUseCache(false);
    }

    private ImageDecoding() {}

    /**
     * 解碼圖片檔案，必要時以二次取樣降低記憶體使用。
     *
     * @param inputPath 圖片路徑
     * @return 解碼結果，呼叫端負責關閉
     * @throws IOException         讀取檔案失敗
     * @throws GenerationException 檔案不是支援的圖片格式，或尺寸為 0
     */
    public static DecodedImage decode(Path inputPath) throws IOException, GenerationException {
        if (!Files.exists(inputPath) || !Files.isReadable(inputPath)) {
            throw new GenerationException(GenerationError.INVALID_IMAGE, "檔案不存在或不可讀: " + inputPath);
        }

        try (InputStream raw = Files.newInputStream(inputPath);
             ImageInputStream in = ImageIO.createImageInputStream(raw)) {
            if (in == null) {
                throw new GenerationException(GenerationError.INVALID_IMAGE, "無法建立圖片輸入流: " + inputPath);
            }

            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new GenerationException(GenerationError.INVALID_IMAGE, "找不到對應的圖片讀取器: " + inputPath);
            }

            ImageReader reader = readers.next();
            reader.setInput(in, true, true);

            try {
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                if (width <= 0 || height <= 0) {
                    throw new GenerationException(GenerationError.INVALID_IMAGE,
                            "圖片尺寸無效: " + width + "x" + height);
                }

                ImageReadParam param = reader.getDefaultReadParam();
                int subsampling = 1;
                int maxDim = Math.max(width, height);
                if (maxDim > PREFERRED_MAX_DIM) {
                    // 確保取樣率是 2 的冪，對某些 JPG 解碼器更友好
                    subsampling = Integer.highestOneBit((int) Math.ceil((double) maxDim / PREFERRED_MAX_DIM));
                    if (maxDim / subsampling > PREFERRED_MAX_DIM) {
                        subsampling <<= 1;
                    }
                    log.debug("{} - 對圖片應用二次取樣，比率: {}", inputPath.getFileName(), subsampling);
                    param.setSourceSubsampling(subsampling, subsampling, 0, 0);
                }

                BufferedImage image = reader.read(0, param);
                log.debug("{} - 解碼完成 {}x{} (type={})", inputPath, image.getWidth(), image.getHeight(), image.getType());
                // reader 交由 DecodedImage 的 close 負責釋放
                return new DecodedImage(image, reader, subsampling);
            } catch (IOException | GenerationException | RuntimeException e) {
                reader.dispose();
                throw e;
            }
        }
    }
}
