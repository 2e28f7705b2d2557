package work.pollochang.particles.image.core;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * 對解碼後圖片原始像素緩衝區的唯讀存取。
 * <p>
 * 位元組順序在建構時決定一次，之後每次讀取都套用相同的通道排列。
 * 物件建立後不再變動，可安全地在多個取樣執行緒之間共用。
 * <ul>
 *     <li>{@link BufferedImage#TYPE_INT_ARGB} 等 packed int 圖片 → {@link PixelByteOrder#ARGB}</li>
 *     <li>{@link BufferedImage#TYPE_4BYTE_ABGR} → {@link PixelByteOrder#RGBA} (依 band 順序取出)</li>
 *     <li>其他類型 → 透過 {@code getRGB} 轉為 little-endian 的 {@link PixelByteOrder#BGRA}</li>
 * </ul>
 *
 * @author PolloChang
 * @since 0.1.0
 */
public final class PixelAccessor {

    private static final int BYTES_PER_PIXEL = 4;

    private final byte[] data;
    private final int width;
    private final int height;
    private final int bytesPerRow;
    private final PixelByteOrder byteOrder;

    /**
     * 以既有的原始緩衝區建立存取器。
     *
     * @param data        像素資料，每個像素 4 個位元組
     * @param width       寬度 (像素)
     * @param height      高度 (像素)
     * @param bytesPerRow 每列的位元組數，至少為 {@code width * 4}
     * @param byteOrder   緩衝區的位元組順序
     * @throws GenerationException 寬或高為 0，或緩衝區大小不足時拋出 {@link GenerationError#INVALID_IMAGE}
     */
    public PixelAccessor(byte[] data, int width, int height, int bytesPerRow, PixelByteOrder byteOrder)
            throws GenerationException {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(byteOrder, "byteOrder must not be null");
        if (width <= 0 || height <= 0) {
            throw new GenerationException(GenerationError.INVALID_IMAGE,
                    "圖片尺寸無效: " + width + "x" + height);
        }
        if (bytesPerRow < width * BYTES_PER_PIXEL) {
            throw new GenerationException(GenerationError.INVALID_IMAGE,
                    "每列位元組數 " + bytesPerRow + " 小於寬度所需的 " + width * BYTES_PER_PIXEL);
        }
        long required = (long) bytesPerRow * (height - 1) + (long) width * BYTES_PER_PIXEL;
        if (data.length < required) {
            throw new GenerationException(GenerationError.INVALID_IMAGE,
                    "像素緩衝區大小 " + data.length + " 不足，至少需要 " + required);
        }
        this.data = data;
        this.width = width;
        this.height = height;
        this.bytesPerRow = bytesPerRow;
        this.byteOrder = byteOrder;
    }

    /**
     * 從 {@link BufferedImage} 複製像素並決定位元組順序。
     *
     * @param image 已解碼的圖片
     * @return 新的存取器
     * @throws GenerationException 圖片尺寸為 0 時拋出
     */
    public static PixelAccessor fromImage(BufferedImage image) throws GenerationException {
        Objects.requireNonNull(image, "image must not be null");
        int w = image.getWidth();
        int h = image.getHeight();
        if (w <= 0 || h <= 0) {
            throw new GenerationException(GenerationError.INVALID_IMAGE, "圖片尺寸無效: " + w + "x" + h);
        }

        switch (image.getType()) {
            case BufferedImage.TYPE_INT_ARGB:
            case BufferedImage.TYPE_INT_ARGB_PRE:
            case BufferedImage.TYPE_INT_RGB: {
                int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
                byte[] bytes = new byte[argb.length * BYTES_PER_PIXEL];
                for (int i = 0; i < argb.length; i++) {
                    int p = argb[i];
                    int o = i * BYTES_PER_PIXEL;
                    bytes[o] = (byte) (p >>> 24);
                    bytes[o + 1] = (byte) (p >>> 16);
                    bytes[o + 2] = (byte) (p >>> 8);
                    bytes[o + 3] = (byte) p;
                }
                return new PixelAccessor(bytes, w, h, w * BYTES_PER_PIXEL, PixelByteOrder.ARGB);
            }
            case BufferedImage.TYPE_4BYTE_ABGR: {
                // getDataElements 依 band 順序 (R, G, B, A) 回傳，與記憶體中的 ABGR 排列無關
                byte[] bytes = (byte[]) image.getRaster().getDataElements(0, 0, w, h, null);
                return new PixelAccessor(bytes, w, h, w * BYTES_PER_PIXEL, PixelByteOrder.RGBA);
            }
            default: {
                int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
                byte[] bytes = new byte[argb.length * BYTES_PER_PIXEL];
                for (int i = 0; i < argb.length; i++) {
                    int p = argb[i];
                    int o = i * BYTES_PER_PIXEL;
                    bytes[o] = (byte) p;
                    bytes[o + 1] = (byte) (p >>> 8);
                    bytes[o + 2] = (byte) (p >>> 16);
                    bytes[o + 3] = (byte) (p >>> 24);
                }
                return new PixelAccessor(bytes, w, h, w * BYTES_PER_PIXEL, PixelByteOrder.BGRA);
            }
        }
    }

    /**
     * 讀取指定像素的顏色。越界座標回傳 {@link Rgba#OPAQUE_BLACK}。
     */
    public Rgba colorAt(int x, int y) {
        if (!contains(x, y)) {
            return Rgba.OPAQUE_BLACK;
        }
        int o = y * bytesPerRow + x * BYTES_PER_PIXEL;
        return Rgba.of(
                data[o + byteOrder.redOffset()] & 0xff,
                data[o + byteOrder.greenOffset()] & 0xff,
                data[o + byteOrder.blueOffset()] & 0xff,
                data[o + byteOrder.alphaOffset()] & 0xff);
    }

    public float alphaAt(int x, int y) {
        if (!contains(x, y)) {
            return 1f;
        }
        return (data[y * bytesPerRow + x * BYTES_PER_PIXEL + byteOrder.alphaOffset()] & 0xff) / 255f;
    }

    public Sample sampleAt(int x, int y) {
        return new Sample(x, y, colorAt(x, y));
    }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int totalPixels() {
        return width * height;
    }

    public PixelByteOrder byteOrder() {
        return byteOrder;
    }
}
