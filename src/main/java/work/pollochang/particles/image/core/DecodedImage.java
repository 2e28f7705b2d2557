package work.pollochang.particles.image.core;

import javax.imageio.ImageReader;
import java.awt.image.BufferedImage;

/**
 * 解碼後的圖片與其讀取器。關閉時釋放兩者。
 *
 * @param subsampling 解碼時每軸的降採樣倍數，1 表示原尺寸
 */
public record DecodedImage(BufferedImage image, ImageReader reader, int subsampling) implements AutoCloseable {

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }

    public boolean downsampled() {
        return subsampling > 1;
    }

    @Override
    public void close() {
        image.flush();
        if (reader != null) {
            reader.dispose();
        }
    }
}
