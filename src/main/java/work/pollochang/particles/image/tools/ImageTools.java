package work.pollochang.particles.image.tools;

import java.awt.*;
import java.awt.image.BufferedImage;

public class ImageTools {

    /**
     * 若圖片最長邊超過 {@code maxDimension}，等比縮小到剛好等於上限；否則原樣回傳。
     */
    public static BufferedImage downscaleToMaxDimension(BufferedImage image, int maxDimension) {
        int maxDim = Math.max(image.getWidth(), image.getHeight());
        if (maxDim <= maxDimension) {
            return image;
        }
        return resizeImage(image, (double) maxDimension / maxDim);
    }

    public static BufferedImage resizeImage(BufferedImage originalImage, double scale) {
        int newWidth = Math.max(1, (int) Math.round(originalImage.getWidth() * scale));
        int newHeight = Math.max(1, (int) Math.round(originalImage.getHeight() * scale));

        // 原圖有 Alpha 通道時保留，供取樣時判斷透明像素
        int imageType = originalImage.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;

        BufferedImage resizedImage = new BufferedImage(newWidth, newHeight, imageType);
        Graphics2D g2d = resizedImage.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2d.drawImage(originalImage, 0, 0, newWidth, newHeight, null);
        } finally {
            g2d.dispose();
        }
        return resizedImage;
    }
}
