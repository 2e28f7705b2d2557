package work.pollochang.particles.image;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * 產生測試用影像
 */
public final class TestImages {

    private TestImages() {}

    public static BufferedImage solid(int width, int height, Color color) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setPaint(color);
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        return image;
    }

    /** 左半黑、右半白 */
    public static BufferedImage halfBlackHalfWhite(int width, int height) {
        BufferedImage image = solid(width, height, Color.BLACK);
        Graphics2D g = image.createGraphics();
        try {
            g.setPaint(Color.WHITE);
            g.fillRect(width / 2, 0, width - width / 2, height);
        } finally {
            g.dispose();
        }
        return image;
    }

    /** 每隔 {@code cell} 像素交替黑白的棋盤格 */
    public static BufferedImage checkerboard(int width, int height, int cell) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                boolean dark = ((x / cell) + (y / cell)) % 2 == 0;
                image.setRGB(x, y, dark ? 0xff202020 : 0xffe0c040);
            }
        }
        return image;
    }
}
