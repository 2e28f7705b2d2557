package work.pollochang.particles.image.assembly;

/**
 * 目的畫面尺寸 (像素)。
 */
public record Viewport(int width, int height) {

    public static Viewport ofImage(int imageWidth, int imageHeight) {
        return new Viewport(imageWidth, imageHeight);
    }
}
