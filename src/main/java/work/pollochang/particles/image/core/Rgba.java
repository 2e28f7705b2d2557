package work.pollochang.particles.image.core;

/**
 * 正規化到 [0,1] 的 RGBA 顏色 (未預乘 alpha)。
 */
public record Rgba(float r, float g, float b, float a) {

    /** 越界讀取時回傳的顏色 */
    public static final Rgba OPAQUE_BLACK = new Rgba(0f, 0f, 0f, 1f);

    public static Rgba of(int r8, int g8, int b8, int a8) {
        return new Rgba(r8 / 255f, g8 / 255f, b8 / 255f, a8 / 255f);
    }

    public float brightness() {
        return (r + g + b) / 3f;
    }

    /** 通道最大值與最小值的差，作為飽和度。 */
    public float channelSpread() {
        return Math.max(r, Math.max(g, b)) - Math.min(r, Math.min(g, b));
    }

    /** Rec. 601 亮度 */
    public float luminance() {
        return 0.299f * r + 0.587f * g + 0.114f * b;
    }

    public float rgbDistance(Rgba other) {
        float dr = r - other.r;
        float dg = g - other.g;
        float db = b - other.b;
        return (float) Math.sqrt(dr * dr + dg * dg + db * db);
    }
}
