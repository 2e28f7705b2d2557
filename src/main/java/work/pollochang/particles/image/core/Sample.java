package work.pollochang.particles.image.core;

/**
 * 從來源圖片取出的一個觀測點，座標為來源圖片的像素空間。
 */
public record Sample(int x, int y, Rgba color) {

    /** 將座標壓成單一 long，作為去重用的位置鍵。 */
    public long positionKey() {
        return positionKey(x, y);
    }

    public static long positionKey(int x, int y) {
        return ((long) x << 32) | (y & 0xffffffffL);
    }
}
