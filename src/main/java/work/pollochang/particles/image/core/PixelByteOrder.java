package work.pollochang.particles.image.core;

/**
 * 原始像素緩衝區中每個像素 4 個位元組的排列方式。
 * 每個常數記錄 R、G、B、A 各自所在的位元組位移。
 */
public enum PixelByteOrder {
    RGBA(0, 1, 2, 3),
    BGRA(2, 1, 0, 3),
    ARGB(1, 2, 3, 0);

    private final int redOffset;
    private final int greenOffset;
    private final int blueOffset;
    private final int alphaOffset;

    PixelByteOrder(int redOffset, int greenOffset, int blueOffset, int alphaOffset) {
        this.redOffset = redOffset;
        this.greenOffset = greenOffset;
        this.blueOffset = blueOffset;
        this.alphaOffset = alphaOffset;
    }

    public int redOffset() { return redOffset; }
    public int greenOffset() { return greenOffset; }
    public int blueOffset() { return blueOffset; }
    public int alphaOffset() { return alphaOffset; }
}
