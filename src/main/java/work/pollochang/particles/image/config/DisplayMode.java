package work.pollochang.particles.image.config;

public enum DisplayMode {
    /** 等比縮放，完整顯示圖片 */
    FIT,
    /** 等比縮放，填滿畫面 (可能裁切) */
    FILL,
    /** 非等比縮放至畫面大小 */
    STRETCH,
    /** 原尺寸置中 */
    CENTER
}
