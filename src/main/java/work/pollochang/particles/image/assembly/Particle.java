package work.pollochang.particles.image.assembly;

import work.pollochang.particles.image.core.Rgba;

/**
 * 輸出粒子。{@code x}、{@code y} 為正規化裝置座標 (-1..1，y 軸向上)，{@code size} 以畫面像素為單位。
 */
public record Particle(float x, float y, Rgba color, float size) {}
