package work.pollochang.particles.image.analysis;

import work.pollochang.particles.image.core.Rgba;

/**
 * 圖片中的代表色，{@code share} 為其在不透明取樣點中所佔比例。
 */
public record DominantColor(Rgba color, float share) {}
