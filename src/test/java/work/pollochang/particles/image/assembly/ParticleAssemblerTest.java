package work.pollochang.particles.image.assembly;

import org.junit.jupiter.api.Test;
import work.pollochang.particles.image.config.DisplayMode;
import work.pollochang.particles.image.config.GenerationConfig;
import work.pollochang.particles.image.core.GenerationError;
import work.pollochang.particles.image.core.GenerationException;
import work.pollochang.particles.image.core.Rgba;
import work.pollochang.particles.image.core.Sample;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParticleAssemblerTest {

    private static final float EPS = 1e-5f;
    private static final Rgba RED = new Rgba(1f, 0f, 0f, 1f);

    private final ParticleAssembler assembler = new ParticleAssembler();

    private static Sample at(int x, int y) {
        return new Sample(x, y, RED);
    }

    /**
     * FIT 模式：100x50 圖片放進 200x200 畫面，等比放大 2 倍並上下置中
     */
    @Test
    void testFit_ShouldLetterboxVertically() throws GenerationException {
        List<Particle> particles = assembler.assemble(List.of(at(0, 0)), 100, 50,
                new Viewport(200, 200), GenerationConfig.standard().withDisplayMode(DisplayMode.FIT));

        Particle p = particles.get(0);
        assertEquals(-0.99f, p.x(), EPS);
        assertEquals(0.49f, p.y(), EPS);
        assertEquals(RED, p.color());
        assertEquals(3f, p.size(), EPS);
    }

    /**
     * FILL 模式：放大 4 倍填滿畫面，左右兩側被裁切
     */
    @Test
    void testFill_ShouldCropHorizontally() throws GenerationException {
        List<Particle> particles = assembler.assemble(List.of(at(25, 0)), 100, 50,
                new Viewport(200, 200), GenerationConfig.standard().withDisplayMode(DisplayMode.FILL));

        assertEquals(-0.98f, particles.get(0).x(), EPS);
        assertEquals(0.98f, particles.get(0).y(), EPS);
    }

    @Test
    void testStretch_ShouldScaleAxesIndependently() throws GenerationException {
        List<Particle> particles = assembler.assemble(List.of(at(99, 49)), 100, 50,
                new Viewport(200, 200), GenerationConfig.standard().withDisplayMode(DisplayMode.STRETCH));

        assertEquals(0.99f, particles.get(0).x(), EPS);
        assertEquals(-0.98f, particles.get(0).y(), EPS);
    }

    /**
     * CENTER 模式維持原尺寸，圖片中心落在畫面中心附近
     */
    @Test
    void testCenter_ShouldKeepOriginalScale() throws GenerationException {
        List<Particle> particles = assembler.assemble(List.of(at(50, 25)), 100, 50,
                new Viewport(200, 200), GenerationConfig.standard().withDisplayMode(DisplayMode.CENTER));

        assertEquals(0.005f, particles.get(0).x(), EPS);
        assertEquals(-0.005f, particles.get(0).y(), EPS);
        assertEquals(1.5f, particles.get(0).size(), EPS);
    }

    /**
     * 粒子大小限制在設定的上下限之間
     */
    @Test
    void testParticleSize_ShouldBeClamped() throws GenerationException {
        List<Particle> large = assembler.assemble(List.of(at(0, 0)), 100, 100,
                new Viewport(4000, 4000), GenerationConfig.ultra());
        List<Particle> small = assembler.assemble(List.of(at(0, 0)), 100, 100,
                new Viewport(100, 100), GenerationConfig.standard().withMinParticleSize(5f));

        assertEquals(16f, large.get(0).size(), EPS);
        assertEquals(5f, small.get(0).size(), EPS);
    }

    @Test
    void testAllParticles_ShouldStayInsideNdcRangeForFit() throws GenerationException {
        List<Sample> corners = List.of(at(0, 0), at(63, 0), at(0, 31), at(63, 31));
        List<Particle> particles = assembler.assemble(corners, 64, 32, new Viewport(300, 500), GenerationConfig.standard());

        assertEquals(corners.size(), particles.size());
        for (Particle p : particles) {
            assertTrue(p.x() > -1f && p.x() < 1f, "x=" + p.x());
            assertTrue(p.y() > -1f && p.y() < 1f, "y=" + p.y());
        }
    }

    @Test
    void testInvalidInput_ShouldThrowMatchingErrors() {
        GenerationConfig config = GenerationConfig.standard();

        assertEquals(GenerationError.INSUFFICIENT_SAMPLES, assertThrows(GenerationException.class,
                () -> assembler.assemble(List.of(), 10, 10, new Viewport(10, 10), config)).getError());
        assertEquals(GenerationError.INVALID_IMAGE, assertThrows(GenerationException.class,
                () -> assembler.assemble(List.of(at(0, 0)), 0, 10, new Viewport(10, 10), config)).getError());
        assertEquals(GenerationError.INVALID_CONFIGURATION, assertThrows(GenerationException.class,
                () -> assembler.assemble(List.of(at(0, 0)), 10, 10, new Viewport(0, 10), config)).getError());
    }
}
