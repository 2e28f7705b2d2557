package work.pollochang.particles.image.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SampleSetTest {

    private static final Rgba BLACK = new Rgba(0f, 0f, 0f, 1f);

    /**
     * 重複座標不會被加入，移除後可再加入且排在最後
     */
    @Test
    void testAddRemove_ShouldKeepInsertionOrderAndRejectDuplicates() {
        SampleSet set = new SampleSet();
        Sample a = new Sample(1, 1, BLACK);
        Sample b = new Sample(2, 1, BLACK);
        Sample c = new Sample(3, 1, BLACK);

        assertTrue(set.add(a));
        assertTrue(set.add(b));
        assertTrue(set.add(c));
        assertFalse(set.add(new Sample(2, 1, new Rgba(1f, 0f, 0f, 1f))));
        assertEquals(List.of(a, b, c), set.toList());

        assertTrue(set.remove(b));
        assertFalse(set.remove(b));
        assertFalse(set.contains(2, 1));
        assertTrue(set.add(b));
        assertEquals(List.of(a, c, b), set.toList());
        assertEquals(3, set.size());
    }

    /**
     * 大量加入後逐一移除一半，剩下的順序不變
     */
    @Test
    void testBulkRemove_ShouldLeaveRemainingInOrder() {
        SampleSet set = new SampleSet(200_000);
        for (int i = 0; i < 200_000; i++) {
            set.add(new Sample(i % 1000, i / 1000, BLACK));
        }
        for (int i = 0; i < 200_000; i += 2) {
            assertTrue(set.remove(new Sample(i % 1000, i / 1000, BLACK)));
        }

        List<Sample> remaining = set.toList();
        assertEquals(100_000, remaining.size());
        assertEquals(new Sample(1, 0, BLACK), remaining.get(0));
        assertEquals(new Sample(999, 199, BLACK), remaining.get(remaining.size() - 1));
        assertFalse(set.isEmpty());
    }
}
