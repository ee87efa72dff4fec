package io.github.yok.dedalo.core.frame;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChannelFrameTest {

    @Test
    @DisplayName("計数配列は防御的にコピーされる")
    void copiesCounts() {
        int[] counts = {1, 2, 3};
        ChannelFrame frame = new ChannelFrame(0, Instant.EPOCH, 1.0, 5000, 3000, 10.0, counts);

        counts[0] = 100;
        frame.getCounts()[1] = 100;

        assertEquals(1, frame.getCount(0));
        assertEquals(2, frame.getCount(1));
        assertEquals(6, frame.totalCount());
    }

    @Test
    @DisplayName("負の計数や空の計数は受け付けない")
    void rejectsInvalidCounts() {
        assertThrows(IllegalArgumentException.class,
                () -> new ChannelFrame(0, Instant.EPOCH, 1.0, 5000, 3000, 10.0, new int[] {-1}));
        assertThrows(IllegalArgumentException.class,
                () -> new ChannelFrame(0, Instant.EPOCH, 1.0, 5000, 3000, 10.0, new int[0]));
    }
}
