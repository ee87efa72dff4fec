package io.github.yok.dedalo.core.lut;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DiameterGridTest {

    @Test
    @DisplayName("1.0〜7.2 µm を 0.2 µm 刻みにすると 32 チャネルになる")
    void uniformChannelGrid() {
        DiameterGrid grid = DiameterGrid.uniform(1.0, 7.2, 0.2);

        assertEquals(32, grid.size());
        assertEquals(1.0, grid.min());
        assertEquals(7.2, grid.max());
        assertEquals(1.6, grid.get(3));
        assertEquals(3.0, grid.get(10));
        assertEquals(0.2, grid.meanStep(), 1e-12);
    }

    @Test
    @DisplayName("狭義単調増加でない格子は受け付けない")
    void rejectsNonIncreasingGrid() {
        assertThrows(IllegalArgumentException.class,
                () -> new DiameterGrid(new double[] {1.0, 1.0, 2.0}));
        assertThrows(IllegalArgumentException.class,
                () -> new DiameterGrid(new double[] {1.0}));
        assertThrows(IllegalArgumentException.class,
                () -> new DiameterGrid(new double[] {-1.0, 2.0}));
    }

    @Test
    @DisplayName("署名は格子の内容で決まる")
    void signatureDependsOnContent() {
        DiameterGrid a = DiameterGrid.uniform(0.2, 20.0, 0.01);
        DiameterGrid b = DiameterGrid.uniform(0.2, 20.0, 0.01);
        DiameterGrid c = DiameterGrid.uniform(0.2, 20.0, 0.02);

        assertEquals(a.signature(), b.signature());
        assertEquals(a, b);
        assertNotEquals(a.signature(), c.signature());
    }
}
