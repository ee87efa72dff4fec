package io.github.yok.dedalo.core.lut;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.dedalo.core.exception.DomainException;
import io.github.yok.dedalo.core.mie.MieExtinctionCalculator;
import io.github.yok.dedalo.core.mie.RefractiveIndex;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LookupTableCacheTest {

    private static final DiameterGrid GRID = new DiameterGrid(new double[] {1.0, 2.0, 3.0});

    @Test
    @DisplayName("同じキーの LUT は並行して要求されても 1 回だけ構築される")
    void buildsOncePerKeyUnderConcurrency() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        MieExtinctionCalculator calculator = (d, wavelength, medium, index) -> {
            calls.incrementAndGet();
            return 2.0;
        };
        ExecutorService callers = Executors.newFixedThreadPool(8);
        try (LookupTableCache cache =
                new LookupTableCache(new LookupTableBuilder(calculator, 0.67, 1.331, 0), 2)) {
            List<Callable<MieLookupTable>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(() -> cache.get(GRID, RefractiveIndex.POLYSTYRENE));
            }
            List<Future<MieLookupTable>> results = callers.invokeAll(tasks);

            MieLookupTable first = results.get(0).get();
            for (Future<MieLookupTable> f : results) {
                assertSame(first, f.get());
            }
            assertEquals(GRID.size(), calls.get());
            assertEquals(1, cache.size());

            cache.get(GRID, new RefractiveIndex(1.45, 0.0));
            assertEquals(2, cache.size());
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    @DisplayName("構築に失敗した LUT はキャッシュから削除され、再要求で構築し直される")
    void failedBuildIsEvicted() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        MieExtinctionCalculator calculator = (d, wavelength, medium, index) -> {
            if (attempts.getAndIncrement() == 0) {
                throw new DomainException("計算に失敗しました");
            }
            return 2.0;
        };
        try (LookupTableCache cache =
                new LookupTableCache(new LookupTableBuilder(calculator, 0.67, 1.331, 0), 1)) {
            assertThrows(DomainException.class,
                    () -> cache.get(GRID, RefractiveIndex.POLYSTYRENE));

            // 削除は構築スレッドの完了通知で行われるため、少し待ちます。
            for (int i = 0; i < 100 && cache.size() > 0; i++) {
                Thread.sleep(10);
            }
            assertEquals(0, cache.size());

            MieLookupTable table = cache.get(GRID, RefractiveIndex.POLYSTYRENE);
            assertEquals(3, table.size());
        }
    }
}
