package io.github.yok.dedalo.core.lut;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.dedalo.core.mie.RefractiveIndex;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link LookupTableKey} ごとに LUT を共有するキャッシュです。
 *
 * <p>
 * 同じキーの構築は高々 1 回で、並行して要求した呼び出し元は同じ {@link CompletableFuture} を受け取ります。
 * 構築に失敗したエントリは削除され、次の要求で再構築されます。 構築は専用スレッドプールで実行します。
 * </p>
 */
@Slf4j
public final class LookupTableCache implements AutoCloseable {

    private final LookupTableBuilder builder;

    private final ConcurrentMap<LookupTableKey, CompletableFuture<MieLookupTable>> tables =
            new ConcurrentHashMap<>();

    private final ExecutorService executor;

    /**
     * キャッシュを生成します。
     *
     * @param builder LUT 構築ロジックです
     * @param threads 構築スレッド数です
     * @throws IllegalArgumentException スレッド数が 1 未満の場合に発生します
     */
    public LookupTableCache(LookupTableBuilder builder, int threads) {
        Preconditions.checkNotNull(builder, "builder が null です。");
        Preconditions.checkArgument(threads >= 1, "構築スレッド数は 1 以上である必要があります。threads=%s",
                threads);
        this.builder = builder;
        this.executor = Executors.newFixedThreadPool(threads,
                new ThreadFactoryBuilder().setNameFormat("lut-builder-%d").setDaemon(true).build());
    }

    /**
     * LUT を非同期に取得します。
     *
     * @param grid 計算格子です
     * @param index 粒子の屈折率です
     * @return LUT の Future です
     */
    public CompletableFuture<MieLookupTable> getAsync(DiameterGrid grid, RefractiveIndex index) {
        LookupTableKey key = builder.keyOf(grid, index);
        CompletableFuture<MieLookupTable> future = tables.computeIfAbsent(key, k -> {
            log.debug("LUT の構築を予約します。key={}", k);
            return CompletableFuture.supplyAsync(() -> builder.build(grid, index), executor);
        });
        future.whenComplete((table, error) -> {
            if (error != null) {
                log.warn("LUT の構築に失敗したためキャッシュから削除します。key={}", key, error);
                tables.remove(key, future);
            }
        });
        return future;
    }

    /**
     * LUT を取得します（構築完了まで待機します）。
     *
     * @param grid 計算格子です
     * @param index 粒子の屈折率です
     * @return LUT です
     * @throws RuntimeException 構築時に発生した例外です（{@link CompletionException} は展開します）
     */
    public MieLookupTable get(DiameterGrid grid, RefractiveIndex index) {
        try {
            return getAsync(grid, index).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw e;
        }
    }

    /**
     * 構築済みまたは構築中のエントリ数を返します。
     *
     * @return エントリ数です
     */
    public int size() {
        return tables.size();
    }

    /**
     * 構築スレッドプールを停止します。
     */
    @Override
    public void close() {
        executor.shutdownNow();
    }
}
