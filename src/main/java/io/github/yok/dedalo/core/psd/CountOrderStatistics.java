package io.github.yok.dedalo.core.psd;

import com.google.common.base.Preconditions;

/**
 * 0 以上の整数値の多重集合に対する順序統計量を、Fenwick 木で O(log V) に求めるクラスです。
 *
 * <p>
 * 値の上限を超える値が追加された場合は容量を 2 倍ずつ広げて木を作り直します。
 * </p>
 */
public final class CountOrderStatistics {

    /**
     * 容量の上限です。
     */
    static final int MAX_CAPACITY = 1 << 24;

    /**
     * 値ごとの出現回数です。
     */
    private long[] frequencies;

    /**
     * Fenwick 木（1 始まり）です。
     */
    private long[] tree;

    private long size;

    /**
     * 既定の初期容量（1024）で生成します。
     */
    public CountOrderStatistics() {
        this(1024);
    }

    /**
     * 初期容量を指定して生成します。
     *
     * @param initialCapacity 初期容量です（2 のべき乗に切り上げます）
     */
    public CountOrderStatistics(int initialCapacity) {
        Preconditions.checkArgument(initialCapacity > 0 && initialCapacity <= MAX_CAPACITY,
                "初期容量が不正です。capacity=%s", initialCapacity);
        int capacity = Integer.highestOneBit(initialCapacity);
        if (capacity < initialCapacity) {
            capacity <<= 1;
        }
        this.frequencies = new long[capacity];
        this.tree = new long[capacity + 1];
    }

    /**
     * 値を追加できるかどうかを返します。
     *
     * @param value 値です
     * @return 0 以上かつ容量の上限未満の場合は true です
     */
    public static boolean accepts(long value) {
        return value >= 0 && value < MAX_CAPACITY;
    }

    /**
     * 値を追加します。
     *
     * @param value 値（0 以上）です
     * @throws IllegalArgumentException 値が負、または容量の上限以上の場合に発生します
     */
    public void add(long value) {
        Preconditions.checkArgument(accepts(value),
                "値は 0 以上 %s 未満である必要があります。value=%s", MAX_CAPACITY, value);
        int v = (int) value;
        while (v >= frequencies.length) {
            grow();
        }
        frequencies[v]++;
        for (int i = v + 1; i < tree.length; i += i & -i) {
            tree[i]++;
        }
        size++;
    }

    public long size() {
        return size;
    }

    /**
     * 昇順で k 番目（0 始まり）の値を返します。
     *
     * @param k 順位です
     * @return 値です
     * @throws IllegalArgumentException k が範囲外の場合に発生します
     */
    public long kth(long k) {
        Preconditions.checkArgument(k >= 0 && k < size, "順位が範囲外です。k=%s, size=%s", k, size);
        // 二分リフティングで累積度数が k を超える最小の位置を探します。
        int pos = 0;
        long remaining = k;
        for (int step = Integer.highestOneBit(tree.length - 1); step > 0; step >>= 1) {
            int next = pos + step;
            if (next < tree.length && tree[next] <= remaining) {
                pos = next;
                remaining -= tree[next];
            }
        }
        return pos;
    }

    /**
     * 線形補間（h = (n-1)p）による分位点を返します。
     *
     * @param p 確率（0〜1）です
     * @return 分位点です（空の場合は NaN）
     */
    public double quantile(double p) {
        if (size == 0) {
            return Double.NaN;
        }
        double h = (size - 1) * p;
        long lo = (long) Math.floor(h);
        double frac = h - lo;
        long lower = kth(lo);
        if (frac == 0.0) {
            return lower;
        }
        long upper = kth(lo + 1);
        return lower + frac * (upper - lower);
    }

    private void grow() {
        int capacity = frequencies.length << 1;
        long[] nextFrequencies = new long[capacity];
        System.arraycopy(frequencies, 0, nextFrequencies, 0, frequencies.length);
        long[] nextTree = new long[capacity + 1];
        // O(capacity) で木を作り直します。
        for (int i = 1; i <= capacity; i++) {
            nextTree[i] += nextFrequencies[i - 1];
            int parent = i + (i & -i);
            if (parent <= capacity) {
                nextTree[parent] += nextTree[i];
            }
        }
        frequencies = nextFrequencies;
        tree = nextTree;
    }
}
