package com.chih.JRender.core.impl;

import com.chih.JRender.core.spi.CharArrayPool;

import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 进程级共享的字符数组池
 * <p>
 * 按 2 的幂分桶（16 ~ 1M 个字符），每个桶最多保留 {@code maxArraysPerBucket} 个空闲数组。
 * 超出上限或超出最大桶尺寸的数组不入池，交给 GC 回收。
 * </p>
 *
 * <h3>线程安全：</h3>
 * 桶使用无锁的 {@link ConcurrentLinkedDeque}，计数使用 {@link AtomicInteger}，可在多个渲染线程间共享。
 *
 * @author JRender Team
 * @since 2026/10/12
 */
public class SharedCharArrayPool implements CharArrayPool {

    public static final int DEFAULT_MAX_ARRAYS_PER_BUCKET = 32;

    static final int MIN_ARRAY_LENGTH = 16;
    static final int MAX_ARRAY_LENGTH = 1 << 20;

    private static final int BUCKET_COUNT =
            Integer.numberOfTrailingZeros(MAX_ARRAY_LENGTH) - Integer.numberOfTrailingZeros(MIN_ARRAY_LENGTH) + 1;

    private final Bucket[] buckets;
    private final int maxArraysPerBucket;

    public SharedCharArrayPool() {
        this(DEFAULT_MAX_ARRAYS_PER_BUCKET);
    }

    public SharedCharArrayPool(int maxArraysPerBucket) {
        if (maxArraysPerBucket < 0) {
            throw new IllegalArgumentException("maxArraysPerBucket must not be negative: " + maxArraysPerBucket);
        }
        this.maxArraysPerBucket = maxArraysPerBucket;
        this.buckets = new Bucket[BUCKET_COUNT];
        for (int i = 0; i < BUCKET_COUNT; i++) {
            buckets[i] = new Bucket(MIN_ARRAY_LENGTH << i);
        }
    }

    /**
     * 全局默认实例，首次使用时初始化
     */
    public static SharedCharArrayPool shared() {
        return Holder.INSTANCE;
    }

    @Override
    public char[] acquire(int minimumLength) {
        if (minimumLength < 0) {
            throw new IllegalArgumentException("minimumLength must not be negative: " + minimumLength);
        }
        int index = bucketIndex(minimumLength);
        if (index < 0) {
            return new char[minimumLength];
        }
        Bucket bucket = buckets[index];
        char[] array = bucket.arrays.pollFirst();
        if (array == null) {
            return new char[bucket.arrayLength];
        }
        bucket.size.decrementAndGet();
        return array;
    }

    @Override
    public void release(char[] array) {
        if (array == null) {
            throw new IllegalArgumentException("Released array cannot be null");
        }
        int index = bucketIndex(array.length);
        if (index < 0 || buckets[index].arrayLength != array.length) {
            // 不是本池借出的尺寸
            return;
        }
        Bucket bucket = buckets[index];
        if (bucket.size.incrementAndGet() > maxArraysPerBucket) {
            bucket.size.decrementAndGet();
            return;
        }
        bucket.arrays.offerFirst(array);
    }

    /**
     * @return 当前池中空闲数组总数
     */
    public int getPooledCount() {
        int total = 0;
        for (Bucket bucket : buckets) {
            total += bucket.size.get();
        }
        return total;
    }

    public int getMaxArraysPerBucket() {
        return maxArraysPerBucket;
    }

    private static int bucketIndex(int length) {
        if (length > MAX_ARRAY_LENGTH) {
            return -1;
        }
        if (length <= MIN_ARRAY_LENGTH) {
            return 0;
        }
        // 向上取整到 2 的幂
        int bits = 32 - Integer.numberOfLeadingZeros(length - 1);
        return bits - Integer.numberOfTrailingZeros(MIN_ARRAY_LENGTH);
    }

    private static final class Bucket {
        final int arrayLength;
        final Deque<char[]> arrays = new ConcurrentLinkedDeque<>();
        final AtomicInteger size = new AtomicInteger();

        Bucket(int arrayLength) {
            this.arrayLength = arrayLength;
        }
    }

    private static final class Holder {
        static final SharedCharArrayPool INSTANCE = new SharedCharArrayPool();
    }
}
