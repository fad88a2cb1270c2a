package com.chih.JRender.core.spi;

/**
 * 字符数组池 SPI
 * <p>
 * 复用临时字符数组，避免频繁分配。{@link #acquire(int)} 与 {@link #release(char[])}
 * 必须严格成对调用，同一个数组只能归还一次。
 * </p>
 *
 * @author JRender Team
 * @since 2026/10/12
 */
public interface CharArrayPool {

    /**
     * 借出数组
     *
     * @param minimumLength 最小长度
     * @return 长度不小于 minimumLength 的数组，内容未定义
     */
    char[] acquire(int minimumLength);

    /**
     * 归还数组
     *
     * @param array 之前由 {@link #acquire(int)} 借出的数组
     */
    void release(char[] array);
}
