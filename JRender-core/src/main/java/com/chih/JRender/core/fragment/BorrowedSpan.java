package com.chih.JRender.core.fragment;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/**
 * 调用方字符数组中一段区间的视图
 * <p>
 * 数组按引用持有，不做拷贝。调用方把数组交出后不能再修改它，
 * 否则输出的内容会随之改变。
 * </p>
 *
 * @param buffer 字符数组（不属于片段本身）
 * @param offset 起始下标
 * @param length 字符数
 * @author JRender Team
 * @since 2026/10/12
 */
public record BorrowedSpan(char[] buffer, int offset, int length) implements Fragment {

    public BorrowedSpan {
        if (buffer == null) {
            throw new IllegalArgumentException("Span buffer cannot be null");
        }
        Objects.checkFromIndexSize(offset, length, buffer.length);
    }

    /**
     * 整个数组作为一个片段
     */
    public static BorrowedSpan whole(char[] buffer) {
        if (buffer == null) {
            throw new IllegalArgumentException("Span buffer cannot be null");
        }
        return new BorrowedSpan(buffer, 0, buffer.length);
    }

    public boolean isWhole() {
        return offset == 0 && length == buffer.length;
    }

    @Override
    public void writeTo(Writer writer) throws IOException {
        writer.write(buffer, offset, length);
    }

    @Override
    public String toString() {
        return new String(buffer, offset, length);
    }
}
