package com.chih.JRender.core.fragment;

import java.io.IOException;
import java.io.Writer;

/**
 * 临时数据的独立拷贝
 * <p>
 * 当源数据的生命周期无法保证长于缓冲区时使用（例如可变的 {@link java.nio.CharBuffer}、
 * {@link StringBuilder}）。数组由片段独占。
 * </p>
 *
 * @param buffer 拷贝后的字符
 * @author JRender Team
 * @since 2026/10/12
 */
public record CopiedSpan(char[] buffer) implements Fragment {

    public CopiedSpan {
        if (buffer == null) {
            throw new IllegalArgumentException("Copied buffer cannot be null");
        }
    }

    @Override
    public int length() {
        return buffer.length;
    }

    @Override
    public void writeTo(Writer writer) throws IOException {
        writer.write(buffer);
    }

    @Override
    public String toString() {
        return new String(buffer);
    }
}
