package com.chih.JRender.core.fragment;

import java.io.IOException;
import java.io.Writer;

/**
 * 完整字符串片段
 *
 * @param value 字符串内容
 * @author JRender Team
 * @since 2026/10/12
 */
public record OwnedText(String value) implements Fragment {

    public OwnedText {
        if (value == null) {
            throw new IllegalArgumentException("Text fragment value cannot be null");
        }
    }

    @Override
    public int length() {
        return value.length();
    }

    @Override
    public void writeTo(Writer writer) throws IOException {
        writer.write(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
