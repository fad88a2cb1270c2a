package com.chih.JRender.core.impl;

import com.chih.JRender.core.fragment.Fragment;
import com.chih.JRender.core.spi.FragmentSink;

import java.io.IOException;
import java.io.Writer;

/**
 * 将片段原样写入 {@link Writer} 的 sink
 */
public class WriterFragmentSink implements FragmentSink {

    private final Writer writer;

    public WriterFragmentSink(Writer writer) {
        if (writer == null) {
            throw new IllegalArgumentException("Writer cannot be null");
        }
        this.writer = writer;
    }

    @Override
    public void write(Fragment fragment) throws IOException {
        fragment.writeTo(writer);
    }

    public Writer getWriter() {
        return writer;
    }
}
