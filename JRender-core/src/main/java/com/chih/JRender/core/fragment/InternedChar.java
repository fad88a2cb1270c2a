package com.chih.JRender.core.fragment;

import java.io.IOException;
import java.io.Writer;

/**
 * 单字符片段（编码 0-255）
 * <p>
 * 256 个实例在类加载时一次性创建，之后只读。相同编码永远返回同一个引用，
 * 逐字符写入（例如 HTML 编码后的内容）时不会产生任何分配。
 * </p>
 *
 * @author JRender Team
 * @since 2026/10/12
 */
public final class InternedChar implements Fragment {

    /**
     * 驻留表大小
     */
    public static final int TABLE_SIZE = 256;

    private static final InternedChar[] TABLE = initTable();

    private final char value;
    private final String text;

    private InternedChar(char value) {
        this.value = value;
        this.text = String.valueOf(value);
    }

    private static InternedChar[] initTable() {
        InternedChar[] table = new InternedChar[TABLE_SIZE];
        for (int i = 0; i < TABLE_SIZE; i++) {
            table[i] = new InternedChar((char) i);
        }
        return table;
    }

    /**
     * 获取共享实例
     *
     * @param c 字符，必须小于 {@link #TABLE_SIZE}
     * @return 该字符唯一的片段实例
     */
    public static InternedChar of(char c) {
        if (c >= TABLE_SIZE) {
            throw new IllegalArgumentException("Character is not interned: U+" + Integer.toHexString(c));
        }
        return TABLE[c];
    }

    public static boolean isInterned(char c) {
        return c < TABLE_SIZE;
    }

    public char value() {
        return value;
    }

    @Override
    public int length() {
        return 1;
    }

    @Override
    public void writeTo(Writer writer) throws IOException {
        writer.write(value);
    }

    @Override
    public String toString() {
        return text;
    }
}
