package com.chih.JRender.core.fragment;

import java.io.IOException;
import java.io.Writer;

/**
 * 一段已经格式化完毕、等待输出的内容片段
 * <p>
 * 片段一经创建即不可变。种类是封闭的：
 * <ul>
 *   <li>{@link InternedChar}：ASCII/Latin-1 单字符，全局共享实例</li>
 *   <li>{@link OwnedText}：完整字符串</li>
 *   <li>{@link BorrowedSpan}：调用方数组的一段视图（不拷贝）</li>
 *   <li>{@link CopiedSpan}：临时数据的独立拷贝</li>
 * </ul>
 * 所有片段都按原样写出，不做任何编码。
 * </p>
 *
 * @author JRender Team
 * @since 2026/10/12
 */
public sealed interface Fragment permits InternedChar, OwnedText, BorrowedSpan, CopiedSpan {

    /**
     * @return 片段包含的字符数
     */
    int length();

    /**
     * 将片段内容原样写入目标 Writer
     *
     * @param writer 最终输出
     * @throws IOException 目标 Writer 写入失败
     */
    void writeTo(Writer writer) throws IOException;
}
