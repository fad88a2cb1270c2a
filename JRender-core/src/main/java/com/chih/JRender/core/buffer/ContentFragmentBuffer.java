package com.chih.JRender.core.buffer;

import com.chih.JRender.core.fragment.BorrowedSpan;
import com.chih.JRender.core.fragment.CopiedSpan;
import com.chih.JRender.core.fragment.Fragment;
import com.chih.JRender.core.fragment.InternedChar;
import com.chih.JRender.core.fragment.OwnedText;
import com.chih.JRender.core.impl.SharedCharArrayPool;
import com.chih.JRender.core.impl.WriterFragmentSink;
import com.chih.JRender.core.spi.CharArrayPool;
import com.chih.JRender.core.spi.FragmentSink;

import java.io.IOException;
import java.io.Writer;
import java.nio.CharBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 片段缓冲区：以 {@link Writer} 的形式接收模板引擎的输出，按写入顺序保存为 {@link Fragment} 列表，
 * 直到 {@link #emit(FragmentSink)} 时才交给最终输出。
 * <p>
 * 设计要点：
 * <ul>
 *   <li><strong>不拼接</strong>：整串、整数组原样引用，不做拷贝</li>
 *   <li><strong>字符驻留</strong>：编码小于 256 的单字符使用全局共享片段，零分配</li>
 *   <li><strong>临时数据拷贝</strong>：只有 {@link #writeSpan(CharBuffer)} 这类生命周期不可信的数据才拷贝，
 *       拷贝时借用 {@link CharArrayPool} 中的数组，{@link #dispose()} 时统一归还</li>
 *   <li><strong>同步语义</strong>：异步形式的写方法在当前线程立即完成，不提交到任何调度器</li>
 * </ul>
 * </p>
 *
 * <h3>生命周期：</h3>
 * 每次渲染创建一个实例，渲染线程独占，非线程安全。使用完毕后调用 {@link #close()}（或 {@link #dispose()}），
 * 推荐 try-with-resources：
 * <pre>{@code
 * try (ContentFragmentBuffer buffer = new ContentFragmentBuffer(pool)) {
 *     engine.execute(compiled, variables, buffer);
 *     buffer.emit(sink);
 * }
 * }</pre>
 *
 * @author JRender Team
 * @since 2026/10/12
 */
public class ContentFragmentBuffer extends Writer {

    public static final String DEFAULT_LINE_SEPARATOR = "\n";

    // 只读的已完成阶段，所有异步写方法共用
    private static final CompletionStage<Void> COMPLETED = CompletableFuture.completedStage(null);

    private final List<Fragment> fragments = new ArrayList<>();
    private final CharArrayPool pool;
    private final String lineSeparator;

    // writeSpan 借出的临时数组，dispose 时归还；懒创建
    private List<char[]> pooledArrays;

    public ContentFragmentBuffer() {
        this(SharedCharArrayPool.shared());
    }

    public ContentFragmentBuffer(CharArrayPool pool) {
        this(pool, DEFAULT_LINE_SEPARATOR);
    }

    /**
     * @param pool 临时数组池
     * @param lineSeparator writeLine 系列方法追加的换行符
     */
    public ContentFragmentBuffer(CharArrayPool pool, String lineSeparator) {
        if (pool == null) {
            throw new IllegalArgumentException("CharArrayPool cannot be null");
        }
        if (lineSeparator == null) {
            throw new IllegalArgumentException("Line separator cannot be null");
        }
        this.pool = pool;
        this.lineSeparator = lineSeparator;
    }

    // =======================================================
    // 同步写入
    // =======================================================

    /**
     * 追加单个字符。编码小于 256 时复用共享片段，否则新建一个单字符文本片段。
     */
    public void writeChar(char c) {
        if (InternedChar.isInterned(c)) {
            fragments.add(InternedChar.of(c));
        } else {
            fragments.add(new OwnedText(String.valueOf(c)));
        }
    }

    /**
     * 追加整个字符串，作为一个片段，不拆分
     */
    public void writeText(String text) {
        fragments.add(new OwnedText(text));
    }

    /**
     * 追加整个数组。数组按引用保存，调用方之后不能再修改它。
     */
    public void writeChars(char[] buffer) {
        fragments.add(BorrowedSpan.whole(buffer));
    }

    /**
     * 追加数组中的一段。覆盖整个数组时与 {@link #writeChars(char[])} 完全等价。
     */
    public void writeChars(char[] buffer, int offset, int length) {
        if (buffer == null) {
            throw new IllegalArgumentException("Span buffer cannot be null");
        }
        if (offset == 0 && length == buffer.length) {
            writeChars(buffer);
            return;
        }
        fragments.add(new BorrowedSpan(buffer, offset, length));
    }

    /**
     * 追加一段生命周期不可信的字符（例如可复用的 {@link CharBuffer}）。
     * <p>
     * 流程：从池中借出临时数组 → 拷贝 span 剩余内容 → 再拷贝一份持久数组作为片段内容 →
     * 临时数组登记到待归还列表。拷贝失败时临时数组立即归还，异常继续抛出，不追加片段。
     * span 的 position 不会改变。
     * </p>
     *
     * @param span 待拷贝的字符
     */
    public void writeSpan(CharBuffer span) {
        if (span == null) {
            throw new IllegalArgumentException("Span cannot be null");
        }
        int length = span.remaining();
        char[] scratch = pool.acquire(length);
        boolean retained = false;
        char[] durable;
        try {
            span.duplicate().get(scratch, 0, length);
            durable = Arrays.copyOf(scratch, length);
            if (pooledArrays == null) {
                pooledArrays = new ArrayList<>();
            }
            pooledArrays.add(scratch);
            retained = true;
        } finally {
            if (!retained) {
                pool.release(scratch);
            }
        }
        fragments.add(new CopiedSpan(durable));
    }

    // =======================================================
    // Writer 适配
    // =======================================================

    @Override
    public void write(int c) {
        writeChar((char) c);
    }

    @Override
    public void write(String str) {
        writeText(str);
    }

    @Override
    public void write(String str, int off, int len) {
        if (str == null) {
            throw new IllegalArgumentException("Text fragment value cannot be null");
        }
        if (off == 0 && len == str.length()) {
            writeText(str);
            return;
        }
        Objects.checkFromIndexSize(off, len, str.length());
        writeText(str.substring(off, off + len));
    }

    @Override
    public void write(char[] cbuf) {
        writeChars(cbuf);
    }

    @Override
    public void write(char[] cbuf, int off, int len) {
        writeChars(cbuf, off, len);
    }

    /**
     * String 不可变，直接引用；其他 CharSequence（StringBuilder 等）内容可能被复用，按 span 拷贝。
     */
    @Override
    public ContentFragmentBuffer append(CharSequence csq) {
        if (csq == null) {
            writeText("null");
        } else if (csq instanceof String s) {
            writeText(s);
        } else {
            writeSpan(CharBuffer.wrap(csq));
        }
        return this;
    }

    @Override
    public ContentFragmentBuffer append(CharSequence csq, int start, int end) {
        CharSequence source = csq == null ? "null" : csq;
        if (source instanceof String s) {
            write(s, start, end - start);
        } else {
            writeSpan(CharBuffer.wrap(source, start, end));
        }
        return this;
    }

    @Override
    public ContentFragmentBuffer append(char c) {
        writeChar(c);
        return this;
    }

    // =======================================================
    // 换行写入
    // =======================================================

    public void writeLine() {
        writeText(lineSeparator);
    }

    public void writeLine(char c) {
        writeChar(c);
        writeLine();
    }

    public void writeLine(String text) {
        writeText(text);
        writeLine();
    }

    public void writeLine(char[] buffer, int offset, int length) {
        writeChars(buffer, offset, length);
        writeLine();
    }

    // =======================================================
    // 异步形式：在调用线程内同步完成，保证与同步写入的顺序一致
    // =======================================================

    public CompletionStage<Void> writeAsync(char c) {
        writeChar(c);
        return COMPLETED;
    }

    public CompletionStage<Void> writeAsync(String text) {
        writeText(text);
        return COMPLETED;
    }

    public CompletionStage<Void> writeAsync(char[] buffer, int offset, int length) {
        writeChars(buffer, offset, length);
        return COMPLETED;
    }

    public CompletionStage<Void> writeLineAsync() {
        writeLine();
        return COMPLETED;
    }

    public CompletionStage<Void> writeLineAsync(char c) {
        writeLine(c);
        return COMPLETED;
    }

    public CompletionStage<Void> writeLineAsync(String text) {
        writeLine(text);
        return COMPLETED;
    }

    public CompletionStage<Void> writeLineAsync(char[] buffer, int offset, int length) {
        writeLine(buffer, offset, length);
        return COMPLETED;
    }

    // =======================================================
    // 输出
    // =======================================================

    /**
     * 按写入顺序把所有片段交给 sink。不清空缓冲区，可以重复调用。
     *
     * @param sink 最终输出
     * @throws IOException sink 写入失败
     */
    public void emit(FragmentSink sink) throws IOException {
        if (sink == null) {
            throw new IllegalArgumentException("FragmentSink cannot be null");
        }
        for (Fragment fragment : fragments) {
            sink.write(fragment);
        }
    }

    /**
     * 直接输出到 Writer
     */
    public void writeTo(Writer writer) throws IOException {
        emit(new WriterFragmentSink(writer));
    }

    /**
     * @return 已写入片段的只读视图
     */
    public List<Fragment> getFragments() {
        return Collections.unmodifiableList(fragments);
    }

    public int size() {
        return fragments.size();
    }

    /**
     * @return 所有片段的字符总数
     */
    public int length() {
        int total = 0;
        for (Fragment fragment : fragments) {
            total += fragment.length();
        }
        return total;
    }

    public String getLineSeparator() {
        return lineSeparator;
    }

    // =======================================================
    // 资源释放
    // =======================================================

    /**
     * 归还所有临时数组，每个只归还一次。没有借过数组或重复调用时什么也不做。
     * <p>
     * 某个数组归还失败时继续归还其余数组，全部尝试完后抛出第一个异常，后续异常作为 suppressed 附加。
     * </p>
     */
    public void dispose() {
        if (pooledArrays == null) {
            return;
        }
        List<char[]> toRelease = pooledArrays;
        pooledArrays = null;
        RuntimeException failure = null;
        for (char[] array : toRelease) {
            try {
                pool.release(array);
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void flush() {
        // 片段在 emit 之前不会离开缓冲区
    }

    @Override
    public void close() {
        dispose();
    }

    /**
     * @return 拼接后的完整文本（仅用于调试和测试，会产生一次完整拷贝）
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(length());
        for (Fragment fragment : fragments) {
            sb.append(fragment);
        }
        return sb.toString();
    }
}
