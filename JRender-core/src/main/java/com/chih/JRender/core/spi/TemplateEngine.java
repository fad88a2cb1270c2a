package com.chih.JRender.core.spi;

import com.chih.JRender.core.buffer.ContentFragmentBuffer;

import java.util.Map;
import java.util.function.Function;

/**
 * 模板引擎 SPI 接口
 * 允许用户替换底层的渲染逻辑
 * 支持预编译模式，渲染结果直接写入片段缓冲区
 *
 * @author JRender Team
 * @since 2026/10/13
 */
public interface TemplateEngine {

    /**
     * 1. 编译阶段：将字符串模板编译为可执行对象
     *
     * @param template 原始模板字符串
     * @param rootId 模板 key，用于循环引用检测和日志
     * @param partialLoader 子模板加载器 (输入子模板名称，返回子模板内容)。如果为 null，则不支持子模板。
     * @return 编译后的对象，template 为 null 时返回 null
     */
    CompiledTemplate compile(String template, String rootId, Function<String, String> partialLoader);

    /**
     * 2. 执行阶段：使用编译好的对象进行渲染
     * 输出以片段形式追加到 out，不做字符串拼接
     *
     * @param compiledTemplate 编译后的对象 (来自于 compile 方法的返回值)
     * @param variables 变量上下文
     * @param out 当前渲染使用的缓冲区
     */
    void execute(CompiledTemplate compiledTemplate, Map<String, Object> variables, ContentFragmentBuffer out);
}
