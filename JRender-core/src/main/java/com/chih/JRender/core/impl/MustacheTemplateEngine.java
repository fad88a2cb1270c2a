package com.chih.JRender.core.impl;

import com.chih.JRender.core.buffer.ContentFragmentBuffer;
import com.chih.JRender.core.exception.TemplateRecursionException;
import com.chih.JRender.core.exception.TemplateRenderException;
import com.chih.JRender.core.spi.CompiledTemplate;
import com.chih.JRender.core.spi.TemplateEngine;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.io.StringReader;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 基于 Mustache 的模板引擎实现
 * 支持 {{user.name}}, {{#list}}循环, {{> partial}} 子模板
 * <p>
 * 渲染时 {@link ContentFragmentBuffer} 直接作为 Mustache 的输出 Writer，
 * 静态文本、变量值、HTML 转义后的字符都以片段形式进入缓冲区，不做中间拼接。
 * </p>
 *
 * @author JRender Team
 * @since 2026/10/13
 */
public class MustacheTemplateEngine implements TemplateEngine {

    private static final Logger log = LoggerFactory.getLogger(MustacheTemplateEngine.class);

    @Override
    public CompiledTemplate compile(String template, String rootId, Function<String, String> partialLoader) {
        if (template == null) {
            return null;
        }
        try {
            // 每次编译创建一个临时的 Factory，绑定当前的 partialLoader
            // 编译结果由 RenderManager 缓存，只在首次访问或失效后发生
            FragmentMustacheFactory mf = new FragmentMustacheFactory(rootId, partialLoader);
            Mustache mustache = mf.compile(new StringReader(template), rootId);
            return new CompiledTemplate(mustache, mf.getRecordedDependencies());
        } catch (RuntimeException e) {
            log.error("Failed to compile mustache template: {}", rootId, e);
            throw e;
        }
    }

    @Override
    public void execute(CompiledTemplate compiledTemplate, Map<String, Object> variables, ContentFragmentBuffer out) {
        if (compiledTemplate == null || compiledTemplate.getEngineObject() == null) {
            return;
        }
        if (out == null) {
            throw new IllegalArgumentException("Output buffer cannot be null");
        }

        Mustache mustache = (Mustache) compiledTemplate.getEngineObject();
        try {
            mustache.execute(out, variables == null ? Map.of() : variables);
        } catch (RuntimeException e) {
            log.error("Template execution failed: {}", mustache.getName(), e);
            throw new TemplateRenderException(mustache.getName(), e);
        }
    }

    /**
     * 自定义 Mustache 工厂，用于从 TemplateLoader 加载子模板
     */
    private static class FragmentMustacheFactory extends DefaultMustacheFactory {
        private final Function<String, String> partialLoader;
        // 本次编译链路中涉及的所有模板 key，用于检测循环引用
        private final Set<String> visiting = new HashSet<>();
        // 编译期遇到的所有子模板引用
        private final Set<String> recordedDependencies = new HashSet<>();

        FragmentMustacheFactory(String rootId, Function<String, String> partialLoader) {
            this.partialLoader = partialLoader;
            if (rootId != null) {
                visiting.add(rootId);
            }
        }

        @Override
        public Reader getReader(String resourceName) {
            // 1. 循环引用检测
            // DefaultMustacheFactory 缓存已编译的子模板，同一个 name 只会调用一次 getReader，
            // 再次出现说明形成了 A -> B -> A
            if (visiting.contains(resourceName)) {
                throw new TemplateRecursionException(
                        String.format("Circular reference detected! Template '%s' is referenced recursively.", resourceName)
                );
            }

            // 2. 记录依赖
            recordedDependencies.add(resourceName);

            // 3. 加载内容
            if (partialLoader != null) {
                String content = partialLoader.apply(resourceName);
                if (content != null) {
                    visiting.add(resourceName);
                    return new StringReader(content);
                }
            }
            // 找不到时返回 null (Mustache 会抛出 MustacheNotFoundException)
            return null;
        }

        Set<String> getRecordedDependencies() {
            return recordedDependencies;
        }
    }
}
