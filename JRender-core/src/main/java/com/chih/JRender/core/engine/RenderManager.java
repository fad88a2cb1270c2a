package com.chih.JRender.core.engine;

import com.chih.JRender.core.buffer.ContentFragmentBuffer;
import com.chih.JRender.core.exception.JRenderException;
import com.chih.JRender.core.exception.TemplateNotFoundException;
import com.chih.JRender.core.exception.TemplateRenderException;
import com.chih.JRender.core.impl.MustacheTemplateEngine;
import com.chih.JRender.core.impl.NoOpRenderMetrics;
import com.chih.JRender.core.impl.SharedCharArrayPool;
import com.chih.JRender.core.impl.WriterFragmentSink;
import com.chih.JRender.core.spi.CharArrayPool;
import com.chih.JRender.core.spi.CompiledTemplate;
import com.chih.JRender.core.spi.FragmentSink;
import com.chih.JRender.core.spi.RenderMetrics;
import com.chih.JRender.core.spi.TemplateEngine;
import com.chih.JRender.core.spi.TemplateLoader;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 核心管理器：负责协调模板加载、编译缓存和渲染输出
 * <p>
 * 渲染流程：
 * <ol>
 *   <li>按 key 取编译结果，未命中时通过 {@link TemplateLoader} 加载并编译（Caffeine 保证同一 key 只编译一次）</li>
 *   <li>为本次渲染创建 {@link ContentFragmentBuffer}，模板引擎把输出写成片段</li>
 *   <li>片段按顺序交给调用方的 {@link FragmentSink}</li>
 *   <li>无论成功失败都释放缓冲区借用的临时数组</li>
 * </ol>
 * </p>
 *
 * @author JRender Team
 * @since 2026/10/16
 */
public class RenderManager {

    private static final Logger log = LoggerFactory.getLogger(RenderManager.class);

    public static final long DEFAULT_MAXIMUM_CACHE_SIZE = 1_000;

    private final TemplateLoader loader;
    private final TemplateEngine templateEngine;
    private final CharArrayPool pool;
    private final RenderMetrics metrics;
    private final String lineSeparator;

    // 缓存 Key -> 编译结果
    private final Cache<String, CompiledTemplate> cache;

    private final DependencyGraph dependencyGraph = new DependencyGraph();

    /**
     * 依赖图管理器
     * <p>
     * 维护模板与子模板之间的正向和反向索引，子模板失效时级联失效所有引用它的模板。
     * </p>
     */
    private static class DependencyGraph {
        // 反向索引：Partial key -> Set<Parent key> (谁依赖了我)
        private final Map<String, Set<String>> reverseDependencies = new ConcurrentHashMap<>();

        // 正向索引：Parent key -> Set<Partial key> (我依赖了谁)
        private final Map<String, Set<String>> forwardDependencies = new ConcurrentHashMap<>();

        void update(String parentKey, Set<String> newDependencies) {
            remove(parentKey);
            if (newDependencies == null || newDependencies.isEmpty()) {
                return;
            }
            Set<String> depSet = ConcurrentHashMap.newKeySet();
            for (String dep : newDependencies) {
                reverseDependencies.computeIfAbsent(dep, k -> ConcurrentHashMap.newKeySet()).add(parentKey);
                depSet.add(dep);
            }
            forwardDependencies.put(parentKey, depSet);
        }

        /**
         * 移除节点的正向依赖（它不再引用别人）
         */
        void remove(String key) {
            Set<String> oldDependencies = forwardDependencies.remove(key);
            if (oldDependencies == null) {
                return;
            }
            for (String oldDep : oldDependencies) {
                Set<String> parents = reverseDependencies.get(oldDep);
                if (parents != null) {
                    parents.remove(key);
                    if (parents.isEmpty()) {
                        reverseDependencies.remove(oldDep);
                    }
                }
            }
        }

        Set<String> getParents(String key) {
            Set<String> parents = reverseDependencies.get(key);
            return parents != null ? parents : Collections.emptySet();
        }

        /**
         * 计算受影响的 Keys（变更 key 本身及所有直接、间接引用它的模板）
         */
        Set<String> calculateAffectedKeys(String changedKey) {
            Set<String> affectedKeys = new HashSet<>();
            Set<String> toProcess = new HashSet<>();
            toProcess.add(changedKey);

            while (!toProcess.isEmpty()) {
                String current = toProcess.iterator().next();
                toProcess.remove(current);
                if (affectedKeys.add(current)) {
                    toProcess.addAll(getParents(current));
                }
            }
            return affectedKeys;
        }

        void clear() {
            reverseDependencies.clear();
            forwardDependencies.clear();
        }
    }

    // 全参构造函数
    public RenderManager(TemplateLoader loader, TemplateEngine templateEngine, CharArrayPool pool,
                         RenderMetrics metrics, long maximumCacheSize, String lineSeparator) {
        if (loader == null) {
            throw new IllegalArgumentException("TemplateLoader cannot be null");
        }
        this.loader = loader;
        this.templateEngine = templateEngine != null ? templateEngine : new MustacheTemplateEngine();
        this.pool = pool != null ? pool : SharedCharArrayPool.shared();
        this.metrics = metrics != null ? metrics : new NoOpRenderMetrics();
        this.lineSeparator = lineSeparator != null ? lineSeparator : ContentFragmentBuffer.DEFAULT_LINE_SEPARATOR;

        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumCacheSize)
                .removalListener((String key, CompiledTemplate value, RemovalCause cause) ->
                        log.debug("Compiled template removed: {}, reason: {}", key, cause))
                .build();
    }

    public RenderManager(TemplateLoader loader, TemplateEngine templateEngine, RenderMetrics metrics) {
        this(loader, templateEngine, SharedCharArrayPool.shared(), metrics, DEFAULT_MAXIMUM_CACHE_SIZE, null);
    }

    public RenderManager(TemplateLoader loader) {
        this(loader, new MustacheTemplateEngine(), new NoOpRenderMetrics());
    }

    /**
     * 渲染模板并把片段交给 sink
     *
     * @throws TemplateNotFoundException key 不存在
     * @throws TemplateRenderException 编译或执行失败
     * @throws IOException sink 写入失败
     */
    public void render(String key, Map<String, Object> variables, FragmentSink sink) throws IOException {
        checkKey(key);
        long startTime = System.nanoTime();
        boolean success = false;
        try (ContentFragmentBuffer buffer = newBuffer()) {
            CompiledTemplate compiled = getCompiled(key);
            templateEngine.execute(compiled, variables, buffer);
            buffer.emit(sink);
            success = true;
        } finally {
            metrics.recordRender(key, System.nanoTime() - startTime, success);
        }
    }

    public void render(String key, Map<String, Object> variables, Writer writer) throws IOException {
        render(key, variables, new WriterFragmentSink(writer));
    }

    public String renderToString(String key, Map<String, Object> variables) {
        StringWriter writer = new StringWriter();
        try {
            render(key, variables, writer);
        } catch (IOException e) {
            // StringWriter 不会抛出 IOException
            throw new TemplateRenderException(key, e);
        }
        return writer.toString();
    }

    /**
     * 渲染到调用方持有的缓冲区（例如嵌套渲染），缓冲区的输出和释放由调用方负责
     */
    public void renderInto(String key, Map<String, Object> variables, ContentFragmentBuffer out) {
        checkKey(key);
        long startTime = System.nanoTime();
        boolean success = false;
        try {
            templateEngine.execute(getCompiled(key), variables, out);
            success = true;
        } finally {
            metrics.recordRender(key, System.nanoTime() - startTime, success);
        }
    }

    /**
     * 创建一个使用本管理器配置的缓冲区
     */
    public ContentFragmentBuffer newBuffer() {
        return new ContentFragmentBuffer(pool, lineSeparator);
    }

    /**
     * 使模板及所有引用它的模板失效，下次渲染时重新加载编译
     *
     * @return 失效的 keys
     */
    public Set<String> invalidate(String key) {
        Set<String> affected = dependencyGraph.calculateAffectedKeys(key);
        for (String affectedKey : affected) {
            cache.invalidate(affectedKey);
            dependencyGraph.remove(affectedKey);
        }
        log.info("Template invalidated: {} ({} affected)", key, affected.size());
        return affected;
    }

    public void invalidateAll() {
        cache.invalidateAll();
        dependencyGraph.clear();
    }

    public boolean isCached(String key) {
        return cache.getIfPresent(key) != null;
    }

    private CompiledTemplate getCompiled(String key) {
        return cache.get(key, this::compile);
    }

    private static void checkKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Template key cannot be null");
        }
    }

    private CompiledTemplate compile(String key) {
        String template = loader.load(key);
        if (template == null) {
            throw new TemplateNotFoundException(key);
        }
        try {
            CompiledTemplate compiled = templateEngine.compile(template, key, loader::load);
            dependencyGraph.update(key, compiled.getDependencies());
            log.debug("Template compiled: {} (dependencies: {})", key, compiled.getDependencies());
            return compiled;
        } catch (JRenderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TemplateRenderException(key, e);
        }
    }
}
