package com.chih.JRender.spring;

import com.chih.JRender.core.exception.JRenderException;
import com.chih.JRender.core.spi.TemplateLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * 基于 Spring Resource 的模板加载器
 * <p>
 * 模板 key 与前缀、后缀拼接成资源路径：{@code page} → {@code classpath:templates/page.mustache}。
 * 子模板同样通过本加载器解析，所以 {@code {{> header}}} 会加载 {@code classpath:templates/header.mustache}。
 * </p>
 *
 * @author JRender Team
 * @see org.springframework.core.io.ResourceLoader
 */
public class SpringResourceTemplateLoader implements TemplateLoader {

    private static final Logger log = LoggerFactory.getLogger(SpringResourceTemplateLoader.class);

    private final ResourceLoader resourceLoader;
    private final String prefix;
    private final String suffix;

    public SpringResourceTemplateLoader(ResourceLoader resourceLoader, String prefix, String suffix) {
        this.resourceLoader = resourceLoader != null ? resourceLoader : new DefaultResourceLoader();
        this.prefix = prefix != null ? prefix : "";
        this.suffix = suffix != null ? suffix : "";
    }

    @Override
    public String load(String key) {
        Resource resource = resourceLoader.getResource(resolveLocation(key));
        if (!resource.exists()) {
            log.debug("Template resource not found: {}", resource.getDescription());
            return null;
        }
        try (InputStream is = resource.getInputStream()) {
            return StreamUtils.copyToString(is, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to read template resource: {}", resource.getDescription(), e);
            throw new JRenderException("Failed to read template: " + key, e);
        }
    }

    String resolveLocation(String key) {
        String path = key.startsWith("/") && prefix.endsWith("/") ? key.substring(1) : key;
        if (!suffix.isEmpty() && !path.endsWith(suffix)) {
            path = path + suffix;
        }
        return prefix + path;
    }
}
