package com.chih.JRender.spring;

import com.chih.JRender.core.buffer.ContentFragmentBuffer;
import com.chih.JRender.core.engine.RenderManager;
import com.chih.JRender.core.impl.SharedCharArrayPool;
import com.chih.JRender.core.registry.TagHelperRegistry;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 渲染配置
 *
 * @author JRender Team
 * @since 2026/10/16
 */
@ConfigurationProperties(prefix = "j-render")
public class JRenderProperties {

    /**
     * Tag Helper 规则文件扫描路径，支持 classpath*: 和 file:
     */
    private List<String> ruleLocations = new ArrayList<>();

    /**
     * 模板 key 前缀，与 key 拼接后交给 Spring ResourceLoader 加载
     */
    private String templatePrefix = "classpath:templates/";

    /**
     * 模板文件后缀，key 已经带后缀时不再追加
     */
    private String templateSuffix = ".mustache";

    /**
     * 编译结果缓存上限
     */
    private long templateCacheSize = RenderManager.DEFAULT_MAXIMUM_CACHE_SIZE;

    /**
     * 标签候选缓存上限
     */
    private long matcherCacheSize = TagHelperRegistry.DEFAULT_MAXIMUM_CACHE_SIZE;

    /**
     * 字符数组池每个桶保留的空闲数组数
     */
    private int poolMaxArraysPerBucket = SharedCharArrayPool.DEFAULT_MAX_ARRAYS_PER_BUCKET;

    /**
     * writeLine 追加的换行符
     */
    private String lineSeparator = ContentFragmentBuffer.DEFAULT_LINE_SEPARATOR;

    public JRenderProperties() {
        // 默认约定：扫描 classpath 下 tag-helpers 目录
        ruleLocations.add("classpath*:tag-helpers/**/*.yaml");
        ruleLocations.add("classpath*:tag-helpers/**/*.yml");
        ruleLocations.add("classpath*:tag-helpers/**/*.json");
    }

    public List<String> getRuleLocations() {
        return ruleLocations;
    }

    public void setRuleLocations(List<String> ruleLocations) {
        this.ruleLocations = ruleLocations;
    }

    public String getTemplatePrefix() {
        return templatePrefix;
    }

    public void setTemplatePrefix(String templatePrefix) {
        this.templatePrefix = templatePrefix;
    }

    public String getTemplateSuffix() {
        return templateSuffix;
    }

    public void setTemplateSuffix(String templateSuffix) {
        this.templateSuffix = templateSuffix;
    }

    public long getTemplateCacheSize() {
        return templateCacheSize;
    }

    public void setTemplateCacheSize(long templateCacheSize) {
        this.templateCacheSize = templateCacheSize;
    }

    public long getMatcherCacheSize() {
        return matcherCacheSize;
    }

    public void setMatcherCacheSize(long matcherCacheSize) {
        this.matcherCacheSize = matcherCacheSize;
    }

    public int getPoolMaxArraysPerBucket() {
        return poolMaxArraysPerBucket;
    }

    public void setPoolMaxArraysPerBucket(int poolMaxArraysPerBucket) {
        this.poolMaxArraysPerBucket = poolMaxArraysPerBucket;
    }

    public String getLineSeparator() {
        return lineSeparator;
    }

    public void setLineSeparator(String lineSeparator) {
        this.lineSeparator = lineSeparator;
    }
}
