package com.chih.JRender.core.spi;

/**
 * 模板源 SPI
 * 按 key 返回模板原文，同时用于加载子模板 ({{> name}})
 *
 * @author JRender Team
 * @since 2026/10/13
 */
@FunctionalInterface
public interface TemplateLoader {

    /**
     * @param key 模板 key
     * @return 模板内容，不存在时返回 null
     */
    String load(String key);
}
