package com.chih.JRender.core.matching;

import java.util.Set;

/**
 * 一条 Tag Helper 匹配规则：标签名 + 必需属性
 *
 * @param tagName 标签名，{@value #WILDCARD} 匹配任意标签
 * @param requiredAttributes 必需属性名（按声明时的连字符写法，例如 {@code asp-for}）
 * @author JRender Team
 * @since 2026/10/14
 */
public record RuleDescriptor(String tagName, Set<String> requiredAttributes) {

    public static final String WILDCARD = "*";

    public RuleDescriptor {
        if (tagName == null || tagName.isEmpty()) {
            throw new IllegalArgumentException("Rule tag name cannot be empty");
        }
        requiredAttributes = requiredAttributes == null ? Set.of() : Set.copyOf(requiredAttributes);
    }

    public static RuleDescriptor of(String tagName, String... requiredAttributes) {
        return new RuleDescriptor(tagName, Set.of(requiredAttributes));
    }

    public boolean isWildcard() {
        return WILDCARD.equals(tagName);
    }
}
