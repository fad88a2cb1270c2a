package com.chih.JRender.core.matching;

import java.util.Collection;

/**
 * 判断一次标签调用是否命中某个 Tag Helper
 * <p>
 * 模板里的属性名可能和规则的写法不同，比较时做三级处理：
 * <ol>
 *   <li>完全相等（区分大小写）</li>
 *   <li>规则以 {@value #DIRECTIVE_PREFIX} 开头时，模板可以省略前缀：
 *       {@code for} / {@code FOR} 都满足 {@code asp-for}，长度必须正好等于去掉前缀后的长度</li>
 *   <li>其他情况把 {@code _} 换成 {@code -} 后忽略大小写比较：{@code my_value} 满足 {@code my-value}</li>
 * </ol>
 * 纯函数，不修改任何输入；实例不可变，可在线程间共享。
 * </p>
 *
 * @author JRender Team
 * @since 2026/10/14
 */
public class TagMatcher {

    public static final String DIRECTIVE_PREFIX = "asp-";

    private final RuleSet ruleSet;

    public TagMatcher(RuleSet ruleSet) {
        if (ruleSet == null) {
            throw new IllegalArgumentException("RuleSet cannot be null");
        }
        this.ruleSet = ruleSet;
    }

    public RuleSet getRuleSet() {
        return ruleSet;
    }

    /**
     * @param tagName 标签名（模板中的原始写法）
     * @param attributeNames 属性名（模板中的原始写法）
     * @return 任意一条规则命中即返回 true
     */
    public boolean matches(String tagName, Collection<String> attributeNames) {
        for (RuleDescriptor rule : ruleSet.getRules()) {
            if (matchesRule(rule, tagName, attributeNames)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesRule(RuleDescriptor rule, String tagName, Collection<String> attributeNames) {
        if (!rule.isWildcard() && !rule.tagName().equalsIgnoreCase(tagName)) {
            return false;
        }
        for (String required : rule.requiredAttributes()) {
            if (!isPresent(required, attributeNames)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isPresent(String required, Collection<String> attributeNames) {
        for (String candidate : attributeNames) {
            if (isSatisfiedBy(required, candidate)) {
                return true;
            }
        }
        return false;
    }

    static boolean isSatisfiedBy(String required, String candidate) {
        if (candidate.equals(required)) {
            return true;
        }

        if (required.startsWith(DIRECTIVE_PREFIX)) {
            int prefixLength = DIRECTIVE_PREFIX.length();
            if (candidate.length() != required.length() - prefixLength) {
                return false;
            }
            String normalized = candidate.replace('_', '-');
            return required.regionMatches(true, prefixLength, normalized, 0, normalized.length());
        }

        String normalized = candidate.indexOf('_') >= 0 ? candidate.replace('_', '-') : candidate;
        return normalized.equalsIgnoreCase(required);
    }
}
