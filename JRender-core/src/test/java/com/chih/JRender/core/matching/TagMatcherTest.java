package com.chih.JRender.core.matching;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * TagMatcher 测试
 *
 * 测试覆盖：
 * - 标签名匹配（通配 / 忽略大小写）
 * - 前缀属性的省略写法
 * - 下划线与连字符的互换
 * - 空规则集
 */
@DisplayName("TagMatcher 测试")
class TagMatcherTest {

    private static TagMatcher matcher(RuleDescriptor... rules) {
        return new TagMatcher(new RuleSet("widget-helper", "test", List.of(rules)));
    }

    private final TagMatcher widgetFor = matcher(RuleDescriptor.of("widget", "asp-for"));

    @Test
    @DisplayName("前缀属性：省略前缀且长度一致时命中")
    void testPrefixStripped() {
        assertThat(widgetFor.matches("widget", List.of("for"))).isTrue();
        assertThat(widgetFor.matches("widget", List.of("FOR"))).isTrue();
    }

    @Test
    @DisplayName("前缀属性：完整写法精确命中")
    void testPrefixExact() {
        assertThat(widgetFor.matches("widget", List.of("asp-for"))).isTrue();
    }

    @Test
    @DisplayName("前缀属性：长度不一致时不命中")
    void testPrefixLengthMismatch() {
        assertThat(widgetFor.matches("widget", List.of("for_each"))).isFalse();
        assertThat(widgetFor.matches("widget", List.of("fo"))).isFalse();
    }

    @Test
    @DisplayName("前缀属性：不接受忽略大小写的完整写法")
    void testPrefixedCandidateIsNotCaseFolded() {
        assertThat(widgetFor.matches("widget", List.of("ASP-FOR"))).isFalse();
    }

    @Test
    @DisplayName("前缀属性：下划线写法")
    void testPrefixWithUnderscore() {
        TagMatcher matcher = matcher(RuleDescriptor.of("a", "asp-route-id"));

        assertThat(matcher.matches("a", List.of("route_id"))).isTrue();
        assertThat(matcher.matches("a", List.of("Route_Id"))).isTrue();
        assertThat(matcher.matches("a", List.of("route-id"))).isTrue();
    }

    @Test
    @DisplayName("标签名不一致时不命中")
    void testTagNameMismatch() {
        assertThat(widgetFor.matches("other", List.of("for"))).isFalse();
    }

    @Test
    @DisplayName("标签名忽略大小写")
    void testTagNameCaseInsensitive() {
        assertThat(widgetFor.matches("WIDGET", List.of("for"))).isTrue();
        assertThat(widgetFor.matches("Widget", List.of("asp-for"))).isTrue();
    }

    @Test
    @DisplayName("缺少必需属性时不命中")
    void testMissingAttribute() {
        assertThat(widgetFor.matches("widget", List.of())).isFalse();
        assertThat(widgetFor.matches("widget", List.of("class", "id"))).isFalse();
    }

    @ParameterizedTest(name = "[{index}] {0} + {1}")
    @CsvSource({
            "anything, ''",
            "div, class",
            "x-custom, a;b;c"
    })
    @DisplayName("通配标签且不要求属性时总是命中")
    void testWildcardWithoutAttributes(String tagName, String attributes) {
        TagMatcher matcher = matcher(new RuleDescriptor(RuleDescriptor.WILDCARD, Set.of()));
        List<String> names = attributes.isEmpty() ? List.of() : List.of(attributes.split(";"));

        assertThat(matcher.matches(tagName, names)).isTrue();
    }

    @Test
    @DisplayName("普通属性：下划线换成连字符后忽略大小写比较")
    void testUnderscoreNormalization() {
        TagMatcher matcher = matcher(RuleDescriptor.of("card", "my-value"));

        assertThat(matcher.matches("card", List.of("my_value"))).isTrue();
        assertThat(matcher.matches("card", List.of("My_Value"))).isTrue();
        assertThat(matcher.matches("card", List.of("MY-VALUE"))).isTrue();
        assertThat(matcher.matches("card", List.of("myvalue"))).isFalse();
    }

    @Test
    @DisplayName("所有必需属性都要满足")
    void testAllRequiredAttributes() {
        TagMatcher matcher = matcher(RuleDescriptor.of("form", "asp-action", "asp-controller"));

        assertThat(matcher.matches("form", List.of("action", "controller"))).isTrue();
        assertThat(matcher.matches("form", List.of("controller", "method", "action"))).isTrue();
        assertThat(matcher.matches("form", List.of("action"))).isFalse();
    }

    @Test
    @DisplayName("任意一条规则命中即可")
    void testAnyRuleMatches() {
        TagMatcher matcher = matcher(
                RuleDescriptor.of("a", "asp-action"),
                RuleDescriptor.of("a", "asp-page"));

        assertThat(matcher.matches("a", List.of("page"))).isTrue();
        assertThat(matcher.matches("a", List.of("action"))).isTrue();
        assertThat(matcher.matches("a", List.of("href"))).isFalse();
    }

    @Test
    @DisplayName("空规则集永不命中")
    void testNoneNeverMatches() {
        TagMatcher none = new TagMatcher(RuleSet.NONE);

        assertThat(none.matches("widget", List.of("for"))).isFalse();
        assertThat(none.matches("*", List.of())).isFalse();
        assertThat(none.matches("", List.of("asp-for"))).isFalse();
    }

    @Test
    @DisplayName("不修改输入")
    void testInputsAreNotMutated() {
        List<String> attributes = new ArrayList<>(List.of("for_each", "my_value"));
        TagMatcher matcher = matcher(RuleDescriptor.of("widget", "my-value"));

        assertThat(matcher.matches("widget", attributes)).isTrue();
        assertThat(attributes).containsExactly("for_each", "my_value");
    }

    @Test
    @DisplayName("属性比较规则")
    void testIsSatisfiedBy() {
        assertThat(TagMatcher.isSatisfiedBy("asp-for", "asp-for")).isTrue();
        assertThat(TagMatcher.isSatisfiedBy("asp-for", "For")).isTrue();
        assertThat(TagMatcher.isSatisfiedBy("asp-for", "asp_for")).isFalse();
        assertThat(TagMatcher.isSatisfiedBy("data-id", "DATA_ID")).isTrue();
        assertThat(TagMatcher.isSatisfiedBy("data-id", "id")).isFalse();
    }

    @Test
    @DisplayName("空规则集参数校验")
    void testNullRuleSet() {
        assertThatThrownBy(() -> new TagMatcher(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
