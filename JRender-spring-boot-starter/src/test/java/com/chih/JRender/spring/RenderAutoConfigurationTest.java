package com.chih.JRender.spring;

import com.chih.JRender.core.engine.RenderManager;
import com.chih.JRender.core.impl.MustacheTemplateEngine;
import com.chih.JRender.core.impl.NoOpRenderMetrics;
import com.chih.JRender.core.impl.SharedCharArrayPool;
import com.chih.JRender.core.matching.RuleSet;
import com.chih.JRender.core.registry.TagHelperRegistry;
import com.chih.JRender.core.spi.CharArrayPool;
import com.chih.JRender.core.spi.RenderMetrics;
import com.chih.JRender.core.spi.TemplateEngine;
import com.chih.JRender.core.spi.TemplateLoader;
import com.chih.JRender.spring.health.JRenderHealthIndicator;
import com.chih.JRender.spring.metrics.MicrometerRenderMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * RenderAutoConfiguration 单元测试
 *
 * 测试 Spring Boot 自动配置功能，包括：
 * - 默认 Bean 装配
 * - 配置属性绑定
 * - 用户自定义 Bean 覆盖
 * - 监控与健康检查的条件装配
 */
@DisplayName("RenderAutoConfiguration 测试")
class RenderAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(RenderAutoConfiguration.class));

    @Test
    @DisplayName("JRenderProperties 默认配置应该正确")
    void testPropertiesDefaults() {
        JRenderProperties properties = new JRenderProperties();

        assertThat(properties.getRuleLocations()).containsExactly(
                "classpath*:tag-helpers/**/*.yaml",
                "classpath*:tag-helpers/**/*.yml",
                "classpath*:tag-helpers/**/*.json");
        assertThat(properties.getTemplatePrefix()).isEqualTo("classpath:templates/");
        assertThat(properties.getTemplateSuffix()).isEqualTo(".mustache");
        assertThat(properties.getTemplateCacheSize()).isEqualTo(1000);
        assertThat(properties.getMatcherCacheSize()).isEqualTo(10_000);
        assertThat(properties.getPoolMaxArraysPerBucket()).isEqualTo(32);
        assertThat(properties.getLineSeparator()).isEqualTo("\n");
    }

    @Test
    @DisplayName("JRenderProperties 注解应该正确")
    void testPropertiesAnnotations() {
        ConfigurationProperties annotation = JRenderProperties.class.getAnnotation(ConfigurationProperties.class);

        assertThat(annotation).isNotNull();
        assertThat(annotation.prefix()).isEqualTo("j-render");
        assertThat(RenderAutoConfiguration.class.isAnnotationPresent(Configuration.class)).isTrue();
        assertThat(RenderAutoConfiguration.class.isAnnotationPresent(EnableConfigurationProperties.class)).isTrue();
    }

    @Test
    @DisplayName("默认装配所有组件")
    void testDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(CharArrayPool.class);
            assertThat(context).hasSingleBean(TemplateLoader.class);
            assertThat(context).hasSingleBean(TagHelperRegistry.class);
            assertThat(context).hasSingleBean(SpringResourceRuleSetLoader.class);
            assertThat(context).hasSingleBean(RenderManager.class);
            assertThat(context).hasSingleBean(RenderMetrics.class);
            assertThat(context).hasSingleBean(JRenderHealthIndicator.class);
            assertThat(context.getBean(TemplateEngine.class)).isInstanceOf(MustacheTemplateEngine.class);
            assertThat(context.getBean(CharArrayPool.class)).isInstanceOf(SharedCharArrayPool.class);
        });
    }

    @Test
    @DisplayName("启动时加载 classpath 下的规则文件")
    void testRulesLoadedAtStartup() {
        contextRunner.run(context -> {
            TagHelperRegistry registry = context.getBean(TagHelperRegistry.class);

            assertThat(registry.getRuleSets()).extracting(RuleSet::getDirectiveName)
                    .contains("anchor", "environment", "label");
            assertThat(registry.resolve("a", List.of("action")).getDirectiveName()).isEqualTo("anchor");
            assertThat(registry.resolve("label", List.of("for")).getDirectiveName()).isEqualTo("label");
            assertThat(registry.resolve("div", List.of("for"))).isSameAs(RuleSet.NONE);
        });
    }

    @Test
    @DisplayName("从 classpath 模板目录渲染，包括子模板")
    void testRenderFromClasspathTemplates() {
        contextRunner.run(context -> {
            RenderManager renderManager = context.getBean(RenderManager.class);

            assertThat(renderManager.renderToString("greeting", Map.of("name", "World")))
                    .isEqualTo("Hello World!");
            assertThat(renderManager.renderToString("page", Map.of("title", "T", "body", "<b>")))
                    .isEqualTo("<header>T</header><main>&lt;b&gt;</main>");
        });
    }

    @Test
    @DisplayName("配置属性绑定")
    void testPropertyBinding() {
        contextRunner
                .withPropertyValues(
                        "j-render.rule-locations=classpath:broken-helpers/valid.yml",
                        "j-render.line-separator=<br>",
                        "j-render.pool-max-arrays-per-bucket=4",
                        "j-render.template-cache-size=10")
                .run(context -> {
                    JRenderProperties properties = context.getBean(JRenderProperties.class);
                    assertThat(properties.getRuleLocations()).containsExactly("classpath:broken-helpers/valid.yml");
                    assertThat(properties.getLineSeparator()).isEqualTo("<br>");
                    assertThat(properties.getTemplateCacheSize()).isEqualTo(10);

                    SharedCharArrayPool pool = (SharedCharArrayPool) context.getBean(CharArrayPool.class);
                    assertThat(pool.getMaxArraysPerBucket()).isEqualTo(4);

                    TagHelperRegistry registry = context.getBean(TagHelperRegistry.class);
                    assertThat(registry.getRuleSets()).extracting(RuleSet::getDirectiveName)
                            .containsExactly("visibility");

                    assertThat(context.getBean(RenderManager.class).newBuffer().getLineSeparator())
                            .isEqualTo("<br>");
                });
    }

    @Test
    @DisplayName("存在 MeterRegistry 时使用 Micrometer 实现")
    void testMicrometerMetrics() {
        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> {
                    assertThat(context.getBean(RenderMetrics.class)).isInstanceOf(MicrometerRenderMetrics.class);

                    context.getBean(RenderManager.class).renderToString("greeting", Map.of("name", "x"));

                    MeterRegistry registry = context.getBean(MeterRegistry.class);
                    assertThat(registry.find("jrender.render.count")
                            .tags("template", "greeting", "result", "success").counter())
                            .isNotNull();
                });
    }

    @Test
    @DisplayName("没有 MeterRegistry 时使用 NoOp 实现")
    void testNoOpMetrics() {
        contextRunner.run(context ->
                assertThat(context.getBean(RenderMetrics.class)).isInstanceOf(NoOpRenderMetrics.class));
    }

    @Test
    @DisplayName("用户自定义 Bean 覆盖默认配置")
    void testUserBeansOverrideDefaults() {
        TemplateLoader customLoader = key -> "custom:" + key;
        RenderMetrics customMetrics = new NoOpRenderMetrics();

        contextRunner
                .withBean(TemplateLoader.class, () -> customLoader)
                .withBean(RenderMetrics.class, () -> customMetrics)
                .run(context -> {
                    assertThat(context.getBean(TemplateLoader.class)).isSameAs(customLoader);
                    assertThat(context.getBean(RenderMetrics.class)).isSameAs(customMetrics);
                    assertThat(context.getBean(RenderManager.class).renderToString("abc", Map.of()))
                            .isEqualTo("custom:abc");
                });
    }
}
