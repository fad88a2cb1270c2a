package com.chih.JRender.spring;

import com.chih.JRender.core.engine.RenderManager;
import com.chih.JRender.core.impl.MustacheTemplateEngine;
import com.chih.JRender.core.impl.NoOpRenderMetrics;
import com.chih.JRender.core.impl.SharedCharArrayPool;
import com.chih.JRender.core.registry.TagHelperRegistry;
import com.chih.JRender.core.spi.CharArrayPool;
import com.chih.JRender.core.spi.RenderMetrics;
import com.chih.JRender.core.spi.TemplateEngine;
import com.chih.JRender.core.spi.TemplateLoader;
import com.chih.JRender.spring.health.JRenderHealthIndicator;
import com.chih.JRender.spring.metrics.MicrometerRenderMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * JRender Spring Boot 自动配置类。
 * <p>
 * 负责创建渲染和 Tag Helper 解析所需的全部组件，所有 Bean 都可以由用户自定义覆盖。
 * </p>
 *
 * <h3>Bean 配置策略：</h3>
 * <ul>
 *   <li><strong>@ConditionalOnMissingBean</strong>：允许用户自定义实现覆盖默认配置</li>
 *   <li><strong>@ConditionalOnClass</strong>：Micrometer、Actuator 在类路径中时才启用监控和健康检查</li>
 * </ul>
 *
 * <h3>使用示例：</h3>
 * <pre>{@code
 * j-render:
 *   rule-locations:
 *     - classpath*:tag-helpers/*.yaml
 *     - file:./tag-helpers/*.yaml
 *   template-prefix: classpath:views/
 *   template-suffix: .mustache
 *   line-separator: "\r\n"
 * }</pre>
 *
 * @author JRender Team
 * @since 2026/10/17
 * @see JRenderProperties
 * @see RenderManager
 * @see TagHelperRegistry
 */
@Configuration
@EnableConfigurationProperties(JRenderProperties.class)
public class RenderAutoConfiguration {

    /**
     * 字符数组池，所有渲染共享
     */
    @Bean
    @ConditionalOnMissingBean(CharArrayPool.class)
    public CharArrayPool charArrayPool(JRenderProperties properties) {
        return new SharedCharArrayPool(properties.getPoolMaxArraysPerBucket());
    }

    @Bean
    @ConditionalOnMissingBean(TemplateEngine.class)
    public TemplateEngine templateEngine() {
        return new MustacheTemplateEngine();
    }

    @Bean
    @ConditionalOnMissingBean(TemplateLoader.class)
    public TemplateLoader templateLoader(ResourceLoader resourceLoader, JRenderProperties properties) {
        return new SpringResourceTemplateLoader(resourceLoader, properties.getTemplatePrefix(),
                properties.getTemplateSuffix());
    }

    /**
     * 监控组件配置。
     * <p>
     * Micrometer 在类路径中且存在 MeterRegistry Bean 时使用 Micrometer 实现，否则使用 NoOp 实现。
     * </p>
     */
    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean(RenderMetrics.class)
        public RenderMetrics renderMetrics(ObjectProvider<MeterRegistry> registry) {
            MeterRegistry meterRegistry = registry.getIfAvailable();
            return meterRegistry != null ? new MicrometerRenderMetrics(meterRegistry) : new NoOpRenderMetrics();
        }
    }

    // 保底配置：如果没有 Metrics 环境，注入空实现
    @Bean
    @ConditionalOnMissingBean(RenderMetrics.class)
    public RenderMetrics defaultRenderMetrics() {
        return new NoOpRenderMetrics();
    }

    @Bean
    @ConditionalOnMissingBean(TagHelperRegistry.class)
    public TagHelperRegistry tagHelperRegistry(RenderMetrics metrics, JRenderProperties properties) {
        return new TagHelperRegistry(metrics, properties.getMatcherCacheSize());
    }

    /**
     * 启动时扫描规则文件并注册到 {@link TagHelperRegistry}
     */
    @Bean
    @ConditionalOnMissingBean(SpringResourceRuleSetLoader.class)
    public SpringResourceRuleSetLoader springResourceRuleSetLoader(JRenderProperties properties,
            TagHelperRegistry registry) {
        return new SpringResourceRuleSetLoader(properties.getRuleLocations(), registry);
    }

    @Bean
    @ConditionalOnMissingBean(RenderManager.class)
    public RenderManager renderManager(TemplateLoader loader,
            TemplateEngine engine,
            CharArrayPool pool,
            RenderMetrics metrics,
            JRenderProperties properties) {
        return new RenderManager(loader, engine, pool, metrics, properties.getTemplateCacheSize(),
                properties.getLineSeparator());
    }

    /**
     * 健康检查自动配置
     * 只有当引入了 Actuator (存在 HealthIndicator 类) 时才生效
     */
    @Configuration
    @ConditionalOnClass(HealthIndicator.class)
    static class HealthCheckConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "jRenderHealthIndicator")
        public JRenderHealthIndicator jRenderHealthIndicator(SpringResourceRuleSetLoader ruleSetLoader) {
            return new JRenderHealthIndicator(ruleSetLoader);
        }
    }
}
