package com.chih.JRender.spring.health;

import com.chih.JRender.core.registry.TagHelperRegistry;
import com.chih.JRender.spring.SpringResourceRuleSetLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JRenderHealthIndicator 测试")
class JRenderHealthIndicatorTest {

    @Test
    @DisplayName("所有规则文件加载成功时为 UP")
    void testUp() {
        SpringResourceRuleSetLoader loader = new SpringResourceRuleSetLoader(
                List.of("classpath:tag-helpers/*.yaml"), new TagHelperRegistry());

        Health health = new JRenderHealthIndicator(loader).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("tagHelperCount", 2);
    }

    @Test
    @DisplayName("配置了不存在的位置时仍为 UP")
    void testUpWithMissingLocation() {
        SpringResourceRuleSetLoader loader = new SpringResourceRuleSetLoader(
                List.of("classpath:tag-helpers/*.yaml", "classpath:nonexistent/*.yaml"), new TagHelperRegistry());

        Health health = new JRenderHealthIndicator(loader).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("tagHelperCount", 2);
    }

    @Test
    @DisplayName("存在加载失败的规则文件时为 DOWN")
    void testDown() {
        SpringResourceRuleSetLoader loader = new SpringResourceRuleSetLoader(
                List.of("classpath:broken-helpers/*"), new TagHelperRegistry());

        Health health = new JRenderHealthIndicator(loader).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("errorCount", 1);
        assertThat((Map<?, ?>) health.getDetails().get("errors")).hasSize(1);
    }
}
