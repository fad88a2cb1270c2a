package com.chih.JRender.spring.health;

import com.chih.JRender.spring.SpringResourceRuleSetLoader;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * JRender 健康检查指示器
 * 如果存在加载失败的 Tag Helper 规则文件，状态标记为 DOWN
 *
 * @author JRender Team
 * @since 2026/10/17
 */
public class JRenderHealthIndicator extends AbstractHealthIndicator {

    private final SpringResourceRuleSetLoader ruleSetLoader;

    public JRenderHealthIndicator(SpringResourceRuleSetLoader ruleSetLoader) {
        this.ruleSetLoader = ruleSetLoader;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) throws Exception {
        Map<String, Throwable> errors = ruleSetLoader.getLoadErrors();
        int tagHelperCount = ruleSetLoader.getRegistry().size();

        if (errors.isEmpty()) {
            builder.up().withDetail("message", "All tag helper rules loaded successfully.")
                    .withDetail("tagHelperCount", tagHelperCount);
        } else {
            builder.status(Status.DOWN).withDetail("message", "Some tag helper rule files failed to load.")
                    .withDetail("tagHelperCount", tagHelperCount)
                    .withDetail("errorCount", errors.size())
                    // 列出具体失败的文件和错误信息
                    .withDetail("errors", errors.entrySet().stream()
                            .collect(Collectors.toMap(Map.Entry::getKey, e -> String.valueOf(e.getValue().getMessage()))));
        }
    }
}
