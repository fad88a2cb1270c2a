package com.chih.JRender.spring.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MicrometerRenderMetrics 测试")
class MicrometerRenderMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MicrometerRenderMetrics metrics = new MicrometerRenderMetrics(registry);

    @Test
    @DisplayName("记录渲染耗时和次数")
    void testRecordRender() {
        metrics.recordRender("page", TimeUnit.MILLISECONDS.toNanos(5), true);
        metrics.recordRender("page", TimeUnit.MILLISECONDS.toNanos(3), true);
        metrics.recordRender("page", 100, false);

        assertThat(registry.get("jrender.render.count").tags("template", "page", "result", "success")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get("jrender.render.count").tags("template", "page", "result", "failure")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("jrender.render.timer").tags("template", "page", "result", "success")
                .timer().totalTime(TimeUnit.MILLISECONDS)).isEqualTo(8.0);
    }

    @Test
    @DisplayName("记录标签解析结果，标签名不作为 tag")
    void testRecordTagResolution() {
        metrics.recordTagResolution("a", true);
        metrics.recordTagResolution("div", false);
        metrics.recordTagResolution("span", false);

        assertThat(registry.get("jrender.tag.resolve.count").tag("result", "matched").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("jrender.tag.resolve.count").tag("result", "unmatched").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.find("jrender.tag.resolve.count").tagKeys("tag").counter()).isNull();
    }
}
