package com.chih.JRender.spring.metrics;

import com.chih.JRender.core.spi.RenderMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * 基于 Micrometer 的监控实现
 * <p>
 * 监控指标说明：
 * <ul>
 *   <li>jrender.render.timer: 模板渲染耗时，tags: template={templateKey}, result={success|failure}</li>
 *   <li>jrender.render.count: 模板渲染次数计数器，tags: template={templateKey}, result={success|failure}</li>
 *   <li>jrender.tag.resolve.count: 标签解析次数，tags: result={matched|unmatched}</li>
 * </ul>
 * </p>
 * <p>
 * <strong>注意</strong>：标签名不作为 tag，模板中出现的任意标签名都会经过解析，作为 tag 会造成基数爆炸。
 * </p>
 */
public class MicrometerRenderMetrics implements RenderMetrics {

    private final MeterRegistry registry;

    public MicrometerRenderMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordRender(String templateKey, long durationNs, boolean success) {
        String result = success ? "success" : "failure";

        Timer.builder("jrender.render.timer")
                .description("Timer for template rendering")
                .tag("template", templateKey)
                .tag("result", result)
                .register(registry)
                .record(durationNs, TimeUnit.NANOSECONDS);

        Counter.builder("jrender.render.count")
                .description("Counter for template rendering")
                .tag("template", templateKey)
                .tag("result", result)
                .register(registry)
                .increment();
    }

    @Override
    public void recordTagResolution(String tagName, boolean matched) {
        Counter.builder("jrender.tag.resolve.count")
                .description("Counter for tag helper resolution")
                .tag("result", matched ? "matched" : "unmatched")
                .register(registry)
                .increment();
    }
}
