package com.chih.JRender.core.spi;

/**
 * 监控指标 SPI 接口
 *
 * @author JRender Team
 */
public interface RenderMetrics {

    /**
     * 记录一次模板渲染
     *
     * @param templateKey 模板 key
     * @param durationNs 耗时 (纳秒)
     * @param success 是否成功
     */
    void recordRender(String templateKey, long durationNs, boolean success);

    /**
     * 记录一次标签解析
     *
     * @param tagName 标签名
     * @param matched 是否命中了某个 Tag Helper
     */
    void recordTagResolution(String tagName, boolean matched);
}
