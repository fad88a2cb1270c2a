package com.chih.JRender.core.impl;

import com.chih.JRender.core.spi.RenderMetrics;

public class NoOpRenderMetrics implements RenderMetrics {
    @Override
    public void recordRender(String templateKey, long durationNs, boolean success) {
        // Do nothing
    }

    @Override
    public void recordTagResolution(String tagName, boolean matched) {
        // Do nothing
    }
}
