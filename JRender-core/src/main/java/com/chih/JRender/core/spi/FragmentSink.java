package com.chih.JRender.core.spi;

import com.chih.JRender.core.fragment.Fragment;

import java.io.IOException;

/**
 * 片段输出 SPI
 * <p>
 * 由宿主渲染管线提供，按写入顺序逐个接收片段并原样输出。
 * </p>
 *
 * @author JRender Team
 * @since 2026/10/12
 */
@FunctionalInterface
public interface FragmentSink {

    /**
     * 原样写出一个片段
     *
     * @param fragment 待输出片段
     * @throws IOException 底层输出失败
     */
    void write(Fragment fragment) throws IOException;
}
