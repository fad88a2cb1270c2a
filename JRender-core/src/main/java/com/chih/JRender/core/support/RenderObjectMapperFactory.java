package com.chih.JRender.core.support;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * ObjectMapper 工厂类。
 * <p>
 * Tag Helper 规则文件的 YAML / JSON 解析共用同一套配置，只用于读取：
 * </p>
 *
 * <h3>配置策略说明：</h3>
 * <ul>
 *   <li>FAIL_ON_UNKNOWN_PROPERTIES: false - 容忍未知字段，提高兼容性</li>
 *   <li>ACCEPT_SINGLE_VALUE_AS_ARRAY: true - {@code requiredAttributes: asp-for} 与单元素列表等价</li>
 * </ul>
 *
 * @author JRender Team
 * @since 2026/10/15
 */
public class RenderObjectMapperFactory {

    /**
     * 创建用于 YAML 解析的 ObjectMapper。
     *
     * @return 配置好的 YAML ObjectMapper，线程安全可重用
     */
    public static ObjectMapper createYamlMapper() {
        return configure(new ObjectMapper(new YAMLFactory()));
    }

    /**
     * 创建用于 JSON 解析的 ObjectMapper。
     * 与 YAML 映射器保持一致的配置策略，确保行为统一。
     *
     * @return 配置好的 JSON ObjectMapper，线程安全可重用
     */
    public static ObjectMapper createJsonMapper() {
        return configure(new ObjectMapper());
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        /* 反序列化配置：遇到未知属性时不抛出异常，提高向前兼容性 */
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

        return mapper;
    }
}
