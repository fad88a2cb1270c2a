package com.chih.JRender.core.support;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RenderObjectMapperFactory 测试")
class RenderObjectMapperFactoryTest {

    @Test
    @DisplayName("YAML 与 JSON 映射器配置一致")
    void testConsistentConfiguration() {
        ObjectMapper yaml = RenderObjectMapperFactory.createYamlMapper();
        ObjectMapper json = RenderObjectMapperFactory.createJsonMapper();

        assertThat(yaml.getFactory()).isInstanceOf(YAMLFactory.class);
        assertThat(json.getFactory()).isNotInstanceOf(YAMLFactory.class);

        for (ObjectMapper mapper : new ObjectMapper[]{yaml, json}) {
            assertThat(mapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)).isFalse();
            assertThat(mapper.isEnabled(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)).isTrue();
        }
    }

    @Test
    @DisplayName("只保留读取规则所需的配置，不注册额外模块")
    void testNoExtraModules() throws Exception {
        ObjectMapper yaml = RenderObjectMapperFactory.createYamlMapper();

        assertThat(yaml.getRegisteredModuleIds()).isEmpty();

        RuleHolder holder = yaml.readValue("requiredAttributes: asp-for\nunknown: 1\n", RuleHolder.class);
        assertThat(holder.requiredAttributes).containsExactly("asp-for");
    }

    static class RuleHolder {
        public List<String> requiredAttributes;
    }
}
