package com.chih.JRender.core.spi;

import java.util.Set;

/**
 * 编译模板 获取模板依赖ID
 * @author JRender Team
 * @since 2026/10/13
 */
public class CompiledTemplate {

    // 具体的模板引擎对象 (如 Mustache)
    private final Object engineObject;

    // 编译过程中发现的子模板依赖 ID
    private final Set<String> dependencies;

    public CompiledTemplate(Object engineObject, Set<String> dependencies) {
        this.engineObject = engineObject;
        this.dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
    }

    public Object getEngineObject() {
        return engineObject;
    }

    public Set<String> getDependencies() {
        return dependencies;
    }
}
