package com.chih.JRender.spring;

import com.chih.JRender.core.matching.RuleSet;
import com.chih.JRender.core.registry.TagHelperRegistry;
import com.chih.JRender.core.support.RuleSetParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.util.StringUtils;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于 Spring Resource 的 Tag Helper 规则加载器
 * <p>
 * 按配置的位置模式扫描规则文件，用 {@link RuleSetParser} 解析后注册到 {@link TagHelperRegistry}。
 * 扫描顺序即注册顺序，同一个资源被多个模式匹配时只加载一次。
 * 单个文件解析失败不影响其他文件，失败信息通过 {@link #getLoadErrors()} 暴露给健康检查。
 * 位置不存在（例如 {@code classpath:} 模式的根目录缺失）视为没有规则文件，不计入加载错误。
 * </p>
 *
 * <h3>支持的位置模式：</h3>
 * <ul>
 *   <li>Classpath 资源（包括所有 jar 包）：classpath*:tag-helpers/**&#47;*.yaml</li>
 *   <li>文件系统资源：file:/opt/app/tag-helpers/*.yml</li>
 * </ul>
 *
 * @author JRender Team
 * @see org.springframework.core.io.Resource
 */
public class SpringResourceRuleSetLoader {

    private static final Logger log = LoggerFactory.getLogger(SpringResourceRuleSetLoader.class);

    private final ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();

    private final List<String> locations;
    private final TagHelperRegistry registry;

    // 资源描述 -> 加载异常
    private final Map<String, Throwable> loadErrors = new ConcurrentHashMap<>();

    // 本加载器注册过的 Tag Helper 名称，reload 时先注销
    private final Set<String> loadedDirectives = new LinkedHashSet<>();

    public SpringResourceRuleSetLoader(List<String> locations, TagHelperRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("TagHelperRegistry cannot be null");
        }
        this.locations = locations == null ? List.of() : new ArrayList<>(locations);
        this.registry = registry;

        load();
    }

    /**
     * 注销本加载器注册过的规则，重新扫描所有位置
     */
    public synchronized void reload() {
        for (String directiveName : loadedDirectives) {
            registry.unregister(directiveName);
        }
        loadedDirectives.clear();
        loadErrors.clear();
        load();
    }

    private synchronized void load() {
        Set<String> visited = new HashSet<>();
        int fileCount = 0;

        for (String location : locations) {
            if (!StringUtils.hasText(location)) {
                continue;
            }
            Resource[] resources;
            try {
                resources = resolver.getResources(location);
            } catch (FileNotFoundException e) {
                log.debug("Tag helper location not found: {}", location);
                continue;
            } catch (IOException e) {
                log.warn("Failed to scan tag helper location: {}", location, e);
                loadErrors.put(location, e);
                continue;
            }
            for (Resource resource : resources) {
                if (isRuleResource(resource) && visited.add(getResourceId(resource))) {
                    loadResource(resource);
                    fileCount++;
                }
            }
        }
        log.info("Tag helper rules loaded: {} files, {} tag helpers, {} errors",
                fileCount, loadedDirectives.size(), loadErrors.size());
    }

    private void loadResource(Resource resource) {
        try (InputStream is = resource.getInputStream()) {
            List<RuleSet> ruleSets = RuleSetParser.parse(is, resource.getFilename());
            for (RuleSet ruleSet : ruleSets) {
                registry.register(ruleSet);
                loadedDirectives.add(ruleSet.getDirectiveName());
            }
            log.debug("Loaded {} tag helpers from {}", ruleSets.size(), resource.getDescription());
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load tag helper rule file: {}", resource.getDescription(), e);
            loadErrors.put(resource.getDescription(), e);
        }
    }

    private boolean isRuleResource(Resource resource) {
        return resource.exists() && RuleSetParser.isSupportedFile(resource.getFilename());
    }

    private static String getResourceId(Resource resource) {
        try {
            return resource.getURI().toString();
        } catch (IOException e) {
            return resource.getDescription();
        }
    }

    /**
     * @return 加载失败的资源及其异常
     */
    public Map<String, Throwable> getLoadErrors() {
        return Collections.unmodifiableMap(loadErrors);
    }

    public synchronized Set<String> getLoadedDirectives() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(loadedDirectives));
    }

    public List<String> getLocations() {
        return Collections.unmodifiableList(locations);
    }

    public TagHelperRegistry getRegistry() {
        return registry;
    }
}
