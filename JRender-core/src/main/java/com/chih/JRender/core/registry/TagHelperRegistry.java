package com.chih.JRender.core.registry;

import com.chih.JRender.core.impl.NoOpRenderMetrics;
import com.chih.JRender.core.matching.RuleDescriptor;
import com.chih.JRender.core.matching.RuleSet;
import com.chih.JRender.core.matching.TagMatcher;
import com.chih.JRender.core.spi.RenderMetrics;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tag Helper 注册表
 * <p>
 * 保存所有已注册的 {@link RuleSet}，每个 RuleSet 对应一个预先构建好的 {@link TagMatcher}。
 * 模板求值器遇到无法识别的标签时调用 {@link #resolve(String, Collection)}，
 * 按注册顺序返回第一个命中的 RuleSet，没有命中时返回 {@link RuleSet#NONE}。
 * </p>
 *
 * <h3>缓存策略：</h3>
 * <ul>
 *   <li>按大小写折叠后的标签名缓存候选 Matcher（含通配规则或点名该标签的 RuleSet），避免每次遍历全部注册项</li>
 *   <li>属性组合不进入缓存 Key，属性匹配始终实时计算</li>
 *   <li>候选缓存属于注册表快照，注册表变更时随快照一起替换</li>
 * </ul>
 *
 * <h3>线程安全：</h3>
 * 注册与注销串行执行，每次变更构建新的 {@link Snapshot}（Matcher 表 + 空的候选缓存）并通过一次 volatile 写发布。
 * 查询只读取一次快照，候选结果只会写入同一个快照的缓存，不会把旧注册表的计算结果留给新注册表。
 *
 * @author JRender Team
 * @since 2026/10/15
 */
public class TagHelperRegistry {

    private static final Logger log = LoggerFactory.getLogger(TagHelperRegistry.class);

    public static final long DEFAULT_MAXIMUM_CACHE_SIZE = 10_000;

    private final RenderMetrics metrics;
    private final long maximumCacheSize;

    private volatile Snapshot snapshot;

    /**
     * 不可变的注册表状态
     *
     * @param matchers 注册顺序即解析优先级
     * @param candidates 折叠后的标签名 -> 候选 Matcher
     */
    private record Snapshot(Map<String, TagMatcher> matchers, Cache<String, List<TagMatcher>> candidates) {
    }

    public TagHelperRegistry() {
        this(new NoOpRenderMetrics(), DEFAULT_MAXIMUM_CACHE_SIZE);
    }

    public TagHelperRegistry(RenderMetrics metrics, long maximumCacheSize) {
        this.metrics = metrics == null ? new NoOpRenderMetrics() : metrics;
        this.maximumCacheSize = maximumCacheSize;
        this.snapshot = newSnapshot(Collections.emptyMap());
    }

    private Snapshot newSnapshot(Map<String, TagMatcher> matchers) {
        Cache<String, List<TagMatcher>> candidates = Caffeine.newBuilder()
                .maximumSize(maximumCacheSize)
                .build();
        return new Snapshot(Collections.unmodifiableMap(matchers), candidates);
    }

    /**
     * 注册 RuleSet；同名 Tag Helper 会被替换
     */
    public synchronized void register(RuleSet ruleSet) {
        if (ruleSet == null || ruleSet.getDirectiveName().isEmpty()) {
            throw new IllegalArgumentException("RuleSet must have a directive name");
        }
        Map<String, TagMatcher> next = new LinkedHashMap<>(snapshot.matchers());
        TagMatcher previous = next.put(ruleSet.getDirectiveName(), new TagMatcher(ruleSet));
        snapshot = newSnapshot(next);

        if (previous != null) {
            log.debug("Tag helper replaced: {} (origin: {} -> {})", ruleSet.getDirectiveName(),
                    previous.getRuleSet().getOriginIdentifier(), ruleSet.getOriginIdentifier());
        } else {
            log.debug("Tag helper registered: {} ({} rules, origin: {})", ruleSet.getDirectiveName(),
                    ruleSet.getRules().size(), ruleSet.getOriginIdentifier());
        }
    }

    public void registerAll(Collection<RuleSet> ruleSets) {
        for (RuleSet ruleSet : ruleSets) {
            register(ruleSet);
        }
    }

    /**
     * @return 被移除的 RuleSet
     */
    public synchronized Optional<RuleSet> unregister(String directiveName) {
        if (!snapshot.matchers().containsKey(directiveName)) {
            return Optional.empty();
        }
        Map<String, TagMatcher> next = new LinkedHashMap<>(snapshot.matchers());
        TagMatcher removed = next.remove(directiveName);
        snapshot = newSnapshot(next);
        log.debug("Tag helper unregistered: {}", directiveName);
        return Optional.of(removed.getRuleSet());
    }

    public Optional<TagMatcher> getMatcher(String directiveName) {
        return Optional.ofNullable(snapshot.matchers().get(directiveName));
    }

    public List<RuleSet> getRuleSets() {
        List<RuleSet> result = new ArrayList<>();
        for (TagMatcher matcher : snapshot.matchers().values()) {
            result.add(matcher.getRuleSet());
        }
        return Collections.unmodifiableList(result);
    }

    public int size() {
        return snapshot.matchers().size();
    }

    /**
     * 查找标签对应的 Tag Helper
     *
     * @param tagName 模板中的标签名
     * @param attributeNames 模板中的属性名
     * @return 第一个命中的 RuleSet，或 {@link RuleSet#NONE}
     */
    public RuleSet resolve(String tagName, Collection<String> attributeNames) {
        Snapshot current = snapshot;
        List<TagMatcher> candidateMatchers = current.candidates().get(foldCase(tagName),
                key -> collectCandidates(current.matchers(), tagName));

        for (TagMatcher matcher : candidateMatchers) {
            if (matcher.matches(tagName, attributeNames)) {
                metrics.recordTagResolution(tagName, true);
                return matcher.getRuleSet();
            }
        }
        metrics.recordTagResolution(tagName, false);
        return RuleSet.NONE;
    }

    public boolean isDirective(String tagName, Collection<String> attributeNames) {
        return resolve(tagName, attributeNames) != RuleSet.NONE;
    }

    public void clearCache() {
        snapshot.candidates().invalidateAll();
    }

    /**
     * 逐字符折叠大小写，长度不变；与 {@link String#equalsIgnoreCase(String)} 判定相等的标签名得到同一个 key
     */
    static String foldCase(String tagName) {
        char[] folded = new char[tagName.length()];
        for (int i = 0; i < folded.length; i++) {
            folded[i] = Character.toLowerCase(Character.toUpperCase(tagName.charAt(i)));
        }
        return new String(folded);
    }

    private static List<TagMatcher> collectCandidates(Map<String, TagMatcher> matchers, String tagName) {
        List<TagMatcher> result = new ArrayList<>();
        for (TagMatcher matcher : matchers.values()) {
            for (RuleDescriptor rule : matcher.getRuleSet().getRules()) {
                if (rule.isWildcard() || rule.tagName().equalsIgnoreCase(tagName)) {
                    result.add(matcher);
                    break;
                }
            }
        }
        return List.copyOf(result);
    }
}
