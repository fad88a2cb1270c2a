package com.chih.JRender.core.matching;

import java.util.List;
import java.util.Objects;

/**
 * 某个 Tag Helper 的全部匹配规则
 * <p>
 * 由注册方在启动时一次性构建，之后不可变，可在线程间共享。
 * {@link #NONE} 不含任何规则，表示"没有对应的 Tag Helper"。
 * </p>
 *
 * @author JRender Team
 * @since 2026/10/14
 */
public final class RuleSet {

    public static final RuleSet NONE = new RuleSet("", "", List.of());

    private final String directiveName;
    private final String originIdentifier;
    private final List<RuleDescriptor> rules;

    public RuleSet(String directiveName, String originIdentifier, List<RuleDescriptor> rules) {
        this.directiveName = directiveName == null ? "" : directiveName;
        this.originIdentifier = originIdentifier == null ? "" : originIdentifier;
        this.rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public String getDirectiveName() {
        return directiveName;
    }

    public String getOriginIdentifier() {
        return originIdentifier;
    }

    public List<RuleDescriptor> getRules() {
        return rules;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RuleSet that)) {
            return false;
        }
        return directiveName.equals(that.directiveName)
                && originIdentifier.equals(that.originIdentifier)
                && rules.equals(that.rules);
    }

    @Override
    public int hashCode() {
        return Objects.hash(directiveName, originIdentifier, rules);
    }

    @Override
    public String toString() {
        return "RuleSet{" +
                "directiveName='" + directiveName + '\'' +
                ", originIdentifier='" + originIdentifier + '\'' +
                ", rules=" + rules.size() +
                '}';
    }
}
