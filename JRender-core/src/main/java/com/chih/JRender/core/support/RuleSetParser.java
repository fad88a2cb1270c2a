package com.chih.JRender.core.support;

import com.chih.JRender.core.exception.RuleSetParseException;
import com.chih.JRender.core.matching.RuleDescriptor;
import com.chih.JRender.core.matching.RuleSet;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tag Helper 规则文件解析器
 * <p>
 * 支持 YAML（.yaml / .yml）和 JSON（.json），一个文件可以声明多个 Tag Helper，
 * 顶层 Key 即 Tag Helper 名称，文件中的顺序即注册顺序。
 * </p>
 *
 * <h3>格式示例：</h3>
 * <pre>{@code
 * anchor:
 *   origin: web-helpers
 *   rules:
 *     - tagName: a
 *       requiredAttributes: [asp-action]
 *     - tagName: a
 *       requiredAttributes: [asp-page]
 *
 * environment:
 *   rules:
 *     - tagName: environment      # 不要求属性
 * }</pre>
 * <p>
 * {@code origin} 缺省时使用文件名；{@code tagName} 缺省时为通配符 {@code *}。
 * </p>
 *
 * @author JRender Team
 * @since 2026/10/15
 */
public class RuleSetParser {

    private static final Logger log = LoggerFactory.getLogger(RuleSetParser.class);

    private static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".yaml", ".yml", ".json");

    /**
     * 最大文件大小限制（10MB），防止误选大文件导致 OOM
     */
    private static final int MAX_FILE_SIZE = 10 * 1024 * 1024;

    private static final ObjectMapper YAML_MAPPER = RenderObjectMapperFactory.createYamlMapper();
    private static final ObjectMapper JSON_MAPPER = RenderObjectMapperFactory.createJsonMapper();

    private static final TypeReference<LinkedHashMap<String, RuleSetDocument>> DOCUMENT_TYPE = new TypeReference<>() {};

    /**
     * 判断文件是否为支持的规则格式（大小写不敏感）
     */
    public static boolean isSupportedFile(String filename) {
        if (filename == null) {
            return false;
        }
        String lowerFilename = filename.toLowerCase();
        return SUPPORTED_EXTENSIONS.stream().anyMatch(lowerFilename::endsWith);
    }

    /**
     * 解析规则文件
     *
     * @param is 输入流，调用方负责关闭
     * @param filename 文件名（用于判断格式和生成默认 origin）
     * @return 按文件顺序排列的 RuleSet
     * @throws IOException 读取失败
     * @throws RuleSetParseException 内容格式错误或文件过大
     */
    public static List<RuleSet> parse(InputStream is, String filename) throws IOException {
        if (is == null) {
            throw new IllegalArgumentException("InputStream cannot be null");
        }
        if (filename == null || filename.trim().isEmpty()) {
            throw new IllegalArgumentException("Filename cannot be null or empty");
        }
        if (!isSupportedFile(filename)) {
            log.warn("Unsupported file type: {}. Supported types: {}", filename, SUPPORTED_EXTENSIONS);
            return Collections.emptyList();
        }

        String content = normalizeContent(readLimited(is, filename));
        if (content.isBlank()) {
            return Collections.emptyList();
        }

        ObjectMapper mapper = filename.toLowerCase().endsWith(".json") ? JSON_MAPPER : YAML_MAPPER;
        Map<String, RuleSetDocument> documents;
        try {
            documents = mapper.readValue(content, DOCUMENT_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse tag helper rule file: {}. Error: {}", filename, e.getOriginalMessage());
            throw new RuleSetParseException(filename, e);
        }
        if (documents == null) {
            return Collections.emptyList();
        }

        String defaultOrigin = stripPath(filename);
        List<RuleSet> result = new ArrayList<>(documents.size());
        for (Map.Entry<String, RuleSetDocument> entry : documents.entrySet()) {
            result.add(toRuleSet(entry.getKey(), entry.getValue(), defaultOrigin, filename));
        }
        return result;
    }

    /**
     * 移除 BOM 头，统一换行符
     */
    public static String normalizeContent(String content) {
        if (content == null) {
            return "";
        }
        if (content.startsWith("\uFEFF")) {
            content = content.substring(1);
        }
        return content.replace("\r\n", "\n");
    }

    private static RuleSet toRuleSet(String directiveName, RuleSetDocument document, String defaultOrigin,
                                     String filename) {
        if (document == null) {
            throw new RuleSetParseException(filename, "tag helper '" + directiveName + "' has no definition");
        }
        List<RuleDescriptor> rules = new ArrayList<>();
        if (document.rules() != null) {
            for (RuleDocument rule : document.rules()) {
                if (rule == null) {
                    continue;
                }
                String tagName = rule.tagName() == null || rule.tagName().isBlank()
                        ? RuleDescriptor.WILDCARD
                        : rule.tagName().trim();
                Set<String> attributes = new LinkedHashSet<>();
                if (rule.requiredAttributes() != null) {
                    for (String attribute : rule.requiredAttributes()) {
                        if (attribute != null && !attribute.isBlank()) {
                            attributes.add(attribute.trim());
                        }
                    }
                }
                rules.add(new RuleDescriptor(tagName, attributes));
            }
        }
        if (rules.isEmpty()) {
            log.warn("Tag helper '{}' in {} declares no rules and will never match", directiveName, filename);
        }
        String origin = document.origin() == null || document.origin().isBlank() ? defaultOrigin : document.origin();
        return new RuleSet(directiveName, origin, rules);
    }

    private static String readLimited(InputStream is, String filename) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] data = new byte[8192];
        int nRead;
        int totalBytes = 0;
        while ((nRead = is.read(data, 0, data.length)) != -1) {
            totalBytes += nRead;
            if (totalBytes > MAX_FILE_SIZE) {
                throw new RuleSetParseException(filename, String.format(
                        "file is too large (%d bytes), maximum allowed size: %d bytes", totalBytes, MAX_FILE_SIZE));
            }
            buffer.write(data, 0, nRead);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static String stripPath(String filename) {
        int lastSlash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        return lastSlash >= 0 ? filename.substring(lastSlash + 1) : filename;
    }

    // Jackson 绑定用的文件结构
    record RuleSetDocument(String origin, List<RuleDocument> rules) {
    }

    record RuleDocument(String tagName, List<String> requiredAttributes) {
    }
}
