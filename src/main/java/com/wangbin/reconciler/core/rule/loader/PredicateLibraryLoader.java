package com.wangbin.reconciler.core.rule.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.reconciler.common.exception.ReconcileException;
import com.wangbin.reconciler.core.rule.model.Combinator;
import com.wangbin.reconciler.core.rule.model.CriteriaGroup;
import com.wangbin.reconciler.core.rule.model.Criterion;
import com.wangbin.reconciler.core.rule.model.DefectPredicate;
import com.wangbin.reconciler.core.rule.model.Operator;
import com.wangbin.reconciler.core.rule.model.PredicateNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 判定规则库加载器
 * 从JSON文档构建判定树；未知运算符、非法组合方式或列数不符在加载时即失败。
 *
 * <pre>
 * {"predicates": [{"name": "Report1", "title": "...", "debug": false,
 *   "requiredColumns": ["GenericType"], "combineWith": "and",
 *   "criteria": [{"columns": "GenericType", "op": "==", "value": "A"}],
 *   "groups": [{"combineWith": "or", "criteria": [...], "groups": [...]}]}]}
 * </pre>
 */
@Slf4j
public class PredicateLibraryLoader {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final ResourceLoader resourceLoader;

    public PredicateLibraryLoader() {
        this(new DefaultResourceLoader());
    }

    public PredicateLibraryLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * 按位置加载，支持 classpath: 前缀与文件路径
     */
    public List<DefectPredicate> load(String location) {
        String resolved = location.startsWith("classpath:") || location.startsWith("file:")
                ? location : "file:" + location;
        Resource resource = resourceLoader.getResource(resolved);
        if (!resource.exists()) {
            throw ReconcileException.configError("判定规则库不存在: " + location);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            List<DefectPredicate> predicates = parse(objectMapper.readTree(inputStream));
            log.info("判定规则库加载完成: {}, {} 条判定", location, predicates.size());
            return predicates;
        } catch (IOException e) {
            log.error("判定规则库读取失败: {}", location, e);
            throw ReconcileException.configError("判定规则库读取失败: " + location + ", " + e.getMessage());
        }
    }

    public List<DefectPredicate> parse(String json) {
        try {
            return parse(objectMapper.readTree(json));
        } catch (IOException e) {
            throw ReconcileException.configError("判定规则库JSON格式错误: " + e.getMessage());
        }
    }

    public List<DefectPredicate> parse(JsonNode document) {
        JsonNode list = document.isArray() ? document : document.path("predicates");
        if (!list.isArray()) {
            throw ReconcileException.configError("判定规则库缺少 predicates 数组");
        }
        List<DefectPredicate> predicates = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (JsonNode node : list) {
            DefectPredicate predicate = parsePredicate(node);
            if (!names.add(predicate.getName())) {
                throw ReconcileException.invalidPredicate(predicate.getName(), "判定名称重复");
            }
            predicates.add(predicate);
        }
        return predicates;
    }

    private DefectPredicate parsePredicate(JsonNode node) {
        String name = node.path("name").asText(null);
        if (name == null || name.isBlank()) {
            throw ReconcileException.invalidPredicate(String.valueOf(node), "缺少判定名称");
        }
        DefectPredicate.DefectPredicateBuilder builder = DefectPredicate.builder()
                .name(name)
                .title(node.path("title").asText(name))
                .debug(node.path("debug").asBoolean(false))
                .root(parseGroup(node, name));
        for (JsonNode column : node.path("requiredColumns")) {
            builder.requiredColumn(column.asText());
        }
        return builder.build();
    }

    private CriteriaGroup parseGroup(JsonNode node, String predicate) {
        String code = node.path("combineWith").asText(null);
        Combinator combinator = Combinator.fromCode(code);
        if (combinator == null) {
            throw ReconcileException.invalidPredicate(predicate, "未知组合方式: " + code);
        }
        List<PredicateNode> children = new ArrayList<>();
        for (JsonNode criterion : node.path("criteria")) {
            children.add(parseCriterion(criterion, predicate));
        }
        for (JsonNode group : node.path("groups")) {
            children.add(parseGroup(group, predicate));
        }
        return new CriteriaGroup(combinator, children);
    }

    private Criterion parseCriterion(JsonNode node, String predicate) {
        String expression = node.path("columns").asText("");
        String code = node.path("op").asText(null);
        Operator operator = Operator.fromCode(code);
        if (operator == null) {
            throw ReconcileException.unknownOperator(code, predicate);
        }
        List<List<String>> groups = splitColumns(expression);
        validateArity(operator, groups, expression, predicate);

        Object value = toValue(node.get("value"));
        if (operator.requiresValue() && !node.has("value")) {
            throw ReconcileException.invalidPredicate(predicate, expression + " " + code + " 缺少比较值");
        }
        return new Criterion(expression, groups, operator, value);
    }

    static List<List<String>> splitColumns(String expression) {
        List<List<String>> groups = new ArrayList<>();
        if (expression.isBlank()) {
            return groups;
        }
        for (String group : expression.split("\\|")) {
            List<String> columns = new ArrayList<>();
            for (String column : group.split(",")) {
                if (!column.isBlank()) {
                    columns.add(column.strip());
                }
            }
            groups.add(columns);
        }
        return groups;
    }

    private static void validateArity(Operator operator, List<List<String>> groups, String expression,
                                      String predicate) {
        int total = groups.stream().mapToInt(List::size).sum();
        boolean valid = switch (operator.getArity()) {
            case NONE -> true;
            case SINGLE -> groups.size() == 1 && total == 1;
            case LIST -> groups.size() == 1 && total >= 1;
            case GROUPS -> !groups.isEmpty() && groups.stream().noneMatch(List::isEmpty);
            case PAIRS -> !groups.isEmpty() && groups.stream().allMatch(g -> g.size() == 2);
            case TRIPLES -> !groups.isEmpty() && groups.stream().allMatch(g -> g.size() == 3);
        };
        if (!valid) {
            throw ReconcileException.invalidPredicate(predicate,
                    "运算符 " + operator.getCode() + " 的列参数不合法: '" + expression + "'");
        }
    }

    /**
     * JSON值转为比较值：整数统一为Long，数组转为列表
     */
    private static Object toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isArray()) {
            List<Object> values = new ArrayList<>();
            node.forEach(element -> values.add(toValue(element)));
            return values;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        return node.asText();
    }
}
