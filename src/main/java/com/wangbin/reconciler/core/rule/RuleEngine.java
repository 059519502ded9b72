package com.wangbin.reconciler.core.rule;

import com.wangbin.reconciler.common.exception.ReconcileException;
import com.wangbin.reconciler.core.rule.model.CriteriaGroup;
import com.wangbin.reconciler.core.rule.model.DefectPredicate;
import com.wangbin.reconciler.core.rule.model.PredicateNode;
import com.wangbin.reconciler.core.table.Row;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * 缺陷判定引擎
 * 对合并表逐行求值每条判定，结果作为同名布尔列追加。
 * 引用其他判定结果列的判定在被引用者之后的阶段执行；同一阶段内的判定互不依赖，可并行求值，
 * 每条判定只写自己的结果数组，阶段结束后统一追加到新行集。
 */
@Slf4j
public class RuleEngine {

    private final List<DefectPredicate> library;
    private final ExecutorService executor;

    public RuleEngine(List<DefectPredicate> library) {
        this(library, null);
    }

    /**
     * @param executor 并行求值线程池，为空时串行
     */
    public RuleEngine(List<DefectPredicate> library, ExecutorService executor) {
        this.library = List.copyOf(library);
        this.executor = executor;
    }

    public RuleEvaluationResult evaluate(RowSet merged) {
        long startTime = System.currentTimeMillis();
        RowSet table = insertRequiredColumns(merged);
        validateColumns(table);
        List<List<DefectPredicate>> stages = stages();

        Map<String, Long> counts = new LinkedHashMap<>();
        for (int i = 0; i < stages.size(); i++) {
            List<DefectPredicate> stage = stages.get(i);
            log.debug("判定阶段 {}: {}", i, stage);
            Map<String, boolean[]> results = evaluateStage(stage, table);
            table = append(table, stage, results);
            for (DefectPredicate predicate : stage) {
                long matched = 0;
                for (boolean value : results.get(predicate.getName())) {
                    if (value) {
                        matched++;
                    }
                }
                counts.put(predicate.getName(), matched);
            }
        }

        Map<String, Long> ordered = new LinkedHashMap<>();
        for (DefectPredicate predicate : library) {
            ordered.put(predicate.getName(), counts.get(predicate.getName()));
            log.info("判定 {}: {} 行命中 ({})", predicate.getName(), counts.get(predicate.getName()), predicate.getTitle());
        }
        log.info("缺陷判定完成: {} 条判定, {} 行, time={}ms",
                library.size(), table.size(), System.currentTimeMillis() - startTime);
        return new RuleEvaluationResult(table, ordered);
    }

    /**
     * 缺失的必需列补空串列并告警
     */
    RowSet insertRequiredColumns(RowSet table) {
        RowSet result = table;
        for (DefectPredicate predicate : library) {
            for (String column : predicate.getRequiredColumns()) {
                if (!result.hasColumn(column)) {
                    log.warn("判定 {} 缺少列 {}，已补空列，该判定可能因此减弱", predicate.getName(), column);
                    result = result.withColumn(column, row -> "");
                }
            }
        }
        return result;
    }

    private void validateColumns(RowSet table) {
        Set<String> predicateNames = predicateNames();
        for (DefectPredicate predicate : library) {
            for (String column : predicate.referencedColumns()) {
                if (!table.hasColumn(column) && !predicateNames.contains(column)) {
                    log.error("判定 {} 引用了未定义的列: {}", predicate.getName(), column);
                    throw ReconcileException.undefinedColumn(column, predicate.getName());
                }
            }
        }
    }

    /**
     * 按判定间引用关系分阶段，循环引用视为定义错误
     */
    List<List<DefectPredicate>> stages() {
        Map<String, DefectPredicate> byName = new LinkedHashMap<>();
        library.forEach(p -> byName.put(p.getName(), p));
        Map<String, Integer> levels = new HashMap<>();
        for (DefectPredicate predicate : library) {
            level(predicate, byName, levels, new HashSet<>());
        }
        List<List<DefectPredicate>> stages = new ArrayList<>();
        for (DefectPredicate predicate : library) {
            int level = levels.get(predicate.getName());
            while (stages.size() <= level) {
                stages.add(new ArrayList<>());
            }
            stages.get(level).add(predicate);
        }
        return stages;
    }

    private int level(DefectPredicate predicate, Map<String, DefectPredicate> byName,
                      Map<String, Integer> levels, Set<String> visiting) {
        Integer known = levels.get(predicate.getName());
        if (known != null) {
            return known;
        }
        if (!visiting.add(predicate.getName())) {
            throw ReconcileException.invalidPredicate(predicate.getName(), "判定之间存在循环引用");
        }
        int level = 0;
        for (String column : predicate.referencedColumns()) {
            DefectPredicate dependency = byName.get(column);
            if (dependency != null) {
                level = Math.max(level, level(dependency, byName, levels, visiting) + 1);
            }
        }
        visiting.remove(predicate.getName());
        levels.put(predicate.getName(), level);
        return level;
    }

    private Map<String, boolean[]> evaluateStage(List<DefectPredicate> stage, RowSet table) {
        Map<String, boolean[]> results = new HashMap<>();
        if (executor == null || stage.size() < 2) {
            for (DefectPredicate predicate : stage) {
                results.put(predicate.getName(), evaluatePredicate(predicate, table));
            }
            return results;
        }

        Map<String, Future<boolean[]>> futures = new LinkedHashMap<>();
        for (DefectPredicate predicate : stage) {
            futures.put(predicate.getName(), executor.submit(() -> evaluatePredicate(predicate, table)));
        }
        for (Map.Entry<String, Future<boolean[]>> entry : futures.entrySet()) {
            try {
                results.put(entry.getKey(), entry.getValue().get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("判定求值被中断: " + entry.getKey(), e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("判定求值失败: " + entry.getKey(), e.getCause());
            }
        }
        return results;
    }

    private boolean[] evaluatePredicate(DefectPredicate predicate, RowSet table) {
        if (predicate.isDebug()) {
            traceCriteria(predicate, table);
        }
        boolean[] values = new boolean[table.size()];
        for (int i = 0; i < table.size(); i++) {
            values[i] = RowPredicateEvaluator.evaluate(predicate.getRoot(), table.row(i));
        }
        return values;
    }

    /**
     * 逐个顶层子节点输出命中数与累计结果
     */
    private void traceCriteria(DefectPredicate predicate, RowSet table) {
        CriteriaGroup root = predicate.getRoot();
        boolean[] accumulated = new boolean[table.size()];
        Arrays.fill(accumulated, root.combinator().identity());
        log.info("判定 {} 调试: 组合方式={}, 初始值={}, 行数={}",
                predicate.getName(), root.combinator().getCode(), root.combinator().identity(), table.size());
        int index = 1;
        for (PredicateNode child : root.children()) {
            long matched = 0;
            long before = count(accumulated);
            for (int i = 0; i < table.size(); i++) {
                boolean value = RowPredicateEvaluator.evaluate(child, table.row(i));
                if (value) {
                    matched++;
                }
                accumulated[i] = root.combinator().combine(accumulated[i], value);
            }
            log.info("  条件 {}: {} -> 命中 {} 行, 累计 {} -> {} 行",
                    index++, child, matched, before, count(accumulated));
        }
    }

    private static long count(boolean[] values) {
        long count = 0;
        for (boolean value : values) {
            if (value) {
                count++;
            }
        }
        return count;
    }

    private static RowSet append(RowSet table, List<DefectPredicate> stage, Map<String, boolean[]> results) {
        List<String> columns = new ArrayList<>(table.columns());
        for (DefectPredicate predicate : stage) {
            columns.add(predicate.getName());
        }
        List<Row> rows = new ArrayList<>(table.size());
        for (int i = 0; i < table.size(); i++) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (DefectPredicate predicate : stage) {
                values.put(predicate.getName(), results.get(predicate.getName())[i]);
            }
            rows.add(table.row(i).withAll(values));
        }
        return RowSet.of(columns, rows);
    }

    private Set<String> predicateNames() {
        Set<String> names = new HashSet<>();
        library.forEach(p -> names.add(p.getName()));
        return names;
    }

    public List<DefectPredicate> getLibrary() {
        return library;
    }
}
