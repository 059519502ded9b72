package com.wangbin.reconciler.core.rule;

import com.wangbin.reconciler.common.enums.ResultCode;
import com.wangbin.reconciler.common.exception.ReconcileException;
import com.wangbin.reconciler.core.rule.loader.PredicateLibraryLoader;
import com.wangbin.reconciler.core.rule.model.DefectPredicate;
import com.wangbin.reconciler.core.table.Row;
import com.wangbin.reconciler.core.table.RowSet;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.wangbin.reconciler.core.table.TestRows.row;
import static com.wangbin.reconciler.core.table.TestRows.table;
import static org.junit.jupiter.api.Assertions.*;

class RuleEngineTest {

    private final PredicateLibraryLoader loader = new PredicateLibraryLoader();

    private static final String NESTED = """
            [{"name": "Nested", "combineWith": "or", "groups": [
              {"combineWith": "and", "criteria": [
                {"columns": "X", "op": "notna_or_blank"},
                {"columns": "Y", "op": "isna_or_blank"}]},
              {"combineWith": "and", "criteria": [
                {"columns": "X", "op": "isna_or_blank"},
                {"columns": "Y", "op": "notna_or_blank"}]}]}]
            """;

    private static RowSet fourRows() {
        return table(
                row("X", "a", "Y", null),
                row("X", "", "Y", "b"),
                row("X", "a", "Y", "b"),
                row("X", null, "Y", ""));
    }

    @Test
    void emptyGroupsUseCombinatorIdentity() {
        List<DefectPredicate> library = loader.parse("""
                [{"name": "EmptyAnd", "combineWith": "and"},
                 {"name": "EmptyOr", "combineWith": "or"}]
                """);

        RowSet result = new RuleEngine(library).evaluate(fourRows()).table();

        assertEquals(List.of(true, true, true, true), result.column("EmptyAnd"));
        assertEquals(List.of(false, false, false, false), result.column("EmptyOr"));
    }

    @Test
    void nestedGroupsMatchTruthTable() {
        RuleEvaluationResult result = new RuleEngine(loader.parse(NESTED)).evaluate(fourRows());

        assertEquals(List.of(true, true, false, false), result.table().column("Nested"));
        assertEquals(2L, result.defectCounts().get("Nested"));
    }

    @Test
    void inputTableIsNotModified() {
        RowSet input = fourRows();

        new RuleEngine(loader.parse(NESTED)).evaluate(input);

        assertFalse(input.hasColumn("Nested"));
    }

    @Test
    void missingRequiredColumnIsInsertedAsBlank() {
        List<DefectPredicate> library = loader.parse("""
                [{"name": "Comment", "requiredColumns": ["Remark"],
                  "criteria": [{"columns": "Remark", "op": "isna_or_blank"}]}]
                """);

        RowSet result = new RuleEngine(library).evaluate(fourRows()).table();

        assertTrue(result.hasColumn("Remark"));
        assertEquals("", result.row(0).get("Remark"));
        assertEquals(List.of(true, true, true, true), result.column("Comment"));
    }

    @Test
    void undefinedColumnIsFatal() {
        List<DefectPredicate> library = loader.parse("""
                [{"name": "Broken", "criteria": [{"columns": "Nope", "op": "notna"}]}]
                """);

        ReconcileException e = assertThrows(ReconcileException.class,
                () -> new RuleEngine(library).evaluate(fourRows()));

        assertEquals(ResultCode.UNDEFINED_COLUMN, e.getResultCode());
        assertEquals(1, e.getExitCode());
    }

    @Test
    void summaryPredicateRunsAfterItsInputs() {
        List<DefectPredicate> library = loader.parse("""
                [{"name": "Any", "combineWith": "or", "criteria": [
                   {"columns": "First", "op": "==", "value": true},
                   {"columns": "Second", "op": "==", "value": true}]},
                 {"name": "First", "criteria": [{"columns": "X", "op": "==", "value": "a"}]},
                 {"name": "Second", "criteria": [{"columns": "Y", "op": "==", "value": ""}]}]
                """);
        RuleEngine engine = new RuleEngine(library);

        List<List<DefectPredicate>> stages = engine.stages();
        RuleEvaluationResult result = engine.evaluate(fourRows());

        assertEquals(2, stages.size());
        assertEquals("Any", stages.get(1).get(0).getName());
        assertEquals(List.of(true, false, true, true), result.table().column("Any"));
        assertEquals(List.of("Any", "First", "Second"), List.copyOf(result.defectCounts().keySet()));
    }

    @Test
    void circularReferenceIsInvalid() {
        List<DefectPredicate> library = loader.parse("""
                [{"name": "P", "criteria": [{"columns": "Q", "op": "==", "value": true}]},
                 {"name": "Q", "criteria": [{"columns": "P", "op": "==", "value": true}]}]
                """);

        ReconcileException e = assertThrows(ReconcileException.class,
                () -> new RuleEngine(library).evaluate(fourRows()));

        assertEquals(ResultCode.PREDICATE_INVALID, e.getResultCode());
    }

    @Test
    void parallelEvaluationMatchesSerial() {
        List<DefectPredicate> library = loader.parse("""
                [{"name": "A", "criteria": [{"columns": "X", "op": "notna"}]},
                 {"name": "B", "criteria": [{"columns": "Y", "op": "notna_or_blank"}]},
                 {"name": "C", "debug": true, "combineWith": "or", "criteria": [
                   {"columns": "X", "op": "==", "value": "a"},
                   {"columns": "Y", "op": "==", "value": "b"}]}]
                """);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            RowSet serial = new RuleEngine(library).evaluate(fourRows()).table();
            RowSet parallel = new RuleEngine(library, executor).evaluate(fourRows()).table();

            assertEquals(serial, parallel);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void missingControllableComponentFlaggedWithoutAttachedControl() {
        List<DefectPredicate> report3 = loader.load("classpath:defect-predicates.json").stream()
                .filter(p -> p.getName().equals("Report3"))
                .toList();
        RowSet merged = table(
                controllable("", false),
                controllable("[(AREC:141):252:6-1 C]", false),
                controllable("", true));

        RowSet result = new RuleEngine(report3).evaluate(merged).table();

        assertEquals(List.of(true, true, false), result.column("Report3"));
    }

    private static Row controllable(String ctrl1Addr, boolean aliasExists) {
        return row("GenericType", "SD", "Controllable", "1", "RTUId", "(AREC:141)",
                "PowerOn Alias Exists", aliasExists, "IGNORE_RTU", false, "IGNORE_POINT", false,
                "OLD_DATA", false, "Ctrl1Addr", ctrl1Addr, "Ctrl2Addr", "");
    }
}
