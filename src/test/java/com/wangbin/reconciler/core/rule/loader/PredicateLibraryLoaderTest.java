package com.wangbin.reconciler.core.rule.loader;

import com.wangbin.reconciler.common.enums.ResultCode;
import com.wangbin.reconciler.common.exception.ReconcileException;
import com.wangbin.reconciler.core.rule.model.CriteriaGroup;
import com.wangbin.reconciler.core.rule.model.Criterion;
import com.wangbin.reconciler.core.rule.model.DefectPredicate;
import com.wangbin.reconciler.core.rule.model.Operator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PredicateLibraryLoaderTest {

    private final PredicateLibraryLoader loader = new PredicateLibraryLoader();

    @Test
    void defaultLibraryLoads() {
        List<DefectPredicate> library = loader.load("classpath:defect-predicates.json");

        assertEquals(12, library.size());
        assertEquals("Report1", library.get(0).getName());
        assertEquals("ReportANY", library.get(11).getName());
        assertTrue(library.get(11).referencedColumns().contains("Report11"));
        assertTrue(library.get(8).getRequiredColumns().contains("AlarmMismatchComment"));
    }

    @Test
    void criterionValuesAreTyped() {
        List<DefectPredicate> library = loader.parse("""
                {"predicates": [{"name": "P", "criteria": [
                  {"columns": "A", "op": "==", "value": 2},
                  {"columns": "B", "op": "in", "value": ["SD", "DD"]},
                  {"columns": "C", "op": "==", "value": false}]}]}
                """);

        CriteriaGroup root = library.get(0).getRoot();
        assertEquals(2L, ((Criterion) root.children().get(0)).value());
        assertEquals(List.of("SD", "DD"), ((Criterion) root.children().get(1)).value());
        assertEquals(Boolean.FALSE, ((Criterion) root.children().get(2)).value());
        assertEquals(Operator.IN, ((Criterion) root.children().get(1)).operator());
    }

    @Test
    void columnGroupsAreSplit() {
        assertEquals(List.of(List.of("a", "b", "c"), List.of("d", "e", "f")),
                PredicateLibraryLoader.splitColumns("a,b,c | d, e, f"));
        assertEquals(List.of(), PredicateLibraryLoader.splitColumns(""));
    }

    @Test
    void unknownOperatorIsFatal() {
        ReconcileException e = assertThrows(ReconcileException.class, () -> loader.parse("""
                [{"name": "P", "criteria": [{"columns": "A", "op": "roughly", "value": 1}]}]
                """));

        assertEquals(ResultCode.UNKNOWN_OPERATOR, e.getResultCode());
    }

    @Test
    void malformedDefinitionsAreRejected() {
        assertThrows(ReconcileException.class, () -> loader.parse("""
                [{"name": "P", "criteria": [{"columns": "A", "op": "=="}]}]
                """));
        assertThrows(ReconcileException.class, () -> loader.parse("""
                [{"name": "P", "criteria": [{"columns": "A,B", "op": "ctrl_test_ok"}]}]
                """));
        assertThrows(ReconcileException.class, () -> loader.parse("""
                [{"name": "P", "combineWith": "xor"}]
                """));
        assertThrows(ReconcileException.class, () -> loader.parse("""
                [{"name": "P"}, {"name": "P"}]
                """));
        assertThrows(ReconcileException.class, () -> loader.parse("{\"other\": []}"));
    }

    @Test
    void loadsFromFilePath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("rules.json");
        Files.writeString(file, "[{\"name\": \"Only\", \"criteria\": [{\"columns\": \"A\", \"op\": \"notna\"}]}]");

        assertEquals("Only", loader.load(file.toString()).get(0).getName());
        assertThrows(ReconcileException.class, () -> loader.load(dir.resolve("missing.json").toString()));
    }
}
