package com.wangbin.reconciler.core.merge;

import com.wangbin.reconciler.common.enums.ResultCode;
import com.wangbin.reconciler.common.exception.ReconcileException;
import com.wangbin.reconciler.core.config.ReconcilerProperties;
import com.wangbin.reconciler.core.merge.stage.PointUnionStage;
import com.wangbin.reconciler.core.table.Row;
import com.wangbin.reconciler.core.table.RowSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.wangbin.reconciler.core.merge.MergeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class MergeEngineTest {

    private RowSet merge(MergeInputs inputs) {
        return new MergeEngine().merge(MergeContext.builder().inputs(inputs).build());
    }

    @Test
    void pointsAreSortedByAddressAndDummyAppended() {
        RowSet merged = merge(inputs().build());

        assertEquals(4, merged.size());
        assertEquals(Arrays.asList(ANDE_POINT, AREC_POINT, ARIE_ANALOG, null), merged.column("GenericPointAddress"));

        Row dummy = merged.row(3);
        assertEquals("AREC/CB/L9/ST", dummy.get("eTerraAlias"));
        assertEquals("DUMMY", dummy.get("Type"));
        assertEquals(new ReconcilerProperties.MergeConfig().getSentinelRtuId(), dummy.get("RTUId"));
        assertEquals(AREC_ORPHAN, dummy.get("Ctrl1Addr"));
    }

    @Test
    void firstTwoControlsAreAttachedWithCommissioningResults() {
        Row point = find(merge(inputs().build()), "GenericPointAddress", AREC_POINT);

        assertEquals(AREC_TRIP, point.get("Ctrl1Addr"));
        assertEquals("TRIP", point.get("Ctrl1Name"));
        assertEquals("MATCHED", point.get("Ctrl1MatchStatus"));
        assertEquals("GOOD", point.get("Ctrl1ConfigHealth"));
        assertEquals("TRIP", point.get("Ctrl1TelecontrolAction"));
        assertEquals("FAIL", point.get("Ctrl1ActionVerified"));
        assertEquals("FAIL", point.get("Ctrl1TestResult"));
        assertEquals("OK", point.get("Ctrl1AutoTestStatus"));

        assertEquals(AREC_CLOSE, point.get("Ctrl2Addr"));
        assertEquals("BAD", point.get("Ctrl2ConfigHealth"));
        assertNull(point.get("Ctrl2MatchStatus"));
        assertEquals("OK", point.get("Ctrl2VisualCheck"));

        assertEquals(2L, point.get("NumControls"));
        assertEquals(1L, point.get("NumControlsCommissionOk"));
        assertEquals(1L, point.get("NumControlsAllCommissionOk"));
        assertEquals(50.0, point.get("PercentControlsCommissionOk"));
    }

    @Test
    void nonControllablePointHasEmptyControlSlots() {
        Row point = find(merge(inputs().build()), "GenericPointAddress", ANDE_POINT);

        assertEquals("", point.get("Ctrl1Addr"));
        assertEquals("", point.get("Ctrl2Name"));
        assertEquals(0L, point.get("NumControls"));
        assertNull(point.get("PercentControlsCommissionOk"));
        assertEquals(Boolean.TRUE, point.get("Ignore"));
        assertEquals(Boolean.TRUE, point.get("RTUComms"));
    }

    @Test
    void tapChangerControlFoundThroughAliasSubstitution() {
        Row analog = find(merge(inputs().build()), "GenericPointAddress", ARIE_ANALOG);

        assertEquals(ARIE_RAISE, analog.get("Ctrl1Addr"));
        assertEquals("RAISE", analog.get("Ctrl1Name"));
    }

    @Test
    void setpointOverridesFirstControlOfAnalog() {
        RowSet setpoints = RowSet.of(List.of("eTerraAlias", "GenericPointAddress"), List.of(
                Row.of(Map.of("eTerraAlias", "ARIE/TX/T1/TCP", "GenericPointAddress", ARIE_SETPOINT))));

        Row analog = find(merge(inputs().setpoints(setpoints).build()), "GenericPointAddress", ARIE_ANALOG);

        assertEquals(ARIE_SETPOINT, analog.get("Ctrl1Addr"));
        assertEquals("SETPOINT", analog.get("Ctrl1Name"));
    }

    @Test
    void inventoryAndRowFlagsAreJoined() {
        Row point = find(merge(inputs().build()), "GenericPointAddress", AREC_POINT);

        assertEquals("AREC-CB-L1", point.get("POAlias"));
        assertEquals("MATCHED", point.get("HbddeCompareStatus"));
        assertFalse(point.has("HabCompKey"));
        assertEquals(Boolean.TRUE, point.get("PowerOn Alias Exists"));
        assertEquals(1L, point.get("PowerOn Alias Linked to SCADA"));
        assertEquals("SD", point.get("Type"));
        assertEquals(Boolean.FALSE, point.get("Ignore"));
    }

    @Test
    void aliasLookupDecidesExistenceWhenConfigured() {
        RowSet merged = merge(inputs().aliasLookup("AREC/CB/L9/ST"::equals).build());

        assertEquals(Boolean.FALSE, find(merged, "GenericPointAddress", AREC_POINT).get("PowerOn Alias Exists"));
        assertEquals(Boolean.TRUE, merged.row(3).get("PowerOn Alias Exists"));
    }

    @Test
    void alarmsFillSlotsMatchedFirst() {
        Row point = find(merge(inputs().build()), "GenericPointAddress", AREC_POINT);

        assertEquals("E0b", point.get("Alarm0_eTerraMessage"));
        assertEquals("P0b", point.get("Alarm0_POMessage"));
        assertEquals(Boolean.TRUE, point.get("Alarm0_MessageMatch"));
        assertEquals("E3", point.get("Alarm3_eTerraMessage"));
        assertEquals(5L, point.get("NumAlarms"));
        assertEquals(3L, point.get("NumAlarmsMatched"));
        assertEquals(60.0, point.get("PercentAlarmsMatched"));
        assertEquals("Matched", point.get("CompAlarmPOStatus"));

        Row other = find(merge(inputs().build()), "GenericPointAddress", ANDE_POINT);
        assertEquals(0L, other.get("NumAlarms"));
        assertNull(other.get("Alarm0_eTerraMessage"));
        assertTrue(other.has("CompAlarmPOStatus"));
    }

    @Test
    void duplicateInventoryAddressIsFatal() {
        RowSet inventory = inventory().concat(RowSet.of(inventory().columns(),
                List.of(inventory(AREC_POINT, "AREC-CB-L1-DUP", "GOOD", null))));

        ReconcileException e = assertThrows(ReconcileException.class,
                () -> merge(inputs().inventory(inventory).build()));

        assertEquals(ResultCode.DUPLICATE_ADDRESS, e.getResultCode());
        assertEquals(2, e.getOffendingRows().size());
        assertEquals(1, e.getExitCode());
    }

    @Test
    void duplicateInventoryKeepsFirstWhenConfigured() {
        RowSet inventory = inventory().concat(RowSet.of(inventory().columns(),
                List.of(inventory(AREC_POINT, "AREC-CB-L1-DUP", "GOOD", null))));
        ReconcilerProperties.MergeConfig config = new ReconcilerProperties.MergeConfig();
        config.setDuplicateInventoryPolicy(ReconcilerProperties.DuplicatePolicy.KEEP_FIRST);

        RowSet merged = new MergeEngine().merge(MergeContext.builder()
                .inputs(inputs().inventory(inventory).build())
                .mergeConfig(config)
                .build());

        assertEquals(4, merged.size());
        assertEquals("AREC-CB-L1", find(merged, "GenericPointAddress", AREC_POINT).get("POAlias"));
    }

    @Test
    void duplicateControlAddressInInventoryIsFatal() {
        RowSet inventory = inventory().concat(RowSet.of(inventory().columns(),
                List.of(inventory(AREC_TRIP, "AREC-CB-L1-TRIP-DUP", "BAD", "CLOSE"))));

        ReconcileException e = assertThrows(ReconcileException.class,
                () -> merge(inputs().inventory(inventory).build()));

        assertEquals(ResultCode.DUPLICATE_ADDRESS, e.getResultCode());
        assertEquals(2, e.getOffendingRows().size());
        assertTrue(e.getOffendingRows().stream().allMatch(line -> line.startsWith(AREC_TRIP)));
        assertEquals(1, e.getExitCode());
    }

    @Test
    void strayInventoryDuplicatesAreFatal() {
        String stray = "[(ZZZ:1):1:1- SD]";
        RowSet inventory = inventory().concat(RowSet.of(inventory().columns(), List.of(
                inventory(stray, "Z1", "GOOD", null),
                inventory(stray, "Z2", "GOOD", null))));

        ReconcileException e = assertThrows(ReconcileException.class,
                () -> merge(inputs().inventory(inventory).build()));

        assertEquals(ResultCode.DUPLICATE_ADDRESS, e.getResultCode());
    }

    @Test
    void duplicateControlAddressKeepsFirstWhenConfigured() {
        RowSet inventory = inventory().concat(RowSet.of(inventory().columns(),
                List.of(inventory(AREC_TRIP, "AREC-CB-L1-TRIP-DUP", "BAD", "CLOSE"))));
        ReconcilerProperties.MergeConfig config = new ReconcilerProperties.MergeConfig();
        config.setDuplicateInventoryPolicy(ReconcilerProperties.DuplicatePolicy.KEEP_FIRST);

        RowSet merged = new MergeEngine().merge(MergeContext.builder()
                .inputs(inputs().inventory(inventory).build())
                .mergeConfig(config)
                .build());

        Row point = find(merged, "GenericPointAddress", AREC_POINT);
        assertEquals("GOOD", point.get("Ctrl1ConfigHealth"));
        assertEquals("TRIP", point.get("Ctrl1TelecontrolAction"));
    }

    @Test
    void controlsBeyondTwoAreNotAttached() {
        String thirdAddress = "[(AREC:141):252:8-0 C]";
        RowSet controls = controls().concat(RowSet.of(controls().columns(),
                List.of(control(thirdAddress, "AREC", "141", "AREC", "CB", "L1", "ST", "EARTH"))));

        Row point = find(merge(inputs().controls(controls).build()), "GenericPointAddress", AREC_POINT);

        assertEquals(AREC_TRIP, point.get("Ctrl1Addr"));
        assertEquals(AREC_CLOSE, point.get("Ctrl2Addr"));
        assertEquals(2L, point.get("NumControls"));
        assertFalse(point.asMap().containsValue(thirdAddress));
    }

    @Test
    void duplicateCompareKeyIsFatal() {
        RowSet compare = inputs().build().getHabddeCompare();
        RowSet duplicated = compare.concat(RowSet.of(compare.columns(), List.of(compare.row(0))));

        ReconcileException e = assertThrows(ReconcileException.class,
                () -> merge(inputs().habddeCompare(duplicated).build()));

        assertEquals(ResultCode.ROW_COUNT_CHANGED, e.getResultCode());
    }

    @Test
    void scopeRestrictsPointsAndDummies() {
        RowSet merged = new MergeEngine().merge(MergeContext.builder()
                .inputs(inputs().build())
                .scope(MergeScope.rtu("AREC"))
                .build());

        assertEquals(2, merged.size());
        assertEquals(AREC_POINT, merged.row(0).get("GenericPointAddress"));
        assertEquals("DUMMY", merged.row(1).get("Type"));
    }

    @Test
    void excludedRtuPointsAreDropped() {
        ReconcilerProperties.MergeConfig config = new ReconcilerProperties.MergeConfig();
        config.setExcludedPointRtus(List.of("ANDE3"));

        RowSet merged = new MergeEngine().merge(MergeContext.builder()
                .inputs(inputs().build())
                .mergeConfig(config)
                .build());

        assertEquals(3, merged.size());
        assertFalse(merged.column("RTU").contains("ANDE3"));
    }

    @Test
    void mergeIsDeterministic() {
        assertEquals(merge(inputs().build()), merge(inputs().build()));
    }

    @Test
    void stageRowCountsAndDebugTablesAreRecorded(@TempDir Path debugDir) {
        MergeContext context = MergeContext.builder()
                .inputs(inputs().build())
                .debugDir(debugDir)
                .build();

        new MergeEngine().merge(context);

        assertEquals(3, context.getStageRowCounts().get("point_union"));
        assertEquals(4, context.getStageRowCounts().get("row_flags"));
        assertTrue(Files.exists(debugDir.resolve("10_point_union.csv")));
        assertTrue(Files.exists(debugDir.resolve("60_control_attach.csv")));
    }

    @Test
    void cardinalityViolationIsFatal() {
        AbstractMergeStage dropping = new AbstractMergeStage("dropping", 15) {
            @Override
            protected RowSet doApply(RowSet input, MergeContext context) {
                return input.filter(row -> false);
            }
        };
        MergeEngine engine = new MergeEngine(List.of(dropping, new PointUnionStage()));

        ReconcileException e = assertThrows(ReconcileException.class,
                () -> engine.merge(MergeContext.builder().inputs(inputs().build()).build()));

        assertEquals(ResultCode.ROW_COUNT_CHANGED, e.getResultCode());
        assertEquals("dropping", e.getStage());
    }
}
