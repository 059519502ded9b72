package com.wangbin.reconciler.core.report;

import com.wangbin.reconciler.core.merge.MergeScope;
import com.wangbin.reconciler.core.table.CsvTableReader;
import com.wangbin.reconciler.core.table.RowSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.wangbin.reconciler.core.table.TestRows.row;
import static com.wangbin.reconciler.core.table.TestRows.table;
import static org.junit.jupiter.api.Assertions.*;

class ReportWriterTest {

    private static final String DEFECT = "[(AREC:141):109:4- SD]";
    private static final String CLEAN = "[(AREC:141):109:5- DD]";

    private RowSet evaluated() {
        return table(
                row("GenericPointAddress", DEFECT, "RTU", "AREC", "GenericType", "SD", "Controllable", "1",
                        "Ctrl1Addr", "[(AREC:141):252:6-1 C]", "Ctrl1Name", "TRIP", "Ctrl2Addr", "", "Ctrl2Name", "",
                        "CompAlarmEterraAlias", null, "Report1", false, "ReportANY", true),
                row("GenericPointAddress", CLEAN, "RTU", "AREC", "GenericType", "DD", "Controllable", "0",
                        "Ctrl1Addr", "", "Ctrl1Name", "", "Ctrl2Addr", "", "Ctrl2Name", "",
                        "CompAlarmEterraAlias", null, "Report1", false, "ReportANY", false),
                row("GenericPointAddress", "[(ARIE3:33053):312:203- A]", "RTU", "ARIE3", "GenericType", "A",
                        "Controllable", "0", "Ctrl1Addr", "", "Ctrl1Name", "", "Ctrl2Addr", "", "Ctrl2Name", "",
                        "CompAlarmEterraAlias", null, "Report1", true, "ReportANY", true));
    }

    @Test
    void writesMergedDefectAndRtuReports(@TempDir Path dir) {
        List<Path> written = new ReportWriter(dir).write(MergeScope.all(), evaluated(), null);

        assertEquals(4, written.size());
        assertTrue(Files.exists(dir.resolve("merged_all.csv")));
        assertTrue(Files.exists(dir.resolve("rtu_report_all/AREC.csv")));
        assertTrue(Files.exists(dir.resolve("rtu_report_all/ARIE3.csv")));

        RowSet defects = CsvTableReader.read(dir.resolve("defect_report_all.csv"));
        assertEquals(2, defects.size());
        assertTrue(defects.hasColumn("Review Status"));
        assertTrue(defects.hasColumn("Comments"));
    }

    @Test
    void reviewCommentsAreCarriedOver(@TempDir Path dir) {
        RowSet previous = table(
                row("GenericPointAddress", DEFECT, "Review Status", "Accepted", "Comments", "known issue"),
                row("GenericPointAddress", CLEAN, "Review Status", "Closed", "Comments", null));

        new ReportWriter(dir).write(MergeScope.rtu("AREC"), evaluated(), previous);

        RowSet defects = CsvTableReader.read(dir.resolve("defect_report_AREC.csv"));
        assertEquals("Accepted", defects.row(0).get("Review Status"));
        assertEquals("known issue", defects.row(0).get("Comments"));
        assertNull(defects.row(1).get("Review Status"));
    }

    @Test
    void existingReviewIsNotOverwritten() {
        RowSet previous = table(row("GenericPointAddress", DEFECT, "Review Status", "Old", "Comments", "old"));
        RowSet current = table(row("GenericPointAddress", DEFECT, "Review Status", "New", "Comments", null));

        RowSet result = ReviewCommentCarrier.carryOver(previous, current);

        assertEquals("New", result.row(0).get("Review Status"));
        assertNull(result.row(0).get("Comments"));
    }

    @Test
    void pointsSectionKeepsDigitalPointsOnly() {
        RowSet section = PointsSectionBuilder.build(evaluated());

        assertEquals(PointsSectionBuilder.columns(), section.columns());
        assertEquals(2, section.size());
        assertEquals("[(AREC:141):252:6-1 C]", section.row(0).get("Ctrl1Addr"));
        assertEquals("TRIP", section.row(0).get("Ctrl1Name"));
        assertEquals("", section.row(1).get("Ctrl1Addr"));
        assertEquals("", section.row(0).get("CompAlarmPOStatus"));
        assertEquals(DEFECT, section.row(0).get("SCADA Address"));
        assertEquals("", section.row(0).get("Report3"));
    }
}
