package com.wangbin.reconciler.core.report;

import com.wangbin.reconciler.common.constant.ColumnNames;
import com.wangbin.reconciler.common.exception.ReconcileException;
import com.wangbin.reconciler.core.merge.MergeScope;
import com.wangbin.reconciler.core.table.CsvTableWriter;
import com.wangbin.reconciler.core.table.Row;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 报表输出
 * 完整合并表、缺陷子集（ReportANY为真）以及按RTU拆分的点位报表，均为CSV。
 */
@Slf4j
public class ReportWriter {

    public static final String ANY_DEFECT = "ReportANY";

    private final Path outputDir;

    public ReportWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * @param previousDefects 上一版缺陷报告，为空时不沿用复核意见
     * @return 写出的文件
     */
    public List<Path> write(MergeScope scope, RowSet evaluated, RowSet previousDefects) {
        List<Path> written = new ArrayList<>();
        String label = scope.label();

        written.add(writeTable(evaluated, outputDir.resolve("merged_" + label + ".csv")));

        RowSet defects = evaluated.hasColumn(ANY_DEFECT)
                ? evaluated.filter(row -> Boolean.TRUE.equals(row.get(ANY_DEFECT)))
                : evaluated.filter(row -> false);
        defects = previousDefects != null
                ? ReviewCommentCarrier.carryOver(previousDefects, defects)
                : ReviewCommentCarrier.withReviewColumns(defects);
        written.add(writeTable(defects, outputDir.resolve("defect_report_" + label + ".csv")));

        Path rtuDir = outputDir.resolve("rtu_report_" + label);
        for (String rtu : rtus(evaluated)) {
            RowSet section = PointsSectionBuilder.build(
                    evaluated.filter(row -> rtu.equals(row.getString(ColumnNames.RTU))));
            written.add(writeTable(section, rtuDir.resolve(rtu + ".csv")));
        }
        log.info("报表输出完成: scope={}, 缺陷 {} 行, RTU报表 {} 个, 目录={}",
                scope, defects.size(), written.size() - 2, outputDir);
        return written;
    }

    /**
     * 输出各判定命中行数汇总
     */
    public void logSummary(Map<String, Long> defectCounts) {
        log.info("========== 缺陷汇总 ==========");
        defectCounts.forEach((name, count) -> log.info("{}: {}", name, count));
    }

    private static Set<String> rtus(RowSet table) {
        Set<String> rtus = new LinkedHashSet<>();
        for (Row row : table.rows()) {
            String rtu = row.getString(ColumnNames.RTU);
            if (rtu != null && !rtu.isBlank()) {
                rtus.add(rtu);
            }
        }
        return rtus;
    }

    private static Path writeTable(RowSet table, Path file) {
        try {
            CsvTableWriter.write(table, file);
            log.debug("已写出: {} ({} 行)", file, table.size());
            return file;
        } catch (IOException e) {
            log.error("报表写出失败: {}", file, e);
            throw ReconcileException.reportError("报表写出失败: " + file, e);
        }
    }
}
