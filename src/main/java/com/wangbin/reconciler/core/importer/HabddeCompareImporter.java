package com.wangbin.reconciler.core.importer;

import com.wangbin.reconciler.common.constant.ColumnNames;
import com.wangbin.reconciler.core.table.CsvTableReader;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 点位匹配比对报告导入器，仅保留匹配状态、通用地址与比对键
 */
@Slf4j
public class HabddeCompareImporter {

    private static final Map<String, String> RENAMES = Map.of(
            "matched_status", ColumnNames.HABDDE_COMPARE_STATUS,
            "Key", ColumnNames.HAB_COMP_KEY);

    private static final List<String> COLUMNS = List.of(
            ColumnNames.HABDDE_COMPARE_STATUS, ColumnNames.GENERIC_POINT_ADDRESS, ColumnNames.HAB_COMP_KEY);

    public RowSet load(Path file) {
        return clean(CsvTableReader.read(file));
    }

    public RowSet clean(RowSet raw) {
        RowSet result = raw.renameColumns(RENAMES).select(COLUMNS);
        log.info("匹配比对报告导入完成: {} 行", result.size());
        return result;
    }
}
