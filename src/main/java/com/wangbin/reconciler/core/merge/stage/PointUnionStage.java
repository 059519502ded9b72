package com.wangbin.reconciler.core.merge.stage;

import com.wangbin.reconciler.common.constant.ColumnNames;
import com.wangbin.reconciler.core.importer.ImportSupport;
import com.wangbin.reconciler.core.merge.AbstractMergeStage;
import com.wangbin.reconciler.core.merge.MergeContext;
import com.wangbin.reconciler.core.table.Row;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 点表与模拟量表合并
 * 取两表公共列（补充列只要任一表有即保留），纵向拼接后按通用地址稳定排序，空地址排最后。
 */
@Slf4j
public class PointUnionStage extends AbstractMergeStage {

    static final List<String> COMMON_COLUMNS = List.of(
            ColumnNames.GENERIC_POINT_ADDRESS, ColumnNames.CASDU, ColumnNames.PROTOCOL, ColumnNames.RTU,
            ColumnNames.CARD, ColumnNames.RTU_ADDRESS, ColumnNames.RTU_ID, ColumnNames.IOA2, ColumnNames.IOA1,
            ColumnNames.IOA, ColumnNames.POINT_ID, ColumnNames.GENERIC_TYPE, ColumnNames.DEVICE_TYPE,
            ColumnNames.DEVICE_NAME, ColumnNames.DEVICE_ID, ColumnNames.SUB, ColumnNames.WORD,
            ColumnNames.ETERRA_KEY, ColumnNames.ETERRA_ALIAS, ColumnNames.CONTROLLABLE);

    private static final Comparator<Row> BY_ADDRESS = Comparator.comparing(
            row -> row.getString(ColumnNames.GENERIC_POINT_ADDRESS),
            Comparator.nullsLast(Comparator.naturalOrder()));

    public PointUnionStage() {
        super("point_union", 10);
    }

    @Override
    public boolean preservesCardinality() {
        return false;
    }

    @Override
    protected RowSet doApply(RowSet input, MergeContext context) {
        RowSet points = context.getInputs().getPoints();
        RowSet analogs = context.getInputs().getAnalogs();

        List<String> columns = new ArrayList<>(COMMON_COLUMNS);
        for (String column : ImportSupport.SUPPLEMENTARY_COLUMNS) {
            if (points.hasColumn(column) || analogs.hasColumn(column)) {
                columns.add(column);
            }
        }

        RowSet union = RowSet.empty(columns)
                .concat(points.select(columns))
                .concat(analogs.select(columns))
                .select(columns);

        Set<String> excluded = new HashSet<>(context.getMergeConfig().getExcludedPointRtus());
        if (!excluded.isEmpty()) {
            int before = union.size();
            union = union.filter(row -> !excluded.contains(row.getString(ColumnNames.RTU)));
            if (union.size() != before) {
                log.info("排除RTU {} 的点位 {} 行", excluded, before - union.size());
            }
        }

        log.info("点表 {} 行, 模拟量表 {} 行, 合并后 {} 行", points.size(), analogs.size(), union.size());
        return union.sorted(BY_ADDRESS);
    }
}
