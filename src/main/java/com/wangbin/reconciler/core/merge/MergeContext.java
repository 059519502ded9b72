package com.wangbin.reconciler.core.merge;

import com.wangbin.reconciler.core.config.ReconcilerProperties;
import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 合并上下文：一次合并运行的输入、范围与配置，以及各阶段行数统计
 */
@Getter
@Builder
public class MergeContext {

    private final MergeInputs inputs;

    @Builder.Default
    private final MergeScope scope = MergeScope.all();

    @Builder.Default
    private final ReconcilerProperties.MergeConfig mergeConfig = new ReconcilerProperties.MergeConfig();

    @Builder.Default
    private final ReconcilerProperties.CommissioningConfig commissioningConfig =
            new ReconcilerProperties.CommissioningConfig();

    /** 中间表输出目录，为空时不输出 */
    private final Path debugDir;

    @Builder.Default
    private final Map<String, Integer> stageRowCounts = new LinkedHashMap<>();

    public void recordRowCount(String stage, int rows) {
        stageRowCounts.put(stage, rows);
    }
}
