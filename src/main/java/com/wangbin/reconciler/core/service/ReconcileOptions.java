package com.wangbin.reconciler.core.service;

import lombok.Builder;
import lombok.Getter;

/**
 * 单次核对运行参数（命令行）
 */
@Getter
@Builder
public class ReconcileOptions {

    private final String rtu;
    private final String substation;

    /** 覆盖配置中的数据目录 */
    private final String dataDir;

    private final boolean refreshCache;
    private final boolean skipReports;
}
