package com.wangbin.reconciler.core.config;

import com.wangbin.reconciler.common.constant.ReconcileConstant;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 核对任务配置类
 */
@Data
@Component
@ConfigurationProperties(prefix = "reconciler")
public class ReconcilerProperties {

    /**
     * 目录配置
     */
    private PathsConfig paths = new PathsConfig();

    /**
     * 源数据文件配置
     */
    private FilesConfig files = new FilesConfig();

    /**
     * 合并引擎配置
     */
    private MergeConfig merge = new MergeConfig();

    /**
     * 人工调试配置
     */
    private CommissioningConfig commissioning = new CommissioningConfig();

    /**
     * 判定规则配置
     */
    private RulesConfig rules = new RulesConfig();

    /**
     * 缓存配置
     */
    private CacheConfig cache = new CacheConfig();

    // =============== 配置类定义 ===============

    @Data
    public static class PathsConfig {
        private String dataDir = "rtu_report_data";
        private String outputDir = "reports";
        // 为空时不输出中间表
        private String debugDir;
        private String cacheFile = "data_cache/merged_cache.json";
    }

    @Data
    public static class FilesConfig {
        private String eterraPoint = "eterra_point.csv";
        private String eterraAnalog = "eterra_analog.csv";
        private String eterraControl = "eterra_control.csv";
        private String eterraSetpoint = "eterra_setpoint.csv";
        private String habddeCompare = "habdde_comparison_to_po_v2.csv";
        private String allRtus = "all_rtus.csv";
        private String controlsTest = "all_efep_control_tests.csv";
        private String compareAlarms = "compare_alarms.csv";
        private String controlsDb = "controls.db";
        // 可选
        private String poweronDb;
        // 可选
        private String previousDefectReport;
    }

    @Data
    public static class MergeConfig {
        private String sentinelRtuId = ReconcileConstant.DEFAULT_SENTINEL_RTU_ID;
        private DuplicatePolicy duplicateInventoryPolicy = DuplicatePolicy.FAIL;
        private List<AliasSubstitution> aliasSubstitutions = new ArrayList<>(List.of(
                new AliasSubstitution("TCP", "TCP", "TAP")));
        private List<String> excludedPointRtus = new ArrayList<>(List.of("MICR4"));
        private List<String> excludedInventoryRtus = new ArrayList<>(List.of("CUMW_RTU"));
        // 模拟量表中视为可控的点位ID（有载调压档位）
        private List<String> controllableAnalogPointIds = new ArrayList<>(List.of("TCP"));
    }

    @Data
    public static class AliasSubstitution {
        // 触发替换的点位ID
        private String pointId;
        private String from;
        private String to;

        public AliasSubstitution() {
        }

        public AliasSubstitution(String pointId, String from, String to) {
            this.pointId = pointId;
            this.from = from;
            this.to = to;
        }
    }

    @Data
    public static class CommissioningConfig {
        private String visualCheckTest = "Visual Check";
        private String controlSentTest = "Control Sent";
        private String actionVerifiedTest = "Action Verified";
        private String passingResult = "OK";
    }

    @Data
    public static class RulesConfig {
        private String definitions = "classpath:defect-predicates.json";
        private boolean parallel = false;
        private int threads = 4;
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private long localMaxSize = 16;
        private long expireAfterAccessSeconds = 3600;
    }

    /**
     * 台账重复地址处理策略
     */
    public enum DuplicatePolicy {
        // 终止核对
        FAIL,
        // 操作员明确确认后保留首条
        KEEP_FIRST
    }
}
