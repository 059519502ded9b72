package com.wangbin.reconciler.core.service;

import com.wangbin.reconciler.common.exception.ReconcileException;
import com.wangbin.reconciler.core.address.RtuDirectory;
import com.wangbin.reconciler.core.cache.MergedTableCache;
import com.wangbin.reconciler.core.config.ReconcilerProperties;
import com.wangbin.reconciler.core.config.ReconcilerProperties.FilesConfig;
import com.wangbin.reconciler.core.importer.AlarmCompareImporter;
import com.wangbin.reconciler.core.importer.ComponentAliasLookup;
import com.wangbin.reconciler.core.importer.ControlsAutoTestImporter;
import com.wangbin.reconciler.core.importer.EterraExportImporter;
import com.wangbin.reconciler.core.importer.HabddeCompareImporter;
import com.wangbin.reconciler.core.importer.ManualCommissioningImporter;
import com.wangbin.reconciler.core.importer.PowerOnComponentLookup;
import com.wangbin.reconciler.core.importer.PowerOnInventoryImporter;
import com.wangbin.reconciler.core.merge.MergeContext;
import com.wangbin.reconciler.core.merge.MergeEngine;
import com.wangbin.reconciler.core.merge.MergeInputs;
import com.wangbin.reconciler.core.merge.MergeScope;
import com.wangbin.reconciler.core.report.ReportWriter;
import com.wangbin.reconciler.core.rule.RuleEngine;
import com.wangbin.reconciler.core.rule.RuleEvaluationResult;
import com.wangbin.reconciler.core.rule.loader.PredicateLibraryLoader;
import com.wangbin.reconciler.core.table.CsvTableReader;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * 核对流程编排：校验源文件 -> 导入 -> 合并（或读缓存）-> 缺陷判定 -> 报表
 */
@Slf4j
@Service
public class ReconciliationService {

    private final ReconcilerProperties properties;
    private final ExecutorService ruleEvaluationExecutor;
    private final PredicateLibraryLoader libraryLoader = new PredicateLibraryLoader();
    private MergedTableCache cache;

    public ReconciliationService(ReconcilerProperties properties,
                                 @Qualifier("ruleEvaluationExecutor") ExecutorService ruleEvaluationExecutor) {
        this.properties = properties;
        this.ruleEvaluationExecutor = ruleEvaluationExecutor;
    }

    public ReconciliationOutcome run(ReconcileOptions options) {
        long startTime = System.currentTimeMillis();
        MergeScope scope;
        try {
            scope = MergeScope.of(options.getRtu(), options.getSubstation());
        } catch (IllegalArgumentException e) {
            throw ReconcileException.configError(e.getMessage());
        }
        Path dataDir = Paths.get(options.getDataDir() != null ? options.getDataDir() : properties.getPaths().getDataDir());
        log.info("核对开始: scope={}, dataDir={}", scope, dataDir);

        RuleEngine ruleEngine = new RuleEngine(libraryLoader.load(properties.getRules().getDefinitions()),
                properties.getRules().isParallel() ? ruleEvaluationExecutor : null);

        Optional<RowSet> cached = Optional.empty();
        if (properties.getCache().isEnabled()) {
            if (options.isRefreshCache()) {
                cache().invalidate();
            } else {
                cached = cache().get(scope);
            }
        }

        RowSet merged;
        if (cached.isPresent()) {
            merged = cached.get();
        } else {
            validateDataFiles(dataDir);
            MergeInputs inputs = loadInputs(dataDir);
            merged = new MergeEngine().merge(MergeContext.builder()
                    .inputs(inputs)
                    .scope(scope)
                    .mergeConfig(properties.getMerge())
                    .commissioningConfig(properties.getCommissioning())
                    .debugDir(debugDir())
                    .build());
            if (inputs.getAliasLookup() instanceof PowerOnComponentLookup lookup) {
                log.info("PowerOn组件查询缓存统计: {}", lookup.getStatsSummary());
            }
            if (properties.getCache().isEnabled()) {
                cache().put(scope, merged);
            }
        }

        RuleEvaluationResult result = ruleEngine.evaluate(merged);

        List<Path> reports = new ArrayList<>();
        ReportWriter writer = new ReportWriter(Paths.get(properties.getPaths().getOutputDir()));
        if (!options.isSkipReports()) {
            reports = writer.write(scope, result.table(), loadPreviousDefects(dataDir));
        }
        writer.logSummary(result.defectCounts());

        if (properties.getCache().isEnabled()) {
            log.info("合并表缓存统计: {}", cache().getStatsSummary());
        }
        log.info("核对完成: scope={}, rows={}, fromCache={}, time={}ms",
                scope, result.table().size(), cached.isPresent(), System.currentTimeMillis() - startTime);
        return new ReconciliationOutcome(scope, result.table(), result.defectCounts(), cached.isPresent(), reports);
    }

    /**
     * 检查全部必需源文件，一次性列出所有缺失文件
     */
    public void validateDataFiles(Path dataDir) {
        List<String> missing = new ArrayList<>();
        for (Map.Entry<String, String> entry : requiredFiles().entrySet()) {
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                missing.add(entry.getKey() + " (未配置)");
            } else if (!Files.isRegularFile(dataDir.resolve(entry.getValue()))) {
                missing.add(dataDir.resolve(entry.getValue()).toString());
            }
        }
        if (!missing.isEmpty()) {
            missing.forEach(file -> log.error("缺少源数据文件: {}", file));
            throw ReconcileException.sourceNotFound(missing);
        }
        log.info("源数据文件检查通过: {}", dataDir);
    }

    private Map<String, String> requiredFiles() {
        FilesConfig files = properties.getFiles();
        Map<String, String> required = new LinkedHashMap<>();
        required.put("eterra-point", files.getEterraPoint());
        required.put("eterra-analog", files.getEterraAnalog());
        required.put("eterra-control", files.getEterraControl());
        required.put("eterra-setpoint", files.getEterraSetpoint());
        required.put("habdde-compare", files.getHabddeCompare());
        required.put("all-rtus", files.getAllRtus());
        required.put("controls-test", files.getControlsTest());
        required.put("compare-alarms", files.getCompareAlarms());
        required.put("controls-db", files.getControlsDb());
        return required;
    }

    MergeInputs loadInputs(Path dataDir) {
        FilesConfig files = properties.getFiles();
        ReconcilerProperties.MergeConfig merge = properties.getMerge();

        EterraExportImporter eterra = new EterraExportImporter(new HashSet<>(merge.getControllableAnalogPointIds()));
        RowSet points = eterra.loadPointTab(dataDir.resolve(files.getEterraPoint()));
        RtuDirectory rtuDirectory = RtuDirectory.fromPointTable(points);
        log.info("RTU目录: {} 个RTU", rtuDirectory.size());

        return MergeInputs.builder()
                .points(points)
                .analogs(eterra.loadAnalogTab(dataDir.resolve(files.getEterraAnalog())))
                .controls(eterra.loadControlTab(dataDir.resolve(files.getEterraControl())))
                .setpoints(eterra.loadSetpointTab(dataDir.resolve(files.getEterraSetpoint())))
                .habddeCompare(new HabddeCompareImporter().load(dataDir.resolve(files.getHabddeCompare())))
                .inventory(new PowerOnInventoryImporter(new HashSet<>(merge.getExcludedInventoryRtus()))
                        .load(dataDir.resolve(files.getAllRtus())))
                .autoTests(new ControlsAutoTestImporter(rtuDirectory).load(dataDir.resolve(files.getControlsTest())))
                .commissioning(new ManualCommissioningImporter(rtuDirectory).load(dataDir.resolve(files.getControlsDb())))
                .alarms(new AlarmCompareImporter().load(dataDir.resolve(files.getCompareAlarms())))
                .aliasLookup(componentLookup(dataDir))
                .build();
    }

    private ComponentAliasLookup componentLookup(Path dataDir) {
        String poweronDb = properties.getFiles().getPoweronDb();
        if (poweronDb == null || poweronDb.isBlank()) {
            return null;
        }
        Path file = dataDir.resolve(poweronDb);
        if (!Files.isRegularFile(file)) {
            log.warn("PowerOn组件库不存在，跳过别名查询: {}", file);
            return null;
        }
        return PowerOnComponentLookup.open(file);
    }

    private RowSet loadPreviousDefects(Path dataDir) {
        String previous = properties.getFiles().getPreviousDefectReport();
        if (previous == null || previous.isBlank()) {
            return null;
        }
        Path file = dataDir.resolve(previous);
        if (!Files.isRegularFile(file)) {
            log.warn("上一版缺陷报告不存在，不沿用复核意见: {}", file);
            return null;
        }
        return CsvTableReader.read(file);
    }

    private Path debugDir() {
        String debugDir = properties.getPaths().getDebugDir();
        return debugDir == null || debugDir.isBlank() ? null : Paths.get(debugDir);
    }

    private synchronized MergedTableCache cache() {
        if (cache == null) {
            cache = new MergedTableCache(Paths.get(properties.getPaths().getCacheFile()), properties.getCache());
        }
        return cache;
    }
}
