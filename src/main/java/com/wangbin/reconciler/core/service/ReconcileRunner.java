package com.wangbin.reconciler.core.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 命令行入口：--rtu / --substation / --data-dir / --refresh-cache / --skip-reports
 */
@Slf4j
@Component
public class ReconcileRunner implements ApplicationRunner {

    private final ReconciliationService reconciliationService;

    public ReconcileRunner(ReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    @Override
    public void run(ApplicationArguments args) {
        ReconcileOptions options = parseOptions(args);
        ReconciliationOutcome outcome = reconciliationService.run(options);
        log.info("输出报表 {} 个, 缺陷统计: {}", outcome.reports().size(), outcome.defectCounts());
    }

    static ReconcileOptions parseOptions(ApplicationArguments args) {
        return ReconcileOptions.builder()
                .rtu(single(args, "rtu"))
                .substation(single(args, "substation"))
                .dataDir(single(args, "data-dir"))
                .refreshCache(args.containsOption("refresh-cache"))
                .skipReports(args.containsOption("skip-reports"))
                .build();
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }
}
