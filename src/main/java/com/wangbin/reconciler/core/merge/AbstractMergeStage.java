package com.wangbin.reconciler.core.merge;

import com.wangbin.reconciler.common.exception.ReconcileException;
import com.wangbin.reconciler.core.table.CsvTableWriter;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 抽象合并阶段
 * 负责计时、行数日志、保持行数校验以及中间表输出，子类只实现 doApply。
 */
@Slf4j
public abstract class AbstractMergeStage implements MergeStage {

    protected final String name;
    protected final int order;

    protected AbstractMergeStage(String name, int order) {
        this.name = name;
        this.order = order;
    }

    @Override
    public String getName() {
        return name != null ? name : getClass().getSimpleName();
    }

    @Override
    public int getOrder() {
        return order;
    }

    @Override
    public boolean preservesCardinality() {
        return true;
    }

    @Override
    public RowSet apply(RowSet input, MergeContext context) {
        long startTime = System.currentTimeMillis();
        log.info("合并阶段开始: stage={}, rows={}", getName(), input.size());

        RowSet output = doApply(input, context);

        if (preservesCardinality() && output.size() != input.size()) {
            log.error("合并阶段行数变化: stage={}, before={}, after={}", getName(), input.size(), output.size());
            throw ReconcileException.rowCountChanged(getName(), input.size(), output.size());
        }

        context.recordRowCount(getName(), output.size());
        log.info("合并阶段完成: stage={}, rows={} -> {}, columns={}, time={}ms",
                getName(), input.size(), output.size(), output.columns().size(),
                System.currentTimeMillis() - startTime);

        dumpIfRequested(output, context);
        return output;
    }

    /**
     * 阶段实际逻辑
     */
    protected abstract RowSet doApply(RowSet input, MergeContext context);

    private void dumpIfRequested(RowSet output, MergeContext context) {
        Path debugDir = context.getDebugDir();
        if (debugDir == null) {
            return;
        }
        Path file = debugDir.resolve(String.format("%02d_%s.csv", getOrder(), getName()));
        try {
            CsvTableWriter.write(output, file);
            log.debug("中间表已输出: {}", file);
        } catch (IOException e) {
            log.warn("中间表输出失败: stage={}, file={}, error={}", getName(), file, e.getMessage());
        }
    }
}
