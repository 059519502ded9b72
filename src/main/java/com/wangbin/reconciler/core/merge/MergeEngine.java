package com.wangbin.reconciler.core.merge;

import com.wangbin.reconciler.core.merge.stage.AlarmAttachStage;
import com.wangbin.reconciler.core.merge.stage.ControlAttachStage;
import com.wangbin.reconciler.core.merge.stage.DummyPointStage;
import com.wangbin.reconciler.core.merge.stage.InventoryJoinStage;
import com.wangbin.reconciler.core.merge.stage.PointUnionStage;
import com.wangbin.reconciler.core.merge.stage.RowFlagsStage;
import com.wangbin.reconciler.core.merge.stage.ScopeFilterStage;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 合并引擎
 * 按固定顺序执行各合并阶段，每个阶段只读取上一阶段发布的行集。
 */
@Slf4j
public class MergeEngine {

    private final List<MergeStage> stages;

    public MergeEngine() {
        this(defaultStages());
    }

    public MergeEngine(List<MergeStage> stages) {
        List<MergeStage> sorted = new ArrayList<>(stages);
        sorted.sort(Comparator.comparingInt(MergeStage::getOrder));
        this.stages = Collections.unmodifiableList(sorted);
    }

    public static List<MergeStage> defaultStages() {
        return List.of(
                new PointUnionStage(),
                new ScopeFilterStage(),
                new DummyPointStage(),
                new InventoryJoinStage(),
                new AlarmAttachStage(),
                new ControlAttachStage(),
                new RowFlagsStage());
    }

    public RowSet merge(MergeContext context) {
        long startTime = System.currentTimeMillis();
        log.info("开始合并: scope={}, stages={}", context.getScope(), stages.size());

        RowSet current = RowSet.empty(Collections.emptyList());
        for (MergeStage stage : stages) {
            current = stage.apply(current, context);
        }

        log.info("合并完成: scope={}, rows={}, columns={}, time={}ms",
                context.getScope(), current.size(), current.columns().size(),
                System.currentTimeMillis() - startTime);
        return current;
    }

    public List<MergeStage> getStages() {
        return stages;
    }
}
