package com.wangbin.reconciler.common.exception;

import com.wangbin.reconciler.common.enums.ResultCode;
import lombok.Getter;
import org.springframework.boot.ExitCodeGenerator;

import java.util.Collections;
import java.util.List;

/**
 * 核对任务致命异常
 * 携带出错的行（格式化后的文本），供诊断输出使用；抛出后整个核对任务以非零退出码终止。
 */
@Getter
public class ReconcileException extends BusinessException implements ExitCodeGenerator {

    private final ResultCode resultCode;
    private final String stage;
    private final List<String> offendingRows;

    public ReconcileException(ResultCode resultCode, String message, String stage, List<String> offendingRows) {
        super(resultCode, message, offendingRows);
        this.resultCode = resultCode;
        this.stage = stage;
        this.offendingRows = offendingRows != null ? List.copyOf(offendingRows) : Collections.emptyList();
    }

    public ReconcileException(ResultCode resultCode, String message, String stage, Throwable cause) {
        this(resultCode, message, stage, Collections.emptyList());
        initCause(cause);
    }

    /**
     * 数据完整性错误退出码为1，配置/定义错误为2
     */
    @Override
    public int getExitCode() {
        return resultCode.isDataError() ? 1 : 2;
    }

    // 台账中同一通用地址对应多条记录
    public static ReconcileException duplicateAddress(String stage, List<String> offendingRows) {
        return new ReconcileException(ResultCode.DUPLICATE_ADDRESS,
                "目标系统台账中存在 " + offendingRows.size() + " 条重复地址记录，拒绝继续合并",
                stage, offendingRows);
    }

    // 保持行数的阶段输出行数与输入不一致
    public static ReconcileException rowCountChanged(String stage, int before, int after) {
        return new ReconcileException(ResultCode.ROW_COUNT_CHANGED,
                String.format("合并阶段 %s 行数由 %d 变为 %d，存在重复键", stage, before, after),
                stage, Collections.emptyList());
    }

    // 右表中同一连接键出现多次，左连接会扩展行数
    public static ReconcileException duplicateJoinKey(String stage, List<String> offendingRows) {
        return new ReconcileException(ResultCode.ROW_COUNT_CHANGED,
                "合并阶段 " + stage + " 的右表存在重复连接键，左连接将改变行数",
                stage, offendingRows);
    }

    public static ReconcileException unknownOperator(String operator, String predicate) {
        return new ReconcileException(ResultCode.UNKNOWN_OPERATOR,
                "判定规则 " + predicate + " 使用了未知运算符: " + operator,
                predicate, Collections.emptyList());
    }

    public static ReconcileException undefinedColumn(String column, String predicate) {
        return new ReconcileException(ResultCode.UNDEFINED_COLUMN,
                "判定规则 " + predicate + " 引用了未定义的列: " + column,
                predicate, Collections.emptyList());
    }

    public static ReconcileException invalidPredicate(String predicate, String reason) {
        return new ReconcileException(ResultCode.PREDICATE_INVALID,
                "判定规则 " + predicate + " 定义无效: " + reason,
                predicate, Collections.emptyList());
    }

    public static ReconcileException sourceNotFound(List<String> missingFiles) {
        return new ReconcileException(ResultCode.SOURCE_NOT_FOUND,
                "缺少必需的源数据文件: " + String.join(", ", missingFiles),
                "validate", missingFiles);
    }

    public static ReconcileException sourceLoadError(String source, Throwable cause) {
        return new ReconcileException(ResultCode.SOURCE_LOAD_ERROR,
                "加载源数据失败: " + source, "import", cause);
    }

    public static ReconcileException configError(String message) {
        return new ReconcileException(ResultCode.CONFIG_ERROR, message, "config", Collections.emptyList());
    }

    public static ReconcileException cacheError(String message, Throwable cause) {
        return new ReconcileException(ResultCode.CACHE_ERROR, message, "cache", cause);
    }

    public static ReconcileException reportError(String message, Throwable cause) {
        return new ReconcileException(ResultCode.REPORT_ERROR, message, "report", cause);
    }
}
