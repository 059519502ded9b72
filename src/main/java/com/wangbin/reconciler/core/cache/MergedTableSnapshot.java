package com.wangbin.reconciler.core.cache;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 合并表缓存文件内容
 */
@Data
public class MergedTableSnapshot {

    /** 构建该表时的范围键，all 表示全网 */
    private String scope;

    private long createdAt;

    private List<String> columns = new ArrayList<>();

    /** 按列顺序存放的行值 */
    private List<List<Object>> rows = new ArrayList<>();
}
