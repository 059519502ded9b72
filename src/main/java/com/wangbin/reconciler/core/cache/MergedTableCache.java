package com.wangbin.reconciler.core.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.wangbin.reconciler.common.exception.ReconcileException;
import com.wangbin.reconciler.core.config.ReconcilerProperties.CacheConfig;
import com.wangbin.reconciler.core.merge.MergeScope;
import com.wangbin.reconciler.core.table.Row;
import com.wangbin.reconciler.core.table.RowSet;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 合并表两级缓存
 * 一级为进程内Caffeine缓存（按范围键），二级为JSON文件（整表读写，不做部分读取）。
 * 全网范围构建的文件可服务任意RTU/变电站范围，在内存中重新过滤。
 */
@Slf4j
public class MergedTableCache {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final Path cacheFile;
    private final Cache<String, RowSet> localCache;

    public MergedTableCache(Path cacheFile, CacheConfig config) {
        this.cacheFile = cacheFile;
        this.localCache = Caffeine.newBuilder()
                .maximumSize(config.getLocalMaxSize())
                .expireAfterAccess(config.getExpireAfterAccessSeconds(), TimeUnit.SECONDS)
                .recordStats()
                .build();
        log.info("合并表缓存初始化完成: file={}, localMaxSize={}", cacheFile, config.getLocalMaxSize());
    }

    public Optional<RowSet> get(MergeScope scope) {
        RowSet cached = localCache.getIfPresent(scope.key());
        if (cached != null) {
            log.info("本地缓存命中: scope={}, rows={}", scope, cached.size());
            return Optional.of(cached);
        }

        Optional<MergedTableSnapshot> snapshot = readSnapshot();
        if (snapshot.isEmpty()) {
            return Optional.empty();
        }
        String builtFor = snapshot.get().getScope();
        RowSet table;
        if (scope.key().equals(builtFor)) {
            table = toRowSet(snapshot.get());
        } else if (MergeScope.all().key().equals(builtFor)) {
            table = toRowSet(snapshot.get()).filter(scope::matches);
        } else {
            log.info("缓存文件范围 {} 不能服务 {}，需要重新合并", builtFor, scope);
            return Optional.empty();
        }
        log.info("缓存文件命中: scope={}, builtFor={}, rows={}", scope, builtFor, table.size());
        localCache.put(scope.key(), table);
        return Optional.of(table);
    }

    /**
     * 整表覆盖写入缓存文件
     */
    public void put(MergeScope scope, RowSet table) {
        MergedTableSnapshot snapshot = new MergedTableSnapshot();
        snapshot.setScope(scope.key());
        snapshot.setCreatedAt(System.currentTimeMillis());
        snapshot.setColumns(new ArrayList<>(table.columns()));
        for (Row row : table.rows()) {
            List<Object> values = new ArrayList<>(table.columns().size());
            for (String column : table.columns()) {
                values.add(row.get(column));
            }
            snapshot.getRows().add(values);
        }

        try {
            Path parent = cacheFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = cacheFile.resolveSibling(cacheFile.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), snapshot);
            Files.move(temp, cacheFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("写入缓存文件失败: {}", cacheFile, e);
            throw ReconcileException.cacheError("写入缓存文件失败: " + cacheFile, e);
        }
        localCache.invalidateAll();
        localCache.put(scope.key(), table);
        log.info("缓存已写入: scope={}, rows={}, file={}", scope, table.size(), cacheFile);
    }

    public void invalidate() {
        localCache.invalidateAll();
        try {
            if (Files.deleteIfExists(cacheFile)) {
                log.info("缓存文件已删除: {}", cacheFile);
            }
        } catch (IOException e) {
            throw ReconcileException.cacheError("删除缓存文件失败: " + cacheFile, e);
        }
    }

    /**
     * 缓存文件损坏时按未命中处理，重新合并后会覆盖
     */
    private Optional<MergedTableSnapshot> readSnapshot() {
        if (!Files.isRegularFile(cacheFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(cacheFile.toFile(), MergedTableSnapshot.class));
        } catch (IOException e) {
            log.warn("缓存文件读取失败，按未命中处理: file={}, error={}", cacheFile, e.getMessage());
            return Optional.empty();
        }
    }

    static RowSet toRowSet(MergedTableSnapshot snapshot) {
        List<String> columns = snapshot.getColumns();
        List<Row> rows = new ArrayList<>(snapshot.getRows().size());
        for (List<Object> values : snapshot.getRows()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), i < values.size() ? normalize(values.get(i)) : null);
            }
            rows.add(Row.of(row));
        }
        return RowSet.of(columns, rows);
    }

    /**
     * JSON反序列化的整数统一为Long
     */
    private static Object normalize(Object value) {
        if (value instanceof Integer i) {
            return i.longValue();
        }
        if (value instanceof BigInteger b) {
            return b.longValue();
        }
        return value;
    }

    public String getStatsSummary() {
        return localCache.stats().toString();
    }
}
