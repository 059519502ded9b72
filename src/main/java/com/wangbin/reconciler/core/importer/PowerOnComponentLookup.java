package com.wangbin.reconciler.core.importer;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.file.Path;
import java.util.List;

/**
 * PowerOn组件别名查询
 * 按组件别名查询 component_header，结果在进程内缓存，同一别名只查一次库。
 */
@Slf4j
public class PowerOnComponentLookup implements ComponentAliasLookup {

    private static final String SQL_COMPONENT_ID =
            "SELECT component_id FROM component_header WHERE component_alias = ?";

    private final JdbcTemplate jdbcTemplate;
    private final Cache<String, Boolean> existenceCache = Caffeine.newBuilder()
            .maximumSize(200_000)
            .recordStats()
            .build();

    public PowerOnComponentLookup(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public static PowerOnComponentLookup open(Path databaseFile) {
        log.info("打开PowerOn组件库: {}", databaseFile);
        return new PowerOnComponentLookup(SqliteSupport.jdbcTemplate(databaseFile));
    }

    /**
     * 别名是否存在于PowerOn；空别名视为不存在，查询出错时记录告警并视为不存在
     */
    @Override
    public boolean aliasExists(String alias) {
        if (alias == null || alias.isBlank()) {
            return false;
        }
        return existenceCache.get(alias, this::queryExists);
    }

    private Boolean queryExists(String alias) {
        try {
            List<Object> ids = jdbcTemplate.queryForList(SQL_COMPONENT_ID, Object.class, alias);
            return !ids.isEmpty() && ids.get(0) != null && !ids.get(0).toString().isEmpty();
        } catch (DataAccessException e) {
            log.warn("查询PowerOn组件失败: alias='{}', error={}", alias, e.getMessage());
            return false;
        }
    }

    public String getStatsSummary() {
        return existenceCache.stats().toString();
    }
}
