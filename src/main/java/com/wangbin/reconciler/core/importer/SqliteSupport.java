package com.wangbin.reconciler.core.importer;

import com.wangbin.reconciler.core.table.Row;
import com.wangbin.reconciler.core.table.RowSet;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SQLite数据源工具
 */
public final class SqliteSupport {

    private static final String DRIVER = "org.sqlite.JDBC";

    private SqliteSupport() {
    }

    public static JdbcTemplate jdbcTemplate(Path databaseFile) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName(DRIVER);
        dataSource.setUrl("jdbc:sqlite:" + databaseFile.toAbsolutePath());
        return new JdbcTemplate(dataSource);
    }

    /**
     * 查询结果转行集；整数统一为Long
     */
    public static RowSet query(JdbcTemplate jdbcTemplate, String sql) {
        List<Map<String, Object>> records = jdbcTemplate.queryForList(sql);
        Set<String> columns = new LinkedHashSet<>();
        List<Row> rows = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : record.entrySet()) {
                Object value = entry.getValue();
                if (value instanceof Integer i) {
                    value = i.longValue();
                }
                values.put(entry.getKey(), value);
                columns.add(entry.getKey());
            }
            rows.add(Row.of(values));
        }
        return RowSet.of(new ArrayList<>(columns), rows);
    }
}
