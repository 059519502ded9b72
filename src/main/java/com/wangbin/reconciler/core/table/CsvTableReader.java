package com.wangbin.reconciler.core.table;

import com.wangbin.reconciler.common.exception.ReconcileException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CSV表读取器
 * 首行为表头；空单元格读为空标记（null），其余一律按字符串读入，类型转换由各导入器负责。
 */
@Slf4j
public final class CsvTableReader {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setAllowMissingColumnNames(true)
            .setIgnoreEmptyLines(true)
            .build();

    private CsvTableReader() {
    }

    public static RowSet read(Path file) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            RowSet table = read(reader);
            log.info("读取CSV文件完成: {}, 行数={}, 列数={}", file.getFileName(), table.size(), table.columns().size());
            return table;
        } catch (IOException e) {
            throw ReconcileException.sourceLoadError(file.toString(), e);
        }
    }

    public static RowSet read(Reader reader) throws IOException {
        try (CSVParser parser = FORMAT.parse(reader)) {
            List<String> headers = new ArrayList<>();
            for (String header : parser.getHeaderNames()) {
                headers.add(stripBom(header));
            }
            List<Row> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                Map<String, Object> values = new LinkedHashMap<>();
                for (int i = 0; i < headers.size(); i++) {
                    String cell = record.isSet(i) ? record.get(i) : null;
                    values.put(headers.get(i), cell == null || cell.isEmpty() ? null : cell);
                }
                rows.add(Row.of(values));
            }
            return RowSet.of(headers, rows);
        }
    }

    private static String stripBom(String header) {
        return header.startsWith("\uFEFF") ? header.substring(1) : header;
    }
}
