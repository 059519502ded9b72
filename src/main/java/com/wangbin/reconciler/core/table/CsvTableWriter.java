package com.wangbin.reconciler.core.table;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV表写出器
 * 空标记写为空单元格，布尔值写为 True/False 以便与上一轮报表直接比对。
 * 文件以UTF-8 BOM开头，Excel打开时按UTF-8识别。
 */
public final class CsvTableWriter {

    private static final char BOM = '\uFEFF';

    private CsvTableWriter() {
    }

    public static void write(RowSet table, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(BOM);
            write(table, writer);
        }
    }

    public static void write(RowSet table, Writer writer) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(table.columns().toArray(new String[0]))
                .build();
        try (CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (Row row : table.rows()) {
                List<String> cells = new ArrayList<>(table.columns().size());
                for (String column : table.columns()) {
                    cells.add(format(row.get(column)));
                }
                printer.printRecord(cells);
            }
        }
    }

    public static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        return value.toString();
    }
}
