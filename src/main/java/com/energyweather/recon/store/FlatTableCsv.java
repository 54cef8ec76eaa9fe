package com.energyweather.recon.store;

import com.energyweather.recon.model.FlatTable;
import com.energyweather.utils.Cells;
import com.energyweather.utils.DateParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads and writes {@link FlatTable}s as UTF-8 CSV with a header row.
 */
public final class FlatTableCsv {
    static final String DATE_COLUMN = "date";

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();

    private static final CSVFormat WRITE_FORMAT = CSVFormat.DEFAULT.builder()
            .setRecordSeparator("\n")
            .build();

    private FlatTableCsv() {
    }

    /**
     * Reads a table and infers column types: {@code date} becomes {@link LocalDate}, a column whose
     * non-empty cells all parse as numbers becomes {@link Double}, {@code true}/{@code false} columns
     * become {@link Boolean}, anything else stays text. Empty cells are null.
     */
    public static FlatTable read(Path file) throws IOException {
        FlatTable text = readText(file);
        List<String> header = text.columns();
        ColumnType[] types = new ColumnType[header.size()];
        for (int c = 0; c < header.size(); c++) {
            types[c] = inferType(header.get(c), text.column(header.get(c)));
        }
        FlatTable.Builder builder = FlatTable.builder(header);
        for (int r = 0; r < text.rowCount(); r++) {
            List<Object> cells = text.row(r);
            List<Object> typed = new ArrayList<>(cells.size());
            for (int c = 0; c < cells.size(); c++) {
                typed.add(convert(types[c], (String) cells.get(c)));
            }
            builder.addRow(typed);
        }
        return builder.build();
    }

    /** Reads a table without type inference: every non-empty cell is a {@link String}, empty cells are null. */
    public static FlatTable readText(Path file) throws IOException {
        List<String> header = new ArrayList<>();
        List<List<Object>> rows = new ArrayList<>();
        String content = Files.readString(file, StandardCharsets.UTF_8);
        if (!content.isEmpty() && content.charAt(0) == '\uFEFF') {
            content = content.substring(1);
        }
        try (CSVParser parser = READ_FORMAT.parse(new StringReader(content))) {
            for (String name : parser.getHeaderNames()) {
                if (name != null && !name.isEmpty() && !header.contains(name)) {
                    header.add(name);
                }
            }
            for (CSVRecord record : parser) {
                List<Object> cells = new ArrayList<>(header.size());
                for (String name : header) {
                    String value = record.isSet(name) ? record.get(name) : null;
                    cells.add(value == null || value.isEmpty() ? null : value);
                }
                rows.add(cells);
            }
        }
        FlatTable.Builder builder = FlatTable.builder(header);
        for (List<Object> row : rows) {
            builder.addRow(row);
        }
        return builder.build();
    }

    /**
     * Writes through a sibling temp file that is moved over {@code target}, so readers never see a
     * partially written table.
     */
    public static void write(FlatTable table, Path target) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = Files.createTempFile(dir, target.getFileName().toString() + ".", ".tmp");
        try {
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, WRITE_FORMAT)) {
                printer.printRecord(table.columns());
                for (int r = 0; r < table.rowCount(); r++) {
                    List<String> cells = new ArrayList<>(table.columnCount());
                    for (Object cell : table.row(r)) {
                        cells.add(Cells.format(cell));
                    }
                    printer.printRecord(cells);
                }
            }
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static ColumnType inferType(String column, List<Object> cells) {
        if (DATE_COLUMN.equals(column)) {
            return ColumnType.DATE;
        }
        boolean any = false;
        boolean numeric = true;
        boolean bool = true;
        for (Object value : cells) {
            if (value == null) {
                continue;
            }
            String cell = (String) value;
            any = true;
            if (numeric && !Cells.isNumberText(cell)) {
                numeric = false;
            }
            String lower = cell.trim().toLowerCase(Locale.ROOT);
            if (bool && !"true".equals(lower) && !"false".equals(lower)) {
                bool = false;
            }
            if (!numeric && !bool) {
                return ColumnType.TEXT;
            }
        }
        if (!any) {
            return ColumnType.TEXT;
        }
        return numeric ? ColumnType.NUMBER : ColumnType.BOOLEAN;
    }

    private static Object convert(ColumnType type, String cell) {
        if (cell == null) {
            return null;
        }
        switch (type) {
            case DATE:
                return DateParsing.parseDate(cell);
            case NUMBER:
                return Double.parseDouble(cell.trim());
            case BOOLEAN:
                return Boolean.parseBoolean(cell.trim());
            default:
                return cell;
        }
    }

    private enum ColumnType {
        DATE, NUMBER, BOOLEAN, TEXT
    }
}
