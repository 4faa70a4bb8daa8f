package io.polarion.field;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class TableField {
    private final List<String> keys;
    private final List<TableRow> rows;

    @JsonCreator
    public TableField(@JsonProperty("keys") List<String> keys, @JsonProperty("rows") List<TableRow> rows) {
        this.keys = keys == null ? new ArrayList<>() : new ArrayList<>(keys);
        this.rows = rows == null ? new ArrayList<>() : new ArrayList<>(rows);
    }

    public static TableField withColumns(String... keys) {
        return new TableField(List.of(keys), List.of());
    }

    @JsonProperty("keys")
    public List<String> keys() {
        return keys;
    }

    @JsonProperty("rows")
    public List<TableRow> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return keys.size();
    }

    public TextContent cell(int row, int col) {
        List<TextContent> values = row(row);
        if (col < 0 || col >= values.size()) {
            throw new IndexOutOfBoundsException(
                    "column index " + col + " out of bounds (row " + row + " has " + values.size() + " columns)");
        }
        return values.get(col);
    }

    public TextContent cell(int row, String key) {
        return cell(row, columnIndex(key));
    }

    public List<TextContent> row(int row) {
        if (row < 0 || row >= rows.size()) {
            throw new IndexOutOfBoundsException("row index " + row + " out of bounds (table has " + rows.size() + " rows)");
        }
        return rows.get(row).values();
    }

    public Map<String, TextContent> rowAsMap(int row) {
        List<TextContent> values = row(row);
        Map<String, TextContent> out = new LinkedHashMap<>();
        for (int i = 0; i < keys.size() && i < values.size(); i++) {
            out.put(keys.get(i), values.get(i));
        }
        return out;
    }

    public List<Map<String, TextContent>> rowsAsMaps() {
        List<Map<String, TextContent>> out = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            out.add(rowAsMap(i));
        }
        return out;
    }

    public List<TextContent> column(int col) {
        if (col < 0 || col >= keys.size()) {
            throw new IndexOutOfBoundsException("column index " + col + " out of bounds (table has " + keys.size() + " columns)");
        }
        List<TextContent> out = new ArrayList<>(rows.size());
        for (TableRow row : rows) {
            out.add(col < row.values().size() ? row.values().get(col) : TextContent.empty());
        }
        return out;
    }

    public List<TextContent> column(String key) {
        return column(columnIndex(key));
    }

    public void addRow(List<TextContent> values) {
        if (values == null || values.size() != keys.size()) {
            int size = values == null ? 0 : values.size();
            throw new IllegalArgumentException("row has " + size + " values but table has " + keys.size() + " columns");
        }
        rows.add(new TableRow(values));
    }

    public void setCell(int row, int col, TextContent value) {
        List<TextContent> values = row(row);
        if (col < 0 || col >= values.size()) {
            throw new IndexOutOfBoundsException(
                    "column index " + col + " out of bounds (row " + row + " has " + values.size() + " columns)");
        }
        values.set(col, value == null ? TextContent.empty() : value);
    }

    private int columnIndex(String key) {
        int index = keys.indexOf(key);
        if (index < 0) {
            throw new IllegalArgumentException("column key \"" + key + "\" not found in table");
        }
        return index;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TableField)) {
            return false;
        }
        TableField that = (TableField) other;
        return keys.equals(that.keys) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return 31 * keys.hashCode() + rows.hashCode();
    }

    @Override
    public String toString() {
        return "TableField{keys=" + keys + ", rows=" + rows.size() + "}";
    }
}
