package io.polarion.field;

import java.util.ArrayList;
import java.util.List;

public record TableRow(List<TextContent> values) {
    public TableRow {
        values = values == null ? new ArrayList<>() : new ArrayList<>(values);
    }

    public static TableRow empty() {
        return new TableRow(List.of());
    }
}
