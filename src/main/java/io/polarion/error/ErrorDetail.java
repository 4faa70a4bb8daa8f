package io.polarion.error;

public record ErrorDetail(
        String status,
        String title,
        String detail,
        String pointer
) {
    public ErrorDetail {
        status = status == null ? "" : status;
        title = title == null ? "" : title;
        detail = detail == null ? "" : detail;
        pointer = pointer == null || pointer.isBlank() ? null : pointer;
    }

    public String describe() {
        if (pointer != null) {
            return "field '" + pointer + "': " + detail;
        }
        if (!title.isEmpty()) {
            return title + ": " + detail;
        }
        return detail;
    }

    @Override
    public String toString() {
        if (pointer != null) {
            return "[" + status + "] " + detail + " (at " + pointer + ")";
        }
        if (!title.isEmpty()) {
            return "[" + status + "] " + title + ": " + detail;
        }
        return "[" + status + "] " + detail;
    }
}
