package io.polarion.field;

public record TextContent(
        String type,
        String value
) {
    public static final String HTML = "text/html";
    public static final String PLAIN = "text/plain";

    public TextContent {
        type = type == null ? "" : type;
        value = value == null ? "" : value;
    }

    public static TextContent html(String value) {
        return new TextContent(HTML, value);
    }

    public static TextContent plain(String value) {
        return new TextContent(PLAIN, value);
    }

    public static TextContent empty() {
        return new TextContent("", "");
    }
}
