package io.mcpcompat.server.spi;

import java.util.List;
import java.util.Objects;

/**
 * Content payload returned by a tool.
 *
 * @param content content items in display order
 * @param isError whether the call failed at tool level
 */
public record ToolResult(List<Content> content, boolean isError) {

    public ToolResult {
        content = List.copyOf(Objects.requireNonNull(content, "content"));
    }

    public static ToolResult text(String text) {
        return new ToolResult(List.of(new Content.Text(text)), false);
    }

    public static ToolResult error(String text) {
        return new ToolResult(List.of(new Content.Text(text)), true);
    }

    /**
     * A content item.
     */
    public sealed interface Content permits Content.Text {

        String type();

        record Text(String text) implements Content {
            public Text {
                Objects.requireNonNull(text, "text");
            }

            @Override
            public String type() {
                return "text";
            }
        }
    }
}
