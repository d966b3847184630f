package com.flowcraft.core.io;

import java.util.List;
import java.util.Map;

/**
 * Dependency-free indentation renderer producing a YAML-shaped document.
 *
 * <p>
 * Rules:
 * <ul>
 * <li>Mappings as {@code key: value} lines, two spaces per nesting level.</li>
 * <li>List items as {@code - item}, one level deeper than their key.</li>
 * <li>A list item that is a mapping is a bare {@code -} followed by the
 * mapping two levels deeper.</li>
 * <li>Empty mappings as {@code {}}, empty lists as {@code []}.</li>
 * <li>Scalars are written as-is, without quoting.</li>
 * </ul>
 * Output ends with a newline unless the document is empty.
 */
public final class PlainFlowSerializer implements FlowSerializer {
    private static final String INDENT = "  ";

    @Override
    public String render(Map<String, Object> document) {
        StringBuilder sb = new StringBuilder(1024);
        appendMapping(sb, document, 0);
        return sb.toString();
    }

    private static void appendMapping(StringBuilder sb, Map<?, ?> mapping, int level) {
        for (Map.Entry<?, ?> e : mapping.entrySet()) {
            indent(sb, level).append(e.getKey()).append(':');
            Object value = e.getValue();
            if (value instanceof Map<?, ?> m) {
                if (m.isEmpty()) {
                    sb.append(" {}\n");
                } else {
                    sb.append('\n');
                    appendMapping(sb, m, level + 1);
                }
            } else if (value instanceof List<?> list) {
                if (list.isEmpty()) {
                    sb.append(" []\n");
                } else {
                    sb.append('\n');
                    appendList(sb, list, level + 1);
                }
            } else {
                sb.append(' ').append(scalar(value)).append('\n');
            }
        }
    }

    private static void appendList(StringBuilder sb, List<?> list, int level) {
        for (Object item : list) {
            if (item instanceof Map<?, ?> m) {
                indent(sb, level).append("-\n");
                appendMapping(sb, m, level + 1);
            } else {
                indent(sb, level).append("- ").append(scalar(item)).append('\n');
            }
        }
    }

    private static String scalar(Object value) {
        return value == null ? "null" : value.toString();
    }

    private static StringBuilder indent(StringBuilder sb, int level) {
        for (int i = 0; i < level; i++)
            sb.append(INDENT);
        return sb;
    }
}
