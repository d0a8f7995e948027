package uast.nodes;

/// Compact JSON-like rendering used by `toString()` for diagnostics.
final class NodeText {

    private NodeText() {}

    static String render(Node node) {
        final var sb = new StringBuilder();
        append(sb, node);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Node node) {
        if (node instanceof ArrayNode arr) {
            sb.append('[');
            var first = true;
            for (final var element : arr.elements()) {
                if (!first) sb.append(',');
                append(sb, element);
                first = false;
            }
            sb.append(']');
        } else if (node instanceof ObjectNode obj) {
            sb.append('{');
            var first = true;
            for (final var entry : obj.members().entrySet()) {
                if (!first) sb.append(',');
                sb.append(quote(entry.getKey())).append(':');
                append(sb, entry.getValue());
                first = false;
            }
            sb.append('}');
        } else {
            sb.append(node);
        }
    }

    static String quote(String s) {
        final var sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
