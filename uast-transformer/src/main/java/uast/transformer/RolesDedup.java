package uast.transformer;

import uast.nodes.ArrayNode;
import uast.nodes.Node;
import uast.nodes.ObjectNode;
import uast.nodes.Uast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Objects;

/// Removes duplicate role ids from every `@role` in a tree.
///
/// The first occurrence of each id is kept and the relative order is preserved. This is a plain
/// structural pass without any pattern matching; applying it twice is the same as applying it once.
public enum RolesDedup implements Transformer {
    INSTANCE;

    public static RolesDedup rolesDedup() {
        return INSTANCE;
    }

    @Override
    public Node apply(Node root) {
        Objects.requireNonNull(root, "root must not be null");
        return dedup(root);
    }

    private static Node dedup(Node node) {
        if (node instanceof ArrayNode arr) {
            final var out = new ArrayList<Node>(arr.size());
            var changed = false;
            for (final var element : arr.elements()) {
                final var updated = dedup(element);
                changed |= updated != element;
                out.add(updated);
            }
            return changed ? new ArrayNode(out) : node;
        }
        if (!(node instanceof ObjectNode obj)) {
            return node;
        }
        final var out = new LinkedHashMap<String, Node>(obj.size());
        var changed = false;
        for (final var entry : obj.members().entrySet()) {
            var value = entry.getValue();
            final var updated = Uast.KEY_ROLES.equals(entry.getKey()) && value instanceof ArrayNode roles
                    ? unique(roles)
                    : dedup(value);
            changed |= updated != value;
            out.put(entry.getKey(), updated);
        }
        return changed ? new ObjectNode(out) : node;
    }

    private static ArrayNode unique(ArrayNode roles) {
        final var seen = new LinkedHashSet<>(roles.elements());
        return seen.size() == roles.size() ? roles : new ArrayNode(new ArrayList<>(seen));
    }
}
