package uast.transformer;

import uast.nodes.Node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Variable bindings captured while matching one pattern against one node.
///
/// A `Bindings` instance belongs to a single match attempt and is discarded when the attempt
/// fails, so a failed match never leaks partial captures.
public final class Bindings {

    private final Map<String, Node> values = new LinkedHashMap<>();

    Bindings() {}

    /// Binds `name` to `node`, or checks `node` against an existing binding.
    ///
    /// @return `false` if `name` is already bound to a node that is not structurally equal
    boolean bind(String name, Node node) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(node, "node must not be null");
        final var existing = values.putIfAbsent(name, node);
        return existing == null || existing.equals(node);
    }

    public Optional<Node> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /// {@return the bound node}
    /// @throws IllegalStateException if `name` is unbound, which validated mappings rule out
    Node require(String name) {
        final var node = values.get(name);
        if (node == null) {
            throw new IllegalStateException("variable '" + name + "' is not bound; bound: " + values.keySet());
        }
        return node;
    }

    public Map<String, Node> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "Bindings" + values;
    }
}
