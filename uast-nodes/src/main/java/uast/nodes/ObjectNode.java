package uast.nodes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A mapping from unique string keys to nodes.
///
/// Members keep their insertion order for display, but equality ignores it: two objects are
/// equal if `o1.members().equals(o2.members())`.
public record ObjectNode(Map<String, Node> members) implements Node {

    public static final ObjectNode EMPTY = new ObjectNode(Map.of());

    public ObjectNode {
        Objects.requireNonNull(members, "members must not be null");
        final var copy = new LinkedHashMap<String, Node>(members.size());
        for (final var entry : members.entrySet()) {
            copy.put(Objects.requireNonNull(entry.getKey(), "member name must not be null"),
                    Objects.requireNonNull(entry.getValue(), () -> "member '" + entry.getKey() + "' must not be null"));
        }
        members = Collections.unmodifiableMap(copy);
    }

    @Override
    public Kind kind() {
        return Kind.OBJECT;
    }

    @Override
    public Optional<Node> member(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(members.get(name));
    }

    public int size() {
        return members.size();
    }

    /// {@return a copy of this object with `name` set to `value`}
    public ObjectNode with(String name, Node value) {
        final var out = new LinkedHashMap<>(members);
        out.put(name, value);
        return new ObjectNode(out);
    }

    /// {@return a copy of this object without `name`, or this object if `name` is absent}
    public ObjectNode without(String name) {
        if (!members.containsKey(name)) {
            return this;
        }
        final var out = new LinkedHashMap<>(members);
        out.remove(name);
        return new ObjectNode(out);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return NodeText.render(this);
    }

    /// Incremental construction of an `ObjectNode`. Putting a name twice replaces the earlier value.
    public static final class Builder {
        private final LinkedHashMap<String, Node> members = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String name, Node value) {
            members.put(Objects.requireNonNull(name, "name must not be null"),
                    Objects.requireNonNull(value, "value must not be null"));
            return this;
        }

        public Builder put(String name, String value) {
            return put(name, new StringNode(value));
        }

        public Builder put(String name, long value) {
            return put(name, new IntNode(value));
        }

        public Builder put(String name, boolean value) {
            return put(name, BoolNode.of(value));
        }

        public Builder putAll(Map<String, ? extends Node> values) {
            values.forEach(this::put);
            return this;
        }

        public ObjectNode build() {
            return new ObjectNode(members);
        }
    }
}
