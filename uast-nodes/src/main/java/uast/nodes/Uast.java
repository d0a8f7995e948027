package uast.nodes;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Reserved keys of the universal tree and accessors that treat their absence as empty.
///
/// The reserved members are the stable contract with loaders and consumers:
/// - `@type` holds a string of the form `"namespace:name"` or `"name"`;
/// - `@role` holds an ordered array of integer role ids (see {@link Role}).
public final class Uast {

    public static final String KEY_TYPE = "@type";
    public static final String KEY_ROLES = "@role";

    static final char NAMESPACE_SEPARATOR = ':';

    private Uast() {}

    /// {@return the `@type` of an object node, or `""` if the node is not an object or carries no string type}
    public static String type(Node node) {
        Objects.requireNonNull(node, "node must not be null");
        return node.member(KEY_TYPE)
                .filter(StringNode.class::isInstance)
                .map(Node::string)
                .orElse("");
    }

    /// {@return the role ids of a node in declared order; empty when `@role` is absent or not an array}
    ///
    /// Elements that are not integers, or that do not fit an `int`, are skipped.
    public static List<Integer> roles(Node node) {
        Objects.requireNonNull(node, "node must not be null");
        final var value = node.member(KEY_ROLES).orElse(null);
        if (!(value instanceof ArrayNode arr)) {
            return List.of();
        }
        final var out = new ArrayList<Integer>(arr.size());
        for (final var element : arr.elements()) {
            if (element instanceof IntNode i && i.value() >= Integer.MIN_VALUE && i.value() <= Integer.MAX_VALUE) {
                out.add((int) i.value());
            }
        }
        return List.copyOf(out);
    }

    /// {@return an `@role` value holding the given ids in order}
    public static ArrayNode roleList(int... ids) {
        final var out = new ArrayList<Node>(ids.length);
        for (final int id : ids) {
            out.add(new IntNode(id));
        }
        return new ArrayNode(out);
    }

    public static ArrayNode roleList(Role... roles) {
        final var out = new ArrayList<Node>(roles.length);
        for (final var role : roles) {
            out.add(new IntNode(role.id()));
        }
        return new ArrayNode(out);
    }

    /// {@return the namespace of a `"namespace:name"` type, or `""` when there is none}
    public static String namespace(String type) {
        Objects.requireNonNull(type, "type must not be null");
        final int i = type.indexOf(NAMESPACE_SEPARATOR);
        return i < 0 ? "" : type.substring(0, i);
    }

    /// {@return the name part of a `"namespace:name"` type}
    public static String localName(String type) {
        Objects.requireNonNull(type, "type must not be null");
        final int i = type.indexOf(NAMESPACE_SEPARATOR);
        return i < 0 ? type : type.substring(i + 1);
    }
}
