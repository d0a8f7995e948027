package uast.nodes;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// A node of a syntax tree, either a parser-specific native tree or the canonical universal tree.
///
/// Instances of `Node` are immutable and thread safe. Equality is structural: two nodes are
/// equal when they are the same variant and carry equal values; objects compare their members
/// regardless of insertion order, arrays compare their elements in order.
///
/// ## Example Usage
/// ```java
/// Node ident = ObjectNode.builder()
///     .put(Uast.KEY_TYPE, "go:Ident")
///     .put("Name", "main")
///     .build();
/// String type = Uast.type(ident); // "go:Ident"
/// ```
public sealed interface Node
        permits NilNode, BoolNode, IntNode, FloatNode, StringNode, ArrayNode, ObjectNode {

    /// The variant of a node.
    enum Kind { NIL, BOOL, INT, FLOAT, STRING, ARRAY, OBJECT }

    /// {@return the variant of this node}
    Kind kind();

    /// {@return `true` for the variants that carry a single value}
    default boolean isScalar() {
        final var kind = kind();
        return kind != Kind.ARRAY && kind != Kind.OBJECT && kind != Kind.NIL;
    }

    /// {@return the `String` value represented by a `StringNode`}
    default String string() {
        throw NodeAssertionException.typeError(this, Kind.STRING);
    }

    /// {@return the elements of an `ArrayNode`}
    default List<Node> elements() {
        throw NodeAssertionException.typeError(this, Kind.ARRAY);
    }

    /// {@return the members of an `ObjectNode`}
    default Map<String, Node> members() {
        throw NodeAssertionException.typeError(this, Kind.OBJECT);
    }

    /// {@return the member with the given name, empty if this is not an object or the member is absent}
    default Optional<Node> member(String name) {
        return Optional.empty();
    }

    /// {@return the nil node}
    static Node nil() {
        return NilNode.INSTANCE;
    }

    static Node of(boolean value) {
        return BoolNode.of(value);
    }

    static Node of(long value) {
        return new IntNode(value);
    }

    static Node of(double value) {
        return new FloatNode(value);
    }

    static Node of(String value) {
        return new StringNode(value);
    }

    /// {@return an array of the given elements, in order}
    static Node array(Node... elements) {
        return new ArrayNode(List.of(elements));
    }

    /// {@return an object holding the given members}
    static Node object(Map<String, ? extends Node> members) {
        return new ObjectNode(new LinkedHashMap<String, Node>(members));
    }
}
