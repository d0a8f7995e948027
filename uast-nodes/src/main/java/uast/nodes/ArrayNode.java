package uast.nodes;

import java.util.List;
import java.util.Objects;

/// An ordered sequence of nodes. Element order is significant for equality.
public record ArrayNode(List<Node> elements) implements Node {

    public static final ArrayNode EMPTY = new ArrayNode(List.of());

    public ArrayNode {
        Objects.requireNonNull(elements, "elements must not be null");
        elements = List.copyOf(elements); // implicit NPE on null elements
    }

    @Override
    public Kind kind() {
        return Kind.ARRAY;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public String toString() {
        return NodeText.render(this);
    }
}
