package uast.nodes;

/// An integer scalar. Never equal to a `FloatNode`, even for the same numeric value.
public record IntNode(long value) implements Node {

    @Override
    public Kind kind() {
        return Kind.INT;
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
