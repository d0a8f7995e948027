package uast.nodes;

import java.util.Objects;

/// A string scalar.
public record StringNode(String value) implements Node {

    public StringNode {
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public Kind kind() {
        return Kind.STRING;
    }

    @Override
    public String string() {
        return value;
    }

    @Override
    public String toString() {
        return NodeText.quote(value);
    }
}
