package uast.nodes;

/// A boolean scalar.
public record BoolNode(boolean value) implements Node {

    public static final BoolNode TRUE = new BoolNode(true);
    public static final BoolNode FALSE = new BoolNode(false);

    public static BoolNode of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public Kind kind() {
        return Kind.BOOL;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
