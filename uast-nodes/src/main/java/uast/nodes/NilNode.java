package uast.nodes;

/// The absent value.
public enum NilNode implements Node {
    INSTANCE;

    @Override
    public Kind kind() {
        return Kind.NIL;
    }

    @Override
    public String toString() {
        return "null";
    }
}
