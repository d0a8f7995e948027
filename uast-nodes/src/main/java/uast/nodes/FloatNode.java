package uast.nodes;

/// A floating point scalar. Equality follows `Double.compare`, so `NaN` equals itself.
public record FloatNode(double value) implements Node {

    @Override
    public Kind kind() {
        return Kind.FLOAT;
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
