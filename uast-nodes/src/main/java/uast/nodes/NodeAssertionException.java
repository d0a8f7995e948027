package uast.nodes;

/// Thrown when a node is accessed as a variant it is not.
public final class NodeAssertionException extends RuntimeException {

    public NodeAssertionException(String message) {
        super(message);
    }

    static NodeAssertionException typeError(Node node, Node.Kind expected) {
        return new NodeAssertionException("expected " + expected + " node but was " + node.kind() + ": " + node);
    }
}
