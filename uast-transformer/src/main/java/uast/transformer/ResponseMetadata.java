package uast.transformer;

import uast.nodes.Node;
import uast.nodes.ObjectNode;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Trims and restores the single-key wrapper object some transports put around the tree.
///
/// With `topLevelIsRootNode` set the tree is the root node and both directions are the identity.
/// Otherwise {@link #apply} requires an object whose only key is `rootKey` and returns its value,
/// and {@link #reverse} wraps the tree under `rootKey` again, so the two directions undo each other.
public record ResponseMetadata(boolean topLevelIsRootNode, String rootKey) implements ReversibleTransformer {

    private static final Logger LOG = Logger.getLogger(ResponseMetadata.class.getName());

    public static final String DEFAULT_ROOT_KEY = "root";

    public ResponseMetadata {
        Objects.requireNonNull(rootKey, "rootKey must not be null");
    }

    public ResponseMetadata(boolean topLevelIsRootNode) {
        this(topLevelIsRootNode, DEFAULT_ROOT_KEY);
    }

    @Override
    public Node apply(Node root) {
        Objects.requireNonNull(root, "root must not be null");
        if (topLevelIsRootNode) {
            return root;
        }
        if (!(root instanceof ObjectNode envelope)) {
            throw new MalformedEnvelopeException("expected a single-key object at the top level, got " + root.kind());
        }
        if (envelope.size() != 1) {
            throw new MalformedEnvelopeException("expected a single-key object at the top level, got keys " + envelope.members().keySet());
        }
        final var value = envelope.members().get(rootKey);
        if (value == null) {
            throw new MalformedEnvelopeException("expected the top-level key '" + rootKey + "', got " + envelope.members().keySet());
        }
        LOG.finer(() -> "Envelope '" + rootKey + "' trimmed");
        return value;
    }

    @Override
    public Node reverse(Node root) {
        Objects.requireNonNull(root, "root must not be null");
        if (topLevelIsRootNode) {
            return root;
        }
        return new ObjectNode(Map.of(rootKey, root));
    }
}
