package uast.transformer;

import uast.nodes.Node;

/// A {@link Transformer} that can also turn its canonical output back into the native shape.
public interface ReversibleTransformer extends Transformer {

    Node reverse(Node root);
}
