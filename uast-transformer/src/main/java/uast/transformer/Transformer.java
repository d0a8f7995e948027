package uast.transformer;

import uast.nodes.Node;

/// A step that turns one tree into another.
///
/// Implementations are immutable and may be shared between threads; each call owns the tree it
/// is given and returns a tree that may share untouched subtrees with the input.
@FunctionalInterface
public interface Transformer {

    Node apply(Node root);
}
