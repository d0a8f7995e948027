package uast.transformer;

import uast.nodes.ArrayNode;
import uast.nodes.Node;
import uast.nodes.ObjectNode;
import uast.nodes.Uast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// An ordered list of {@link Mapping}s applied once to every node of a tree.
///
/// The tree is walked bottom-up: the children of a node are rewritten before the node itself is
/// offered to the mappings. For each node the mappings are tried in declared order and the first
/// whose match succeeds replaces the node with its build result; a node no mapping matches is
/// kept as is. A rewritten node is not offered to the stage again. Mapping order is significant
/// and never changed.
public final class Stage implements ReversibleTransformer {

    private static final Logger LOG = Logger.getLogger(Stage.class.getName());

    private final String name;
    private final List<Mapping> mappings;
    // the @type each mapping's match pins per direction, null when it matches any node
    private final String[] forwardTypes;
    private final String[] reverseTypes;

    private Stage(String name, List<Mapping> mappings) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.mappings = List.copyOf(Objects.requireNonNull(mappings, "mappings must not be null"));
        this.forwardTypes = new String[this.mappings.size()];
        this.reverseTypes = new String[this.mappings.size()];
        for (int i = 0; i < this.mappings.size(); i++) {
            final var mapping = this.mappings.get(i);
            forwardTypes[i] = Patterns.requiredType(mapping.forward().match()).orElse(null);
            reverseTypes[i] = Patterns.requiredType(mapping.reverse().match()).orElse(null);
        }
    }

    public static Stage of(String name, List<Mapping> mappings) {
        return new Stage(name, mappings);
    }

    public static Stage of(String name, Mapping... mappings) {
        return new Stage(name, List.of(mappings));
    }

    public static Stage of(Mapping... mappings) {
        return new Stage("stage", List.of(mappings));
    }

    public String name() {
        return name;
    }

    /// {@return the mappings in the order they are tried}
    public List<Mapping> mappings() {
        return mappings;
    }

    @Override
    public Node apply(Node root) {
        return run(root, true);
    }

    @Override
    public Node reverse(Node root) {
        return run(root, false);
    }

    private Node run(Node root, boolean forward) {
        Objects.requireNonNull(root, "root must not be null");
        final var pass = new Pass(forward);
        final var out = pass.visit(root);
        LOG.fine(() -> "Stage '" + name + "' " + (forward ? "forward" : "reverse") + ": " + pass.rewrites + " rewrites");
        return out;
    }

    /// State of one traversal; never shared between calls.
    private final class Pass {
        private final boolean forward;
        private final String[] types;
        private int rewrites;

        Pass(boolean forward) {
            this.forward = forward;
            this.types = forward ? forwardTypes : reverseTypes;
        }

        Node visit(Node node) {
            return rewrite(visitChildren(node));
        }

        private Node visitChildren(Node node) {
            if (node instanceof ArrayNode arr) {
                final var out = new ArrayList<Node>(arr.size());
                var changed = false;
                for (final var element : arr.elements()) {
                    final var updated = visit(element);
                    changed |= updated != element;
                    out.add(updated);
                }
                return changed ? new ArrayNode(out) : node;
            }
            if (node instanceof ObjectNode obj) {
                final var out = new LinkedHashMap<String, Node>(obj.size());
                var changed = false;
                for (final var entry : obj.members().entrySet()) {
                    final var updated = visit(entry.getValue());
                    changed |= updated != entry.getValue();
                    out.put(entry.getKey(), updated);
                }
                return changed ? new ObjectNode(out) : node;
            }
            return node;
        }

        private Node rewrite(Node node) {
            final String type = node instanceof ObjectNode ? Uast.type(node) : null;
            for (int i = 0; i < mappings.size(); i++) {
                if (types[i] != null && !types[i].equals(type)) {
                    continue;
                }
                final var mapping = mappings.get(i);
                final var rule = mapping.rule(forward);
                final var bindings = Matcher.match(rule.match(), node);
                if (bindings.isPresent()) {
                    rewrites++;
                    LOG.finer(() -> "Stage '" + name + "': mapping '" + mapping.name() + "' matched " + node.kind());
                    return NodeBuilder.build(rule.build(), bindings.get());
                }
            }
            return node;
        }
    }

    @Override
    public String toString() {
        return "Stage[" + name + ", " + mappings.size() + " mappings]";
    }
}
