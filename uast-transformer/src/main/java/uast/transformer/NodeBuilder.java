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

/// Build side of the pattern algebra: evaluates an {@link Op} against {@link Bindings}.
///
/// Mappings are validated when assembled, so every variable a build pattern references has been
/// bound by its match pattern. An unbound variable here is a programming error and surfaces as
/// an `IllegalStateException`.
final class NodeBuilder {

    private static final Logger LOG = Logger.getLogger(NodeBuilder.class.getName());

    private NodeBuilder() {}

    static Node build(Op op, Bindings bindings) {
        Objects.requireNonNull(op, "op must not be null");
        Objects.requireNonNull(bindings, "bindings must not be null");
        return build(op, "", bindings);
    }

    private static Node build(Op op, String path, Bindings bindings) {
        if (op instanceof Op.Var v) {
            return bindings.require(v.name());
        }
        if (op instanceof Op.Is is) {
            return is.value();
        }
        if (op instanceof Op.Arr arr) {
            final var out = new ArrayList<Node>(arr.elements().size());
            for (int i = 0; i < arr.elements().size(); i++) {
                out.add(build(arr.elements().get(i), path + "/" + i, bindings));
            }
            return new ArrayNode(out);
        }
        if (op instanceof Op.Obj obj) {
            return buildObject(obj, path, bindings);
        }
        if (op instanceof Op.MapObj mapObj) {
            return buildObject(mapObj.construct(), path, bindings);
        }
        if (op instanceof Op.AnnotateType at) {
            return buildAnnotated(at.type(), at.fields(), appended(bindings, at.roles()), path, bindings);
        }
        if (op instanceof Op.AnnotateIfNoRoles anr) {
            return buildAnnotated(anr.type(), null, appended(bindings, anr.roles()), path, bindings);
        }
        if (op instanceof Op.Unannotate un) {
            return buildAnnotated(un.type(), un.fields(), remaining(bindings, un.roles()), path, bindings);
        }
        throw new IllegalStateException("unhandled op: " + op);
    }

    private static ObjectNode buildObject(Op.Obj obj, String path, Bindings bindings) {
        final var out = new LinkedHashMap<String, Node>();
        for (final var field : obj.fields()) {
            out.put(field.name(), build(field.op(), path + "/" + field.name(), bindings));
        }
        if (obj.mode() == Op.Mode.PARTIAL) {
            final var restBinding = obj.restBinding(path);
            final var rest = bindings.require(restBinding);
            if (!(rest instanceof ObjectNode residual)) {
                throw new IllegalStateException("rest variable '" + restBinding + "' is bound to a " + rest.kind() + " node");
            }
            for (final var entry : residual.members().entrySet()) {
                if (out.containsKey(entry.getKey())) {
                    LOG.fine(() -> "Declared field '" + entry.getKey() + "' replaces the preserved member of the same name");
                    continue;
                }
                out.put(entry.getKey(), entry.getValue());
            }
        }
        return new ObjectNode(out);
    }

    /// `roles` is `null` when the result carries no `@role` member.
    private static ObjectNode buildAnnotated(String type, Op.MapObj fields, List<Node> roles, String path,
                                             Bindings bindings) {
        final var body = buildObject(Matcher.fieldsOrIdentity(fields).construct(), path, bindings);
        final var out = new LinkedHashMap<String, Node>();
        out.put(Uast.KEY_TYPE, Node.of(type));
        if (roles != null) {
            out.put(Uast.KEY_ROLES, new ArrayNode(roles));
        }
        body.members().forEach(out::putIfAbsent);
        return new ObjectNode(out);
    }

    /// {@return the roles the node was matched with, or `null` if it had no `@role`}
    private static List<Node> existingRoles(Bindings bindings) {
        final var roles = bindings.require(Matcher.ROLES_BINDING);
        return roles instanceof ArrayNode arr ? arr.elements() : null;
    }

    private static List<Node> appended(Bindings bindings, List<Integer> roles) {
        final var existing = existingRoles(bindings);
        if (existing == null && roles.isEmpty()) {
            return null;
        }
        final var out = existing == null ? new ArrayList<Node>() : new ArrayList<Node>(existing);
        for (final int role : roles) {
            out.add(Node.of(role));
        }
        return out;
    }

    /// An emptied `@role` is dropped once roles were removed from it; one left untouched stays.
    private static List<Node> remaining(Bindings bindings, List<Integer> removed) {
        final var existing = existingRoles(bindings);
        if (existing == null || (existing.isEmpty() && !removed.isEmpty())) {
            return null;
        }
        return existing;
    }
}
