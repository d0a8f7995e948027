package uast.transformer;

import uast.nodes.ArrayNode;
import uast.nodes.Node;
import uast.nodes.ObjectNode;
import uast.nodes.StringNode;
import uast.nodes.Uast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Match side of the pattern algebra.
///
/// A structural mismatch, including a shape mismatch such as an object pattern offered an
/// array, is an ordinary non-match and never an exception.
final class Matcher {

    private static final Logger LOG = Logger.getLogger(Matcher.class.getName());

    /// Binding that carries the roles an annotation op found on the node; nil when the node had
    /// no `@role`.
    static final String ROLES_BINDING = Op.RESERVED_PREFIX + "roles";

    /// Rest variable of annotation ops declared without a field mapping.
    static final String REST_BINDING = Op.RESERVED_PREFIX + "rest";

    /// Field mapping that keeps every member as is.
    static final Op.MapObj IDENTITY_FIELDS = new Op.MapObj(
            new Op.Obj(List.of(), Op.Mode.PARTIAL, REST_BINDING),
            new Op.Obj(List.of(), Op.Mode.PARTIAL, REST_BINDING));

    private Matcher() {}

    /// {@return the bindings captured by matching `op` against `node`, empty on a non-match}
    static Optional<Bindings> match(Op op, Node node) {
        Objects.requireNonNull(op, "op must not be null");
        Objects.requireNonNull(node, "node must not be null");
        final var bindings = new Bindings();
        if (matchInto(op, node, "", bindings)) {
            return Optional.of(bindings);
        }
        LOG.finest(() -> "No match: " + op.getClass().getSimpleName() + " against " + node.kind());
        return Optional.empty();
    }

    /// Matches `op` found at `path`, the field names and array indices leading to it from the
    /// top of the pattern.
    static boolean matchInto(Op op, Node node, String path, Bindings bindings) {
        if (op instanceof Op.Var v) {
            return bindings.bind(v.name(), node);
        }
        if (op instanceof Op.Is is) {
            return is.value().equals(node);
        }
        if (op instanceof Op.Arr arr) {
            if (!(node instanceof ArrayNode array) || array.size() != arr.elements().size()) {
                return false;
            }
            for (int i = 0; i < array.size(); i++) {
                if (!matchInto(arr.elements().get(i), array.elements().get(i), path + "/" + i, bindings)) {
                    return false;
                }
            }
            return true;
        }
        if (op instanceof Op.Obj obj) {
            return node instanceof ObjectNode object && matchMembers(obj, object.members(), path, bindings);
        }
        if (op instanceof Op.MapObj mapObj) {
            return node instanceof ObjectNode object && matchMembers(mapObj.extract(), object.members(), path, bindings);
        }
        if (op instanceof Op.AnnotateType at) {
            return matchAnnotated(at.type(), at.fields(), node, false, path, bindings);
        }
        if (op instanceof Op.AnnotateIfNoRoles anr) {
            return matchAnnotated(anr.type(), null, node, true, path, bindings);
        }
        if (op instanceof Op.Unannotate un) {
            return matchUnannotated(un, node, path, bindings);
        }
        throw new IllegalStateException("unhandled op: " + op);
    }

    static boolean matchMembers(Op.Obj obj, Map<String, Node> members, String path, Bindings bindings) {
        if (obj.mode() == Op.Mode.EXACT && members.size() != obj.fields().size()) {
            return false;
        }
        for (final var field : obj.fields()) {
            final var value = members.get(field.name());
            if (value == null || !matchInto(field.op(), value, path + "/" + field.name(), bindings)) {
                return false;
            }
        }
        if (obj.mode() == Op.Mode.EXACT) {
            return true;
        }
        final var residual = new LinkedHashMap<String, Node>();
        for (final var entry : members.entrySet()) {
            if (obj.field(entry.getKey()) == null) {
                residual.put(entry.getKey(), entry.getValue());
            }
        }
        return bindings.bind(obj.restBinding(path), new ObjectNode(residual));
    }

    private static boolean matchAnnotated(String type, Op.MapObj fields, Node node, boolean requireNoRoles,
                                          String path, Bindings bindings) {
        if (!(node instanceof ObjectNode object) || !hasType(object, type)) {
            return false;
        }
        final var roles = object.members().get(Uast.KEY_ROLES);
        if (roles != null && !(roles instanceof ArrayNode)) {
            return false;
        }
        if (requireNoRoles && roles != null && !((ArrayNode) roles).isEmpty()) {
            return false;
        }
        return bindings.bind(ROLES_BINDING, roles == null ? Node.nil() : roles)
                && matchMembers(fieldsOrIdentity(fields).extract(), withoutReserved(object), path, bindings);
    }

    private static boolean matchUnannotated(Op.Unannotate un, Node node, String path, Bindings bindings) {
        if (!(node instanceof ObjectNode object) || !hasType(object, un.type())) {
            return false;
        }
        final var roles = object.members().get(Uast.KEY_ROLES);
        final Node remainder;
        if (roles == null) {
            if (!un.roles().isEmpty()) {
                return false;
            }
            remainder = Node.nil();
        } else if (roles instanceof ArrayNode arr) {
            final var remaining = new ArrayList<>(arr.elements());
            for (final int role : un.roles()) {
                if (!remaining.remove(Node.of(role))) {
                    return false;
                }
            }
            remainder = new ArrayNode(remaining);
        } else {
            return false;
        }
        return bindings.bind(ROLES_BINDING, remainder)
                && matchMembers(fieldsOrIdentity(un.fields()).extract(), withoutReserved(object), path, bindings);
    }

    static Op.MapObj fieldsOrIdentity(Op.MapObj fields) {
        return fields == null ? IDENTITY_FIELDS : fields;
    }

    private static boolean hasType(ObjectNode object, String type) {
        return object.members().get(Uast.KEY_TYPE) instanceof StringNode s && s.value().equals(type);
    }

    private static Map<String, Node> withoutReserved(ObjectNode object) {
        final var out = new LinkedHashMap<>(object.members());
        out.remove(Uast.KEY_TYPE);
        out.remove(Uast.KEY_ROLES);
        return out;
    }
}
