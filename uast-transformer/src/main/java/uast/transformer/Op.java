package uast.transformer;

import uast.nodes.Node;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A pattern over {@link Node}s.
///
/// The same `Op` value is used on both sides of a {@link Mapping}: on the match side it checks a
/// node and captures variables into {@link Bindings}; on the build side it constructs a node from
/// those bindings. Matching is implemented once in {@link Matcher}, construction in {@link NodeBuilder}.
public sealed interface Op
        permits Op.Var, Op.Is, Op.Arr, Op.Obj, Op.MapObj, Op.AnnotateType, Op.AnnotateIfNoRoles, Op.Unannotate {

    /// Prefix reserved for bindings the engine creates itself.
    String RESERVED_PREFIX = "#";

    /// Rest variable used by {@link #part(Field...)} and {@link #mapObj(Map, Map)}.
    ///
    /// Unlike other variable names it is scoped by position: a nested partial pattern using it
    /// binds under the path of field names and array indices leading to it, so an outer and an
    /// inner `Part` keep their residual members apart. A build pattern restores it from the same
    /// position. Any other rest name is a plain variable shared across the whole pattern.
    String DEFAULT_REST = "_";

    /// Captures the matched node; a repeated name must match a structurally equal node.
    record Var(String name) implements Op {
        public Var {
            Objects.requireNonNull(name, "name must not be null");
            if (name.isBlank()) {
                throw new InvalidMappingException("variable name must not be blank");
            }
            if (name.startsWith(RESERVED_PREFIX)) {
                throw new InvalidMappingException("variable name '" + name + "' uses the reserved prefix '" + RESERVED_PREFIX + "'");
            }
        }
    }

    /// A constant: matches an equal node, builds that node.
    record Is(Node value) implements Op {
        public Is {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /// An array of exactly `elements.size()` elements, matched position by position.
    record Arr(List<Op> elements) implements Op {
        public Arr {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = List.copyOf(elements);
        }
    }

    /// One declared member of an {@link Obj} pattern.
    record Field(String name, Op op) {
        public Field {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(op, () -> "op of field '" + name + "' must not be null");
        }
    }

    enum Mode { EXACT, PARTIAL }

    /// An object pattern.
    ///
    /// In {@link Mode#EXACT} mode the node must have exactly the declared keys. In
    /// {@link Mode#PARTIAL} mode every declared key must be present; the undeclared members are
    /// captured as an object under `rest` and written back unchanged when the pattern builds.
    record Obj(List<Field> fields, Mode mode, String rest) implements Op {
        public Obj {
            Objects.requireNonNull(fields, "fields must not be null");
            Objects.requireNonNull(mode, "mode must not be null");
            fields = List.copyOf(fields);
            final var seen = new HashSet<String>();
            for (final var field : fields) {
                if (!seen.add(field.name())) {
                    throw new InvalidMappingException("duplicate field '" + field.name() + "' in object pattern");
                }
            }
            if (mode == Mode.PARTIAL) {
                Objects.requireNonNull(rest, "partial object pattern needs a rest variable");
                if (rest.isBlank()) {
                    throw new InvalidMappingException("rest variable name must not be blank");
                }
            } else if (rest != null) {
                throw new InvalidMappingException("exact object pattern cannot declare a rest variable");
            }
        }

        /// {@return the op declared for `name`, or `null`}
        public Op field(String name) {
            for (final var field : fields) {
                if (field.name().equals(name)) {
                    return field.op();
                }
            }
            return null;
        }

        /// {@return the binding that holds the residual members of this pattern when it sits at
        /// `path` inside the enclosing pattern}
        public String restBinding(String path) {
            if (rest == null || path.isEmpty() || !rest.equals(DEFAULT_REST)) {
                return rest;
            }
            return RESERVED_PREFIX + rest + path;
        }
    }

    /// Matches `extract` to populate bindings, then builds `construct` from them.
    record MapObj(Obj extract, Obj construct) implements Op {
        public MapObj {
            Objects.requireNonNull(extract, "extract must not be null");
            Objects.requireNonNull(construct, "construct must not be null");
        }

        public MapObj inverse() {
            return new MapObj(construct, extract);
        }
    }

    /// Matches objects of the given `@type`, appends `roles` to `@role` and rewrites the
    /// remaining members with `fields` when given.
    record AnnotateType(String type, MapObj fields, List<Integer> roles) implements Op {
        public AnnotateType {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(roles, "roles must not be null");
            roles = List.copyOf(roles);
        }
    }

    /// As {@link AnnotateType}, but only matches while the node has no roles yet.
    record AnnotateIfNoRoles(String type, List<Integer> roles) implements Op {
        public AnnotateIfNoRoles {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(roles, "roles must not be null");
            roles = List.copyOf(roles);
        }
    }

    /// The reverse of the annotation ops: matches objects of `type` carrying all of `roles`,
    /// removes one occurrence of each and rewrites the remaining members with `fields`.
    record Unannotate(String type, MapObj fields, List<Integer> roles) implements Op {
        public Unannotate {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(roles, "roles must not be null");
            roles = List.copyOf(roles);
        }
    }

    static Var var(String name) {
        return new Var(name);
    }

    static Is is(Node value) {
        return new Is(value);
    }

    static Is is(String value) {
        return new Is(Node.of(value));
    }

    static Arr arr(Op... elements) {
        return new Arr(Arrays.asList(elements));
    }

    static Field field(String name, Op op) {
        return new Field(name, op);
    }

    /// {@return an exact object pattern}
    static Obj obj(Field... fields) {
        return new Obj(Arrays.asList(fields), Mode.EXACT, null);
    }

    static Obj obj(Map<String, ? extends Op> fields) {
        return new Obj(toFields(fields), Mode.EXACT, null);
    }

    /// {@return a partial object pattern keeping undeclared members under {@link #DEFAULT_REST}}
    static Obj part(Field... fields) {
        return part(DEFAULT_REST, fields);
    }

    static Obj part(String rest, Field... fields) {
        return new Obj(Arrays.asList(fields), Mode.PARTIAL, rest);
    }

    static Obj part(String rest, Map<String, ? extends Op> fields) {
        return new Obj(toFields(fields), Mode.PARTIAL, rest);
    }

    /// {@return a field mapping from the `extract` members to the `construct` members,
    /// keeping every other member}
    static MapObj mapObj(Map<String, ? extends Op> extract, Map<String, ? extends Op> construct) {
        return new MapObj(part(DEFAULT_REST, extract), part(DEFAULT_REST, construct));
    }

    private static List<Field> toFields(Map<String, ? extends Op> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        final var out = new ArrayList<Field>(fields.size());
        fields.forEach((name, op) -> out.add(new Field(name, op)));
        return out;
    }
}
