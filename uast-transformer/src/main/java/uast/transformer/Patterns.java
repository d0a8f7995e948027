package uast.transformer;

import uast.nodes.StringNode;
import uast.nodes.Uast;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/// Static analysis of patterns, used when mappings are assembled.
public final class Patterns {

    private Patterns() {}

    /// {@return the variables `op` binds when used as a match pattern}
    ///
    /// A nested default rest variable is reported under its positional binding name, see
    /// {@link Op#DEFAULT_REST}.
    public static Set<String> boundVars(Op op) {
        final var out = new LinkedHashSet<String>();
        collect(op, true, "", out);
        return out;
    }

    /// {@return the variables `op` reads when used as a build pattern}
    public static Set<String> referencedVars(Op op) {
        final var out = new LinkedHashSet<String>();
        collect(op, false, "", out);
        return out;
    }

    private static void collect(Op op, boolean matchSide, String path, Set<String> out) {
        if (op instanceof Op.Var v) {
            out.add(v.name());
        } else if (op instanceof Op.Is) {
            // constants bind nothing
        } else if (op instanceof Op.Arr arr) {
            for (int i = 0; i < arr.elements().size(); i++) {
                collect(arr.elements().get(i), matchSide, path + "/" + i, out);
            }
        } else if (op instanceof Op.Obj obj) {
            obj.fields().forEach(f -> collect(f.op(), matchSide, path + "/" + f.name(), out));
            if (obj.mode() == Op.Mode.PARTIAL) {
                out.add(obj.restBinding(path));
            }
        } else if (op instanceof Op.MapObj mapObj) {
            collect(matchSide ? mapObj.extract() : mapObj.construct(), matchSide, path, out);
        } else if (op instanceof Op.AnnotateType at) {
            collectAnnotated(at.fields(), matchSide, path, out);
        } else if (op instanceof Op.AnnotateIfNoRoles) {
            collectAnnotated(null, matchSide, path, out);
        } else if (op instanceof Op.Unannotate un) {
            collectAnnotated(un.fields(), matchSide, path, out);
        } else {
            throw new IllegalStateException("unhandled op: " + op);
        }
    }

    private static void collectAnnotated(Op.MapObj fields, boolean matchSide, String path, Set<String> out) {
        out.add(Matcher.ROLES_BINDING);
        collect(Matcher.fieldsOrIdentity(fields), matchSide, path, out);
    }

    /// {@return the op that undoes `op`}
    ///
    /// Rewrite ops (field mappings and annotations) invert into their reverse form. Plain
    /// structural patterns are their own inverse.
    public static Op inverse(Op op) {
        if (op instanceof Op.MapObj mapObj) {
            return mapObj.inverse();
        }
        if (op instanceof Op.AnnotateType at) {
            return new Op.Unannotate(at.type(), inverseOrNull(at.fields()), at.roles());
        }
        if (op instanceof Op.AnnotateIfNoRoles anr) {
            return new Op.Unannotate(anr.type(), null, anr.roles());
        }
        if (op instanceof Op.Unannotate un) {
            return new Op.AnnotateType(un.type(), inverseOrNull(un.fields()), un.roles());
        }
        return op;
    }

    private static Op.MapObj inverseOrNull(Op.MapObj fields) {
        return fields == null ? null : fields.inverse();
    }

    /// {@return the `@type` a node must have for `op` to match it, if `op` pins one}
    public static Optional<String> requiredType(Op op) {
        if (op instanceof Op.AnnotateType at) {
            return Optional.of(at.type());
        }
        if (op instanceof Op.AnnotateIfNoRoles anr) {
            return Optional.of(anr.type());
        }
        if (op instanceof Op.Unannotate un) {
            return Optional.of(un.type());
        }
        if (op instanceof Op.MapObj mapObj) {
            return requiredType(mapObj.extract());
        }
        if (op instanceof Op.Obj obj && obj.field(Uast.KEY_TYPE) instanceof Op.Is is
                && is.value() instanceof StringNode s) {
            return Optional.of(s.value());
        }
        return Optional.empty();
    }
}
