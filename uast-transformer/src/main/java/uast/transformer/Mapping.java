package uast.transformer;

import java.util.LinkedHashSet;
import java.util.Objects;

/// A bidirectional rewrite rule.
///
/// `forward` normalizes a native node into its canonical shape, `reverse` turns the canonical
/// shape back into the native one. Both directions are validated when the mapping is created:
/// a build pattern may only reference variables its match pattern binds.
///
/// ## Example Usage
/// ```java
/// // rename "pred" to "p", keeping every other member
/// Mapping rename = Mapping.map(
///     Op.part(Op.field("pred", Op.var("x"))),
///     Op.part(Op.field("p", Op.var("x"))));
/// ```
public record Mapping(String name, Rule forward, Rule reverse) {

    /// One direction of a mapping.
    public record Rule(Op match, Op build) {
        public Rule {
            Objects.requireNonNull(match, "match must not be null");
            Objects.requireNonNull(build, "build must not be null");
        }
    }

    public Mapping {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(forward, "forward must not be null");
        Objects.requireNonNull(reverse, "reverse must not be null");
        validate(name, "forward", forward);
        validate(name, "reverse", reverse);
    }

    /// {@return a mapping rewriting `src` into `dst`, and `dst` back into `src`}
    public static Mapping map(Op src, Op dst) {
        return new Mapping(describe(src) + " -> " + describe(dst), new Rule(src, dst), new Rule(dst, src));
    }

    /// {@return a mapping for a self-contained rewrite op such as a field mapping or an annotation}
    public static Mapping rewrite(Op op) {
        final var inverse = Patterns.inverse(op);
        return new Mapping(describe(op), new Rule(op, op), new Rule(inverse, inverse));
    }

    public static Mapping of(String name, Op forwardMatch, Op forwardBuild, Op reverseMatch, Op reverseBuild) {
        return new Mapping(name, new Rule(forwardMatch, forwardBuild), new Rule(reverseMatch, reverseBuild));
    }

    /// {@return this mapping under another name, for diagnostics}
    public Mapping named(String newName) {
        return new Mapping(newName, forward, reverse);
    }

    public Rule rule(boolean forwardDirection) {
        return forwardDirection ? forward : reverse;
    }

    private static void validate(String name, String direction, Rule rule) {
        final var unbound = new LinkedHashSet<>(Patterns.referencedVars(rule.build()));
        unbound.removeAll(Patterns.boundVars(rule.match()));
        if (!unbound.isEmpty()) {
            throw new InvalidMappingException("mapping '" + name + "' (" + direction
                    + "): build references variables not bound by match: " + unbound);
        }
    }

    private static String describe(Op op) {
        return Patterns.requiredType(op)
                .map(type -> op.getClass().getSimpleName() + "(" + type + ")")
                .orElseGet(() -> op.getClass().getSimpleName());
    }
}
