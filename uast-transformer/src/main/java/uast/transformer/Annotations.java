package uast.transformer;

import uast.nodes.Role;

import java.util.ArrayList;
import java.util.List;

/// Mapping factories that attach roles to nodes of a given `@type`.
///
/// The roles are appended to the node's existing `@role`; duplicates are left for
/// {@link RolesDedup}. The reverse direction removes them again.
public final class Annotations {

    private Annotations() {}

    /// {@return a mapping that appends `roles` to objects of `type`, rewriting their members with
    /// `fields` when it is not `null`}
    public static Mapping annotateType(String type, Op.MapObj fields, int... roles) {
        return Mapping.rewrite(new Op.AnnotateType(type, fields, toList(roles)));
    }

    public static Mapping annotateType(String type, Op.MapObj fields, Role... roles) {
        return annotateType(type, fields, toIds(roles));
    }

    /// {@return a mapping that assigns `roles` to objects of `type` that carry no roles yet}
    ///
    /// Once a node has a role the mapping no longer matches it, so reapplying is a no-op.
    public static Mapping annotateIfNoRoles(String type, int... roles) {
        return Mapping.rewrite(new Op.AnnotateIfNoRoles(type, toList(roles)));
    }

    public static Mapping annotateIfNoRoles(String type, Role... roles) {
        return annotateIfNoRoles(type, toIds(roles));
    }

    private static List<Integer> toList(int... roles) {
        final var out = new ArrayList<Integer>(roles.length);
        for (final int role : roles) {
            out.add(role);
        }
        return out;
    }

    private static int[] toIds(Role... roles) {
        final var out = new int[roles.length];
        for (int i = 0; i < roles.length; i++) {
            out[i] = roles[i].id();
        }
        return out;
    }
}
