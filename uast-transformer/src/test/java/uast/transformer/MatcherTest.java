package uast.transformer;

import org.junit.jupiter.api.Test;
import uast.nodes.ArrayNode;
import uast.nodes.Node;
import uast.nodes.ObjectNode;
import uast.nodes.Uast;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static uast.transformer.Op.arr;
import static uast.transformer.Op.field;
import static uast.transformer.Op.is;
import static uast.transformer.Op.obj;
import static uast.transformer.Op.part;
import static uast.transformer.Op.var;

public final class MatcherTest extends TransformerTestBase {

    @Test
    void varBindsAnything() {
        final var bindings = Matcher.match(var("x"), Node.array(Node.of(1))).orElseThrow();
        assertThat(bindings.get("x")).contains(Node.array(Node.of(1)));
    }

    @Test
    void repeatedVarRequiresEqualSubtree() {
        final var pattern = arr(var("x"), var("x"));
        assertThat(Matcher.match(pattern, Node.array(Node.of("a"), Node.of("a")))).isPresent();
        assertThat(Matcher.match(pattern, Node.array(Node.of("a"), Node.of("b")))).isEmpty();
    }

    @Test
    void repeatedVarComparesStructurally() {
        final var pattern = arr(var("x"), var("x"));
        final var first = ObjectNode.builder().put("a", 1).put("b", 2).build();
        final var second = ObjectNode.builder().put("b", 2).put("a", 1).build();
        assertThat(Matcher.match(pattern, Node.array(first, second))).isPresent();
    }

    @Test
    void conflictDeepInsideObjectAbortsWholeMatch() {
        final var pattern = obj(field("a", var("x")), field("b", obj(field("c", var("x")))));
        final var node = ObjectNode.builder()
                .put("a", 1)
                .put("b", ObjectNode.builder().put("c", 2).build())
                .build();
        assertThat(Matcher.match(pattern, node)).isEmpty();
    }

    @Test
    void isMatchesEqualConstantOnly() {
        assertThat(Matcher.match(is("a"), Node.of("a"))).isPresent();
        assertThat(Matcher.match(is("a"), Node.of("b"))).isEmpty();
        assertThat(Matcher.match(Op.is(Node.of(1)), Node.of(1.0))).isEmpty();
    }

    @Test
    void arrRequiresSameLength() {
        assertThat(Matcher.match(arr(var("x")), Node.array(Node.of(1), Node.of(2)))).isEmpty();
        assertThat(Matcher.match(arr(), Node.array())).isPresent();
    }

    @Test
    void exactObjectRequiresExactKeySet() {
        final var pattern = obj(field("k", var("x")));
        assertThat(Matcher.match(pattern, ObjectNode.builder().put("k", "v").build())).isPresent();
        assertThat(Matcher.match(pattern, ObjectNode.builder().put("k", "v").put("extra", 1).build())).isEmpty();
        assertThat(Matcher.match(pattern, ObjectNode.builder().put("other", "v").build())).isEmpty();
    }

    @Test
    void partialObjectCapturesResidualMembers() {
        final var pattern = part(field("k", var("x")));
        final var bindings = Matcher.match(pattern, ObjectNode.builder()
                .put("k", "v")
                .put("extra", 1)
                .put(Uast.KEY_TYPE, "typed")
                .build()).orElseThrow();

        assertThat(bindings.get("x")).contains(Node.of("v"));
        assertThat(bindings.get(Op.DEFAULT_REST)).contains(ObjectNode.builder()
                .put("extra", 1)
                .put(Uast.KEY_TYPE, "typed")
                .build());
    }

    @Test
    void nestedPartialPatternsKeepTheirOwnResidualMembers() {
        final var pattern = part(field("body", part(field("pred", var("x")))));
        final var node = ObjectNode.builder()
                .put("a", 1)
                .put("body", ObjectNode.builder().put("pred", "v").put("z", 2).build())
                .build();

        final var bindings = Matcher.match(pattern, node).orElseThrow();
        assertThat(bindings.get("x")).contains(Node.of("v"));
        assertThat(bindings.get(Op.DEFAULT_REST)).contains(ObjectNode.builder().put("a", 1).build());
        assertThat(bindings.get("#_/body")).contains(ObjectNode.builder().put("z", 2).build());
    }

    @Test
    void partialPatternsInsideArrayKeepTheirOwnResidualMembers() {
        final var pattern = arr(part(field("k", var("x"))), part(field("k", var("y"))));
        final var node = Node.array(
                ObjectNode.builder().put("k", 1).put("a", true).build(),
                ObjectNode.builder().put("k", 2).put("b", false).build());
        assertThat(Matcher.match(pattern, node)).isPresent();
    }

    @Test
    void namedRestIsSharedAcrossPattern() {
        final var pattern = part("r", field("body", part("r", field("k", var("x")))));
        final var same = ObjectNode.builder()
                .put("z", 2)
                .put("body", ObjectNode.builder().put("k", 1).put("z", 2).build())
                .build();
        final var different = ObjectNode.builder()
                .put("a", 1)
                .put("body", ObjectNode.builder().put("k", 1).put("z", 2).build())
                .build();
        assertThat(Matcher.match(pattern, same)).isPresent();
        assertThat(Matcher.match(pattern, different)).isEmpty();
    }

    @Test
    void partialObjectRequiresDeclaredKeys() {
        assertThat(Matcher.match(part(field("k", var("x"))), ObjectNode.builder().put("extra", 1).build())).isEmpty();
    }

    @Test
    void shapeMismatchIsSilentNonMatch() {
        assertThat(Matcher.match(obj(field("k", var("x"))), Node.array(Node.of("k")))).isEmpty();
        assertThat(Matcher.match(part(), Node.of("scalar"))).isEmpty();
        assertThat(Matcher.match(arr(var("x")), ObjectNode.builder().put("0", 1).build())).isEmpty();
        assertThat(Matcher.match(Op.mapObj(Map.of(), Map.of()), Node.nil())).isEmpty();
    }

    @Test
    void mapObjMatchesExtractSide() {
        final var mapObj = Op.mapObj(Map.of("k", var("x")), Map.of("key", var("x")));
        assertThat(Matcher.match(mapObj, ObjectNode.builder().put("k", "v").put("z", 0).build())).isPresent();
        assertThat(Matcher.match(mapObj, ObjectNode.builder().put("key", "v").build())).isEmpty();
    }

    @Test
    void annotateTypeChecksType() {
        final var op = new Op.AnnotateType("typed", null, List.of(10));
        assertThat(Matcher.match(op, ObjectNode.builder().put(Uast.KEY_TYPE, "typed").build())).isPresent();
        assertThat(Matcher.match(op, ObjectNode.builder().put(Uast.KEY_TYPE, "other").build())).isEmpty();
        assertThat(Matcher.match(op, ObjectNode.builder().put("pred", "typed").build())).isEmpty();
        assertThat(Matcher.match(op, Node.of("typed"))).isEmpty();
    }

    @Test
    void annotateTypeRejectsMalformedRoles() {
        final var op = new Op.AnnotateType("typed", null, List.of(10));
        final var node = ObjectNode.builder().put(Uast.KEY_TYPE, "typed").put(Uast.KEY_ROLES, "not-a-list").build();
        assertThat(Matcher.match(op, node)).isEmpty();
    }

    @Test
    void annotateTypeAppliesFieldPatternToNonReservedMembers() {
        final var op = new Op.AnnotateType("typed", Op.mapObj(Map.of("k", var("x")), Map.of("key", var("x"))), List.of(10));
        assertThat(Matcher.match(op, ObjectNode.builder().put(Uast.KEY_TYPE, "typed").put("k", 1).build())).isPresent();
        assertThat(Matcher.match(op, ObjectNode.builder().put(Uast.KEY_TYPE, "typed").build())).isEmpty();
    }

    @Test
    void annotateIfNoRolesRequiresEmptyRoles() {
        final var op = new Op.AnnotateIfNoRoles("typed", List.of(10));
        final var typed = ObjectNode.builder().put(Uast.KEY_TYPE, "typed").build();
        assertThat(Matcher.match(op, typed)).isPresent();
        assertThat(Matcher.match(op, typed.with(Uast.KEY_ROLES, ArrayNode.EMPTY))).isPresent();
        assertThat(Matcher.match(op, typed.with(Uast.KEY_ROLES, Uast.roleList(1)))).isEmpty();
    }

    @Test
    void unannotateRequiresEveryRole() {
        final var op = new Op.Unannotate("typed", null, List.of(10, 10));
        final var typed = ObjectNode.builder().put(Uast.KEY_TYPE, "typed").build();
        assertThat(Matcher.match(op, typed.with(Uast.KEY_ROLES, Uast.roleList(10)))).isEmpty();
        final var bindings = Matcher.match(op, typed.with(Uast.KEY_ROLES, Uast.roleList(10, 3, 10))).orElseThrow();
        assertThat(bindings.get(Matcher.ROLES_BINDING)).contains(Uast.roleList(3));
    }
}
