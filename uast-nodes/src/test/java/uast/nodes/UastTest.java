package uast.nodes;

import org.junit.jupiter.api.Test;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public final class UastTest extends UastNodesLoggingConfig {

    private static final Logger LOG = Logger.getLogger(UastTest.class.getName());

    @Test
    void typeAbsentIsEmpty() {
        LOG.info(() -> "TEST: typeAbsentIsEmpty");
        assertThat(Uast.type(ObjectNode.EMPTY)).isEmpty();
        assertThat(Uast.type(Node.array())).isEmpty();
        assertThat(Uast.type(ObjectNode.builder().put(Uast.KEY_TYPE, 7).build())).isEmpty();
        assertThat(Uast.type(ObjectNode.builder().put(Uast.KEY_TYPE, "typed").build())).isEqualTo("typed");
    }

    @Test
    void rolesAbsentIsEmpty() {
        LOG.info(() -> "TEST: rolesAbsentIsEmpty");
        assertThat(Uast.roles(ObjectNode.EMPTY)).isEmpty();
        assertThat(Uast.roles(Node.of("x"))).isEmpty();
        final var node = ObjectNode.builder().put(Uast.KEY_ROLES, Uast.roleList(1, 2, 1)).build();
        assertThat(Uast.roles(node)).containsExactly(1, 2, 1);
    }

    @Test
    void rolesSkipIdsOutsideIntRange() {
        LOG.info(() -> "TEST: rolesSkipIdsOutsideIntRange");
        final var node = ObjectNode.builder()
                .put(Uast.KEY_ROLES, Node.array(Node.of(1), Node.of(1L << 32), Node.of("x"), Node.of(Integer.MIN_VALUE)))
                .build();
        assertThat(Uast.roles(node)).containsExactly(1, Integer.MIN_VALUE);
    }

    @Test
    void roleListFromCatalogue() {
        LOG.info(() -> "TEST: roleListFromCatalogue");
        assertThat(Uast.roleList(Role.IDENTIFIER, Role.INCOMPLETE))
                .isEqualTo(Uast.roleList(Role.IDENTIFIER.id(), Role.INCOMPLETE.id()));
        assertThat(Role.byId(Role.INCOMPLETE.id())).isEqualTo(Role.INCOMPLETE);
        assertThat(Role.INVALID.id()).isZero();
        assertThatThrownBy(() -> Role.byId(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Role.byId(Role.values().length)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void namespacedTypes() {
        LOG.info(() -> "TEST: namespacedTypes");
        assertThat(Uast.namespace("uast:Identifier")).isEqualTo("uast");
        assertThat(Uast.localName("uast:Identifier")).isEqualTo("Identifier");
        assertThat(Uast.namespace("Identifier")).isEmpty();
        assertThat(Uast.localName("Identifier")).isEqualTo("Identifier");
    }
}
