package uast.transformer;

import uast.nodes.Node;

import java.util.List;
import java.util.Objects;

/// Composition of transformers.
public final class Transformers {

    private Transformers() {}

    /// {@return a transformer applying `steps` one after the other, in the given order}
    public static Transformer sequence(List<? extends Transformer> steps) {
        Objects.requireNonNull(steps, "steps must not be null");
        final List<Transformer> copy = List.copyOf(steps);
        return root -> {
            Node current = Objects.requireNonNull(root, "root must not be null");
            for (final var step : copy) {
                current = step.apply(current);
            }
            return current;
        };
    }

    public static Transformer sequence(Transformer... steps) {
        return sequence(List.of(steps));
    }
}
