package uast.transformer;

import uast.nodes.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// A complete normalization: envelope trimming, an ordered list of {@link Stage}s and a final
/// {@link RolesDedup} pass.
///
/// Stage `k + 1` sees the output of stage `k`, so later stages may rely on shapes produced by
/// earlier ones. A pipeline is immutable once built and may be run concurrently on different
/// trees.
///
/// ## Example Usage
/// ```java
/// Pipeline pipeline = Pipeline.builder()
///     .topLevelIsRootNode(false)
///     .stage(Stage.of("native", Annotations.annotateType("internal-type", null, Role.INCOMPLETE)))
///     .build();
/// Node canonical = pipeline.run(nativeTree);
/// ```
public final class Pipeline implements ReversibleTransformer {

    private static final Logger LOG = Logger.getLogger(Pipeline.class.getName());

    private final ResponseMetadata envelope;
    private final List<Stage> stages;
    private final boolean dedupRoles;
    private final Transformer normalizer;

    private Pipeline(Builder builder) {
        this.envelope = new ResponseMetadata(builder.topLevelIsRootNode, builder.rootKey);
        this.stages = List.copyOf(builder.stages);
        this.dedupRoles = builder.dedupRoles;
        final var steps = new ArrayList<Transformer>(stages.size() + 2);
        steps.add(envelope);
        steps.addAll(stages);
        if (dedupRoles) {
            steps.add(RolesDedup.rolesDedup());
        }
        this.normalizer = Transformers.sequence(steps);
        LOG.config(() -> "Pipeline assembled: " + this);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// {@return the canonical tree for `tree`}
    public static Node run(Node tree, Pipeline pipeline) {
        Objects.requireNonNull(pipeline, "pipeline must not be null");
        return pipeline.run(tree);
    }

    /// {@return the canonical tree for `tree`}
    /// @throws MalformedEnvelopeException if an envelope is expected and `tree` is not one
    public Node run(Node tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        return normalizer.apply(tree);
    }

    @Override
    public Node apply(Node root) {
        return run(root);
    }

    /// {@return the native tree for a canonical `tree`: the stages' reverse directions in
    /// reverse stage order, then the envelope restored}
    @Override
    public Node reverse(Node tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        Node current = tree;
        for (int i = stages.size() - 1; i >= 0; i--) {
            current = stages.get(i).reverse(current);
        }
        return envelope.reverse(current);
    }

    public List<Stage> stages() {
        return stages;
    }

    public ResponseMetadata envelope() {
        return envelope;
    }

    @Override
    public String toString() {
        return "Pipeline[envelope=" + envelope + ", stages=" + stages + ", dedupRoles=" + dedupRoles + "]";
    }

    public static final class Builder {
        private boolean topLevelIsRootNode = true;
        private String rootKey = ResponseMetadata.DEFAULT_ROOT_KEY;
        private final List<Stage> stages = new ArrayList<>();
        private boolean dedupRoles = true;

        private Builder() {}

        /// Whether the tree handed to {@link #run} is the root node itself (`true`, the default)
        /// or a single-key wrapper object around it.
        public Builder topLevelIsRootNode(boolean value) {
            this.topLevelIsRootNode = value;
            return this;
        }

        /// The wrapper key restored by {@link #reverse}.
        public Builder rootKey(String value) {
            this.rootKey = Objects.requireNonNull(value, "rootKey must not be null");
            return this;
        }

        public Builder stage(Stage stage) {
            stages.add(Objects.requireNonNull(stage, "stage must not be null"));
            return this;
        }

        /// Appends a stage holding `mappings`, named after its position.
        public Builder stage(Mapping... mappings) {
            return stage(Stage.of("stage-" + stages.size(), mappings));
        }

        public Builder dedupRoles(boolean value) {
            this.dedupRoles = value;
            return this;
        }

        public Pipeline build() {
            return new Pipeline(this);
        }
    }
}
