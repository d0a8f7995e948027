package uast.transformer;

/// Thrown while assembling patterns, mappings, stages or pipelines that can never be applied
/// safely, before any tree is processed.
public final class InvalidMappingException extends TransformException {

    public InvalidMappingException(String message) {
        super(message);
    }
}
