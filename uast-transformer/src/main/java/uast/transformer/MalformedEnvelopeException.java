package uast.transformer;

/// Thrown when the top of a tree is not the single-key wrapper object the pipeline was
/// configured to expect.
public final class MalformedEnvelopeException extends TransformException {

    public MalformedEnvelopeException(String message) {
        super(message);
    }
}
