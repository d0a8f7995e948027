package uast.transformer;

/// Base exception for failures assembling or running a transformation.
public class TransformException extends RuntimeException {

    public TransformException(String message) {
        super(message);
    }
}
