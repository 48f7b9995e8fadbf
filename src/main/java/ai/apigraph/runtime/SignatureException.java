package ai.apigraph.runtime;

/**
 * A callable's parameter list cannot be determined.
 */
public class SignatureException extends ReflectionException {

    public SignatureException(String message) {
        super(message);
    }
}
