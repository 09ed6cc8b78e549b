package lab.reconciler.common;

/**
 * Request signature, timestamp window or second factor did not check out.
 */
public class SignatureVerificationException extends RuntimeException {
    public SignatureVerificationException(String message) {
        super(message);
    }
}
