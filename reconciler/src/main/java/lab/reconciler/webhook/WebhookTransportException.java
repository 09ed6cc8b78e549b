package lab.reconciler.webhook;

public class WebhookTransportException extends RuntimeException {
    public WebhookTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
