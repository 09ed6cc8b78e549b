package lab.reconciler.webhook;

/**
 * Outbound HTTP for callbacks. Returns the response status; throws
 * {@link WebhookTransportException} when no response was received.
 */
public interface WebhookTransport {

    int post(String url, String payload, String signature);
}
