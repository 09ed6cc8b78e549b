package lab.reconciler.webhook;

import lab.reconciler.config.ReconcilerProperties;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
public class RestClientWebhookTransport implements WebhookTransport {

    public static final String SIGNATURE_HEADER = "X-Signature";

    private final RestClient restClient;

    public RestClientWebhookTransport(RestClient.Builder builder, ReconcilerProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getWebhook().getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getWebhook().getReadTimeout().toMillis());
        this.restClient = builder.requestFactory(requestFactory).build();
    }

    @Override
    public int post(String url, String payload, String signature) {
        try {
            return restClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(SIGNATURE_HEADER, signature)
                    .body(payload)
                    .exchange((request, response) -> response.getStatusCode().value());
        } catch (RestClientException e) {
            throw new WebhookTransportException("callback to " + url + " failed: " + e.getMessage(), e);
        }
    }
}
