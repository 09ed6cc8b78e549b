package lab.reconciler.api;

import lab.reconciler.domain.webhook.WebhookDelivery;

import java.time.Instant;
import java.util.UUID;

public record WebhookDeliveryResponse(
        UUID id,
        UUID orderId,
        String eventStatus,
        String outcome,
        int attemptCount,
        int resendCount,
        Instant nextAttemptAt,
        Integer lastResponseStatus,
        String lastError
) {

    static WebhookDeliveryResponse from(WebhookDelivery delivery) {
        return new WebhookDeliveryResponse(
                delivery.getId(),
                delivery.getOrderId(),
                delivery.getEventStatus().name(),
                delivery.getOutcome().name(),
                delivery.getAttemptCount(),
                delivery.getResendCount(),
                delivery.getNextAttemptAt(),
                delivery.getLastResponseStatus(),
                delivery.getLastError()
        );
    }
}
