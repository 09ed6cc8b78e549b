package lab.reconciler.support;

import lab.reconciler.webhook.WebhookTransport;
import lab.reconciler.webhook.WebhookTransportException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Captures callbacks instead of sending them. Every post answers 200 unless a status was
 * queued with {@link #respondWith}; a queued {@code -1} simulates a connection failure.
 */
public class RecordingWebhookTransport implements WebhookTransport {

    public record Call(String url, String payload, String signature) {}

    private final List<Call> calls = new ArrayList<>();
    private final Deque<Integer> scripted = new ArrayDeque<>();

    @Override
    public synchronized int post(String url, String payload, String signature) {
        calls.add(new Call(url, payload, signature));
        Integer status = scripted.poll();
        if (status == null) {
            return 200;
        }
        if (status < 0) {
            throw new WebhookTransportException("connect timed out", null);
        }
        return status;
    }

    public synchronized void respondWith(Integer... statuses) {
        scripted.addAll(List.of(statuses));
    }

    public synchronized List<Call> callsTo(String url) {
        return calls.stream().filter(call -> call.url().equals(url)).toList();
    }
}
