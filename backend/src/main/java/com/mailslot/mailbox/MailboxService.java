package com.mailslot.mailbox;

import java.util.List;

import org.springframework.stereotype.Service;

import com.mailslot.web.InvalidRequestException;

import reactor.core.publisher.Mono;

/**
 * Request-facing side of the mailbox.
 *
 * <p><strong>Validation boundary:</strong> every input check happens here, before the
 * {@link MailboxStore} is touched. A rejected request returns an {@link InvalidRequestException}
 * and leaves the store exactly as it was.
 */
@Service
public class MailboxService {

    static final List<String> ENDPOINTS = List.of("POST /send", "GET /recv");

    private final MailboxStore store;

    public MailboxService(MailboxStore store) {
        this.store = store;
    }

    public Mono<SendReceipt> send(SendRequest request) {
        SendRequest fields = request != null ? request : new SendRequest(null, null);
        return Mono.fromCallable(() -> {
            String recipient = requireText(fields.recipient(),
                    "Invalid recipient", "Recipient is required and must be a string");
            String content = requireText(fields.message(),
                    "Invalid message", "Message is required and must be a string");

            Message message = store.send(recipient, content);
            return new SendReceipt(message.id(), message.recipient(), message.timestamp());
        });
    }

    /**
     * Drains the recipient's mailbox.
     *
     * A missing or empty parameter and a whitespace-only one are rejected with different
     * messages; any other value is normalized and drained, even if nothing was ever sent to it.
     */
    public Mono<InboxDelivery> receive(String recipient) {
        return Mono.fromCallable(() -> {
            if (recipient == null || recipient.isEmpty()) {
                throw new InvalidRequestException("Invalid recipient", "Recipient parameter is required");
            }
            if (recipient.isBlank()) {
                throw new InvalidRequestException("Invalid recipient", "Recipient parameter cannot be empty");
            }
            return toInbox(store.receive(recipient));
        });
    }

    public Mono<HealthStatus> health() {
        return Mono.fromSupplier(() -> new HealthStatus(
                "healthy",
                "Message server is running",
                ENDPOINTS,
                store.stats().totalRecipients()));
    }

    private static String requireText(Object value, String error, String message) {
        if (!(value instanceof String)) {
            throw new InvalidRequestException(error, message);
        }
        String text = (String) value;
        if (text.isBlank()) {
            throw new InvalidRequestException(error, message);
        }
        return text;
    }

    private InboxDelivery toInbox(Delivery delivery) {
        List<DeliveredMessage> messages = delivery.messages().stream()
                .map(m -> new DeliveredMessage(m.id(), m.content(), m.timestamp()))
                .toList();
        return new InboxDelivery(delivery.recipient(), messages, delivery.count());
    }
}
