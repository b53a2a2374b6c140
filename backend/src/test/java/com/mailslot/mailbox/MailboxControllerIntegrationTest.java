package com.mailslot.mailbox;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import reactor.core.publisher.Flux;

/**
 * HTTP-layer integration tests for MailboxController.
 *
 * Runs against a real embedded Netty server with the real MailboxStore bean;
 * the store is cleared before each test.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class MailboxControllerIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private MailboxStore store;

    @BeforeEach
    void setup() {
        store.clear();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private void send(String recipient, String message) {
        webTestClient.post()
                .uri("/send")
                .bodyValue(Map.of("recipient", recipient, "message", message))
                .exchange()
                .expectStatus().isCreated();
    }

    private WebTestClient.ResponseSpec recv(String recipient) {
        return webTestClient.get()
                .uri(uri -> uri.path("/recv").queryParam("recipient", recipient).build())
                .exchange();
    }

    // ── POST /send ────────────────────────────────────────────────────────────

    @Test
    void send_shouldReturn201WithReceipt() {
        webTestClient.post()
                .uri("/send")
                .bodyValue(Map.of("recipient", "Alice", "message", "Hello, Alice!"))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.message").isEqualTo("Message sent successfully")
                .jsonPath("$.data.recipient").isEqualTo("alice")
                .jsonPath("$.data.id").isNotEmpty()
                .jsonPath("$.data.timestamp").value((String ts) -> assertNotNull(Instant.parse(ts)));
    }

    @Test
    void send_missingRecipient_shouldReturn400() {
        webTestClient.post()
                .uri("/send")
                .bodyValue(Map.of("message", "Hello!"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Invalid recipient")
                .jsonPath("$.message").isEqualTo("Recipient is required and must be a string");

        assertEquals(0, store.stats().totalRecipients());
    }

    @Test
    void send_nonStringRecipient_shouldReturn400() {
        webTestClient.post()
                .uri("/send")
                .bodyValue(Map.of("recipient", 123, "message", "Hello!"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Invalid recipient");
    }

    @Test
    void send_emptyMessage_shouldReturn400() {
        webTestClient.post()
                .uri("/send")
                .bodyValue(Map.of("recipient", "alice", "message", ""))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Invalid message")
                .jsonPath("$.message").isEqualTo("Message is required and must be a string");

        assertEquals(0, store.stats().totalRecipients());
    }

    @Test
    void send_emptyBody_reportsMissingRecipient() {
        webTestClient.post()
                .uri("/send")
                .contentType(MediaType.APPLICATION_JSON)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Invalid recipient")
                .jsonPath("$.message").isEqualTo("Recipient is required and must be a string");
    }

    @Test
    void send_nonObjectBody_reportsMissingRecipient() {
        for (String body : List.of("[]", "\"alice\"", "42")) {
            webTestClient.post()
                    .uri("/send")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("Invalid recipient")
                    .jsonPath("$.message").isEqualTo("Recipient is required and must be a string");
        }
        assertEquals(0, store.stats().totalRecipients());
    }

    @Test
    void send_malformedJson_shouldReturn400() {
        webTestClient.post()
                .uri("/send")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"invalid\": json}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Invalid JSON");
    }

    // ── GET /recv ─────────────────────────────────────────────────────────────

    @Test
    void recv_shouldDrainInOrder() {
        send("bob", "First message");
        send("BOB", "Second message");
        send("Bob", "Third message");

        recv("bob")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.message").isEqualTo("Messages retrieved successfully")
                .jsonPath("$.data.recipient").isEqualTo("bob")
                .jsonPath("$.data.count").isEqualTo(3)
                .jsonPath("$.data.messages[0].content").isEqualTo("First message")
                .jsonPath("$.data.messages[1].content").isEqualTo("Second message")
                .jsonPath("$.data.messages[2].content").isEqualTo("Third message")
                .jsonPath("$.data.messages[0].id").isNotEmpty()
                .jsonPath("$.data.messages[0].recipient").doesNotExist();

        recv("bob")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.message").isEqualTo("No messages found for recipient")
                .jsonPath("$.data.count").isEqualTo(0)
                .jsonPath("$.data.messages").isEmpty();
    }

    @Test
    void recv_isCaseInsensitive() {
        send("eve", "Hello, Eve!");

        recv("EVE")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.recipient").isEqualTo("eve")
                .jsonPath("$.data.count").isEqualTo(1);
    }

    @Test
    void recv_keepsSpecialCharactersAndLongBodies() {
        String special = "Hello! 🎉 Special chars: @#$%^&*()_+-=[]{}|;:,.<>?";
        String longBody = "A".repeat(10_000);
        send("test", special);
        send("test", longBody);

        recv("test")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.messages[0].content").isEqualTo(special)
                .jsonPath("$.data.messages[1].content").isEqualTo(longBody);
    }

    @Test
    void recv_numericRecipient_isTreatedAsName() {
        recv("123")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.recipient").isEqualTo("123")
                .jsonPath("$.data.count").isEqualTo(0);
    }

    @Test
    void recv_missingRecipient_shouldReturn400() {
        webTestClient.get()
                .uri("/recv")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Invalid recipient")
                .jsonPath("$.message").isEqualTo("Recipient parameter is required");
    }

    @Test
    void recv_emptyRecipient_shouldReturn400() {
        recv("")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Recipient parameter is required");

        recv("   ")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Recipient parameter cannot be empty");
    }

    @Test
    void recv_concurrentDrains_deliverTheMessageOnce() {
        send("concurrent", "Test message");

        List<Integer> counts = Flux.range(0, 5)
                .flatMap(i -> webTestClient.get()
                        .uri(uri -> uri.path("/recv").queryParam("recipient", "concurrent").build())
                        .exchange()
                        .returnResult(Map.class)
                        .getResponseBody()
                        .map(body -> (Integer) ((Map<?, ?>) body.get("data")).get("count")))
                .collectList()
                .block();

        assertEquals(5, counts.size());
        assertEquals(1, counts.stream().mapToInt(Integer::intValue).sum());
    }

    @Test
    void send_concurrentRequests_areAllQueued() {
        Flux.range(0, 10)
                .flatMap(i -> webTestClient.post()
                        .uri("/send")
                        .bodyValue(Map.of("recipient", "concurrent", "message", "Message " + i))
                        .exchange()
                        .returnResult(Map.class)
                        .getResponseBody())
                .blockLast();

        recv("concurrent")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.count").isEqualTo(10);
    }

    // ── GET /health ───────────────────────────────────────────────────────────

    @Test
    void health_reportsDistinctRecipients() {
        webTestClient.get()
                .uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy")
                .jsonPath("$.message").isEqualTo("Message server is running")
                .jsonPath("$.endpoints[0]").isEqualTo("POST /send")
                .jsonPath("$.endpoints[1]").isEqualTo("GET /recv")
                .jsonPath("$.totalRecipients").isEqualTo(0);

        IntStream.range(0, 2).forEach(i -> send("alice", "Hello " + i));
        send("bob", "Hello");

        webTestClient.get()
                .uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.totalRecipients").isEqualTo(2);

        recv("alice").expectStatus().isOk();

        webTestClient.get()
                .uri("/health")
                .exchange()
                .expectBody()
                .jsonPath("$.totalRecipients").isEqualTo(1);
    }

    @Test
    void mailboxRoutes_needNoApiKey() {
        webTestClient.get()
                .uri("/health")
                .exchange()
                .expectStatus().isOk();
    }
}
