package com.mailslot.mailbox;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.JsonNode;

import reactor.core.publisher.Mono;

@RestController
public class MailboxController {

    private final MailboxService mailboxService;

    public MailboxController(MailboxService mailboxService) {
        this.mailboxService = mailboxService;
    }

    @PostMapping("/send")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ApiResponse<SendReceipt>> send(@RequestBody(required = false) JsonNode body) {
        return mailboxService.send(SendRequest.from(body))
                .map(receipt -> ApiResponse.ok("Message sent successfully", receipt));
    }

    /**
     * DRAIN: returns and removes everything queued for the recipient.
     */
    @GetMapping("/recv")
    public Mono<ApiResponse<InboxDelivery>> receive(@RequestParam(required = false) String recipient) {
        return mailboxService.receive(recipient)
                .map(inbox -> ApiResponse.ok(
                        inbox.count() == 0 ? "No messages found for recipient" : "Messages retrieved successfully",
                        inbox));
    }

    @GetMapping("/health")
    public Mono<HealthStatus> health() {
        return mailboxService.health();
    }
}
