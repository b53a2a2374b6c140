package com.mailslot.mailbox;

import java.time.Instant;

/**
 * One entry of a drained mailbox as returned to the client.
 * The recipient is reported once on the enclosing {@link InboxDelivery}.
 */
public record DeliveredMessage(
        String id,
        String content,
        Instant timestamp
) {}
