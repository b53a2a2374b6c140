package com.mailslot.mailbox;

import java.time.Instant;

/**
 * A message accepted by the {@link MailboxStore}.
 *
 * recipient — the normalized key the message is filed under, not the name
 *             the sender typed.
 * timestamp — acceptance time, read back from the time-based id.
 */
public record Message(
        String id,
        String content,
        String recipient,
        Instant timestamp
) {}
