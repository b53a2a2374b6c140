package com.mailslot.mailbox;

import java.time.Instant;

public record SendReceipt(
        String id,
        String recipient,   // normalized key, not the name as sent
        Instant timestamp
) {}
