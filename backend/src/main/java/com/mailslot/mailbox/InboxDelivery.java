package com.mailslot.mailbox;

import java.util.List;

public record InboxDelivery(
        String recipient,
        List<DeliveredMessage> messages,
        int count
) {}
