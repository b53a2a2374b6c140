package com.mailslot.mailbox;

import java.util.List;

/**
 * Result of draining one mailbox. {@code count} always equals {@code messages.size()}.
 */
public record Delivery(String recipient, List<Message> messages) {

    public Delivery {
        messages = List.copyOf(messages);
    }

    public int count() {
        return messages.size();
    }
}
